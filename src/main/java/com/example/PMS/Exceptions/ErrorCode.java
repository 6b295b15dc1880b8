package com.example.PMS.Exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "Invalid request"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C002", "Internal server error"),

    // Parking spot
    SPOT_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "Parking spot not found"),
    DUPLICATE_SPOT_NUMBER(HttpStatus.BAD_REQUEST, "P002", "Spot number already exists"),
    SPOT_NOT_AVAILABLE(HttpStatus.BAD_REQUEST, "P003", "Parking spot is not available"),
    SPOT_NOT_OCCUPIED(HttpStatus.BAD_REQUEST, "P004", "Parking spot is not occupied");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
