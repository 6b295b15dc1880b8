package com.example.PMS.Entities;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum SpotStatus {
    AVAILABLE("available"),
    OCCUPIED("occupied"),
    RESERVED("reserved"),
    MAINTENANCE("maintenance");

    /** Regex accepted by request validation for a status field. */
    public static final String PATTERN = "available|occupied|reserved|maintenance";

    private final String value;

    public static Optional<SpotStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst();
    }

    public static boolean isOccupied(String status) {
        return OCCUPIED.value.equals(status);
    }
}
