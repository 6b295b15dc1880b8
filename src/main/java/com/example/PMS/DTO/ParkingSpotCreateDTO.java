package com.example.PMS.DTO;

import com.example.PMS.Entities.SpotStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ParkingSpotCreateDTO {
    @NotBlank
    private String spotNumber;

    @NotBlank
    private String spotType;

    @PositiveOrZero
    private Double hourlyRate; // null means the default rate

    @Pattern(regexp = SpotStatus.PATTERN, message = "must be one of available, occupied, reserved, maintenance")
    private String status;
}
