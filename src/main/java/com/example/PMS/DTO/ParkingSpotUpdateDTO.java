package com.example.PMS.DTO;

import com.example.PMS.Entities.SpotStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Sparse update of spot metadata. A null field is left untouched.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ParkingSpotUpdateDTO {
    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String spotNumber;

    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String spotType;

    @PositiveOrZero
    private Double hourlyRate;

    @Pattern(regexp = SpotStatus.PATTERN, message = "must be one of available, occupied, reserved, maintenance")
    private String status;
}
