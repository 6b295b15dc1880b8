package com.example.PMS.DTO;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.io.Serializable;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DashboardStatsDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private long totalSpots;
    private long availableSpots;
    private long occupiedSpots;
    private long reservedSpots;
    private long maintenanceSpots;
    private double totalRevenue; // sum of hourly_rate over occupied spots, not time-weighted
}
