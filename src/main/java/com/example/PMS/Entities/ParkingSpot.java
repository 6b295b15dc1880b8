package com.example.PMS.Entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Document(collection = "parking_spots")
public class ParkingSpot {
    public static final double DEFAULT_HOURLY_RATE = 5.0;

    @Id
    private String id; // UUID string, doubles as the document key

    @Indexed(name = "spot_number_idx")
    @Field("spot_number")
    private String spotNumber;

    @Field("spot_type")
    private String spotType; // regular, handicap, vip, electric

    @Indexed(name = "status_idx")
    private String status = SpotStatus.AVAILABLE.getValue();

    // Always written together with status
    @JsonProperty("is_occupied")
    @Field("is_occupied")
    private boolean occupied;

    @Field("vehicle_license")
    private String vehicleLicense;
    @Field("driver_name")
    private String driverName;
    @Field("driver_phone")
    private String driverPhone;

    @Field("entry_time")
    private LocalDateTime entryTime;
    @Field("exit_time")
    private LocalDateTime exitTime;

    @Field("hourly_rate")
    private double hourlyRate = DEFAULT_HOURLY_RATE;

    @Field("reserved_by")
    private String reservedBy; // not driven by any transition yet

    @Field("created_at")
    private LocalDateTime createdAt;
}
