package com.example.PMS;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ParkingManagementApplication {

    public static void main(String[] args) {
        // entry/exit/created timestamps are stored as UTC
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(ParkingManagementApplication.class, args);
    }
}
