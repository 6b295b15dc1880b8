package com.example.PMS.Repositories;

import com.example.PMS.Entities.ParkingSpot;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ParkingSpotRepository extends MongoRepository<ParkingSpot, String>, ParkingSpotRepositoryCustom {
    // Backed by spot_number_idx
    boolean existsBySpotNumber(String spotNumber);
}
