package com.example.PMS.Controller;

import com.example.PMS.DTO.CheckInRequestDTO;
import com.example.PMS.DTO.MessageResponse;
import com.example.PMS.DTO.ParkingSpotCreateDTO;
import com.example.PMS.DTO.ParkingSpotUpdateDTO;
import com.example.PMS.DTO.SpotSearchCriteria;
import com.example.PMS.Entities.ParkingSpot;
import com.example.PMS.Services.ParkingSpotService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/spots")
public class ParkingSpotController {

    @Autowired
    private ParkingSpotService parkingSpotService;

    // --- Spot CRUD ---
    @GetMapping
    public ResponseEntity<List<ParkingSpot>> getAllSpots(
            @RequestParam(required = false) String status,
            @RequestParam(name = "spot_type", required = false) String spotType,
            @RequestParam(required = false) String search) {
        return ResponseEntity.ok(parkingSpotService.listSpots(new SpotSearchCriteria(status, spotType, search)));
    }

    @GetMapping("/{spotId}")
    public ResponseEntity<ParkingSpot> getSpot(@PathVariable String spotId) {
        return ResponseEntity.ok(parkingSpotService.getSpot(spotId));
    }

    @PostMapping
    public ResponseEntity<ParkingSpot> createSpot(@Valid @RequestBody ParkingSpotCreateDTO payload) {
        return ResponseEntity.ok(parkingSpotService.createSpot(payload));
    }

    @PutMapping("/{spotId}")
    public ResponseEntity<ParkingSpot> updateSpot(@PathVariable String spotId,
            @Valid @RequestBody ParkingSpotUpdateDTO payload) {
        return ResponseEntity.ok(parkingSpotService.updateSpot(spotId, payload));
    }

    @DeleteMapping("/{spotId}")
    public ResponseEntity<MessageResponse> deleteSpot(@PathVariable String spotId) {
        parkingSpotService.deleteSpot(spotId);
        return ResponseEntity.ok(new MessageResponse("Parking spot deleted successfully"));
    }

    // --- Occupancy ---
    @PostMapping("/{spotId}/checkin")
    public ResponseEntity<ParkingSpot> checkIn(@PathVariable String spotId,
            @Valid @RequestBody CheckInRequestDTO payload) {
        return ResponseEntity.ok(parkingSpotService.checkIn(spotId, payload));
    }

    @PostMapping("/{spotId}/checkout")
    public ResponseEntity<ParkingSpot> checkOut(@PathVariable String spotId) {
        return ResponseEntity.ok(parkingSpotService.checkOut(spotId));
    }
}
