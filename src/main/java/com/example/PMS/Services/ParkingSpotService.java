package com.example.PMS.Services;

import com.example.PMS.DTO.CheckInRequestDTO;
import com.example.PMS.DTO.ParkingSpotCreateDTO;
import com.example.PMS.DTO.ParkingSpotUpdateDTO;
import com.example.PMS.DTO.SpotSearchCriteria;
import com.example.PMS.Entities.ParkingSpot;
import com.example.PMS.Entities.SpotStatus;
import com.example.PMS.Exceptions.BusinessException;
import com.example.PMS.Exceptions.ErrorCode;
import com.example.PMS.Repositories.ParkingSpotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Spot CRUD plus the occupancy state machine.
 * <p>
 * Only two transitions exist: available -> occupied (check-in) and occupied -> available
 * (check-out). Both are conditional updates on the current status, so a concurrent
 * second check-in on the same spot fails instead of overwriting the first.
 * reserved and maintenance are only reachable through {@link #updateSpot}.
 */
@Slf4j
@Service
public class ParkingSpotService {

    @Autowired
    private ParkingSpotRepository parkingSpotRepository;

    @Autowired
    private DashboardService dashboardService;

    public List<ParkingSpot> listSpots(SpotSearchCriteria criteria) {
        return parkingSpotRepository.search(criteria);
    }

    public ParkingSpot getSpot(String spotId) {
        return parkingSpotRepository.findById(spotId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SPOT_NOT_FOUND));
    }

    public ParkingSpot createSpot(ParkingSpotCreateDTO request) {
        // Uniqueness is only checked here, not on update
        if (parkingSpotRepository.existsBySpotNumber(request.getSpotNumber())) {
            throw new BusinessException(ErrorCode.DUPLICATE_SPOT_NUMBER);
        }

        ParkingSpot spot = new ParkingSpot();
        spot.setId(UUID.randomUUID().toString());
        spot.setSpotNumber(request.getSpotNumber());
        spot.setSpotType(request.getSpotType());
        if (request.getHourlyRate() != null) {
            spot.setHourlyRate(request.getHourlyRate());
        }
        if (request.getStatus() != null) {
            spot.setStatus(request.getStatus());
        }
        spot.setOccupied(SpotStatus.isOccupied(spot.getStatus()));
        spot.setCreatedAt(LocalDateTime.now());

        ParkingSpot saved = parkingSpotRepository.insert(spot);
        dashboardService.evictStats();
        log.info("Created spot {} ({}) with id {}", saved.getSpotNumber(), saved.getSpotType(), saved.getId());
        return saved;
    }

    public ParkingSpot updateSpot(String spotId, ParkingSpotUpdateDTO request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (request.getSpotNumber() != null) {
            fields.put("spotNumber", request.getSpotNumber());
        }
        if (request.getSpotType() != null) {
            fields.put("spotType", request.getSpotType());
        }
        if (request.getHourlyRate() != null) {
            fields.put("hourlyRate", request.getHourlyRate());
        }
        if (request.getStatus() != null) {
            // Occupancy fields are left alone; only the flag follows the status
            fields.put("status", request.getStatus());
            fields.put("occupied", SpotStatus.isOccupied(request.getStatus()));
        }

        if (fields.isEmpty()) {
            return getSpot(spotId);
        }

        ParkingSpot updated = parkingSpotRepository.updateFields(spotId, fields)
                .orElseThrow(() -> new BusinessException(ErrorCode.SPOT_NOT_FOUND));
        dashboardService.evictStats();
        log.info("Updated spot {}: {}", spotId, fields.keySet());
        return updated;
    }

    public void deleteSpot(String spotId) {
        if (!parkingSpotRepository.removeById(spotId)) {
            throw new BusinessException(ErrorCode.SPOT_NOT_FOUND);
        }
        dashboardService.evictStats();
        log.info("Deleted spot {}", spotId);
    }

    public ParkingSpot checkIn(String spotId, CheckInRequestDTO request) {
        Update update = new Update()
                .set("status", SpotStatus.OCCUPIED.getValue())
                .set("occupied", true)
                .set("vehicleLicense", request.getVehicleLicense())
                .set("driverName", request.getDriverName())
                .set("driverPhone", request.getDriverPhone())
                .set("entryTime", LocalDateTime.now())
                .set("exitTime", null);

        ParkingSpot spot = parkingSpotRepository.transition(spotId, SpotStatus.AVAILABLE.getValue(), update)
                .orElseThrow(() -> rejectTransition(spotId, ErrorCode.SPOT_NOT_AVAILABLE));
        dashboardService.evictStats();
        log.info("Checked in vehicle {} at spot {}", request.getVehicleLicense(), spotId);
        return spot;
    }

    public ParkingSpot checkOut(String spotId) {
        // entryTime is kept so the last stay can still be read off the record
        Update update = new Update()
                .set("status", SpotStatus.AVAILABLE.getValue())
                .set("occupied", false)
                .set("vehicleLicense", null)
                .set("driverName", null)
                .set("driverPhone", null)
                .set("exitTime", LocalDateTime.now());

        ParkingSpot spot = parkingSpotRepository.transition(spotId, SpotStatus.OCCUPIED.getValue(), update)
                .orElseThrow(() -> rejectTransition(spotId, ErrorCode.SPOT_NOT_OCCUPIED));
        dashboardService.evictStats();
        log.info("Checked out spot {}", spotId);
        return spot;
    }

    // The conditional update matched nothing: either the spot is gone or its status was wrong
    private BusinessException rejectTransition(String spotId, ErrorCode invalidState) {
        if (!parkingSpotRepository.existsById(spotId)) {
            return new BusinessException(ErrorCode.SPOT_NOT_FOUND);
        }
        log.warn("Rejected transition on spot {}: {}", spotId, invalidState.getMessage());
        return new BusinessException(invalidState);
    }
}
