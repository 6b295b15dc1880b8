package com.example.PMS.Repositories;

import com.example.PMS.DTO.SpotSearchCriteria;
import com.example.PMS.DTO.StatusBucket;
import com.example.PMS.Entities.ParkingSpot;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Queries on the parking_spots collection that derived query methods cannot express.
 */
public interface ParkingSpotRepositoryCustom {

    /**
     * Lists spots matching every non-blank filter in {@code criteria}, ordered by spot number ascending.
     */
    List<ParkingSpot> search(SpotSearchCriteria criteria);

    /**
     * Sets the given properties on the spot and returns the stored result,
     * or empty if no spot has that id. Keys are {@link ParkingSpot} property names.
     */
    Optional<ParkingSpot> updateFields(String id, Map<String, Object> fields);

    /**
     * Applies {@code update} only if the spot currently has {@code expectedStatus}, as one
     * atomic findAndModify. Empty when the spot is missing or in another status.
     */
    Optional<ParkingSpot> transition(String id, String expectedStatus, Update update);

    /** @return true if a spot was removed */
    boolean removeById(String id);

    /**
     * Groups all spots by status. Revenue per bucket is the sum of hourly rates of occupied spots.
     */
    List<StatusBucket> aggregateByStatus();
}
