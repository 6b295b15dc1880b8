package com.example.PMS.Services;

import com.example.PMS.DTO.DashboardStatsDTO;
import com.example.PMS.DTO.StatusBucket;
import com.example.PMS.Entities.SpotStatus;
import com.example.PMS.Repositories.ParkingSpotRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Dashboard totals with a Redis cache.
 * <p>
 * Every write bumps {@code dashboard:stats:version}. A cached entry is stamped with the
 * version read before its aggregation started and is only served while that version is
 * still current, so a snapshot computed across a concurrent write is never reused.
 */
@Slf4j
@Service
public class DashboardService {

    static final String STATS_KEY = "dashboard:stats";
    static final String VERSION_KEY = "dashboard:stats:version";

    @Autowired
    private ParkingSpotRepository parkingSpotRepository;

    @Autowired
    private RedisTemplate<String, Object> redisTemplate;

    // 0 disables caching
    @Value("${pms.dashboard.cache-ttl-seconds:30}")
    private long cacheTtlSeconds;

    public DashboardStatsDTO getStats() {
        Long version = currentVersion();
        if (version != null) {
            DashboardStatsDTO cached = readCache(version);
            if (cached != null) {
                return cached;
            }
        }

        DashboardStatsDTO stats = computeStats(parkingSpotRepository.aggregateByStatus());
        if (version != null) {
            writeCache(version, stats);
        }
        return stats;
    }

    /**
     * Invalidates the cached stats. Called after every write to the spot collection.
     */
    public void evictStats() {
        try {
            redisTemplate.opsForValue().increment(VERSION_KEY);
            redisTemplate.delete(STATS_KEY);
        } catch (Exception e) {
            // Stale stats expire with the TTL
            log.warn("Redis is unavailable, could not invalidate {}: {}", STATS_KEY, e.getMessage());
        }
    }

    /**
     * Folds per-status buckets into dashboard totals. Statuses outside the four known values
     * still count toward the total and the revenue but have no named bucket.
     */
    DashboardStatsDTO computeStats(List<StatusBucket> buckets) {
        DashboardStatsDTO stats = new DashboardStatsDTO();

        for (StatusBucket bucket : buckets) {
            stats.setTotalSpots(stats.getTotalSpots() + bucket.getCount());
            stats.setTotalRevenue(stats.getTotalRevenue() + bucket.getRevenue());

            SpotStatus.fromValue(bucket.getStatus()).ifPresent(status -> {
                switch (status) {
                    case AVAILABLE -> stats.setAvailableSpots(bucket.getCount());
                    case OCCUPIED -> stats.setOccupiedSpots(bucket.getCount());
                    case RESERVED -> stats.setReservedSpots(bucket.getCount());
                    case MAINTENANCE -> stats.setMaintenanceSpots(bucket.getCount());
                }
            });
        }

        return stats;
    }

    // null when caching is off or Redis cannot be reached
    private Long currentVersion() {
        if (cacheTtlSeconds <= 0) {
            return null;
        }
        try {
            // INCRBY 0 reads the counter, creating it at 0 if absent
            return redisTemplate.opsForValue().increment(VERSION_KEY, 0L);
        } catch (Exception e) {
            log.warn("Redis is unavailable. Computing dashboard stats from MongoDB: {}", e.getMessage());
            return null;
        }
    }

    private DashboardStatsDTO readCache(long version) {
        try {
            Object value = redisTemplate.opsForValue().get(STATS_KEY);
            if (value instanceof CachedStats && ((CachedStats) value).getVersion() == version) {
                return ((CachedStats) value).getStats();
            }
        } catch (Exception e) {
            log.warn("Could not read cached dashboard stats: {}", e.getMessage());
        }
        return null;
    }

    private void writeCache(long version, DashboardStatsDTO stats) {
        try {
            redisTemplate.opsForValue().set(STATS_KEY, new CachedStats(version, stats),
                    Duration.ofSeconds(cacheTtlSeconds));
        } catch (Exception e) {
            log.warn("Redis is unavailable, dashboard stats not cached: {}", e.getMessage());
        }
    }

    @Getter
    @AllArgsConstructor
    static class CachedStats implements Serializable {
        private static final long serialVersionUID = 1L;

        private final long version;
        private final DashboardStatsDTO stats;
    }
}
