package com.eldplanner.repository;

import com.eldplanner.config.PlannerProperties;
import com.eldplanner.model.TripRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Process-local trip storage; contents are lost on restart. The store is
 * bounded by {@code planner.trip-store-capacity}: once full, Caffeine's size
 * policy evicts trips to make room for new ones.
 */
@Repository
public class InMemoryTripRepository implements TripRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTripRepository.class);

    private final Cache<String, TripRecord> trips;

    @Autowired
    public InMemoryTripRepository(PlannerProperties properties) {
        this(properties.getTripStoreCapacity());
    }

    public InMemoryTripRepository(long capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        // maintenance on the caller thread so the bound holds once save returns
        this.trips = Caffeine.newBuilder()
            .maximumSize(capacity)
            .executor(Runnable::run)
            .removalListener((String id, TripRecord trip, RemovalCause cause) ->
                log.debug("Trip {} removed from store: {}", id, cause))
            .build();
    }

    @Override
    public TripRecord save(TripRecord trip) {
        trips.put(trip.id(), trip);
        trips.cleanUp();
        return trip;
    }

    @Override
    public Optional<TripRecord> findById(String id) {
        return Optional.ofNullable(trips.getIfPresent(id));
    }

    @Override
    public List<TripRecord> findRecent(int limit) {
        return trips.asMap().values().stream()
            .sorted(Comparator.comparing(TripRecord::createdAt).reversed()
                .thenComparing(TripRecord::id))
            .limit(Math.max(0, limit))
            .toList();
    }
}
