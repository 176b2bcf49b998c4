package com.eldplanner.repository;

import com.eldplanner.model.TripRecord;

import java.util.List;
import java.util.Optional;

/**
 * Storage for planned trips.
 */
public interface TripRepository {

    TripRecord save(TripRecord trip);

    Optional<TripRecord> findById(String id);

    /**
     * Most recently created trips first.
     */
    List<TripRecord> findRecent(int limit);
}
