package com.eldplanner.unit;

import com.eldplanner.config.PlannerProperties;
import com.eldplanner.model.Coordinate;
import com.eldplanner.model.TripRecord;
import com.eldplanner.repository.InMemoryTripRepository;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class InMemoryTripRepositoryTest {

    private final InMemoryTripRepository repository = new InMemoryTripRepository(100);

    private static TripRecord trip(String id, LocalDateTime createdAt) {
        Coordinate here = Coordinate.of(40.0, -100.0);
        return new TripRecord(id, createdAt, here, here, here, 0.0, null, null, null);
    }

    @Test
    void test_save_and_find() {
        repository.save(trip("a", LocalDateTime.of(2024, 1, 1, 0, 0)));

        assertTrue(repository.findById("a").isPresent());
        assertTrue(repository.findById("b").isEmpty());
    }

    @Test
    void test_recent_newest_first_and_limited() {
        LocalDateTime base = LocalDateTime.of(2024, 1, 1, 0, 0);
        repository.save(trip("old", base));
        repository.save(trip("newest", base.plusHours(2)));
        repository.save(trip("middle", base.plusHours(1)));

        List<TripRecord> recent = repository.findRecent(2);

        assertEquals(List.of("newest", "middle"), recent.stream().map(TripRecord::id).toList());
    }

    @Test
    void test_store_stays_within_capacity() {
        InMemoryTripRepository bounded = new InMemoryTripRepository(10);
        LocalDateTime base = LocalDateTime.of(2024, 1, 1, 0, 0);

        for (int i = 0; i < 200; i++) {
            bounded.save(trip("trip-" + i, base.plusMinutes(i)));
        }

        assertTrue(bounded.findRecent(Integer.MAX_VALUE).size() <= 10);
        assertTrue(bounded.findById("trip-199").isPresent(), "latest trip must stay retrievable");
    }

    @Test
    void test_capacity_taken_from_properties() {
        PlannerProperties properties = new PlannerProperties();
        properties.setTripStoreCapacity(3);
        InMemoryTripRepository configured = new InMemoryTripRepository(properties);
        LocalDateTime base = LocalDateTime.of(2024, 1, 1, 0, 0);

        for (int i = 0; i < 20; i++) {
            configured.save(trip("trip-" + i, base.plusMinutes(i)));
        }

        assertTrue(configured.findRecent(Integer.MAX_VALUE).size() <= 3);
    }

    @Test
    void test_non_positive_capacity_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryTripRepository(0));
    }
}
