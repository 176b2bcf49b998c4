package com.eldplanner.concurrency;

import com.eldplanner.config.PlannerProperties;
import com.eldplanner.geo.NoOpLocationResolver;
import com.eldplanner.geo.TimeoutLocationResolver;
import com.eldplanner.model.Coordinate;
import com.eldplanner.model.DriverInfo;
import com.eldplanner.model.DutyEvent;
import com.eldplanner.model.TripOptions;
import com.eldplanner.model.TripRecord;
import com.eldplanner.model.TripRequest;
import com.eldplanner.repository.InMemoryTripRepository;
import com.eldplanner.routing.LegEstimate;
import com.eldplanner.routing.StraightLineRouteProvider;
import com.eldplanner.service.ComplianceChecker;
import com.eldplanner.service.DailyLogAggregator;
import com.eldplanner.service.DutyScheduleSimulator;
import com.eldplanner.service.HoursHistoryParser;
import com.eldplanner.service.RollingHoursTracker;
import com.eldplanner.service.RouteLegBuilder;
import com.eldplanner.service.TripPlanService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

@Tag("concurrency")
public class ConcurrentPlanningTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 6, 0);

    private TimeoutLocationResolver resolver;
    private InMemoryTripRepository repository;
    private TripPlanService service;

    @BeforeEach
    void setUp() {
        resolver = new TimeoutLocationResolver(new NoOpLocationResolver(), Duration.ofSeconds(2), 4);
        repository = new InMemoryTripRepository(1000);
        PlannerProperties properties = new PlannerProperties();
        properties.setTripListLimit(100);
        service = new TripPlanService(new StraightLineRouteProvider(55), new RouteLegBuilder(),
            new DutyScheduleSimulator(resolver), new DailyLogAggregator(), new ComplianceChecker(),
            new RollingHoursTracker(), new HoursHistoryParser(), repository, properties,
            Clock.systemDefaultZone());
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    private static TripRequest request(double leg2Miles, TripOptions options) {
        return new TripRequest(
            Coordinate.of(41.8781, -87.6298), Coordinate.of(39.7684, -86.1581), Coordinate.of(36.1627, -86.7816),
            new LegEstimate(400, 6.67), new LegEstimate(leg2Miles, leg2Miles / 60.0),
            options, List.of(), new DriverInfo("Driver", "Carrier", "Office", "TRUCK-1"), START);
    }

    @Test
    void test_concurrent_plans_are_independent() throws Exception {
        List<DutyEvent> expected = service.planTrip(request(600, TripOptions.standard(0)))
            .tripPlan().getSchedule();

        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<TripRecord>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threadCount; i++) {
                // odd threads plan a split-sleeper trip alongside the standard ones
                TripOptions options = i % 2 == 0
                    ? TripOptions.standard(0)
                    : TripOptions.standard(0).withSplitSleeper(true);
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    return service.planTrip(request(600, options));
                }));
            }
            startLatch.countDown();

            for (int i = 0; i < threadCount; i++) {
                TripRecord record = futures.get(i).get(30, TimeUnit.SECONDS);
                List<DutyEvent> schedule = record.tripPlan().getSchedule();
                if (i % 2 == 0) {
                    assertEquals(expected.size(), schedule.size());
                    for (int j = 0; j < schedule.size(); j++) {
                        assertEquals(expected.get(j).getActivity(), schedule.get(j).getActivity());
                        assertEquals(expected.get(j).getDurationHours(), schedule.get(j).getDurationHours(), 1e-9);
                    }
                } else {
                    assertTrue(schedule.stream().anyMatch(e -> e.getActivity().startsWith("Sleeper Berth")));
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void test_concurrent_saves_all_kept() throws Exception {
        int threadCount = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        List<Exception> errors = Collections.synchronizedList(new ArrayList<>());
        Set<String> ids = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threadCount; i++) {
            final double miles = 100 + i * 10;
            new Thread(() -> {
                try {
                    startLatch.await();
                    ids.add(service.planTrip(request(miles, TripOptions.standard(0))).id());
                } catch (Exception e) {
                    errors.add(e);
                } finally {
                    doneLatch.countDown();
                }
            }).start();
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));

        assertTrue(errors.isEmpty(), "Concurrent planning should not fail: " + errors);
        assertEquals(threadCount, ids.size());
        assertEquals(threadCount, service.listTrips().size());
        for (String id : ids) {
            assertTrue(repository.findById(id).isPresent());
        }
    }

    @Test
    void test_concurrent_rolling_hours() throws Exception {
        List<Map<String, Object>> history = List.of(
            Map.of("date", "2024-01-01", "hours", 9),
            Map.of("date", "2024-01-02", "hours", 11));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Double>> tasks = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                tasks.add(() -> service.rollingHours(history, service.defaultWeeklyMode()).hoursUsed());
            }
            for (Future<Double> used : executor.invokeAll(tasks)) {
                assertEquals(20.0, used.get(), 1e-9);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
