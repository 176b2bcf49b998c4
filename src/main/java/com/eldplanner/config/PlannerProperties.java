package com.eldplanner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized settings of the planner, bound from the {@code planner.*} keys.
 */
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    /**
     * Upper bound for a single reverse-geocoding lookup.
     */
    private Duration resolverTimeout = Duration.ofSeconds(3);

    /**
     * Worker threads available to reverse-geocoding lookups.
     */
    private int resolverThreads = 4;

    /**
     * Cycle applied when a request does not name one.
     */
    private String defaultWeeklyMode = "70/8";

    /**
     * Average speed for straight-line leg duration estimates.
     */
    private double fallbackSpeedMph = 55.0;

    /**
     * Maximum number of trips returned by the trip listing.
     */
    private int tripListLimit = 20;

    /**
     * Trips kept in memory before older entries are evicted.
     */
    private long tripStoreCapacity = 500;

    /**
     * Sleeper-berth split. Accepted for compatibility but not used: the
     * simulator always splits 7 + 3.
     */
    private String splitSleeperOption = "7/3";

    public Duration getResolverTimeout() { return resolverTimeout; }
    public void setResolverTimeout(Duration resolverTimeout) { this.resolverTimeout = resolverTimeout; }
    public int getResolverThreads() { return resolverThreads; }
    public void setResolverThreads(int resolverThreads) { this.resolverThreads = resolverThreads; }
    public String getDefaultWeeklyMode() { return defaultWeeklyMode; }
    public void setDefaultWeeklyMode(String defaultWeeklyMode) { this.defaultWeeklyMode = defaultWeeklyMode; }
    public double getFallbackSpeedMph() { return fallbackSpeedMph; }
    public void setFallbackSpeedMph(double fallbackSpeedMph) { this.fallbackSpeedMph = fallbackSpeedMph; }
    public int getTripListLimit() { return tripListLimit; }
    public void setTripListLimit(int tripListLimit) { this.tripListLimit = tripListLimit; }
    public long getTripStoreCapacity() { return tripStoreCapacity; }
    public void setTripStoreCapacity(long tripStoreCapacity) { this.tripStoreCapacity = tripStoreCapacity; }
    public String getSplitSleeperOption() { return splitSleeperOption; }
    public void setSplitSleeperOption(String splitSleeperOption) { this.splitSleeperOption = splitSleeperOption; }
}
