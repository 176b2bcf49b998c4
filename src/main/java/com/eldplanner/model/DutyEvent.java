package com.eldplanner.model;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A single contiguous interval of the duty timeline.
 *
 * Instances are immutable. The simulator creates events without offsets and
 * stamps the cumulative start/end offsets once the whole timeline is known,
 * via {@link #withOffsets(double, double)}.
 */
public final class DutyEvent {

    private final String activity;
    private final DutyStatus dutyStatus;
    private final LocalDateTime startTime;
    private final double durationHours;
    private final Double distanceMiles;
    private final Coordinate location;
    private final PlaceName place;
    private final String description;
    private final RestBreak restBreak;
    private final double startOffsetHours;
    private final double endOffsetHours;

    private DutyEvent(Builder builder) {
        this.activity = Objects.requireNonNull(builder.activity, "activity");
        this.dutyStatus = Objects.requireNonNull(builder.dutyStatus, "dutyStatus");
        this.startTime = Objects.requireNonNull(builder.startTime, "startTime");
        if (builder.durationHours < 0 || Double.isNaN(builder.durationHours)) {
            throw new IllegalArgumentException("durationHours must be >= 0: " + builder.durationHours);
        }
        if (builder.distanceMiles != null && builder.dutyStatus != DutyStatus.DRIVING) {
            throw new IllegalArgumentException("distance is only recorded for driving events");
        }
        this.durationHours = builder.durationHours;
        this.distanceMiles = builder.distanceMiles;
        this.location = builder.location;
        this.place = builder.place;
        this.description = builder.description == null ? "" : builder.description;
        this.restBreak = builder.restBreak;
        this.startOffsetHours = builder.startOffsetHours;
        this.endOffsetHours = builder.endOffsetHours;
    }

    public static Builder builder(String activity, DutyStatus dutyStatus) {
        return new Builder(activity, dutyStatus);
    }

    public String getActivity() { return activity; }
    public DutyStatus getDutyStatus() { return dutyStatus; }
    public LocalDateTime getStartTime() { return startTime; }
    public double getDurationHours() { return durationHours; }
    public Coordinate getLocation() { return location; }
    public String getDescription() { return description; }
    public double getStartOffsetHours() { return startOffsetHours; }
    public double getEndOffsetHours() { return endOffsetHours; }

    public OptionalDouble getDistanceMiles() {
        return distanceMiles == null ? OptionalDouble.empty() : OptionalDouble.of(distanceMiles);
    }

    public Optional<PlaceName> getPlace() {
        return Optional.ofNullable(place);
    }

    public Optional<RestBreak> getRestBreak() {
        return Optional.ofNullable(restBreak);
    }

    public LocalDateTime getEndTime() {
        return startTime.plusNanos(Math.round(durationHours * 3_600_000_000_000.0));
    }

    public boolean isRestBreakOf(RestBreakKind kind) {
        return restBreak != null && restBreak.kind() == kind;
    }

    public DutyEvent withOffsets(double startOffset, double endOffset) {
        return toBuilder().offsets(startOffset, endOffset).build();
    }

    public DutyEvent withRestBreak(RestBreak newRestBreak) {
        return toBuilder().restBreak(newRestBreak).build();
    }

    private Builder toBuilder() {
        Builder b = new Builder(activity, dutyStatus)
            .startTime(startTime)
            .durationHours(durationHours)
            .location(location)
            .place(place)
            .description(description)
            .restBreak(restBreak)
            .offsets(startOffsetHours, endOffsetHours);
        b.distanceMiles = distanceMiles;
        return b;
    }

    @Override
    public String toString() {
        return activity + "[" + dutyStatus.getCode() + ", " + startTime + ", " + durationHours + "h]";
    }

    public static final class Builder {
        private final String activity;
        private final DutyStatus dutyStatus;
        private LocalDateTime startTime;
        private double durationHours;
        private Double distanceMiles;
        private Coordinate location;
        private PlaceName place;
        private String description;
        private RestBreak restBreak;
        private double startOffsetHours;
        private double endOffsetHours;

        private Builder(String activity, DutyStatus dutyStatus) {
            this.activity = activity;
            this.dutyStatus = dutyStatus;
        }

        public Builder startTime(LocalDateTime startTime) { this.startTime = startTime; return this; }
        public Builder durationHours(double hours) { this.durationHours = hours; return this; }
        public Builder distanceMiles(double miles) { this.distanceMiles = miles; return this; }
        public Builder location(Coordinate location) { this.location = location; return this; }
        public Builder place(PlaceName place) { this.place = place; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder restBreak(RestBreak restBreak) { this.restBreak = restBreak; return this; }

        public Builder offsets(double start, double end) {
            this.startOffsetHours = start;
            this.endOffsetHours = end;
            return this;
        }

        public DutyEvent build() {
            return new DutyEvent(this);
        }
    }
}
