package com.eldplanner.model;

import java.util.Objects;

/**
 * Rest-period metadata attached to a duty event.
 *
 * Split sleeper segments carry a segment id and, once the pair is complete,
 * the id of the other segment.
 */
public record RestBreak(
    RestBreakKind kind,
    String segmentId,
    String pairedSegmentId,
    boolean excludedFromOnDutyWindow
) {

    public RestBreak {
        Objects.requireNonNull(kind, "kind");
    }

    public static RestBreak fullRest() {
        return new RestBreak(RestBreakKind.FULL_REST, null, null, false);
    }

    public static RestBreak fullRestart() {
        return new RestBreak(RestBreakKind.FULL_RESTART, null, null, false);
    }

    public static RestBreak firstSegment(String segmentId) {
        return new RestBreak(RestBreakKind.SPLIT_SLEEPER_SEGMENT_1, segmentId, null, true);
    }

    public static RestBreak secondSegment(String segmentId, String pairedSegmentId) {
        return new RestBreak(RestBreakKind.SPLIT_SLEEPER_SEGMENT_2, segmentId, pairedSegmentId, false);
    }

    public RestBreak pairedWith(String otherSegmentId) {
        return new RestBreak(kind, segmentId, otherSegmentId, excludedFromOnDutyWindow);
    }
}
