package com.eldplanner.controller.dto;

import com.eldplanner.routing.LegEstimate;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Routing figures for one leg, when the client already has them.
 */
public class LegDto {

    @NotNull(message = "Leg distance is required")
    @DecimalMin(value = "0.0", message = "Leg distance cannot be negative")
    private Double distanceMiles;

    @NotNull(message = "Leg duration is required")
    @DecimalMin(value = "0.0", message = "Leg duration cannot be negative")
    private Double durationHours;

    public LegEstimate toEstimate() {
        return new LegEstimate(distanceMiles, durationHours);
    }

    public Double getDistanceMiles() { return distanceMiles; }
    public void setDistanceMiles(Double distanceMiles) { this.distanceMiles = distanceMiles; }
    public Double getDurationHours() { return durationHours; }
    public void setDurationHours(Double durationHours) { this.durationHours = durationHours; }
}
