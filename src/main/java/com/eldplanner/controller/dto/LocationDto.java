package com.eldplanner.controller.dto;

import com.eldplanner.model.Coordinate;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * A waypoint as sent by API clients.
 */
public class LocationDto {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double lat;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double lon;

    private String address = "";

    public LocationDto() {
    }

    public LocationDto(Double lat, Double lon) {
        this.lat = lat;
        this.lon = lon;
    }

    public Coordinate toCoordinate() {
        return new Coordinate(lat, lon);
    }

    public Double getLat() { return lat; }
    public void setLat(Double lat) { this.lat = lat; }
    public Double getLon() { return lon; }
    public void setLon(Double lon) { this.lon = lon; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
}
