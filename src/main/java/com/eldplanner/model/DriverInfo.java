package com.eldplanner.model;

/**
 * Header fields printed on each daily log sheet.
 */
public record DriverInfo(String driverName, String carrierName, String mainOffice, String vehicleNumber) {
}
