package com.eldplanner.controller.dto;

public record ErrorResponse(String error, Object details) {
}
