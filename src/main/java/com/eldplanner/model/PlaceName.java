package com.eldplanner.model;

/**
 * City and region of a resolved location.
 *
 * Resolvers return a free-form, comma separated address. Only the last two
 * tokens are used; anything shorter degrades to {@link #UNKNOWN}.
 */
public record PlaceName(String city, String region) {

    public static final String UNKNOWN_TOKEN = "Unknown";
    public static final PlaceName UNKNOWN = new PlaceName(UNKNOWN_TOKEN, UNKNOWN_TOKEN);

    public static PlaceName parse(String formatted) {
        if (formatted == null || formatted.isBlank()) {
            return UNKNOWN;
        }
        String[] parts = formatted.split(",");
        if (parts.length < 2) {
            return UNKNOWN;
        }
        String city = parts[parts.length - 2].trim();
        String region = parts[parts.length - 1].trim();
        return new PlaceName(
            city.isEmpty() ? UNKNOWN_TOKEN : city,
            region.isEmpty() ? UNKNOWN_TOKEN : region);
    }

    public boolean isKnown() {
        return !UNKNOWN_TOKEN.equals(city) || !UNKNOWN_TOKEN.equals(region);
    }

    @Override
    public String toString() {
        return city + ", " + region;
    }
}
