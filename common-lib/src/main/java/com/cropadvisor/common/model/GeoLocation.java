package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GeoLocation(
    @JsonProperty("latitude")  double latitude,
    @JsonProperty("longitude") double longitude,
    @JsonProperty("name")      String name
) {
    public GeoLocation {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }

    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude, null);
    }
}
