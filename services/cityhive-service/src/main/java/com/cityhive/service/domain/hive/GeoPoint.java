package com.cityhive.service.domain.hive;

/**
 * A WGS84 (SRID 4326) position in degrees.
 */
public record GeoPoint(double latitude, double longitude) {

    public static final int SRID = 4326;

    public GeoPoint {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }
}
