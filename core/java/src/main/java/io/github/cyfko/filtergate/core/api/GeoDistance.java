package io.github.cyfko.filtergate.core.api;

import java.util.Map;

/**
 * Coerced value of {@link GeoOperator#ST_DWITHIN}: a point and a radius in metres.
 *
 * @param lat            latitude in degrees, [-90, 90]
 * @param lon            longitude in degrees, [-180, 180]
 * @param distanceMeters radius in metres, not negative
 * @since 1.0.0
 */
public record GeoDistance(double lat, double lon, double distanceMeters) {

    public GeoDistance {
        if (lat < -90 || lat > 90) {
            throw new IllegalArgumentException("lat must be in [-90, 90], got: " + lat);
        }
        if (lon < -180 || lon > 180) {
            throw new IllegalArgumentException("lon must be in [-180, 180], got: " + lon);
        }
        if (distanceMeters < 0) {
            throw new IllegalArgumentException("distance must not be negative, got: " + distanceMeters);
        }
    }

    /**
     * Reads {@code {lat, lon, distance}} from a decoded JSON object.
     *
     * @param raw decoded object
     * @return the geo distance
     * @throws IllegalArgumentException if a key is missing or not numeric
     */
    public static GeoDistance fromMap(Map<?, ?> raw) {
        return new GeoDistance(number(raw, "lat"), number(raw, "lon"), number(raw, "distance"));
    }

    private static double number(Map<?, ?> raw, String key) {
        Object value = raw.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be a number, got: " + value);
    }
}
