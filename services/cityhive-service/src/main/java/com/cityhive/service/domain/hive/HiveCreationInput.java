package com.cityhive.service.domain.hive;

import java.time.Instant;

/**
 * Hive creation request after sanitizing.
 *
 * <p>Coordinates stay untyped until validation: they may arrive as numbers, numeric strings or
 * anything else a JSON body can hold. Latitude and longitude must be both present or both absent.
 *
 * @param userId      owning user
 * @param name        trimmed name
 * @param latitude    raw latitude, nullable
 * @param longitude   raw longitude, nullable
 * @param frameType   trimmed frame type, null when empty
 * @param installedAt installation time, null means now
 */
public record HiveCreationInput(
        long userId,
        String name,
        Object latitude,
        Object longitude,
        String frameType,
        Instant installedAt) {
}
