package com.cityhive.service.domain.hive;

import java.time.Instant;

/**
 * A hive owned by a user.
 *
 * @param id          store-assigned identifier, null before the first save
 * @param userId      owning user
 * @param name        display name
 * @param location    optional position
 * @param frameType   optional frame type, e.g. "Langstroth"
 * @param installedAt installation time
 */
public record Hive(Long id, long userId, String name, GeoPoint location, String frameType, Instant installedAt) {

    public Hive withId(long newId) {
        return new Hive(newId, userId, name, location, frameType, installedAt);
    }
}
