package com.cityhive.service.domain.user;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered beekeeper.
 *
 * @param id           store-assigned identifier, null before the first save
 * @param name         display name
 * @param email        normalized (lower-case) address, unique
 * @param apiKey       generated credential, unique
 * @param registeredAt registration time
 */
public record User(Long id, String name, String email, UUID apiKey, Instant registeredAt) {

    public User withId(long newId) {
        return new User(newId, name, email, apiKey, registeredAt);
    }
}
