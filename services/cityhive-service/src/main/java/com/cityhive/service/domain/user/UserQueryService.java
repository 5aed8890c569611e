package com.cityhive.service.domain.user;

import com.cityhive.validation.InputSanitizer;
import java.util.Optional;

/** Read-side lookups for users. */
public class UserQueryService {

    private final UserRepository users;

    public UserQueryService(UserRepository users) {
        this.users = users;
    }

    public Optional<User> findById(long id) {
        return users.findById(id);
    }

    /** Looks up by address, normalized the same way registration normalizes it. */
    public Optional<User> findByEmail(String email) {
        String normalized = InputSanitizer.sanitizeEmail(email);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return users.findByEmail(normalized);
    }
}
