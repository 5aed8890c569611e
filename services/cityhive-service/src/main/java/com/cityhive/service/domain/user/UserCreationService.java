package com.cityhive.service.domain.user;

import com.cityhive.observability.MetricFactory;
import com.cityhive.service.domain.creation.CreationErrorKind;
import com.cityhive.service.domain.creation.CreationResult;
import com.cityhive.service.domain.creation.CreationWorkflow;
import com.cityhive.service.domain.creation.EntityType;
import com.cityhive.validation.FieldValidator;
import com.cityhive.validation.ValidationResult;
import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers users.
 *
 * <p>Duplicate addresses are caught twice: by an {@code existsByEmail} pre-check, which gives the
 * common case a clear message without a failed insert, and by the store's unique index, which
 * catches registrations that race past the pre-check. Both report {@link CreationErrorKind#CONFLICT}
 * with the same message.
 */
public class UserCreationService extends CreationWorkflow<UserRegistrationInput, User> {

    private static final Logger log = LoggerFactory.getLogger(UserCreationService.class);

    public static final String DUPLICATE_EMAIL = "User with this email already exists";

    private final UserRepository users;
    private final Clock clock;
    private final Supplier<UUID> apiKeys;

    public UserCreationService(UserRepository users, Clock clock, MetricFactory metrics) {
        this(users, clock, metrics, UUID::randomUUID);
    }

    UserCreationService(UserRepository users, Clock clock, MetricFactory metrics, Supplier<UUID> apiKeys) {
        super(EntityType.USER, metrics);
        this.users = users;
        this.clock = clock;
        this.apiKeys = apiKeys;
    }

    @Override
    protected CreationResult<User> attempt(UserRegistrationInput input) {
        ValidationResult name = FieldValidator.validateRequired(input.name(), "Name");
        if (!name.valid()) {
            return invalid(name.errorMessage());
        }
        ValidationResult email = FieldValidator.validateEmail(input.email());
        if (!email.valid()) {
            return invalid(email.errorMessage());
        }

        if (users.existsByEmail(input.email())) {
            log.warn("Registration failed - user already exists: email={}", input.email());
            return CreationResult.failure(CreationErrorKind.CONFLICT, DUPLICATE_EMAIL);
        }

        User user = new User(null, input.name(), input.email(), apiKeys.get(), clock.instant());
        CreationResult<User> result = persist(user, users::save);
        if (result.success()) {
            log.info("User registered: userId={}", result.entity().id());
        }
        return result;
    }

    @Override
    protected String conflictMessage() {
        return DUPLICATE_EMAIL;
    }
}
