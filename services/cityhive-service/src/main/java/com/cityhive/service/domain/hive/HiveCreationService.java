package com.cityhive.service.domain.hive;

import com.cityhive.observability.MetricFactory;
import com.cityhive.service.domain.creation.CreationErrorKind;
import com.cityhive.service.domain.creation.CreationResult;
import com.cityhive.service.domain.creation.CreationWorkflow;
import com.cityhive.service.domain.creation.EntityType;
import com.cityhive.service.domain.user.UserRepository;
import com.cityhive.validation.FieldValidator;
import com.cityhive.validation.ValidationResult;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates hives. The owner is looked up before anything else, so a request for a missing user
 * reports NOT_FOUND even if its other fields are also invalid.
 */
public class HiveCreationService extends CreationWorkflow<HiveCreationInput, Hive> {

    private static final Logger log = LoggerFactory.getLogger(HiveCreationService.class);

    public static final String USER_NOT_FOUND = "User not found";
    public static final String CONFLICT = "Hive could not be created due to a data conflict";

    private final UserRepository users;
    private final HiveRepository hives;
    private final Clock clock;

    public HiveCreationService(UserRepository users, HiveRepository hives, Clock clock, MetricFactory metrics) {
        super(EntityType.HIVE, metrics);
        this.users = users;
        this.hives = hives;
        this.clock = clock;
    }

    @Override
    protected CreationResult<Hive> attempt(HiveCreationInput input) {
        if (users.findById(input.userId()).isEmpty()) {
            log.warn("Hive creation failed - user not found: userId={}", input.userId());
            return CreationResult.failure(CreationErrorKind.NOT_FOUND, USER_NOT_FOUND);
        }

        ValidationResult name = FieldValidator.validateRequired(input.name(), "Name");
        if (!name.valid()) {
            return invalid(name.errorMessage());
        }
        ValidationResult coordinates = FieldValidator.validateCoordinates(input.latitude(), input.longitude());
        if (!coordinates.valid()) {
            return invalid(coordinates.errorMessage());
        }

        GeoPoint location = input.latitude() == null
                ? null
                : new GeoPoint(
                        FieldValidator.toFiniteDouble(input.latitude()),
                        FieldValidator.toFiniteDouble(input.longitude()));
        Hive hive = new Hive(
                null,
                input.userId(),
                input.name(),
                location,
                input.frameType(),
                input.installedAt() != null ? input.installedAt() : clock.instant());

        CreationResult<Hive> result = persist(hive, hives::save);
        if (result.success()) {
            log.info("Hive created: hiveId={}, userId={}, hasLocation={}",
                    result.entity().id(), input.userId(), location != null);
        }
        return result;
    }

    @Override
    protected String conflictMessage() {
        return CONFLICT;
    }
}
