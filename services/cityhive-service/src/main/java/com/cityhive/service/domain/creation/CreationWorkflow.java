package com.cityhive.service.domain.creation;

import com.cityhive.observability.MetricFactory;
import java.util.Locale;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared shape of every creation service.
 *
 * <p>{@link #create} never throws. Subclasses implement {@link #attempt} as a short-circuiting
 * sequence (parent lookup, semantic checks, build, one {@link #persist} call) and return early
 * with {@link CreationResult#failure} on the first problem. Exceptions that escape the subclass
 * are classified here: store failures become {@link CreationErrorKind#DEPENDENCY_FAILURE},
 * anything else {@link CreationErrorKind#UNKNOWN}. Both are logged with the full exception and
 * reported with a generic message.
 *
 * <p>Every outcome increments {@code cityhive.creation.outcomes} tagged with the entity and the
 * outcome ({@code success} or the lower-case error kind).
 *
 * @param <I> creation input
 * @param <E> entity type
 */
public abstract class CreationWorkflow<I, E> {

    public static final String OUTCOME_COUNTER = "cityhive.creation.outcomes";
    public static final String INVALID_INPUT = "Invalid input data";
    public static final String INTERNAL_ERROR = "Internal server error";

    private final Logger log = LoggerFactory.getLogger(getClass());
    private final EntityType entityType;
    private final MetricFactory metrics;

    protected CreationWorkflow(EntityType entityType, MetricFactory metrics) {
        if (entityType == null || metrics == null) {
            throw new IllegalArgumentException("entityType and metrics must not be null");
        }
        this.entityType = entityType;
        this.metrics = metrics;
    }

    public final CreationResult<E> create(I input) {
        CreationResult<E> result;
        if (input == null) {
            result = CreationResult.failure(CreationErrorKind.INVALID_INPUT, INVALID_INPUT);
        } else {
            try {
                result = attempt(input);
            } catch (PersistenceException e) {
                log.error("Store failure during {} creation", entityType.tag(), e);
                result = CreationResult.failure(CreationErrorKind.DEPENDENCY_FAILURE, INTERNAL_ERROR);
            } catch (RuntimeException e) {
                log.error("Unexpected error during {} creation: errorType={}",
                        entityType.tag(), e.getClass().getSimpleName(), e);
                result = CreationResult.failure(CreationErrorKind.UNKNOWN, INTERNAL_ERROR);
            }
        }
        record(result);
        return result;
    }

    public EntityType entityType() {
        return entityType;
    }

    /**
     * Runs the entity-specific steps. May throw; {@link #create} classifies what escapes.
     */
    protected abstract CreationResult<E> attempt(I input);

    /** Caller-safe message for a constraint violation reported by the store. */
    protected abstract String conflictMessage();

    /**
     * Performs the single write. A constraint violation becomes {@link CreationErrorKind#CONFLICT};
     * other store failures propagate to {@link #create}.
     */
    protected final CreationResult<E> persist(E entity, UnaryOperator<E> save) {
        try {
            return CreationResult.success(save.apply(entity));
        } catch (IntegrityViolationException e) {
            log.warn("Store rejected {}: {}", entityType.tag(), e.getMessage());
            return CreationResult.failure(CreationErrorKind.CONFLICT, conflictMessage());
        }
    }

    /** Builds an INVALID_INPUT failure and logs it at WARN. */
    protected final CreationResult<E> invalid(String message) {
        log.warn("{} creation rejected: {}", entityType.tag(), message);
        return CreationResult.failure(CreationErrorKind.INVALID_INPUT, message);
    }

    private void record(CreationResult<E> result) {
        String outcome = result.success() ? "success" : result.errorKind().name().toLowerCase(Locale.ROOT);
        metrics.counter(OUTCOME_COUNTER, "Outcomes of entity creation requests",
                        "entity", entityType.tag(), "outcome", outcome)
                .increment();
    }
}
