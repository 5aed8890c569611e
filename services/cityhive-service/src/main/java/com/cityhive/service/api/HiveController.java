package com.cityhive.service.api;

import com.cityhive.service.domain.creation.EntityType;
import com.cityhive.service.domain.hive.GeoPoint;
import com.cityhive.service.domain.hive.Hive;
import com.cityhive.service.domain.hive.HiveCreationInput;
import com.cityhive.service.domain.hive.HiveCreationService;
import com.cityhive.service.domain.hive.HiveQueryService;
import com.cityhive.service.domain.user.UserQueryService;
import com.cityhive.validation.InputSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hive creation and lookup.
 */
@RestController
public class HiveController {

    static final String HIVE_NOT_FOUND = "Hive not found";

    private final HiveCreationService creation;
    private final HiveQueryService hives;
    private final UserQueryService users;

    public HiveController(HiveCreationService creation, HiveQueryService hives, UserQueryService users) {
        this.creation = creation;
        this.hives = hives;
        this.users = users;
    }

    /**
     * Creates a hive. 201 on success, 400 for invalid input, 404 when the owner does not exist.
     */
    @PostMapping("/api/hives")
    public ResponseEntity<Object> create(@Valid @RequestBody CreationRequest request) {
        var input = new HiveCreationInput(
                request.userId(),
                InputSanitizer.sanitizeString(request.name()),
                request.latitude(),
                request.longitude(),
                InputSanitizer.emptyToNull(request.frameType()),
                request.installedAt());
        return CreationResponses.toResponse(
                EntityType.HIVE, creation.create(input), hive -> new HiveEnvelope(true, HiveBody.of(hive)));
    }

    @GetMapping("/api/hives/{id}")
    public ResponseEntity<Object> findById(@PathVariable("id") long id) {
        return hives.findById(id)
                .<ResponseEntity<Object>>map(hive -> ResponseEntity.ok(new HiveEnvelope(true, HiveBody.of(hive))))
                .orElseGet(() -> CreationResponses.notFound(HIVE_NOT_FOUND));
    }

    @GetMapping("/api/users/{userId}/hives")
    public ResponseEntity<Object> findByUser(@PathVariable("userId") long userId) {
        if (users.findById(userId).isEmpty()) {
            return CreationResponses.notFound(UserController.USER_NOT_FOUND);
        }
        List<HiveBody> body = hives.findByUserId(userId).stream().map(HiveBody::of).toList();
        return ResponseEntity.ok(new HiveListEnvelope(true, body));
    }

    /**
     * Coordinates are untyped so that non-numeric values reach validation instead of failing
     * JSON binding.
     */
    public record CreationRequest(
            @NotNull @Positive Long userId,
            @Size(max = 100) String name,
            Object latitude,
            Object longitude,
            @Size(max = 50) String frameType,
            Instant installedAt) {
    }

    public record Location(double latitude, double longitude) {
    }

    public record HiveBody(long id, long userId, String name, String frameType, Instant installedAt, Location location) {

        static HiveBody of(Hive hive) {
            GeoPoint point = hive.location();
            return new HiveBody(
                    hive.id(),
                    hive.userId(),
                    hive.name(),
                    hive.frameType(),
                    hive.installedAt(),
                    point == null ? null : new Location(point.latitude(), point.longitude()));
        }
    }

    public record HiveEnvelope(boolean success, HiveBody hive) {
    }

    public record HiveListEnvelope(boolean success, List<HiveBody> hives) {
    }
}
