package com.cityhive.service.api;

import com.cityhive.service.domain.creation.EntityType;
import com.cityhive.service.domain.user.User;
import com.cityhive.service.domain.user.UserCreationService;
import com.cityhive.service.domain.user.UserQueryService;
import com.cityhive.service.domain.user.UserRegistrationInput;
import com.cityhive.validation.InputSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * User registration and lookup.
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    static final String USER_NOT_FOUND = "User not found";

    private final UserCreationService creation;
    private final UserQueryService queries;

    public UserController(UserCreationService creation, UserQueryService queries) {
        this.creation = creation;
        this.queries = queries;
    }

    /**
     * Registers a user. 201 on success, 400 for invalid input, 409 for a duplicate address.
     */
    @PostMapping
    public ResponseEntity<Object> register(@Valid @RequestBody RegistrationRequest request) {
        var input = new UserRegistrationInput(
                InputSanitizer.sanitizeString(request.name()),
                InputSanitizer.sanitizeEmail(request.email()));
        return CreationResponses.toResponse(
                EntityType.USER, creation.create(input), user -> new UserEnvelope(true, UserBody.of(user)));
    }

    @GetMapping
    public ResponseEntity<Object> findByEmail(@RequestParam("email") String email) {
        return queries.findByEmail(email)
                .<ResponseEntity<Object>>map(user -> ResponseEntity.ok(new UserEnvelope(true, UserBody.of(user))))
                .orElseGet(() -> CreationResponses.notFound(USER_NOT_FOUND));
    }

    public record RegistrationRequest(
            @Size(max = 100) String name,
            @Size(max = 254) String email) {
    }

    public record UserBody(long id, String name, String email, UUID apiKey, Instant registeredAt) {

        static UserBody of(User user) {
            return new UserBody(user.id(), user.name(), user.email(), user.apiKey(), user.registeredAt());
        }
    }

    public record UserEnvelope(boolean success, UserBody user) {
    }
}
