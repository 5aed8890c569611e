package com.cityhive.service.api;

import com.cityhive.service.domain.creation.EntityType;
import com.cityhive.service.domain.hive.HiveQueryService;
import com.cityhive.service.domain.inspection.Inspection;
import com.cityhive.service.domain.inspection.InspectionCreationInput;
import com.cityhive.service.domain.inspection.InspectionCreationService;
import com.cityhive.service.domain.inspection.InspectionQueryService;
import com.cityhive.validation.InputSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inspection scheduling and lookup.
 */
@RestController
public class InspectionController {

    static final String INSPECTION_NOT_FOUND = "Inspection not found";

    private final InspectionCreationService creation;
    private final InspectionQueryService inspections;
    private final HiveQueryService hives;

    public InspectionController(
            InspectionCreationService creation, InspectionQueryService inspections, HiveQueryService hives) {
        this.creation = creation;
        this.inspections = inspections;
        this.hives = hives;
    }

    /**
     * Schedules an inspection. 201 on success with the inspection fields at the top level,
     * 404 when the hive does not exist, 400 otherwise.
     */
    @PostMapping("/api/inspections")
    public ResponseEntity<Object> create(@Valid @RequestBody CreationRequest request) {
        var input = new InspectionCreationInput(
                request.hiveId(), request.scheduledFor(), InputSanitizer.emptyToNull(request.notes()));
        return CreationResponses.toResponse(
                EntityType.INSPECTION, creation.create(input), CreatedBody::of);
    }

    @GetMapping("/api/inspections/{id}")
    public ResponseEntity<Object> findById(@PathVariable("id") long id) {
        return inspections.findById(id)
                .<ResponseEntity<Object>>map(inspection ->
                        ResponseEntity.ok(new InspectionEnvelope(true, InspectionBody.of(inspection))))
                .orElseGet(() -> CreationResponses.notFound(INSPECTION_NOT_FOUND));
    }

    @GetMapping("/api/hives/{hiveId}/inspections")
    public ResponseEntity<Object> findByHive(@PathVariable("hiveId") long hiveId) {
        if (hives.findById(hiveId).isEmpty()) {
            return CreationResponses.notFound(HiveController.HIVE_NOT_FOUND);
        }
        List<InspectionBody> body = inspections.findByHiveId(hiveId).stream().map(InspectionBody::of).toList();
        return ResponseEntity.ok(new InspectionListEnvelope(true, body));
    }

    public record CreationRequest(
            @NotNull @Positive Long hiveId,
            LocalDate scheduledFor,
            @Size(max = 1000) String notes) {
    }

    public record InspectionBody(long id, long hiveId, LocalDate scheduledFor, String notes, Instant createdAt) {

        static InspectionBody of(Inspection inspection) {
            return new InspectionBody(
                    inspection.id(),
                    inspection.hiveId(),
                    inspection.scheduledFor(),
                    inspection.notes(),
                    inspection.createdAt());
        }
    }

    public record CreatedBody(
            boolean success, long id, long hiveId, LocalDate scheduledFor, String notes, Instant createdAt) {

        static CreatedBody of(Inspection inspection) {
            return new CreatedBody(
                    true,
                    inspection.id(),
                    inspection.hiveId(),
                    inspection.scheduledFor(),
                    inspection.notes(),
                    inspection.createdAt());
        }
    }

    public record InspectionEnvelope(boolean success, InspectionBody inspection) {
    }

    public record InspectionListEnvelope(boolean success, List<InspectionBody> inspections) {
    }
}
