package io.github.drompincen.postscheduler.gateway.controller;

import io.github.drompincen.postscheduler.persistence.document.ScheduleDocument;
import io.github.drompincen.postscheduler.persistence.repository.ScheduleStoreException;
import io.github.drompincen.postscheduler.protocol.api.CreateRecurringRequest;
import io.github.drompincen.postscheduler.protocol.api.CreateScheduleRequest;
import io.github.drompincen.postscheduler.protocol.api.EditScheduleRequest;
import io.github.drompincen.postscheduler.protocol.api.ScheduleDto;
import io.github.drompincen.postscheduler.runtime.schedule.ScheduleService;
import io.github.drompincen.postscheduler.runtime.schedule.ScheduleTimeParser;
import io.github.drompincen.postscheduler.runtime.schedule.ScheduleValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;
    private final ScheduleTimeParser timeParser;

    public ScheduleController(ScheduleService scheduleService, ScheduleTimeParser timeParser) {
        this.scheduleService = scheduleService;
        this.timeParser = timeParser;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateScheduleRequest req) {
        ScheduleDocument doc = scheduleService.create(req.destinationId(), req.content(), req.when());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(doc));
    }

    @PostMapping("/recurring")
    public ResponseEntity<?> createRecurring(@RequestBody CreateRecurringRequest req) {
        String cron = req.cronExpr() != null && !req.cronExpr().isBlank()
                ? req.cronExpr()
                : timeParser.toCron(req.time(), req.weekday());
        ScheduleDocument doc = scheduleService.createRecurring(req.destinationId(), req.content(), cron);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(doc));
    }

    @GetMapping
    public List<ScheduleDto> list() {
        return scheduleService.list().stream().map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduleDto> get(@PathVariable String id) {
        return scheduleService.get(id)
                .map(doc -> ResponseEntity.ok(toDto(doc)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> edit(@PathVariable String id, @RequestBody EditScheduleRequest req) {
        return scheduleService.edit(id, req.content(), req.when())
                .<ResponseEntity<?>>map(doc -> ResponseEntity.ok(toDto(doc)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return scheduleService.delete(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @ExceptionHandler(ScheduleValidationException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(ScheduleValidationException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ScheduleStoreException.class)
    public ResponseEntity<Map<String, String>> handleStoreFailure(ScheduleStoreException e) {
        log.error("Schedule store failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Schedule store unavailable: " + e.getMessage()));
    }

    private ScheduleDto toDto(ScheduleDocument doc) {
        return new ScheduleDto(
                doc.getId(),
                doc.getDestinationId(),
                doc.getContent(),
                doc.getKind(),
                doc.getFireAt(),
                doc.getCronExpr(),
                scheduleService.effectiveStatus(doc),
                scheduleService.nextFireTime(doc.getId()).orElse(null),
                doc.getLastFiredAt(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }
}
