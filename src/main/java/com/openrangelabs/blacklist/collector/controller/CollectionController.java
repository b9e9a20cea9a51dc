package com.openrangelabs.blacklist.collector.controller;

import com.openrangelabs.blacklist.collector.dto.TriggerCollectionRequest;
import com.openrangelabs.blacklist.collector.dto.TriggerCollectionResponse;
import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.SourceStatus;
import com.openrangelabs.blacklist.collector.model.TriggerResult;
import com.openrangelabs.blacklist.collector.service.CollectionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * REST controller for collection operations
 * Exposes source status, manual triggers and run history
 */
@Slf4j
@RestController
@RequestMapping("/api/collection")
@Tag(name = "Collection", description = "Threat intelligence collection control")
public class CollectionController {

    private final CollectionOrchestrator orchestrator;

    @Autowired
    public CollectionController(CollectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Scheduling status of every source
     *
     * @return one entry per source with phase, backoff state and rate limit status
     */
    @GetMapping("/status")
    @Operation(summary = "Status of all collection sources")
    public Mono<ResponseEntity<List<SourceStatus>>> getStatus() {
        return Mono.fromCallable(orchestrator::status)
                .map(ResponseEntity::ok);
    }

    /**
     * Trigger a manual collection run
     *
     * Without a body the source's default backfill range ending today is fetched.
     * The run executes in the background; this endpoint only reports whether it started.
     *
     * @param source the source name, case insensitive
     * @param request optional date range
     * @return 202 when started, 409 when a run is already in progress or the source is disabled
     */
    @PostMapping("/trigger/{source}")
    @Operation(summary = "Trigger a manual collection run")
    public Mono<ResponseEntity<TriggerCollectionResponse>> trigger(
            @Parameter(description = "Source name", example = "REGTECH") @PathVariable String source,
            @Valid @RequestBody(required = false) TriggerCollectionRequest request) {

        Optional<DateWindow> window = request != null ? request.toWindow() : Optional.empty();
        return orchestrator.trigger(source, window)
                .map(result -> ResponseEntity.status(statusFor(result))
                        .body(TriggerCollectionResponse.builder()
                                .source(source.toUpperCase(Locale.ROOT))
                                .result(result)
                                .startDate(window.map(DateWindow::start).orElse(null))
                                .endDate(window.map(DateWindow::end).orElse(null))
                                .message(messageFor(result))
                                .build()));
    }

    /**
     * Recent collection runs of a source, newest first
     *
     * @param source the source name, case insensitive
     * @param limit maximum number of runs to return (1 to 100)
     */
    @GetMapping("/history/{source}")
    @Operation(summary = "Recent collection runs of a source")
    public Mono<ResponseEntity<List<CollectionHistory>>> getHistory(
            @PathVariable String source,
            @RequestParam(defaultValue = "20") int limit) {

        return orchestrator.history(source, limit)
                .collectList()
                .map(ResponseEntity::ok);
    }

    private static HttpStatus statusFor(TriggerResult result) {
        return switch (result) {
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case ALREADY_RUNNING, DISABLED -> HttpStatus.CONFLICT;
        };
    }

    private static String messageFor(TriggerResult result) {
        return switch (result) {
            case ACCEPTED -> "Collection run started";
            case ALREADY_RUNNING -> "A collection run for this source is already in progress";
            case DISABLED -> "Source is disabled";
        };
    }
}
