package com.openrangelabs.blacklist.collector.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one source scheduler.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Scheduling status of a collection source")
public class SourceStatus {

    @Schema(description = "Source name", example = "REGTECH")
    String sourceName;

    boolean enabled;

    boolean running;

    @Schema(description = "Scheduling phase", example = "IDLE")
    SchedulePhase phase;

    @Schema(description = "Outcome of the last finished run", example = "SUCCESS")
    RunOutcome lastOutcome;

    @Schema(description = "Error kind of the last failed run", example = "credential_rejected")
    String lastErrorKind;

    Instant lastRunAt;

    Instant nextRunAt;

    int consecutiveFailures;

    @Schema(description = "Set when the last failure cannot be fixed by retrying")
    boolean attentionRequired;

    long intervalSeconds;

    RateLimitStatus rateLimit;
}
