package com.openrangelabs.blacklist.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openrangelabs.blacklist.collector.model.TriggerResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Outcome of a manual trigger request.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a manual collection trigger")
public class TriggerCollectionResponse {

    @Schema(description = "Source name", example = "REGTECH")
    String source;

    @Schema(description = "Trigger result", example = "ACCEPTED")
    TriggerResult result;

    @Schema(description = "Requested range start, absent for the default backfill range")
    LocalDate startDate;

    @Schema(description = "Requested range end, absent for the default backfill range")
    LocalDate endDate;

    @Schema(description = "Human readable explanation", example = "Collection run started")
    String message;
}
