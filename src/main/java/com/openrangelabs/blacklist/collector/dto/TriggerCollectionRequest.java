package com.openrangelabs.blacklist.collector.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Request DTO for a manual collection trigger.
 * Both dates must be given together; an absent body means the default backfill range.
 */
@Schema(description = "Optional date range for a manual collection run")
public class TriggerCollectionRequest {

    @JsonProperty("start_date")
    @Schema(description = "First day of the range (inclusive)", example = "2025-01-01")
    private LocalDate startDate;

    @JsonProperty("end_date")
    @Schema(description = "Last day of the range (inclusive)", example = "2025-01-31")
    private LocalDate endDate;

    // Constructors
    public TriggerCollectionRequest() {}

    public TriggerCollectionRequest(LocalDate startDate, LocalDate endDate) {
        this.startDate = startDate;
        this.endDate = endDate;
    }

    // Validation
    @AssertTrue(message = "start_date and end_date must be given together")
    @JsonIgnore
    @Schema(hidden = true)
    public boolean isComplete() {
        return (startDate == null) == (endDate == null);
    }

    @AssertTrue(message = "start_date must not be after end_date")
    @JsonIgnore
    @Schema(hidden = true)
    public boolean isOrdered() {
        return startDate == null || endDate == null || !startDate.isAfter(endDate);
    }

    @JsonIgnore
    public Optional<DateWindow> toWindow() {
        if (startDate == null || endDate == null) {
            return Optional.empty();
        }
        return Optional.of(new DateWindow(startDate, endDate));
    }

    // Getters and Setters
    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }

    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }

    @Override
    public String toString() {
        return "TriggerCollectionRequest{" +
                "startDate=" + startDate +
                ", endDate=" + endDate +
                '}';
    }
}
