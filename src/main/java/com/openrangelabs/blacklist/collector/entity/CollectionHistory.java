package com.openrangelabs.blacklist.collector.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.model.RunOutcome;
import com.openrangelabs.blacklist.collector.model.TriggerType;
import com.openrangelabs.blacklist.collector.model.UpsertResult;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One collection attempt for one source.
 * Written when the run starts and finalized exactly once when it ends.
 */
@Table("collection_history")
public class CollectionHistory {

    private static final int MAX_DETAIL_LENGTH = 2000;

    @Id
    private Long id;

    @Column("service_name")
    private String serviceName;

    @Column("trigger_type")
    private String triggerType;

    @Column("batch_identifier")
    private String batchIdentifier;

    @Column("window_start")
    private LocalDate windowStart;

    @Column("window_end")
    private LocalDate windowEnd;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("finished_at")
    private LocalDateTime finishedAt;

    private String outcome;

    @Column("items_fetched")
    private Integer itemsFetched = 0;

    @Column("items_new")
    private Integer itemsNew = 0;

    @Column("items_duplicate")
    private Integer itemsDuplicate = 0;

    @Column("items_rejected")
    private Integer itemsRejected = 0;

    @Column("error_kind")
    private String errorKind;

    @Column("error_detail")
    private String errorDetail;

    @Column("execution_time_ms")
    private Long executionTimeMs;

    // Constructors
    public CollectionHistory() {}

    public CollectionHistory(String serviceName, TriggerType triggerType, DateWindow window, String batchIdentifier) {
        this.serviceName = serviceName;
        this.triggerType = triggerType.name();
        this.windowStart = window.start();
        this.windowEnd = window.end();
        this.batchIdentifier = batchIdentifier;
    }

    // Business methods
    public void start(LocalDateTime now) {
        this.startedAt = now;
    }

    public void succeed(int fetched, UpsertResult result, int dropped, LocalDateTime now) {
        finish(RunOutcome.SUCCESS, now);
        this.itemsFetched = fetched;
        this.itemsNew = result.getInserted();
        this.itemsDuplicate = result.getExisting();
        this.itemsRejected = dropped + result.getRejected();
    }

    /**
     * Finalizes as success without fetching because the window was already ingested.
     */
    public void skipAlreadyProcessed(LocalDateTime now) {
        finish(RunOutcome.SUCCESS, now);
        this.itemsFetched = 0;
        this.itemsNew = 0;
        this.itemsDuplicate = 0;
        this.errorDetail = "Batch " + batchIdentifier + " already processed";
    }

    public void partial(UpsertResult achieved, int dropped, ErrorKind kind, String detail, LocalDateTime now) {
        finish(RunOutcome.PARTIAL, now);
        this.itemsFetched = achieved.getPersisted();
        this.itemsNew = achieved.getInserted();
        this.itemsDuplicate = achieved.getExisting();
        this.itemsRejected = dropped + achieved.getRejected();
        this.errorKind = kind.getCode();
        this.errorDetail = truncate(detail);
    }

    public void fail(ErrorKind kind, String detail, LocalDateTime now) {
        finish(RunOutcome.FAILURE, now);
        this.errorKind = kind.getCode();
        this.errorDetail = truncate(detail);
    }

    private static String truncate(String detail) {
        return detail != null && detail.length() > MAX_DETAIL_LENGTH ? detail.substring(0, MAX_DETAIL_LENGTH) : detail;
    }

    private void finish(RunOutcome runOutcome, LocalDateTime now) {
        if (isFinalized()) {
            throw new IllegalStateException("Collection run " + id + " is already finalized as " + outcome);
        }
        this.outcome = runOutcome.name();
        this.finishedAt = now;
        if (startedAt != null) {
            this.executionTimeMs = Duration.between(startedAt, now).toMillis();
        }
    }

    public boolean isFinalized() {
        return finishedAt != null;
    }

    @JsonIgnore
    public RunOutcome getRunOutcome() {
        return outcome != null ? RunOutcome.valueOf(outcome) : null;
    }

    @JsonIgnore
    public ErrorKind getErrorKindEnum() {
        return errorKind != null ? ErrorKind.fromCode(errorKind) : null;
    }

    public boolean isSuccessful() {
        return RunOutcome.SUCCESS.name().equals(outcome);
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }

    public String getTriggerType() { return triggerType; }
    public void setTriggerType(String triggerType) { this.triggerType = triggerType; }

    public String getBatchIdentifier() { return batchIdentifier; }
    public void setBatchIdentifier(String batchIdentifier) { this.batchIdentifier = batchIdentifier; }

    public LocalDate getWindowStart() { return windowStart; }
    public void setWindowStart(LocalDate windowStart) { this.windowStart = windowStart; }

    public LocalDate getWindowEnd() { return windowEnd; }
    public void setWindowEnd(LocalDate windowEnd) { this.windowEnd = windowEnd; }

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getFinishedAt() { return finishedAt; }
    public void setFinishedAt(LocalDateTime finishedAt) { this.finishedAt = finishedAt; }

    public String getOutcome() { return outcome; }
    public void setOutcome(String outcome) { this.outcome = outcome; }

    public Integer getItemsFetched() { return itemsFetched; }
    public void setItemsFetched(Integer itemsFetched) { this.itemsFetched = itemsFetched; }

    public Integer getItemsNew() { return itemsNew; }
    public void setItemsNew(Integer itemsNew) { this.itemsNew = itemsNew; }

    public Integer getItemsDuplicate() { return itemsDuplicate; }
    public void setItemsDuplicate(Integer itemsDuplicate) { this.itemsDuplicate = itemsDuplicate; }

    public Integer getItemsRejected() { return itemsRejected; }
    public void setItemsRejected(Integer itemsRejected) { this.itemsRejected = itemsRejected; }

    public String getErrorKind() { return errorKind; }
    public void setErrorKind(String errorKind) { this.errorKind = errorKind; }

    public String getErrorDetail() { return errorDetail; }
    public void setErrorDetail(String errorDetail) { this.errorDetail = errorDetail; }

    public Long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(Long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollectionHistory that = (CollectionHistory) o;
        return id != null && java.util.Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CollectionHistory{" +
                "id=" + id +
                ", serviceName='" + serviceName + '\'' +
                ", batchIdentifier='" + batchIdentifier + '\'' +
                ", outcome='" + outcome + '\'' +
                ", itemsFetched=" + itemsFetched +
                ", itemsNew=" + itemsNew +
                ", itemsDuplicate=" + itemsDuplicate +
                ", errorKind='" + errorKind + '\'' +
                ", executionTimeMs=" + executionTimeMs +
                '}';
    }
}
