package com.openrangelabs.blacklist.collector.entity;

import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.model.SourceSettings;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Operator-managed scheduling configuration for a source.
 * Null columns fall back to the application defaults.
 */
@Table("collection_sources")
public class SourceConfig {

    @Id
    private Long id;

    @Column("source_name")
    private String sourceName;

    private Boolean enabled = true;

    @Column("interval_seconds")
    private Long intervalSeconds;

    @Column("max_backoff_seconds")
    private Long maxBackoffSeconds;

    @Column("scheduled_window_days")
    private Integer scheduledWindowDays;

    @Column("backfill_window_days")
    private Integer backfillWindowDays;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public SourceConfig() {}

    public SourceConfig(String sourceName, boolean enabled, Long intervalSeconds) {
        this.sourceName = sourceName;
        this.enabled = enabled;
        this.intervalSeconds = intervalSeconds;
    }

    // Business methods
    public SourceSettings toSettings(CollectorProperties.Defaults defaults) {
        return SourceSettings.builder()
                .sourceName(sourceName)
                .enabled(Boolean.TRUE.equals(enabled))
                .interval(intervalSeconds != null && intervalSeconds > 0
                        ? Duration.ofSeconds(intervalSeconds) : defaults.getInterval())
                .maxBackoff(maxBackoffSeconds != null && maxBackoffSeconds > 0
                        ? Duration.ofSeconds(maxBackoffSeconds) : defaults.getMaxBackoff())
                .scheduledWindowDays(scheduledWindowDays != null
                        ? scheduledWindowDays : defaults.getScheduledWindowDays())
                .backfillWindowDays(backfillWindowDays != null
                        ? backfillWindowDays : defaults.getBackfillWindowDays())
                .build();
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getSourceName() { return sourceName; }
    public void setSourceName(String sourceName) { this.sourceName = sourceName; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }

    public Long getIntervalSeconds() { return intervalSeconds; }
    public void setIntervalSeconds(Long intervalSeconds) { this.intervalSeconds = intervalSeconds; }

    public Long getMaxBackoffSeconds() { return maxBackoffSeconds; }
    public void setMaxBackoffSeconds(Long maxBackoffSeconds) { this.maxBackoffSeconds = maxBackoffSeconds; }

    public Integer getScheduledWindowDays() { return scheduledWindowDays; }
    public void setScheduledWindowDays(Integer scheduledWindowDays) { this.scheduledWindowDays = scheduledWindowDays; }

    public Integer getBackfillWindowDays() { return backfillWindowDays; }
    public void setBackfillWindowDays(Integer backfillWindowDays) { this.backfillWindowDays = backfillWindowDays; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
