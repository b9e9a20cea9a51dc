package com.openrangelabs.blacklist.collector.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Marker that an export window of a source has been fully stored.
 */
@Table("processed_reports")
public class ProcessedReport {

    @Id
    private Long id;

    private String source;

    @Column("report_id")
    private String reportId;

    @Column("record_count")
    private Integer recordCount;

    @Column("processed_at")
    private LocalDateTime processedAt;

    public ProcessedReport() {}

    public ProcessedReport(String source, String reportId, int recordCount, LocalDateTime processedAt) {
        this.source = source;
        this.reportId = reportId;
        this.recordCount = recordCount;
        this.processedAt = processedAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getReportId() { return reportId; }
    public void setReportId(String reportId) { this.reportId = reportId; }

    public Integer getRecordCount() { return recordCount; }
    public void setRecordCount(Integer recordCount) { this.recordCount = recordCount; }

    public LocalDateTime getProcessedAt() { return processedAt; }
    public void setProcessedAt(LocalDateTime processedAt) { this.processedAt = processedAt; }
}
