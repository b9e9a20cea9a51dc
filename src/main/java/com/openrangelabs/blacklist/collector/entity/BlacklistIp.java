package com.openrangelabs.blacklist.collector.entity;

import com.openrangelabs.blacklist.collector.model.NormalizedIpRecord;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Stored blacklist entry, unique per {@code (ip_address, source)}.
 * Entries are never deleted, only deactivated once their removal date passes.
 */
@Table("blacklist_ips")
public class BlacklistIp {

    @Id
    private Long id;

    @Column("ip_address")
    private String ipAddress;

    private String source;

    private String country;

    private String reason;

    @Column("detection_date")
    private LocalDate detectionDate;

    @Column("removal_date")
    private LocalDate removalDate;

    @Column("raw_data")
    private String rawData;

    @Column("is_active")
    private Boolean isActive = true;

    @Column("first_seen")
    private LocalDateTime firstSeen;

    @Column("last_seen")
    private LocalDateTime lastSeen;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    // Constructors
    public BlacklistIp() {}

    public BlacklistIp(String ipAddress, String source) {
        this.ipAddress = ipAddress;
        this.source = source;
    }

    // Business methods
    public static BlacklistIp fromRecord(NormalizedIpRecord record, String rawData, LocalDateTime now) {
        BlacklistIp entry = new BlacklistIp(record.getIpAddress(), record.getSourceName());
        entry.copyFrom(record, rawData);
        entry.setIsActive(!entry.isExpired(now.toLocalDate()));
        entry.setFirstSeen(now);
        entry.setLastSeen(now);
        entry.setUpdatedAt(now);
        return entry;
    }

    /**
     * Whether storing {@code record} would change the stored data. The active flag is
     * not compared, only the expiry sweep or a data change moves it.
     */
    public boolean differsFrom(NormalizedIpRecord record, String rawData) {
        return !Objects.equals(country, record.getCountry())
                || !Objects.equals(reason, record.getReason())
                || !Objects.equals(detectionDate, record.getDetectedAt())
                || !Objects.equals(removalDate, record.getExpiresAt())
                || !Objects.equals(this.rawData, rawData);
    }

    public void applyUpdate(NormalizedIpRecord record, String rawData, LocalDateTime now) {
        copyFrom(record, rawData);
        this.isActive = !isExpired(now.toLocalDate());
        this.lastSeen = now;
        this.updatedAt = now;
    }

    public boolean isExpired(LocalDate today) {
        return removalDate != null && removalDate.isBefore(today);
    }

    private void copyFrom(NormalizedIpRecord record, String rawData) {
        this.country = record.getCountry();
        this.reason = record.getReason();
        this.detectionDate = record.getDetectedAt();
        this.removalDate = record.getExpiresAt();
        this.rawData = rawData;
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getIpAddress() { return ipAddress; }
    public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public LocalDate getDetectionDate() { return detectionDate; }
    public void setDetectionDate(LocalDate detectionDate) { this.detectionDate = detectionDate; }

    public LocalDate getRemovalDate() { return removalDate; }
    public void setRemovalDate(LocalDate removalDate) { this.removalDate = removalDate; }

    public String getRawData() { return rawData; }
    public void setRawData(String rawData) { this.rawData = rawData; }

    public Boolean getIsActive() { return isActive; }
    public void setIsActive(Boolean isActive) { this.isActive = isActive; }

    public LocalDateTime getFirstSeen() { return firstSeen; }
    public void setFirstSeen(LocalDateTime firstSeen) { this.firstSeen = firstSeen; }

    public LocalDateTime getLastSeen() { return lastSeen; }
    public void setLastSeen(LocalDateTime lastSeen) { this.lastSeen = lastSeen; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlacklistIp that = (BlacklistIp) o;
        return Objects.equals(ipAddress, that.ipAddress) && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ipAddress, source);
    }

    @Override
    public String toString() {
        return "BlacklistIp{" +
                "ipAddress='" + ipAddress + '\'' +
                ", source='" + source + '\'' +
                ", country='" + country + '\'' +
                ", isActive=" + isActive +
                '}';
    }
}
