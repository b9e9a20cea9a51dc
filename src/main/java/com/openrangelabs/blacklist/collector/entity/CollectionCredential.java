package com.openrangelabs.blacklist.collector.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Stored login for a source portal. Username and password are encrypted when
 * {@code encrypted} is set. This service only reads these rows.
 */
@Table("collection_credentials")
public class CollectionCredential {

    @Id
    private Long id;

    @Column("service_name")
    private String serviceName;

    private String username;

    private String password;

    @Column("base_url")
    private String baseUrl;

    @Column("is_active")
    private Boolean isActive = true;

    private Boolean encrypted = true;

    @Column("last_rotated_at")
    private LocalDateTime lastRotatedAt;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column("updated_at")
    private LocalDateTime updatedAt;

    // Constructors
    public CollectionCredential() {}

    public CollectionCredential(String serviceName, String username, String password) {
        this.serviceName = serviceName;
        this.username = username;
        this.password = password;
    }

    public boolean isUsable() {
        return Boolean.TRUE.equals(isActive);
    }

    public boolean isStoredEncrypted() {
        return Boolean.TRUE.equals(encrypted);
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public Boolean getIsActive() { return isActive; }
    public void setIsActive(Boolean isActive) { this.isActive = isActive; }

    public Boolean getEncrypted() { return encrypted; }
    public void setEncrypted(Boolean encrypted) { this.encrypted = encrypted; }

    public LocalDateTime getLastRotatedAt() { return lastRotatedAt; }
    public void setLastRotatedAt(LocalDateTime lastRotatedAt) { this.lastRotatedAt = lastRotatedAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "CollectionCredential{" +
                "id=" + id +
                ", serviceName='" + serviceName + '\'' +
                ", isActive=" + isActive +
                ", encrypted=" + encrypted +
                ", lastRotatedAt=" + lastRotatedAt +
                '}';
    }
}
