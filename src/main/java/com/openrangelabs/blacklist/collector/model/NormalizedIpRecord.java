package com.openrangelabs.blacklist.collector.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * A single blacklisted address as produced by a source parser.
 *
 * <p>Identity is the natural key {@code (ipAddress, sourceName)}.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedIpRecord {

    String ipAddress;
    String sourceName;
    String country;
    LocalDate detectedAt;
    LocalDate expiresAt;
    @Singular("metadata")
    Map<String, String> rawMetadata;

    public String naturalKey() {
        return ipAddress + "|" + sourceName;
    }

    public String getReason() {
        return rawMetadata.get("reason");
    }
}
