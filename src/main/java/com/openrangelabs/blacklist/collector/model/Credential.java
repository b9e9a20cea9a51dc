package com.openrangelabs.blacklist.collector.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Decrypted login material for one source. Lives no longer than a collection run.
 */
@Value
@Builder
public class Credential {

    String sourceName;
    String username;
    @ToString.Exclude
    String secret;
    String baseUrl;
    boolean enabled;
    LocalDateTime lastRotatedAt;
}
