package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.entity.CollectionCredential;
import com.openrangelabs.blacklist.collector.exception.CollectionException;
import com.openrangelabs.blacklist.collector.exception.CredentialDisabledException;
import com.openrangelabs.blacklist.collector.exception.CredentialNotFoundException;
import com.openrangelabs.blacklist.collector.model.Credential;
import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.repository.CollectionCredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for resolving decrypted source credentials
 *
 * <p>Lookups are cached per source for a short TTL. Concurrent callers for the same
 * source share one repository lookup; failures are never cached.
 */
@Service
public class CredentialProvider {

    private static final Logger logger = LoggerFactory.getLogger(CredentialProvider.class);

    private final CollectionCredentialRepository repository;
    private final TextEncryptor encryptor;
    private final CollectorProperties properties;
    private final Map<String, Mono<Credential>> cache = new ConcurrentHashMap<>();

    @Autowired
    public CredentialProvider(CollectionCredentialRepository repository,
                              TextEncryptor credentialEncryptor,
                              CollectorProperties properties) {
        this.repository = repository;
        this.encryptor = credentialEncryptor;
        this.properties = properties;
    }

    /**
     * Resolve the credential for a source, possibly from cache
     */
    public Mono<Credential> resolve(String sourceName) {
        return cache.computeIfAbsent(key(sourceName), this::cachedLookup);
    }

    /**
     * Resolve the credential for a new collection run, bypassing any cached value
     */
    public Mono<Credential> resolveForRun(String sourceName) {
        evict(sourceName);
        return resolve(sourceName);
    }

    /**
     * Drop the cached credential of a source
     */
    public void evict(String sourceName) {
        if (cache.remove(key(sourceName)) != null) {
            logger.debug("Evicted cached credential for {}", sourceName);
        }
    }

    private Mono<Credential> cachedLookup(String sourceName) {
        Duration ttl = properties.getCredentials().getCacheTtl();
        return load(sourceName)
                .cache(value -> ttl, error -> Duration.ZERO, () -> Duration.ZERO);
    }

    private Mono<Credential> load(String sourceName) {
        return repository.findByServiceName(sourceName)
                .switchIfEmpty(Mono.error(() -> new CredentialNotFoundException(sourceName)))
                .flatMap(row -> {
                    if (!row.isUsable()) {
                        return Mono.error(new CredentialDisabledException(sourceName));
                    }
                    if (!StringUtils.hasText(row.getUsername()) || !StringUtils.hasText(row.getPassword())) {
                        return Mono.error(new CredentialNotFoundException(sourceName));
                    }
                    return Mono.fromCallable(() -> toCredential(sourceName, row));
                })
                .doOnNext(credential -> logger.debug("Loaded credential for {} (user {})",
                        sourceName, credential.getUsername()));
    }

    private Credential toCredential(String sourceName, CollectionCredential row) {
        String secret;
        if (row.isStoredEncrypted()) {
            try {
                secret = encryptor.decrypt(row.getPassword());
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new CollectionException(ErrorKind.INTERNAL, sourceName,
                        "Stored credential for " + sourceName + " could not be decrypted", e);
            }
        } else {
            secret = row.getPassword();
        }
        return Credential.builder()
                .sourceName(sourceName)
                .username(row.getUsername())
                .secret(secret)
                .baseUrl(row.getBaseUrl())
                .enabled(true)
                .lastRotatedAt(row.getLastRotatedAt())
                .build();
    }

    private static String key(String sourceName) {
        return sourceName.toUpperCase(Locale.ROOT);
    }
}
