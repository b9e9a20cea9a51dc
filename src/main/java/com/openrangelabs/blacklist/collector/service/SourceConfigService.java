package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.entity.SourceConfig;
import com.openrangelabs.blacklist.collector.model.SourceSettings;
import com.openrangelabs.blacklist.collector.repository.SourceConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Locale;

/**
 * Service resolving the effective scheduling settings of each source.
 * Rows in {@code collection_sources} override the configured defaults.
 */
@Service
public class SourceConfigService {

    private static final Logger logger = LoggerFactory.getLogger(SourceConfigService.class);

    private final SourceConfigRepository repository;
    private final CollectorProperties properties;

    @Autowired
    public SourceConfigService(SourceConfigRepository repository, CollectorProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    /**
     * Effective settings for one source
     */
    public Mono<SourceSettings> settingsFor(String sourceName) {
        return repository.findBySourceName(sourceName)
                .map(config -> config.toSettings(properties.getDefaults()))
                .defaultIfEmpty(defaultSettings(sourceName));
    }

    /**
     * Effective settings for every known source. Rows naming a source without
     * a collector are reported and skipped.
     */
    public Flux<SourceSettings> loadAll(Collection<String> knownSources) {
        return repository.findAll()
                .collectMap(config -> config.getSourceName().toUpperCase(Locale.ROOT))
                .flatMapMany(rows -> {
                    rows.keySet().stream()
                            .filter(name -> !knownSources.contains(name))
                            .forEach(name -> logger.warn("Source {} is configured but has no collector", name));
                    return Flux.fromIterable(knownSources)
                            .map(name -> {
                                SourceConfig row = rows.get(name);
                                return row != null
                                        ? row.toSettings(properties.getDefaults()).toBuilder().sourceName(name).build()
                                        : defaultSettings(name);
                            });
                });
    }

    public SourceSettings defaultSettings(String sourceName) {
        CollectorProperties.Defaults defaults = properties.getDefaults();
        return SourceSettings.builder()
                .sourceName(sourceName)
                .enabled(true)
                .interval(defaults.getInterval())
                .maxBackoff(defaults.getMaxBackoff())
                .scheduledWindowDays(defaults.getScheduledWindowDays())
                .backfillWindowDays(defaults.getBackfillWindowDays())
                .build();
    }
}
