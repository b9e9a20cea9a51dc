package com.openrangelabs.blacklist.collector.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.blacklist.collector.entity.BlacklistIp;
import com.openrangelabs.blacklist.collector.exception.SinkException;
import com.openrangelabs.blacklist.collector.model.NormalizedIpRecord;
import com.openrangelabs.blacklist.collector.model.UpsertResult;
import com.openrangelabs.blacklist.collector.parser.IpRecordValidator;
import com.openrangelabs.blacklist.collector.repository.BlacklistIpRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service persisting normalized records into the blacklist store
 *
 * <p>Records are upserted one by one on their natural key {@code (ip_address, source)}.
 * Writing a record identical to the stored one changes nothing.
 */
@Service
public class RecordSink {

    private static final Logger logger = LoggerFactory.getLogger(RecordSink.class);

    private enum Outcome { INSERTED, UPDATED, UNCHANGED, REJECTED }

    private final BlacklistIpRepository repository;
    private final IpRecordValidator validator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public RecordSink(BlacklistIpRepository repository, IpRecordValidator validator,
                      ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Upsert a batch of records.
     * Fails with {@link SinkException} carrying the counts committed before the failure.
     */
    public Mono<UpsertResult> upsertBatch(List<NormalizedIpRecord> records) {
        if (records.isEmpty()) {
            return Mono.just(UpsertResult.empty());
        }
        String sourceName = records.get(0).getSourceName();
        Counts counts = new Counts();

        return Flux.fromIterable(records)
                .concatMap(this::upsert)
                .doOnNext(counts::add)
                .then(Mono.fromCallable(counts::toResult))
                .doOnSuccess(result -> logger.info("Stored {} records for {}: {} new, {} updated, {} unchanged, {} rejected",
                        records.size(), sourceName, result.getInserted(), result.getUpdated(),
                        result.getUnchanged(), result.getRejected()))
                .onErrorMap(error -> !(error instanceof SinkException),
                        error -> new SinkException(sourceName, counts.toResult(), error));
    }

    /**
     * Deactivate records whose removal date lies before {@code today}
     */
    public Mono<Integer> deactivateExpired(LocalDate today) {
        return repository.deactivateExpired(today)
                .doOnSuccess(count -> logger.info("Deactivated {} expired blacklist entries", count));
    }

    private Mono<Outcome> upsert(NormalizedIpRecord record) {
        Optional<String> invalid = validator.validate(record);
        if (invalid.isPresent()) {
            logger.debug("Rejected record {}: {}", record.getIpAddress(), invalid.get());
            return Mono.just(Outcome.REJECTED);
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(record.getRawMetadata()))
                .flatMap(rawData -> repository.findByIpAddressAndSource(record.getIpAddress(), record.getSourceName())
                        .flatMap(existing -> {
                            if (!existing.differsFrom(record, rawData)) {
                                return Mono.just(Outcome.UNCHANGED);
                            }
                            existing.applyUpdate(record, rawData, LocalDateTime.now(clock));
                            return repository.save(existing).thenReturn(Outcome.UPDATED);
                        })
                        .switchIfEmpty(Mono.defer(() -> repository
                                .save(BlacklistIp.fromRecord(record, rawData, LocalDateTime.now(clock)))
                                .thenReturn(Outcome.INSERTED))));
    }

    private static final class Counts {
        private final AtomicInteger inserted = new AtomicInteger();
        private final AtomicInteger updated = new AtomicInteger();
        private final AtomicInteger unchanged = new AtomicInteger();
        private final AtomicInteger rejected = new AtomicInteger();

        void add(Outcome outcome) {
            switch (outcome) {
                case INSERTED -> inserted.incrementAndGet();
                case UPDATED -> updated.incrementAndGet();
                case UNCHANGED -> unchanged.incrementAndGet();
                case REJECTED -> rejected.incrementAndGet();
            }
        }

        UpsertResult toResult() {
            return new UpsertResult(inserted.get(), updated.get(), unchanged.get(), rejected.get());
        }
    }
}
