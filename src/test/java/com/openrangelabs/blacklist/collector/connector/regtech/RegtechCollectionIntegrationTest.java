package com.openrangelabs.blacklist.collector.connector.regtech;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.entity.BlacklistIp;
import com.openrangelabs.blacklist.collector.entity.CollectionCredential;
import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.TriggerType;
import com.openrangelabs.blacklist.collector.parser.CsvBlacklistParser;
import com.openrangelabs.blacklist.collector.parser.ExportFixtures;
import com.openrangelabs.blacklist.collector.parser.HtmlTableBlacklistParser;
import com.openrangelabs.blacklist.collector.parser.XlsxBlacklistParser;
import com.openrangelabs.blacklist.collector.ratelimit.SourceRateLimiter;
import com.openrangelabs.blacklist.collector.repository.BlacklistIpRepository;
import com.openrangelabs.blacklist.collector.repository.CollectionCredentialRepository;
import com.openrangelabs.blacklist.collector.repository.CollectionHistoryRepository;
import com.openrangelabs.blacklist.collector.repository.ProcessedReportRepository;
import com.openrangelabs.blacklist.collector.service.CollectionRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RegtechCollectionIntegrationTest {

    private static final DateWindow JANUARY = new DateWindow(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31));
    private static final DateWindow FEBRUARY = new DateWindow(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 28));
    private static final Duration RUN_TIMEOUT = Duration.ofSeconds(30);

    @Autowired
    private CollectionRunService runService;

    @Autowired
    private BlacklistIpRepository blacklistRepository;

    @Autowired
    private CollectionHistoryRepository historyRepository;

    @Autowired
    private CollectionCredentialRepository credentialRepository;

    @Autowired
    private ProcessedReportRepository processedReportRepository;

    @Autowired
    private SourceRateLimiter rateLimiter;

    @Autowired
    private XlsxBlacklistParser xlsxParser;

    @Autowired
    private CsvBlacklistParser csvParser;

    @Autowired
    private HtmlTableBlacklistParser htmlParser;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CollectorProperties properties;

    @Autowired
    private Clock clock;

    private RegtechCollector collector;

    @BeforeEach
    void setUp() {
        blacklistRepository.deleteAll().block();
        historyRepository.deleteAll().block();
        processedReportRepository.deleteAll().block();
        credentialRepository.deleteAll().block();

        CollectionCredential credential = new CollectionCredential("REGTECH", "analyst", "s3cret");
        credential.setEncrypted(false);
        credentialRepository.save(credential).block();

        collector = new RegtechCollector(WebClient.builder().exchangeFunction(this::portal), rateLimiter,
                xlsxParser, csvParser, htmlParser, objectMapper, properties, clock);
    }

    @Test
    void execute_RepeatedCollectionLeavesStoredEntriesUnchanged() {
        // Act
        CollectionHistory first = runService.execute(collector, JANUARY, TriggerType.MANUAL).block(RUN_TIMEOUT);
        Map<String, String> afterFirst = storedRows();
        CollectionHistory second = runService.execute(collector, FEBRUARY, TriggerType.MANUAL).block(RUN_TIMEOUT);
        Map<String, String> afterSecond = storedRows();

        // Assert
        assertThat(first.getOutcome()).isEqualTo("SUCCESS");
        assertThat(first.getItemsFetched()).isEqualTo(3);
        assertThat(first.getItemsNew()).isEqualTo(3);
        assertThat(first.getItemsRejected()).isEqualTo(2);
        assertThat(afterFirst).containsOnlyKeys("203.0.113.10", "198.51.100.7", "2001:db8::1");

        assertThat(second.getOutcome()).isEqualTo("SUCCESS");
        assertThat(second.getItemsNew()).isZero();
        assertThat(second.getItemsDuplicate()).isEqualTo(3);
        assertThat(afterSecond).isEqualTo(afterFirst);
    }

    @Test
    void execute_ProcessedWindowIsNotCollectedTwice() {
        // Arrange
        runService.execute(collector, JANUARY, TriggerType.SCHEDULED).block(RUN_TIMEOUT);
        Map<String, String> afterFirst = storedRows();

        // Act
        CollectionHistory repeat = runService.execute(collector, JANUARY, TriggerType.SCHEDULED).block(RUN_TIMEOUT);

        // Assert
        assertThat(repeat.getOutcome()).isEqualTo("SUCCESS");
        assertThat(repeat.getItemsFetched()).isZero();
        assertThat(repeat.getItemsNew()).isZero();
        assertThat(storedRows()).isEqualTo(afterFirst);
        assertThat(historyRepository.findRecentByServiceName("REGTECH", 10).count().block()).isEqualTo(2);
    }

    private Map<String, String> storedRows() {
        return blacklistRepository.findAll()
                .collectList()
                .block(RUN_TIMEOUT)
                .stream()
                .collect(Collectors.toMap(BlacklistIp::getIpAddress, RegtechCollectionIntegrationTest::describe));
    }

    private static String describe(BlacklistIp entry) {
        return String.join("|", entry.getSource(), String.valueOf(entry.getCountry()),
                String.valueOf(entry.getReason()), String.valueOf(entry.getDetectionDate()),
                String.valueOf(entry.getRemovalDate()), String.valueOf(entry.getIsActive()),
                String.valueOf(entry.getUpdatedAt()));
    }

    private Mono<ClientResponse> portal(ClientRequest request) {
        Map<String, Function<ClientRequest, ClientResponse>> routes = Map.of(
                RegtechCollector.LOGIN_FORM_PATH, r -> ClientResponse.create(HttpStatus.OK)
                        .body("<html>login</html>").build(),
                RegtechCollector.FIND_MEMBER_PATH, r -> ClientResponse.create(HttpStatus.OK)
                        .body("{\"id\":\"M-1001\"}").build(),
                RegtechCollector.LOGIN_PATH, r -> ClientResponse.create(HttpStatus.FOUND)
                        .header(HttpHeaders.LOCATION, "/main/main")
                        .cookie(RegtechCollector.ACCESS_TOKEN_COOKIE, "jwt-token")
                        .build(),
                RegtechCollector.EXPORT_PATH, r -> ClientResponse.create(HttpStatus.OK)
                        .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(ExportFixtures.workbook())))
                        .build());
        Function<ClientRequest, ClientResponse> handler = routes.get(request.url().getPath());
        if (handler == null) {
            return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
        }
        return Mono.fromCallable(() -> handler.apply(request));
    }
}
