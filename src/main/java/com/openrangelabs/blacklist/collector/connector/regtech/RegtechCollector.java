package com.openrangelabs.blacklist.collector.connector.regtech;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.connector.AbstractSourceCollector;
import com.openrangelabs.blacklist.collector.connector.CollectorSession;
import com.openrangelabs.blacklist.collector.exception.AuthenticationException;
import com.openrangelabs.blacklist.collector.exception.CollectionException;
import com.openrangelabs.blacklist.collector.exception.NetworkException;
import com.openrangelabs.blacklist.collector.model.Credential;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.parser.CsvBlacklistParser;
import com.openrangelabs.blacklist.collector.parser.HtmlTableBlacklistParser;
import com.openrangelabs.blacklist.collector.parser.XlsxBlacklistParser;
import com.openrangelabs.blacklist.collector.ratelimit.SourceRateLimiter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.ConnectException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Collector for the REGTECH (FSEC) threat intelligence portal.
 *
 * <p>Login is two-staged: the member lookup validates username and password,
 * then the login exchange turns the member id into a session carrying the
 * {@code regtech-va} JWT cookie. Blacklist data is pulled as a single spreadsheet
 * export per date window.
 */
@Component
public class RegtechCollector extends AbstractSourceCollector {

    public static final String SOURCE_NAME = "REGTECH";

    static final String LOGIN_FORM_PATH = "/login/loginForm";
    static final String FIND_MEMBER_PATH = "/member/findOneMember";
    static final String LOGIN_PATH = "/login/addLogin";
    static final String EXPORT_PATH = "/fcti/securityAdvisory/advisoryListDownloadXlsx";

    static final String ACCESS_TOKEN_COOKIE = "regtech-va";
    private static final int TOO_MANY_REQUESTS = 429;
    private static final int SERVICE_UNAVAILABLE = 503;
    private static final String MAIN_PAGE = "/main/main";
    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private final WebClient.Builder webClientBuilder;
    private final SourceRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final CollectorProperties.Regtech settings;

    public RegtechCollector(WebClient.Builder webClientBuilder,
                            SourceRateLimiter rateLimiter,
                            XlsxBlacklistParser primaryParser,
                            CsvBlacklistParser csvParser,
                            HtmlTableBlacklistParser htmlParser,
                            ObjectMapper objectMapper,
                            CollectorProperties properties,
                            Clock clock) {
        super(primaryParser, List.of(csvParser, htmlParser), clock);
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.settings = properties.getRegtech();
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    @Override
    protected Mono<Void> doAuthenticate(CollectorSession session) {
        return openLoginForm(session)
                .then(Mono.defer(() -> findMember(session)))
                .flatMap(memberId -> exchangeSession(session, memberId)
                        .retryWhen(Retry.max(settings.getSessionExchangeRetries())
                                .filter(RegtechCollector::isSessionExchangeFailure)
                                .doBeforeRetry(signal -> logger.warn("Retrying REGTECH session exchange: {}",
                                        signal.failure().getMessage()))
                                .onRetryExhaustedThrow((spec, signal) -> signal.failure())));
    }

    @Override
    protected Mono<byte[]> doFetch(CollectorSession session, DateWindow window) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("tabSort", "blacklist");
        form.add("excelDownload", "blacklist,");
        form.add("startDate", window.startCompact());
        form.add("endDate", window.endCompact());
        form.add("findCondition", "all");
        form.add("findKeyword", "");
        form.add("excelDown", "blacklist");

        logger.debug("Requesting REGTECH export for {}", window);
        return send(session, HttpMethod.POST, EXPORT_PATH, form)
                .flatMap(response -> {
                    if (response.status().is3xxRedirection()) {
                        return Mono.error(new AuthenticationException(
                                AuthenticationException.Reason.SESSION_EXCHANGE_FAILED, SOURCE_NAME,
                                "Export redirected to " + response.location() + ", session is no longer valid"));
                    }
                    if (!response.status().is2xxSuccessful()) {
                        return Mono.error(NetworkException.unexpectedStatus(
                                SOURCE_NAME, EXPORT_PATH, response.status().value()));
                    }
                    byte[] body = response.body();
                    if (isEmptyExport(body)) {
                        logger.info("REGTECH export for {} is {} bytes, treating window as empty",
                                window, body.length);
                        return Mono.empty();
                    }
                    return Mono.just(body);
                });
    }

    /**
     * A workbook below the size threshold is the portal's "no data" export.
     * Text exports are always parsed, a header-only file yields no records.
     */
    private boolean isEmptyExport(byte[] body) {
        if (body.length == 0) {
            return true;
        }
        return XlsxBlacklistParser.isWorkbook(body) && body.length < settings.getEmptyExportThresholdBytes();
    }

    private Mono<Void> openLoginForm(CollectorSession session) {
        return send(session, HttpMethod.GET, LOGIN_FORM_PATH, null)
                .flatMap(response -> response.status().is2xxSuccessful()
                        ? Mono.<Void>empty()
                        : Mono.error(NetworkException.unexpectedStatus(
                                SOURCE_NAME, LOGIN_FORM_PATH, response.status().value())));
    }

    /**
     * Stage one. Resolves the member id for the credential or rejects it.
     */
    Mono<String> findMember(CollectorSession session) {
        Credential credential = session.getCredential();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("memberId", credential.getUsername());
        form.add("memberPw", credential.getSecret());

        return send(session, HttpMethod.POST, FIND_MEMBER_PATH, form)
                .flatMap(response -> {
                    HttpStatusCode status = response.status();
                    if (status.is5xxServerError()) {
                        return Mono.error(NetworkException.unexpectedStatus(
                                SOURCE_NAME, FIND_MEMBER_PATH, status.value()));
                    }
                    if (!status.is2xxSuccessful()) {
                        return Mono.error(credentialRejected("member lookup returned HTTP " + status.value()));
                    }
                    return memberIdFrom(response.body(), credential.getUsername());
                });
    }

    /**
     * Stage two. Exchanges the member id for a logged-in session.
     */
    Mono<Void> exchangeSession(CollectorSession session, String memberId) {
        Credential credential = session.getCredential();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", credential.getUsername());
        form.add("password", credential.getSecret());
        form.add("login_error", "");
        form.add("smsTimeExcess", "N");
        form.add("txId", "");
        form.add("token", "");
        form.add("memberId", memberId);

        return send(session, HttpMethod.POST, LOGIN_PATH, form)
                .flatMap(response -> {
                    String accessToken = session.getCookie(ACCESS_TOKEN_COOKIE);
                    String location = response.location();
                    boolean redirected = response.status().is3xxRedirection();
                    if (redirected && (StringUtils.hasText(accessToken)
                            || (location != null && location.contains(MAIN_PAGE)))) {
                        if (StringUtils.hasText(accessToken)) {
                            session.setBearerToken(accessToken);
                        }
                        return Mono.<Void>empty();
                    }
                    return Mono.error(new AuthenticationException(
                            AuthenticationException.Reason.SESSION_EXCHANGE_FAILED, SOURCE_NAME,
                            "Login exchange returned HTTP " + response.status().value()
                                    + (location != null ? " to " + location : "")));
                });
    }

    private Mono<String> memberIdFrom(byte[] body, String username) {
        if (body.length == 0) {
            return Mono.just(username);
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (java.io.IOException e) {
            logger.debug("REGTECH member lookup answered with non-JSON content, using username as member id");
            return Mono.just(username);
        }
        if (json == null || !json.isObject()) {
            return Mono.just(username);
        }
        if (json.hasNonNull("error")
                || "fail".equalsIgnoreCase(json.path("result").asText())
                || (json.has("success") && !json.path("success").asBoolean())) {
            return Mono.error(credentialRejected("member lookup refused the credentials"));
        }
        String memberId = json.path("id").asText(json.path("memberId").asText(""));
        return Mono.just(StringUtils.hasText(memberId) ? memberId : username);
    }

    private Mono<PortalResponse> send(CollectorSession session, HttpMethod method, String path,
                                      MultiValueMap<String, String> form) {
        return rateLimiter.acquire(SOURCE_NAME)
                .then(Mono.defer(() -> {
                    WebClient.RequestBodySpec request = client(session)
                            .method(method)
                            .uri(path)
                            .headers(headers -> applySession(headers, session))
                            .cookies(cookies -> session.getCookies().forEach(cookies::add));
                    WebClient.RequestHeadersSpec<?> ready = form != null
                            ? request.contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                    .body(BodyInserters.fromFormData(form))
                            : request;
                    return ready.exchangeToMono(response -> response.bodyToMono(byte[].class)
                            .defaultIfEmpty(new byte[0])
                            .map(body -> new PortalResponse(response.statusCode(),
                                    response.headers().asHttpHeaders(), response.cookies(), body)))
                            .timeout(settings.getRequestTimeout());
                }))
                .onErrorMap(error -> !(error instanceof CollectionException), error -> toNetworkException(path, error))
                .doOnNext(response -> {
                    adaptRate(response.status());
                    captureCookies(session, response);
                });
    }

    private WebClient client(CollectorSession session) {
        String baseUrl = StringUtils.hasText(session.getCredential().getBaseUrl())
                ? session.getCredential().getBaseUrl()
                : settings.getBaseUrl();
        return webClientBuilder.clone().baseUrl(baseUrl).build();
    }

    private void applySession(HttpHeaders headers, CollectorSession session) {
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        if (session.getBearerToken() != null) {
            headers.setBearerAuth(session.getBearerToken());
        }
    }

    private void adaptRate(HttpStatusCode status) {
        int code = status.value();
        if (code == TOO_MANY_REQUESTS || code == SERVICE_UNAVAILABLE) {
            rateLimiter.onThrottled(SOURCE_NAME, code);
        } else if (!status.isError()) {
            rateLimiter.onSuccess(SOURCE_NAME);
        }
    }

    private void captureCookies(CollectorSession session, PortalResponse response) {
        response.cookies().forEach((name, values) -> {
            if (!values.isEmpty()) {
                session.putCookie(name, values.get(values.size() - 1).getValue());
            }
        });
    }

    private NetworkException toNetworkException(String path, Throwable error) {
        if (hasCause(error, TimeoutException.class) || hasCause(error, io.netty.handler.timeout.TimeoutException.class)) {
            return new NetworkException(ErrorKind.NETWORK_TIMEOUT, SOURCE_NAME,
                    "Timed out calling " + path, error);
        }
        if (error instanceof WebClientRequestException || hasCause(error, ConnectException.class)) {
            return new NetworkException(ErrorKind.CONNECTION_REFUSED, SOURCE_NAME,
                    "Could not reach " + path + ": " + error.getMessage(), error);
        }
        return new NetworkException(ErrorKind.UNEXPECTED_STATUS, SOURCE_NAME,
                "Request to " + path + " failed: " + error.getMessage(), error);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSessionExchangeFailure(Throwable error) {
        return error instanceof AuthenticationException auth
                && auth.getReason() == AuthenticationException.Reason.SESSION_EXCHANGE_FAILED;
    }

    private static AuthenticationException credentialRejected(String message) {
        return new AuthenticationException(AuthenticationException.Reason.CREDENTIAL_REJECTED, SOURCE_NAME,
                "REGTECH " + message);
    }

    private record PortalResponse(HttpStatusCode status, HttpHeaders headers,
                                  MultiValueMap<String, ResponseCookie> cookies, byte[] body) {

        String location() {
            return headers.getFirst(HttpHeaders.LOCATION);
        }
    }
}
