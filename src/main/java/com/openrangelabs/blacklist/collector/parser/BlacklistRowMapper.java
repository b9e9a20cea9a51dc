package com.openrangelabs.blacklist.collector.parser;

import com.openrangelabs.blacklist.collector.model.NormalizedIpRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns tabular export rows into normalized records, independent of the file format.
 *
 * <p>Rows hold {@link String} or {@link LocalDate} cells. Columns are located by
 * header keywords, English or Korean, so column order in the export does not matter.
 */
@Component
public class BlacklistRowMapper {

    private static final Logger logger = LoggerFactory.getLogger(BlacklistRowMapper.class);

    private static final int HEADER_SEARCH_ROWS = 10;
    private static final Pattern IP_HEADER = Pattern.compile("(^|[^a-z])ip([^a-z]|$)|addr|아이피");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("yyyy.MM.dd"),
            DateTimeFormatter.ofPattern("yyyyMMdd"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("MM-dd-yyyy"));

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final IpRecordValidator validator;

    public BlacklistRowMapper(IpRecordValidator validator) {
        this.validator = validator;
    }

    /**
     * Maps all rows of one sheet. Invalid rows are dropped and counted.
     */
    public ParseResult mapRows(List<List<Object>> rows, String sourceName, String format) {
        List<List<Object>> nonBlank = rows.stream().filter(row -> !isBlank(row)).toList();
        if (nonBlank.isEmpty()) {
            return ParseResult.success(format, List.of(), 0);
        }

        int headerIndex = findHeader(nonBlank);
        ColumnLayout layout = headerIndex >= 0
                ? ColumnLayout.fromHeader(nonBlank.get(headerIndex))
                : ColumnLayout.headerless();

        Map<String, NormalizedIpRecord> records = new LinkedHashMap<>();
        int dropped = 0;
        for (int i = headerIndex + 1; i < nonBlank.size(); i++) {
            Optional<NormalizedIpRecord> record = mapRow(nonBlank.get(i), layout, sourceName);
            if (record.isEmpty()) {
                dropped++;
                continue;
            }
            records.putIfAbsent(record.get().naturalKey(), record.get());
        }

        if (dropped > 0) {
            logger.debug("Dropped {} invalid {} rows for {}", dropped, format, sourceName);
        }
        return ParseResult.success(format, new ArrayList<>(records.values()), dropped);
    }

    Optional<NormalizedIpRecord> mapRow(List<Object> row, ColumnLayout layout, String sourceName) {
        String ip = validator.normalizeIp(text(cell(row, layout.ip)));
        if (ip == null || ip.isEmpty()) {
            return Optional.empty();
        }
        String reason = text(cell(row, layout.reason));
        NormalizedIpRecord record = NormalizedIpRecord.builder()
                .ipAddress(ip)
                .sourceName(sourceName)
                .country(validator.normalizeCountry(text(cell(row, layout.country))))
                .detectedAt(parseDate(cell(row, layout.detected)))
                .expiresAt(parseDate(cell(row, layout.removed)))
                .metadata("reason", reason == null || reason.isEmpty() ? sourceName + " Excel Import" : reason)
                .build();

        Optional<String> rejection = validator.validate(record);
        if (rejection.isPresent()) {
            logger.trace("Rejected row for {}: {}", sourceName, rejection.get());
            return Optional.empty();
        }
        return Optional.of(record);
    }

    LocalDate parseDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        String text = text(value);
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (text.length() == 19) {
            LocalDateTime dateTime = tryParseDateTime(text);
            if (dateTime != null) {
                return dateTime.toLocalDate();
            }
        }
        for (DateTimeFormatter formatter : DATE_FORMATS) {
            LocalDate date = tryParseDate(text, formatter);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalDateTime tryParseDateTime(String text) {
        try {
            return LocalDateTime.parse(text, DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate tryParseDate(String text, DateTimeFormatter formatter) {
        try {
            return LocalDate.parse(text, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private int findHeader(List<List<Object>> rows) {
        String first = text(cell(rows.get(0), 0));
        if (first != null && validator.isValidIpLiteral(validator.normalizeIp(first))) {
            return -1;
        }
        int limit = Math.min(HEADER_SEARCH_ROWS, rows.size());
        for (int i = 0; i < limit; i++) {
            for (Object value : rows.get(i)) {
                String header = text(value);
                if (header != null && IP_HEADER.matcher(header.toLowerCase(Locale.ROOT)).find()) {
                    return i;
                }
            }
        }
        return 0;
    }

    private static Object cell(List<Object> row, int index) {
        return index >= 0 && index < row.size() ? row.get(index) : null;
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        return value.toString().replace('\u00A0', ' ').trim();
    }

    private static boolean isBlank(List<Object> row) {
        for (Object value : row) {
            String text = text(value);
            if (text != null && !text.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Column positions of the fields, {@code -1} where absent.
     */
    static final class ColumnLayout {

        private final int ip;
        private final int country;
        private final int reason;
        private final int detected;
        private final int removed;

        private ColumnLayout(int ip, int country, int reason, int detected, int removed) {
            this.ip = ip;
            this.country = country;
            this.reason = reason;
            this.detected = detected;
            this.removed = removed;
        }

        static ColumnLayout headerless() {
            return new ColumnLayout(0, -1, -1, -1, -1);
        }

        static ColumnLayout fromHeader(List<Object> header) {
            int ip = -1;
            int country = -1;
            int reason = -1;
            int detected = -1;
            int removed = -1;
            for (int i = 0; i < header.size(); i++) {
                String name = text(header.get(i));
                if (name == null) {
                    continue;
                }
                name = name.toLowerCase(Locale.ROOT);
                if (ip < 0 && IP_HEADER.matcher(name).find()) {
                    ip = i;
                } else if (country < 0 && (name.contains("국가") || name.contains("country"))) {
                    country = i;
                } else if (reason < 0 && (name.contains("사유") || name.contains("reason") || name.contains("이유"))) {
                    reason = i;
                } else if (removed < 0 && (name.contains("해제") || name.contains("삭제") || name.contains("remov"))) {
                    removed = i;
                } else if (detected < 0 && (name.contains("탐지") || name.contains("등록") || name.contains("detect"))) {
                    detected = i;
                }
            }
            return new ColumnLayout(ip >= 0 ? ip : 0, country, reason, detected, removed);
        }
    }
}
