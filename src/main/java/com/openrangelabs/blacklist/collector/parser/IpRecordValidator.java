package com.openrangelabs.blacklist.collector.parser;

import com.openrangelabs.blacklist.collector.model.NormalizedIpRecord;
import org.springframework.stereotype.Component;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Field-level validation and normalization for blacklist records.
 *
 * <p>Only literal addresses are accepted; resolution never touches DNS.
 */
@Component
public class IpRecordValidator {

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9A-Fa-f:.]+$");
    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Z]{2}$");

    private static final Map<String, String> COUNTRY_NAMES = Map.ofEntries(
            Map.entry("KOREA", "KR"),
            Map.entry("SOUTH KOREA", "KR"),
            Map.entry("REPUBLIC OF KOREA", "KR"),
            Map.entry("한국", "KR"),
            Map.entry("대한민국", "KR"),
            Map.entry("USA", "US"),
            Map.entry("UNITED STATES", "US"),
            Map.entry("미국", "US"),
            Map.entry("CHINA", "CN"),
            Map.entry("중국", "CN"),
            Map.entry("JAPAN", "JP"),
            Map.entry("일본", "JP"),
            Map.entry("RUSSIA", "RU"),
            Map.entry("러시아", "RU"),
            Map.entry("GERMANY", "DE"),
            Map.entry("독일", "DE"),
            Map.entry("NETHERLANDS", "NL"),
            Map.entry("UNITED KINGDOM", "GB"),
            Map.entry("VIETNAM", "VN"),
            Map.entry("INDIA", "IN"),
            Map.entry("BRAZIL", "BR"));

    /**
     * Why the record must be dropped, or empty when it is acceptable.
     */
    public Optional<String> validate(NormalizedIpRecord record) {
        if (record.getSourceName() == null || record.getSourceName().isBlank()) {
            return Optional.of("missing source");
        }
        if (!isValidIpLiteral(record.getIpAddress())) {
            return Optional.of("invalid ip address: " + record.getIpAddress());
        }
        if (!isRoutable(record.getIpAddress())) {
            return Optional.of("non-routable ip address: " + record.getIpAddress());
        }
        if (record.getCountry() == null || !COUNTRY_CODE.matcher(record.getCountry()).matches()) {
            return Optional.of("missing country");
        }
        if (record.getDetectedAt() != null && record.getExpiresAt() != null
                && !record.getExpiresAt().isAfter(record.getDetectedAt())) {
            return Optional.of("removal date not after detection date");
        }
        return Optional.empty();
    }

    public boolean isValid(NormalizedIpRecord record) {
        return validate(record).isEmpty();
    }

    public boolean isValidIpLiteral(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        if (IPV4.matcher(value).matches()) {
            return true;
        }
        return value.contains(":") && IPV6_CHARS.matcher(value).matches() && parseLiteral(value) != null;
    }

    /**
     * Rejects loopback, private, link-local, wildcard and multicast ranges.
     */
    public boolean isRoutable(String literal) {
        InetAddress address = parseLiteral(literal);
        if (address == null) {
            return false;
        }
        if (address.isAnyLocalAddress() || address.isLoopbackAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return false;
        }
        byte[] bytes = address.getAddress();
        // IPv6 unique local fc00::/7
        return bytes.length != 16 || (bytes[0] & 0xFE) != 0xFC;
    }

    /**
     * Trims the literal and brings IPv6 into its canonical compressed form, so every
     * spelling of one address maps to the same stored key.
     */
    public String normalizeIp(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (!trimmed.contains(":")) {
            return trimmed;
        }
        InetAddress address = parseLiteral(trimmed);
        if (address instanceof Inet6Address) {
            return compressIpv6(address.getAddress());
        }
        // IPv4-mapped literals resolve to plain IPv4
        return address != null ? address.getHostAddress() : trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Two-letter country code for a code or a known country name, or {@code null}.
     */
    public String normalizeCountry(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        String mapped = COUNTRY_NAMES.get(upper);
        if (mapped != null) {
            return mapped;
        }
        return COUNTRY_CODE.matcher(upper).matches() ? upper : null;
    }

    static String compressIpv6(byte[] bytes) {
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((bytes[2 * i] & 0xFF) << 8) | (bytes[2 * i + 1] & 0xFF);
        }
        int bestStart = -1;
        int bestLength = 1;
        for (int i = 0; i < 8; i++) {
            int length = 0;
            while (i + length < 8 && groups[i + length] == 0) {
                length++;
            }
            if (length > bestLength) {
                bestStart = i;
                bestLength = length;
            }
            i += length;
        }

        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                text.append("::");
                i += bestLength - 1;
                continue;
            }
            if (text.length() > 0 && text.charAt(text.length() - 1) != ':') {
                text.append(':');
            }
            text.append(Integer.toHexString(groups[i]));
        }
        return text.toString();
    }

    private InetAddress parseLiteral(String literal) {
        if (!IPV4.matcher(literal).matches() && !(literal.contains(":") && IPV6_CHARS.matcher(literal).matches())) {
            return null;
        }
        try {
            return InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
