package com.openrangelabs.blacklist.collector.parser;

import com.openrangelabs.blacklist.collector.model.NormalizedIpRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class IpRecordValidatorTest {

    private final IpRecordValidator validator = new IpRecordValidator();

    @ParameterizedTest
    @ValueSource(strings = {"203.0.113.10", "8.8.8.8", "2001:db8::1", "2606:4700:4700::1111"})
    void isValidIpLiteral_AcceptsPublicLiterals(String literal) {
        assertThat(validator.isValidIpLiteral(literal)).isTrue();
        assertThat(validator.isRoutable(literal)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "256.1.1.1", "1.2.3", "example.com", "1.2.3.4/24", "::g"})
    void isValidIpLiteral_RejectsMalformedValues(String literal) {
        assertThat(validator.isValidIpLiteral(literal)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"10.0.0.1", "172.16.5.4", "192.168.1.1", "127.0.0.1", "169.254.1.1",
            "0.0.0.0", "224.0.0.1", "::1", "fe80::1", "fd00::1"})
    void isRoutable_RejectsReservedRanges(String literal) {
        assertThat(validator.isRoutable(literal)).isFalse();
    }

    @Test
    void normalizeCountry_MapsNamesAndCodes() {
        assertThat(validator.normalizeCountry("kr")).isEqualTo("KR");
        assertThat(validator.normalizeCountry("한국")).isEqualTo("KR");
        assertThat(validator.normalizeCountry("United States")).isEqualTo("US");
        assertThat(validator.normalizeCountry("Atlantis")).isNull();
        assertThat(validator.normalizeCountry(" ")).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"2001:db8::1", "2001:DB8:0:0:0:0:0:1", " 2001:0db8:0000::0001 "})
    void normalizeIp_CanonicalizesIpv6Spellings(String literal) {
        assertThat(validator.normalizeIp(literal)).isEqualTo("2001:db8::1");
    }

    @Test
    void normalizeIp_CompressesLongestZeroRun() {
        assertThat(validator.normalizeIp("2001:0:0:1:0:0:0:1")).isEqualTo("2001:0:0:1::1");
        assertThat(validator.normalizeIp("2606:4700:4700:0:0:0:0:1111")).isEqualTo("2606:4700:4700::1111");
    }

    @Test
    void normalizeIp_KeepsIpv4AndUnwrapsMappedAddresses() {
        assertThat(validator.normalizeIp(" 203.0.113.5 ")).isEqualTo("203.0.113.5");
        assertThat(validator.normalizeIp("::ffff:203.0.113.5")).isEqualTo("203.0.113.5");
    }

    @Test
    void validate_RejectsMissingCountry() {
        NormalizedIpRecord record = record("203.0.113.10", null, null, null);

        assertThat(validator.validate(record)).contains("missing country");
    }

    @Test
    void validate_RejectsRemovalNotAfterDetection() {
        LocalDate day = LocalDate.of(2025, 1, 10);
        NormalizedIpRecord record = record("203.0.113.10", "KR", day, day);

        assertThat(validator.validate(record)).isPresent();
    }

    @Test
    void validate_AcceptsCompleteRecord() {
        NormalizedIpRecord record = record("203.0.113.10", "KR",
                LocalDate.of(2025, 1, 10), LocalDate.of(2025, 4, 10));

        assertThat(validator.isValid(record)).isTrue();
    }

    private static NormalizedIpRecord record(String ip, String country, LocalDate detected, LocalDate expires) {
        return NormalizedIpRecord.builder()
                .ipAddress(ip)
                .sourceName("REGTECH")
                .country(country)
                .detectedAt(detected)
                .expiresAt(expires)
                .metadata("reason", "test")
                .build();
    }
}
