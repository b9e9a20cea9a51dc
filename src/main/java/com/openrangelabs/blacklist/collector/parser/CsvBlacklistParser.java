package com.openrangelabs.blacklist.collector.parser;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.openrangelabs.blacklist.collector.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fallback export parser for delimited text, used when the portal hands back
 * a text export instead of a workbook. Comma, tab and semicolon separators are
 * detected from the first line. UTF-8 is tried first, then the Korean legacy code page.
 */
@Component
public class CsvBlacklistParser implements BlacklistFileParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvBlacklistParser.class);

    public static final String FORMAT = "csv";

    private static final String LEGACY_CHARSET = "x-windows-949";

    private final BlacklistRowMapper rowMapper;

    public CsvBlacklistParser(BlacklistRowMapper rowMapper) {
        this.rowMapper = rowMapper;
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    @Override
    public ParseResult parse(byte[] content, String sourceName) {
        if (content == null || content.length == 0) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_FALLBACK_FORMAT, "Empty export content");
        }
        if (looksBinary(content)) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_FALLBACK_FORMAT, "Content is binary, not delimited text");
        }

        String text = stripBom(decode(content));
        if (text.stripLeading().startsWith("<")) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_FALLBACK_FORMAT,
                    "Content is markup, the portal probably returned an error page");
        }

        char separator = detectSeparator(text);
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                .build()) {
            List<List<Object>> rows = new ArrayList<>();
            for (String[] line : reader.readAll()) {
                rows.add(new ArrayList<>(Arrays.asList((Object[]) line)));
            }
            logger.debug("Read {} delimited rows for {} with separator '{}'", rows.size(), sourceName, separator);
            return rowMapper.mapRows(rows, sourceName, FORMAT);
        } catch (IOException | CsvException e) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_FALLBACK_FORMAT, e.getMessage());
        }
    }

    private String decode(byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            Charset legacy = Charset.isSupported(LEGACY_CHARSET) ? Charset.forName(LEGACY_CHARSET) : StandardCharsets.ISO_8859_1;
            logger.debug("Export is not UTF-8, decoding as {}", legacy);
            return new String(content, legacy);
        }
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    private static boolean looksBinary(byte[] content) {
        int sampled = Math.min(content.length, 512);
        for (int i = 0; i < sampled; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return XlsxBlacklistParser.isWorkbook(content);
    }

    static char detectSeparator(String text) {
        int end = text.indexOf('\n');
        String firstLine = end >= 0 ? text.substring(0, end) : text;
        long tabs = firstLine.chars().filter(c -> c == '\t').count();
        long semicolons = firstLine.chars().filter(c -> c == ';').count();
        long commas = firstLine.chars().filter(c -> c == ',').count();
        if (tabs > commas && tabs >= semicolons) {
            return '\t';
        }
        if (semicolons > commas) {
            return ';';
        }
        return ',';
    }
}
