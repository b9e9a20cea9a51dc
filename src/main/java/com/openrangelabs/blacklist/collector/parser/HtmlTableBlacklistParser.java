package com.openrangelabs.blacklist.collector.parser;

import com.openrangelabs.blacklist.collector.model.ErrorKind;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Last-resort parser for exports the portal renders as an HTML result table.
 *
 * <p>Data rows hold at least four cells. Without a {@code th} header row the columns
 * are taken positionally: IP, country, reason, detection date, removal date.
 */
@Component
public class HtmlTableBlacklistParser implements BlacklistFileParser {

    private static final Logger logger = LoggerFactory.getLogger(HtmlTableBlacklistParser.class);

    public static final String FORMAT = "html";

    static final int MIN_DATA_CELLS = 4;
    static final List<Object> POSITIONAL_HEADER = List.of("IP", "국가", "사유", "등록일", "해제일");

    private final BlacklistRowMapper rowMapper;

    public HtmlTableBlacklistParser(BlacklistRowMapper rowMapper) {
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
        if (XlsxBlacklistParser.isWorkbook(content)) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_FALLBACK_FORMAT, "Content is a workbook, not markup");
        }

        Document document;
        try {
            document = Jsoup.parse(new ByteArrayInputStream(content), null, "");
        } catch (IOException e) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_FALLBACK_FORMAT, e.getMessage());
        }

        Elements tableRows = document.select("table tr");
        if (tableRows.isEmpty()) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_FALLBACK_FORMAT,
                    "Markup holds no result table, the portal probably returned an error page");
        }

        List<List<Object>> rows = new ArrayList<>();
        boolean hasHeader = false;
        for (Element row : tableRows) {
            List<Element> headerCells = childCells(row, "th");
            if (!hasHeader && rows.isEmpty() && headerCells.size() >= MIN_DATA_CELLS) {
                rows.add(cellTexts(headerCells));
                hasHeader = true;
                continue;
            }
            List<Element> cells = childCells(row, "td");
            if (cells.size() >= MIN_DATA_CELLS) {
                rows.add(cellTexts(cells));
            }
        }
        if (!hasHeader) {
            rows.add(0, POSITIONAL_HEADER);
        }

        logger.debug("Read {} HTML table rows for {}", rows.size() - 1, sourceName);
        return rowMapper.mapRows(rows, sourceName, FORMAT);
    }

    private static List<Element> childCells(Element row, String tag) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            if (tag.equals(child.normalName())) {
                cells.add(child);
            }
        }
        return cells;
    }

    private static List<Object> cellTexts(List<Element> cells) {
        List<Object> values = new ArrayList<>(cells.size());
        for (Element cell : cells) {
            values.add(cell.text());
        }
        return values;
    }
}
