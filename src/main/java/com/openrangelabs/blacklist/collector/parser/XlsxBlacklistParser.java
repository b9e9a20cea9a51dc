package com.openrangelabs.blacklist.collector.parser;

import com.openrangelabs.blacklist.collector.model.ErrorKind;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Primary export parser for spreadsheet workbooks (OOXML, and BIFF as produced by older portals).
 * Only the first sheet is read.
 */
@Component
public class XlsxBlacklistParser implements BlacklistFileParser {

    private static final Logger logger = LoggerFactory.getLogger(XlsxBlacklistParser.class);

    public static final String FORMAT = "xlsx";

    private final BlacklistRowMapper rowMapper;

    public XlsxBlacklistParser(BlacklistRowMapper rowMapper) {
        this.rowMapper = rowMapper;
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    @Override
    public ParseResult parse(byte[] content, String sourceName) {
        if (content == null || content.length == 0) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_PRIMARY_FORMAT, "Empty workbook content");
        }
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return ParseResult.failure(FORMAT, ErrorKind.PARSE_PRIMARY_FORMAT, "Workbook has no sheets");
            }
            List<List<Object>> rows = readRows(workbook.getSheetAt(0));
            logger.debug("Read {} spreadsheet rows for {}", rows.size(), sourceName);
            return rowMapper.mapRows(rows, sourceName, FORMAT);
        } catch (IOException | EncryptedDocumentException e) {
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_PRIMARY_FORMAT, e.getMessage());
        } catch (RuntimeException e) {
            // POI signals non-workbook content with unchecked exceptions
            return ParseResult.failure(FORMAT, ErrorKind.PARSE_PRIMARY_FORMAT,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Whether the content starts with a zip (OOXML) or OLE2 (BIFF) signature.
     */
    public static boolean isWorkbook(byte[] content) {
        return content != null && content.length >= 4
                && ((content[0] == 'P' && content[1] == 'K')
                || ((content[0] & 0xFF) == 0xD0 && (content[1] & 0xFF) == 0xCF));
    }

    private List<List<Object>> readRows(Sheet sheet) {
        DataFormatter formatter = new DataFormatter();
        List<List<Object>> rows = new ArrayList<>();
        for (Row row : sheet) {
            List<Object> values = new ArrayList<>();
            short lastCell = row.getLastCellNum();
            for (int i = 0; i < lastCell; i++) {
                values.add(cellValue(row.getCell(i), formatter));
            }
            rows.add(values);
        }
        return rows;
    }

    private Object cellValue(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return null;
        }
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate();
        }
        return formatter.formatCellValue(cell);
    }
}
