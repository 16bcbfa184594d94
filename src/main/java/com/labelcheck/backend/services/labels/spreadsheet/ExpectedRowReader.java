package com.labelcheck.backend.services.labels.spreadsheet;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import com.labelcheck.backend.services.labels.reconciliation.ExpectedRow;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads expected rows from the first sheet of an Excel workbook (.xlsx or .xls).
 * The first row is the header; blank rows are skipped.
 */
@Slf4j
public class ExpectedRowReader {

    private final DataFormatter dataFormatter = new DataFormatter();

    public List<ExpectedRow> read(InputStream inputStream) {
        try (Workbook workbook = WorkbookFactory.create(inputStream)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new SpreadsheetReadException("Planilha sem abas");
            }
            return read(workbook.getSheetAt(0));
        } catch (SpreadsheetReadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // POI reports unknown formats as IOException or UnsupportedFileFormatException
            throw new SpreadsheetReadException("Não foi possível ler a planilha: " + e.getMessage(), e);
        }
    }

    public List<ExpectedRow> read(Sheet sheet) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            log.info("[Reconcile] Spreadsheet '{}' has no header row", sheet.getSheetName());
            return List.of();
        }

        List<String> headers = new ArrayList<>();
        for (int c = 0; c < headerRow.getLastCellNum(); c++) {
            headers.add(cellText(headerRow, c));
        }
        ColumnMapping mapping = SpreadsheetColumnMapper.map(headers);
        log.info("[Reconcile] Spreadsheet headers={} mapping={}", headers, mapping);
        if (!mapping.hasStyle()) {
            // sem coluna de estilo nenhuma linha casa com etiqueta
            log.warn("[Reconcile] Spreadsheet '{}' has no style column, every row will report match=none", sheet.getSheetName());
        }

        List<ExpectedRow> rows = new ArrayList<>();
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null || isBlank(row)) {
                continue;
            }
            rows.add(ExpectedRow.of(
                    value(row, mapping.style()),
                    value(row, mapping.size()),
                    value(row, mapping.color()),
                    value(row, mapping.careUpc()),
                    value(row, mapping.hangUpc()),
                    value(row, mapping.upc())));
        }
        log.info("[Reconcile] Spreadsheet rows={}", rows.size());
        return rows;
    }

    private String value(Row row, int column) {
        return column == ColumnMapping.MISSING ? "" : cellText(row, column);
    }

    private String cellText(Row row, int column) {
        Cell cell = row.getCell(column);
        if (cell == null) return "";
        // "General" renders 12+ digit numbers in scientific notation; UPC cells need every digit.
        if (cell.getCellType() == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
        }
        return dataFormatter.formatCellValue(cell).trim();
    }

    private boolean isBlank(Row row) {
        for (int c = 0; c < row.getLastCellNum(); c++) {
            if (!cellText(row, c).isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
