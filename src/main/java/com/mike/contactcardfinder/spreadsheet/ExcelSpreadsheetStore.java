package com.mike.contactcardfinder.spreadsheet;

import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.dto.ContactInfo;
import com.mike.contactcardfinder.dto.EmailRecord;
import com.mike.contactcardfinder.dto.Status;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * .xlsx store. The workbook is opened, changed, saved and closed on every write so that an interrupted run
 * never loses more than the record in flight.
 */
@Slf4j
@Component
public class ExcelSpreadsheetStore implements SpreadsheetStore {

    private final Path file;
    private final String sheetName;
    private final int startRow;
    private final int emailColumn;
    private final int statusColumn;
    private final Set<Status> retryStatuses;

    private final DataFormatter formatter = new DataFormatter();

    @Autowired
    public ExcelSpreadsheetStore(ContactFinderProperties props) {
        this(Path.of(props.getSpreadsheet().getFile()),
                props.getSpreadsheet().getSheetName(),
                props.getSpreadsheet().getStartRow(),
                props.getSpreadsheet().getEmailColumn(),
                props.getSpreadsheet().getStatusColumn(),
                props.getProcessing().getRetryStatuses());
    }

    public ExcelSpreadsheetStore(Path file, String sheetName, int startRow, int emailColumn, int statusColumn,
                                 Set<Status> retryStatuses) {
        this.file = file;
        this.sheetName = sheetName;
        this.startRow = startRow;
        this.emailColumn = emailColumn;
        this.statusColumn = statusColumn;
        this.retryStatuses = retryStatuses == null || retryStatuses.isEmpty()
                ? EnumSet.noneOf(Status.class)
                : EnumSet.copyOf(retryStatuses);
    }

    @Override
    public List<EmailRecord> readPending() {
        return readPending(startRow, emailColumn, statusColumn);
    }

    @Override
    public synchronized List<EmailRecord> readPending(int startRow, int emailColumn, int statusColumn) {
        if (!Files.exists(file)) {
            createEmptyWorkbook();
            return List.of();
        }

        List<EmailRecord> pending = new ArrayList<>();
        int skipped = 0;

        try (Workbook wb = open()) {
            Sheet sheet = sheetOf(wb);
            if (repairHeaders(sheet)) save(wb);

            for (int r = startRow - 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;

                String email = text(row, emailColumn);
                if (!email.contains("@")) continue;

                Status status = Status.fromMarker(text(row, statusColumn));
                if (status == Status.PENDING || retryStatuses.contains(status)) {
                    pending.add(new EmailRecord(email, r + 1));
                } else {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read workbook " + file, e);
        }

        log.info("Spreadsheet: {} pending, {} already done in {}", pending.size(), skipped, file);
        return pending;
    }

    @Override
    public synchronized void writeResult(int row, Status status, ContactInfo info) {
        if (!Files.exists(file)) {
            createEmptyWorkbook();
        }

        try (Workbook wb = open()) {
            Sheet sheet = sheetOf(wb);
            repairHeaders(sheet);

            Row r = sheet.getRow(row - 1);
            if (r == null) r = sheet.createRow(row - 1);

            setText(r, statusColumn, status.marker());

            for (SpreadsheetColumns col : SpreadsheetColumns.dataColumns()) {
                String value = status == Status.SUCCESS ? col.valueOf(info) : null;
                setText(r, col.column(), value);
            }

            save(wb);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write row " + row + " of " + file, e);
        }
    }

    void createEmptyWorkbook() {
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet(sheetName);
            Row header = sheet.createRow(0);
            for (SpreadsheetColumns col : SpreadsheetColumns.values()) {
                header.createCell(col.column() - 1).setCellValue(col.header());
            }

            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            save(wb);
            log.info("Spreadsheet: created {} with header row", file);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create workbook " + file, e);
        }
    }

    /**
     * Rewrites header cells that differ from the fixed column layout. Skipped when data starts on row 1.
     *
     * @return true if any header cell changed
     */
    boolean repairHeaders(Sheet sheet) {
        if (startRow <= 1) return false;

        Row header = sheet.getRow(0);
        if (header == null) header = sheet.createRow(0);

        boolean changed = false;
        for (SpreadsheetColumns col : SpreadsheetColumns.values()) {
            String current = text(header, col.column());
            if (!col.header().equals(current)) {
                log.warn("Spreadsheet: header in column {} was '{}', setting '{}'", col.column(), current, col.header());
                setText(header, col.column(), col.header());
                changed = true;
            }
        }
        return changed;
    }

    private Workbook open() throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return new XSSFWorkbook(in);
        }
    }

    private void save(Workbook wb) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            wb.write(out);
        }
    }

    private Sheet sheetOf(Workbook wb) {
        Sheet sheet = sheetName == null ? null : wb.getSheet(sheetName);
        if (sheet != null) return sheet;
        if (wb.getNumberOfSheets() > 0) return wb.getSheetAt(0);
        return wb.createSheet(sheetName == null ? "Sheet1" : sheetName);
    }

    private String text(Row row, int column) {
        Cell cell = row.getCell(column - 1);
        if (cell == null) return "";
        return formatter.formatCellValue(cell).trim();
    }

    private static void setText(Row row, int column, String value) {
        if (value == null || value.isEmpty()) {
            Cell existing = row.getCell(column - 1);
            if (existing != null) row.removeCell(existing);
            return;
        }
        Cell cell = row.getCell(column - 1);
        if (cell == null) cell = row.createCell(column - 1);
        cell.setCellValue(value);
    }
}
