package com.example.dutyroster.people;

import com.example.dutyroster.exception.BusinessException;
import org.apache.poi.EmptyFileException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the two ordered name lists from the first sheet of a workbook (.xlsx or .xls). The
 * first row names the columns; row order is seniority order.
 */
@Component
public class PersonnelWorkbookImporter {

    public static final String ERROR_CODE = "IMPORT_ERROR";

    private static final Logger logger = LoggerFactory.getLogger(PersonnelWorkbookImporter.class);
    private static final Set<String> PRIMARY_HEADERS = Set.of("primary", "faculty");
    private static final Set<String> SECONDARY_HEADERS = Set.of("secondary", "staff");

    private final DataFormatter formatter = new DataFormatter();

    public PersonnelLists read(InputStream input) {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                throw new BusinessException(ERROR_CODE, "Sheet is empty");
            }
            int primaryColumn = findColumn(header, PRIMARY_HEADERS);
            int secondaryColumn = findColumn(header, SECONDARY_HEADERS);
            if (primaryColumn < 0 && secondaryColumn < 0) {
                throw new BusinessException(ERROR_CODE,
                        "Header must contain a Primary/Faculty or Secondary/Staff column");
            }

            List<String> primary = new ArrayList<>();
            List<String> secondary = new ArrayList<>();
            for (int i = header.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }
                addCell(row, primaryColumn, primary);
                addCell(row, secondaryColumn, secondary);
            }
            if (primary.isEmpty() && secondary.isEmpty()) {
                throw new BusinessException(ERROR_CODE, "No names found in sheet " + sheet.getSheetName());
            }
            logger.info("Imported {} primary and {} secondary names", primary.size(), secondary.size());
            return new PersonnelLists(primary, secondary);
        } catch (IOException | EmptyFileException e) {
            throw new BusinessException(ERROR_CODE, "Could not read workbook: " + e.getMessage(), e);
        }
    }

    private int findColumn(Row header, Set<String> accepted) {
        for (Cell cell : header) {
            if (accepted.contains(text(cell).toLowerCase(Locale.ROOT))) {
                return cell.getColumnIndex();
            }
        }
        return -1;
    }

    private void addCell(Row row, int column, List<String> target) {
        if (column < 0) {
            return;
        }
        String value = text(row.getCell(column));
        if (!value.isEmpty()) {
            target.add(value);
        }
    }

    private String text(Cell cell) {
        return cell == null ? "" : formatter.formatCellValue(cell).trim();
    }

    public record PersonnelLists(List<String> primary, List<String> secondary) { }
}
