package com.example.dutyroster.roster;

import com.example.dutyroster.exception.BusinessException;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a roster as an .xlsx workbook. The first sheet has a header row of day labels and two
 * rows per room (primary, then secondary) with the room label merged over both rows; the second
 * sheet lists duty counts per population.
 */
@Component
public class RosterWorkbookExporter {

    public static final String ROSTER_SHEET = "Duty Roster";
    public static final String COUNTS_SHEET = "Duty Counts";
    public static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    public WorkbookFile export(RosterResult result) {
        RosterConfiguration config = result.configuration();
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            writeRosterSheet(workbook, result, config.getDays(), config.getRooms());
            writeCountsSheet(workbook, result);
            workbook.write(out);
            String filename = String.format("duty-roster-%dd-%dr.xlsx", config.getDays(), config.getRooms());
            return new WorkbookFile(filename, out.toByteArray());
        } catch (IOException e) {
            throw new BusinessException("EXPORT_ERROR", "Could not write roster workbook", e);
        }
    }

    private void writeRosterSheet(Workbook workbook, RosterResult result, int days, int rooms) {
        Sheet sheet = workbook.createSheet(ROSTER_SHEET);
        CellStyle bordered = borderedStyle(workbook);
        CellStyle label = borderedStyle(workbook);
        label.setVerticalAlignment(VerticalAlignment.CENTER);
        label.setAlignment(HorizontalAlignment.CENTER);

        Map<String, SlotAssignmentDto> byPosition = new HashMap<>();
        result.slots().forEach(s -> byPosition.put(s.day() + ":" + s.room(), s));

        Row header = sheet.createRow(0);
        cell(header, 0, "Day/Room", label);
        for (int day = 1; day <= days; day++) {
            cell(header, day, "Day " + day, label);
        }

        for (int room = 1; room <= rooms; room++) {
            int first = 1 + (room - 1) * 2;
            Row primaryRow = sheet.createRow(first);
            Row secondaryRow = sheet.createRow(first + 1);
            cell(primaryRow, 0, "Room " + room, label);
            cell(secondaryRow, 0, null, label);
            sheet.addMergedRegion(new CellRangeAddress(first, first + 1, 0, 0));
            for (int day = 1; day <= days; day++) {
                SlotAssignmentDto slot = byPosition.get(day + ":" + room);
                cell(primaryRow, day, slot == null ? null : slot.primaryPerson(), bordered);
                cell(secondaryRow, day, slot == null ? null : slot.secondaryPerson(), bordered);
            }
        }

        sheet.setColumnWidth(0, 14 * 256);
        for (int day = 1; day <= days; day++) {
            sheet.setColumnWidth(day, 16 * 256);
        }
    }

    private void writeCountsSheet(Workbook workbook, RosterResult result) {
        Sheet sheet = workbook.createSheet(COUNTS_SHEET);
        int next = writeDuties(sheet, 0, "Primary Duties", result.primaryDuties());
        writeDuties(sheet, next + 1, "Secondary Duties", result.secondaryDuties());
        sheet.setColumnWidth(0, 20 * 256);
    }

    /** @return the first row index after the section */
    private int writeDuties(Sheet sheet, int start, String title, List<DutyCountDto> duties) {
        int rowIndex = start;
        sheet.createRow(rowIndex++).createCell(0).setCellValue(title);
        Row columns = sheet.createRow(rowIndex++);
        columns.createCell(0).setCellValue("Name");
        columns.createCell(1).setCellValue("Count");
        for (DutyCountDto duty : duties) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(duty.name());
            row.createCell(1).setCellValue(duty.dutyCount());
        }
        return rowIndex;
    }

    private static void cell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        if (value != null) {
            cell.setCellValue(value);
        }
        cell.setCellStyle(style);
    }

    private static CellStyle borderedStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        return style;
    }

    public record WorkbookFile(String filename, byte[] data) { }
}
