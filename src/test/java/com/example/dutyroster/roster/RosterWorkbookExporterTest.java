package com.example.dutyroster.roster;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RosterWorkbookExporterTest {

    private final RosterWorkbookExporter exporter = new RosterWorkbookExporter();

    @Test
    void export_writesRosterSheetWithMergedRoomLabelsAndCountsSheet() throws Exception {
        RosterResult result = new RosterResult(
                RosterConfiguration.resolve(3, 3, 2, 2, RosterPolicy.DEFAULT),
                3L,
                List.of(
                        new SlotAssignmentDto(1, 1, "Ada", "Dee"),
                        new SlotAssignmentDto(1, 2, "Ben", "Eli"),
                        new SlotAssignmentDto(2, 1, "Cal", "Fay"),
                        new SlotAssignmentDto(2, 2, "Ada", "Ben")),
                List.of(new DutyCountDto("Ada", 2), new DutyCountDto("Ben", 2), new DutyCountDto("Cal", 1)),
                List.of(new DutyCountDto("Dee", 1), new DutyCountDto("Eli", 1), new DutyCountDto("Fay", 1)),
                List.of(),
                List.of());

        RosterWorkbookExporter.WorkbookFile file = exporter.export(result);

        assertThat(file.filename()).isEqualTo("duty-roster-2d-2r.xlsx");
        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(file.data()))) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(2);

            Sheet roster = workbook.getSheet(RosterWorkbookExporter.ROSTER_SHEET);
            assertThat(text(roster, 0, 1)).isEqualTo("Day 1");
            assertThat(text(roster, 0, 2)).isEqualTo("Day 2");
            assertThat(text(roster, 1, 0)).isEqualTo("Room 1");
            assertThat(text(roster, 3, 0)).isEqualTo("Room 2");
            assertThat(text(roster, 1, 1)).isEqualTo("Ada");
            assertThat(text(roster, 2, 1)).isEqualTo("Dee");
            assertThat(text(roster, 3, 2)).isEqualTo("Ada");
            assertThat(text(roster, 4, 2)).isEqualTo("Ben");
            assertThat(roster.getMergedRegions()).containsExactlyInAnyOrder(
                    new CellRangeAddress(1, 2, 0, 0),
                    new CellRangeAddress(3, 4, 0, 0));

            Sheet counts = workbook.getSheet(RosterWorkbookExporter.COUNTS_SHEET);
            assertThat(text(counts, 0, 0)).isEqualTo("Primary Duties");
            assertThat(text(counts, 1, 1)).isEqualTo("Count");
            assertThat(text(counts, 2, 0)).isEqualTo("Ada");
            assertThat(counts.getRow(2).getCell(1).getNumericCellValue()).isEqualTo(2.0);
            assertThat(text(counts, 6, 0)).isEqualTo("Secondary Duties");
            assertThat(text(counts, 10, 0)).isEqualTo("Fay");
        }
    }

    @Test
    void export_leavesEmptyPositionsBlank() throws Exception {
        RosterResult result = new RosterResult(
                RosterConfiguration.resolve(2, 2, 1, 1, RosterPolicy.DEFAULT),
                0L,
                List.of(new SlotAssignmentDto(1, 1, "Ada", null)),
                List.of(),
                List.of(),
                List.of(),
                List.of());

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(exporter.export(result).data()))) {
            Sheet roster = workbook.getSheet(RosterWorkbookExporter.ROSTER_SHEET);
            assertThat(text(roster, 1, 1)).isEqualTo("Ada");
            assertThat(text(roster, 2, 1)).isEmpty();
        }
    }

    private static String text(Sheet sheet, int row, int column) {
        return sheet.getRow(row).getCell(column).getStringCellValue();
    }
}
