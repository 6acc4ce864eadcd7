package com.example.dutyroster.roster;

import com.example.dutyroster.common.ApiResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/roster")
public class RosterController {

    private static final Logger logger = LoggerFactory.getLogger(RosterController.class);

    private final RosterService rosterService;
    private final RosterWorkbookExporter workbookExporter;
    private final RosterCsvExporter csvExporter;

    public RosterController(RosterService rosterService, RosterWorkbookExporter workbookExporter,
                            RosterCsvExporter csvExporter) {
        this.rosterService = rosterService;
        this.workbookExporter = workbookExporter;
        this.csvExporter = csvExporter;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<RosterResponse>> generate(@Valid @RequestBody RosterRequest request) {
        RosterResult result = rosterService.generate(request.toInput(), request.seed());
        Map<String, Object> meta = new HashMap<>();
        meta.put("days", request.days());
        meta.put("rooms", request.rooms());
        meta.put("seed", result.seed());
        meta.put("violationCount", result.violations().size());
        String message = result.isClean()
                ? "Roster generated"
                : "Roster generated with " + result.violations().size() + " findings";
        return ResponseEntity.ok(ApiResponse.success(message, RosterResponse.from(result), meta));
    }

    @PostMapping("/export")
    public ResponseEntity<byte[]> export(@Valid @RequestBody RosterRequest request) {
        RosterResult result = rosterService.generate(request.toInput(), request.seed());
        RosterWorkbookExporter.WorkbookFile file = workbookExporter.export(result);
        logger.info("Exported roster {} ({} bytes)", file.filename(), file.data().length);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(MediaType.parseMediaType(RosterWorkbookExporter.CONTENT_TYPE))
                .body(file.data());
    }

    @PostMapping("/export/csv")
    public ResponseEntity<byte[]> exportCsv(@Valid @RequestBody RosterRequest request) {
        RosterResult result = rosterService.generate(request.toInput(), request.seed());
        RosterCsvExporter.CsvFile file = csvExporter.export(result);
        logger.info("Exported roster {} ({} bytes)", file.filename(), file.data().length);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(file.data());
    }
}
