package com.example.dutyroster.people;

import com.example.dutyroster.common.ApiResponse;
import com.example.dutyroster.exception.BusinessException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

@RestController
@RequestMapping("/api/roster/people")
public class PersonnelController {

    private final PersonnelWorkbookImporter importer;

    public PersonnelController(PersonnelWorkbookImporter importer) {
        this.importer = importer;
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<PersonnelWorkbookImporter.PersonnelLists>> importPeople(
            @RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            throw new BusinessException(PersonnelWorkbookImporter.ERROR_CODE, "Uploaded file is empty");
        }
        try (InputStream input = file.getInputStream()) {
            PersonnelWorkbookImporter.PersonnelLists lists = importer.read(input);
            Map<String, Object> meta = Map.of(
                    "primaryCount", lists.primary().size(),
                    "secondaryCount", lists.secondary().size());
            return ResponseEntity.ok(ApiResponse.success("People imported", lists, meta));
        } catch (IOException e) {
            throw new BusinessException(PersonnelWorkbookImporter.ERROR_CODE, "Could not read upload", e);
        }
    }
}
