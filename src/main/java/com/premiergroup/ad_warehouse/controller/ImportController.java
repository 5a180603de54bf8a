package com.premiergroup.ad_warehouse.controller;

import com.premiergroup.ad_warehouse.dto.ImportSummary;
import com.premiergroup.ad_warehouse.entity.ImportHistory;
import com.premiergroup.ad_warehouse.exception.ReportReadException;
import com.premiergroup.ad_warehouse.service.ImportService;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
@Validated
@Log4j2
public class ImportController {

    private final ImportService importService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportSummary> importReport(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) @Size(max = 50) String source
    ) throws ReportReadException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded report is empty");
        }
        try (InputStream in = file.getInputStream()) {
            return ResponseEntity.ok(importService.importReport(in, file.getOriginalFilename(), source));
        } catch (IOException e) {
            throw new ReportReadException("Cannot read uploaded report " + file.getOriginalFilename(), e);
        }
    }

    @GetMapping("/history")
    public ResponseEntity<List<ImportHistory>> getHistory() {
        List<ImportHistory> history = importService.history();
        if (history.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(history);
    }
}
