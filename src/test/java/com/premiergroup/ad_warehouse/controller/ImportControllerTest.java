package com.premiergroup.ad_warehouse.controller;

import com.premiergroup.ad_warehouse.dto.ImportFailure;
import com.premiergroup.ad_warehouse.dto.ImportSummary;
import com.premiergroup.ad_warehouse.entity.ImportHistory;
import com.premiergroup.ad_warehouse.enums.Dimension;
import com.premiergroup.ad_warehouse.enums.RecordStage;
import com.premiergroup.ad_warehouse.exception.ReportReadException;
import com.premiergroup.ad_warehouse.exception.WarehouseUnavailableException;
import com.premiergroup.ad_warehouse.service.ImportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ImportController.class)
class ImportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ImportService importService;

    private final MockMultipartFile report =
            new MockMultipartFile("file", "march.csv", "text/csv", "Day,Ad ID\n2024-03-07,1\n".getBytes());

    @Test
    void importReturnsSummary() throws Exception {
        ImportSummary summary = new ImportSummary(2, 1, 1, List.of(
                new ImportFailure(2, RecordStage.RESOLVING, Dimension.CAMPAIGN, "campaign name missing")));
        when(importService.importReport(any(), eq("march.csv"), isNull())).thenReturn(summary);

        mockMvc.perform(multipart("/api/imports").file(report))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.succeeded").value(1))
                .andExpect(jsonPath("$.failures[0].position").value(2))
                .andExpect(jsonPath("$.failures[0].failedAt").value("RESOLVING"))
                .andExpect(jsonPath("$.failures[0].dimension").value("CAMPAIGN"));
    }

    @Test
    void unreadableReportIsBadRequest() throws Exception {
        when(importService.importReport(any(), any(), any()))
                .thenThrow(new ReportReadException("Report is missing required columns: [adId]"));

        mockMvc.perform(multipart("/api/imports").file(report))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("REPORT_UNREADABLE"))
                .andExpect(jsonPath("$.message").value("Report is missing required columns: [adId]"));
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]);

        mockMvc.perform(multipart("/api/imports").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));

        verifyNoInteractions(importService);
    }

    @Test
    void unavailableWarehouseIsServiceUnavailable() throws Exception {
        when(importService.importReport(any(), any(), any()))
                .thenThrow(new WarehouseUnavailableException("Cannot open a transaction for record 1"));

        mockMvc.perform(multipart("/api/imports").file(report).param("source", "manual"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("WAREHOUSE_UNAVAILABLE"));
    }

    @Test
    void emptyHistoryIsNoContent() throws Exception {
        when(importService.history()).thenReturn(List.of());

        mockMvc.perform(get("/api/imports/history"))
                .andExpect(status().isNoContent());
    }

    @Test
    void historyIsListed() throws Exception {
        when(importService.history()).thenReturn(List.of(ImportHistory.builder()
                .id(1)
                .source("meta-csv")
                .fileName("march.csv")
                .recordsTotal(3)
                .recordsSucceeded(2)
                .recordsFailed(1)
                .createdAt(LocalDateTime.of(2024, 3, 8, 9, 0))
                .build()));

        mockMvc.perform(get("/api/imports/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].fileName").value("march.csv"))
                .andExpect(jsonPath("$[0].recordsFailed").value(1));
    }

    @Test
    void uploadUiOriginIsAllowed() throws Exception {
        mockMvc.perform(options("/api/imports")
                        .header("Origin", "http://localhost:4200")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:4200"));
    }
}
