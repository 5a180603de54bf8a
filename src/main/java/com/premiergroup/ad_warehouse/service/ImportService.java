package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.dto.AdPerformanceRecord;
import com.premiergroup.ad_warehouse.dto.ImportSummary;
import com.premiergroup.ad_warehouse.entity.ImportHistory;
import com.premiergroup.ad_warehouse.exception.ReportReadException;
import com.premiergroup.ad_warehouse.exception.WarehouseUnavailableException;
import com.premiergroup.ad_warehouse.repository.ImportHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Log4j2
@RequiredArgsConstructor
public class ImportService {

    private final DataSource dataSource;
    private final MetaReportReader reportReader;
    private final RecordProcessor recordProcessor;
    private final ImportHistoryRepository importHistoryRepository;

    @Value("${warehouse.import.source:meta-csv}")
    private String defaultSource;

    @Value("${warehouse.import.connection-check-timeout-seconds:5}")
    private int connectionCheckTimeoutSeconds;

    /**
     * Loads a whole report. The connection is checked and the report fully read
     * before the first record is touched; either failing aborts the run.
     */
    public ImportSummary importReport(InputStream report, String fileName, String source) throws ReportReadException {
        String importSource = source == null || source.isBlank() ? defaultSource : source;
        log.info("Starting {} import of {}", importSource, fileName);

        verifyConnection();
        List<AdPerformanceRecord> records = reportReader.read(report);
        ImportSummary summary = recordProcessor.processAll(records);

        recordHistory(importSource, fileName, summary);
        log.info("Finished {} import of {}: {} of {} records loaded",
                importSource, fileName, summary.succeeded(), summary.total());
        return summary;
    }

    public List<ImportHistory> history() {
        return importHistoryRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    void verifyConnection() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(connectionCheckTimeoutSeconds)) {
                throw new WarehouseUnavailableException("Warehouse connection failed validation");
            }
        } catch (SQLException e) {
            log.error("Cannot connect to the warehouse", e);
            throw new WarehouseUnavailableException("Cannot connect to the warehouse: " + e.getMessage(), e);
        }
    }

    private void recordHistory(String source, String fileName, ImportSummary summary) {
        try {
            importHistoryRepository.save(ImportHistory.builder()
                    .source(source)
                    .fileName(fileName)
                    .recordsTotal(summary.total())
                    .recordsSucceeded(summary.succeeded())
                    .recordsFailed(summary.failed())
                    .createdAt(LocalDateTime.now())
                    .build());
        } catch (DataAccessException e) {
            // records are already committed, the summary is still returned
            log.error("Could not record import history for {}", fileName, e);
        }
    }
}
