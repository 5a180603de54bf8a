package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.dto.AdPerformanceRecord;
import com.premiergroup.ad_warehouse.dto.DimensionKeySet;
import com.premiergroup.ad_warehouse.dto.ImportFailure;
import com.premiergroup.ad_warehouse.dto.ImportSummary;
import com.premiergroup.ad_warehouse.enums.RecordStage;
import com.premiergroup.ad_warehouse.exception.WarehouseUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads records one at a time, in input order, each in its own transaction.
 * A failing record is rolled back and reported; it never stops the run.
 * Only losing the connection to the warehouse does.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class RecordProcessor {

    private final TransactionTemplate transactionTemplate;
    private final DimensionResolver dimensionResolver;
    private final FactReplacer factReplacer;

    public ImportSummary processAll(List<AdPerformanceRecord> records) {
        List<ImportFailure> failures = new ArrayList<>();
        int succeeded = 0;
        int position = 0;

        for (AdPerformanceRecord record : records) {
            position++;
            AtomicReference<RecordStage> stage = new AtomicReference<>(RecordStage.PENDING);
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    stage.set(RecordStage.RESOLVING);
                    DimensionKeySet keys = dimensionResolver.resolve(record);
                    stage.set(RecordStage.REPLACING);
                    factReplacer.replace(keys, record.getMeasures());
                });
                stage.set(RecordStage.COMMITTED);
                succeeded++;
            } catch (CannotCreateTransactionException e) {
                log.error("Lost the warehouse connection at record {}, aborting run", position, e);
                throw new WarehouseUnavailableException("Cannot open a transaction for record " + position, e);
            } catch (RuntimeException e) {
                RecordStage failedAt = stage.getAndSet(RecordStage.ROLLED_BACK);
                failures.add(ImportFailure.of(position, failedAt, e));
                log.warn("Record {} rolled back while {}: {}", position, failedAt, e.getMessage());
            }
        }

        ImportSummary summary = new ImportSummary(records.size(), succeeded, failures.size(), List.copyOf(failures));
        log.info("Processed {} records: {} succeeded, {} failed",
                summary.total(), summary.succeeded(), summary.failed());
        return summary;
    }
}
