package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.dto.AdPerformanceRecord;
import com.premiergroup.ad_warehouse.dto.DimensionKeySet;
import com.premiergroup.ad_warehouse.dto.ImportSummary;
import com.premiergroup.ad_warehouse.dto.MetricMeasures;
import com.premiergroup.ad_warehouse.enums.Dimension;
import com.premiergroup.ad_warehouse.enums.RecordStage;
import com.premiergroup.ad_warehouse.exception.DimensionResolutionException;
import com.premiergroup.ad_warehouse.exception.FactReplacementException;
import com.premiergroup.ad_warehouse.exception.WarehouseUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecordProcessorTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private DimensionResolver dimensionResolver;

    @Mock
    private FactReplacer factReplacer;

    private RecordProcessor recordProcessor;

    private final DimensionKeySet keys = new DimensionKeySet(20240307, 1, 2, 3, 5, 2, 3);

    @BeforeEach
    void setUp() {
        recordProcessor = new RecordProcessor(new TransactionTemplate(transactionManager), dimensionResolver, factReplacer);
    }

    @Test
    void eachRecordCommitsInItsOwnTransaction() {
        AdPerformanceRecord first = record(4001L);
        AdPerformanceRecord second = record(4002L);
        when(dimensionResolver.resolve(any())).thenReturn(keys);

        ImportSummary summary = recordProcessor.processAll(List.of(first, second));

        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failures()).isEmpty();
        InOrder inOrder = inOrder(transactionManager, dimensionResolver, factReplacer);
        inOrder.verify(transactionManager).getTransaction(any());
        inOrder.verify(dimensionResolver).resolve(first);
        inOrder.verify(factReplacer).replace(keys, first.getMeasures());
        inOrder.verify(transactionManager).commit(any());
        inOrder.verify(transactionManager).getTransaction(any());
        inOrder.verify(dimensionResolver).resolve(second);
        inOrder.verify(factReplacer).replace(keys, second.getMeasures());
        inOrder.verify(transactionManager).commit(any());
    }

    @Test
    void resolutionFailureRollsBackAndContinues() {
        AdPerformanceRecord broken = record(4001L);
        AdPerformanceRecord fine = record(4002L);
        when(dimensionResolver.resolve(broken))
                .thenThrow(new DimensionResolutionException(Dimension.AD_SET, 3001L, "boom"));
        when(dimensionResolver.resolve(fine)).thenReturn(keys);

        ImportSummary summary = recordProcessor.processAll(List.of(broken, fine));

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.failures().get(0).position()).isEqualTo(1);
        assertThat(summary.failures().get(0).failedAt()).isEqualTo(RecordStage.RESOLVING);
        assertThat(summary.failures().get(0).dimension()).isEqualTo(Dimension.AD_SET);
        verify(transactionManager).rollback(any());
        verify(transactionManager).commit(any());
        verify(factReplacer, times(1)).replace(any(), any());
    }

    @Test
    void replacementFailureIsReportedAtReplacingStage() {
        AdPerformanceRecord record = record(4001L);
        when(dimensionResolver.resolve(record)).thenReturn(keys);
        doThrow(new FactReplacementException(keys, "insert failed"))
                .when(factReplacer).replace(keys, record.getMeasures());

        ImportSummary summary = recordProcessor.processAll(List.of(record));

        assertThat(summary.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.failedAt()).isEqualTo(RecordStage.REPLACING);
            assertThat(failure.dimension()).isNull();
            assertThat(failure.cause()).contains("insert failed");
        });
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void unexpectedRuntimeErrorIsStillRecordLevel() {
        AdPerformanceRecord record = record(4001L);
        AdPerformanceRecord next = record(4002L);
        when(dimensionResolver.resolve(record)).thenThrow(new IllegalStateException("unexpected"));
        when(dimensionResolver.resolve(next)).thenReturn(keys);

        ImportSummary summary = recordProcessor.processAll(List.of(record, next));

        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
    }

    @Test
    void losingTheConnectionAbortsTheRun() {
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("connection refused"));

        assertThatThrownBy(() -> recordProcessor.processAll(List.of(record(4001L), record(4002L))))
                .isInstanceOf(WarehouseUnavailableException.class)
                .hasMessageContaining("record 1");

        verifyNoInteractions(dimensionResolver, factReplacer);
    }

    @Test
    void emptyInputYieldsEmptySummary() {
        ImportSummary summary = recordProcessor.processAll(List.of());

        assertThat(summary.total()).isZero();
        assertThat(summary.failures()).isEmpty();
        verifyNoInteractions(transactionManager);
    }

    private static AdPerformanceRecord record(Long adId) {
        return AdPerformanceRecord.builder()
                .adId(adId)
                .measures(MetricMeasures.builder().spend(BigDecimal.TEN).impressions(100).build())
                .build();
    }
}
