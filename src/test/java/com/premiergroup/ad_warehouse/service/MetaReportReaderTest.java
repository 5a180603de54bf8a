package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.dto.AdPerformanceRecord;
import com.premiergroup.ad_warehouse.exception.ReportReadException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetaReportReaderTest {

    private final MetaReportReader reader = new MetaReportReader("Unknown");

    @Test
    void readsSpanishExport() throws Exception {
        List<AdPerformanceRecord> records;
        try (InputStream in = getClass().getResourceAsStream("/reports/meta_report_es.csv")) {
            records = reader.read(in);
        }

        // the all-blank line is skipped
        assertThat(records).hasSize(3);

        AdPerformanceRecord first = records.get(0);
        assertThat(first.getDate()).isEqualTo(LocalDate.of(2024, 3, 7));
        assertThat(first.getAccountId()).isEqualTo(1001L);
        assertThat(first.getAccountName()).isEqualTo("Tienda Sol");
        assertThat(first.getCampaignId()).isEqualTo(2001L);
        assertThat(first.getCampaignName()).isEqualTo("Primavera");
        assertThat(first.getObjective()).isEqualTo("Ventas");
        assertThat(first.getAdSetId()).isEqualTo(3001L);
        assertThat(first.getAdId()).isEqualTo(4001L);
        assertThat(first.getPlatform()).isEqualTo("Facebook");
        assertThat(first.getPosition()).isEqualTo("Feed");
        assertThat(first.getMeasures().getSpend()).isEqualByComparingTo("12.50");
        assertThat(first.getMeasures().getImpressions()).isEqualTo(1234);
        assertThat(first.getMeasures().getPurchaseValue()).isEqualByComparingTo("99.90");
        assertThat(first.getMeasures().getVideoPlays100Pct()).isEqualTo(25);
        assertThat(first.getMeasures().getResults()).isEqualTo(2);
        assertThat(first.getMeasures().getCostPerResult()).isEqualByComparingTo("6.25");

        AdPerformanceRecord second = records.get(1);
        assertThat(second.getDate()).isEqualTo(LocalDate.of(2024, 3, 7));
        assertThat(second.getPlatform()).isEqualTo("Unknown");
        assertThat(second.getDevice()).isEqualTo("Unknown");
        assertThat(second.getPosition()).isEqualTo("Unknown");
        assertThat(second.getMeasures().getCostPerResult()).isEqualByComparingTo(BigDecimal.ZERO);

        assertThat(records.get(2).getDate()).isNull();
    }

    @Test
    void readsEnglishHeaders() throws Exception {
        String csv = """
                Day,Account ID,Account name,Campaign ID,Campaign name,Ad set ID,Ad set name,Ad ID,Ad name,Age,Gender,Amount spent (EUR),Impressions,Results,Cost per result
                2024-03-08,1,Acme,2,Launch,3,Broad,4,Hero video,18-24,male,20.00,400,4,5.00
                """;

        List<AdPerformanceRecord> records = reader.read(stream(csv));

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.getDate()).isEqualTo(LocalDate.of(2024, 3, 8));
            assertThat(record.getAdName()).isEqualTo("Hero video");
            assertThat(record.getAgeBracket()).isEqualTo("18-24");
            assertThat(record.getMeasures().getResults()).isEqualTo(4);
            assertThat(record.getMeasures().getCostPerResult()).isEqualByComparingTo("5.00");
            assertThat(record.getMeasures().getPurchases()).isNull();
        });
    }

    @Test
    void unparseableCellsAreLeftNull() throws Exception {
        String csv = """
                Day,Account ID,Campaign ID,Ad set ID,Ad ID,Impressions
                31/02/2024,abc,2,3,4,12.5
                """;

        AdPerformanceRecord record = reader.read(stream(csv)).get(0);

        assertThat(record.getDate()).isNull();
        assertThat(record.getAccountId()).isNull();
        assertThat(record.getMeasures().getImpressions()).isNull();
        assertThat(record.getMeasures().getSpend()).isNull();
    }

    @Test
    void missingKeyColumnsFailTheWholeReport() {
        assertThatThrownBy(() -> {
            try (InputStream in = getClass().getResourceAsStream("/reports/meta_report_missing_ids.csv")) {
                reader.read(in);
            }
        })
                .isInstanceOf(ReportReadException.class)
                .hasMessageContaining("accountId")
                .hasMessageContaining("adId");
    }

    @Test
    void emptyReportIsRejected() {
        assertThatThrownBy(() -> reader.read(stream("")))
                .isInstanceOf(ReportReadException.class)
                .hasMessageContaining("no header");
    }

    @Test
    void headersAreNormalized() {
        assertThat(MetaReportReader.normalizeHeader("Importe gastado (EUR)")).isEqualTo("importe gastado eur");
        assertThat(MetaReportReader.normalizeHeader("\uFEFFDía")).isEqualTo("dia");
        assertThat(MetaReportReader.normalizeHeader("Reproducciones de video hasta el 25%"))
                .isEqualTo("reproducciones de video hasta el 25");
    }

    @Test
    void numbersAcceptSpanishAndPlainFormats() {
        assertThat(MetaReportReader.parseDecimal("1.234,56")).isEqualByComparingTo("1234.56");
        assertThat(MetaReportReader.parseDecimal("€ 12,5")).isEqualByComparingTo("12.5");
        assertThat(MetaReportReader.parseDecimal("12.50")).isEqualByComparingTo("12.50");
        assertThat(MetaReportReader.parseDecimal("n/a")).isNull();
        assertThat(MetaReportReader.parseInteger("1.234")).isEqualTo(1234);
        assertThat(MetaReportReader.parseInteger("1.234.567")).isEqualTo(1234567);
        assertThat(MetaReportReader.parseInteger("42")).isEqualTo(42);
    }

    @Test
    void numbersAcceptEnglishGrouping() {
        assertThat(MetaReportReader.parseDecimal("1,234.56")).isEqualByComparingTo("1234.56");
        assertThat(MetaReportReader.parseDecimal("$1,234,567.8")).isEqualByComparingTo("1234567.8");
        assertThat(MetaReportReader.parseDecimal("1,234,567")).isEqualByComparingTo("1234567");
        assertThat(MetaReportReader.parseDecimal("1.234.567")).isEqualByComparingTo("1234567");
        assertThat(MetaReportReader.parseInteger("1,234")).isEqualTo(1234);
        assertThat(MetaReportReader.parseInteger("12,345,678")).isEqualTo(12345678);
    }

    @Test
    void ambiguousOrMalformedNumbersAreRejected() {
        // thousands in English, three decimals in Spanish
        assertThat(MetaReportReader.parseDecimal("1,234")).isNull();
        assertThat(MetaReportReader.parseDecimal("1,23,4")).isNull();
        assertThat(MetaReportReader.parseDecimal("1.234,5.6")).isNull();
        assertThat(MetaReportReader.parseInteger("1.23")).isNull();
    }

    @Test
    void englishReportWithGroupedSpendKeepsItsValue() throws Exception {
        String csv = """
                Day,Account ID,Campaign ID,Ad set ID,Ad ID,Amount spent (EUR),Impressions
                2024-03-08,1,2,3,4,"1,234.56","12,345"
                """;

        AdPerformanceRecord record = reader.read(stream(csv)).get(0);

        assertThat(record.getMeasures().getSpend()).isEqualByComparingTo("1234.56");
        assertThat(record.getMeasures().getImpressions()).isEqualTo(12345);
    }

    @Test
    void datesAcceptIsoAndDayMonthYear() {
        assertThat(MetaReportReader.parseDate("2024-03-07")).isEqualTo(LocalDate.of(2024, 3, 7));
        assertThat(MetaReportReader.parseDate("7/3/2024")).isEqualTo(LocalDate.of(2024, 3, 7));
        assertThat(MetaReportReader.parseDate("07/03/24")).isEqualTo(LocalDate.of(2024, 3, 7));
        assertThat(MetaReportReader.parseDate("March 7")).isNull();
    }

    private static InputStream stream(String csv) {
        return new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8));
    }
}
