package com.premiergroup.ad_warehouse.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.premiergroup.ad_warehouse.dto.AdPerformanceRecord;
import com.premiergroup.ad_warehouse.dto.MetricMeasures;
import com.premiergroup.ad_warehouse.exception.ReportReadException;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a Meta Ads performance export (CSV, Spanish or English headers) into records.
 * <p>
 * Cells that cannot be parsed are left null so the loader rejects that record alone;
 * only an unreadable file or a missing key column fails the whole report.
 */
@Component
@Log4j2
public class MetaReportReader {

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern DMY_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{2,4})$");
    private static final Pattern GROUPED_INTEGER = Pattern.compile("^-?\\d{1,3}([.,])\\d{3}(?:\\1\\d{3})*$");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern COMMA_DECIMAL = Pattern.compile("^-?\\d+,\\d+$");
    private static final Pattern COMMA_THOUSANDS_ONLY = Pattern.compile("^-?\\d{1,3},\\d{3}$");
    private static final Pattern ENGLISH_GROUPED = Pattern.compile("^-?\\d{1,3}(,\\d{3})+(\\.\\d+)?$");
    private static final Pattern SPANISH_GROUPED = Pattern.compile("^-?\\d{1,3}(\\.\\d{3})+(,\\d+)?$");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private static final Map<String, String> HEADER_MAPPING = new HashMap<>();

    static {
        map("date", "dia", "day", "date", "fecha");
        map("accountId", "identificador de la cuenta", "account id");
        map("accountName", "nombre de la cuenta", "account name");
        map("campaignId", "identificador de la campana", "campaign id");
        map("campaignName", "nombre de la campana", "campaign name");
        map("objective", "objetivo", "objective");
        map("adSetId", "identificador del conjunto de anuncios", "ad set id");
        map("adSetName", "nombre del conjunto de anuncios", "ad set name");
        map("adId", "identificador del anuncio", "ad id");
        map("adName", "nombre del anuncio", "ad name");
        map("adBody", "cuerpo del anuncio", "body", "ad body");
        map("adThumbnailUrl", "url de la miniatura del anuncio", "ad thumbnail url", "thumbnail url");
        map("permanentLink", "enlace permanente", "permalink", "permanent link");
        map("ageBracket", "edad", "age");
        map("gender", "sexo", "gender");
        map("platform", "plataforma", "platform");
        map("device", "dispositivo", "device", "impression device");
        map("position", "ubicacion", "placement", "position");
        map("spend", "importe gastado eur", "amount spent eur", "spend");
        map("impressions", "impresiones", "impressions");
        map("reach", "alcance", "reach");
        map("clicks", "clics todos", "clicks all", "clicks");
        map("purchases", "compras", "purchases");
        map("purchaseValue", "valor de conversion de compras", "purchases conversion value");
        map("videoPlays25Pct", "reproducciones de video hasta el 25", "video plays at 25");
        map("videoPlays50Pct", "reproducciones de video hasta el 50", "video plays at 50");
        map("videoPlays75Pct", "reproducciones de video hasta el 75", "video plays at 75");
        map("videoPlays95Pct", "reproducciones de video hasta el 95", "video plays at 95");
        map("videoPlays100Pct", "reproducciones de video hasta el 100", "video plays at 100");
        map("results", "resultados", "results");
        map("costPerResult", "costo por resultado", "coste por resultado", "cost per result");
    }

    private static final List<String> REQUIRED_FIELDS = List.of("date", "accountId", "campaignId", "adSetId", "adId");

    private final String unknownLabel;

    public MetaReportReader(@Value("${warehouse.import.unknown-label:Unknown}") String unknownLabel) {
        this.unknownLabel = unknownLabel;
    }

    public List<AdPerformanceRecord> read(InputStream csvStream) throws ReportReadException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8));
             CSVReader csvReader = new CSVReader(reader)) {

            String[] header = csvReader.readNext();
            if (header == null) {
                throw new ReportReadException("Empty report: no header row found");
            }
            Map<String, Integer> columns = mapHeader(header);
            List<String> missing = REQUIRED_FIELDS.stream().filter(f -> !columns.containsKey(f)).toList();
            if (!missing.isEmpty()) {
                throw new ReportReadException("Report is missing required columns: " + missing);
            }

            List<AdPerformanceRecord> records = new ArrayList<>();
            String[] row;
            while ((row = csvReader.readNext()) != null) {
                if (isBlank(row)) {
                    continue;
                }
                records.add(toRecord(new Row(row, columns)));
            }
            log.info("Read {} records from report", records.size());
            return records;
        } catch (IOException | CsvValidationException e) {
            throw new ReportReadException("Cannot read report: " + e.getMessage(), e);
        }
    }

    static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String stripped = DIACRITICS.matcher(Normalizer.normalize(header.replace("\uFEFF", ""), Normalizer.Form.NFD))
                .replaceAll("");
        return stripped.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", " ")
                .trim();
    }

    static BigDecimal parseDecimal(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("[\\s\\u20AC$%]", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        String canonical = canonicalDecimal(cleaned);
        if (canonical == null) {
            log.debug("Unparseable or ambiguous number '{}'", raw);
            return null;
        }
        return new BigDecimal(canonical);
    }

    static Integer parseInteger(String raw) {
        if (raw != null && GROUPED_INTEGER.matcher(raw.trim()).matches()) {
            raw = raw.trim().replaceAll("[.,]", "");
        }
        BigDecimal value = parseDecimal(raw);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            log.debug("Not an integer count '{}'", raw);
            return null;
        }
    }

    // 1234.56, 1,234.56, 1.234,56 and 12,5; a lone "1,234" could be either and is rejected
    private static String canonicalDecimal(String value) {
        if (PLAIN_DECIMAL.matcher(value).matches()) {
            return value;
        }
        if (COMMA_THOUSANDS_ONLY.matcher(value).matches()) {
            return null;
        }
        if (COMMA_DECIMAL.matcher(value).matches()) {
            return value.replace(',', '.');
        }
        if (ENGLISH_GROUPED.matcher(value).matches()) {
            return value.replace(",", "");
        }
        if (SPANISH_GROUPED.matcher(value).matches()) {
            return value.replace(".", "").replace(',', '.');
        }
        return null;
    }

    static Long parseId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.debug("Unparseable id '{}'", raw);
            return null;
        }
    }

    static LocalDate parseDate(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        try {
            Matcher iso = ISO_DATE.matcher(value);
            if (iso.matches()) {
                return LocalDate.of(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)),
                        Integer.parseInt(iso.group(3)));
            }
            Matcher dmy = DMY_DATE.matcher(value);
            if (dmy.matches()) {
                String year = dmy.group(3);
                if (year.length() == 2) {
                    year = "20" + year;
                }
                return LocalDate.of(Integer.parseInt(year), Integer.parseInt(dmy.group(2)),
                        Integer.parseInt(dmy.group(1)));
            }
        } catch (DateTimeException e) {
            log.debug("Invalid calendar date '{}'", raw);
        }
        return null;
    }

    private static void map(String field, String... headers) {
        for (String header : headers) {
            HEADER_MAPPING.put(header, field);
        }
    }

    private static Map<String, Integer> mapHeader(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String field = HEADER_MAPPING.get(normalizeHeader(header[i]));
            if (field != null) {
                // first occurrence wins when an export repeats a column
                columns.putIfAbsent(field, i);
            }
        }
        return columns;
    }

    private static boolean isBlank(String[] row) {
        return Arrays.stream(row).allMatch(cell -> cell == null || cell.isBlank());
    }

    private AdPerformanceRecord toRecord(Row row) {
        BigDecimal spend = parseDecimal(row.get("spend"));
        Integer purchases = parseInteger(row.get("purchases"));
        Integer results = row.has("results") ? parseInteger(row.get("results")) : purchases;
        BigDecimal costPerResult = row.has("costPerResult")
                ? parseDecimal(row.get("costPerResult"))
                : costPerResult(spend, results);

        MetricMeasures measures = MetricMeasures.builder()
                .spend(spend)
                .impressions(parseInteger(row.get("impressions")))
                .reach(parseInteger(row.get("reach")))
                .clicks(parseInteger(row.get("clicks")))
                .purchases(purchases)
                .purchaseValue(parseDecimal(row.get("purchaseValue")))
                .videoPlays25Pct(parseInteger(row.get("videoPlays25Pct")))
                .videoPlays50Pct(parseInteger(row.get("videoPlays50Pct")))
                .videoPlays75Pct(parseInteger(row.get("videoPlays75Pct")))
                .videoPlays95Pct(parseInteger(row.get("videoPlays95Pct")))
                .videoPlays100Pct(parseInteger(row.get("videoPlays100Pct")))
                .results(results)
                .costPerResult(costPerResult)
                .build();

        return AdPerformanceRecord.builder()
                .date(parseDate(row.get("date")))
                .accountId(parseId(row.get("accountId")))
                .accountName(row.get("accountName"))
                .campaignId(parseId(row.get("campaignId")))
                .campaignName(row.get("campaignName"))
                .objective(row.get("objective"))
                .adSetId(parseId(row.get("adSetId")))
                .adSetName(row.get("adSetName"))
                .adId(parseId(row.get("adId")))
                .adName(row.get("adName"))
                .adBody(row.get("adBody"))
                .adThumbnailUrl(row.get("adThumbnailUrl"))
                .permanentLink(row.get("permanentLink"))
                .ageBracket(orUnknown(row.get("ageBracket")))
                .gender(orUnknown(row.get("gender")))
                .platform(orUnknown(row.get("platform")))
                .device(orUnknown(row.get("device")))
                .position(orUnknown(row.get("position")))
                .measures(measures)
                .build();
    }

    private static BigDecimal costPerResult(BigDecimal spend, Integer results) {
        if (spend == null || results == null) {
            return null;
        }
        if (results == 0) {
            return BigDecimal.ZERO;
        }
        return spend.divide(BigDecimal.valueOf(results), 4, RoundingMode.HALF_UP);
    }

    private String orUnknown(String value) {
        return value == null ? unknownLabel : value;
    }

    private record Row(String[] cells, Map<String, Integer> columns) {

        boolean has(String field) {
            return columns.containsKey(field);
        }

        // trimmed cell, null when the column is absent or the cell blank
        String get(String field) {
            Integer index = columns.get(field);
            if (index == null || index >= cells.length || cells[index] == null) {
                return null;
            }
            String value = cells[index].trim();
            return value.isEmpty() ? null : value;
        }
    }
}
