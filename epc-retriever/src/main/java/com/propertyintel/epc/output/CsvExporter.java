package com.propertyintel.epc.output;

import com.opencsv.CSVWriter;
import com.propertyintel.epc.config.EpcProperties;
import com.propertyintel.epc.model.CertificateRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes certificates to {outputDir}/{filename}.csv.
 *
 * Columns are either the requested ones that actually occur in the data, or
 * every field in first-seen order. The two report presets pick a fixed column
 * set and name the file after the area or supplier plus a timestamp.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvExporter {

    public static final List<String> AGRICULTURAL_SUMMARY_COLUMNS = List.of(
            "address1", "address2", "postcode", "local-authority",
            "current-energy-rating", "potential-energy-rating",
            "current-energy-efficiency", "potential-energy-efficiency",
            "total-floor-area", "property-type", "built-form",
            "inspection-date", "lodgement-date"
    );

    public static final List<String> SUPPLY_CHAIN_COLUMNS = List.of(
            "uprn", "address1", "address2", "postcode",
            "current-energy-rating", "current-energy-efficiency",
            "co2-emissions-current", "lighting-cost-current",
            "heating-cost-current", "hot-water-cost-current",
            "total-floor-area", "property-type",
            "main-fuel", "main-heating-controls",
            "inspection-date"
    );

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final EpcProperties properties;
    private final Clock clock;

    /** Writes agricultural_buildings_{area}_{stamp}.csv with the summary columns. */
    public Optional<Path> exportAgriculturalSummary(List<CertificateRecord> records, String areaName) {
        String area = areaName == null || areaName.isBlank() ? "area" : areaName;
        return export(records, "agricultural_buildings_" + ExportPaths.slug(area) + "_" + stamp(),
                AGRICULTURAL_SUMMARY_COLUMNS);
    }

    /** Writes supply_chain_{supplier}_{stamp}.csv with the running-cost columns. */
    public Optional<Path> exportSupplyChainReport(List<CertificateRecord> records, String supplierName) {
        String supplier = supplierName == null || supplierName.isBlank() ? "supplier" : supplierName;
        return export(records, "supply_chain_" + ExportPaths.slug(supplier) + "_" + stamp(),
                SUPPLY_CHAIN_COLUMNS);
    }

    public Optional<Path> export(List<CertificateRecord> records, String filename) {
        return export(records, filename, List.of());
    }

    /**
     * @return the written file, or empty when there was nothing to write
     */
    public Optional<Path> export(List<CertificateRecord> records, String filename, List<String> columns) {
        if (records.isEmpty()) {
            log.warn("No data to export");
            return Optional.empty();
        }

        Path outputPath = ExportPaths.resolve(properties.getExport().getOutputDir(), filename, ".csv");
        String[] header = resolveColumns(records, columns).toArray(new String[0]);
        ensureDirectory(outputPath.getParent());

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getExport().isIncludeHeader()) {
                writer.writeNext(header);
            }

            for (CertificateRecord r : records) {
                writer.writeNext(toRow(r, header));
            }

            log.info("Exported {} records to {}", records.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
        return Optional.of(outputPath);
    }

    private List<String> resolveColumns(List<CertificateRecord> records, List<String> requested) {
        Set<String> all = new LinkedHashSet<>();
        for (CertificateRecord r : records) {
            all.addAll(r.getFields().keySet());
        }
        if (requested == null || requested.isEmpty()) {
            return new ArrayList<>(all);
        }

        List<String> available = requested.stream().filter(all::contains).toList();
        if (available.isEmpty()) {
            log.warn("None of the specified columns found in data, exporting all columns");
            return new ArrayList<>(all);
        }
        return available;
    }

    private String[] toRow(CertificateRecord r, String[] header) {
        String[] row = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            String value = r.getString(header[i]);
            row[i] = value == null ? "" : value;
        }
        return row;
    }

    private String stamp() {
        return LocalDateTime.now(clock).format(FILE_STAMP);
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
