package io.tradeload.trading;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import io.tradeload.core.Batch;
import io.tradeload.core.BatchSource;
import io.tradeload.registry.EntityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code <inputDir>/<entity>.csv}. The first line names the columns; cells stay strings and
 * empty cells become null. Columns the entity does not declare are dropped, declared columns absent
 * from the file are null.
 */
public class CsvBatchSource implements BatchSource {
    private static final Logger log = LoggerFactory.getLogger(CsvBatchSource.class);

    private final Path inputDir;

    public CsvBatchSource(Path inputDir) {
        this.inputDir = inputDir;
    }

    public Path fileFor(EntityDescriptor entity) { return inputDir.resolve(entity.name() + ".csv"); }

    @Override
    public Batch extract(EntityDescriptor entity) throws IOException {
        Path file = fileFor(entity);
        if (!Files.exists(file)) {
            log.warn("no input file {} for '{}'; loading an empty batch", file, entity.name());
            return Batch.empty(entity.name());
        }
        List<String[]> lines;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            lines = newParser().parseAll(reader);
        }
        if (lines.isEmpty()) return Batch.empty(entity.name());

        Map<String, Integer> header = new HashMap<>();
        String[] names = lines.get(0);
        for (int i = 0; i < names.length; i++) {
            if (names[i] == null) continue;
            String column = names[i].trim();
            if (entity.hasColumn(column)) {
                header.put(column, i);
            } else {
                log.debug("ignoring column '{}' of {}", column, file);
            }
        }

        List<Map<String, Object>> records = new ArrayList<>(lines.size() - 1);
        for (int r = 1; r < lines.size(); r++) {
            String[] cells = lines.get(r);
            Map<String, Object> record = new LinkedHashMap<>();
            for (String column : entity.columnNames()) {
                Integer idx = header.get(column);
                record.put(column, idx == null || idx >= cells.length ? null : cells[idx]);
            }
            records.add(record);
        }
        log.debug("read {} rows from {}", records.size(), file);
        return Batch.of(entity.name(), records);
    }

    private static CsvParser newParser() {
        CsvParserSettings settings = new CsvParserSettings();
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(true);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setNullValue(null);
        settings.setEmptyValue(null);
        settings.setMaxCharsPerColumn(4096);
        return new CsvParser(settings);
    }
}
