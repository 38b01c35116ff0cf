package io.tradeload.error;

import io.tradeload.validate.FieldViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/** Appends one JSON line per failed step, including its row-level violations. */
public class FileFailureReportSink implements FailureReportSink {
    private static final Logger log = LoggerFactory.getLogger(FileFailureReportSink.class);

    private final Path file;

    public FileFailureReportSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String entityName, String phase, String message, List<FieldViolation> violations) {
        StringBuilder rows = new StringBuilder("[");
        for (int i = 0; i < violations.size(); i++) {
            FieldViolation v = violations.get(i);
            if (i > 0) rows.append(',');
            rows.append(String.format("{\"row\":%d,\"field\":\"%s\",\"rule\":\"%s\",\"message\":\"%s\"}",
                    v.rowIndex(), safe(v.field()), v.rule(), safe(v.message())));
        }
        rows.append(']');
        String json = String.format(
                "{\"ts\":\"%s\",\"entity\":\"%s\",\"phase\":\"%s\",\"error\":\"%s\",\"violations\":%s}%n",
                Instant.now(), safe(entityName), safe(phase), safe(message), rows);
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("could not append failure report for '{}' to {}: {}", entityName, file, e.getMessage());
        }
    }

    private static String safe(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '\\': out.append("\\\\"); break;
                case '"': out.append('\''); break;
                case '\n':
                case '\r': out.append(' '); break;
                default:
                    if (ch < 0x20 || ch == 0x2028 || ch == 0x2029) {
                        out.append(String.format("\\u%04x", (int) ch));
                    } else {
                        out.append(ch);
                    }
            }
        }
        return out.toString();
    }
}
