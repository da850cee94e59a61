package com.rdslens.parser;

import com.rdslens.model.EngineFamily;
import com.rdslens.model.SlowQueryRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the MySQL slow query log.
 *
 * <pre>
 * # Time: 2024-01-01T10:00:00.000000Z
 * # User@Host: app[app] @ [10.0.0.1]  Id: 42
 * # Query_time: 10.5  Lock_time: 0.1  Rows_sent: 100  Rows_examined: 1000
 * SET timestamp=1704103200;
 * SELECT * FROM users WHERE status = 'active';
 * </pre>
 *
 * A {@code # Time:} line opens a record and closes the previous one. Statement capture starts at a
 * line beginning with {@code select} and runs until a blank line. {@code SET timestamp=} and
 * {@code use} lines are dropped. A record is emitted only if it has a query time and at least one
 * statement line; the last record is emitted at end of input.
 */
@Component
public class MySqlSlowLogParser implements SlowQueryParser {

    static final String TIME_MARKER = "# Time:";
    static final String QUERY_TIME_MARKER = "# Query_time:";

    private static final Pattern METRIC_PATTERN = Pattern.compile("(\\w+): (\\d+\\.?\\d*)");
    private static final DateTimeFormatter LEGACY_TIME_FORMAT = DateTimeFormatter.ofPattern("yyMMdd H:mm:ss", Locale.ROOT);

    @Override
    public EngineFamily engine() {
        return EngineFamily.MYSQL;
    }

    @Override
    public List<SlowQueryRecord> parse(String logText) {
        List<SlowQueryRecord> out = new ArrayList<>();
        if (logText == null || logText.isEmpty()) {
            return out;
        }

        SlowQueryRecord.SlowQueryRecordBuilder current = null;
        boolean hasQueryTime = false;
        List<String> sqlLines = new ArrayList<>();
        boolean capturing = false;

        for (String rawLine : logText.split("\n", -1)) {
            String line = rawLine.strip();

            if (line.startsWith(TIME_MARKER)) {
                if (current != null && hasQueryTime && !sqlLines.isEmpty()) {
                    out.add(finish(current, sqlLines));
                }
                current = SlowQueryRecord.builder()
                        .queryTimeUnit(SlowQueryRecord.UNIT_SECONDS)
                        .timestamp(parseTimestamp(line.substring(TIME_MARKER.length()).strip()));
                hasQueryTime = false;
                sqlLines = new ArrayList<>();
                capturing = false;
            } else if (line.startsWith(QUERY_TIME_MARKER)) {
                if (current != null) {
                    hasQueryTime |= applyMetrics(current, line);
                }
            } else if (line.startsWith("SET timestamp=") || line.startsWith("use ")) {
                continue;
            } else if (!line.isEmpty() && !line.startsWith("#")) {
                if (line.toLowerCase(Locale.ROOT).startsWith("select")) {
                    capturing = true;
                    sqlLines.add(line);
                } else if (capturing) {
                    sqlLines.add(line);
                }
            } else if (line.isEmpty()) {
                capturing = false;
            }
        }

        if (current != null && hasQueryTime && !sqlLines.isEmpty()) {
            out.add(finish(current, sqlLines));
        }
        return out;
    }

    private static SlowQueryRecord finish(SlowQueryRecord.SlowQueryRecordBuilder builder, List<String> sqlLines) {
        String sql = String.join(" ", sqlLines).strip();
        return QueryNormalizer.normalize(builder.sql(sql).build());
    }

    /**
     * Copy {@code name: value} pairs of a query-time line into the record.
     *
     * @return whether a query time was found
     */
    private static boolean applyMetrics(SlowQueryRecord.SlowQueryRecordBuilder builder, String line) {
        boolean foundQueryTime = false;
        Matcher m = METRIC_PATTERN.matcher(line.substring(2));
        while (m.find()) {
            String value = m.group(2);
            switch (m.group(1)) {
                case "Query_time":
                    builder.queryTime(Double.parseDouble(value));
                    foundQueryTime = true;
                    break;
                case "Lock_time":
                    builder.lockTime(Double.parseDouble(value));
                    break;
                case "Rows_sent":
                    builder.rowsSent(parseCount(value));
                    break;
                case "Rows_examined":
                    builder.rowsExamined(parseCount(value));
                    break;
                default:
                    break;
            }
        }
        return foundQueryTime;
    }

    private static Long parseCount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return (long) Double.parseDouble(value);
        }
    }

    static OffsetDateTime parseTimestamp(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw);
        } catch (DateTimeParseException e) {
            // MySQL 5.6 and earlier: "# Time: 240101 10:00:00"
            try {
                return LocalDateTime.parse(raw, LEGACY_TIME_FORMAT).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
