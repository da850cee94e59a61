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
 * Parser for PostgreSQL error logs with {@code log_min_duration_statement} enabled.
 *
 * <pre>
 * 2024-01-01 10:00:00 UTC:10.0.0.1(5432):app@orders:[123]:LOG:  duration: 1532.112 ms  statement: SELECT *
 *     FROM orders
 *     WHERE id IN (1,2,3)
 * </pre>
 *
 * A line starting with {@code YYYY-MM-DD HH:MM:SS UTC:} opens a block; following lines belong to it
 * until the next such line. Lines before the first block are ignored. Blocks without a duration
 * statement are dropped. The last block is emitted at end of input.
 */
@Component
public class PostgresLogParser implements SlowQueryParser {

    private static final Pattern BLOCK_START = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} UTC:");
    private static final Pattern DURATION_STATEMENT = Pattern.compile(
            "LOG:  duration: (\\d+\\.?\\d*) ms  statement: (.*)", Pattern.DOTALL);
    private static final DateTimeFormatter BLOCK_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    @Override
    public EngineFamily engine() {
        return EngineFamily.POSTGRES;
    }

    @Override
    public List<SlowQueryRecord> parse(String logText) {
        List<SlowQueryRecord> out = new ArrayList<>();
        if (logText == null || logText.isEmpty()) {
            return out;
        }

        List<String> block = new ArrayList<>();
        for (String rawLine : logText.split("\n", -1)) {
            String line = rawLine.strip();
            if (BLOCK_START.matcher(line).find()) {
                if (!block.isEmpty()) {
                    parseBlock(block, out);
                }
                block = new ArrayList<>();
                block.add(line);
            } else if (!block.isEmpty()) {
                block.add(line);
            }
        }

        if (!block.isEmpty()) {
            parseBlock(block, out);
        }
        return out;
    }

    private static void parseBlock(List<String> lines, List<SlowQueryRecord> out) {
        String entry = String.join("\n", lines);
        Matcher m = DURATION_STATEMENT.matcher(entry);
        if (!m.find()) {
            return;
        }
        SlowQueryRecord record = SlowQueryRecord.builder()
                .timestamp(parseBlockTimestamp(lines.get(0)))
                .queryTime(Double.parseDouble(m.group(1)))
                .queryTimeUnit(SlowQueryRecord.UNIT_MILLIS)
                .sql(m.group(2))
                .build();
        out.add(QueryNormalizer.normalize(record));
    }

    static OffsetDateTime parseBlockTimestamp(String firstLine) {
        try {
            return LocalDateTime.parse(firstLine.substring(0, 19), BLOCK_TIME_FORMAT).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException | IndexOutOfBoundsException e) {
            return null;
        }
    }
}
