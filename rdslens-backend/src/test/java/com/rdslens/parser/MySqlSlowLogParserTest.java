package com.rdslens.parser;

import com.rdslens.model.SlowQueryRecord;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MySqlSlowLogParserTest {

    private final MySqlSlowLogParser parser = new MySqlSlowLogParser();

    @Test
    void parsesBlockClosedByNextTimeMarker() {
        String log = String.join("\n",
                "# Time: 2024-01-01T10:00:00.000000Z",
                "# User@Host: app[app] @ [10.0.0.1]  Id: 42",
                "# Query_time: 10.5  Lock_time: 0.1  Rows_sent: 100  Rows_examined: 1000",
                "SET timestamp=1704103200;",
                "SELECT * FROM users WHERE status = 'active';",
                "# Time: 2024-01-01T10:05:00.000000Z");

        List<SlowQueryRecord> records = parser.parse(log);

        assertThat(records).hasSize(1);
        SlowQueryRecord r = records.get(0);
        assertThat(r.getQueryTime()).isEqualTo(10.5);
        assertThat(r.getQueryTimeUnit()).isEqualTo("s");
        assertThat(r.getLockTime()).isEqualTo(0.1);
        assertThat(r.getRowsSent()).isEqualTo(100L);
        assertThat(r.getRowsExamined()).isEqualTo(1000L);
        assertThat(r.getSql()).isEqualTo("SELECT * FROM users WHERE status = 'active';");
        assertThat(r.getTimestamp()).isEqualTo(OffsetDateTime.parse("2024-01-01T10:00:00Z"));
    }

    @Test
    void flushesTrailingRecordAtEndOfInput() {
        String log = String.join("\n",
                "# Time: 2024-01-01T10:00:00Z",
                "# Query_time: 1.0  Lock_time: 0.0  Rows_sent: 1  Rows_examined: 1",
                "select 1;",
                "# Time: 2024-01-01T10:01:00Z",
                "# Query_time: 2.0  Lock_time: 0.0  Rows_sent: 1  Rows_examined: 1",
                "select 2;");

        assertThat(parser.parse(log)).extracting(SlowQueryRecord::getSql).containsExactly("select 1;", "select 2;");
    }

    @Test
    void multiLineStatementEndsAtBlankLine() {
        String log = String.join("\n",
                "# Time: 2024-01-01T10:00:00Z",
                "# Query_time: 3.2  Lock_time: 0.0  Rows_sent: 5  Rows_examined: 50",
                "use orders;",
                "SELECT id",
                "  FROM orders",
                "  WHERE total > 10;",
                "",
                "some trailing noise");

        List<SlowQueryRecord> records = parser.parse(log);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getSql()).isEqualTo("SELECT id FROM orders WHERE total > 10;");
    }

    @Test
    void blocksWithoutQueryTimeOrSelectAreDropped() {
        String log = String.join("\n",
                "# Time: 2024-01-01T10:00:00Z",
                "SELECT no_query_time;",
                "# Time: 2024-01-01T10:01:00Z",
                "# Query_time: 4.0  Lock_time: 0.0  Rows_sent: 0  Rows_examined: 0",
                "UPDATE t SET a = 1;",
                "# Time: 2024-01-01T10:02:00Z");

        assertThat(parser.parse(log)).isEmpty();
    }

    @Test
    void linesBeforeFirstTimeMarkerAreIgnored() {
        String log = String.join("\n",
                "/rdsdbbin/mysql/bin/mysqld, Version: 8.0.35. started with:",
                "# Query_time: 9.0  Lock_time: 0.0  Rows_sent: 0  Rows_examined: 0",
                "SELECT orphan;");

        assertThat(parser.parse(log)).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void normalizesLongInLists() {
        String log = String.join("\n",
                "# Time: 2024-01-01T10:00:00Z",
                "# Query_time: 1.5  Lock_time: 0.0  Rows_sent: 0  Rows_examined: 0",
                "SELECT * FROM t WHERE id IN (1,2,3,4,5,6,7);");

        assertThat(parser.parse(log).get(0).getSql()).isEqualTo("SELECT * FROM t WHERE id IN (1,2,3, ... 6,7);");
    }

    @Test
    void timestampParsing() {
        assertThat(MySqlSlowLogParser.parseTimestamp("240101 9:05:00"))
                .isEqualTo(OffsetDateTime.parse("2024-01-01T09:05:00Z"));
        assertThat(MySqlSlowLogParser.parseTimestamp("yesterday")).isNull();
        assertThat(MySqlSlowLogParser.parseTimestamp("")).isNull();
    }
}
