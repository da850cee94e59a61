package com.rdslens.parser;

import com.rdslens.model.EngineFamily;
import com.rdslens.model.SlowQueryRecord;

import java.util.List;

/**
 * Converts raw, fully concatenated engine log text into normalized slow query records.
 *
 * Implementations are pure: no I/O, no shared state between calls.
 */
public interface SlowQueryParser {

    /**
     * Engine family whose log format this parser understands.
     */
    EngineFamily engine();

    /**
     * Parse log text.
     *
     * @param logText raw log text, lines separated by {@code \n}
     * @return records in log order, each with a query time and a normalized statement
     */
    List<SlowQueryRecord> parse(String logText);
}
