package com.rdslens.parser;

import com.rdslens.model.EngineFamily;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the log parser for an engine family.
 */
@Component
public class SlowQueryParsers {

    private final Map<EngineFamily, SlowQueryParser> byEngine = new EnumMap<>(EngineFamily.class);

    public SlowQueryParsers(List<SlowQueryParser> parsers) {
        for (SlowQueryParser parser : parsers) {
            byEngine.put(parser.engine(), parser);
        }
    }

    /**
     * Parser for an engine.
     *
     * @param family engine family
     * @param engine raw engine string, used in the error message
     * @return parser
     * @throws UnsupportedEngineException when no parser handles the family
     */
    public SlowQueryParser forEngine(EngineFamily family, String engine) {
        SlowQueryParser parser = byEngine.get(family);
        if (parser == null) {
            throw new UnsupportedEngineException(engine);
        }
        return parser;
    }
}
