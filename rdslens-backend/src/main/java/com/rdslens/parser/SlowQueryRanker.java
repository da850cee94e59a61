package com.rdslens.parser;

import com.rdslens.model.SlowQueryRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders slow query records by query time, longest first, and bounds the output.
 */
public final class SlowQueryRanker {

    /** Records shown in detail. */
    public static final int MAX_TOP = 5;

    private SlowQueryRanker() {
    }

    /**
     * Ranked view of a record set.
     *
     * @param total number of records before bounding
     * @param top up to the requested number of records (never more than {@link #MAX_TOP}), longest first
     */
    public record Ranking(int total, List<SlowQueryRecord> top) {
    }

    /**
     * Rank records. Records with equal query times keep their log order.
     *
     * @param records parsed records
     * @param limit requested detail size; values above {@link #MAX_TOP} are capped, values below 1 mean {@link #MAX_TOP}
     * @return ranking
     */
    public static Ranking rank(List<SlowQueryRecord> records, int limit) {
        List<SlowQueryRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingDouble(SlowQueryRecord::getQueryTime).reversed());

        int topSize = limit < 1 ? MAX_TOP : Math.min(limit, MAX_TOP);
        List<SlowQueryRecord> top = List.copyOf(sorted.subList(0, Math.min(sorted.size(), topSize)));
        return new Ranking(records.size(), top);
    }
}
