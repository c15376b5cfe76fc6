package org.pixelforge.metrics;

import java.util.List;

/**
 * JSON shape of a benchmark report: the raw records and the aggregates derived from them.
 */
public record BenchmarkSession(String name, String timestamp, List<BenchmarkRecord> records,
                               List<BenchmarkAggregate> aggregates) {

    public BenchmarkSession {
        records = List.copyOf(records);
        aggregates = List.copyOf(aggregates);
    }
}
