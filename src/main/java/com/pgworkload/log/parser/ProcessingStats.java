package com.pgworkload.log.parser;

// per-chunk counters, summed by the pipeline
public class ProcessingStats {
    public final long records;
    public final long aggregated;
    public final long excluded;

    public ProcessingStats(long records, long aggregated, long excluded) {
        this.records = records;
        this.aggregated = aggregated;
        this.excluded = excluded;
    }

    public ProcessingStats plus(ProcessingStats other) {
        return new ProcessingStats(records + other.records, aggregated + other.aggregated, excluded + other.excluded);
    }

    @Override
    public String toString() {
        return String.format("%,d records, %,d aggregated, %,d excluded", records, aggregated, excluded);
    }
}
