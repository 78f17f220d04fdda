package com.pgworkload.log.parser;

import com.pgworkload.log.parser.accumulator.ExclusionAccumulator;
import com.pgworkload.log.parser.accumulator.WorkloadAccumulator;

/**
 * Partial results of one {@link LogParserTask}.
 */
public class ParsedChunk {

    private final int index;
    private final WorkloadAccumulator workload;
    private final ExclusionAccumulator exclusions;
    private final ProcessingStats stats;

    public ParsedChunk(int index, WorkloadAccumulator workload, ExclusionAccumulator exclusions,
            ProcessingStats stats) {
        this.index = index;
        this.workload = workload;
        this.exclusions = exclusions;
        this.stats = stats;
    }

    public int getIndex() {
        return index;
    }

    public WorkloadAccumulator getWorkload() {
        return workload;
    }

    public ExclusionAccumulator getExclusions() {
        return exclusions;
    }

    public ProcessingStats getStats() {
        return stats;
    }
}
