package com.pgworkload.log.parser;

import com.pgworkload.log.parser.accumulator.ExclusionAccumulator;
import com.pgworkload.log.parser.accumulator.WorkloadAccumulator;

/**
 * Merged output of a run: the workload aggregate, the excluded records and
 * the record counters.
 */
public class WorkloadResult {

    private final WorkloadAccumulator workload;
    private final ExclusionAccumulator exclusions;
    private ProcessingStats stats = new ProcessingStats(0, 0, 0);
    private long readErrors;
    private int failedChunks;

    public WorkloadResult(int sampleLimit) {
        this.workload = new WorkloadAccumulator();
        this.exclusions = new ExclusionAccumulator(sampleLimit);
    }

    void merge(ParsedChunk chunk) {
        workload.merge(chunk.getWorkload());
        exclusions.merge(chunk.getExclusions());
        stats = stats.plus(chunk.getStats());
    }

    public void merge(WorkloadResult other) {
        workload.merge(other.workload);
        exclusions.merge(other.exclusions);
        stats = stats.plus(other.stats);
        readErrors += other.readErrors;
        failedChunks += other.failedChunks;
    }

    void addReadErrors(long count) {
        readErrors += count;
    }

    void chunkFailed() {
        failedChunks++;
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

    /**
     * Rows the reader could not turn into a log record.
     */
    public long getReadErrors() {
        return readErrors;
    }

    public int getFailedChunks() {
        return failedChunks;
    }
}
