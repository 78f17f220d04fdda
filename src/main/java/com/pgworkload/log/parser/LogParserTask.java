package com.pgworkload.log.parser;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgworkload.log.parser.accumulator.ExclusionAccumulator;
import com.pgworkload.log.parser.accumulator.WorkloadAccumulator;

/**
 * Templates one chunk of records into accumulators owned by this task.
 */
class LogParserTask implements Callable<ParsedChunk> {

    private static final Logger logger = LoggerFactory.getLogger(LogParserTask.class);

    private final int index;
    private final List<LogRecord> recordsChunk;
    private final LogRecordProcessor processor;
    private final int sampleLimit;
    private final boolean debug;

    public LogParserTask(int index, List<LogRecord> recordsChunk, LogRecordProcessor processor, int sampleLimit,
            boolean debug) {
        this.index = index;
        this.recordsChunk = recordsChunk;
        this.processor = processor;
        this.sampleLimit = sampleLimit;
        this.debug = debug;
    }

    @Override
    public ParsedChunk call() {
        WorkloadAccumulator workload = new WorkloadAccumulator();
        ExclusionAccumulator exclusions = new ExclusionAccumulator(sampleLimit);
        long localAggregated = 0;
        long localExcluded = 0;
        long localMalformed = 0;

        for (LogRecord record : recordsChunk) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            TemplatedRecord templated;
            try {
                templated = processor.process(record);
            } catch (MalformedParameterException e) {
                // excluded, the rest of the chunk carries on
                exclusions.accumulate(record, e);
                localExcluded++;
                localMalformed++;
                if (debug && localMalformed <= 3) {
                    logger.warn("Malformed parameters in thread {}: {}", Thread.currentThread().getName(),
                            e.getMessage());
                }
                continue;
            }

            if (templated.isAggregated()) {
                workload.accumulate(templated);
                localAggregated++;
            } else {
                exclusions.accumulate(templated);
                localExcluded++;
            }
        }

        return new ParsedChunk(index, workload, exclusions,
                new ProcessingStats(localAggregated + localExcluded, localAggregated, localExcluded));
    }
}
