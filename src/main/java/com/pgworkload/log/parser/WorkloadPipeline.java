package com.pgworkload.log.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgworkload.log.config.ParserConfig;
import com.pgworkload.log.parser.accumulator.ExclusionAccumulator;
import com.pgworkload.log.parser.reader.LogRecordReader;
import com.pgworkload.log.parser.template.SqlTemplater;

/**
 * Turns a stream of log records into a workload aggregate. Records are cut
 * into chunks, each chunk is templated by a {@link LogParserTask} on a fixed
 * thread pool into its own accumulators, and the partial results are merged
 * as tasks complete.
 */
public class WorkloadPipeline {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadPipeline.class);

    private final ParserConfig config;
    private final LogRecordProcessor processor;
    private boolean debug = false;

    public WorkloadPipeline() {
        this(new ParserConfig());
    }

    public WorkloadPipeline(ParserConfig config) {
        this.config = config;
        this.processor = new LogRecordProcessor(new ParameterExtractor(config.isQuoteAwareParameters()),
                new SqlTemplater(config.getSpacing()), new TimeBucketer(config.getBucketGranularity()));
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    /**
     * Per-record view of the pipeline. Records with malformed parameters are
     * recorded in {@code exclusions} and left out of the stream; records
     * without a usable template stay in the stream with their exclusion
     * reason set.
     */
    public Stream<TemplatedRecord> templatedRecords(Stream<LogRecord> records, ExclusionAccumulator exclusions) {
        return records.flatMap(record -> {
            try {
                return Stream.of(processor.process(record));
            } catch (MalformedParameterException e) {
                synchronized (exclusions) {
                    exclusions.accumulate(record, e);
                }
                return Stream.empty();
            }
        });
    }

    public WorkloadResult run(Iterable<LogRecord> records) throws InterruptedException {
        try (Dispatch dispatch = new Dispatch()) {
            List<LogRecord> chunk = new ArrayList<>();
            for (LogRecord record : records) {
                chunk.add(record);
                if (chunk.size() >= config.getChunkSize()) {
                    dispatch.submit(chunk);
                    chunk = new ArrayList<>();
                }
            }
            dispatch.submit(chunk);
            return dispatch.awaitResult();
        }
    }

    /**
     * @param limit stop after this many records, or null to read everything
     */
    public WorkloadResult run(LogRecordReader reader, Long limit) throws IOException, InterruptedException {
        try (Dispatch dispatch = new Dispatch()) {
            List<LogRecord> chunk = new ArrayList<>();
            long count = 0;
            LogRecord record;
            while ((record = reader.read()) != null) {
                if (limit != null && count >= limit) {
                    logger.info("Reached record limit of {} in {}", limit, reader.getSourceName());
                    break;
                }
                count++;
                chunk.add(record);
                if (chunk.size() >= config.getChunkSize()) {
                    dispatch.submit(chunk);
                    chunk = new ArrayList<>();
                }
            }
            dispatch.submit(chunk);
            WorkloadResult result = dispatch.awaitResult();
            result.addReadErrors(reader.getReadErrors());
            return result;
        }
    }

    /**
     * One run's worth of worker threads. Closing it before
     * {@link #awaitResult()} returns drops whatever was not merged yet.
     */
    private class Dispatch implements AutoCloseable {

        private final ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism());
        private final CompletionService<ParsedChunk> completionService = new ExecutorCompletionService<>(executor);
        private int submittedTasks = 0;

        void submit(List<LogRecord> chunk) {
            if (chunk.isEmpty()) {
                return;
            }
            completionService.submit(new LogParserTask(submittedTasks, chunk, processor,
                    config.getExclusionSampleLimit(), debug));
            submittedTasks++;
        }

        WorkloadResult awaitResult() throws InterruptedException {
            WorkloadResult result = new WorkloadResult(config.getExclusionSampleLimit());
            for (int i = 0; i < submittedTasks; i++) {
                try {
                    ParsedChunk chunk = completionService.take().get();
                    result.merge(chunk);
                    if (debug) {
                        logger.debug("Merged chunk {}: {}", chunk.getIndex(), chunk.getStats());
                    }
                } catch (ExecutionException e) {
                    logger.error("Task execution failed", e);
                    result.chunkFailed();
                }
            }
            return result;
        }

        @Override
        public void close() {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warn("Executor did not terminate gracefully");
                }
            } catch (InterruptedException e) {
                logger.warn("Executor interrupted");
                Thread.currentThread().interrupt();
            }
        }
    }
}
