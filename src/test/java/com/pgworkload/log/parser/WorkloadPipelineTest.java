package com.pgworkload.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.pgworkload.log.config.ParserConfig;
import com.pgworkload.log.parser.accumulator.ExclusionAccumulator;
import com.pgworkload.log.parser.reader.LogFormat;
import com.pgworkload.log.parser.reader.LogRecordReader;

public class WorkloadPipelineTest {

    private static final Instant BASE = Instant.parse("2021-12-06T16:01:40Z");
    private static final String SELECT = "execute <unnamed>: SELECT * FROM t WHERE id = $1";

    private static LogRecord select(int id, long offsetMillis) {
        return new LogRecord(BASE.plusMillis(offsetMillis), null, "SELECT", SELECT, "parameters: $1 = '" + id + "'");
    }

    private static ParserConfig config(int parallelism, int chunkSize) {
        ParserConfig config = new ParserConfig();
        config.setParallelism(parallelism);
        config.setChunkSize(chunkSize);
        return config;
    }

    private static List<LogRecord> mixedRecords() {
        List<LogRecord> records = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            records.add(select(i, i * 250L));
            if (i % 5 == 0) {
                records.add(new LogRecord(BASE.plusMillis(i * 250L), null, "INSERT",
                        "statement: INSERT INTO audit VALUES (" + i + ", 'x')", null));
            }
            if (i % 7 == 0) {
                records.add(new LogRecord(BASE.plusMillis(i * 250L), null, "idle", "duration: 0.5 ms", null));
            }
        }
        return records;
    }

    @Test
    public void testMalformedRecordIsExcludedOnly() throws Exception {
        List<LogRecord> records = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            records.add(select(i, i * 10L));
        }
        records.add(new LogRecord(BASE, null, "UPDATE", "execute <unnamed>: UPDATE t SET b = $1",
                "parameters: $1 5"));

        WorkloadResult result = new WorkloadPipeline(config(2, 3)).run(records);

        assertEquals(9, result.getWorkload().getTotalCount());
        assertEquals(9, result.getWorkload().getCount("SELECT * FROM t WHERE id = $1", BASE));
        assertEquals(1, result.getExclusions().getCount(ExclusionReason.MALFORMED_PARAMETERS));
        assertEquals(1, result.getExclusions().getTotalCount());
        assertEquals(10, result.getStats().records);
        assertEquals(9, result.getStats().aggregated);
        assertEquals(1, result.getStats().excluded);
        assertEquals(0, result.getFailedChunks());
    }

    @Test
    public void testUnterminatedQuoteDoesNotStopRun() throws Exception {
        List<LogRecord> records = List.of(
                select(1, 0),
                new LogRecord(BASE, null, "SELECT", "statement: SELECT 'abc", null),
                select(2, 0));

        WorkloadResult result = new WorkloadPipeline(config(1, 10)).run(records);

        assertEquals(2, result.getWorkload().getTotalCount());
        assertEquals(1, result.getExclusions().getCount(ExclusionReason.TOKENIZATION_FAILED));
    }

    @Test
    public void testChunkingDoesNotChangeTheAggregate() throws Exception {
        List<LogRecord> records = mixedRecords();

        WorkloadResult single = new WorkloadPipeline(config(1, 1000)).run(records);
        WorkloadResult chunked = new WorkloadPipeline(config(4, 3)).run(records);

        assertEquals(single.getWorkload().getCounts(), chunked.getWorkload().getCounts());
        assertEquals(single.getExclusions().getCount(ExclusionReason.NO_QUERY),
                chunked.getExclusions().getCount(ExclusionReason.NO_QUERY));
        assertEquals(single.getStats().records, chunked.getStats().records);
        assertEquals(records.size(), chunked.getStats().records);
    }

    @Test
    public void testMergeOrderDoesNotMatter() throws Exception {
        List<LogRecord> records = mixedRecords();
        List<LogRecord> first = records.subList(0, records.size() / 2);
        List<LogRecord> second = records.subList(records.size() / 2, records.size());
        WorkloadPipeline pipeline = new WorkloadPipeline(config(2, 5));

        WorkloadResult ab = pipeline.run(first);
        ab.merge(pipeline.run(second));
        WorkloadResult ba = pipeline.run(second);
        ba.merge(pipeline.run(first));
        WorkloadResult whole = pipeline.run(records);

        assertEquals(ab.getWorkload().getCounts(), ba.getWorkload().getCounts());
        assertEquals(whole.getWorkload().getCounts(), ab.getWorkload().getCounts());
        assertEquals(whole.getStats().excluded, ba.getStats().excluded);
        for (String template : whole.getWorkload().getTemplates()) {
            assertEquals(whole.getWorkload().getSample(template), ab.getWorkload().getSample(template));
            assertEquals(whole.getWorkload().getSample(template), ba.getWorkload().getSample(template));
        }
    }

    @Test
    public void testEmptyInput() throws Exception {
        WorkloadResult result = new WorkloadPipeline(config(2, 10)).run(new ArrayList<>());

        assertTrue(result.getWorkload().isEmpty());
        assertFalse(result.getExclusions().hasExclusions());
        assertEquals(0, result.getStats().records);
    }

    @Test
    public void testTemplatedRecordsStream() {
        WorkloadPipeline pipeline = new WorkloadPipeline();
        ExclusionAccumulator exclusions = new ExclusionAccumulator();
        List<LogRecord> records = List.of(
                select(1, 0),
                new LogRecord(BASE, null, "UPDATE", "execute <unnamed>: UPDATE t SET b = $1", "parameters: $1 5"),
                new LogRecord(BASE, null, "idle", "duration: 12.3 ms", null));

        List<TemplatedRecord> templated = pipeline.templatedRecords(records.stream(), exclusions)
                .collect(Collectors.toList());

        assertEquals(2, templated.size());
        assertEquals("SELECT * FROM t WHERE id = $1", templated.get(0).getTemplate());
        assertEquals(ExclusionReason.NO_QUERY, templated.get(1).getExclusionReason());
        assertEquals(1, exclusions.getCount(ExclusionReason.MALFORMED_PARAMETERS));
    }

    @Test
    public void testRunFromCsvLog() throws Exception {
        File file = new File(getClass().getResource("/postgresql-sample.csv").toURI());

        WorkloadResult result;
        try (LogRecordReader reader = LogFormat.CSV.open(file)) {
            result = new WorkloadPipeline(config(2, 2)).run(reader, null);
        }

        assertEquals(5, result.getStats().records);
        assertEquals(3, result.getStats().aggregated);
        assertEquals(1, result.getReadErrors());
        assertEquals(2, result.getWorkload().getCount("SELECT * FROM t WHERE a = $1 AND b = $2", BASE));
        assertEquals(1, result.getWorkload().getCount("INSERT INTO t VALUES ( $1 , $2 , $3 )",
                Instant.parse("2021-12-06T16:01:41Z")));
        assertEquals(1, result.getExclusions().getCount(ExclusionReason.NO_QUERY));
        assertEquals(1, result.getExclusions().getCount(ExclusionReason.MALFORMED_PARAMETERS));
        assertEquals("SELECT * FROM t WHERE a = '5' AND b = 'x'",
                result.getWorkload().getSample("SELECT * FROM t WHERE a = $1 AND b = $2"));
    }

    @Test
    public void testRecordLimit() throws Exception {
        File file = new File(getClass().getResource("/postgresql-sample.csv").toURI());

        WorkloadResult result;
        try (LogRecordReader reader = LogFormat.CSV.open(file)) {
            result = new WorkloadPipeline(config(1, 10)).run(reader, 2L);
        }

        assertEquals(2, result.getStats().records);
        assertEquals(2, result.getWorkload().getTotalCount());
    }

    @Test
    public void testCoarserBuckets() throws Exception {
        ParserConfig config = config(1, 100);
        config.setBucketGranularity(java.time.Duration.ofMinutes(1));

        WorkloadResult result = new WorkloadPipeline(config).run(mixedRecords());

        assertEquals(1, result.getWorkload().getCounts().keySet().stream()
                .filter(key -> key.getTemplate().startsWith("SELECT")).count());
        assertEquals(40, result.getWorkload().getCount("SELECT * FROM t WHERE id = $1",
                Instant.parse("2021-12-06T16:02:00Z")));
    }
}
