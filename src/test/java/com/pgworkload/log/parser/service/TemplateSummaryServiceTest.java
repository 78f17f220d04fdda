package com.pgworkload.log.parser.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pgworkload.log.parser.accumulator.WorkloadAccumulator;
import com.pgworkload.log.parser.model.TemplateSummaryEntry;

public class TemplateSummaryServiceTest {

    private static final Instant T0 = Instant.parse("2021-12-06T16:01:40Z");

    private WorkloadAccumulator accumulator;

    @BeforeEach
    public void setUp() {
        accumulator = new WorkloadAccumulator();
        accumulator.accumulate("SELECT * FROM t WHERE id = $1", T0, 1);
        accumulator.accumulate("SELECT * FROM t WHERE id = $1", T0.plusSeconds(2), 3);
        accumulator.accumulate("INSERT INTO t VALUES ( $1 )", T0.plusSeconds(1), 5);
        accumulator.accumulate("DELETE FROM t", T0, 4);
    }

    @Test
    public void testSummariesSortedByTotal() {
        List<TemplateSummaryEntry> summaries = TemplateSummaryService.getTemplateSummaries(accumulator);

        assertEquals(3, summaries.size());
        assertEquals("INSERT INTO t VALUES ( $1 )", summaries.get(0).getTemplate());
        // tie on 4 is broken by template text
        assertEquals("DELETE FROM t", summaries.get(1).getTemplate());
        assertEquals("SELECT * FROM t WHERE id = $1", summaries.get(2).getTemplate());
    }

    @Test
    public void testPerBucketStatistics() {
        TemplateSummaryEntry select = TemplateSummaryService.getTemplateSummaries(accumulator).get(2);

        assertEquals(4, select.getTotalCount());
        assertEquals(2, select.getBucketCount());
        assertEquals(T0, select.getFirstBucket());
        assertEquals(T0.plusSeconds(2), select.getLastBucket());
        assertEquals(1, select.getMinPerBucket());
        assertEquals(3, select.getMaxPerBucket());
        assertEquals(2.0, select.getAvgPerBucket(), 0.0001);
        assertEquals(3.0, select.getP95PerBucket(), 0.0001);
    }

    @Test
    public void testFilterAndTop() {
        List<TemplateSummaryEntry> summaries = TemplateSummaryService.getTemplateSummaries(accumulator);

        assertEquals(1, TemplateSummaryService.filterByStatementType(summaries, "SELECT").size());
        assertEquals(0, TemplateSummaryService.filterByStatementType(summaries, "UPDATE").size());
        List<TemplateSummaryEntry> top = TemplateSummaryService.getTopTemplates(summaries, 2);
        assertEquals(2, top.size());
        assertEquals(5, top.get(0).getTotalCount());
    }

    @Test
    public void testSummaryStats() {
        String stats = TemplateSummaryService.getSummaryStats(
                TemplateSummaryService.getTemplateSummaries(accumulator));

        assertEquals("Templates: 3, Statements: 13, Selects: 1, Inserts: 1, Updates: 0, Deletes: 1", stats);
    }

    @Test
    public void testEmptyAccumulator() {
        assertTrue(TemplateSummaryService.getTemplateSummaries(new WorkloadAccumulator()).isEmpty());
    }
}
