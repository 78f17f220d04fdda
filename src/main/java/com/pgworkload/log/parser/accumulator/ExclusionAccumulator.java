package com.pgworkload.log.parser.accumulator;

import java.io.FileNotFoundException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.pgworkload.log.parser.ExclusionReason;
import com.pgworkload.log.parser.LogRecord;
import com.pgworkload.log.parser.TemplatedRecord;
import com.pgworkload.log.parser.WorkloadParseException;

/**
 * Counts records left out of the workload, per reason, and keeps the first
 * few of each reason as samples.
 */
public class ExclusionAccumulator {

    public static final int DEFAULT_SAMPLE_LIMIT = 20;

    private final Map<ExclusionReason, AtomicLong> counts = new EnumMap<>(ExclusionReason.class);
    private final Map<ExclusionReason, List<ExcludedRecord>> samples = new EnumMap<>(ExclusionReason.class);
    private final int sampleLimit;

    private String[] headers = new String[] { "Reason", "Location", "LogTime", "Problem", "Message" };

    public ExclusionAccumulator() {
        this(DEFAULT_SAMPLE_LIMIT);
    }

    public ExclusionAccumulator(int sampleLimit) {
        this.sampleLimit = sampleLimit;
    }

    /**
     * Records the exclusion of a templated record; aggregated records are ignored.
     */
    public void accumulate(TemplatedRecord record) {
        if (record.isAggregated()) {
            return;
        }
        accumulate(new ExcludedRecord(record.getExclusionReason(), record.getExclusionDetail(), record.getRecord()));
    }

    public void accumulate(LogRecord record, WorkloadParseException e) {
        accumulate(new ExcludedRecord(e.getReason(), e.getMessage(), record));
    }

    public void accumulate(ExcludedRecord excluded) {
        counts.computeIfAbsent(excluded.getReason(), k -> new AtomicLong()).incrementAndGet();
        addSample(excluded);
    }

    public void merge(ExclusionAccumulator other) {
        for (Map.Entry<ExclusionReason, AtomicLong> entry : other.counts.entrySet()) {
            counts.computeIfAbsent(entry.getKey(), k -> new AtomicLong()).addAndGet(entry.getValue().get());
        }
        for (List<ExcludedRecord> list : other.samples.values()) {
            list.forEach(this::addSample);
        }
    }

    private void addSample(ExcludedRecord excluded) {
        List<ExcludedRecord> list = samples.computeIfAbsent(excluded.getReason(), k -> new ArrayList<>());
        if (list.size() < sampleLimit) {
            list.add(excluded);
        }
    }

    public long getCount(ExclusionReason reason) {
        AtomicLong count = counts.get(reason);
        return count == null ? 0 : count.get();
    }

    public long getTotalCount() {
        return counts.values().stream().mapToLong(AtomicLong::get).sum();
    }

    public List<ExcludedRecord> getSamples(ExclusionReason reason) {
        return Collections.unmodifiableList(samples.getOrDefault(reason, Collections.emptyList()));
    }

    public boolean hasExclusions() {
        return !counts.isEmpty();
    }

    public void report() {
        if (counts.isEmpty()) {
            System.out.println("No records were excluded");
            return;
        }
        System.out.println("\n=== Excluded Records ===");
        System.out.println(String.format("%-22s %10s  %s", "Reason", "Count", "Description"));
        System.out.println("=".repeat(100));
        for (ExclusionReason reason : ExclusionReason.values()) {
            long count = getCount(reason);
            if (count > 0) {
                System.out.println(String.format("%-22s %,10d  %s", reason.getCode(), count, reason.getDescription()));
            }
        }
        for (ExclusionReason reason : ExclusionReason.values()) {
            if (reason == ExclusionReason.NO_QUERY) {
                continue;
            }
            for (ExcludedRecord sample : getSamples(reason)) {
                System.out.println("  " + sample.getLocation() + " " + sample.getProblem());
            }
        }
    }

    public void reportCsv(String fileName) throws FileNotFoundException {
        PrintWriter writer = new PrintWriter(fileName);
        writer.println(String.join(",", headers));
        for (ExclusionReason reason : ExclusionReason.values()) {
            getSamples(reason).forEach(sample -> writer.println(sample.toCsvString()));
        }
        writer.close();
    }
}
