package com.pgworkload.log.parser.accumulator;

import java.io.FileNotFoundException;
import java.io.PrintWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

import com.pgworkload.log.parser.TemplatedRecord;

/**
 * Occurrence counts per (template, time bucket).
 * <p>
 * Not thread safe: each worker fills its own instance and the results are
 * combined with {@link #merge(WorkloadAccumulator)}, which only sums counts
 * and so gives the same totals in any merge order.
 */
public class WorkloadAccumulator {

    private final Map<TemplateBucketKey, AtomicLong> counts = new HashMap<>();

    // smallest literal statement seen per template, so merging stays order independent
    private final Map<String, String> samples = new HashMap<>();

    private String[] headers = new String[] { "TimeBucket", "Count", "Template" };

    /**
     * Adds one occurrence. Records that are not aggregated (empty template)
     * are ignored.
     */
    public void accumulate(TemplatedRecord record) {
        if (!record.isAggregated() || record.getTemplate().isEmpty()) {
            return;
        }
        accumulate(record.getTemplate(), record.getTimeBucket(), 1);
        addSample(record.getTemplate(), record.getSubstitutedQuery());
    }

    public void accumulate(String template, Instant timeBucket, long count) {
        if (template == null || template.isEmpty()) {
            return;
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive: " + count);
        }
        counts.computeIfAbsent(new TemplateBucketKey(template, timeBucket), k -> new AtomicLong())
                .addAndGet(count);
    }

    public void merge(WorkloadAccumulator other) {
        if (other == this) {
            throw new IllegalArgumentException("Cannot merge an accumulator into itself");
        }
        for (Map.Entry<TemplateBucketKey, AtomicLong> entry : other.counts.entrySet()) {
            counts.computeIfAbsent(entry.getKey(), k -> new AtomicLong()).addAndGet(entry.getValue().get());
        }
        for (Map.Entry<String, String> entry : other.samples.entrySet()) {
            addSample(entry.getKey(), entry.getValue());
        }
    }

    private void addSample(String template, String query) {
        if (query == null || query.isEmpty()) {
            return;
        }
        samples.merge(template, query, (a, b) -> a.compareTo(b) <= 0 ? a : b);
    }

    public long getCount(String template, Instant timeBucket) {
        AtomicLong count = counts.get(new TemplateBucketKey(template, timeBucket));
        return count == null ? 0 : count.get();
    }

    /**
     * Snapshot of all counts. Iteration order is unspecified; use
     * {@link #sortedEntries()} for stable output.
     */
    public Map<TemplateBucketKey, Long> getCounts() {
        Map<TemplateBucketKey, Long> snapshot = new HashMap<>();
        counts.forEach((key, value) -> snapshot.put(key, value.get()));
        return snapshot;
    }

    /**
     * Entries sorted by template, then bucket.
     */
    public List<Map.Entry<TemplateBucketKey, Long>> sortedEntries() {
        List<Map.Entry<TemplateBucketKey, Long>> entries = new ArrayList<>(getCounts().entrySet());
        entries.sort(Map.Entry.comparingByKey());
        return entries;
    }

    public Set<String> getTemplates() {
        Set<String> templates = new TreeSet<>();
        counts.keySet().forEach(key -> templates.add(key.getTemplate()));
        return Collections.unmodifiableSet(templates);
    }

    public String getSample(String template) {
        return samples.get(template);
    }

    public long getTotalCount() {
        return counts.values().stream().mapToLong(AtomicLong::get).sum();
    }

    public int getSize() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public void report() {
        System.out.println(String.format("%-30s %10s  %s", "TimeBucket", "Count", "Template"));
        System.out.println("=".repeat(120));
        for (Map.Entry<TemplateBucketKey, Long> entry : sortedEntries()) {
            System.out.println(String.format("%-30s %10d  %s", entry.getKey().getTimeBucket(), entry.getValue(),
                    entry.getKey().getTemplate()));
        }
    }

    public void reportCsv(String fileName) throws FileNotFoundException {
        PrintWriter writer = new PrintWriter(fileName);
        writer.println(String.join(",", headers));
        for (Map.Entry<TemplateBucketKey, Long> entry : sortedEntries()) {
            writer.println(String.format("%s,%d,%s", entry.getKey().getTimeBucket(), entry.getValue(),
                    escapeCsv(entry.getKey().getTemplate())));
        }
        writer.close();
    }

    static String escapeCsv(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
