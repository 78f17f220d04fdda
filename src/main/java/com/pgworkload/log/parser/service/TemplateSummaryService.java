package com.pgworkload.log.parser.service;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.pgworkload.log.parser.accumulator.TemplateBucketKey;
import com.pgworkload.log.parser.accumulator.WorkloadAccumulator;
import com.pgworkload.log.parser.model.TemplateSummaryEntry;

/**
 * Converts the (template, bucket) counts of a WorkloadAccumulator into one
 * TemplateSummaryEntry per template.
 */
public class TemplateSummaryService {

    /**
     * Summaries sorted by total count, busiest first; ties by template text.
     */
    public static List<TemplateSummaryEntry> getTemplateSummaries(WorkloadAccumulator accumulator) {
        Map<String, SortedMap<Instant, Long>> byTemplate = new HashMap<>();
        for (Map.Entry<TemplateBucketKey, Long> entry : accumulator.getCounts().entrySet()) {
            byTemplate.computeIfAbsent(entry.getKey().getTemplate(), k -> new TreeMap<>())
                    .put(entry.getKey().getTimeBucket(), entry.getValue());
        }
        return byTemplate.entrySet().stream()
                .map(e -> new TemplateSummaryEntry(e.getKey(), e.getValue(), accumulator.getSample(e.getKey())))
                .sorted(Comparator.comparingLong(TemplateSummaryEntry::getTotalCount).reversed()
                        .thenComparing(TemplateSummaryEntry::getTemplate))
                .collect(Collectors.toList());
    }

    /**
     * Templates whose statement starts with the given keyword, e.g. {@code SELECT}.
     */
    public static List<TemplateSummaryEntry> filterByStatementType(List<TemplateSummaryEntry> entries,
            String keyword) {
        return entries.stream()
                .filter(entry -> entry.getTemplate().startsWith(keyword))
                .collect(Collectors.toList());
    }

    public static List<TemplateSummaryEntry> getTopTemplates(List<TemplateSummaryEntry> entries, int limit) {
        return entries.stream().limit(limit).collect(Collectors.toList());
    }

    public static String getSummaryStats(List<TemplateSummaryEntry> entries) {
        long total = entries.stream().mapToLong(TemplateSummaryEntry::getTotalCount).sum();
        return String.format("Templates: %d, Statements: %d, Selects: %d, Inserts: %d, Updates: %d, Deletes: %d",
                entries.size(), total,
                filterByStatementType(entries, "SELECT").size(),
                filterByStatementType(entries, "INSERT").size(),
                filterByStatementType(entries, "UPDATE").size(),
                filterByStatementType(entries, "DELETE").size());
    }
}
