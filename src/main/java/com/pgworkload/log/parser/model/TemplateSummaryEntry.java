package com.pgworkload.log.parser.model;

import java.time.Instant;
import java.util.Map;
import java.util.SortedMap;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Everything the reports show about one template: how often it ran in
 * total and how its per-bucket counts are distributed.
 */
public class TemplateSummaryEntry {

    private final String template;
    private final String sampleQuery;
    private final long totalCount;
    private final int bucketCount;
    private final Instant firstBucket;
    private final Instant lastBucket;
    private final long minPerBucket;
    private final long maxPerBucket;
    private final double avgPerBucket;
    private final double p95PerBucket;

    /**
     * @param countsByBucket occurrence count per time bucket, at least one entry
     */
    public TemplateSummaryEntry(String template, SortedMap<Instant, Long> countsByBucket, String sampleQuery) {
        if (countsByBucket.isEmpty()) {
            throw new IllegalArgumentException("No buckets for template " + template);
        }
        this.template = template;
        this.sampleQuery = sampleQuery;

        DescriptiveStatistics perBucket = new DescriptiveStatistics();
        long total = 0;
        for (Map.Entry<Instant, Long> entry : countsByBucket.entrySet()) {
            total += entry.getValue();
            perBucket.addValue(entry.getValue());
        }
        this.totalCount = total;
        this.bucketCount = countsByBucket.size();
        this.firstBucket = countsByBucket.firstKey();
        this.lastBucket = countsByBucket.lastKey();
        this.minPerBucket = (long) perBucket.getMin();
        this.maxPerBucket = (long) perBucket.getMax();
        this.avgPerBucket = perBucket.getMean();
        this.p95PerBucket = perBucket.getPercentile(95);
    }

    public String getTemplate() {
        return template;
    }

    public String getSampleQuery() {
        return sampleQuery;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public int getBucketCount() {
        return bucketCount;
    }

    public Instant getFirstBucket() {
        return firstBucket;
    }

    public Instant getLastBucket() {
        return lastBucket;
    }

    public long getMinPerBucket() {
        return minPerBucket;
    }

    public long getMaxPerBucket() {
        return maxPerBucket;
    }

    public double getAvgPerBucket() {
        return avgPerBucket;
    }

    public double getP95PerBucket() {
        return p95PerBucket;
    }
}
