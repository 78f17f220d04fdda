package com.pgworkload.log.parser.accumulator;

import java.time.Instant;
import java.util.Comparator;

public class TemplateBucketKey implements Comparable<TemplateBucketKey> {

    private static final Comparator<TemplateBucketKey> ORDER = Comparator
            .comparing(TemplateBucketKey::getTemplate)
            .thenComparing(TemplateBucketKey::getTimeBucket);

    private final String template;
    private final Instant timeBucket;

    public TemplateBucketKey(String template, Instant timeBucket) {
        if (template == null || template.isEmpty()) {
            throw new IllegalArgumentException("Aggregate key requires a non-empty template");
        }
        if (timeBucket == null) {
            throw new IllegalArgumentException("Aggregate key requires a time bucket");
        }
        this.template = template;
        this.timeBucket = timeBucket;
    }

    public String getTemplate() {
        return template;
    }

    public Instant getTimeBucket() {
        return timeBucket;
    }

    @Override
    public int compareTo(TemplateBucketKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + template.hashCode();
        result = prime * result + timeBucket.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        TemplateBucketKey other = (TemplateBucketKey) obj;
        return template.equals(other.template) && timeBucket.equals(other.timeBucket);
    }

    @Override
    public String toString() {
        return timeBucket + " " + template;
    }
}
