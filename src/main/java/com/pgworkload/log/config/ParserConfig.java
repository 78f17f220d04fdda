package com.pgworkload.log.config;

import java.time.Duration;
import java.util.Properties;

import com.pgworkload.log.parser.TimeBucketer;
import com.pgworkload.log.parser.template.TemplateSpacing;

/**
 * Settings for a workload run. Starts from built-in defaults; a properties
 * file may override any of them:
 * <ul>
 * <li>bucket.granularity: time bucket size, e.g. {@code 1s}, {@code 5m}, {@code PT1S}</li>
 * <li>pipeline.parallelism: number of worker threads</li>
 * <li>pipeline.chunkSize: records handed to one worker task</li>
 * <li>template.spacing: {@code TOKEN_SEPARATED} or {@code GAP_PRESERVING}</li>
 * <li>parameters.quoteAwareSplit: only split parameter lists outside quotes</li>
 * <li>exclusions.sampleLimit: excluded records kept per reason</li>
 * </ul>
 */
public class ParserConfig {

    public static final int DEFAULT_CHUNK_SIZE = 25000;
    public static final int DEFAULT_SAMPLE_LIMIT = 20;

    private Duration bucketGranularity = TimeBucketer.DEFAULT_GRANULARITY;
    private int parallelism = Runtime.getRuntime().availableProcessors();
    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private TemplateSpacing spacing = TemplateSpacing.TOKEN_SEPARATED;
    private boolean quoteAwareParameters = false;
    private int exclusionSampleLimit = DEFAULT_SAMPLE_LIMIT;

    /**
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public void loadFromProperties(Properties props) {
        String granularity = props.getProperty("bucket.granularity");
        if (granularity != null && !granularity.trim().isEmpty()) {
            setBucketGranularity(TimeBucketer.parseGranularity(granularity));
        }

        String threads = props.getProperty("pipeline.parallelism");
        if (threads != null && !threads.trim().isEmpty()) {
            setParallelism(parseInt("pipeline.parallelism", threads));
        }

        String chunk = props.getProperty("pipeline.chunkSize");
        if (chunk != null && !chunk.trim().isEmpty()) {
            setChunkSize(parseInt("pipeline.chunkSize", chunk));
        }

        String templateSpacing = props.getProperty("template.spacing");
        if (templateSpacing != null && !templateSpacing.trim().isEmpty()) {
            setSpacing(TemplateSpacing.fromString(templateSpacing));
        }

        String quoteAware = props.getProperty("parameters.quoteAwareSplit");
        if (quoteAware != null && !quoteAware.trim().isEmpty()) {
            setQuoteAwareParameters(Boolean.parseBoolean(quoteAware.trim()));
        }

        String sampleLimit = props.getProperty("exclusions.sampleLimit");
        if (sampleLimit != null && !sampleLimit.trim().isEmpty()) {
            setExclusionSampleLimit(parseInt("exclusions.sampleLimit", sampleLimit));
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public Duration getBucketGranularity() {
        return bucketGranularity;
    }

    public void setBucketGranularity(Duration bucketGranularity) {
        if (bucketGranularity.isZero() || bucketGranularity.isNegative()) {
            throw new IllegalArgumentException("bucket.granularity must be positive: " + bucketGranularity);
        }
        this.bucketGranularity = bucketGranularity;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("pipeline.parallelism must be at least 1: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("pipeline.chunkSize must be at least 1: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public TemplateSpacing getSpacing() {
        return spacing;
    }

    public void setSpacing(TemplateSpacing spacing) {
        this.spacing = spacing;
    }

    public boolean isQuoteAwareParameters() {
        return quoteAwareParameters;
    }

    public void setQuoteAwareParameters(boolean quoteAwareParameters) {
        this.quoteAwareParameters = quoteAwareParameters;
    }

    public int getExclusionSampleLimit() {
        return exclusionSampleLimit;
    }

    public void setExclusionSampleLimit(int exclusionSampleLimit) {
        if (exclusionSampleLimit < 0) {
            throw new IllegalArgumentException("exclusions.sampleLimit must not be negative: " + exclusionSampleLimit);
        }
        this.exclusionSampleLimit = exclusionSampleLimit;
    }

    @Override
    public String toString() {
        return String.format("granularity=%s, parallelism=%d, chunkSize=%d, spacing=%s, quoteAwareParameters=%s",
                bucketGranularity, parallelism, chunkSize, spacing, quoteAwareParameters);
    }
}
