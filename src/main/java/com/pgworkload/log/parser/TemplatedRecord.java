package com.pgworkload.log.parser;

import java.time.Instant;
import java.util.List;

import com.pgworkload.log.parser.template.TemplateResult;

/**
 * A log record together with everything the pipeline derived from it.
 * A record whose template is empty carries the reason it was left out of
 * the aggregate.
 */
public final class TemplatedRecord {

    private final LogRecord record;
    private final String rawQuery;
    private final ParameterMap params;
    private final String substitutedQuery;
    private final TemplateResult templateResult;
    private final Instant timeBucket;
    private final ExclusionReason exclusionReason;
    private final String exclusionDetail;

    TemplatedRecord(LogRecord record, String rawQuery, ParameterMap params, String substitutedQuery,
            TemplateResult templateResult, Instant timeBucket, ExclusionReason exclusionReason,
            String exclusionDetail) {
        this.record = record;
        this.rawQuery = rawQuery;
        this.params = params;
        this.substitutedQuery = substitutedQuery;
        this.templateResult = templateResult;
        this.timeBucket = timeBucket;
        this.exclusionReason = exclusionReason;
        this.exclusionDetail = exclusionDetail;
    }

    public LogRecord getRecord() {
        return record;
    }

    public Instant getLogTime() {
        return record.getLogTime();
    }

    public Instant getSessionStartTime() {
        return record.getSessionStartTime();
    }

    public String getCommandTag() {
        return record.getCommandTag();
    }

    public String getMessage() {
        return record.getMessage();
    }

    public String getDetail() {
        return record.getDetail();
    }

    public String getRawQuery() {
        return rawQuery;
    }

    public ParameterMap getParams() {
        return params;
    }

    public String getSubstitutedQuery() {
        return substitutedQuery;
    }

    public String getTemplate() {
        return templateResult.getTemplate();
    }

    public List<String> getTemplateParams() {
        return templateResult.getParams();
    }

    public Instant getTimeBucket() {
        return timeBucket;
    }

    public boolean isAggregated() {
        return exclusionReason == null;
    }

    /**
     * @return null for aggregated records
     */
    public ExclusionReason getExclusionReason() {
        return exclusionReason;
    }

    public String getExclusionDetail() {
        return exclusionDetail;
    }

    @Override
    public String toString() {
        return "TemplatedRecord[" + record.describe() + " " + timeBucket + " "
                + (isAggregated() ? templateResult : exclusionReason) + "]";
    }
}
