package com.pgworkload.log.parser;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgworkload.log.parser.template.SqlTemplater;
import com.pgworkload.log.parser.template.TemplateResult;
import com.pgworkload.log.parser.template.TokenizationException;

/**
 * Runs one log record through query extraction, parameter extraction,
 * substitution and templating. Holds no mutable state, so one instance
 * serves all worker threads.
 */
public class LogRecordProcessor {

    private static final Logger logger = LoggerFactory.getLogger(LogRecordProcessor.class);

    private final QueryExtractor queryExtractor;
    private final ParameterExtractor parameterExtractor;
    private final ParameterSubstitutor parameterSubstitutor;
    private final SqlTemplater templater;
    private final TimeBucketer bucketer;

    public LogRecordProcessor() {
        this(new ParameterExtractor(), new SqlTemplater(), new TimeBucketer());
    }

    public LogRecordProcessor(ParameterExtractor parameterExtractor, SqlTemplater templater, TimeBucketer bucketer) {
        this.queryExtractor = new QueryExtractor();
        this.parameterExtractor = parameterExtractor;
        this.parameterSubstitutor = new ParameterSubstitutor();
        this.templater = templater;
        this.bucketer = bucketer;
    }

    /**
     * Records without a statement and records whose statement cannot be
     * tokenized come back with an empty template and an exclusion reason.
     *
     * @throws MalformedParameterException if the detail column has a broken
     *             parameter list; the caller decides how to report it
     */
    public TemplatedRecord process(LogRecord record) throws MalformedParameterException {
        String rawQuery = queryExtractor.extract(record.getMessage());
        ParameterMap params = parameterExtractor.extract(record.getDetail(), record);
        String substituted = parameterSubstitutor.substitute(rawQuery, params);
        Instant bucket = bucketer.bucket(record.getLogTime());

        if (rawQuery.isEmpty()) {
            return new TemplatedRecord(record, rawQuery, params, substituted, TemplateResult.empty(), bucket,
                    ExclusionReason.NO_QUERY, null);
        }

        try {
            TemplateResult result = templater.template(substituted);
            return new TemplatedRecord(record, rawQuery, params, substituted, result, bucket, null, null);
        } catch (TokenizationException e) {
            logger.debug("Could not tokenize {}: {}", record.describe(), e.getMessage());
            return new TemplatedRecord(record, rawQuery, params, substituted, TemplateResult.empty(), bucket,
                    ExclusionReason.TOKENIZATION_FAILED, e.getMessage());
        }
    }
}
