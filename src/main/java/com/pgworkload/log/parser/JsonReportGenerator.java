package com.pgworkload.log.parser;

import java.io.FileWriter;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pgworkload.log.config.ParserConfig;
import com.pgworkload.log.parser.accumulator.ExcludedRecord;
import com.pgworkload.log.parser.accumulator.ExclusionAccumulator;
import com.pgworkload.log.parser.accumulator.TemplateBucketKey;
import com.pgworkload.log.parser.accumulator.WorkloadAccumulator;
import com.pgworkload.log.parser.model.TemplateSummaryEntry;
import com.pgworkload.log.parser.service.TemplateSummaryService;

/**
 * Generates structured JSON reports from a workload run
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void generateReport(String fileName, WorkloadResult result, ParserConfig config)
            throws IOException {
        try (FileWriter writer = new FileWriter(fileName)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, buildReport(result, config));
        }
    }

    static ObjectNode buildReport(WorkloadResult result, ParserConfig config) {
        ObjectNode report = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", java.time.Instant.now().toString());
        metadata.put("bucketGranularity", config.getBucketGranularity().toString());
        metadata.put("templateSpacing", config.getSpacing().name());
        metadata.put("quoteAwareParameters", config.isQuoteAwareParameters());
        report.set("metadata", metadata);

        ObjectNode summary = mapper.createObjectNode();
        summary.put("totalRecords", result.getStats().records);
        summary.put("aggregatedRecords", result.getStats().aggregated);
        summary.put("excludedRecords", result.getStats().excluded);
        summary.put("readErrors", result.getReadErrors());
        summary.put("failedChunks", result.getFailedChunks());
        summary.put("uniqueTemplates", result.getWorkload().getTemplates().size());
        summary.put("aggregateEntries", result.getWorkload().getSize());
        report.set("summary", summary);

        report.set("templates", generateTemplatesJson(
                TemplateSummaryService.getTemplateSummaries(result.getWorkload())));
        report.set("aggregate", generateAggregateJson(result.getWorkload()));
        report.set("exclusions", generateExclusionsJson(result.getExclusions()));
        return report;
    }

    private static JsonNode generateTemplatesJson(List<TemplateSummaryEntry> entries) {
        ArrayNode templates = mapper.createArrayNode();
        for (TemplateSummaryEntry entry : entries) {
            ObjectNode node = mapper.createObjectNode();
            node.put("template", entry.getTemplate());
            node.put("totalCount", entry.getTotalCount());
            node.put("buckets", entry.getBucketCount());
            node.put("firstBucket", entry.getFirstBucket().toString());
            node.put("lastBucket", entry.getLastBucket().toString());
            node.put("minPerBucket", entry.getMinPerBucket());
            node.put("maxPerBucket", entry.getMaxPerBucket());
            node.put("avgPerBucket", Math.round(entry.getAvgPerBucket() * 100.0) / 100.0);
            node.put("p95PerBucket", Math.round(entry.getP95PerBucket() * 100.0) / 100.0);
            if (entry.getSampleQuery() != null) {
                node.put("sampleQuery", entry.getSampleQuery());
            }
            templates.add(node);
        }
        return templates;
    }

    private static JsonNode generateAggregateJson(WorkloadAccumulator workload) {
        ArrayNode aggregate = mapper.createArrayNode();
        for (Map.Entry<TemplateBucketKey, Long> entry : workload.sortedEntries()) {
            ObjectNode node = mapper.createObjectNode();
            node.put("template", entry.getKey().getTemplate());
            node.put("timeBucket", entry.getKey().getTimeBucket().toString());
            node.put("count", entry.getValue());
            aggregate.add(node);
        }
        return aggregate;
    }

    private static JsonNode generateExclusionsJson(ExclusionAccumulator exclusions) {
        ObjectNode node = mapper.createObjectNode();
        for (ExclusionReason reason : ExclusionReason.values()) {
            ObjectNode reasonNode = mapper.createObjectNode();
            reasonNode.put("count", exclusions.getCount(reason));
            reasonNode.put("description", reason.getDescription());
            ArrayNode samples = mapper.createArrayNode();
            for (ExcludedRecord sample : exclusions.getSamples(reason)) {
                ObjectNode s = mapper.createObjectNode();
                s.put("location", sample.getLocation());
                s.put("logTime", sample.getLogTime().toString());
                if (sample.getProblem() != null) {
                    s.put("problem", sample.getProblem());
                }
                s.put("message", sample.getMessage());
                samples.add(s);
            }
            reasonNode.set("samples", samples);
            node.set(reason.getCode(), reasonNode);
        }
        return node;
    }
}
