package com.pgworkload.log.parser;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgworkload.log.config.ParserConfig;
import com.pgworkload.log.parser.model.TemplateSummaryEntry;
import com.pgworkload.log.parser.reader.LogFormat;
import com.pgworkload.log.parser.reader.LogRecordReader;
import com.pgworkload.log.parser.service.TemplateSummaryService;
import com.pgworkload.log.parser.template.TemplateSpacing;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Reads PostgreSQL csvlog/jsonlog files and reports the SQL workload as
 * query templates counted per time bucket.
 */
@Command(name = "workloadParser", mixinStandardHelpOptions = true, version = "1.0",
         description = "Turn PostgreSQL server logs into templated SQL workload summaries")
public class WorkloadParser implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(WorkloadParser.class);

    @Option(names = { "-f", "--files" }, description = "PostgreSQL log file(s), csvlog or jsonlog, optionally gzipped", required = true, arity = "1..*")
    private String[] fileNames;

    @Option(names = { "--format" }, description = "Log format: csv or json (default: from file extension)")
    private String format;

    @Option(names = { "--config" }, description = "Configuration properties file")
    private String configFile;

    @Option(names = { "--granularity" }, description = "Time bucket size, e.g. 1s, 500ms, 5m or PT1S (default: 1s)")
    private String granularity;

    @Option(names = { "--threads" }, description = "Worker threads (default: available processors)")
    private Integer threads;

    @Option(names = { "--chunkSize" }, description = "Records per worker task (default: 25000)")
    private Integer chunkSize;

    @Option(names = { "--spacing" }, description = "Template spacing: TOKEN_SEPARATED or GAP_PRESERVING")
    private String spacing;

    @Option(names = { "--quoteAwareParams" }, description = "Split parameter lists only outside quoted values")
    private boolean quoteAwareParams = false;

    @Option(names = { "--limit" }, description = "Limit parsing to the first N records of each log file")
    private Long recordLimit = null;

    @Option(names = { "-c", "--csv" }, description = "CSV output file for the (template, bucket) counts")
    private String csvOutputFile;

    @Option(names = { "--json" }, description = "JSON output file for the full report")
    private String jsonOutputFile;

    @Option(names = { "--exclusionsCsv" }, description = "CSV output file for sampled excluded records")
    private String exclusionsCsvFile;

    @Option(names = { "--text" }, description = "Print the aggregate and exclusions to the console")
    private boolean textOutput = false;

    @Option(names = { "--debug" }, description = "Enable debug logging")
    private boolean debug = false;

    @Option(names = { "--verbose" }, description = "Enable verbose output with timing information")
    private boolean verbose = false;

    private final ParserConfig config = new ParserConfig();

    @Override
    public Integer call() throws Exception {
        System.out.println("🚀 PostgreSQL Workload Parser");
        System.out.println("📁 Processing " + fileNames.length + " file(s)...");

        long overallStart = System.currentTimeMillis();

        loadConfiguration();
        applyOptions();
        if (verbose) {
            System.err.println("[VERBOSE] Configuration: " + config);
        }

        WorkloadPipeline pipeline = new WorkloadPipeline(config);
        pipeline.setDebug(debug);
        WorkloadResult total = new WorkloadResult(config.getExclusionSampleLimit());

        int successfulFiles = read(pipeline, total);

        if (verbose) {
            long overallTime = System.currentTimeMillis() - overallStart;
            System.err.printf("[VERBOSE] Overall processing completed in %d ms%n", overallTime);
        }

        if (successfulFiles == 0) {
            System.err.println("❌ No files were successfully processed. Exiting without generating reports.");
            return 1;
        }

        System.out.println("✅ Analysis complete: " + total.getStats());
        reportSummary(total);

        if (textOutput) {
            total.getWorkload().report();
            total.getExclusions().report();
        }

        if (csvOutputFile != null) {
            System.out.println("📊 Generating workload CSV: " + csvOutputFile);
            total.getWorkload().reportCsv(csvOutputFile);
        }

        if (exclusionsCsvFile != null) {
            System.out.println("📊 Generating exclusions CSV: " + exclusionsCsvFile);
            total.getExclusions().reportCsv(exclusionsCsvFile);
        }

        if (jsonOutputFile != null) {
            try {
                System.out.println("📊 Generating JSON report: " + jsonOutputFile);
                JsonReportGenerator.generateReport(jsonOutputFile, total, config);
                System.out.println("🎉 JSON report completed: " + jsonOutputFile);
            } catch (IOException e) {
                System.err.println("❌ Failed to generate JSON report: " + e.getMessage());
            }
        }

        return 0;
    }

    private void loadConfiguration() {
        if (configFile != null) {
            try (InputStream in = new FileInputStream(configFile)) {
                Properties props = new Properties();
                props.load(in);
                config.loadFromProperties(props);
                logger.info("Loaded configuration from: {}", configFile);
            } catch (IOException e) {
                logger.warn("Could not load config file: {}. Using defaults.", configFile);
            }
        }
    }

    // command line options win over the config file
    private void applyOptions() {
        if (granularity != null) {
            config.setBucketGranularity(TimeBucketer.parseGranularity(granularity));
        }
        if (threads != null) {
            config.setParallelism(threads);
        }
        if (chunkSize != null) {
            config.setChunkSize(chunkSize);
        }
        if (spacing != null) {
            config.setSpacing(TemplateSpacing.fromString(spacing));
        }
        if (quoteAwareParams) {
            config.setQuoteAwareParameters(true);
        }
    }

    int read(WorkloadPipeline pipeline, WorkloadResult total) throws InterruptedException {
        int fileCount = 0;
        int successfulFiles = 0;

        for (String fileName : fileNames) {
            File f = new File(fileName);
            fileCount++;

            if (!f.exists()) {
                System.err.println("❌ File not found: " + fileName);
                continue;
            }

            if (!f.canRead()) {
                System.err.println("❌ Cannot read file: " + fileName);
                continue;
            }

            LogFormat logFormat = format != null ? LogFormat.fromString(format) : LogFormat.fromFileName(f.getName());
            System.out.printf("📄 [%d/%d] %s (%s, %s)%n", fileCount, fileNames.length, f.getName(),
                    logFormat.getName(), formatFileSize(f.length()));

            long start = System.currentTimeMillis();
            try (LogRecordReader reader = logFormat.open(f)) {
                WorkloadResult result = pipeline.run(reader, recordLimit);
                total.merge(result);
                successfulFiles++;
                logProcessingResults(f, System.currentTimeMillis() - start, result);
            } catch (IOException e) {
                System.err.println("❌ Failed to process " + fileName + ": " + e.getMessage());
                logger.debug("Failed to process {}", fileName, e);
            }
        }

        return successfulFiles;
    }

    private void logProcessingResults(File file, long duration, WorkloadResult result) {
        if (debug || verbose) {
            logger.info("File processing complete - {} | Duration: {}ms | {} | Read errors: {} | Failed chunks: {}",
                    file.getName(), duration, result.getStats(), result.getReadErrors(), result.getFailedChunks());
        }
        if (result.getStats().aggregated == 0) {
            System.err.println("⚠️  WARNING: No statements were templated from " + file.getName());
            System.err.println("   This might indicate a wrong log format or logs without statement logging");
        }
    }

    private void reportSummary(WorkloadResult total) {
        List<TemplateSummaryEntry> summaries = TemplateSummaryService.getTemplateSummaries(total.getWorkload());
        System.out.println("   " + TemplateSummaryService.getSummaryStats(summaries));
        for (ExclusionReason reason : ExclusionReason.values()) {
            long count = total.getExclusions().getCount(reason);
            if (count > 0) {
                System.out.printf("   Excluded (%s): %,d%n", reason.getCode(), count);
            }
        }
        if (total.getReadErrors() > 0) {
            System.out.printf("   Unreadable rows: %,d%n", total.getReadErrors());
        }
        if (textOutput) {
            System.out.println("\nTop templates:");
            TemplateSummaryService.getTopTemplates(summaries, 10)
                    .forEach(entry -> System.out.printf("  %,10d  %s%n", entry.getTotalCount(), entry.getTemplate()));
        }
    }

    private String formatFileSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        int unit = (int) (Math.log(bytes) / Math.log(1024));
        String pre = "KMGTPE".charAt(unit - 1) + "";
        return String.format("%.1f %sB", bytes / Math.pow(1024, unit), pre);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkloadParser()).execute(args);
        System.exit(exitCode);
    }
}
