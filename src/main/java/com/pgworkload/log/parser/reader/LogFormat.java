package com.pgworkload.log.parser.reader;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

public enum LogFormat {
    CSV("csv"),
    JSON("json");

    private final String name;

    LogFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Picks the format from the file name; {@code .json} and {@code .json.gz}
     * are jsonlog, anything else is taken as csvlog.
     */
    public static LogFormat fromFileName(String fileName) {
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".gz")) {
            lower = lower.substring(0, lower.length() - 3);
        }
        return lower.endsWith(".json") ? JSON : CSV;
    }

    public static LogFormat fromString(String value) {
        for (LogFormat format : values()) {
            if (format.name.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown log format: " + value);
    }

    public LogRecordReader open(File file) throws IOException {
        // 16MB buffer, statements in logs can be very long
        int bufferSize = 16 * 1024 * 1024;
        InputStream stream = new FileInputStream(file);
        if (file.getName().toLowerCase().endsWith(".gz")) {
            stream = new GZIPInputStream(stream);
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8), bufferSize);
        if (this == JSON) {
            return new JsonLogRecordReader(reader, file.getName());
        }
        return new CsvLogRecordReader(reader, file.getName());
    }
}
