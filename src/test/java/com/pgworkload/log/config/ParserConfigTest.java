package com.pgworkload.log.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.pgworkload.log.parser.template.TemplateSpacing;

public class ParserConfigTest {

    @Test
    public void testDefaults() {
        ParserConfig config = new ParserConfig();

        assertEquals(Duration.ofSeconds(1), config.getBucketGranularity());
        assertEquals(ParserConfig.DEFAULT_CHUNK_SIZE, config.getChunkSize());
        assertEquals(TemplateSpacing.TOKEN_SEPARATED, config.getSpacing());
        assertFalse(config.isQuoteAwareParameters());
        assertEquals(20, config.getExclusionSampleLimit());
        assertTrue(config.getParallelism() >= 1);
    }

    @Test
    public void testLoadFromProperties() {
        Properties props = new Properties();
        props.setProperty("bucket.granularity", "5m");
        props.setProperty("pipeline.parallelism", "3");
        props.setProperty("pipeline.chunkSize", " 1000 ");
        props.setProperty("template.spacing", "gap_preserving");
        props.setProperty("parameters.quoteAwareSplit", "true");
        props.setProperty("exclusions.sampleLimit", "5");

        ParserConfig config = new ParserConfig();
        config.loadFromProperties(props);

        assertEquals(Duration.ofMinutes(5), config.getBucketGranularity());
        assertEquals(3, config.getParallelism());
        assertEquals(1000, config.getChunkSize());
        assertEquals(TemplateSpacing.GAP_PRESERVING, config.getSpacing());
        assertTrue(config.isQuoteAwareParameters());
        assertEquals(5, config.getExclusionSampleLimit());
    }

    @Test
    public void testMissingKeysKeepDefaults() {
        Properties props = new Properties();
        props.setProperty("pipeline.chunkSize", "");

        ParserConfig config = new ParserConfig();
        config.loadFromProperties(props);

        assertEquals(ParserConfig.DEFAULT_CHUNK_SIZE, config.getChunkSize());
        assertEquals(Duration.ofSeconds(1), config.getBucketGranularity());
    }

    @Test
    public void testInvalidValues() {
        Properties badNumber = new Properties();
        badNumber.setProperty("pipeline.parallelism", "many");
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig().loadFromProperties(badNumber));

        Properties badGranularity = new Properties();
        badGranularity.setProperty("bucket.granularity", "0s");
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig().loadFromProperties(badGranularity));

        assertThrows(IllegalArgumentException.class, () -> new ParserConfig().setChunkSize(0));
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig().setExclusionSampleLimit(-1));
    }
}
