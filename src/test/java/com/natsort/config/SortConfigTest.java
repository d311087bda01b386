package com.natsort.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class SortConfigTest {

    @Test
    void testDefaults() {
        SortConfig config = SortConfig.defaults();

        assertNotNull(config);
        assertFalse(config.isReverse());
        assertEquals(Constants.FORMAT_TEXT, config.getFormat());
        assertFalse(config.isJsonFormat());
        assertEquals(Constants.DEFAULT_CHARSET, config.getCharset());
        assertEquals(Constants.MAX_INPUT_LINES, config.getMaxInputLines());
    }

    @Test
    void testSetters() {
        SortConfig config = new SortConfig();

        config.setReverse(true);
        config.setFormat("JSON");
        config.setCharset(StandardCharsets.UTF_16);
        config.setMaxInputLines(50);

        assertTrue(config.isReverse());
        assertEquals("JSON", config.getFormat());
        assertTrue(config.isJsonFormat());
        assertEquals(StandardCharsets.UTF_16, config.getCharset());
        assertEquals(50, config.getMaxInputLines());
    }
}
