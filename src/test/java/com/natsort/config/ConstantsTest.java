package com.natsort.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.lang.reflect.Constructor;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals("text", Constants.FORMAT_TEXT);
        assertEquals("json", Constants.FORMAT_JSON);
        assertEquals(1_000_000, Constants.MAX_INPUT_LINES);
        assertEquals(StandardCharsets.UTF_8, Constants.DEFAULT_CHARSET);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
