package com.solv.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads solution files from {@code src/test/resources/solutions}.
 */
public final class Fixtures {

    public static final String REAL = "real.sln";
    public static final String VERSION8 = "version8.sln";
    public static final String APR = "apr.sln";
    public static final String CORRECT = "correct.sln";
    public static final String CYCLES = "cycles.sln";
    public static final String DANGLINGS = "danglings.sln";
    public static final String MISSING_CONFIGS = "missing-configs.sln";

    private Fixtures() {
    }

    public static String solution(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/solutions/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No such fixture: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
