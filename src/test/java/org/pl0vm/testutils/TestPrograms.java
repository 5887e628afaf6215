package org.pl0vm.testutils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads PL/0 fixtures from {@code src/test/resources/programs}.
 */
public final class TestPrograms {

    private TestPrograms() {}

    public static String load(String name) {
        try (InputStream in = TestPrograms.class.getResourceAsStream("/programs/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No test program " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
