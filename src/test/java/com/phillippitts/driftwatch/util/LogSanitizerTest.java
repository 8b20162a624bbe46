package com.phillippitts.driftwatch.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void returnsEmptyForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview("abc", 0)).isEmpty();
    }

    @Test
    void truncatesLongInput() {
        assertThat(LogSanitizer.preview("abcdefghij", 4)).isEqualTo("abcd...");
        assertThat(LogSanitizer.preview("abc", 4)).isEqualTo("abc");
    }

    @Test
    void replacesControlCharacters() {
        assertThat(LogSanitizer.preview("a\nb\rc\td", 20)).isEqualTo("a b c d");
    }
}
