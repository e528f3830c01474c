package com.phillippitts.classmate.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -5)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenShorterThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("This is a long string", 10)).isEqualTo("This is a ");
    }

    @Test
    void shouldCollapseWhitespaceInPreview() {
        assertThat(LogSanitizer.preview("  What is\n the   capital? ")).isEqualTo("What is the capital?");
    }

    @Test
    void shouldMarkTruncatedPreview() {
        String longText = "word ".repeat(20);

        String preview = LogSanitizer.preview(longText);

        assertThat(preview).endsWith("...");
        assertThat(preview).hasSize(LogSanitizer.DEFAULT_PREVIEW_CHARS + 3);
    }
}
