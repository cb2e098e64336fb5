package com.phillippitts.council.util;

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
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenNotLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("This is a long string", 10)).isEqualTo("This is a ");
    }

    @Test
    void shouldCollapseWhitespaceInPreview() {
        assertThat(LogSanitizer.preview("  What is\n\n the   capital\tof France?  "))
                .isEqualTo("What is the capital of France?");
    }

    @Test
    void shouldAppendEllipsisWhenPreviewIsCut() {
        String query = "a".repeat(LogSanitizer.PREVIEW_CHARS + 20);

        String preview = LogSanitizer.preview(query);

        assertThat(preview).hasSize(LogSanitizer.PREVIEW_CHARS + 3);
        assertThat(preview).endsWith("...");
    }

    @Test
    void shouldNotAppendEllipsisAtExactLength() {
        String query = "b".repeat(LogSanitizer.PREVIEW_CHARS);

        assertThat(LogSanitizer.preview(query)).isEqualTo(query);
    }
}
