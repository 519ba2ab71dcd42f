package com.phillippitts.clinicalai.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndShortInput() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 10)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
    }

    @Test
    void previewCollapsesWhitespaceAndMarksCut() {
        assertThat(LogSanitizer.preview("pain\n\n  in   lower back", 100)).isEqualTo("pain in lower back");
        assertThat(LogSanitizer.preview("abcdefghij", 4)).isEqualTo("abcd...");
        assertThat(LogSanitizer.preview(null, 4)).isEmpty();
    }

    @Test
    void maskKeepsOnlyLastFourCharacters() {
        assertThat(LogSanitizer.mask("sk-ant-123456789")).isEqualTo("****6789");
        assertThat(LogSanitizer.mask("abc")).isEqualTo("****");
        assertThat(LogSanitizer.mask(null)).isEqualTo("none");
        assertThat(LogSanitizer.mask("  ")).isEqualTo("none");
    }
}
