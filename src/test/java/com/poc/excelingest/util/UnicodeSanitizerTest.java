package com.poc.excelingest.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UnicodeSanitizerTest {

    @Test
    @DisplayName("clean text is returned as is")
    void cleanTextUnchanged() {
        String text = "Landfill\tgas\r\nnotes \uD83D\uDE00";
        assertThat(UnicodeSanitizer.sanitize(text)).isSameAs(text);
    }

    @Test
    @DisplayName("unpaired surrogates become the replacement character")
    void unpairedSurrogatesReplaced() {
        assertThat(UnicodeSanitizer.sanitize("a\uD83Db")).isEqualTo("a\uFFFDb");
        assertThat(UnicodeSanitizer.sanitize("a\uDE00")).isEqualTo("a\uFFFD");
    }

    @Test
    @DisplayName("control characters other than whitespace are dropped")
    void controlCharactersDropped() {
        assertThat(UnicodeSanitizer.sanitize("a\u0000b\u0007c")).isEqualTo("abc");
    }

    @Test
    @DisplayName("null and empty pass through")
    void nullAndEmpty() {
        assertThat(UnicodeSanitizer.sanitize(null)).isNull();
        assertThat(UnicodeSanitizer.sanitize("")).isEmpty();
    }
}
