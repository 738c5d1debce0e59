package com.rustarchitect.core.extractor;

import com.rustarchitect.core.model.Visibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VisibilityParser}.
 */
class VisibilityParserTest {

    @ParameterizedTest
    @CsvSource({
        "pub, PUB",
        "'pub ', PUB",
        "pub(crate), PUB_CRATE",
        "'pub( crate ) ', PUB_CRATE",
        "pub(super), PUB_SUPER",
        "pub(self), PUB_SELF",
        "pub(in crate::net), PUB_IN",
        "pub(in super::super), PUB_IN",
        "pub(unknown), PUB",
        "private, PRIVATE",
        "publish, PRIVATE"
    })
    void parse_withQualifier_returnsCanonicalVisibility(String qualifier, Visibility expected) {
        assertThat(VisibilityParser.parse(qualifier)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void parse_withoutQualifier_returnsPrivate(String qualifier) {
        assertThat(VisibilityParser.parse(qualifier)).isEqualTo(Visibility.PRIVATE);
    }

    @Test
    void parse_withInKeywordButNoPath_fallsBackToPub() {
        assertThat(VisibilityParser.parse("pub(in)")).isEqualTo(Visibility.PUB);
    }
}
