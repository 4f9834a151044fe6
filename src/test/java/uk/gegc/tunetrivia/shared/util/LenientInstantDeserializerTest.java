package uk.gegc.tunetrivia.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LenientInstantDeserializer Tests")
class LenientInstantDeserializerTest {

    @ParameterizedTest
    @CsvSource({
            "2024-06-01T12:00:00Z, 2024-06-01T12:00:00Z",
            "2024-06-01T14:00:00+02:00, 2024-06-01T12:00:00Z",
            "2024-06-01T12:00:00.250, 2024-06-01T12:00:00.250Z"
    })
    @DisplayName("parse: accepted formats")
    void parse_acceptedFormats(String text, String expected) {
        assertThat(LenientInstantDeserializer.parse(text)).isEqualTo(Instant.parse(expected));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"yesterday", "01/06/2024 12:00"})
    @DisplayName("parse: anything else becomes null")
    void parse_rejected(String text) {
        assertThat(LenientInstantDeserializer.parse(text)).isNull();
    }
}
