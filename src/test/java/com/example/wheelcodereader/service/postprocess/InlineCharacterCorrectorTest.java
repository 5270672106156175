package com.example.wheelcodereader.service.postprocess;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class InlineCharacterCorrectorTest {

    private final InlineCharacterCorrector corrector = new InlineCharacterCorrector();

    @ParameterizedTest
    @CsvSource({
            "AT6O2O2, AT60202",
            "ATS1234, AT51234",
            "HELL0, HELLO",
            "1O5, 105",
            "12B45X, 12845X",
            "4L7, 447",
            "MICHELIN, MICHELIN",
            "hello, hello"
    })
    void correctsLookAlikeCharacters(String input, String expected) {
        assertThat(corrector.correct(input)).isEqualTo(expected);
    }
}
