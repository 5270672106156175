package com.example.wheelcodereader.service.correction;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class WheelCodeGrammarTest {

    @ParameterizedTest
    @ValueSource(strings = {"AT64202", "ABC1234", "1234A5", "1234AB5"})
    void acceptsKnownCodeLayouts(String code) {
        assertThat(WheelCodeGrammar.matches(code)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"AT6O2O2", "at64202", "AT642021", "1234", "MICHELIN", ""})
    void rejectsEverythingElse(String text) {
        assertThat(WheelCodeGrammar.matches(text)).isFalse();
    }
}
