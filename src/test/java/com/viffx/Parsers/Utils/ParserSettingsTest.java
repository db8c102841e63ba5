package com.viffx.Parsers.Utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ParserSettings")
class ParserSettingsTest {

    @Test
    @DisplayName("the bundled resource holds the defaults")
    void load() {
        assertThat(ParserSettings.load()).isEqualTo(ParserSettings.defaults());
        assertThat(ParserSettings.defaults().maxStates()).isEqualTo(ParserSettings.DEFAULT_MAX_STATES);
    }

    @Test
    @DisplayName("missing keys fall back to the defaults")
    void fromProperties() {
        Properties properties = new Properties();
        properties.setProperty(ParserSettings.MAX_STATES, " 40 ");

        ParserSettings settings = ParserSettings.fromProperties(properties);

        assertThat(settings.maxStates()).isEqualTo(40);
        assertThat(settings.maxParseSteps()).isEqualTo(ParserSettings.DEFAULT_MAX_PARSE_STEPS);
    }

    @Test
    @DisplayName("rejects values that are not positive integers")
    void invalid() {
        Properties properties = new Properties();
        properties.setProperty(ParserSettings.MAX_PARSE_STEPS, "many");

        assertThatThrownBy(() -> ParserSettings.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parser.max-steps");
        assertThatThrownBy(() -> ParserSettings.defaults().withMaxStates(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("system properties override the resource")
    void override() {
        String key = ParserSettings.SYSTEM_PREFIX + ParserSettings.MAX_PARSE_STEPS;
        System.setProperty(key, "25");
        try {
            assertThat(ParserSettings.load().maxParseSteps()).isEqualTo(25);
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    @DisplayName("a missing resource yields empty properties")
    void missingResource() {
        assertThat(ParserSettings.loadProperties("no-such-file.properties")).isEmpty();
    }
}
