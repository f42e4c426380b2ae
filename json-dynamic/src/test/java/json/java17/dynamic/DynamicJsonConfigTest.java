package json.java17.dynamic;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Tests for [DynamicJsonConfig] system property parsing.
///
/// The static defaults are read once per JVM, so the parsing helpers are exercised directly
/// against a scratch property.
class DynamicJsonConfigTest extends DynamicLoggingConfig {

    private static final Logger LOG = Logger.getLogger(DynamicJsonConfigTest.class.getName());

    private static final String PROPERTY = "json.dynamic.test.scratch";

    @AfterEach
    void clearProperty() {
        System.clearProperty(PROPERTY);
    }

    @Test
    @DisplayName("Defaults apply when no system property is set")
    void testDefaultsWithoutProperties() {
        LOG.info(() -> "TEST: testDefaultsWithoutProperties");
        // Assumes the surefire run does not set the json.dynamic.* properties
        assertThat(DynamicJsonConfig.maxDepth()).isEqualTo(DynamicJsonConfig.DEFAULT_MAX_DEPTH);
        assertThat(DynamicJsonConfig.maxMemory()).isEqualTo(DynamicJsonConfig.DEFAULT_MAX_MEMORY);
        assertThat(DynamicJsonConfig.unmappableAsNull()).isTrue();
        assertThat(DecodeOptions.defaults().maxMemory()).isZero();
        assertThat(EncodeOptions.defaults().unmappableAsNull()).isTrue();
    }

    @Test
    void testPositiveLongParsesValidValue() {
        LOG.info(() -> "TEST: testPositiveLongParsesValidValue");
        System.setProperty(PROPERTY, " 4096 ");
        assertThat(DynamicJsonConfig.positiveLong(PROPERTY, 7, Long.MAX_VALUE, true)).isEqualTo(4096);
    }

    @Test
    void testPositiveLongFallsBackOnInvalidValues() {
        LOG.info(() -> "TEST: testPositiveLongFallsBackOnInvalidValues");
        System.setProperty(PROPERTY, "lots");
        assertThat(DynamicJsonConfig.positiveLong(PROPERTY, 7, Long.MAX_VALUE, true)).isEqualTo(7);
        System.setProperty(PROPERTY, "-1");
        assertThat(DynamicJsonConfig.positiveLong(PROPERTY, 7, Long.MAX_VALUE, true)).isEqualTo(7);
        System.setProperty(PROPERTY, "0");
        assertThat(DynamicJsonConfig.positiveLong(PROPERTY, 7, Long.MAX_VALUE, false)).isEqualTo(7);
        assertThat(DynamicJsonConfig.positiveLong(PROPERTY, 7, Long.MAX_VALUE, true)).isZero();
        System.setProperty(PROPERTY, "3000000000");
        assertThat(DynamicJsonConfig.positiveLong(PROPERTY, 7, Integer.MAX_VALUE, false)).isEqualTo(7);
    }

    @Test
    void testBoolParsing() {
        LOG.info(() -> "TEST: testBoolParsing");
        assertThat(DynamicJsonConfig.bool(PROPERTY, true)).isTrue();
        System.setProperty(PROPERTY, "FALSE");
        assertThat(DynamicJsonConfig.bool(PROPERTY, true)).isFalse();
        System.setProperty(PROPERTY, "maybe");
        assertThat(DynamicJsonConfig.bool(PROPERTY, false)).isFalse();
    }
}
