package org.celshape.config;

import org.celshape.InvalidOptionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShapeOptionsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ShapeOptions.CEL_VALIDATION_PROPERTY);
        System.clearProperty(ShapeOptions.SUBJECT_PROPERTY);
    }

    @Test
    void defaults() {
        ShapeOptions options = ShapeOptions.defaults();

        assertThat(options.isCelValidation()).isTrue();
        assertThat(options.getSubject()).isEqualTo("this");
    }

    @Test
    void defaults_comeFromSystemProperties() {
        System.setProperty(ShapeOptions.CEL_VALIDATION_PROPERTY, "0");
        System.setProperty(ShapeOptions.SUBJECT_PROPERTY, "self");

        ShapeOptions options = ShapeOptions.defaults();

        assertThat(options.isCelValidation()).isFalse();
        assertThat(options.getSubject()).isEqualTo("self");
    }

    @Test
    void parse_readsEveryKey() {
        ShapeOptions options = ShapeOptions.parse("cel_validation=true, cel_subject=msg");

        assertThat(options.isCelValidation()).isTrue();
        assertThat(options.getSubject()).isEqualTo("msg");
    }

    @Test
    void parse_acceptsNumericBooleans() {
        assertThat(ShapeOptions.parse("cel_validation=1").isCelValidation()).isTrue();
        assertThat(ShapeOptions.parse("cel_validation=0").isCelValidation()).isFalse();
        assertThat(ShapeOptions.parse("cel_validation=false").isCelValidation()).isFalse();
    }

    @Test
    void parse_blankOrEmptyPairs_keepDefaults() {
        assertThat(ShapeOptions.parse(null).isCelValidation()).isTrue();
        assertThat(ShapeOptions.parse("").getSubject()).isEqualTo("this");
        assertThat(ShapeOptions.parse(",cel_validation=false,").isCelValidation()).isFalse();
    }

    @Test
    void parse_overridesSystemProperty() {
        System.setProperty(ShapeOptions.CEL_VALIDATION_PROPERTY, "false");

        assertThat(ShapeOptions.parse("cel_validation=1").isCelValidation()).isTrue();
    }

    @Test
    void unknownKey_isRejected() {
        assertThatThrownBy(() -> ShapeOptions.parse("target=ts"))
                .isInstanceOf(InvalidOptionException.class)
                .satisfies(e -> {
                    InvalidOptionException ioe = (InvalidOptionException) e;
                    assertThat(ioe.getKey()).isEqualTo("target");
                    assertThat(ioe.getValue()).isEqualTo("ts");
                    assertThat(ioe.getMessage()).isEqualTo("Invalid option 'target=ts': unknown option");
                });
    }

    @Test
    void badBoolean_isRejected() {
        assertThatThrownBy(() -> ShapeOptions.parse("cel_validation=yes"))
                .isInstanceOf(InvalidOptionException.class)
                .hasMessageContaining("cel_validation=yes");
        assertThatThrownBy(() -> ShapeOptions.parse("cel_validation"))
                .isInstanceOf(InvalidOptionException.class);
    }

    @Test
    void badSubject_isRejected() {
        assertThatThrownBy(() -> ShapeOptions.parse("cel_subject=this.that"))
                .isInstanceOf(InvalidOptionException.class);
        assertThatThrownBy(() -> ShapeOptions.defaults().withSubject("1x"))
                .isInstanceOf(InvalidOptionException.class);
    }

    @Test
    void badSystemProperty_isRejected() {
        System.setProperty(ShapeOptions.CEL_VALIDATION_PROPERTY, "maybe");

        assertThatThrownBy(ShapeOptions::defaults)
                .isInstanceOf(InvalidOptionException.class)
                .satisfies(e -> assertThat(((InvalidOptionException) e).getKey())
                        .isEqualTo(ShapeOptions.CEL_VALIDATION_PROPERTY));
    }
}
