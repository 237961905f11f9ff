package com.example.sickrock.dialect;

import com.example.sickrock.exception.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifiersTest {

    @ParameterizedTest
    @ValueSource(strings = {"contacts", "Contacts_2", "_private", "a"})
    void acceptsSafeNames(String name) {
        assertThat(Identifiers.validate(name, "table")).isEqualTo(name);
        assertThat(Identifiers.isValid(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "1st", "first name", "name;drop", "na\"me", "naïve", "_sr_shadow_x", "_SR_tmp"})
    void rejectsUnsafeNames(String name) {
        assertThatThrownBy(() -> Identifiers.validate(name, "column")).isInstanceOf(ValidationException.class);
        assertThat(Identifiers.isValid(name)).isFalse();
    }

    @Test
    void enforcesMaximumLength() {
        String longest = "t".repeat(Identifiers.MAX_LENGTH);

        assertThat(Identifiers.isValid(longest)).isTrue();
        assertThatThrownBy(() -> Identifiers.validate(longest + "x", "table"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("longer than 64");
    }

    @Test
    void nullIsRejected() {
        assertThatThrownBy(() -> Identifiers.validate(null, "table")).isInstanceOf(ValidationException.class);
        assertThat(Identifiers.isValid(null)).isFalse();
    }

    @Test
    void literalQuotesValidatedNames() {
        assertThat(Identifiers.literal("contacts")).isEqualTo("'contacts'");
        assertThatThrownBy(() -> Identifiers.literal("x' OR '1'='1")).isInstanceOf(ValidationException.class);
    }
}
