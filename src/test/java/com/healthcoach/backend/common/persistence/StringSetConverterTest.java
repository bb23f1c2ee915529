package com.healthcoach.backend.common.persistence;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StringSetConverterTest {

    private final StringSetConverter c = new StringSetConverter();

    @Test
    void column_keeps_insertion_order() {
        assertThat(c.convertToDatabaseColumn(new LinkedHashSet<>(List.of("weight_loss", "muscle_gain"))))
                .isEqualTo("weight_loss,muscle_gain");
    }

    @Test
    void empty_and_null_become_empty_column() {
        assertThat(c.convertToDatabaseColumn(null)).isEmpty();
        assertThat(c.convertToDatabaseColumn(new LinkedHashSet<>())).isEmpty();
    }

    @Test
    void reading_skips_blanks_and_trims() {
        assertThat(c.convertToEntityAttribute(" vegan, ,gluten_free,")).containsExactly("vegan", "gluten_free");
        assertThat(c.convertToEntityAttribute(null)).isEmpty();
        assertThat(c.convertToEntityAttribute("   ")).isEmpty();
    }

    @Test
    void tag_with_separator_is_rejected_instead_of_split() {
        assertThatThrownBy(() -> c.convertToDatabaseColumn(new LinkedHashSet<>(List.of("vegan", "low_fat,dairy_free"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("low_fat,dairy_free");
    }
}
