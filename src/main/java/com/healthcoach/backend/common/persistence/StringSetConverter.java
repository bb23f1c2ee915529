package com.healthcoach.backend.common.persistence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/** Tag sets (goals, restrictions, workout types) as one comma separated column; insertion order kept. */
@Converter(autoApply = false)
public class StringSetConverter implements AttributeConverter<Set<String>, String> {

    private static final String SEP = ",";

    @Override
    public String convertToDatabaseColumn(Set<String> tags) {
        if (tags == null || tags.isEmpty()) return "";
        return tags.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .peek(StringSetConverter::requireNoSeparator)
                .collect(Collectors.joining(SEP));
    }

    private static void requireNoSeparator(String tag) {
        if (tag.contains(SEP)) {
            throw new IllegalArgumentException("tag must not contain '" + SEP + "': " + tag);
        }
    }

    @Override
    public Set<String> convertToEntityAttribute(String s) {
        if (s == null || s.isBlank()) return new LinkedHashSet<>();
        return Arrays.stream(s.split(SEP))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
