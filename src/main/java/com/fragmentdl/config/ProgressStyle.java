package com.fragmentdl.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum ProgressStyle {
    INLINE("inline"),
    FULL_SCREEN("full_screen"),
    SIMPLE("simple");

    private final String value;

    ProgressStyle(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ProgressStyle fromValue(String value) {
        for (ProgressStyle style : values()) {
            if (style.value.equalsIgnoreCase(value)) {
                return style;
            }
        }
        throw new IllegalArgumentException("Invalid progress style '" + value + "'. Use: " + allowedValues());
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(ProgressStyle::getValue).collect(Collectors.joining(", "));
    }
}
