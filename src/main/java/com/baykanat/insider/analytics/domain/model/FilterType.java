package com.baykanat.insider.analytics.domain.model;

import java.util.Arrays;
import java.util.Optional;

/** Filtre operatörleri; contains/not_contains değeri % ile sarar. */
public enum FilterType {

    EQUALS("equals", "=", false),
    NOT_EQUALS("not_equals", "!=", false),
    CONTAINS("contains", "LIKE", true),
    NOT_CONTAINS("not_contains", "NOT LIKE", true);

    private final String value;
    private final String operator;
    private final boolean wildcard;

    FilterType(String value, String operator, boolean wildcard) {
        this.value = value;
        this.operator = operator;
        this.wildcard = wildcard;
    }

    public String getValue() {
        return value;
    }

    public String getOperator() {
        return operator;
    }

    /** LIKE operatörleri için değeri joker karakterlerle sarar. */
    public String decorate(String rawValue) {
        return wildcard ? "%" + rawValue + "%" : rawValue;
    }

    public static Optional<FilterType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
