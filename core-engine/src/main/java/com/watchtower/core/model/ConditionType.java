package com.watchtower.core.model;

import java.util.Locale;

/**
 * Comparison operators a {@link DataCondition} can apply to an observation.
 *
 * @since 1.0.0
 */
public enum ConditionType {

    GT("gt") {
        @Override
        public boolean test(double value, double comparison) {
            return value > comparison;
        }
    },
    GTE("gte") {
        @Override
        public boolean test(double value, double comparison) {
            return value >= comparison;
        }
    },
    LT("lt") {
        @Override
        public boolean test(double value, double comparison) {
            return value < comparison;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(double value, double comparison) {
            return value <= comparison;
        }
    },
    EQ("eq") {
        @Override
        public boolean test(double value, double comparison) {
            return Double.compare(value, comparison) == 0;
        }
    },
    NE("ne") {
        @Override
        public boolean test(double value, double comparison) {
            return Double.compare(value, comparison) != 0;
        }
    };

    private final String key;

    ConditionType(String key) {
        this.key = key;
    }

    /**
     * @param value      the observed value
     * @param comparison the configured operand
     * @return {@code true} if {@code value <op> comparison} holds
     */
    public abstract boolean test(double value, double comparison);

    public String getKey() {
        return key;
    }

    /**
     * Resolve a condition type from its configuration key ({@code gt},
     * {@code lte}, ...).
     *
     * @param key configuration key, case-insensitive
     * @return the matching type
     * @throws IllegalArgumentException if the key is unknown
     */
    public static ConditionType fromKey(String key) {
        if (key != null) {
            String normalised = key.trim().toLowerCase(Locale.ROOT);
            for (ConditionType type : values()) {
                if (type.key.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown condition type: '" + key
                + "'. Supported: gt, gte, lt, lte, eq, ne");
    }
}
