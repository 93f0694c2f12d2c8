package com.example.osr.domain.document;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Value types of order fields, each with its format and range rule.
 */
public enum FieldType {

    QUANTITY {
        @Override
        public Optional<String> check(String value) {
            if (!DIGITS.matcher(value).matches()) {
                return Optional.of("must be a positive integer, got '" + value + "'");
            }
            if (value.length() > 6 || Integer.parseInt(value) == 0) {
                return Optional.of("must be between 1 and " + MAX_QUANTITY + ", got " + value);
            }
            return Optional.empty();
        }
    },

    CATALOG_CODE {
        @Override
        public Optional<String> check(String value) {
            return matches(CATALOG_CODE_PATTERN, value, "must be a catalog code [A-Za-z0-9][A-Za-z0-9_.-]{0,31}");
        }
    },

    LOCATION_CODE {
        @Override
        public Optional<String> check(String value) {
            return matches(LOCATION_PATTERN, value, "must be a location code without whitespace, at most 32 characters");
        }
    },

    ORDER_NUMBER {
        @Override
        public Optional<String> check(String value) {
            return matches(ORDER_NUMBER_PATTERN, value, "must match [A-Za-z0-9_-]{1,32}");
        }
    },

    COMPARTMENT_TYPE {
        @Override
        public Optional<String> check(String value) {
            return matches(COMPARTMENT_TYPE_PATTERN, value, "must match [a-z_]{1,16}");
        }
    },

    TEXT {
        @Override
        public Optional<String> check(String value) {
            if (value.length() > 64) {
                return Optional.of("must be at most 64 characters");
            }
            return Optional.empty();
        }
    };

    public static final int MAX_QUANTITY = 999_999;

    private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");
    private static final Pattern CATALOG_CODE_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,31}$");
    private static final Pattern LOCATION_PATTERN = Pattern.compile("^\\S{1,32}$");
    private static final Pattern ORDER_NUMBER_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,32}$");
    private static final Pattern COMPARTMENT_TYPE_PATTERN = Pattern.compile("^[a-z_]{1,16}$");

    /**
     * Checks a non-blank raw value.
     *
     * @param value the raw value, never blank
     * @return the rejection reason, or empty if the value is valid
     */
    public abstract Optional<String> check(String value);

    private static Optional<String> matches(Pattern pattern, String value, String reason) {
        return pattern.matcher(value).matches() ? Optional.empty() : Optional.of(reason);
    }
}
