package io.segmentnav.core.model;

import java.util.Objects;

/**
 * Identity of one input segment as read by the upstream lexer: its tag plus up to two qualifying
 * element values.
 *
 * <p>
 * Immutable, thread-safe. Empty qualifier values are normalized to {@code null} so that "absent"
 * has a single representation. Whitespace is a real value.
 *
 * @param wireName    the segment tag (e.g. "NAD")
 * @param firstValue  value of the first qualifying element, or {@code null}
 * @param secondValue value of the second qualifying element, or {@code null}
 */
public record TokenIdentity(String wireName, String firstValue, String secondValue) {

    /** Canonical constructor: validates the tag and normalizes empty qualifiers. */
    public TokenIdentity {
        Objects.requireNonNull(wireName, "wireName must not be null");
        firstValue = emptyToNull(firstValue);
        secondValue = emptyToNull(secondValue);
    }

    /** Identity with no qualifier values. */
    public static TokenIdentity of(String wireName) {
        return new TokenIdentity(wireName, null, null);
    }

    /** Identity with a first qualifier value only. */
    public static TokenIdentity of(String wireName, String firstValue) {
        return new TokenIdentity(wireName, firstValue, null);
    }

    public static TokenIdentity of(String wireName, String firstValue, String secondValue) {
        return new TokenIdentity(wireName, firstValue, secondValue);
    }

    public boolean hasFirstValue() {
        return firstValue != null;
    }

    public boolean hasSecondValue() {
        return secondValue != null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
