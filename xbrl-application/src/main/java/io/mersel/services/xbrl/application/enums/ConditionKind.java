package io.mersel.services.xbrl.application.enums;

/**
 * Kural koşul dilinin kapalı varyant kümesi.
 * <p>
 * {@link #OTHER} tanınmayan koşulları temsil eder ve her zaman "geçti" olarak değerlendirilir.
 */
public enum ConditionKind {
    NOT_EMPTY,
    NUMERIC,
    RANGE,
    COMPARISON,
    EMAIL,
    PHONE,
    DATE,
    PATTERN,
    ONE_OF,
    EQUALS,
    OTHER
}
