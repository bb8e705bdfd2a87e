package io.mersel.services.xbrl.application.enums;

import java.util.Locale;

/**
 * Doğrulama kuralı tipleri.
 * <p>
 * Kural tipi, koşul metninin nasıl yorumlanacağını daraltır:
 * örneğin {@link #FORMAT} kuralında tanınmayan bir koşul düzenli ifade olarak ele alınır.
 */
public enum RuleType {
    REQUIRED,
    FORMAT,
    RANGE,
    CUSTOM,
    CELL;

    /**
     * Büyük/küçük harf duyarsız çözümleme. Tanınmayan değerler {@link #CUSTOM} olarak döner.
     */
    public static RuleType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CUSTOM;
        }
    }
}
