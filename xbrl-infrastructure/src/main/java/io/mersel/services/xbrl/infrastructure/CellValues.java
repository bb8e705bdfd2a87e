package io.mersel.services.xbrl.infrastructure;

import java.math.BigDecimal;

/**
 * Hücre değerlerinin metin ve sayı olarak okunması.
 */
public final class CellValues {

    private CellValues() {
    }

    /**
     * Hücre değerini metne çevirir. Tam sayı değerli {@code double}'lar ".0" olmadan yazılır,
     * {@link BigDecimal} bilimsel gösterime düşmez. {@code null} boş metindir.
     */
    public static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Değeri sonlu ondalık sayı olarak okur; okunamazsa {@code null}.
     */
    public static BigDecimal asNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return parseDecimal(String.valueOf(value));
    }

    /**
     * Metni ondalık sayı olarak okur; okunamazsa {@code null}.
     */
    public static BigDecimal parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
