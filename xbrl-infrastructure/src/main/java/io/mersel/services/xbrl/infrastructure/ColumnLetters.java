package io.mersel.services.xbrl.infrastructure;

import java.util.Locale;

/**
 * Tablo sütun harfleri ile 1 tabanlı sütun numaraları arasında dönüşüm (A=1, Z=26, AA=27, ZZ=702).
 */
public final class ColumnLetters {

    // 6 harf int aralığında kalır (ZZZZZZ = 321272406)
    private static final int MAX_LENGTH = 6;

    private ColumnLetters() {
    }

    /**
     * Sütun harflerini sıra numarasına çevirir. Küçük harfler kabul edilir.
     *
     * @throws IllegalArgumentException boş, harf dışı karakter içeren veya çok uzun girdi
     */
    public static int toOrdinal(String letters) {
        if (letters == null || letters.isBlank()) {
            throw new IllegalArgumentException("Sütun harfi boş olamaz");
        }
        String normalized = letters.strip().toUpperCase(Locale.ROOT);
        if (normalized.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Sütun harfi çok uzun: " + letters);
        }
        int result = 0;
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Geçersiz sütun harfi: " + letters);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result;
    }

    /**
     * Sıra numarasını sütun harflerine çevirir.
     *
     * @throws IllegalArgumentException numara 1'den küçükse
     */
    public static String toLetters(int ordinal) {
        if (ordinal < 1) {
            throw new IllegalArgumentException("Sütun numarası 1'den küçük olamaz: " + ordinal);
        }
        var sb = new StringBuilder();
        int n = ordinal;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Girdi yalnızca A-Z harflerinden mi oluşuyor? (büyük/küçük harf duyarsız)
     */
    public static boolean isLetters(String value) {
        if (value == null || value.isEmpty() || value.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = Character.toUpperCase(value.charAt(i));
            if (c < 'A' || c > 'Z') {
                return false;
            }
        }
        return true;
    }
}
