package io.mersel.services.xbrl.application.models;

/**
 * Tek bir kural koşulunun tek bir değer üzerindeki sonucu.
 *
 * @param valid   Koşul sağlandı mı
 * @param message Geçersizse kuralın hata mesajı, geçerliyse boş metin
 */
public record RuleOutcome(boolean valid, String message) {

    public static RuleOutcome pass() {
        return new RuleOutcome(true, "");
    }

    public static RuleOutcome fail(String message) {
        return new RuleOutcome(false, message != null ? message : "");
    }
}
