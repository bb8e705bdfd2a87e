package io.mersel.services.xbrl.application.enums;

/**
 * Gönderimin doğrulama sonrası durumu.
 * <p>
 * Yalnızca {@code ERROR} seviyesindeki başarısız sonuçlar gönderimi {@link #FAILED} yapar;
 * uyarılar görünür kalır ancak durumu etkilemez.
 */
public enum SubmissionStatus {
    PASSED,
    FAILED
}
