package io.mersel.services.xbrl.application.models;

/**
 * Kural yazım hatası teşhisi.
 * <p>
 * Hatalı adresleme veya geçersiz düzenli ifade gibi yapılandırma sorunlarını taşır.
 * Gönderimin geçti/kaldı kararına dahil edilmez.
 *
 * @param ruleId    Sorunlu kuralın kimliği ({@code null} olabilir)
 * @param field     Kuralın alan tanımı
 * @param sheetName Değerlendirilen sayfa adı
 * @param message   Açıklama
 */
public record RuleDiagnostic(Long ruleId, String field, String sheetName, String message) {
}
