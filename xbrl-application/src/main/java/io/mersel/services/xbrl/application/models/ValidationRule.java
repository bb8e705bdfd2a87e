package io.mersel.services.xbrl.application.models;

import io.mersel.services.xbrl.application.enums.RuleType;
import io.mersel.services.xbrl.application.enums.Severity;

/**
 * Adreslenebilir tablo doğrulama kuralı.
 * <p>
 * Adresleme önceliği: {@code cellRange} &gt; {@code rowRange}/{@code columnRange} &gt;
 * {@code applyToAllRows} &gt; tek {@code field} referansı. Aynı anda yalnızca bir mod geçerlidir.
 *
 * @param id             Kural kimliği (kalıcı depoda yoksa {@code null})
 * @param templateId     Şablon kimliği
 * @param sheetId        Sayfa kimliği ({@code null} ise tüm sayfalara uygulanır)
 * @param ruleType       Kural tipi
 * @param field          Alan adı, başlık adı veya hücre adresi (örn: "A27", "Company Name")
 * @param condition      Koşul metni (örn: "NOT_EMPTY", "min:0,max:100")
 * @param errorMessage   Kural başarısız olduğunda gösterilecek mesaj
 * @param severity       Önem derecesi
 * @param rowRange       Satır aralığı (örn: "2-100", "5", "10-*")
 * @param columnRange    Sütun aralığı (örn: "A-Z", "B", "C-E")
 * @param cellRange      Hücre kutusu (örn: "A2:Z100", "B5")
 * @param applyToAllRows Alanın tüm veri satırlarına uygulanıp uygulanmayacağı
 * @param active         Pasif kurallar değerlendirilmez ({@code null} ise aktif kabul edilir)
 */
public record ValidationRule(
        Long id,
        Long templateId,
        Long sheetId,
        RuleType ruleType,
        String field,
        String condition,
        String errorMessage,
        Severity severity,
        String rowRange,
        String columnRange,
        String cellRange,
        boolean applyToAllRows,
        Boolean active
) {

    public ValidationRule {
        ruleType = ruleType != null ? ruleType : RuleType.CUSTOM;
        field = field != null ? field.strip() : "";
        condition = condition != null ? condition : "";
        errorMessage = errorMessage != null ? errorMessage : "";
        severity = severity != null ? severity : Severity.ERROR;
        active = active == null || active;
    }

    public boolean hasCellRange() {
        return cellRange != null && !cellRange.isBlank();
    }

    public boolean hasRowOrColumnRange() {
        return (rowRange != null && !rowRange.isBlank()) || (columnRange != null && !columnRange.isBlank());
    }
}
