package io.mersel.services.xbrl.application.models;

import io.mersel.services.xbrl.application.enums.RuleType;
import io.mersel.services.xbrl.application.enums.Severity;

/**
 * Tek bir (kural, hücre) çifti için doğrulama sonucu.
 * <p>
 * Oluşturulduktan sonra değişmez; üretildiği gönderime aittir.
 */
public record ValidationResult(
        long submissionId,
        Long ruleId,
        String field,
        RuleType ruleType,
        String condition,
        String cellReference,
        String cellValue,
        String message,
        Severity severity,
        boolean valid,
        String sheetName,
        Integer rowNumber,
        Integer columnNumber,
        String columnName
) {

    public boolean isFailedError() {
        return !valid && severity == Severity.ERROR;
    }

    public boolean isFailedWarning() {
        return !valid && severity == Severity.WARNING;
    }
}
