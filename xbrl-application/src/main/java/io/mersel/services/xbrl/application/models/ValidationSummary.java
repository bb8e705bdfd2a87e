package io.mersel.services.xbrl.application.models;

import io.mersel.services.xbrl.application.enums.SubmissionStatus;

import java.util.List;

/**
 * Gönderim doğrulama özeti.
 *
 * @param totalRules   Değerlendirilen aktif kural sayısı
 * @param totalChecks  Üretilen sonuç sayısı
 * @param passedChecks Geçen sonuç sayısı
 * @param failedChecks Başarısız sonuç sayısı
 * @param errorCount   {@code ERROR} seviyesindeki başarısız sonuçlar
 * @param warningCount {@code WARNING} seviyesindeki başarısız sonuçlar
 * @param status       {@code errorCount > 0} ise FAILED, değilse PASSED
 */
public record ValidationSummary(
        int totalRules,
        int totalChecks,
        int passedChecks,
        int failedChecks,
        int errorCount,
        int warningCount,
        SubmissionStatus status
) {

    public static ValidationSummary of(int totalRules, List<ValidationResult> results) {
        int passed = 0;
        int errors = 0;
        int warnings = 0;
        for (ValidationResult result : results) {
            if (result.valid()) {
                passed++;
            } else if (result.isFailedError()) {
                errors++;
            } else if (result.isFailedWarning()) {
                warnings++;
            }
        }
        return new ValidationSummary(
                totalRules,
                results.size(),
                passed,
                results.size() - passed,
                errors,
                warnings,
                errors > 0 ? SubmissionStatus.FAILED : SubmissionStatus.PASSED);
    }
}
