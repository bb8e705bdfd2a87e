package io.mersel.services.xbrl.application.models;

import io.mersel.services.xbrl.application.enums.SubmissionStatus;

import java.util.List;

/**
 * Bir gönderimin tam doğrulama çıktısı.
 *
 * @param submissionId Gönderim kimliği
 * @param results      (kural, hücre) başına tek sonuç
 * @param diagnostics  Atlanan kurallar için yazım hatası teşhisleri
 * @param summary      Sayımlar ve genel durum
 */
public record SubmissionValidationReport(
        long submissionId,
        List<ValidationResult> results,
        List<RuleDiagnostic> diagnostics,
        ValidationSummary summary
) {

    public SubmissionValidationReport {
        results = List.copyOf(results);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isPassed() {
        return summary.status() == SubmissionStatus.PASSED;
    }

    public List<ValidationResult> failures() {
        return results.stream().filter(r -> !r.valid()).toList();
    }
}
