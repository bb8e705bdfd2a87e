package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.SubmissionValidationReport;
import io.mersel.services.xbrl.application.models.ValidationRule;

import java.util.List;

/**
 * Bir gönderimin sayfalarını kural kümesine göre doğrulayan orkestratör.
 */
public interface ISubmissionValidator {

    /**
     * Tüm sayfaları doğrular.
     * <p>
     * Saf ve tekrarlanabilir bir işlemdir: aynı girdi her zaman aynı sonuç kümesini üretir.
     *
     * @param submissionId Gönderim kimliği
     * @param rules        Kural kümesi
     * @param sheets       Sayfa ızgaraları
     * @return Sonuçlar, kural teşhisleri ve özet
     */
    SubmissionValidationReport validate(long submissionId, List<ValidationRule> rules, List<SheetGrid> sheets);

    /**
     * Tek sayfalık gönderimler için kısayol.
     */
    default SubmissionValidationReport validate(long submissionId, List<ValidationRule> rules, SheetGrid sheet) {
        return validate(submissionId, rules, List.of(sheet));
    }
}
