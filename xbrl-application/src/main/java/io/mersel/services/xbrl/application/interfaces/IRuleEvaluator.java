package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.RuleOutcome;
import io.mersel.services.xbrl.application.models.ValidationRule;

/**
 * Tek bir kuralın koşulunu tek bir hücre değerine uygular.
 * <p>
 * Tanınmayan koşullar "geçti" sayılır; uygulama hiçbir koşulda istisna fırlatmaz.
 */
public interface IRuleEvaluator {

    /**
     * @param rule      Değerlendirilecek kural
     * @param cellValue Hücre değeri ({@code null} = boş)
     * @return Geçti/kaldı bilgisi; kaldıysa mesaj kuralın hata mesajıdır
     */
    RuleOutcome evaluate(ValidationRule rule, Object cellValue);
}
