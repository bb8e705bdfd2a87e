package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.SubmissionValidationReport;

/**
 * Doğrulama sonuçlarının teslim edildiği dış bileşen (kalıcı depo vb.).
 * <p>
 * Yazma disiplini (atomiklik, gönderim başına tek yazım) uygulamanın sorumluluğundadır.
 */
public interface IValidationResultSink {

    void accept(SubmissionValidationReport report);
}
