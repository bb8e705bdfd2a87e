package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.interfaces.IValidationResultSink;
import io.mersel.services.xbrl.application.models.SubmissionValidationReport;
import io.mersel.services.xbrl.application.models.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Kalıcı depo bağlanmadığında kullanılan sonuç alıcısı; raporu yalnızca loglar.
 */
@Component
public class LoggingValidationResultSink implements IValidationResultSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingValidationResultSink.class);

    @Override
    public void accept(SubmissionValidationReport report) {
        log.info("Gönderim {} sonuçları alındı — {} sonuç, {} başarısız, {} teşhis",
                report.submissionId(), report.results().size(), report.failures().size(), report.diagnostics().size());
        if (log.isDebugEnabled()) {
            for (ValidationResult failure : report.failures()) {
                log.debug("  [{}] {}!{} = '{}' → {}", failure.severity(), failure.sheetName(),
                        failure.cellReference(), failure.cellValue(), failure.message());
            }
        }
    }
}
