package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.SubmissionValidationReport;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlReportMapping;

import java.util.Map;

/**
 * Doğrulamadan geçmiş bir gönderimin alan değerlerinden {@link XbrlInstance} oluşturur.
 */
public interface IXbrlReportAssembler {

    /**
     * @param report      Gönderimin doğrulama raporu (PASSED olmalı)
     * @param fieldValues Alan adı → değer
     * @param mapping     Alan → kavram eşlemesi, bağlam ve birim bilgileri
     * @throws SubmissionNotPassedException rapor PASSED değilse
     */
    XbrlInstance assemble(SubmissionValidationReport report, Map<String, Object> fieldValues, XbrlReportMapping mapping);

    /**
     * Alan değerlerini ızgaradan okur: hücre adresleri doğrudan, başlık adları 2. satırdan.
     *
     * @throws SubmissionNotPassedException rapor PASSED değilse
     */
    XbrlInstance assemble(SubmissionValidationReport report, SheetGrid sheet, XbrlReportMapping mapping);
}
