package io.mersel.services.xbrl.application.models.xbrl;

import java.util.List;

/**
 * Taksonomiden türetilen doğrulama şablonu. Saklanmaz, her seferinde türetilir.
 *
 * @param taxonomy         Kaynak taksonomi
 * @param requiredConcepts Soyut olmayan tüm kavramlar (her biri bir kez)
 * @param validationRules  Kavram başına varsayılan kurallar
 * @param reportingPeriods Desteklenen raporlama dönemleri
 * @param currencies       Desteklenen para birimleri
 */
public record XbrlTemplate(
        XbrlTaxonomy taxonomy,
        List<String> requiredConcepts,
        List<TemplateRule> validationRules,
        List<String> reportingPeriods,
        List<String> currencies
) {

    public XbrlTemplate {
        requiredConcepts = List.copyOf(requiredConcepts);
        validationRules = List.copyOf(validationRules);
        reportingPeriods = List.copyOf(reportingPeriods);
        currencies = List.copyOf(currencies);
    }
}
