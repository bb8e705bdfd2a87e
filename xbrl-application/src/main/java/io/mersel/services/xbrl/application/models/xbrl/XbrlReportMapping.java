package io.mersel.services.xbrl.application.models.xbrl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Doğrulanmış tablo alanlarının XBRL kavramlarına eşlemesi.
 *
 * @param schemaRef        Taksonomi şema referansı
 * @param namespace        Kavramların namespace URI'ı
 * @param entityIdentifier İşletme tanımlayıcısı
 * @param contextId        Üretilecek tek bağlamın kimliği
 * @param period           Raporlama dönemi
 * @param currency         ISO 4217 para birimi kodu (örn: "USD")
 * @param decimals         Sayısal olgular için ondalık hassasiyet ({@code null} olabilir)
 * @param conceptsByField  Alan (başlık adı veya hücre adresi) → kavram adı; sıra korunur
 * @param monetaryConcepts Parasal olarak yazılacak kavramlar
 */
public record XbrlReportMapping(
        String schemaRef,
        String namespace,
        String entityIdentifier,
        String contextId,
        XbrlPeriod period,
        String currency,
        Integer decimals,
        Map<String, String> conceptsByField,
        Set<String> monetaryConcepts
) {

    public XbrlReportMapping {
        contextId = contextId != null && !contextId.isBlank() ? contextId : "C1";
        period = period != null ? period : XbrlPeriod.empty();
        conceptsByField = conceptsByField != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(conceptsByField))
                : Map.of();
        monetaryConcepts = monetaryConcepts != null ? Set.copyOf(monetaryConcepts) : Set.of();
    }
}
