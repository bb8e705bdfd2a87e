package io.mersel.services.xbrl.application.models.xbrl;

/**
 * XBRL olgusu: bir taksonomi kavramının belirli bir bağlamdaki değeri.
 *
 * @param name      Kavram adı (yerel ad, önek içermez)
 * @param type      Kavram tipi ("monetary", "decimal", "string" vb.)
 * @param period    Dönem tipi ("instant" veya "duration")
 * @param value     Metin değeri
 * @param unit      Birim referansı ({@code unitRef}), sayısal değilse {@code null}
 * @param context   Bağlam referansı ({@code contextRef})
 * @param decimals  Ondalık hassasiyet, belirtilmemişse {@code null}
 * @param namespace Kavramın namespace URI'ı, bilinmiyorsa {@code null}
 */
public record XbrlFact(
        String name,
        String type,
        String period,
        String value,
        String unit,
        String context,
        Integer decimals,
        String namespace
) {

    public XbrlFact {
        value = value != null ? value : "";
    }
}
