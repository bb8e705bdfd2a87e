package io.mersel.services.xbrl.application.models.xbrl;

/**
 * Belgeden türetilen özet bilgiler.
 *
 * @param entity   İlk bağlamın işletme tanımlayıcısı
 * @param period   En geç kapanış tarihi
 * @param currency İlk ISO 4217 birimindeki para birimi kodu
 * @param language Kök elemandaki {@code xml:lang}
 */
public record XbrlMetadata(String entity, String period, String currency, String language) {

    public XbrlMetadata {
        entity = entity != null ? entity : "";
        period = period != null ? period : "";
        currency = currency != null ? currency : "";
        language = language != null ? language : "";
    }
}
