package io.mersel.services.xbrl.application.models.xbrl;

/**
 * XBRL bağlamı: olgunun ait olduğu işletme ve dönem.
 * <p>
 * {@code id} belge içinde tekildir ve olgular tarafından {@code contextRef} ile referans alınır.
 *
 * @param id     Bağlam kimliği
 * @param entity İşletme tanımlayıcısı (identifier metni)
 * @param period Dönem
 */
public record XbrlContext(String id, String entity, XbrlPeriod period) {

    public XbrlContext {
        entity = entity != null ? entity : "";
        period = period != null ? period : XbrlPeriod.empty();
    }
}
