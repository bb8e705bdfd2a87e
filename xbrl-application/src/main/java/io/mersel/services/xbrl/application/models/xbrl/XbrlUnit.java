package io.mersel.services.xbrl.application.models.xbrl;

/**
 * Sayısal olguların ölçü birimi (örn: {@code iso4217:USD}, {@code xbrli:shares}).
 */
public record XbrlUnit(String id, String measure) {

    public XbrlUnit {
        measure = measure != null ? measure : "";
    }
}
