package io.mersel.services.xbrl.application.models.xbrl;

import java.util.List;

/**
 * XBRL instance belgesinin bellek içi modeli.
 * <p>
 * Bağlamlar, birimler ve olgular kaynak sırasını korur.
 */
public record XbrlInstance(
        String schemaRef,
        List<XbrlContext> contexts,
        List<XbrlUnit> units,
        List<XbrlFact> facts,
        XbrlMetadata metadata
) {

    public XbrlInstance {
        schemaRef = schemaRef != null ? schemaRef : "";
        contexts = contexts != null ? List.copyOf(contexts) : List.of();
        units = units != null ? List.copyOf(units) : List.of();
        facts = facts != null ? List.copyOf(facts) : List.of();
        metadata = metadata != null ? metadata : new XbrlMetadata(null, null, null, null);
    }
}
