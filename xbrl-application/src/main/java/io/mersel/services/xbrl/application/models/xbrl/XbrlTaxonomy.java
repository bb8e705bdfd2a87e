package io.mersel.services.xbrl.application.models.xbrl;

import java.util.List;

/**
 * Taksonomi: geçerli kavramlar ve sunum ilişkileri.
 */
public record XbrlTaxonomy(List<TaxonomyConcept> concepts, List<PresentationRole> presentations) {

    public XbrlTaxonomy {
        concepts = concepts != null ? List.copyOf(concepts) : List.of();
        presentations = presentations != null ? List.copyOf(presentations) : List.of();
    }
}
