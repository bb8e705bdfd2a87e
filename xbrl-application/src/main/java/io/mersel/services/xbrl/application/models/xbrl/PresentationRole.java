package io.mersel.services.xbrl.application.models.xbrl;

import java.util.List;

/**
 * Bir sunum rolüne ({@code xlink:role}) ait kavram hiyerarşisi.
 */
public record PresentationRole(String role, List<PresentationNode> concepts) {

    public PresentationRole {
        concepts = List.copyOf(concepts);
    }
}
