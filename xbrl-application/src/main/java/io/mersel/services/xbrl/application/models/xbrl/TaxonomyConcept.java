package io.mersel.services.xbrl.application.models.xbrl;

/**
 * Taksonomi şemasında tanımlı raporlanabilir kavram.
 * <p>
 * {@code abstract} kavramlar yalnızca gruplama düğümleridir; zorunlu kavram listesine girmez.
 */
public record TaxonomyConcept(
        String name,
        String type,
        String label,
        String documentation,
        boolean abstractConcept,
        String periodType,
        String balance
) {

    public TaxonomyConcept {
        type = type != null && !type.isBlank() ? type : "string";
        label = label != null && !label.isBlank() ? label : name;
    }

    public boolean isMonetary() {
        return "monetary".equals(type);
    }
}
