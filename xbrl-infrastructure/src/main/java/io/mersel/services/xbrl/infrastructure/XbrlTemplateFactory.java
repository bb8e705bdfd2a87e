package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.interfaces.IXbrlTemplateFactory;
import io.mersel.services.xbrl.application.models.xbrl.TaxonomyConcept;
import io.mersel.services.xbrl.application.models.xbrl.TemplateRule;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTaxonomy;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTemplate;
import io.mersel.services.xbrl.infrastructure.config.XbrlProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Taksonomiden doğrulama şablonu türetir.
 * <p>
 * Soyut kavramlar gruplama düğümüdür ve zorunlu listeye girmez. Aynı adla birden fazla
 * tanımlanan kavram bir kez listelenir (ilk tanım geçerlidir).
 */
@Service
public class XbrlTemplateFactory implements IXbrlTemplateFactory {

    private static final Logger log = LoggerFactory.getLogger(XbrlTemplateFactory.class);

    private final XbrlProperties properties;

    public XbrlTemplateFactory(XbrlProperties properties) {
        this.properties = properties;
    }

    @Override
    public XbrlTemplate createTemplate(XbrlTaxonomy taxonomy) {
        Map<String, TaxonomyConcept> required = new LinkedHashMap<>();
        for (TaxonomyConcept concept : taxonomy.concepts()) {
            if (!concept.abstractConcept() && concept.name() != null && !concept.name().isBlank()) {
                required.putIfAbsent(concept.name(), concept);
            }
        }

        var rules = new ArrayList<TemplateRule>();
        for (TaxonomyConcept concept : required.values()) {
            if (concept.isMonetary()) {
                rules.add(new TemplateRule(concept.name(), TemplateRule.NUMERIC,
                        concept.label() + " sayısal bir değer olmalıdır"));
            } else {
                rules.add(new TemplateRule(concept.name(), TemplateRule.REQUIRED,
                        concept.label() + " zorunludur"));
            }
        }

        log.debug("Şablon türetildi — {} kavramdan {} zorunlu", taxonomy.concepts().size(), required.size());
        return new XbrlTemplate(
                taxonomy,
                List.copyOf(required.keySet()),
                rules,
                properties.getReportingPeriods(),
                properties.getCurrencies());
    }
}
