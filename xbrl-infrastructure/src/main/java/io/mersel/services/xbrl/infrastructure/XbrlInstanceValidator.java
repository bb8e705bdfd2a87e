package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.interfaces.IXbrlValidator;
import io.mersel.services.xbrl.application.models.xbrl.TemplateRule;
import io.mersel.services.xbrl.application.models.xbrl.XbrlContext;
import io.mersel.services.xbrl.application.models.xbrl.XbrlFact;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTemplate;
import io.mersel.services.xbrl.application.models.xbrl.XbrlUnit;
import io.mersel.services.xbrl.application.models.xbrl.XbrlValidationResult;
import io.mersel.services.xbrl.infrastructure.diagnostics.ValidationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instance belgesini şablona göre denetler.
 * <p>
 * Hatalar:
 * <ul>
 *   <li>Eksik zorunlu kavramlar: tek bir toplu hata</li>
 *   <li>Olgu başına şablon kuralları ("numeric", "required")</li>
 *   <li>İşletme bilgisi olmayan bağlamlar</li>
 * </ul>
 * Uyarılar: bilinmeyen {@code contextRef}/{@code unitRef} ve tekrarlanan bağlam kimlikleri.
 * Tüm sorunlar tek geçişte toplanır; servis istisna fırlatmaz.
 */
@Service
public class XbrlInstanceValidator implements IXbrlValidator {

    private static final Logger log = LoggerFactory.getLogger(XbrlInstanceValidator.class);

    private final ValidationMetrics metrics;

    public XbrlInstanceValidator(ValidationMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public XbrlValidationResult validate(XbrlInstance instance, XbrlTemplate template) {
        long start = System.currentTimeMillis();
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        checkRequiredConcepts(instance, template, errors);
        checkFactRules(instance, template, errors);
        checkContexts(instance, errors, warnings);
        checkReferences(instance, warnings);

        XbrlValidationResult result = XbrlValidationResult.of(errors, warnings);
        metrics.recordDocumentOperation("validate", result.valid(), System.currentTimeMillis() - start);
        log.info("XBRL doğrulaması tamamlandı — geçerli: {}, hata: {}, uyarı: {}",
                result.valid(), errors.size(), warnings.size());
        return result;
    }

    private static void checkRequiredConcepts(XbrlInstance instance, XbrlTemplate template, List<String> errors) {
        Set<String> present = new HashSet<>();
        for (XbrlFact fact : instance.facts()) {
            present.add(fact.name());
        }
        var missing = new LinkedHashSet<String>();
        for (String concept : template.requiredConcepts()) {
            if (!present.contains(concept)) {
                missing.add(concept);
            }
        }
        if (!missing.isEmpty()) {
            errors.add("Zorunlu kavramlar eksik: " + String.join(", ", missing));
        }
    }

    private static void checkFactRules(XbrlInstance instance, XbrlTemplate template, List<String> errors) {
        Map<String, List<TemplateRule>> rulesByConcept = new HashMap<>();
        for (TemplateRule rule : template.validationRules()) {
            rulesByConcept.computeIfAbsent(rule.concept(), c -> new ArrayList<>()).add(rule);
        }
        for (XbrlFact fact : instance.facts()) {
            for (TemplateRule rule : rulesByConcept.getOrDefault(fact.name(), List.of())) {
                if (!satisfies(fact, rule)) {
                    errors.add(fact.name() + ": " + rule.message());
                }
            }
        }
    }

    private static boolean satisfies(XbrlFact fact, TemplateRule rule) {
        String value = fact.value();
        if (rule.rule() == null) {
            return true;
        }
        return switch (rule.rule()) {
            case TemplateRule.NUMERIC -> CellValues.parseDecimal(value) != null;
            case TemplateRule.REQUIRED -> value != null && !value.isBlank();
            default -> true;
        };
    }

    private static void checkContexts(XbrlInstance instance, List<String> errors, List<String> warnings) {
        Set<String> seen = new HashSet<>();
        for (XbrlContext context : instance.contexts()) {
            if (context.entity() == null || context.entity().isBlank()) {
                errors.add("Bağlam " + context.id() + ": işletme bilgisi eksik");
            }
            if (!seen.add(context.id())) {
                warnings.add("Bağlam kimliği tekrarlanıyor: " + context.id());
            }
        }
    }

    private static void checkReferences(XbrlInstance instance, List<String> warnings) {
        Set<String> contextIds = new HashSet<>();
        instance.contexts().forEach(c -> contextIds.add(c.id()));
        Set<String> unitIds = new HashSet<>();
        for (XbrlUnit unit : instance.units()) {
            unitIds.add(unit.id());
        }

        for (XbrlFact fact : instance.facts()) {
            if (fact.context() != null && !contextIds.contains(fact.context())) {
                warnings.add(fact.name() + ": tanımsız bağlam referansı '" + fact.context() + "'");
            }
            if (fact.unit() != null && !unitIds.contains(fact.unit())) {
                warnings.add(fact.name() + ": tanımsız birim referansı '" + fact.unit() + "'");
            }
        }
    }
}
