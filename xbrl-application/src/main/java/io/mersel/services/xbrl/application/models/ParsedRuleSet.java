package io.mersel.services.xbrl.application.models;

import java.util.List;
import java.util.Map;

/**
 * Kural tanım dosyasının ayrıştırma çıktısı.
 * <p>
 * İçerik sorunları istisna fırlatmaz; {@code errors} listesinde toplanır.
 *
 * @param rules    Ayrıştırılan kurallar
 * @param metadata Dosya üst bilgisi (templateName, version, description vb.)
 * @param errors   Atlanan bloklar/sütunlar için hata açıklamaları
 */
public record ParsedRuleSet(List<ValidationRule> rules, Map<String, String> metadata, List<String> errors) {

    public ParsedRuleSet {
        rules = List.copyOf(rules);
        metadata = Map.copyOf(metadata);
        errors = List.copyOf(errors);
    }
}
