package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.enums.RuleFileFormat;
import io.mersel.services.xbrl.application.models.ParsedRuleSet;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Kural tanım dosyalarını (YAML veya düz metin) {@code ValidationRule} listesine çevirir.
 * <p>
 * İçerik hataları {@link ParsedRuleSet#errors()} içinde toplanır; yalnızca okunamayan
 * dosyalar için istisna fırlatılır.
 */
public interface IValidationRuleLoader {

    /**
     * Dosyayı uzantısına göre biçim belirleyerek yükler.
     *
     * @throws IOException dosya okunamazsa
     * @throws IllegalArgumentException uzantı tanınmıyorsa
     */
    ParsedRuleSet load(Path file, Long templateId) throws IOException;

    /**
     * Bellekteki içeriği ayrıştırır.
     */
    ParsedRuleSet parse(String content, RuleFileFormat format, Long templateId);
}
