package io.mersel.services.xbrl.application.enums;

import java.util.Locale;

/**
 * Desteklenen kural tanım dosyası biçimleri.
 */
public enum RuleFileFormat {
    YAML,
    TEXT;

    /**
     * Dosya adının uzantısından biçimi çözer.
     *
     * @throws IllegalArgumentException desteklenmeyen uzantı
     */
    public static RuleFileFormat fromFileName(String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
            return YAML;
        }
        if (lower.endsWith(".txt") || lower.endsWith(".rules")) {
            return TEXT;
        }
        throw new IllegalArgumentException("Desteklenmeyen kural dosyası biçimi: " + fileName);
    }
}
