package io.mersel.services.xbrl.application.models.xbrl;

/**
 * Şablondan türetilen kavram kuralı.
 *
 * @param concept Kavram adı
 * @param rule    "numeric" veya "required"
 * @param message Kural mesajı
 */
public record TemplateRule(String concept, String rule, String message) {

    public static final String NUMERIC = "numeric";
    public static final String REQUIRED = "required";
}
