package io.mersel.services.xbrl.application.models.xbrl;

import java.util.List;

/**
 * Instance belgesinin şablona göre doğrulama sonucu.
 * <p>
 * {@code valid} yalnızca hata listesi boşken {@code true} olur; uyarılar etkilemez.
 */
public record XbrlValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public XbrlValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static XbrlValidationResult of(List<String> errors, List<String> warnings) {
        return new XbrlValidationResult(errors.isEmpty(), errors, warnings);
    }
}
