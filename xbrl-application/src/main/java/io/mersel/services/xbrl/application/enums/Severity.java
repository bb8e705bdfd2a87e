package io.mersel.services.xbrl.application.enums;

import java.util.Locale;

/**
 * Doğrulama sonucu önem derecesi.
 */
public enum Severity {
    ERROR,
    WARNING;

    public static Severity fromValue(String value) {
        if (value != null && "warning".equals(value.strip().toLowerCase(Locale.ROOT))) {
            return WARNING;
        }
        return ERROR;
    }
}
