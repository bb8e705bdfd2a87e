package io.mersel.services.xbrl.application.interfaces;

/**
 * XBRL instance veya taksonomi belgesi ayrıştırılamadığında fırlatılan istisna.
 * <p>
 * Bozuk XML veya okunamayan kaynak durumlarında kullanılır; kısmi model döndürülmez.
 */
public class XbrlParseException extends Exception {

    public XbrlParseException(String message) {
        super(message);
    }

    public XbrlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
