package io.mersel.services.xbrl.application.interfaces;

/**
 * XBRL belgesi oluşturulurken veya serileştirilirken oluşan hata.
 */
public class XbrlGenerationException extends RuntimeException {

    public XbrlGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
