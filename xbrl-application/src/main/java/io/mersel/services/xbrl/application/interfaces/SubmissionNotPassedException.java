package io.mersel.services.xbrl.application.interfaces;

/**
 * Geçmemiş bir gönderim için XBRL üretimi istendiğinde fırlatılır (ön koşul ihlali).
 */
public class SubmissionNotPassedException extends RuntimeException {

    private final long submissionId;

    public SubmissionNotPassedException(long submissionId) {
        super("Gönderim doğrulamadan geçmedi, XBRL üretilemez: " + submissionId);
        this.submissionId = submissionId;
    }

    public long getSubmissionId() {
        return submissionId;
    }
}
