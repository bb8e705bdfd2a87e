package io.mersel.services.xbrl.infrastructure;

/**
 * Olgu taramasının ilk geçişinde toplanan eleman özeti.
 *
 * @param localName  Eleman yerel adı
 * @param namespace  Namespace URI (namespace yoksa boş metin)
 * @param contextRef {@code contextRef} özniteliği, yoksa {@code null}
 * @param unitRef    {@code unitRef} özniteliği, yoksa {@code null}
 * @param decimals   {@code decimals} özniteliği, yoksa {@code null}
 * @param text       Ham metin içeriği
 */
public record FactCandidate(
        String localName,
        String namespace,
        String contextRef,
        String unitRef,
        String decimals,
        String text
) {
}
