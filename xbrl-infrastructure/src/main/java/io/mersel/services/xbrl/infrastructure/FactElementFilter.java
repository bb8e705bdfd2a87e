package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.models.xbrl.XbrlNamespaces;

import java.util.function.Predicate;

/**
 * Olgu taramasının ikinci geçişi: hangi elemanların olgu sayılacağına karar verir.
 * <p>
 * Namespace bağımsızdır; bir eleman şu koşullarda olgudur:
 * <ul>
 *   <li>boş olmayan {@code contextRef} özniteliği taşıyor</li>
 *   <li>{@code xbrli}, {@code link} veya {@code xs} yapısal namespace'lerinden birinde değil</li>
 * </ul>
 */
public class FactElementFilter implements Predicate<FactCandidate> {

    private final XbrlNamespaces namespaces;

    public FactElementFilter(XbrlNamespaces namespaces) {
        this.namespaces = namespaces;
    }

    @Override
    public boolean test(FactCandidate candidate) {
        return candidate.contextRef() != null
                && !candidate.contextRef().isBlank()
                && !namespaces.isStructural(candidate.namespace());
    }
}
