package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTaxonomy;

import java.nio.file.Path;

/**
 * XBRL instance ve taksonomi şema belgelerini bellek içi modele okur.
 * <p>
 * Bozuk XML ayrıştırmayı tümüyle başarısız kılar; eksik alt elemanlar boş koleksiyon üretir.
 */
public interface IXbrlParser {

    XbrlInstance parseInstance(Path file) throws XbrlParseException;

    XbrlInstance parseInstance(byte[] content) throws XbrlParseException;

    XbrlTaxonomy parseTaxonomy(Path file) throws XbrlParseException;

    XbrlTaxonomy parseTaxonomy(byte[] content) throws XbrlParseException;
}
