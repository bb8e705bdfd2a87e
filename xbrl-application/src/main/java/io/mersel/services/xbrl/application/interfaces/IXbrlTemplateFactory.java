package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.xbrl.XbrlTaxonomy;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTemplate;

/**
 * Taksonomiden doğrulama şablonu türetir.
 */
public interface IXbrlTemplateFactory {

    /**
     * Soyut olmayan her kavram bir kez zorunlu olur; parasal kavramlara "numeric",
     * diğerlerine "required" kuralı atanır.
     */
    XbrlTemplate createTemplate(XbrlTaxonomy taxonomy);
}
