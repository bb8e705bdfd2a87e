package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTemplate;
import io.mersel.services.xbrl.application.models.xbrl.XbrlValidationResult;

/**
 * Instance belgesini şablona göre denetler.
 * <p>
 * Hatalar biriktirilir, ilk hatada durulmaz ve istisna fırlatılmaz.
 */
public interface IXbrlValidator {

    XbrlValidationResult validate(XbrlInstance instance, XbrlTemplate template);
}
