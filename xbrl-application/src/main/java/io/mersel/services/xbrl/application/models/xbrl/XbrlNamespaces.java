package io.mersel.services.xbrl.application.models.xbrl;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * XPath sorgularında ve üretimde kullanılan namespace önek bağlamaları.
 * <p>
 * Ortam durumu yerine ayrıştırıcıya açıkça verilir.
 *
 * @param bindings önek → namespace URI
 */
public record XbrlNamespaces(Map<String, String> bindings) {

    public static final String XBRLI = "http://www.xbrl.org/2003/instance";
    public static final String LINK = "http://www.xbrl.org/2003/linkbase";
    public static final String XLINK = "http://www.w3.org/1999/xlink";
    public static final String XSI = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String XS = "http://www.w3.org/2001/XMLSchema";
    public static final String ISO4217 = "http://www.xbrl.org/2003/iso4217";

    public XbrlNamespaces {
        bindings = Map.copyOf(bindings);
    }

    /**
     * XBRL 2.1 instance ve şema sözlükleri için standart bağlamalar.
     */
    public static XbrlNamespaces standard() {
        var map = new LinkedHashMap<String, String>();
        map.put("xbrli", XBRLI);
        map.put("link", LINK);
        map.put("xlink", XLINK);
        map.put("xsi", XSI);
        map.put("xs", XS);
        map.put("iso4217", ISO4217);
        return new XbrlNamespaces(map);
    }

    /**
     * Standart bağlamalara ek önekler ekler; aynı önek varsa ek değer kazanır.
     */
    public XbrlNamespaces with(Map<String, String> extra) {
        var merged = new LinkedHashMap<>(bindings);
        if (extra != null) {
            merged.putAll(extra);
        }
        return new XbrlNamespaces(merged);
    }

    /**
     * URI'a bağlı ilk öneki döndürür; yoksa {@code null}.
     */
    public String prefixFor(String namespaceUri) {
        for (var entry : bindings.entrySet()) {
            if (entry.getValue().equals(namespaceUri)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Yapısal (olgu olmayan) elemanların namespace'i mi?
     */
    public boolean isStructural(String namespaceUri) {
        return XBRLI.equals(namespaceUri) || LINK.equals(namespaceUri) || XS.equals(namespaceUri);
    }
}
