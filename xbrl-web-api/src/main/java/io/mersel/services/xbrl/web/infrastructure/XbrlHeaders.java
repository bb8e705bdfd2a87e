package io.mersel.services.xbrl.web.infrastructure;

/**
 * XBRL üretim uç noktalarının döndüğü özel HTTP response header sabitleri.
 *
 * <pre>
 * HTTP/1.1 200 OK
 * Content-Type: application/xml
 * X-Xbrl-Fact-Count: 12
 * X-Xbrl-Output-Size: 4821
 * </pre>
 */
public final class XbrlHeaders {

    private XbrlHeaders() {
    }

    /** Üretilen belgedeki olgu sayısı. */
    public static final String FACT_COUNT = "X-Xbrl-Fact-Count";

    /** Üretilen belgenin bayt cinsinden boyutu. */
    public static final String OUTPUT_SIZE = "X-Xbrl-Output-Size";
}
