package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.interfaces.IXbrlGenerator;
import io.mersel.services.xbrl.application.interfaces.XbrlGenerationException;
import io.mersel.services.xbrl.application.models.xbrl.XbrlContext;
import io.mersel.services.xbrl.application.models.xbrl.XbrlFact;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlNamespaces;
import io.mersel.services.xbrl.application.models.xbrl.XbrlPeriod;
import io.mersel.services.xbrl.application.models.xbrl.XbrlUnit;
import io.mersel.services.xbrl.infrastructure.config.XbrlProperties;
import io.mersel.services.xbrl.infrastructure.diagnostics.ValidationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DOM tabanlı XBRL instance üreticisi.
 * <p>
 * Önce ağaç tümüyle kurulur, sonra tek geçişte serileştirilir. Eleman sırası sabittir:
 * {@code link:schemaRef}, bağlamlar, birimler, olgular (her grup kaynak sırasıyla).
 * Olgular kendi namespace'lerinde, kök elemanda tanımlanan öneklerle yazılır.
 */
@Service
public class DomXbrlGenerator implements IXbrlGenerator {

    private static final Logger log = LoggerFactory.getLogger(DomXbrlGenerator.class);

    static final String DEFAULT_CONTEXT_REF = "default";

    private static final String XMLNS = XMLConstants.XMLNS_ATTRIBUTE_NS_URI;

    private final XbrlNamespaces namespaces;
    private final XbrlProperties properties;
    private final ValidationMetrics metrics;

    public DomXbrlGenerator(XbrlNamespaces namespaces, XbrlProperties properties, ValidationMetrics metrics) {
        this.namespaces = namespaces;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public byte[] generate(XbrlInstance instance) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            Document document = buildTree(instance);
            byte[] xml = serialize(document);
            success = true;
            log.debug("XBRL üretildi — {} bağlam, {} birim, {} olgu, {} byte",
                    instance.contexts().size(), instance.units().size(), instance.facts().size(), xml.length);
            return xml;
        } catch (ParserConfigurationException | TransformerException e) {
            throw new XbrlGenerationException("XBRL belgesi üretilemedi: " + e.getMessage(), e);
        } catch (DOMException e) {
            throw new XbrlGenerationException("XBRL belgesinde geçersiz ad: " + e.getMessage(), e);
        } finally {
            metrics.recordDocumentOperation("generate", success, System.currentTimeMillis() - start);
        }
    }

    @Override
    public void write(XbrlInstance instance, Path target) throws IOException {
        byte[] xml = generate(instance);

        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
        boolean moved = false;
        try {
            Files.write(temp, xml);
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("XBRL yazımı iptal edildi: " + target);
            }
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomik taşıma desteklenmiyor, normal taşıma kullanılıyor: {}", directory);
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
            log.info("XBRL raporu yazıldı: {} ({} byte)", absolute, xml.length);
        } finally {
            if (!moved) {
                Files.deleteIfExists(temp);
            }
        }
    }

    // ── Ağaç kurulumu ──────────────────────────────────────────────

    private Document buildTree(XbrlInstance instance) throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        Document document = factory.newDocumentBuilder().newDocument();
        document.setXmlStandalone(true);

        Element root = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:xbrl");
        root.setAttributeNS(XMLNS, "xmlns:xbrli", XbrlNamespaces.XBRLI);
        root.setAttributeNS(XMLNS, "xmlns:xlink", XbrlNamespaces.XLINK);
        root.setAttributeNS(XMLNS, "xmlns:xsi", XbrlNamespaces.XSI);
        root.setAttributeNS(XMLNS, "xmlns:link", XbrlNamespaces.LINK);
        if (!instance.metadata().language().isEmpty()) {
            root.setAttributeNS(XMLConstants.XML_NS_URI, "xml:lang", instance.metadata().language());
        }

        boolean monetary = instance.units().stream()
                .anyMatch(u -> u.measure().startsWith("iso4217:"));
        if (monetary) {
            root.setAttributeNS(XMLNS, "xmlns:iso4217", XbrlNamespaces.ISO4217);
        }

        Map<String, String> factPrefixes = assignFactPrefixes(instance);
        factPrefixes.forEach((uri, prefix) -> root.setAttributeNS(XMLNS, "xmlns:" + prefix, uri));
        document.appendChild(root);

        Element schemaRef = document.createElementNS(XbrlNamespaces.LINK, "link:schemaRef");
        schemaRef.setAttributeNS(XbrlNamespaces.XLINK, "xlink:type", "simple");
        schemaRef.setAttributeNS(XbrlNamespaces.XLINK, "xlink:href", instance.schemaRef());
        root.appendChild(schemaRef);

        for (XbrlContext context : instance.contexts()) {
            root.appendChild(contextElement(document, context));
        }
        for (XbrlUnit unit : instance.units()) {
            root.appendChild(unitElement(document, unit));
        }
        for (XbrlFact fact : instance.facts()) {
            root.appendChild(factElement(document, fact, factPrefixes));
        }
        return document;
    }

    /**
     * Olgu namespace'lerine önek atar: yapılandırmada bağlı önek varsa o, yoksa ns1, ns2...
     */
    private Map<String, String> assignFactPrefixes(XbrlInstance instance) {
        Map<String, String> prefixes = new LinkedHashMap<>();
        int counter = 0;
        for (XbrlFact fact : instance.facts()) {
            String uri = fact.namespace();
            if (uri == null || uri.isBlank() || prefixes.containsKey(uri)) {
                continue;
            }
            String prefix = namespaces.prefixFor(uri);
            if (prefix == null || namespaces.isStructural(uri) || isReservedPrefix(prefix) || prefixes.containsValue(prefix)) {
                do {
                    prefix = "ns" + (++counter);
                } while (prefixes.containsValue(prefix));
            }
            prefixes.put(uri, prefix);
        }
        return prefixes;
    }

    private static boolean isReservedPrefix(String prefix) {
        return switch (prefix) {
            case "xbrli", "xlink", "xsi", "link", "iso4217", "xml" -> true;
            default -> false;
        };
    }

    private Element contextElement(Document document, XbrlContext context) {
        Element element = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:context");
        element.setAttributeNS(null, "id", context.id());

        Element entity = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:entity");
        Element identifier = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:identifier");
        identifier.setAttributeNS(null, "scheme", properties.getEntityScheme());
        identifier.setTextContent(context.entity());
        entity.appendChild(identifier);
        element.appendChild(entity);

        Element period = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:period");
        XbrlPeriod value = context.period();
        if (value.hasInstant()) {
            period.appendChild(textElement(document, "xbrli:instant", value.instant()));
        } else if (value.hasDuration()) {
            period.appendChild(textElement(document, "xbrli:startDate", value.startDate()));
            period.appendChild(textElement(document, "xbrli:endDate", value.endDate()));
        } else {
            period.appendChild(document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:forever"));
        }
        element.appendChild(period);
        return element;
    }

    private Element unitElement(Document document, XbrlUnit unit) {
        Element element = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:unit");
        element.setAttributeNS(null, "id", unit.id());

        int slash = unit.measure().indexOf('/');
        if (slash > 0) {
            Element divide = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:divide");
            Element numerator = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:unitNumerator");
            numerator.appendChild(textElement(document, "xbrli:measure", unit.measure().substring(0, slash)));
            Element denominator = document.createElementNS(XbrlNamespaces.XBRLI, "xbrli:unitDenominator");
            denominator.appendChild(textElement(document, "xbrli:measure", unit.measure().substring(slash + 1)));
            divide.appendChild(numerator);
            divide.appendChild(denominator);
            element.appendChild(divide);
        } else {
            element.appendChild(textElement(document, "xbrli:measure", unit.measure()));
        }
        return element;
    }

    private Element factElement(Document document, XbrlFact fact, Map<String, String> prefixes) {
        Element element;
        if (fact.namespace() != null && !fact.namespace().isBlank()) {
            element = document.createElementNS(fact.namespace(), prefixes.get(fact.namespace()) + ":" + fact.name());
        } else {
            element = document.createElementNS(null, fact.name());
        }
        String contextRef = fact.context() != null && !fact.context().isBlank() ? fact.context() : DEFAULT_CONTEXT_REF;
        element.setAttributeNS(null, "contextRef", contextRef);
        if (fact.unit() != null && !fact.unit().isBlank()) {
            element.setAttributeNS(null, "unitRef", fact.unit());
        }
        if (fact.decimals() != null) {
            element.setAttributeNS(null, "decimals", String.valueOf(fact.decimals()));
        }
        element.setTextContent(fact.value());
        return element;
    }

    private static Element textElement(Document document, String qualifiedName, String text) {
        Element element = document.createElementNS(XbrlNamespaces.XBRLI, qualifiedName);
        element.setTextContent(text);
        return element;
    }

    // ── Serileştirme ───────────────────────────────────────────────

    private static byte[] serialize(Document document) throws TransformerException {
        // Saxon sınıf yolunda olsa da JDK'nın yerleşik serileştiricisi kullanılır
        TransformerFactory factory = TransformerFactory.newDefaultInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        Transformer transformer = factory.newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

        var out = new ByteArrayOutputStream();
        transformer.transform(new DOMSource(document), new StreamResult(out));
        return out.toByteArray();
    }
}
