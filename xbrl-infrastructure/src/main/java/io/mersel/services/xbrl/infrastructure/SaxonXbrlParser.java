package io.mersel.services.xbrl.infrastructure;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.xbrl.application.interfaces.IXbrlParser;
import io.mersel.services.xbrl.application.interfaces.XbrlParseException;
import io.mersel.services.xbrl.application.models.xbrl.PresentationNode;
import io.mersel.services.xbrl.application.models.xbrl.PresentationRole;
import io.mersel.services.xbrl.application.models.xbrl.TaxonomyConcept;
import io.mersel.services.xbrl.application.models.xbrl.XbrlContext;
import io.mersel.services.xbrl.application.models.xbrl.XbrlFact;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlMetadata;
import io.mersel.services.xbrl.application.models.xbrl.XbrlNamespaces;
import io.mersel.services.xbrl.application.models.xbrl.XbrlPeriod;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTaxonomy;
import io.mersel.services.xbrl.application.models.xbrl.XbrlUnit;
import io.mersel.services.xbrl.infrastructure.config.XbrlProperties;
import io.mersel.services.xbrl.infrastructure.diagnostics.ValidationMetrics;
import net.sf.saxon.s9api.DocumentBuilder;
import net.sf.saxon.s9api.Processor;
import net.sf.saxon.s9api.QName;
import net.sf.saxon.s9api.SaxonApiException;
import net.sf.saxon.s9api.XPathCompiler;
import net.sf.saxon.s9api.XPathExecutable;
import net.sf.saxon.s9api.XPathSelector;
import net.sf.saxon.s9api.XdmItem;
import net.sf.saxon.s9api.XdmNode;
import net.sf.saxon.s9api.XdmValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.InputSource;
import org.xml.sax.XMLReader;

import javax.xml.parsers.SAXParserFactory;
import javax.xml.transform.sax.SAXSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Saxon HE tabanlı XBRL instance ve taksonomi ayrıştırıcısı.
 * <p>
 * XPath sorguları açık {@link XbrlNamespaces} bağlamalarıyla derlenir; ortam durumuna dayanmaz.
 * Olgular iki geçişte bulunur: önce tüm elemanlar {@link FactCandidate} olarak toplanır,
 * sonra {@link FactElementFilter} ile süzülür.
 * <p>
 * Bozuk XML {@link XbrlParseException} ile sonuçlanır. Eksik alt elemanlar boş koleksiyon üretir.
 * Dosyadan okunan taksonomiler yol ve değişiklik zamanına göre Caffeine ile önbelleğe alınır.
 */
@Service
public class SaxonXbrlParser implements IXbrlParser {

    private static final Logger log = LoggerFactory.getLogger(SaxonXbrlParser.class);

    private static final QName ID = new QName("id");
    private static final QName NAME = new QName("name");
    private static final QName TYPE = new QName("type");
    private static final QName ABSTRACT = new QName("abstract");
    private static final QName ORDER = new QName("order");
    private static final QName CONTEXT_REF = new QName("contextRef");
    private static final QName UNIT_REF = new QName("unitRef");
    private static final QName DECIMALS = new QName("decimals");
    private static final QName PERIOD_TYPE = new QName(XbrlNamespaces.XBRLI, "periodType");
    private static final QName BALANCE = new QName(XbrlNamespaces.XBRLI, "balance");
    private static final QName XLINK_ROLE = new QName(XbrlNamespaces.XLINK, "role");
    private static final QName XLINK_LABEL = new QName(XbrlNamespaces.XLINK, "label");
    private static final QName XLINK_HREF = new QName(XbrlNamespaces.XLINK, "href");
    private static final QName XLINK_FROM = new QName(XbrlNamespaces.XLINK, "from");
    private static final QName XLINK_TO = new QName(XbrlNamespaces.XLINK, "to");

    private final Processor processor;
    private final XbrlNamespaces namespaces;
    private final FactElementFilter factFilter;
    private final ValidationMetrics metrics;
    private final Cache<String, XbrlTaxonomy> taxonomyCache;

    // ── Derlenmiş XPath ifadeleri (thread-safe) ──
    private final XPathExecutable schemaRefPath;
    private final XPathExecutable contextsPath;
    private final XPathExecutable identifierPath;
    private final XPathExecutable instantPath;
    private final XPathExecutable startDatePath;
    private final XPathExecutable endDatePath;
    private final XPathExecutable unitsPath;
    private final XPathExecutable measurePath;
    private final XPathExecutable numeratorPath;
    private final XPathExecutable denominatorPath;
    private final XPathExecutable allElementsPath;
    private final XPathExecutable languagePath;
    private final XPathExecutable conceptsPath;
    private final XPathExecutable documentationPath;
    private final XPathExecutable presentationLinksPath;
    private final XPathExecutable locsPath;
    private final XPathExecutable arcsPath;

    public SaxonXbrlParser(XbrlNamespaces namespaces, XbrlProperties properties, ValidationMetrics metrics) {
        this.processor = new Processor(false);
        this.namespaces = namespaces;
        this.factFilter = new FactElementFilter(namespaces);
        this.metrics = metrics;
        this.taxonomyCache = Caffeine.newBuilder()
                .maximumSize(properties.getTaxonomyCache().getMaxSize())
                .expireAfterAccess(Duration.ofMinutes(properties.getTaxonomyCache().getExpireAfterAccessMinutes()))
                .build();
        metrics.registerTaxonomyCacheSizeGauge(taxonomyCache);

        XPathCompiler compiler = processor.newXPathCompiler();
        namespaces.bindings().forEach(compiler::declareNamespace);
        try {
            schemaRefPath = compiler.compile("string((//link:schemaRef)[1]/@xlink:href)");
            contextsPath = compiler.compile("//xbrli:context");
            identifierPath = compiler.compile("normalize-space((xbrli:entity/xbrli:identifier)[1])");
            instantPath = compiler.compile("normalize-space((xbrli:period/xbrli:instant)[1])");
            startDatePath = compiler.compile("normalize-space((xbrli:period/xbrli:startDate)[1])");
            endDatePath = compiler.compile("normalize-space((xbrli:period/xbrli:endDate)[1])");
            unitsPath = compiler.compile("//xbrli:unit");
            measurePath = compiler.compile("normalize-space((xbrli:measure)[1])");
            numeratorPath = compiler.compile("normalize-space((xbrli:divide/xbrli:unitNumerator/xbrli:measure)[1])");
            denominatorPath = compiler.compile("normalize-space((xbrli:divide/xbrli:unitDenominator/xbrli:measure)[1])");
            allElementsPath = compiler.compile("//*");
            languagePath = compiler.compile("string(/*/@xml:lang)");
            conceptsPath = compiler.compile("/xs:schema/xs:element[@name]");
            documentationPath = compiler.compile("normalize-space((xs:annotation/xs:documentation)[1])");
            presentationLinksPath = compiler.compile("//link:presentationLink");
            locsPath = compiler.compile("link:loc");
            arcsPath = compiler.compile("link:presentationArc");
        } catch (SaxonApiException e) {
            throw new IllegalStateException("XBRL XPath ifadeleri derlenemedi: " + e.getMessage(), e);
        }
        log.info("XBRL ayrıştırıcı hazır — {} namespace bağlaması", namespaces.bindings().size());
    }

    // ── Instance ───────────────────────────────────────────────────

    @Override
    public XbrlInstance parseInstance(Path file) throws XbrlParseException {
        return parseInstance(read(file));
    }

    @Override
    public XbrlInstance parseInstance(byte[] content) throws XbrlParseException {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            XdmNode document = build(content);

            String schemaRef = string(schemaRefPath, document);
            List<XbrlContext> contexts = readContexts(document);
            List<XbrlUnit> units = readUnits(document);
            List<XbrlFact> facts = readFacts(document, contexts, units);
            XbrlMetadata metadata = deriveMetadata(document, contexts, units);

            success = true;
            log.debug("XBRL instance ayrıştırıldı — bağlam: {}, birim: {}, olgu: {}",
                    contexts.size(), units.size(), facts.size());
            return new XbrlInstance(schemaRef, contexts, units, facts, metadata);
        } catch (SaxonApiException e) {
            throw new XbrlParseException("XBRL instance okunamadı: " + e.getMessage(), e);
        } finally {
            metrics.recordDocumentOperation("parse_instance", success, System.currentTimeMillis() - start);
        }
    }

    private List<XbrlContext> readContexts(XdmNode document) throws SaxonApiException {
        var contexts = new ArrayList<XbrlContext>();
        for (XdmItem item : evaluate(contextsPath, document)) {
            XdmNode node = (XdmNode) item;
            String instant = string(instantPath, node);
            String startDate = string(startDatePath, node);
            String endDate = string(endDatePath, node);

            XbrlPeriod period;
            if (!instant.isEmpty()) {
                period = XbrlPeriod.instant(instant);
            } else if (!startDate.isEmpty() && !endDate.isEmpty()) {
                period = XbrlPeriod.duration(startDate, endDate);
            } else {
                period = XbrlPeriod.empty();
            }
            contexts.add(new XbrlContext(attribute(node, ID), string(identifierPath, node), period));
        }
        return contexts;
    }

    private List<XbrlUnit> readUnits(XdmNode document) throws SaxonApiException {
        var units = new ArrayList<XbrlUnit>();
        for (XdmItem item : evaluate(unitsPath, document)) {
            XdmNode node = (XdmNode) item;
            String measure = string(measurePath, node);
            if (measure.isEmpty()) {
                String numerator = string(numeratorPath, node);
                String denominator = string(denominatorPath, node);
                if (!numerator.isEmpty() && !denominator.isEmpty()) {
                    measure = numerator + "/" + denominator;
                }
            }
            units.add(new XbrlUnit(attribute(node, ID), measure));
        }
        return units;
    }

    private List<XbrlFact> readFacts(XdmNode document, List<XbrlContext> contexts, List<XbrlUnit> units)
            throws SaxonApiException {
        // 1. geçiş: tüm elemanlar
        var candidates = new ArrayList<FactCandidate>();
        for (XdmItem item : evaluate(allElementsPath, document)) {
            XdmNode element = (XdmNode) item;
            QName name = element.getNodeName();
            candidates.add(new FactCandidate(
                    name.getLocalName(),
                    name.getNamespaceURI(),
                    element.getAttributeValue(CONTEXT_REF),
                    element.getAttributeValue(UNIT_REF),
                    element.getAttributeValue(DECIMALS),
                    element.getStringValue()));
        }

        Map<String, XbrlContext> contextById = new HashMap<>();
        contexts.forEach(c -> contextById.putIfAbsent(c.id(), c));
        Map<String, XbrlUnit> unitById = new HashMap<>();
        units.forEach(u -> unitById.putIfAbsent(u.id(), u));

        // 2. geçiş: süzme
        var facts = new ArrayList<XbrlFact>();
        for (FactCandidate candidate : candidates) {
            if (!factFilter.test(candidate)) {
                continue;
            }
            facts.add(new XbrlFact(
                    candidate.localName(),
                    factType(unitById.get(candidate.unitRef()), candidate.unitRef()),
                    periodKind(contextById.get(candidate.contextRef())),
                    factValue(candidate),
                    blankToNull(candidate.unitRef()),
                    candidate.contextRef(),
                    parseDecimals(candidate.decimals()),
                    blankToNull(candidate.namespace())));
        }
        return facts;
    }

    /**
     * Sayısal olgunun çevresindeki boşluk atılır; sayısal olmayan olgu metni olduğu gibi korunur.
     */
    private static String factValue(FactCandidate candidate) {
        boolean numeric = candidate.unitRef() != null && !candidate.unitRef().isBlank();
        return numeric ? candidate.text().strip() : candidate.text();
    }

    /**
     * Belgeden türetilen üst bilgi; sabit varsayılan değer kullanılmaz.
     */
    private XbrlMetadata deriveMetadata(XdmNode document, List<XbrlContext> contexts, List<XbrlUnit> units)
            throws SaxonApiException {
        String entity = contexts.isEmpty() ? "" : contexts.get(0).entity();

        String period = "";
        for (XbrlContext context : contexts) {
            String closing = context.period().closingDate();
            if (closing != null && closing.compareTo(period) > 0) {
                period = closing;
            }
        }

        String currency = "";
        for (XbrlUnit unit : units) {
            if (unit.measure().toLowerCase(Locale.ROOT).startsWith("iso4217:")) {
                currency = unit.measure().substring("iso4217:".length());
                break;
            }
        }

        return new XbrlMetadata(entity, period, currency, string(languagePath, document));
    }

    // ── Taksonomi ──────────────────────────────────────────────────

    @Override
    public XbrlTaxonomy parseTaxonomy(Path file) throws XbrlParseException {
        String key;
        try {
            key = file.toAbsolutePath().normalize() + "@" + Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            throw new XbrlParseException("Taksonomi dosyası okunamadı: " + file, e);
        }

        XbrlTaxonomy cached = taxonomyCache.getIfPresent(key);
        if (cached != null) {
            log.debug("Taksonomi önbellekten döndü: {}", file);
            return cached;
        }

        XbrlTaxonomy taxonomy = parseTaxonomy(read(file));
        taxonomyCache.put(key, taxonomy);
        log.info("Taksonomi yüklendi: {} — {} kavram, {} sunum rolü",
                file, taxonomy.concepts().size(), taxonomy.presentations().size());
        return taxonomy;
    }

    @Override
    public XbrlTaxonomy parseTaxonomy(byte[] content) throws XbrlParseException {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            XdmNode document = build(content);

            var concepts = new ArrayList<TaxonomyConcept>();
            Map<String, String> nameById = new HashMap<>();
            for (XdmItem item : evaluate(conceptsPath, document)) {
                XdmNode element = (XdmNode) item;
                String name = attribute(element, NAME);
                String id = attribute(element, ID);
                if (!id.isEmpty()) {
                    nameById.put(id, name);
                }
                String abstractValue = attribute(element, ABSTRACT);
                concepts.add(new TaxonomyConcept(
                        name,
                        conceptType(attribute(element, TYPE)),
                        name,
                        blankToNull(string(documentationPath, element)),
                        "true".equals(abstractValue) || "1".equals(abstractValue),
                        blankToNull(attribute(element, PERIOD_TYPE)),
                        blankToNull(attribute(element, BALANCE))));
            }

            List<PresentationRole> presentations = readPresentations(document, nameById);
            success = true;
            return new XbrlTaxonomy(concepts, presentations);
        } catch (SaxonApiException e) {
            throw new XbrlParseException("Taksonomi okunamadı: " + e.getMessage(), e);
        } finally {
            metrics.recordDocumentOperation("parse_taxonomy", success, System.currentTimeMillis() - start);
        }
    }

    /**
     * Gömülü {@code link:presentationLink} bağlantılarını role göre gruplar.
     * Hiçbir yayın hedefi olmayan konumlar kök düğüm olarak önce yazılır.
     */
    private List<PresentationRole> readPresentations(XdmNode document, Map<String, String> nameById)
            throws SaxonApiException {
        Map<String, List<PresentationNode>> byRole = new LinkedHashMap<>();
        for (XdmItem item : evaluate(presentationLinksPath, document)) {
            XdmNode link = (XdmNode) item;
            String role = attribute(link, XLINK_ROLE);

            Map<String, String> conceptByLabel = new LinkedHashMap<>();
            for (XdmItem loc : evaluate(locsPath, link)) {
                XdmNode locNode = (XdmNode) loc;
                conceptByLabel.put(attribute(locNode, XLINK_LABEL), conceptFromHref(attribute(locNode, XLINK_HREF), nameById));
            }

            var children = new ArrayList<PresentationNode>();
            Set<String> targets = new HashSet<>();
            for (XdmItem arc : evaluate(arcsPath, link)) {
                XdmNode arcNode = (XdmNode) arc;
                String from = attribute(arcNode, XLINK_FROM);
                String to = attribute(arcNode, XLINK_TO);
                targets.add(to);
                children.add(new PresentationNode(
                        conceptByLabel.getOrDefault(to, to),
                        parseOrder(attribute(arcNode, ORDER)),
                        conceptByLabel.getOrDefault(from, from)));
            }

            List<PresentationNode> nodes = byRole.computeIfAbsent(role, r -> new ArrayList<>());
            for (var entry : conceptByLabel.entrySet()) {
                if (!targets.contains(entry.getKey())) {
                    nodes.add(new PresentationNode(entry.getValue(), 0, null));
                }
            }
            nodes.addAll(children);
        }

        var roles = new ArrayList<PresentationRole>();
        byRole.forEach((role, nodes) -> roles.add(new PresentationRole(role, nodes)));
        return roles;
    }

    // ── Yardımcılar ────────────────────────────────────────────────

    /**
     * XXE korumalı SAX kaynağı üzerinden Saxon ağacı oluşturur.
     */
    private XdmNode build(byte[] content) throws XbrlParseException, SaxonApiException {
        if (content == null || content.length == 0) {
            throw new XbrlParseException("XML içeriği boş");
        }
        XMLReader reader;
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            // XXE koruma
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            reader = factory.newSAXParser().getXMLReader();
        } catch (Exception e) {
            throw new XbrlParseException("XML ayrıştırıcı oluşturulamadı: " + e.getMessage(), e);
        }
        DocumentBuilder builder = processor.newDocumentBuilder();
        return builder.build(new SAXSource(reader, new InputSource(new ByteArrayInputStream(content))));
    }

    private static byte[] read(Path file) throws XbrlParseException {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new XbrlParseException("Dosya okunamadı: " + file, e);
        }
    }

    private static XdmValue evaluate(XPathExecutable executable, XdmItem context) throws SaxonApiException {
        XPathSelector selector = executable.load();
        selector.setContextItem(context);
        return selector.evaluate();
    }

    private static String string(XPathExecutable executable, XdmItem context) throws SaxonApiException {
        XPathSelector selector = executable.load();
        selector.setContextItem(context);
        XdmItem item = selector.evaluateSingle();
        return item == null ? "" : item.getStringValue().strip();
    }

    private static String attribute(XdmNode node, QName name) {
        String value = node.getAttributeValue(name);
        return value == null ? "" : value.strip();
    }

    /**
     * Birimi tek bir ISO 4217 ölçüsü olan olgular "monetary", diğer birimli olgular "decimal", birimsizler "string".
     */
    static String factType(XbrlUnit unit, String unitRef) {
        if (unitRef == null || unitRef.isBlank()) {
            return "string";
        }
        if (unit != null && unit.measure().toLowerCase(Locale.ROOT).startsWith("iso4217:") && !unit.measure().contains("/")) {
            return "monetary";
        }
        return "decimal";
    }

    private static String periodKind(XbrlContext context) {
        if (context == null) {
            return "";
        }
        if (context.period().hasInstant()) {
            return "instant";
        }
        return context.period().hasDuration() ? "duration" : "";
    }

    /**
     * "xbrli:monetaryItemType" → "monetary"; önek ve "ItemType" son eki atılır.
     */
    static String conceptType(String type) {
        if (type == null || type.isBlank()) {
            return "string";
        }
        String local = type.substring(type.indexOf(':') + 1);
        if (local.endsWith("ItemType") && local.length() > "ItemType".length()) {
            local = local.substring(0, local.length() - "ItemType".length());
        }
        return local;
    }

    private static Integer parseDecimals(String decimals) {
        if (decimals == null || decimals.isBlank() || "INF".equalsIgnoreCase(decimals.strip())) {
            return null;
        }
        try {
            return Integer.valueOf(decimals.strip());
        } catch (NumberFormatException e) {
            log.debug("Geçersiz decimals değeri yok sayıldı: {}", decimals);
            return null;
        }
    }

    private static double parseOrder(String order) {
        if (order.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(order);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String conceptFromHref(String href, Map<String, String> nameById) {
        String fragment = href.substring(href.indexOf('#') + 1);
        return nameById.getOrDefault(fragment, fragment);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
