package io.mersel.services.xbrl.infrastructure.diagnostics;

import io.mersel.services.xbrl.application.interfaces.IXbrlGenerator;
import io.mersel.services.xbrl.application.interfaces.IXbrlParser;
import io.mersel.services.xbrl.application.models.xbrl.XbrlContext;
import io.mersel.services.xbrl.application.models.xbrl.XbrlFact;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlNamespaces;
import io.mersel.services.xbrl.application.models.xbrl.XbrlPeriod;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * XBRL motoru sağlık kontrolü.
 * <p>
 * Küçük bir instance'ı üretip geri ayrıştırarak üretici ve Saxon ayrıştırıcısının
 * birlikte çalıştığını doğrular.
 */
@Component
public class XbrlEngineHealthCheck implements HealthIndicator {

    private static final XbrlInstance PROBE = new XbrlInstance(
            "health.xsd",
            List.of(new XbrlContext("H1", "health", XbrlPeriod.instant("2000-01-01"))),
            List.of(),
            List.of(new XbrlFact("Probe", "string", "instant", "OK", null, "H1", null, "urn:mersel:health")),
            null);

    private final IXbrlGenerator generator;
    private final IXbrlParser parser;
    private final XbrlNamespaces namespaces;

    public XbrlEngineHealthCheck(IXbrlGenerator generator, IXbrlParser parser, XbrlNamespaces namespaces) {
        this.generator = generator;
        this.parser = parser;
        this.namespaces = namespaces;
    }

    @Override
    public Health health() {
        try {
            XbrlInstance parsed = parser.parseInstance(generator.generate(PROBE));
            if (parsed.facts().size() != 1 || !"OK".equals(parsed.facts().get(0).value())) {
                return Health.down()
                        .withDetail("engine", "Saxon HE")
                        .withDetail("error", "Deneme olgusu geri okunamadı")
                        .build();
            }
            return Health.up()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("version", net.sf.saxon.Version.getProductVersion())
                    .withDetail("namespaceBindings", namespaces.bindings().size())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
