package io.mersel.services.xbrl.infrastructure.config;

import io.mersel.services.xbrl.application.models.xbrl.XbrlNamespaces;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (kural motoru, Saxon ayrıştırıcı, üretici, metrikler) otomatik tarar.
 * XBRL yapılandırma özelliklerini etkinleştirir ve namespace bağlamalarını tek bir bean olarak sunar.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.xbrl.infrastructure")
@EnableConfigurationProperties(XbrlProperties.class)
public class InfrastructureConfig {

    @Bean
    public XbrlNamespaces xbrlNamespaces(XbrlProperties properties) {
        return XbrlNamespaces.standard().with(properties.getNamespaces());
    }
}
