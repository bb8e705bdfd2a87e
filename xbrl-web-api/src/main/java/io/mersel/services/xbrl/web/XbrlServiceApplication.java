package io.mersel.services.xbrl.web;

import io.mersel.services.xbrl.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL XBRL Service - Ana uygulama giriş noktası.
 * <p>
 * Tablo gönderimlerini kurallara göre doğrular; XBRL instance belgelerini ayrıştırır,
 * taksonomiden şablon türetir, denetler ve üretir.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class XbrlServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(XbrlServiceApplication.class, args);
    }
}
