package io.mersel.services.xbrl.web.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI dokümantasyon yapılandırması.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI xbrlServiceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("MERSEL XBRL Service API")
                        .description("""
                                Tablo gönderim doğrulama ve XBRL alışveriş servisi.

                                ## Özellikler
                                - **Gönderim Doğrulama** — Hücre, satır/sütun ve başlık adresli kuralları tablo sayfalarına uygular
                                - **Kural Dosyaları** — YAML ve düz metin kural tanımlarını ayrıştırır
                                - **XBRL Ayrıştırma** — Instance belgelerinden bağlam, birim ve olguları çıkarır
                                - **Şablon Türetme** — Taksonomi şemasından zorunlu kavramları ve kuralları türetir
                                - **XBRL Üretimi** — Bellek içi modelden XBRL 2.1 instance belgesi yazar
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT")
                                .url("https://github.com/mersel-os/xbrl-service/blob/main/LICENSE"))
                        .contact(new Contact()
                                .name("Mersel")
                                .url("https://mersel.io")))
                .servers(List.of(
                        new Server().url("/").description("Yerel sunucu")
                ));
    }
}
