package io.mersel.services.xbrl.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.mersel.services.xbrl.application.models.ValidationSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * XBRL servisi özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılan tüm uygulama metriklerini yönetir.
 */
@Component
public class ValidationMetrics {

    private final MeterRegistry registry;

    public ValidationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Gönderim doğrulama metrikleri kaydet.
     *
     * @param summary     Doğrulama özeti
     * @param diagnostics Kural teşhisi sayısı
     * @param durationMs  İşlem süresi (milisaniye)
     */
    public void recordSubmissionValidation(ValidationSummary summary, int diagnostics, long durationMs) {
        Counter.builder("xbrl_submission_validations_total")
                .tag("status", summary.status().name().toLowerCase())
                .description("Gönderim doğrulama sayısı")
                .register(registry)
                .increment();

        Timer.builder("xbrl_submission_validation_duration")
                .description("Gönderim doğrulama süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));

        registry.summary("xbrl_submission_checks").record(summary.totalChecks());

        if (summary.errorCount() > 0) {
            Counter.builder("xbrl_submission_failures_total")
                    .tag("severity", "error")
                    .description("Başarısız hücre kontrolü sayısı")
                    .register(registry)
                    .increment(summary.errorCount());
        }
        if (summary.warningCount() > 0) {
            Counter.builder("xbrl_submission_failures_total")
                    .tag("severity", "warning")
                    .description("Başarısız hücre kontrolü sayısı")
                    .register(registry)
                    .increment(summary.warningCount());
        }
        if (diagnostics > 0) {
            Counter.builder("xbrl_rule_diagnostics_total")
                    .description("Kural yazım hatası sayısı")
                    .register(registry)
                    .increment(diagnostics);
        }
    }

    /**
     * XBRL belge işlem metrikleri kaydet.
     *
     * @param operation  "parse_instance", "parse_taxonomy", "generate" veya "validate"
     * @param success    İşlem başarılı mı
     * @param durationMs İşlem süresi (milisaniye)
     */
    public void recordDocumentOperation(String operation, boolean success, long durationMs) {
        Counter.builder("xbrl_document_operations_total")
                .tag("operation", operation)
                .tag("result", success ? "success" : "failure")
                .description("XBRL belge işlem sayısı")
                .register(registry)
                .increment();

        Timer.builder("xbrl_document_operation_duration")
                .tag("operation", operation)
                .description("XBRL belge işlem süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Kural dosyası yükleme metrikleri kaydet.
     *
     * @param format Dosya biçimi ("yaml" veya "text")
     * @param rules  Üretilen kural sayısı
     * @param errors İçerik hatası sayısı
     */
    public void recordRuleFileLoad(String format, int rules, int errors) {
        Counter.builder("xbrl_rule_files_loaded_total")
                .tag("format", format)
                .tag("result", errors == 0 ? "clean" : "with_errors")
                .description("Yüklenen kural dosyası sayısı")
                .register(registry)
                .increment();

        registry.summary("xbrl_rule_file_rules", "format", format).record(rules);
    }

    /**
     * Taksonomi önbellek boyutu için gauge kaydeder.
     *
     * @param cache Taksonomi önbelleği (Caffeine)
     */
    public void registerTaxonomyCacheSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("xbrl_taxonomy_cache_size", cache, c -> (double) c.estimatedSize())
                .description("Önbelleğe alınmış taksonomi sayısı")
                .register(registry);
    }
}
