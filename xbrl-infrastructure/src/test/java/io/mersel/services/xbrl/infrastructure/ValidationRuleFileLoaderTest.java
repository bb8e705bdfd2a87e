package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.enums.RuleFileFormat;
import io.mersel.services.xbrl.application.enums.RuleType;
import io.mersel.services.xbrl.application.enums.Severity;
import io.mersel.services.xbrl.application.models.ParsedRuleSet;
import io.mersel.services.xbrl.application.models.ValidationRule;
import io.mersel.services.xbrl.infrastructure.diagnostics.ValidationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ValidationRuleFileLoader")
class ValidationRuleFileLoaderTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ValidationRuleFileLoader loader = new ValidationRuleFileLoader(new ValidationMetrics(registry));

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(ValidationRuleFileLoaderTest.class.getResource(name).toURI());
    }

    @Nested
    @DisplayName("YAML")
    class YamlFormat {

        @Test
        @DisplayName("örnek dosya sütun özelliklerini ayrı kurallara açar")
        void sample_file() throws Exception {
            ParsedRuleSet set = loader.load(resource("/rules/quarterly-report.yaml"), 5L);

            assertThat(set.errors()).isEmpty();
            assertThat(set.rules()).hasSize(11);
            assertThat(set.rules()).allSatisfy(rule -> {
                assertThat(rule.templateId()).isEqualTo(5L);
                assertThat(rule.rowRange()).isEqualTo("2-*");
                assertThat(rule.columnRange()).isEqualTo(rule.field());
            });
            assertThat(set.metadata())
                    .containsEntry("format", "yaml")
                    .containsEntry("version", "1.0")
                    .containsEntry("sheet.1", "Annexure 1")
                    .containsEntry("sheet.2", "Annexure 2");
        }

        @Test
        @DisplayName("sütun D: zorunlu, sayısal ve aralık")
        void total_assets_column() throws Exception {
            ParsedRuleSet set = loader.load(resource("/rules/quarterly-report.yaml"), 5L);

            List<ValidationRule> columnD = set.rules().stream()
                    .filter(r -> r.sheetId() == 1L && r.field().equals("D"))
                    .toList();

            assertThat(columnD).extracting(ValidationRule::ruleType)
                    .containsExactly(RuleType.REQUIRED, RuleType.FORMAT, RuleType.RANGE);
            assertThat(columnD).extracting(ValidationRule::condition)
                    .containsExactly("not_empty", "numeric", "min:0,max:999999999");
            assertThat(columnD.get(0).errorMessage()).isEqualTo("Total Assets zorunludur");
        }

        @Test
        @DisplayName("uzunluk, desen ve küme koşulları")
        void length_pattern_enum() throws Exception {
            ParsedRuleSet set = loader.load(resource("/rules/quarterly-report.yaml"), null);

            assertThat(set.rules()).extracting(ValidationRule::condition)
                    .contains("LENGTH >= 1 AND LENGTH <= 100",
                            "regex:^[A-Z]{2}[0-9]{4}$",
                            "in:Equity|Debt|Derivatives");
        }

        @Test
        @DisplayName("sayfa düzeyi severity ve zorunlu olmayan sütun")
        void optional_warning_column() throws Exception {
            ParsedRuleSet set = loader.load(resource("/rules/quarterly-report.yaml"), null);

            List<ValidationRule> columnC = set.rules().stream()
                    .filter(r -> r.sheetId() == 2L && r.field().equals("C"))
                    .toList();

            assertThat(columnC).extracting(ValidationRule::ruleType).containsExactly(RuleType.FORMAT, RuleType.RANGE);
            assertThat(columnC).allMatch(r -> r.severity() == Severity.WARNING);
        }

        @Test
        @DisplayName("hatalı sütunlar hata listesine düşer, diğerleri yüklenir")
        void content_errors_collected() {
            String yaml = """
                    sheetValidations:
                      Main:
                        columnValidations:
                          "1A":
                            required: true
                          B:
                            dataType: money
                            required: true
                          C:
                            minimum: abc
                    """;

            ParsedRuleSet set = loader.parse(yaml, RuleFileFormat.YAML, 1L);

            assertThat(set.errors()).hasSize(3);
            assertThat(set.errors()).anySatisfy(e -> assertThat(e).contains("geçersiz sütun harfi"));
            assertThat(set.errors()).anySatisfy(e -> assertThat(e).contains("bilinmeyen dataType 'money'"));
            assertThat(set.errors()).anySatisfy(e -> assertThat(e).contains("minimum sayı olmalı"));
            assertThat(set.rules()).extracting(ValidationRule::field).containsExactly("B");
        }

        @Test
        @DisplayName("bozuk YAML istisna değil hata döndürür")
        void malformed_yaml() {
            ParsedRuleSet set = loader.parse("sheetValidations: [unclosed", RuleFileFormat.YAML, 1L);

            assertThat(set.rules()).isEmpty();
            assertThat(set.errors()).singleElement().satisfies(e -> assertThat(e).startsWith("YAML ayrıştırılamadı"));
        }

        @Test
        @DisplayName("sheetValidations yoksa hata")
        void missing_sheets() {
            assertThat(loader.parse("metadata: {}", RuleFileFormat.YAML, 1L).errors())
                    .containsExactly("sheetValidations bölümü bulunamadı");
        }
    }

    @Nested
    @DisplayName("Düz metin")
    class TextFormat {

        @Test
        @DisplayName("örnek dosyanın dört bloğu")
        void sample_file() throws Exception {
            ParsedRuleSet set = loader.load(resource("/rules/legacy.rules"), 2L);

            assertThat(set.errors()).isEmpty();
            assertThat(set.metadata()).containsEntry("format", "text");
            assertThat(set.rules()).extracting(ValidationRule::field)
                    .containsExactly("Company Name", "Email", "A1:A10", "B5");
            assertThat(set.rules()).extracting(ValidationRule::severity)
                    .containsExactly(Severity.ERROR, Severity.WARNING, Severity.ERROR, Severity.WARNING);
            assertThat(set.rules().get(3).condition()).isEqualTo("value > 100 AND value < 1000");
            assertThat(set.rules().get(1).condition()).isEqualTo("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
        }

        @Test
        @DisplayName("eksik anahtarlı blok atlanır")
        void missing_keys() {
            String text = """
                    FIELD: Revenue
                    RULE: range
                    ---
                    FIELD: Email
                    RULE: format
                    CONDITION: email
                    ERROR: Geçersiz e-posta
                    """;

            ParsedRuleSet set = loader.parse(text, RuleFileFormat.TEXT, 1L);

            assertThat(set.errors()).containsExactly("Blok 1: eksik anahtar(lar): CONDITION, ERROR");
            assertThat(set.rules()).singleElement().extracting(ValidationRule::field).isEqualTo("Email");
        }

        @Test
        @DisplayName("isteğe bağlı adresleme anahtarları")
        void optional_addressing_keys() {
            String text = """
                    FIELD: Revenue
                    RULE: range
                    CONDITION: min:0,max:100
                    ERROR: Aralık dışı
                    SHEET: 2
                    ROWS: 2-50
                    COLUMNS: B-C
                    ALL_ROWS: true
                    """;

            ValidationRule rule = loader.parse(text, RuleFileFormat.TEXT, 1L).rules().get(0);

            assertThat(rule.sheetId()).isEqualTo(2L);
            assertThat(rule.rowRange()).isEqualTo("2-50");
            assertThat(rule.columnRange()).isEqualTo("B-C");
            assertThat(rule.applyToAllRows()).isTrue();
        }

        @Test
        @DisplayName("bilinmeyen kural tipi ve sayısal olmayan SHEET hata üretir")
        void invalid_values() {
            String text = """
                    FIELD: A
                    RULE: magic
                    CONDITION: x
                    ERROR: y
                    ---
                    FIELD: A
                    RULE: required
                    CONDITION: not_empty
                    ERROR: y
                    SHEET: first
                    """;

            ParsedRuleSet set = loader.parse(text, RuleFileFormat.TEXT, 1L);

            assertThat(set.rules()).isEmpty();
            assertThat(set.errors()).hasSize(2);
        }
    }

    @Test
    @DisplayName("diskteki dosya uzantısına göre okunur")
    void load_from_disk(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("rules.txt");
        Files.writeString(file, "FIELD: A2\nRULE: required\nCONDITION: not_empty\nERROR: Zorunlu\n", StandardCharsets.UTF_8);

        ParsedRuleSet set = loader.load(file, 9L);

        assertThat(set.rules()).singleElement().satisfies(r -> {
            assertThat(r.field()).isEqualTo("A2");
            assertThat(r.templateId()).isEqualTo(9L);
        });
        assertThat(registry.get("xbrl_rule_files_loaded_total").tag("format", "text").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("desteklenmeyen uzantı reddedilir")
    void unsupported_extension(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("rules.xlsx");
        Files.writeString(file, "x");

        assertThatThrownBy(() -> loader.load(file, 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rules.xlsx");
    }
}
