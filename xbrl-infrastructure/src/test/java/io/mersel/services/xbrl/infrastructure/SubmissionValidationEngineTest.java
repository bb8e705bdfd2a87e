package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.enums.RuleType;
import io.mersel.services.xbrl.application.enums.Severity;
import io.mersel.services.xbrl.application.enums.SubmissionStatus;
import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.SubmissionValidationReport;
import io.mersel.services.xbrl.application.models.ValidationResult;
import io.mersel.services.xbrl.application.models.ValidationRule;
import io.mersel.services.xbrl.infrastructure.diagnostics.ValidationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.mersel.services.xbrl.infrastructure.TestRules.cellRange;
import static io.mersel.services.xbrl.infrastructure.TestRules.field;
import static io.mersel.services.xbrl.infrastructure.TestRules.grid;
import static io.mersel.services.xbrl.infrastructure.TestRules.row;
import static io.mersel.services.xbrl.infrastructure.TestRules.rows;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubmissionValidationEngine")
class SubmissionValidationEngineTest {

    private SimpleMeterRegistry registry;
    private SubmissionValidationEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ConditionParser parser = new ConditionParser();
        engine = new SubmissionValidationEngine(
                new RangeAddressResolver(1_000_000),
                parser,
                new RuleConditionEvaluator(parser),
                new ValidationMetrics(registry));
    }

    private final SheetGrid grid = grid(
            row("Company Name", "Revenue", "Email"),
            row("Acme", 100, "ops@acme.com"),
            row("Globex", "n/a", "bad-mail"),
            row("", 300, null),
            row("Umbrella", 400, "d@umbrella.com"));

    @Nested
    @DisplayName("Hücre adresleme")
    class Addressing {

        @Test
        @DisplayName("B2:B2 boş hücrede satır 2 sütun B için tek başarısız sonuç")
        void single_cell_box_on_empty_cell() {
            SheetGrid sparse = grid(row("Name", null), row("x", ""));

            SubmissionValidationReport report = engine.validate(7L, List.of(cellRange(1, "B2:B2", "not_empty")), sparse);

            assertThat(report.results()).singleElement().satisfies(r -> {
                assertThat(r.valid()).isFalse();
                assertThat(r.rowNumber()).isEqualTo(2);
                assertThat(r.columnName()).isEqualTo("B");
                assertThat(r.cellReference()).isEqualTo("B2");
                assertThat(r.submissionId()).isEqualTo(7L);
            });
        }

        @Test
        @DisplayName("ızgara dışındaki A27 boş değer olarak değerlendirilir")
        void out_of_grid_cell_is_empty_not_skipped() {
            SheetGrid small = grid(row("Company Name"), row("Acme"));
            var rule = field(27, RuleType.REQUIRED, "A27", "NOT_EMPTY", Severity.ERROR);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), small);

            assertThat(report.results()).singleElement().satisfies(r -> {
                assertThat(r.valid()).isFalse();
                assertThat(r.cellValue()).isEmpty();
                assertThat(r.rowNumber()).isEqualTo(27);
                assertThat(r.columnName()).isEqualTo("A");
            });
            assertThat(report.summary().status()).isEqualTo(SubmissionStatus.FAILED);
        }

        @Test
        @DisplayName("'10-*' 5 satırlık ızgarada 10. satırı değerlendirir")
        void open_row_range_beyond_grid() {
            SubmissionValidationReport report = engine.validate(1L,
                    List.of(rows(1, "", "10-*", "A", "not_empty")), grid);

            assertThat(report.results()).extracting(ValidationResult::rowNumber).containsExactly(10);
        }

        @Test
        @DisplayName("her (kural, hücre) çifti için tam olarak bir sonuç")
        void one_result_per_cell() {
            SubmissionValidationReport report = engine.validate(1L,
                    List.of(cellRange(1, "A2:C5", "not_empty")), grid);

            assertThat(report.results()).hasSize(12);
            assertThat(report.results()).extracting(ValidationResult::cellReference).doesNotHaveDuplicates();
            assertThat(report.failures()).extracting(ValidationResult::cellReference).containsExactly("A4", "C4");
        }

        @Test
        @DisplayName("başlık adıyla alan tek hücreyi, applyToAllRows tüm veri satırlarını değerlendirir")
        void header_field_with_and_without_all_rows() {
            var single = headerRule(false);
            var expanded = headerRule(true);

            SubmissionValidationReport singleReport = engine.validate(1L, List.of(single), grid);
            SubmissionValidationReport expandedReport = engine.validate(1L, List.of(expanded), grid);

            assertThat(singleReport.results()).singleElement().satisfies(r -> {
                assertThat(r.cellReference()).isEqualTo("C2");
                assertThat(r.valid()).isTrue();
            });
            assertThat(expandedReport.results()).hasSize(4);
            assertThat(expandedReport.failures()).extracting(ValidationResult::cellReference)
                    .containsExactly("C3", "C4");
            assertThat(expandedReport.summary().warningCount()).isEqualTo(2);
            assertThat(expandedReport.isPassed()).isTrue();
        }

        private ValidationRule headerRule(boolean applyToAllRows) {
            return new ValidationRule(1L, 1L, null, RuleType.FORMAT, "Email", "email", "Geçersiz e-posta",
                    Severity.WARNING, null, null, null, applyToAllRows, true);
        }
    }

    @Nested
    @DisplayName("Boş hücreler")
    class EmptyCells {

        private final SheetGrid emptyRevenue = grid(row("Company Name", "Revenue"), row("Acme", ""));

        @Test
        @DisplayName("boş B2 sayısal kuralda başarısız")
        void numeric_rule_on_empty_cell() {
            var rule = field(1, RuleType.FORMAT, "B2", "numeric", Severity.ERROR);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), emptyRevenue);

            assertThat(report.results()).singleElement().satisfies(r -> {
                assertThat(r.valid()).isFalse();
                assertThat(r.cellReference()).isEqualTo("B2");
            });
            assertThat(report.summary().status()).isEqualTo(SubmissionStatus.FAILED);
        }

        @Test
        @DisplayName("boş B2 aralık kuralında başarısız")
        void range_rule_on_empty_cell() {
            var rule = field(1, RuleType.RANGE, "B2", "min:0,max:100", Severity.ERROR);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), emptyRevenue);

            assertThat(report.results()).singleElement().satisfies(r -> {
                assertThat(r.valid()).isFalse();
                assertThat(r.message()).endsWith(RuleConditionEvaluator.NOT_A_NUMBER_SUFFIX);
            });
            assertThat(report.summary().errorCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Özet")
    class Summary {

        @Test
        @DisplayName("3 hata ve 2 uyarı FAILED verir")
        void errors_and_warnings() {
            List<ValidationRule> rules = List.of(
                    field(1, RuleType.REQUIRED, "A10", "not_empty", Severity.ERROR),
                    field(2, RuleType.REQUIRED, "A11", "not_empty", Severity.ERROR),
                    field(3, RuleType.REQUIRED, "A12", "not_empty", Severity.ERROR),
                    field(4, RuleType.REQUIRED, "B10", "not_empty", Severity.WARNING),
                    field(5, RuleType.REQUIRED, "B11", "not_empty", Severity.WARNING),
                    field(6, RuleType.REQUIRED, "A2", "not_empty", Severity.ERROR));

            SubmissionValidationReport report = engine.validate(1L, rules, grid);

            assertThat(report.summary().totalRules()).isEqualTo(6);
            assertThat(report.summary().totalChecks()).isEqualTo(6);
            assertThat(report.summary().passedChecks()).isEqualTo(1);
            assertThat(report.summary().failedChecks()).isEqualTo(5);
            assertThat(report.summary().errorCount()).isEqualTo(3);
            assertThat(report.summary().warningCount()).isEqualTo(2);
            assertThat(report.summary().status()).isEqualTo(SubmissionStatus.FAILED);
        }

        @Test
        @DisplayName("yalnız uyarılar PASSED verir")
        void warnings_only_pass() {
            var rule = field(1, RuleType.REQUIRED, "A20", "not_empty", Severity.WARNING);

            assertThat(engine.validate(1L, List.of(rule), grid).summary().status()).isEqualTo(SubmissionStatus.PASSED);
        }

        @Test
        @DisplayName("metrikler kaydedilir")
        void metrics_recorded() {
            engine.validate(1L, List.of(field(1, RuleType.REQUIRED, "A30", "not_empty", Severity.ERROR)), grid);

            assertThat(registry.get("xbrl_submission_validations_total").tag("status", "failed").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("aynı girdi aynı sonuçları verir")
    void idempotent() {
        List<ValidationRule> rules = List.of(
                cellRange(1, "A2:C5", "not_empty"),
                field(2, RuleType.RANGE, "Revenue", "min:0,max:350", Severity.ERROR),
                field(3, RuleType.FORMAT, "Email", "email", Severity.WARNING));

        SubmissionValidationReport first = engine.validate(3L, rules, grid);
        SubmissionValidationReport second = engine.validate(3L, rules, grid);

        assertThat(second.results()).isEqualTo(first.results());
        assertThat(second.summary()).isEqualTo(first.summary());
    }

    @Test
    @DisplayName("pasif kurallar değerlendirilmez")
    void inactive_rules_skipped() {
        var inactive = new ValidationRule(1L, 1L, null, RuleType.REQUIRED, "A20", "not_empty", "x",
                Severity.ERROR, null, null, null, false, false);

        SubmissionValidationReport report = engine.validate(1L, List.of(inactive), grid);

        assertThat(report.results()).isEmpty();
        assertThat(report.summary().totalRules()).isZero();
        assertThat(report.isPassed()).isTrue();
    }

    @Nested
    @DisplayName("Yazım hataları")
    class AuthoringProblems {

        @Test
        @DisplayName("hatalı adresleme kuralı atlar ve teşhis üretir")
        void malformed_range_becomes_diagnostic() {
            List<ValidationRule> rules = List.of(
                    rows(1, "", "5-2", "A", "not_empty"),
                    field(2, RuleType.REQUIRED, "A2", "not_empty", Severity.ERROR));

            SubmissionValidationReport report = engine.validate(1L, rules, grid);

            assertThat(report.results()).hasSize(1);
            assertThat(report.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.ruleId()).isEqualTo(1L);
                assertThat(d.sheetName()).isEqualTo("Sayfa1");
                assertThat(d.message()).contains("5-2");
            });
            assertThat(report.isPassed()).isTrue();
        }

        @Test
        @DisplayName("geçersiz düzenli ifade teşhis üretir, hücreler geçer")
        void invalid_regex_becomes_diagnostic() {
            var rule = field(1, RuleType.CUSTOM, "Company Name", "regex:[oops", Severity.ERROR);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), grid);

            assertThat(report.diagnostics()).hasSize(1);
            assertThat(report.results()).allMatch(ValidationResult::valid);
        }
    }

    @Nested
    @DisplayName("Çok sayfalı gönderim")
    class MultiSheet {

        private final List<SheetGrid> sheets = List.of(
                new SheetGrid(1L, "Annexure 1", List.of(List.of("Name"), List.of("Acme"))),
                new SheetGrid(2L, "Annexure 2", listOf(List.of("Name"), listWithNull())));

        @Test
        @DisplayName("sheetId'li kural yalnız o sayfada çalışır")
        void bound_rule() {
            var rule = new ValidationRule(1L, 1L, 2L, RuleType.REQUIRED, "Name", "not_empty", "Zorunlu",
                    Severity.ERROR, null, null, null, false, true);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), sheets);

            assertThat(report.results()).singleElement().satisfies(r -> {
                assertThat(r.sheetName()).isEqualTo("Annexure 2");
                assertThat(r.valid()).isFalse();
            });
        }

        @Test
        @DisplayName("sheetId'siz kural tüm sayfalarda çalışır")
        void unbound_rule() {
            var rule = field(1, RuleType.REQUIRED, "Name", "not_empty", Severity.ERROR);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), sheets);

            assertThat(report.results()).extracting(ValidationResult::sheetName)
                    .containsExactly("Annexure 1", "Annexure 2");
        }

        @Test
        @DisplayName("bulunamayan sayfa başarısız sonuç üretir")
        void missing_sheet() {
            var rule = new ValidationRule(1L, 1L, 9L, RuleType.REQUIRED, "Name", "not_empty", "Zorunlu",
                    Severity.ERROR, null, null, null, false, true);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), sheets);

            assertThat(report.results()).singleElement().satisfies(r -> {
                assertThat(r.valid()).isFalse();
                assertThat(r.message()).isEqualTo("Sayfa bulunamadı: 9");
            });
            assertThat(report.isPassed()).isFalse();
        }

        @Test
        @DisplayName("sayfasız gönderimde kural başarısız olur")
        void no_sheets() {
            var rule = field(1, RuleType.REQUIRED, "Name", "not_empty", Severity.ERROR);

            SubmissionValidationReport report = engine.validate(1L, List.of(rule), List.of());

            assertThat(report.results()).singleElement()
                    .extracting(ValidationResult::message).isEqualTo("Gönderimde sayfa bulunamadı");
        }

        private List<List<Object>> listOf(List<Object> header, List<Object> data) {
            var rows = new ArrayList<List<Object>>();
            rows.add(header);
            rows.add(data);
            return rows;
        }

        private List<Object> listWithNull() {
            var cells = new ArrayList<Object>();
            cells.add(null);
            return cells;
        }
    }
}
