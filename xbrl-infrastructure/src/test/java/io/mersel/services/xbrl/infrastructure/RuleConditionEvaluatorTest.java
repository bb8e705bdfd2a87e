package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.enums.RuleType;
import io.mersel.services.xbrl.application.enums.Severity;
import io.mersel.services.xbrl.application.models.RuleOutcome;
import io.mersel.services.xbrl.application.models.ValidationRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleConditionEvaluator")
class RuleConditionEvaluatorTest {

    private final RuleConditionEvaluator evaluator = new RuleConditionEvaluator(new ConditionParser());

    private static ValidationRule rule(RuleType type, String condition) {
        return TestRules.field(1, type, "Revenue", condition, Severity.ERROR);
    }

    @Nested
    @DisplayName("Boş değer")
    class EmptyValue {

        @Test
        @DisplayName("NOT_EMPTY boş ve yalnız boşluk içeren değerde başarısız")
        void not_empty_fails() {
            assertThat(evaluator.evaluate(rule(RuleType.REQUIRED, "not_empty"), null).valid()).isFalse();
            assertThat(evaluator.evaluate(rule(RuleType.REQUIRED, "not_empty"), "   ").valid()).isFalse();
        }

        @Test
        @DisplayName("boş hücre sayısal kontrolde başarısız")
        void numeric_fails_on_empty() {
            RuleOutcome outcome = evaluator.evaluate(rule(RuleType.FORMAT, "numeric"), "");

            assertThat(outcome.valid()).isFalse();
            assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "numeric"), null).valid()).isFalse();
        }

        @Test
        @DisplayName("boş hücre aralık kontrolünde 'sayı değil' ile başarısız")
        void range_fails_on_empty() {
            RuleOutcome outcome = evaluator.evaluate(rule(RuleType.RANGE, "min:0,max:100"), null);

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.message()).endsWith(RuleConditionEvaluator.NOT_A_NUMBER_SUFFIX);
        }

        @Test
        @DisplayName("boş hücre değer karşılaştırmasında başarısız, uzunluk karşılaştırması 0 ile yapılır")
        void comparison_on_empty() {
            assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "value > 0"), "  ").valid()).isFalse();
            assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "LENGTH <= 5"), "").valid()).isTrue();
            assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "LENGTH >= 1"), "").valid()).isFalse();
        }

        @Test
        @DisplayName("biçim aileleri boş metni sınar")
        void format_families_check_empty_text() {
            assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "email"), "").valid()).isFalse();
            assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "date"), null).valid()).isFalse();
            assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "in:Yes|No"), "").valid()).isFalse();
        }

        @Test
        @DisplayName("tanınmayan koşul boş değerde de geçer")
        void other_passes() {
            assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "SUM(A:A) = B10"), null).valid()).isTrue();
        }
    }

    @Test
    @DisplayName("sayısal: metin, sayı ve BigDecimal")
    void numeric() {
        ValidationRule numeric = rule(RuleType.FORMAT, "numeric");

        assertThat(evaluator.evaluate(numeric, "12.50").valid()).isTrue();
        assertThat(evaluator.evaluate(numeric, 42).valid()).isTrue();
        assertThat(evaluator.evaluate(numeric, new BigDecimal("1E+3")).valid()).isTrue();
        assertThat(evaluator.evaluate(numeric, "12a").valid()).isFalse();
    }

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "0, true",
            "100, true",
            "50.5, true",
            "-0.01, false",
            "100.01, false"
    })
    @DisplayName("aralık sınırları dahil")
    void range_inclusive(String value, boolean expected) {
        assertThat(evaluator.evaluate(rule(RuleType.RANGE, "min:0,max:100"), value).valid()).isEqualTo(expected);
    }

    @Test
    @DisplayName("sayı olmayan değer aralık kontrolünde ek açıklama alır")
    void range_not_a_number() {
        RuleOutcome outcome = evaluator.evaluate(rule(RuleType.RANGE, "min:0,max:100"), "yüz");

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.message()).isEqualTo("Hata: Revenue" + RuleConditionEvaluator.NOT_A_NUMBER_SUFFIX);
    }

    @Test
    @DisplayName("karşılaştırma zinciri")
    void comparisons() {
        ValidationRule between = rule(RuleType.CUSTOM, "value > 100 AND value < 1000");

        assertThat(evaluator.evaluate(between, 500).valid()).isTrue();
        assertThat(evaluator.evaluate(between, 100).valid()).isFalse();
        assertThat(evaluator.evaluate(between, "1000").valid()).isFalse();
    }

    @Test
    @DisplayName("LENGTH karakter sayısını ölçer")
    void length() {
        ValidationRule length = rule(RuleType.CUSTOM, "LENGTH >= 2 AND LENGTH <= 4");

        assertThat(evaluator.evaluate(length, "ığü").valid()).isTrue();
        assertThat(evaluator.evaluate(length, "a").valid()).isFalse();
        assertThat(evaluator.evaluate(length, "abcde").valid()).isFalse();
    }

    @Test
    @DisplayName("e-posta ve telefon")
    void email_and_phone() {
        assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "email"), "ops@acme.com").valid()).isTrue();
        assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "email"), "ops@acme").valid()).isFalse();
        assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "phone"), "+90 (212) 555-01-01").valid()).isTrue();
        assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "phone"), "12-34").valid()).isFalse();
    }

    @Test
    @DisplayName("tarih ISO biçiminde olmalı")
    void date() {
        assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "date"), "2025-03-31").valid()).isTrue();
        assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "date"), "31.03.2025").valid()).isFalse();
        assertThat(evaluator.evaluate(rule(RuleType.FORMAT, "date"), "2025-02-30").valid()).isFalse();
    }

    @Test
    @DisplayName("düzenli ifade, küme ve eşitlik")
    void pattern_set_equals() {
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "regex:^[A-Z]{3}$"), "INR").valid()).isTrue();
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "regex:^[A-Z]{3}$"), "inr").valid()).isFalse();
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "in:Yes|No"), "No").valid()).isTrue();
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "in:Yes|No"), "Maybe").valid()).isFalse();
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "equals:INR"), "INR").valid()).isTrue();
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "equals:INR"), "USD").valid()).isFalse();
    }

    @Test
    @DisplayName("tanınmayan koşul her zaman geçer")
    void other_passes() {
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "SUM(A:A) = B10"), "anything").valid()).isTrue();
    }

    @Test
    @DisplayName("hata mesajı boşsa varsayılan mesaj üretilir")
    void default_message() {
        var noMessage = new ValidationRule(1L, 1L, null, RuleType.REQUIRED, "Email", "not_empty", "",
                Severity.ERROR, null, null, null, false, true);

        assertThat(evaluator.evaluate(noMessage, "").message())
                .isEqualTo("Doğrulama başarısız: Email (not_empty)");
    }

    @Test
    @DisplayName("tam sayı değerli double '.0' olmadan karşılaştırılır")
    void integral_double_as_text() {
        assertThat(evaluator.evaluate(rule(RuleType.CUSTOM, "equals:100"), 100.0d).valid()).isTrue();
    }
}
