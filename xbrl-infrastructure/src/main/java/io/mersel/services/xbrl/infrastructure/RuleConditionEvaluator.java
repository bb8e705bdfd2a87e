package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.enums.ConditionKind;
import io.mersel.services.xbrl.application.interfaces.IRuleEvaluator;
import io.mersel.services.xbrl.application.models.RuleOutcome;
import io.mersel.services.xbrl.application.models.ValidationRule;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Ayrıştırılmış koşulu tek bir hücre değerine uygular.
 * <p>
 * Boş hücre koşulun kendisine tabidir: NOT_EMPTY, NUMERIC, RANGE ve değer karşılaştırması
 * boş değerde başarısız olur; biçim aileleri boş metni olduğu gibi sınar.
 * Yalnızca OTHER her zaman geçer. Hiçbir durumda istisna fırlatılmaz.
 */
@Component
public class RuleConditionEvaluator implements IRuleEvaluator {

    static final String NOT_A_NUMBER_SUFFIX = " (sayı değil)";

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[1-9]\\d{6,15}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");

    private final ConditionParser parser;

    public RuleConditionEvaluator(ConditionParser parser) {
        this.parser = parser;
    }

    @Override
    public RuleOutcome evaluate(ValidationRule rule, Object cellValue) {
        return evaluate(parser.parse(rule.ruleType(), rule.condition()), rule, cellValue);
    }

    /**
     * Önceden ayrıştırılmış koşulla değerlendirir; kural başına bir kez ayrıştırma için kullanılır.
     */
    public RuleOutcome evaluate(RuleCondition condition, ValidationRule rule, Object cellValue) {
        String text = CellValues.asText(cellValue).strip();

        if (condition.kind() == ConditionKind.NOT_EMPTY) {
            return text.isEmpty() ? RuleOutcome.fail(failureMessage(rule)) : RuleOutcome.pass();
        }
        if (condition.kind() == ConditionKind.OTHER) {
            return RuleOutcome.pass();
        }

        return switch (condition.kind()) {
            case NUMERIC -> outcome(CellValues.asNumber(cellValue) != null, rule);
            case RANGE -> evaluateRange(condition, rule, cellValue);
            case COMPARISON -> evaluateComparisons(condition, rule, cellValue, text);
            case EMAIL -> outcome(EMAIL.matcher(text).matches(), rule);
            case PHONE -> outcome(PHONE.matcher(PHONE_SEPARATORS.matcher(text).replaceAll("")).matches(), rule);
            case DATE -> outcome(isIsoDate(text), rule);
            case PATTERN -> outcome(condition.pattern().matcher(text).find(), rule);
            case ONE_OF -> outcome(condition.options().contains(text), rule);
            case EQUALS -> outcome(condition.expected().equals(text), rule);
            default -> RuleOutcome.pass();
        };
    }

    private RuleOutcome evaluateRange(RuleCondition condition, ValidationRule rule, Object cellValue) {
        BigDecimal number = CellValues.asNumber(cellValue);
        if (number == null) {
            return RuleOutcome.fail(failureMessage(rule) + NOT_A_NUMBER_SUFFIX);
        }
        boolean inRange = (condition.min() == null || number.compareTo(condition.min()) >= 0)
                && (condition.max() == null || number.compareTo(condition.max()) <= 0);
        return outcome(inRange, rule);
    }

    private RuleOutcome evaluateComparisons(RuleCondition condition, ValidationRule rule, Object cellValue, String text) {
        for (RuleCondition.Comparison comparison : condition.comparisons()) {
            BigDecimal actual;
            if (comparison.subject() == RuleCondition.Subject.LENGTH) {
                actual = BigDecimal.valueOf(text.codePointCount(0, text.length()));
            } else {
                actual = CellValues.asNumber(cellValue);
                if (actual == null) {
                    return RuleOutcome.fail(failureMessage(rule) + NOT_A_NUMBER_SUFFIX);
                }
            }
            if (!comparison.test(actual)) {
                return RuleOutcome.fail(failureMessage(rule));
            }
        }
        return RuleOutcome.pass();
    }

    private static boolean isIsoDate(String text) {
        try {
            LocalDate.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static RuleOutcome outcome(boolean valid, ValidationRule rule) {
        return valid ? RuleOutcome.pass() : RuleOutcome.fail(failureMessage(rule));
    }

    private static String failureMessage(ValidationRule rule) {
        if (!rule.errorMessage().isBlank()) {
            return rule.errorMessage();
        }
        return "Doğrulama başarısız: " + rule.field() + " (" + rule.condition() + ")";
    }
}
