package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.enums.ConditionKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Bir kez ayrıştırılmış kural koşulu.
 * <p>
 * {@link #kind()} hangi alanların dolu olduğunu belirler:
 * <ul>
 *   <li>RANGE: {@code min} ve/veya {@code max}</li>
 *   <li>COMPARISON: {@code comparisons} (VE ile bağlı)</li>
 *   <li>PATTERN: {@code pattern}</li>
 *   <li>ONE_OF: {@code options}</li>
 *   <li>EQUALS: {@code expected}</li>
 * </ul>
 * {@code authoringProblem} doluysa koşul yazım hatası içerir ve {@code OTHER} olarak değerlendirilir.
 */
public record RuleCondition(
        ConditionKind kind,
        String raw,
        BigDecimal min,
        BigDecimal max,
        List<Comparison> comparisons,
        Pattern pattern,
        Set<String> options,
        String expected,
        String authoringProblem
) {

    public RuleCondition {
        raw = raw != null ? raw : "";
        comparisons = comparisons != null ? List.copyOf(comparisons) : List.of();
        options = options != null ? Set.copyOf(options) : Set.of();
    }

    static RuleCondition of(ConditionKind kind, String raw) {
        return new RuleCondition(kind, raw, null, null, null, null, null, null, null);
    }

    static RuleCondition range(String raw, BigDecimal min, BigDecimal max) {
        return new RuleCondition(ConditionKind.RANGE, raw, min, max, null, null, null, null, null);
    }

    static RuleCondition comparisons(String raw, List<Comparison> comparisons) {
        return new RuleCondition(ConditionKind.COMPARISON, raw, null, null, comparisons, null, null, null, null);
    }

    static RuleCondition pattern(String raw, Pattern pattern) {
        return new RuleCondition(ConditionKind.PATTERN, raw, null, null, null, pattern, null, null, null);
    }

    static RuleCondition oneOf(String raw, Set<String> options) {
        return new RuleCondition(ConditionKind.ONE_OF, raw, null, null, null, null, options, null, null);
    }

    static RuleCondition equalTo(String raw, String expected) {
        return new RuleCondition(ConditionKind.EQUALS, raw, null, null, null, null, null, expected, null);
    }

    static RuleCondition other(String raw) {
        return of(ConditionKind.OTHER, raw);
    }

    static RuleCondition invalid(String raw, String problem) {
        return new RuleCondition(ConditionKind.OTHER, raw, null, null, null, null, null, null, problem);
    }

    public boolean hasAuthoringProblem() {
        return authoringProblem != null;
    }

    /**
     * "VALUE &gt;= 10" veya "LENGTH &lt;= 50" biçiminde tek karşılaştırma.
     */
    public record Comparison(Subject subject, Operator operator, BigDecimal operand) {

        public boolean test(BigDecimal actual) {
            int cmp = actual.compareTo(operand);
            return switch (operator) {
                case GT -> cmp > 0;
                case GE -> cmp >= 0;
                case LT -> cmp < 0;
                case LE -> cmp <= 0;
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
            };
        }
    }

    public enum Subject {
        VALUE,
        LENGTH
    }

    public enum Operator {
        GT, GE, LT, LE, EQ, NE;

        static Operator fromSymbol(String symbol) {
            return switch (symbol) {
                case ">" -> GT;
                case ">=" -> GE;
                case "<" -> LT;
                case "<=" -> LE;
                case "=", "==" -> EQ;
                case "!=", "<>" -> NE;
                default -> throw new IllegalArgumentException("Bilinmeyen operatör: " + symbol);
            };
        }
    }
}
