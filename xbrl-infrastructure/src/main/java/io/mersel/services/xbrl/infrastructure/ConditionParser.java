package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.enums.ConditionKind;
import io.mersel.services.xbrl.application.enums.RuleType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Kural koşul metnini {@link RuleCondition} varyantına ayrıştırır.
 * <p>
 * Tanınan aileler (büyük/küçük harf duyarsız):
 * <ul>
 *   <li>{@code not_empty}, {@code required} → NOT_EMPTY</li>
 *   <li>{@code numeric}, {@code number}, {@code format=number}, {@code type_is_number} → NUMERIC</li>
 *   <li>{@code min:0,max:100}, {@code 0,100} → RANGE</li>
 *   <li>{@code VALUE >= 10 AND LENGTH <= 50} → COMPARISON</li>
 *   <li>{@code email}, {@code phone}, {@code date} → biçim kontrolleri</li>
 *   <li>{@code regex:^[A-Z]+$}, {@code REGEX("^[A-Z]+$")} → PATTERN</li>
 *   <li>{@code VALUE IN ["a", "b"]}, {@code in:a|b}, {@code enum:a|b} → ONE_OF</li>
 *   <li>{@code equals:x} → EQUALS</li>
 * </ul>
 * Diğer her şey OTHER olur ve "geçti" sayılır. Ayrıştırıcı istisna fırlatmaz.
 */
@Component
public class ConditionParser {

    private static final Set<String> NOT_EMPTY_WORDS = Set.of(
            "not_empty", "notempty", "non_empty", "not empty", "required", "is_not_empty");
    private static final Set<String> NUMERIC_WORDS = Set.of(
            "numeric", "number", "format=number", "type_is_number", "decimal", "is_number");
    private static final Set<String> EMAIL_WORDS = Set.of("email", "format=email", "type_is_email");
    private static final Set<String> PHONE_WORDS = Set.of("phone", "format=phone", "type_is_phone");
    private static final Set<String> DATE_WORDS = Set.of("date", "format=date", "type_is_date");

    private static final String NUMBER = "[-+]?\\d+(?:\\.\\d+)?";

    private static final Pattern MIN_MAX = Pattern.compile(
            "(?:min\\s*:\\s*(" + NUMBER + "))?\\s*,?\\s*(?:max\\s*:\\s*(" + NUMBER + "))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern PAIR = Pattern.compile("(" + NUMBER + ")\\s*,\\s*(" + NUMBER + ")");
    private static final Pattern COMPARISON = Pattern.compile(
            "(value|length)\\s*(>=|<=|!=|<>|==|=|>|<)\\s*(" + NUMBER + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND = Pattern.compile("\\s+AND\\s+|\\s*&&\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern OR = Pattern.compile("\\s+OR\\s+|\\|\\|", Pattern.CASE_INSENSITIVE);
    private static final Pattern REGEX_CALL = Pattern.compile("regex\\(\\s*\"(.*)\"\\s*\\)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern VALUE_IN = Pattern.compile("value\\s+in\\s*\\[(.*)]", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /**
     * @param ruleType  Kural tipi; yorumu daraltır
     * @param condition Koşul metni ({@code null} olabilir)
     */
    public RuleCondition parse(RuleType ruleType, String condition) {
        String raw = condition != null ? condition.strip() : "";
        if (raw.isEmpty()) {
            return ruleType == RuleType.REQUIRED
                    ? RuleCondition.of(ConditionKind.NOT_EMPTY, raw)
                    : RuleCondition.other(raw);
        }

        RuleCondition parsed = parseFamilies(raw);

        if (ruleType == RuleType.RANGE
                && parsed.kind() != ConditionKind.RANGE
                && parsed.kind() != ConditionKind.COMPARISON) {
            return RuleCondition.other(raw);
        }
        if (ruleType == RuleType.FORMAT && parsed.kind() == ConditionKind.OTHER && !parsed.hasAuthoringProblem()) {
            // Biçim kurallarında tanınmayan metin düzenli ifadedir
            return compilePattern(raw, raw);
        }
        return parsed;
    }

    private RuleCondition parseFamilies(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);

        if (NOT_EMPTY_WORDS.contains(lower)) {
            return RuleCondition.of(ConditionKind.NOT_EMPTY, raw);
        }
        if (NUMERIC_WORDS.contains(lower)) {
            return RuleCondition.of(ConditionKind.NUMERIC, raw);
        }
        if (EMAIL_WORDS.contains(lower)) {
            return RuleCondition.of(ConditionKind.EMAIL, raw);
        }
        if (PHONE_WORDS.contains(lower)) {
            return RuleCondition.of(ConditionKind.PHONE, raw);
        }
        if (DATE_WORDS.contains(lower)) {
            return RuleCondition.of(ConditionKind.DATE, raw);
        }

        // ── Düzenli ifade ──
        if (lower.startsWith("regex:") || lower.startsWith("pattern:")) {
            return compilePattern(raw, raw.substring(raw.indexOf(':') + 1).strip());
        }
        Matcher regexCall = REGEX_CALL.matcher(raw);
        if (regexCall.matches()) {
            return compilePattern(raw, regexCall.group(1));
        }

        // ── Sayısal aralık ──
        if (lower.startsWith("min") || lower.startsWith("max")) {
            Matcher m = MIN_MAX.matcher(raw);
            if (m.matches() && (m.group(1) != null || m.group(2) != null)) {
                return RuleCondition.range(raw, decimal(m.group(1)), decimal(m.group(2)));
            }
        }
        Matcher pair = PAIR.matcher(raw);
        if (pair.matches()) {
            BigDecimal a = new BigDecimal(pair.group(1));
            BigDecimal b = new BigDecimal(pair.group(2));
            return RuleCondition.range(raw, a.min(b), a.max(b));
        }

        // ── Küme ve eşitlik ──
        Matcher valueIn = VALUE_IN.matcher(raw);
        if (valueIn.matches()) {
            return RuleCondition.oneOf(raw, splitOptions(valueIn.group(1), ","));
        }
        if (lower.startsWith("in:") || lower.startsWith("enum:")) {
            String list = raw.substring(raw.indexOf(':') + 1);
            return RuleCondition.oneOf(raw, splitOptions(list, list.contains("|") ? "\\|" : ","));
        }
        if (lower.startsWith("equals:")) {
            return RuleCondition.equalTo(raw, raw.substring("equals:".length()).strip());
        }

        // ── Karşılaştırma ──
        if (lower.startsWith("value") || lower.startsWith("length")) {
            if (OR.matcher(raw).find()) {
                return RuleCondition.other(raw);
            }
            var comparisons = new ArrayList<RuleCondition.Comparison>();
            for (String part : AND.split(raw)) {
                Matcher m = COMPARISON.matcher(part.strip());
                if (!m.matches()) {
                    return RuleCondition.other(raw);
                }
                comparisons.add(new RuleCondition.Comparison(
                        RuleCondition.Subject.valueOf(m.group(1).toUpperCase(Locale.ROOT)),
                        RuleCondition.Operator.fromSymbol(m.group(2)),
                        new BigDecimal(m.group(3))));
            }
            return RuleCondition.comparisons(raw, comparisons);
        }

        return RuleCondition.other(raw);
    }

    private static RuleCondition compilePattern(String raw, String expression) {
        if (expression.isEmpty()) {
            return RuleCondition.invalid(raw, "Boş düzenli ifade");
        }
        try {
            return RuleCondition.pattern(raw, Pattern.compile(expression));
        } catch (PatternSyntaxException e) {
            return RuleCondition.invalid(raw, "Geçersiz düzenli ifade: " + e.getDescription());
        }
    }

    private static Set<String> splitOptions(String list, String separatorRegex) {
        var options = new LinkedHashSet<String>();
        for (String item : list.split(separatorRegex)) {
            String value = unquote(item.strip());
            if (!value.isEmpty()) {
                options.add(value);
            }
        }
        return options;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static BigDecimal decimal(String text) {
        return text != null ? new BigDecimal(text) : null;
    }
}
