package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.enums.RuleFileFormat;
import io.mersel.services.xbrl.application.enums.RuleType;
import io.mersel.services.xbrl.application.enums.Severity;
import io.mersel.services.xbrl.application.interfaces.IValidationRuleLoader;
import io.mersel.services.xbrl.application.models.ParsedRuleSet;
import io.mersel.services.xbrl.application.models.ValidationRule;
import io.mersel.services.xbrl.infrastructure.diagnostics.ValidationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Kural tanım dosyası yükleyici.
 * <p>
 * İki biçim desteklenir:
 * <ul>
 *   <li><b>YAML</b>: {@code metadata} ve {@code sheetValidations.<sayfa>.columnValidations.<sütun>}
 *       yapısı. Her sütun özelliği ({@code required}, {@code dataType}, {@code minLength},
 *       {@code maxLength}, {@code minimum}, {@code maximum}, {@code pattern}, {@code enumValues})
 *       sütunun tüm veri satırlarına uygulanan ayrı bir kurala dönüşür. Sayfalar dosyadaki
 *       sıralarına göre 1'den başlayan {@code sheetId} alır.</li>
 *   <li><b>Düz metin</b>: {@code ---} satırlarıyla ayrılmış
 *       {@code FIELD:/RULE:/CONDITION:/ERROR:/SEVERITY:} blokları, {@code #} ile yorum satırları.</li>
 * </ul>
 * İçerik hataları {@link ParsedRuleSet#errors()} içinde toplanır, sorunlu blok veya sütun atlanır.
 */
@Service
public class ValidationRuleFileLoader implements IValidationRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ValidationRuleFileLoader.class);

    private static final String ALL_DATA_ROWS = "2-*";
    private static final Set<String> TEXT_RULE_TYPES = Set.of("required", "format", "range", "custom", "cell");

    private final ValidationMetrics metrics;

    public ValidationRuleFileLoader(ValidationMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public ParsedRuleSet load(Path file, Long templateId) throws IOException {
        RuleFileFormat format = RuleFileFormat.fromFileName(file.getFileName().toString());
        String content = Files.readString(file, StandardCharsets.UTF_8);
        log.info("Kural dosyası okunuyor: {} ({})", file, format);
        return parse(content, format, templateId);
    }

    @Override
    public ParsedRuleSet parse(String content, RuleFileFormat format, Long templateId) {
        ParsedRuleSet result = format == RuleFileFormat.YAML
                ? parseYaml(content != null ? content : "", templateId)
                : parseText(content != null ? content : "", templateId);

        metrics.recordRuleFileLoad(format.name().toLowerCase(Locale.ROOT), result.rules().size(), result.errors().size());
        if (result.errors().isEmpty()) {
            log.info("Kural dosyası ayrıştırıldı — {} kural", result.rules().size());
        } else {
            log.warn("Kural dosyası {} hata ile ayrıştırıldı — {} kural, hatalar: {}",
                    result.errors().size(), result.rules().size(), result.errors());
        }
        return result;
    }

    // ── YAML ───────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private ParsedRuleSet parseYaml(String content, Long templateId) {
        var rules = new ArrayList<ValidationRule>();
        var metadata = new LinkedHashMap<String, String>();
        var errors = new ArrayList<String>();

        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(content);
        } catch (YAMLException e) {
            errors.add("YAML ayrıştırılamadı: " + e.getMessage());
            return new ParsedRuleSet(rules, metadata, errors);
        }

        if (!(root instanceof Map<?, ?> rootMap)) {
            errors.add("YAML kökü bir eşleme olmalı");
            return new ParsedRuleSet(rules, metadata, errors);
        }

        metadata.put("format", "yaml");
        if (rootMap.get("metadata") instanceof Map<?, ?> metaMap) {
            for (var entry : metaMap.entrySet()) {
                if (entry.getValue() != null) {
                    metadata.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
                }
            }
        }

        if (!(rootMap.get("sheetValidations") instanceof Map<?, ?> sheets)) {
            errors.add("sheetValidations bölümü bulunamadı");
            return new ParsedRuleSet(rules, metadata, errors);
        }

        long sheetId = 0;
        for (var sheetEntry : sheets.entrySet()) {
            sheetId++;
            String sheetName = String.valueOf(sheetEntry.getKey());
            metadata.put("sheet." + sheetId, sheetName);

            if (!(sheetEntry.getValue() instanceof Map<?, ?> sheetMap)) {
                errors.add("Sayfa '" + sheetName + "': tanım bir eşleme olmalı");
                continue;
            }
            if (sheetMap.get("crossFieldValidations") != null) {
                log.warn("Sayfa '{}': çapraz alan doğrulamaları desteklenmiyor, atlandı", sheetName);
            }
            if (!(sheetMap.get("columnValidations") instanceof Map<?, ?> columns)) {
                continue;
            }
            for (var columnEntry : columns.entrySet()) {
                String column = String.valueOf(columnEntry.getKey()).strip();
                if (!ColumnLetters.isLetters(column)) {
                    errors.add("Sayfa '" + sheetName + "', sütun '" + column + "': geçersiz sütun harfi");
                    continue;
                }
                if (!(columnEntry.getValue() instanceof Map<?, ?> spec)) {
                    errors.add("Sayfa '" + sheetName + "', sütun '" + column + "': tanım bir eşleme olmalı");
                    continue;
                }
                columnRules(templateId, sheetId, sheetName, column.toUpperCase(Locale.ROOT),
                        (Map<String, Object>) spec, rules, errors);
            }
        }
        return new ParsedRuleSet(rules, metadata, errors);
    }

    private void columnRules(Long templateId, long sheetId, String sheetName, String column,
                             Map<String, Object> spec, List<ValidationRule> rules, List<String> errors) {
        String label = spec.get("description") != null ? String.valueOf(spec.get("description")) : "Sütun " + column;
        Severity severity = Severity.fromValue(spec.get("severity") != null ? String.valueOf(spec.get("severity")) : null);
        String where = "Sayfa '" + sheetName + "', sütun " + column;

        if (Boolean.TRUE.equals(spec.get("required"))) {
            rules.add(columnRule(templateId, sheetId, column, RuleType.REQUIRED, "not_empty",
                    label + " zorunludur", severity));
        }

        Object dataType = spec.get("dataType");
        if (dataType != null) {
            String type = String.valueOf(dataType).strip().toLowerCase(Locale.ROOT);
            switch (type) {
                case "number", "numeric", "integer", "decimal" -> rules.add(columnRule(templateId, sheetId, column,
                        RuleType.FORMAT, "numeric", label + " sayısal olmalıdır", severity));
                case "date" -> rules.add(columnRule(templateId, sheetId, column,
                        RuleType.FORMAT, "date", label + " geçerli bir tarih olmalıdır (YYYY-MM-DD)", severity));
                case "email" -> rules.add(columnRule(templateId, sheetId, column,
                        RuleType.FORMAT, "email", label + " geçerli bir e-posta adresi olmalıdır", severity));
                case "phone" -> rules.add(columnRule(templateId, sheetId, column,
                        RuleType.FORMAT, "phone", label + " geçerli bir telefon numarası olmalıdır", severity));
                case "string", "text" -> {
                    // metin sütunlarında tip kontrolü yok
                }
                default -> errors.add(where + ": bilinmeyen dataType '" + dataType + "'");
            }
        }

        BigDecimal minLength = number(spec, "minLength", where, errors);
        BigDecimal maxLength = number(spec, "maxLength", where, errors);
        if (minLength != null || maxLength != null) {
            var parts = new ArrayList<String>();
            if (minLength != null) {
                parts.add("LENGTH >= " + minLength.toPlainString());
            }
            if (maxLength != null) {
                parts.add("LENGTH <= " + maxLength.toPlainString());
            }
            rules.add(columnRule(templateId, sheetId, column, RuleType.CUSTOM, String.join(" AND ", parts),
                    label + " uzunluğu " + bounds(minLength, maxLength) + " olmalıdır", severity));
        }

        BigDecimal minimum = number(spec, "minimum", where, errors);
        BigDecimal maximum = number(spec, "maximum", where, errors);
        if (minimum != null || maximum != null) {
            var parts = new ArrayList<String>();
            if (minimum != null) {
                parts.add("min:" + minimum.toPlainString());
            }
            if (maximum != null) {
                parts.add("max:" + maximum.toPlainString());
            }
            rules.add(columnRule(templateId, sheetId, column, RuleType.RANGE, String.join(",", parts),
                    label + " değeri " + bounds(minimum, maximum) + " olmalıdır", severity));
        }

        Object pattern = spec.get("pattern");
        if (pattern != null && !String.valueOf(pattern).isBlank()) {
            rules.add(columnRule(templateId, sheetId, column, RuleType.FORMAT, "regex:" + pattern,
                    label + " beklenen biçimde değil", severity));
        }

        Object enumValues = spec.get("enumValues");
        if (enumValues instanceof List<?> values && !values.isEmpty()) {
            var items = values.stream().map(String::valueOf).map(String::strip).toList();
            rules.add(columnRule(templateId, sheetId, column, RuleType.CUSTOM, "in:" + String.join("|", items),
                    label + " şu değerlerden biri olmalıdır: " + String.join(", ", items), severity));
        } else if (enumValues != null) {
            errors.add(where + ": enumValues bir liste olmalı");
        }
    }

    private static ValidationRule columnRule(Long templateId, long sheetId, String column, RuleType type,
                                             String condition, String message, Severity severity) {
        return new ValidationRule(null, templateId, sheetId, type, column, condition, message, severity,
                ALL_DATA_ROWS, column, null, false, true);
    }

    private static BigDecimal number(Map<String, Object> spec, String key, String where, List<String> errors) {
        Object value = spec.get(key);
        if (value == null) {
            return null;
        }
        BigDecimal number = CellValues.asNumber(value);
        if (number == null) {
            errors.add(where + ": " + key + " sayı olmalı ('" + value + "')");
        }
        return number;
    }

    private static String bounds(BigDecimal min, BigDecimal max) {
        if (min != null && max != null) {
            return min.toPlainString() + " ile " + max.toPlainString() + " arasında";
        }
        return min != null ? "en az " + min.toPlainString() : "en fazla " + max.toPlainString();
    }

    // ── Düz metin ──────────────────────────────────────────────────

    private ParsedRuleSet parseText(String content, Long templateId) {
        var rules = new ArrayList<ValidationRule>();
        var errors = new ArrayList<String>();

        List<List<String>> blocks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String line : content.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.equals("---")) {
                blocks.add(current);
                current = new ArrayList<>();
            } else if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                current.add(trimmed);
            }
        }
        blocks.add(current);

        int blockNumber = 0;
        for (List<String> block : blocks) {
            if (block.isEmpty()) {
                continue;
            }
            blockNumber++;
            parseTextBlock(block, blockNumber, templateId, rules, errors);
        }
        return new ParsedRuleSet(rules, Map.of("format", "text"), errors);
    }

    private static void parseTextBlock(List<String> lines, int blockNumber, Long templateId,
                                       List<ValidationRule> rules, List<String> errors) {
        var values = new LinkedHashMap<String, String>();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            values.put(line.substring(0, colon).strip().toUpperCase(Locale.ROOT), line.substring(colon + 1).strip());
        }

        var missing = new ArrayList<String>();
        for (String key : List.of("FIELD", "RULE", "CONDITION", "ERROR")) {
            if (values.getOrDefault(key, "").isEmpty()) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            errors.add("Blok " + blockNumber + ": eksik anahtar(lar): " + String.join(", ", missing));
            return;
        }

        String ruleType = values.get("RULE").toLowerCase(Locale.ROOT);
        if (!TEXT_RULE_TYPES.contains(ruleType)) {
            errors.add("Blok " + blockNumber + ": bilinmeyen kural tipi '" + values.get("RULE") + "'");
            return;
        }

        Long sheetId = null;
        String sheet = values.get("SHEET");
        if (sheet != null && !sheet.isEmpty()) {
            try {
                sheetId = Long.parseLong(sheet);
            } catch (NumberFormatException e) {
                errors.add("Blok " + blockNumber + ": SHEET sayısal bir sayfa kimliği olmalı ('" + sheet + "')");
                return;
            }
        }

        rules.add(new ValidationRule(
                null,
                templateId,
                sheetId,
                RuleType.fromValue(ruleType),
                values.get("FIELD"),
                values.get("CONDITION"),
                values.get("ERROR"),
                Severity.fromValue(values.get("SEVERITY")),
                values.get("ROWS"),
                values.get("COLUMNS"),
                values.get("CELLS"),
                Boolean.parseBoolean(values.get("ALL_ROWS")),
                true));
    }
}
