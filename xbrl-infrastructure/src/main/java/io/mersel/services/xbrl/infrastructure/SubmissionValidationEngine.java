package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.interfaces.ISubmissionValidator;
import io.mersel.services.xbrl.application.interfaces.RangeExpressionException;
import io.mersel.services.xbrl.application.models.RuleDiagnostic;
import io.mersel.services.xbrl.application.models.RuleOutcome;
import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.SubmissionValidationReport;
import io.mersel.services.xbrl.application.models.ValidationResult;
import io.mersel.services.xbrl.application.models.ValidationRule;
import io.mersel.services.xbrl.application.models.ValidationSummary;
import io.mersel.services.xbrl.infrastructure.diagnostics.ValidationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Gönderim doğrulama orkestratörü.
 * <p>
 * Her aktif kural için:
 * <ol>
 *   <li>Koşul bir kez ayrıştırılır</li>
 *   <li>Kuralın bağlı olduğu sayfalar seçilir ({@code sheetId} boşsa tüm sayfalar)</li>
 *   <li>Adresleme hücre kutusuna çözülür; hatalıysa kural o sayfada atlanır ve teşhis üretilir</li>
 *   <li>Kutudaki her hücre için tek bir {@link ValidationResult} üretilir</li>
 * </ol>
 * Izgara dışındaki hücreler boş değer olarak değerlendirilir, atlanmaz.
 * Servis durum tutmaz; aynı girdi her zaman aynı sonuçları verir.
 */
@Service
public class SubmissionValidationEngine implements ISubmissionValidator {

    private static final Logger log = LoggerFactory.getLogger(SubmissionValidationEngine.class);

    private final RangeAddressResolver addressResolver;
    private final ConditionParser conditionParser;
    private final RuleConditionEvaluator evaluator;
    private final ValidationMetrics metrics;

    public SubmissionValidationEngine(RangeAddressResolver addressResolver,
                                      ConditionParser conditionParser,
                                      RuleConditionEvaluator evaluator,
                                      ValidationMetrics metrics) {
        this.addressResolver = addressResolver;
        this.conditionParser = conditionParser;
        this.evaluator = evaluator;
        this.metrics = metrics;
    }

    @Override
    public SubmissionValidationReport validate(long submissionId, List<ValidationRule> rules, List<SheetGrid> sheets) {
        long start = System.currentTimeMillis();
        var results = new ArrayList<ValidationResult>();
        var diagnostics = new ArrayList<RuleDiagnostic>();

        List<ValidationRule> activeRules = rules.stream()
                .filter(Objects::nonNull)
                .filter(ValidationRule::active)
                .toList();

        for (ValidationRule rule : activeRules) {
            RuleCondition condition = conditionParser.parse(rule.ruleType(), rule.condition());
            if (condition.hasAuthoringProblem()) {
                log.warn("Kural koşulu hatalı, koşul geçti sayılacak — kural: {}, alan: {}, sorun: {}",
                        rule.id(), rule.field(), condition.authoringProblem());
                diagnostics.add(new RuleDiagnostic(rule.id(), rule.field(), null, condition.authoringProblem()));
            }

            List<SheetGrid> targets = sheets.stream()
                    .filter(sheet -> rule.sheetId() == null || rule.sheetId().equals(sheet.sheetId()))
                    .toList();

            if (targets.isEmpty()) {
                results.add(missingSheetResult(submissionId, rule));
                continue;
            }

            for (SheetGrid sheet : targets) {
                evaluateOnSheet(submissionId, rule, condition, sheet, results, diagnostics);
            }
        }

        ValidationSummary summary = ValidationSummary.of(activeRules.size(), results);
        long durationMs = System.currentTimeMillis() - start;
        metrics.recordSubmissionValidation(summary, diagnostics.size(), durationMs);

        log.info("Gönderim {} doğrulandı — durum: {}, kural: {}, kontrol: {}, hata: {}, uyarı: {}, teşhis: {} ({} ms)",
                submissionId, summary.status(), summary.totalRules(), summary.totalChecks(),
                summary.errorCount(), summary.warningCount(), diagnostics.size(), durationMs);

        return new SubmissionValidationReport(submissionId, results, diagnostics, summary);
    }

    private void evaluateOnSheet(long submissionId,
                                 ValidationRule rule,
                                 RuleCondition condition,
                                 SheetGrid sheet,
                                 List<ValidationResult> results,
                                 List<RuleDiagnostic> diagnostics) {
        CellSelection selection;
        try {
            selection = addressResolver.resolve(rule, sheet);
        } catch (RangeExpressionException | IllegalArgumentException e) {
            log.warn("Kural adreslemesi çözümlenemedi, kural atlandı — kural: {}, sayfa: {}, sorun: {}",
                    rule.id(), sheet.sheetName(), e.getMessage());
            diagnostics.add(new RuleDiagnostic(rule.id(), rule.field(), sheet.sheetName(), e.getMessage()));
            return;
        }

        for (CellCoordinate coordinate : selection.coordinates()) {
            Object value = sheet.cellValue(coordinate.row(), coordinate.column());
            RuleOutcome outcome = evaluator.evaluate(condition, rule, value);
            results.add(new ValidationResult(
                    submissionId,
                    rule.id(),
                    rule.field(),
                    rule.ruleType(),
                    rule.condition(),
                    coordinate.reference(),
                    CellValues.asText(value),
                    outcome.message(),
                    rule.severity(),
                    outcome.valid(),
                    sheet.sheetName(),
                    coordinate.row(),
                    coordinate.column(),
                    coordinate.columnName()));
        }
        log.debug("Kural {} sayfa '{}' üzerinde {} hücrede değerlendirildi", rule.id(), sheet.sheetName(), selection.size());
    }

    /**
     * Kuralın bağlı olduğu sayfa gönderimde yoksa veri eksikliği sessizce geçilmez.
     */
    private static ValidationResult missingSheetResult(long submissionId, ValidationRule rule) {
        String message = rule.sheetId() != null
                ? "Sayfa bulunamadı: " + rule.sheetId()
                : "Gönderimde sayfa bulunamadı";
        return new ValidationResult(
                submissionId,
                rule.id(),
                rule.field(),
                rule.ruleType(),
                rule.condition(),
                null,
                "",
                message,
                rule.severity(),
                false,
                null,
                null,
                null,
                null);
    }
}
