package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.interfaces.IXbrlReportAssembler;
import io.mersel.services.xbrl.application.interfaces.SubmissionNotPassedException;
import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.SubmissionValidationReport;
import io.mersel.services.xbrl.application.models.xbrl.XbrlContext;
import io.mersel.services.xbrl.application.models.xbrl.XbrlFact;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlMetadata;
import io.mersel.services.xbrl.application.models.xbrl.XbrlPeriod;
import io.mersel.services.xbrl.application.models.xbrl.XbrlReportMapping;
import io.mersel.services.xbrl.application.models.xbrl.XbrlUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Doğrulamadan geçmiş gönderimden XBRL instance modeli kurar.
 * <p>
 * Tek bağlam (eşlemedeki işletme ve dönem), parasal olgu varsa tek birim
 * ({@code iso4217:<para birimi>}) ve eşlenen her dolu alan için bir olgu üretilir.
 * Boş alanlar atlanır. Rapor PASSED değilse hiçbir şey üretilmez.
 */
@Service
public class XbrlReportAssembler implements IXbrlReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(XbrlReportAssembler.class);

    private static final Pattern CELL_ADDRESS = Pattern.compile("([A-Za-z]{1,3})(\\d{1,9})");
    private static final int FIRST_DATA_ROW = 2;

    @Override
    public XbrlInstance assemble(SubmissionValidationReport report, Map<String, Object> fieldValues,
                                 XbrlReportMapping mapping) {
        requirePassed(report);

        String currency = mapping.currency() != null ? mapping.currency().strip().toUpperCase(Locale.ROOT) : "";
        String periodKind = mapping.period().hasInstant() ? "instant" : mapping.period().hasDuration() ? "duration" : "";

        var facts = new ArrayList<XbrlFact>();
        boolean anyMonetary = false;
        for (var entry : mapping.conceptsByField().entrySet()) {
            String value = CellValues.asText(fieldValues.get(entry.getKey())).strip();
            if (value.isEmpty()) {
                log.debug("Alan '{}' boş, {} olgusu üretilmedi", entry.getKey(), entry.getValue());
                continue;
            }
            boolean monetary = mapping.monetaryConcepts().contains(entry.getValue()) && !currency.isEmpty();
            anyMonetary |= monetary;
            facts.add(new XbrlFact(
                    entry.getValue(),
                    monetary ? "monetary" : "string",
                    periodKind,
                    value,
                    monetary ? currency : null,
                    mapping.contextId(),
                    monetary ? mapping.decimals() : null,
                    mapping.namespace()));
        }

        List<XbrlUnit> units = anyMonetary ? List.of(new XbrlUnit(currency, "iso4217:" + currency)) : List.of();
        XbrlContext context = new XbrlContext(mapping.contextId(), mapping.entityIdentifier(), mapping.period());
        XbrlMetadata metadata = new XbrlMetadata(
                mapping.entityIdentifier(), closingDate(mapping.period()), anyMonetary ? currency : "", null);

        log.info("Gönderim {} için XBRL modeli kuruldu — {} olgu", report.submissionId(), facts.size());
        return new XbrlInstance(mapping.schemaRef(), List.of(context), units, facts, metadata);
    }

    @Override
    public XbrlInstance assemble(SubmissionValidationReport report, SheetGrid sheet, XbrlReportMapping mapping) {
        requirePassed(report);

        Map<String, Object> values = new LinkedHashMap<>();
        for (String field : mapping.conceptsByField().keySet()) {
            Matcher address = CELL_ADDRESS.matcher(field.strip());
            if (address.matches() && !sheet.hasHeader(field)) {
                values.put(field, sheet.cellValue(Integer.parseInt(address.group(2)),
                        ColumnLetters.toOrdinal(address.group(1))));
                continue;
            }
            int column = sheet.headerColumn(field);
            if (column < 1) {
                log.warn("Alan '{}' sayfa '{}' başlıklarında bulunamadı", field, sheet.sheetName());
                continue;
            }
            values.put(field, sheet.cellValue(FIRST_DATA_ROW, column));
        }
        return assemble(report, values, mapping);
    }

    private static void requirePassed(SubmissionValidationReport report) {
        if (!report.isPassed()) {
            log.warn("Gönderim {} geçmediği için XBRL üretimi reddedildi", report.submissionId());
            throw new SubmissionNotPassedException(report.submissionId());
        }
    }

    private static String closingDate(XbrlPeriod period) {
        String closing = period.closingDate();
        return closing != null ? closing : "";
    }
}
