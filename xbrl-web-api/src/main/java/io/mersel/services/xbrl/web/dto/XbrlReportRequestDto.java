package io.mersel.services.xbrl.web.dto;

import io.mersel.services.xbrl.application.models.ValidationRule;
import io.mersel.services.xbrl.application.models.xbrl.XbrlReportMapping;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Gönderimden XBRL rapor üretme isteği.
 * <p>
 * Sayfa önce kurallara göre doğrulanır; yalnızca PASSED sonuçta rapor üretilir.
 */
public class XbrlReportRequestDto {

    @NotNull(message = "Kural listesi boş olamaz")
    @Schema(description = "Uygulanacak kurallar", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<ValidationRule> rules;

    @NotNull(message = "Sayfa boş olamaz")
    @Valid
    @Schema(description = "Değerlerin okunacağı tablo sayfası", requiredMode = Schema.RequiredMode.REQUIRED)
    private SheetDto sheet;

    @NotNull(message = "Kavram eşlemesi boş olamaz")
    @Schema(description = "Alan → kavram eşlemesi, bağlam ve birim bilgileri",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private XbrlReportMapping mapping;

    public List<ValidationRule> getRules() {
        return rules;
    }

    public void setRules(List<ValidationRule> rules) {
        this.rules = rules;
    }

    public SheetDto getSheet() {
        return sheet;
    }

    public void setSheet(SheetDto sheet) {
        this.sheet = sheet;
    }

    public XbrlReportMapping getMapping() {
        return mapping;
    }

    public void setMapping(XbrlReportMapping mapping) {
        this.mapping = mapping;
    }
}
