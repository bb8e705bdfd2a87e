package io.mersel.services.xbrl.web.dto;

import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.ValidationRule;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Gönderim doğrulama isteği DTO'su.
 * <p>
 * JSON gövde olarak alınır. Kural listesi boş olabilir; bu durumda gönderim kontrolsüz geçer.
 */
public class SubmissionValidationRequestDto {

    @NotNull(message = "Kural listesi boş olamaz")
    @Schema(description = "Uygulanacak kurallar", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<ValidationRule> rules;

    @NotNull(message = "Sayfa listesi boş olamaz")
    @Valid
    @Schema(description = "Gönderimin tablo sayfaları", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<SheetDto> sheets;

    public List<SheetGrid> toGrids() {
        return sheets.stream().map(SheetDto::toGrid).toList();
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    public void setRules(List<ValidationRule> rules) {
        this.rules = rules;
    }

    public List<SheetDto> getSheets() {
        return sheets;
    }

    public void setSheets(List<SheetDto> sheets) {
        this.sheets = sheets;
    }
}
