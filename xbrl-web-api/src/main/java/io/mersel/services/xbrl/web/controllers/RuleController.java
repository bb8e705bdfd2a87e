package io.mersel.services.xbrl.web.controllers;

import io.mersel.services.xbrl.application.enums.RuleFileFormat;
import io.mersel.services.xbrl.application.interfaces.IValidationRuleLoader;
import io.mersel.services.xbrl.application.models.ParsedRuleSet;
import io.mersel.services.xbrl.application.models.ServiceResponse;
import io.mersel.services.xbrl.web.dto.RuleFileRequestDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Kural tanım dosyası endpoint'i.
 */
@RestController
@RequestMapping("/v1/rules")
@Tag(name = "Rules", description = "YAML ve düz metin kural dosyalarının ayrıştırılması")
public class RuleController {

    private static final Logger log = LoggerFactory.getLogger(RuleController.class);

    @Value("${xbrl.limits.max-rule-file-size-kb:${XBRL_MAX_RULE_FILE_SIZE_KB:1024}}")
    private int maxRuleFileSizeKb;

    private final IValidationRuleLoader ruleLoader;

    public RuleController(IValidationRuleLoader ruleLoader) {
        this.ruleLoader = ruleLoader;
    }

    @Operation(
            summary = "Kural Dosyası Ayrıştırma",
            description = """
                    Kural dosyasını `ValidationRule` listesine çevirir. Biçim dosya uzantısından çözülür.

                    - **YAML** (`.yml`, `.yaml`): `sheetValidations.<sayfa>.columnValidations.<sütun>` altında sütun özellikleri
                    - **Düz metin** (`.txt`, `.rules`): `---` ile ayrılmış `FIELD/RULE/CONDITION/ERROR/SEVERITY` blokları

                    Bozuk bloklar isteği düşürmez; `errors` listesinde raporlanır.
                    """
    )
    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ServiceResponse<ParsedRuleSet>> parse(
            @ModelAttribute @Valid RuleFileRequestDto requestDto) throws IOException {

        if (requestDto.getFile() == null || requestDto.getFile().isEmpty()) {
            return ResponseEntity.badRequest().body(ServiceResponse.error("Kural dosyası boş olamaz"));
        }
        if (requestDto.getFile().getSize() > maxRuleFileSizeKb * 1024L) {
            return ResponseEntity.badRequest().body(ServiceResponse.error(
                    "Kural dosyası çok büyük: " + (requestDto.getFile().getSize() / 1024)
                            + " KB. Maksimum izin verilen: " + maxRuleFileSizeKb + " KB"));
        }

        String fileName = requestDto.getFile().getOriginalFilename();
        RuleFileFormat format = RuleFileFormat.fromFileName(fileName);
        String content = new String(requestDto.getFile().getBytes(), StandardCharsets.UTF_8);

        ParsedRuleSet parsed = ruleLoader.parse(content, format, requestDto.getTemplateId());

        log.info("Kural dosyası ayrıştırıldı — Dosya: {}, Biçim: {}, Kural: {}, Hata: {}",
                fileName, format, parsed.rules().size(), parsed.errors().size());

        return ResponseEntity.ok(ServiceResponse.success(parsed));
    }
}
