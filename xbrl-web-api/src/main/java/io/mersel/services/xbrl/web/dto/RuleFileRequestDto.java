package io.mersel.services.xbrl.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import org.springframework.web.multipart.MultipartFile;

/**
 * Kural dosyası ayrıştırma isteği DTO'su.
 * <p>
 * multipart/form-data olarak alınır. Biçim dosya uzantısından çözülür
 * ({@code .yml}/{@code .yaml} veya {@code .txt}/{@code .rules}).
 */
public class RuleFileRequestDto {

    @NotNull(message = "Kural dosyası boş olamaz")
    @Schema(description = "YAML veya düz metin kural dosyası", requiredMode = Schema.RequiredMode.REQUIRED)
    private MultipartFile file;

    @Schema(description = "Kurallara atanacak şablon kimliği", example = "7", nullable = true)
    private Long templateId;

    public MultipartFile getFile() {
        return file;
    }

    public void setFile(MultipartFile file) {
        this.file = file;
    }

    public Long getTemplateId() {
        return templateId;
    }

    public void setTemplateId(Long templateId) {
        this.templateId = templateId;
    }
}
