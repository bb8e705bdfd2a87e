package io.mersel.services.xbrl.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.web.multipart.MultipartFile;

/**
 * XBRL belge yükleme isteği DTO'su.
 * <p>
 * multipart/form-data olarak alınır. Hangi parçanın zorunlu olduğu uç noktaya göre değişir:
 * ayrıştırmada {@code instance}, şablon türetmede {@code taxonomy}, denetimde ikisi birden.
 */
public class XbrlDocumentRequestDto {

    @Schema(description = "XBRL instance belgesi (.xbrl / .xml)", nullable = true)
    private MultipartFile instance;

    @Schema(description = "Taksonomi şeması (.xsd)", nullable = true)
    private MultipartFile taxonomy;

    public MultipartFile getInstance() {
        return instance;
    }

    public void setInstance(MultipartFile instance) {
        this.instance = instance;
    }

    public MultipartFile getTaxonomy() {
        return taxonomy;
    }

    public void setTaxonomy(MultipartFile taxonomy) {
        this.taxonomy = taxonomy;
    }
}
