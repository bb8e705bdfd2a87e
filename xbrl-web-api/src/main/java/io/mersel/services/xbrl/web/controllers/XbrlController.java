package io.mersel.services.xbrl.web.controllers;

import io.mersel.services.xbrl.application.interfaces.IXbrlGenerator;
import io.mersel.services.xbrl.application.interfaces.IXbrlParser;
import io.mersel.services.xbrl.application.interfaces.IXbrlTemplateFactory;
import io.mersel.services.xbrl.application.interfaces.IXbrlValidator;
import io.mersel.services.xbrl.application.interfaces.XbrlParseException;
import io.mersel.services.xbrl.application.models.ServiceResponse;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.application.models.xbrl.XbrlTemplate;
import io.mersel.services.xbrl.application.models.xbrl.XbrlValidationResult;
import io.mersel.services.xbrl.web.dto.XbrlDocumentRequestDto;
import io.mersel.services.xbrl.web.infrastructure.XbrlHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * XBRL belge endpoint'leri: ayrıştırma, şablon türetme, denetim ve üretim.
 * <p>
 * Ayrıştırılamayan belgeler {@link XbrlParseException} ile 422 döner;
 * denetim bulguları ise yanıt gövdesinde toplanır.
 */
@RestController
@RequestMapping("/v1/xbrl")
@Tag(name = "XBRL", description = "XBRL instance ve taksonomi işlemleri")
public class XbrlController {

    private static final Logger log = LoggerFactory.getLogger(XbrlController.class);

    @Value("${xbrl.limits.max-document-size-mb:${XBRL_MAX_DOCUMENT_SIZE_MB:50}}")
    private int maxDocumentSizeMb;

    private final IXbrlParser xbrlParser;
    private final IXbrlTemplateFactory templateFactory;
    private final IXbrlValidator xbrlValidator;
    private final IXbrlGenerator xbrlGenerator;

    public XbrlController(IXbrlParser xbrlParser,
                          IXbrlTemplateFactory templateFactory,
                          IXbrlValidator xbrlValidator,
                          IXbrlGenerator xbrlGenerator) {
        this.xbrlParser = xbrlParser;
        this.templateFactory = templateFactory;
        this.xbrlValidator = xbrlValidator;
        this.xbrlGenerator = xbrlGenerator;
    }

    @Operation(
            summary = "Instance Ayrıştırma",
            description = """
                    XBRL instance belgesinden bağlamları, birimleri ve olguları çıkarır.
                    Üst bilgi (işletme, dönem, para birimi, dil) belgeden türetilir.
                    """
    )
    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ServiceResponse<XbrlInstance>> parse(
            @ModelAttribute XbrlDocumentRequestDto requestDto) throws IOException, XbrlParseException {

        String error = checkPart(requestDto.getInstance(), "Instance belgesi");
        if (error != null) {
            return ResponseEntity.badRequest().body(ServiceResponse.error(error));
        }

        XbrlInstance instance = xbrlParser.parseInstance(requestDto.getInstance().getBytes());
        log.info("Instance ayrıştırıldı — Dosya: {}, Bağlam: {}, Birim: {}, Olgu: {}",
                requestDto.getInstance().getOriginalFilename(),
                instance.contexts().size(), instance.units().size(), instance.facts().size());

        return ResponseEntity.ok(ServiceResponse.success(instance));
    }

    @Operation(
            summary = "Taksonomiden Şablon",
            description = """
                    Taksonomi şemasındaki kavramlardan şablon türetir.

                    - Soyut olmayan her kavram zorunlu kabul edilir (aynı ad bir kez)
                    - Parasal kavramlara sayısal kural, diğerlerine zorunluluk kuralı eklenir
                    - Raporlama dönemleri ve para birimleri yapılandırmadan gelir
                    """
    )
    @PostMapping(value = "/template", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ServiceResponse<XbrlTemplate>> template(
            @ModelAttribute XbrlDocumentRequestDto requestDto) throws IOException, XbrlParseException {

        String error = checkPart(requestDto.getTaxonomy(), "Taksonomi şeması");
        if (error != null) {
            return ResponseEntity.badRequest().body(ServiceResponse.error(error));
        }

        XbrlTemplate template = templateFactory.createTemplate(
                xbrlParser.parseTaxonomy(requestDto.getTaxonomy().getBytes()));
        log.info("Şablon türetildi — Dosya: {}, Kavram: {}, Zorunlu: {}",
                requestDto.getTaxonomy().getOriginalFilename(),
                template.taxonomy().concepts().size(), template.requiredConcepts().size());

        return ResponseEntity.ok(ServiceResponse.success(template));
    }

    @Operation(
            summary = "Instance Denetimi",
            description = """
                    Instance belgesini taksonomiden türetilen şablona göre denetler.
                    Tüm bulgular toplanır; ilk hatada durulmaz. Uyarılar `valid` değerini etkilemez.
                    """
    )
    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ServiceResponse<XbrlValidationResult>> validate(
            @ModelAttribute XbrlDocumentRequestDto requestDto) throws IOException, XbrlParseException {

        String error = checkPart(requestDto.getInstance(), "Instance belgesi");
        if (error == null) {
            error = checkPart(requestDto.getTaxonomy(), "Taksonomi şeması");
        }
        if (error != null) {
            return ResponseEntity.badRequest().body(ServiceResponse.error(error));
        }

        XbrlInstance instance = xbrlParser.parseInstance(requestDto.getInstance().getBytes());
        XbrlTemplate template = templateFactory.createTemplate(
                xbrlParser.parseTaxonomy(requestDto.getTaxonomy().getBytes()));
        XbrlValidationResult result = xbrlValidator.validate(instance, template);

        log.info("Instance denetlendi — Dosya: {}, Sonuç: {}, Hata: {}, Uyarı: {}",
                requestDto.getInstance().getOriginalFilename(),
                result.valid() ? "Geçerli" : "Geçersiz",
                result.errors().size(), result.warnings().size());

        return ResponseEntity.ok(ServiceResponse.success(result));
    }

    @Operation(
            summary = "Instance Üretimi",
            description = """
                    JSON olarak verilen instance modelinden XBRL 2.1 belgesi üretir.

                    **Başarılı yanıt:** `200 OK` + `application/xml` body + `X-Xbrl-*` header'ları.
                    """
    )
    @PostMapping(value = "/generate",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<byte[]> generate(@RequestBody XbrlInstance instance) {
        byte[] xml = xbrlGenerator.generate(instance);
        log.info("Instance üretildi — Olgu: {}, Boyut: {} bayt", instance.facts().size(), xml.length);

        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_XML);
        headers.set(XbrlHeaders.FACT_COUNT, String.valueOf(instance.facts().size()));
        headers.set(XbrlHeaders.OUTPUT_SIZE, String.valueOf(xml.length));
        return new ResponseEntity<>(xml, headers, HttpStatus.OK);
    }

    /**
     * Yüklenen parçayı denetler; sorun yoksa {@code null}, varsa hata mesajı döner.
     */
    private String checkPart(MultipartFile part, String label) {
        if (part == null || part.isEmpty()) {
            return label + " boş olamaz";
        }
        if (part.getSize() > maxDocumentSizeMb * 1024L * 1024L) {
            return label + " çok büyük: " + (part.getSize() / (1024 * 1024))
                    + " MB. Maksimum izin verilen: " + maxDocumentSizeMb + " MB";
        }
        return null;
    }
}
