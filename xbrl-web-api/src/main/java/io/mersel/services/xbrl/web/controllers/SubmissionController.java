package io.mersel.services.xbrl.web.controllers;

import io.mersel.services.xbrl.application.interfaces.ISubmissionValidator;
import io.mersel.services.xbrl.application.interfaces.IValidationResultSink;
import io.mersel.services.xbrl.application.interfaces.IXbrlGenerator;
import io.mersel.services.xbrl.application.interfaces.IXbrlReportAssembler;
import io.mersel.services.xbrl.application.models.ServiceResponse;
import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.SubmissionValidationReport;
import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;
import io.mersel.services.xbrl.web.dto.SubmissionValidationRequestDto;
import io.mersel.services.xbrl.web.dto.XbrlReportRequestDto;
import io.mersel.services.xbrl.web.infrastructure.XbrlHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Gönderim doğrulama endpoint'leri.
 * <p>
 * Kurallar ve sayfalar istek gövdesinde gelir; rapor sonuç deposuna teslim edildikten
 * sonra çağırana da döndürülür.
 */
@RestController
@RequestMapping("/v1/submissions")
@Tag(name = "Submissions", description = "Tablo gönderimlerinin kurallara göre doğrulanması")
public class SubmissionController {

    private static final Logger log = LoggerFactory.getLogger(SubmissionController.class);

    private final ISubmissionValidator submissionValidator;
    private final IValidationResultSink resultSink;
    private final IXbrlReportAssembler reportAssembler;
    private final IXbrlGenerator xbrlGenerator;

    public SubmissionController(ISubmissionValidator submissionValidator,
                                IValidationResultSink resultSink,
                                IXbrlReportAssembler reportAssembler,
                                IXbrlGenerator xbrlGenerator) {
        this.submissionValidator = submissionValidator;
        this.resultSink = resultSink;
        this.reportAssembler = reportAssembler;
        this.xbrlGenerator = xbrlGenerator;
    }

    @Operation(
            summary = "Gönderim Doğrulama",
            description = """
                    Aktif kuralları gönderimin sayfalarına uygular ve doğrulama raporu döner.

                    **Adresleme:** `cellRange` (örn. `A2:Z100`) > `rowRange`/`columnRange` (örn. `10-*`, `B-D`)
                    > `applyToAllRows` > tek `field` (hücre adresi veya başlık adı; başlık adı yalnız ilk veri satırını sınar).

                    **Durum:** ERROR önemindeki en az bir başarısız kontrol gönderimi `FAILED` yapar;
                    yalnızca uyarılar `PASSED` sonucunu değiştirmez.

                    **Tanılar:** Bozuk aralık ifadeleri kontrol yerine `diagnostics` listesinde raporlanır.
                    """
    )
    @PostMapping(value = "/{submissionId}/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ServiceResponse<SubmissionValidationReport>> validate(
            @PathVariable long submissionId,
            @RequestBody @Valid SubmissionValidationRequestDto requestDto) {

        var report = submissionValidator.validate(submissionId, requestDto.getRules(), requestDto.toGrids());
        resultSink.accept(report);

        log.info("Gönderim doğrulama isteği tamamlandı — Gönderim: {}, Durum: {}, Hata: {}, Uyarı: {}",
                submissionId, report.summary().status(),
                report.summary().errorCount(), report.summary().warningCount());

        return ResponseEntity.ok(ServiceResponse.success(report));
    }

    @Operation(
            summary = "Gönderimden XBRL Raporu",
            description = """
                    Sayfayı kurallara göre doğrular ve gönderim `PASSED` ise eşlemedeki alanlardan
                    XBRL instance belgesi üretir.

                    **Başarılı yanıt:** `200 OK` + `application/xml` body + `X-Xbrl-*` header'ları.

                    **Geçmeyen gönderim:** `409 Conflict` (ProblemDetail); belge üretilmez.
                    """
    )
    @PostMapping(value = "/{submissionId}/report",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<byte[]> report(
            @PathVariable long submissionId,
            @RequestBody @Valid XbrlReportRequestDto requestDto) {

        SheetGrid sheet = requestDto.getSheet().toGrid();
        var report = submissionValidator.validate(submissionId, requestDto.getRules(), List.of(sheet));
        resultSink.accept(report);

        XbrlInstance instance = reportAssembler.assemble(report, sheet, requestDto.getMapping());
        byte[] xml = xbrlGenerator.generate(instance);

        log.info("XBRL raporu üretildi — Gönderim: {}, Olgu: {}, Boyut: {} bayt",
                submissionId, instance.facts().size(), xml.length);

        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_XML);
        headers.set(XbrlHeaders.FACT_COUNT, String.valueOf(instance.facts().size()));
        headers.set(XbrlHeaders.OUTPUT_SIZE, String.valueOf(xml.length));
        return new ResponseEntity<>(xml, headers, HttpStatus.OK);
    }
}
