package io.mersel.services.xbrl.web.infrastructure;

import io.mersel.services.xbrl.application.interfaces.SubmissionNotPassedException;
import io.mersel.services.xbrl.application.interfaces.XbrlGenerationException;
import io.mersel.services.xbrl.application.interfaces.XbrlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Global hata yöneticisi: RFC 7807 Problem Details.
 * <pre>
 * {
 *   "type": "https://mersel.io/xbrl/errors/parse-failed",
 *   "title": "Ayrıştırma Başarısız",
 *   "status": 422,
 *   "detail": "XBRL belgesi ayrıştırılamadı: ..."
 * }
 * </pre>
 * Veri ihlalleri istisna değil sonuç olarak döndüğü için burada yalnızca belge,
 * önkoşul ve istek düzeyindeki hatalar ele alınır.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE_URI = "https://mersel.io/xbrl/errors/";

    /**
     * Bozuk XML / şema → 422 Unprocessable Entity.
     */
    @ExceptionHandler(XbrlParseException.class)
    public ProblemDetail handleParseException(XbrlParseException ex) {
        log.warn("Ayrıştırma hatası: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "parse-failed"));
        problem.setTitle("Ayrıştırma Başarısız");
        return problem;
    }

    /**
     * Doğrulamadan geçmemiş gönderim için rapor istendi → 409 Conflict.
     */
    @ExceptionHandler(SubmissionNotPassedException.class)
    public ProblemDetail handleSubmissionNotPassed(SubmissionNotPassedException ex) {
        log.warn("Gönderim doğrulamadan geçmedi: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "submission-not-passed"));
        problem.setTitle("Gönderim Geçmedi");
        return problem;
    }

    /**
     * Serileştirme hatası → 500, ayrıntı loglanır.
     */
    @ExceptionHandler(XbrlGenerationException.class)
    public ProblemDetail handleGenerationException(XbrlGenerationException ex) {
        log.error("XBRL üretim hatası: {}", ex.getMessage(), ex);
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "XBRL belgesi üretilemedi");
        problem.setType(URI.create(ERROR_BASE_URI + "generation-failed"));
        problem.setTitle("Üretim Başarısız");
        return problem;
    }

    /**
     * Dosya boyutu aşımı → 413 Payload Too Large.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ProblemDetail handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Dosya boyutu aşımı: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.PAYLOAD_TOO_LARGE,
                "Yüklenen dosya boyutu izin verilen sınırı aşıyor");
        problem.setType(URI.create(ERROR_BASE_URI + "payload-too-large"));
        problem.setTitle("Dosya Boyutu Aşımı");
        return problem;
    }

    /**
     * Genel istek hatası → 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Geçersiz parametre: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "bad-request"));
        problem.setTitle("Geçersiz İstek");
        return problem;
    }

    /**
     * Okunamayan JSON gövdesi → 400 Bad Request.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Okunamayan istek gövdesi: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.BAD_REQUEST, "İstek gövdesi okunamadı");
        problem.setType(URI.create(ERROR_BASE_URI + "unreadable-body"));
        problem.setTitle("Geçersiz İstek");
        return problem;
    }

    /**
     * Bean Validation hatası → 400 Bad Request.
     * {@code @RequestBody @Valid} için fırlatılan MethodArgumentNotValidException da buraya düşer.
     */
    @ExceptionHandler(BindException.class)
    public ProblemDetail handleBindException(BindException ex) {
        String detail = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Doğrulama hatası: {}", detail);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setType(URI.create(ERROR_BASE_URI + "validation-error"));
        problem.setTitle("Doğrulama Hatası");
        return problem;
    }

    /**
     * Beklenmeyen hata → 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Beklenmeyen bir hata oluştu. Lütfen tekrar deneyin.");
        problem.setType(URI.create(ERROR_BASE_URI + "internal-error"));
        problem.setTitle("Sunucu Hatası");
        return problem;
    }
}
