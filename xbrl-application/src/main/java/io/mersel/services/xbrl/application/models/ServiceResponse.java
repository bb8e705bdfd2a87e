package io.mersel.services.xbrl.application.models;

/**
 * JSON uç noktalarının yanıt zarfı.
 * <p>
 * Başarılı çağrıda {@code result} doğrulama raporunu, ayrıştırılmış instance'ı, taksonomiyi
 * veya kural setini taşır. İstemci kaynaklı hatada (boş dosya, boyut sınırı, okunamayan kural dosyası)
 * yalnız {@code errorMessage} doludur. Beklenmeyen hatalar bu zarfla değil ProblemDetail ile döner.
 *
 * @param <T> Sonuç tipi
 */
public class ServiceResponse<T> {

    private String errorMessage;
    private T result;

    public ServiceResponse() {
    }

    public ServiceResponse(T result) {
        this.result = result;
    }

    public ServiceResponse(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public static <T> ServiceResponse<T> success(T result) {
        return new ServiceResponse<>(result);
    }

    public static <T> ServiceResponse<T> error(String errorMessage) {
        return new ServiceResponse<>(errorMessage);
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public T getResult() {
        return result;
    }

    public void setResult(T result) {
        this.result = result;
    }
}
