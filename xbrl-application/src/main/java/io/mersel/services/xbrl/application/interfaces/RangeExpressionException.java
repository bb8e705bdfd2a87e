package io.mersel.services.xbrl.application.interfaces;

/**
 * Kuraldaki satır/sütun/hücre aralığı ifadesi çözümlenemediğinde fırlatılır.
 * <p>
 * Kural yazım hatasıdır, veri hatası değildir: kural ilgili sayfada atlanır ve teşhis üretilir.
 */
public class RangeExpressionException extends RuntimeException {

    private final String expression;

    public RangeExpressionException(String message, String expression) {
        super(message);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
