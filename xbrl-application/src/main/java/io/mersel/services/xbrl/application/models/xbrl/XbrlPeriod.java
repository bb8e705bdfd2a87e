package io.mersel.services.xbrl.application.models.xbrl;

/**
 * Bağlam dönemi: ya anlık ({@code instant}) ya da süreli ({@code startDate}/{@code endDate}).
 * <p>
 * İki biçimden yalnızca biri dolu olur. Tarihler belgede yazıldığı metin haliyle tutulur.
 */
public record XbrlPeriod(String instant, String startDate, String endDate) {

    public XbrlPeriod {
        if (instant != null && (startDate != null || endDate != null)) {
            throw new IllegalArgumentException("Dönem hem anlık hem süreli olamaz");
        }
        if ((startDate == null) != (endDate == null)) {
            throw new IllegalArgumentException("Süreli dönem için başlangıç ve bitiş birlikte verilmeli");
        }
    }

    public static XbrlPeriod instant(String instant) {
        return new XbrlPeriod(instant, null, null);
    }

    public static XbrlPeriod duration(String startDate, String endDate) {
        return new XbrlPeriod(null, startDate, endDate);
    }

    /**
     * Belgede dönem bilgisi bulunmadığında kullanılır.
     */
    public static XbrlPeriod empty() {
        return new XbrlPeriod(null, null, null);
    }

    public boolean hasInstant() {
        return instant != null;
    }

    public boolean hasDuration() {
        return startDate != null;
    }

    /**
     * Dönemin kapanış tarihi: anlık ise {@code instant}, süreli ise {@code endDate}.
     */
    public String closingDate() {
        return hasInstant() ? instant : endDate;
    }
}
