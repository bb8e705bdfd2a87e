package io.mersel.services.xbrl.infrastructure;

import java.util.ArrayList;
import java.util.List;

/**
 * Bir kuralın adreslemesinden çözülen dikdörtgen hücre kutusu (sınırlar dahil).
 * <p>
 * Sınırlar ızgaranın dışına taşabilir; dışarıdaki hücreler boş değer olarak değerlendirilir.
 */
public record CellSelection(int firstRow, int lastRow, int firstColumn, int lastColumn) {

    public CellSelection {
        if (firstRow < 1 || firstColumn < 1 || lastRow < firstRow || lastColumn < firstColumn) {
            throw new IllegalArgumentException(
                    "Geçersiz hücre kutusu: satır " + firstRow + "-" + lastRow + ", sütun " + firstColumn + "-" + lastColumn);
        }
    }

    public static CellSelection single(int row, int column) {
        return new CellSelection(row, row, column, column);
    }

    public boolean matches(int row, int column) {
        return row >= firstRow && row <= lastRow && column >= firstColumn && column <= lastColumn;
    }

    public long size() {
        return (long) (lastRow - firstRow + 1) * (lastColumn - firstColumn + 1);
    }

    /**
     * Satır öncelikli sırada tüm koordinatlar.
     */
    public List<CellCoordinate> coordinates() {
        var result = new ArrayList<CellCoordinate>((int) Math.min(size(), Integer.MAX_VALUE - 8));
        for (int row = firstRow; row <= lastRow; row++) {
            for (int column = firstColumn; column <= lastColumn; column++) {
                result.add(new CellCoordinate(row, column));
            }
        }
        return result;
    }
}
