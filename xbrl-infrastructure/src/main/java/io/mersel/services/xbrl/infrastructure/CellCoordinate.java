package io.mersel.services.xbrl.infrastructure;

/**
 * 1 tabanlı hücre koordinatı.
 */
public record CellCoordinate(int row, int column) {

    public CellCoordinate {
        if (row < 1 || column < 1) {
            throw new IllegalArgumentException("Koordinatlar 1 tabanlıdır: " + row + "," + column);
        }
    }

    public String columnName() {
        return ColumnLetters.toLetters(column);
    }

    /**
     * Tablo programı biçiminde adres (örn: "B5").
     */
    public String reference() {
        return columnName() + row;
    }
}
