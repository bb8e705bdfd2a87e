package io.mersel.services.xbrl.application.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Salt okunur tablo hücre ızgarası.
 * <p>
 * Satırlar ve sütunlar dışarıya 1 tabanlı numaralarla açılır (tablo programı geleneği).
 * Hücre değerleri {@link String}, {@link Number} veya {@code null} olabilir.
 *
 * @param sheetId    Şablondaki sayfa kimliği ({@code null} olabilir)
 * @param sheetName  Sayfa adı
 * @param rows       Satırlar: her satır hücre değerleri listesi
 */
public record SheetGrid(Long sheetId, String sheetName, List<List<Object>> rows) {

    public SheetGrid {
        sheetName = sheetName != null ? sheetName : "";
        var copy = new ArrayList<List<Object>>();
        if (rows != null) {
            for (List<Object> row : rows) {
                // Hücreler null olabildiği için List.copyOf kullanılamaz
                copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    public SheetGrid(String sheetName, List<List<Object>> rows) {
        this(null, sheetName, rows);
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * En geniş satırın hücre sayısı.
     */
    public int columnCount() {
        int max = 0;
        for (List<Object> row : rows) {
            max = Math.max(max, row.size());
        }
        return max;
    }

    /**
     * 1 tabanlı koordinattaki değeri döndürür; ızgara dışındaysa {@code null}.
     */
    public Object cellValue(int rowNumber, int columnNumber) {
        if (rowNumber < 1 || rowNumber > rows.size()) {
            return null;
        }
        List<Object> row = rows.get(rowNumber - 1);
        if (columnNumber < 1 || columnNumber > row.size()) {
            return null;
        }
        return row.get(columnNumber - 1);
    }

    /**
     * Başlık satırında (1. satır) adı eşleşen sütunun 1 tabanlı numarası; yoksa -1.
     * Karşılaştırma büyük/küçük harf duyarsızdır.
     */
    public int headerColumn(String headerName) {
        if (rows.isEmpty() || headerName == null) {
            return -1;
        }
        List<Object> header = rows.get(0);
        for (int i = 0; i < header.size(); i++) {
            Object cell = header.get(i);
            if (cell != null && String.valueOf(cell).strip().equalsIgnoreCase(headerName.strip())) {
                return i + 1;
            }
        }
        return -1;
    }

    public boolean hasHeader(String headerName) {
        return headerColumn(headerName) > 0;
    }
}
