package io.mersel.services.xbrl.infrastructure;

import io.mersel.services.xbrl.application.interfaces.RangeExpressionException;
import io.mersel.services.xbrl.application.models.SheetGrid;
import io.mersel.services.xbrl.application.models.ValidationRule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Kural adreslemesini somut bir hücre kutusuna çözer.
 * <p>
 * Öncelik sırası:
 * <ol>
 *   <li>{@code cellRange}: "A2:Z100" veya "B5"</li>
 *   <li>{@code rowRange} / {@code columnRange}: "2-100", "5", "10-*" / "A-Z", "B", "C-E"</li>
 *   <li>{@code applyToAllRows}: alanın sütunundaki tüm veri satırları</li>
 *   <li>Tek {@code field}: hücre adresi, satır içi aralık veya başlık adı; başlık adı ve sütun harfi
 *       ilk veri satırındaki tek hücreye çözülür</li>
 * </ol>
 * Hatalı ifadeler {@link RangeExpressionException} fırlatır; kural her şeyle eşleşmeye düşmez.
 * Veri satırları 2. satırdan başlar (1. satır başlıktır).
 */
@Component
public class RangeAddressResolver {

    private static final int FIRST_DATA_ROW = 2;

    private static final Pattern CELL = Pattern.compile("([A-Za-z]{1,6})(\\d{1,9})");
    private static final Pattern CELL_BOX = Pattern.compile("([A-Za-z]{1,6})(\\d{1,9})(?:\\s*:\\s*([A-Za-z]{1,6})(\\d{1,9}))?");
    private static final Pattern ROW_RANGE = Pattern.compile("(\\d{1,9})(?:\\s*-\\s*(\\d{1,9}|\\*))?");
    private static final Pattern COLUMN_RANGE = Pattern.compile("([A-Za-z]{1,6})(?:\\s*-\\s*([A-Za-z]{1,6}))?");

    private final long maxCellsPerRule;

    public RangeAddressResolver(@Value("${xbrl.validation.max-cells-per-rule:1000000}") long maxCellsPerRule) {
        this.maxCellsPerRule = maxCellsPerRule > 0 ? maxCellsPerRule : 1_000_000L;
    }

    /**
     * @throws RangeExpressionException ifade çözümlenemiyorsa veya kutu üst sınırı aşıyorsa
     */
    public CellSelection resolve(ValidationRule rule, SheetGrid grid) {
        CellSelection selection;
        if (rule.hasCellRange()) {
            selection = parseCellBox(rule.cellRange(), "cellRange");
        } else if (rule.hasRowOrColumnRange()) {
            selection = resolveRowColumnRanges(rule, grid);
        } else if (rule.applyToAllRows()) {
            int column = fieldColumn(rule.field(), grid);
            if (column < 1) {
                throw new RangeExpressionException("Alanın sütunu çözümlenemedi: " + rule.field(), rule.field());
            }
            selection = new CellSelection(FIRST_DATA_ROW, lastDataRow(grid), column, column);
        } else {
            selection = resolveField(rule.field(), grid);
        }

        if (selection.size() > maxCellsPerRule) {
            throw new RangeExpressionException(
                    "Kural " + selection.size() + " hücre seçiyor, üst sınır " + maxCellsPerRule, describe(rule));
        }
        return selection;
    }

    // ── Adresleme modları ──────────────────────────────────────────

    private CellSelection resolveRowColumnRanges(ValidationRule rule, SheetGrid grid) {
        int firstRow = FIRST_DATA_ROW;
        int lastRow = lastDataRow(grid);
        if (!isBlank(rule.rowRange())) {
            Matcher m = ROW_RANGE.matcher(rule.rowRange().strip());
            if (!m.matches()) {
                throw new RangeExpressionException("Geçersiz satır aralığı: " + rule.rowRange(), rule.rowRange());
            }
            firstRow = parseRow(m.group(1), rule.rowRange());
            String end = m.group(2);
            if (end == null) {
                lastRow = firstRow;
            } else if ("*".equals(end)) {
                // Izgaranın dışındaki başlangıç satırı da bir kez değerlendirilir
                lastRow = Math.max(firstRow, grid.rowCount());
            } else {
                lastRow = parseRow(end, rule.rowRange());
            }
            if (lastRow < firstRow) {
                throw new RangeExpressionException("Satır aralığı ters: " + rule.rowRange(), rule.rowRange());
            }
        }

        int firstColumn;
        int lastColumn;
        if (!isBlank(rule.columnRange())) {
            Matcher m = COLUMN_RANGE.matcher(rule.columnRange().strip());
            if (!m.matches()) {
                throw new RangeExpressionException("Geçersiz sütun aralığı: " + rule.columnRange(), rule.columnRange());
            }
            firstColumn = ColumnLetters.toOrdinal(m.group(1));
            lastColumn = m.group(2) != null ? ColumnLetters.toOrdinal(m.group(2)) : firstColumn;
            if (lastColumn < firstColumn) {
                throw new RangeExpressionException("Sütun aralığı ters: " + rule.columnRange(), rule.columnRange());
            }
        } else {
            int column = fieldColumn(rule.field(), grid);
            if (column > 0) {
                firstColumn = column;
                lastColumn = column;
            } else {
                firstColumn = 1;
                lastColumn = Math.max(1, grid.columnCount());
            }
        }
        return new CellSelection(firstRow, lastRow, firstColumn, lastColumn);
    }

    private CellSelection resolveField(String field, SheetGrid grid) {
        if (isBlank(field)) {
            throw new RangeExpressionException("Kuralda alan veya adresleme tanımlı değil", field);
        }
        if (CELL_BOX.matcher(field).matches() && !grid.hasHeader(field)) {
            return parseCellBox(field, "field");
        }
        int column = grid.headerColumn(field);
        if (column < 1 && isColumnReference(field)) {
            column = ColumnLetters.toOrdinal(field);
        }
        if (column < 1) {
            throw new RangeExpressionException("Başlık satırında alan bulunamadı: " + field, field);
        }
        return CellSelection.single(FIRST_DATA_ROW, column);
    }

    // ── Yardımcılar ────────────────────────────────────────────────

    private CellSelection parseCellBox(String expression, String source) {
        Matcher m = CELL_BOX.matcher(expression.strip());
        if (!m.matches()) {
            throw new RangeExpressionException("Geçersiz hücre aralığı (" + source + "): " + expression, expression);
        }
        int row1 = parseRow(m.group(2), expression);
        int col1 = ColumnLetters.toOrdinal(m.group(1));
        if (m.group(3) == null) {
            return CellSelection.single(row1, col1);
        }
        int row2 = parseRow(m.group(4), expression);
        int col2 = ColumnLetters.toOrdinal(m.group(3));
        return new CellSelection(Math.min(row1, row2), Math.max(row1, row2), Math.min(col1, col2), Math.max(col1, col2));
    }

    /**
     * Alan adını sütuna çevirir: başlık adı, sütun harfi veya hücre adresinin sütunu. Bulunamazsa -1.
     */
    private int fieldColumn(String field, SheetGrid grid) {
        if (isBlank(field)) {
            return -1;
        }
        int header = grid.headerColumn(field);
        if (header > 0) {
            return header;
        }
        if (isColumnReference(field)) {
            return ColumnLetters.toOrdinal(field);
        }
        Matcher cell = CELL.matcher(field);
        if (cell.matches()) {
            return ColumnLetters.toOrdinal(cell.group(1));
        }
        return -1;
    }

    /**
     * En fazla üç harf (XFD = 16384) sütun referansı sayılır; daha uzun adlar başlık adıdır.
     */
    private static boolean isColumnReference(String field) {
        return field.length() <= 3 && ColumnLetters.isLetters(field);
    }

    private static int parseRow(String digits, String expression) {
        int row = Integer.parseInt(digits);
        if (row < 1) {
            throw new RangeExpressionException("Satır numarası 1'den küçük olamaz: " + expression, expression);
        }
        return row;
    }

    private static int lastDataRow(SheetGrid grid) {
        return Math.max(FIRST_DATA_ROW, grid.rowCount());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String describe(ValidationRule rule) {
        if (rule.hasCellRange()) {
            return rule.cellRange();
        }
        if (rule.hasRowOrColumnRange()) {
            return "rows=" + rule.rowRange() + ", columns=" + rule.columnRange();
        }
        return rule.field();
    }
}
