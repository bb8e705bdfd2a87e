package io.mersel.services.xbrl.web.dto;

import io.mersel.services.xbrl.application.models.SheetGrid;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Gönderimdeki tek tablo sayfası.
 * <p>
 * Satırlar 1. satırdan başlar; başlık adı ile adreslenen kurallar için 1. satır başlık satırıdır.
 */
public class SheetDto {

    @Schema(description = "Şablondaki sayfa kimliği. Kurallar sheetId ile bu sayfaya bağlanır.",
            example = "1", nullable = true)
    private Long sheetId;

    @Schema(description = "Sayfa adı", example = "Bilanço")
    private String sheetName;

    @NotNull(message = "Sayfa satırları boş olamaz")
    @Schema(description = "Hücre değerleri (metin, sayı veya null)",
            example = "[[\"Company Name\",\"Revenue\"],[\"Mersel\",1200]]",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private List<List<Object>> rows;

    public SheetGrid toGrid() {
        return new SheetGrid(sheetId, sheetName, rows);
    }

    public Long getSheetId() {
        return sheetId;
    }

    public void setSheetId(Long sheetId) {
        this.sheetId = sheetId;
    }

    public String getSheetName() {
        return sheetName;
    }

    public void setSheetName(String sheetName) {
        this.sheetName = sheetName;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public void setRows(List<List<Object>> rows) {
        this.rows = rows;
    }
}
