package work.pollochang.mosaic.core;

public enum PreprocessResult {
    PROCESSED("處理完成"),
    CACHED("沿用快取"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    FAILED_DECODE("無法解碼"),
    FAILED_WRITE("縮圖寫入失敗"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_TIMEOUT("逾時未完成"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    PreprocessResult(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isSuccess() {
        return this == PROCESSED || this == CACHED;
    }
}
