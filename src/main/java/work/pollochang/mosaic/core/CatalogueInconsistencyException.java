package work.pollochang.mosaic.core;

/**
 * 目錄中列出的縮圖在預處理目錄裡不存在或無法解碼，代表目錄與檔案系統不一致。
 */
public class CatalogueInconsistencyException extends RuntimeException {

    public CatalogueInconsistencyException(String message) {
        super(message);
    }

    public CatalogueInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
