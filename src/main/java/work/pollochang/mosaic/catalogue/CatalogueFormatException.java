package work.pollochang.mosaic.catalogue;

import java.io.IOException;

/**
 * 目錄檔內容無法辨識：版本不符、欄位缺漏或數值不合法。
 */
public class CatalogueFormatException extends IOException {

    public CatalogueFormatException(String message) {
        super(message);
    }

    public CatalogueFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
