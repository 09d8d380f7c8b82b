package work.pollochang.mosaic.report;

import work.pollochang.mosaic.catalogue.CatalogueEntry;
import work.pollochang.mosaic.core.PreprocessResult;

import java.nio.file.Path;

/**
 * 單一檔案的預處理結果。成功時帶有目錄項目，失敗時帶有原因。
 */
public record PreprocessReport(Path source, PreprocessResult result, CatalogueEntry entry, String reason, long thumbnailBytes) {

    public static PreprocessReport success(Path source, PreprocessResult result, CatalogueEntry entry, long thumbnailBytes) {
        return new PreprocessReport(source, result, entry, null, thumbnailBytes);
    }

    public static PreprocessReport failure(Path source, PreprocessResult result, String reason) {
        return new PreprocessReport(source, result, null, reason, 0);
    }
}
