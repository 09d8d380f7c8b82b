package work.pollochang.mosaic.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 用於快取的 Key：來源檔案、縮圖輸出目錄與產生結果時的設定。檔案大小或修改時間改變即視為不同檔案。
 * @param sourcePath 來源檔案的絕對路徑
 * @param outputDir 縮圖輸出目錄的絕對路徑
 * @param fileSize 檔案大小 (bytes)
 * @param lastModified 最後修改時間 (epoch 毫秒)
 * @param settings 預處理設定簽章
 */
public record CacheKey(String sourcePath, String outputDir, long fileSize, long lastModified, String settings) {

    public static CacheKey of(Path source, Path outputDir, String settings) throws IOException {
        return new CacheKey(
                source.toAbsolutePath().normalize().toString(),
                outputDir.toAbsolutePath().normalize().toString(),
                Files.size(source),
                Files.getLastModifiedTime(source).toMillis(),
                settings);
    }
}
