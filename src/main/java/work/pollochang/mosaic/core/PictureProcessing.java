package work.pollochang.mosaic.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.cache.CacheKey;
import work.pollochang.mosaic.cache.CachedPicture;
import work.pollochang.mosaic.catalogue.CatalogueEntry;
import work.pollochang.mosaic.report.PreprocessParams;
import work.pollochang.mosaic.report.PreprocessReport;
import work.pollochang.mosaic.tools.FileTools;
import work.pollochang.mosaic.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 單張圖片的預處理：解碼、計算比例、產生並儲存縮圖、計算原圖的代表色。
 */
@Slf4j
public final class PictureProcessing {

    private PictureProcessing() {}

    /**
     * 處理一張圖片。任何錯誤都不會拋出，而是以 {@link PreprocessReport} 回報，讓整批處理可以繼續。
     *
     * @param source 來源圖片
     * @param outputDir 縮圖輸出目錄
     * @param thumbnailName 縮圖檔名 (同時是目錄中的 path)
     * @param params 預處理參數
     * @param extractor 代表色策略
     * @param cache 預處理快取，可為 {@code null}
     * @return 處理結果
     */
    public static PreprocessReport processPicture(
            Path source,
            Path outputDir,
            String thumbnailName,
            PreprocessParams params,
            ColorExtractor extractor,
            Map<CacheKey, CachedPicture> cache
    ) {
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            log.warn("{} - 檔案不存在或不可讀，跳過", source);
            return PreprocessReport.failure(source, PreprocessResult.SKIPPED_NOT_FOUND, "檔案不存在或不可讀");
        }

        Path thumbnailPath = outputDir.resolve(thumbnailName);

        CacheKey key = null;
        if (cache != null) {
            try {
                key = CacheKey.of(source, outputDir, params.signature());
                CachedPicture cached = cache.get(key);
                // 縮圖必須仍是這個來源寫出的那一份，被其他來源覆蓋時重新處理
                if (cached != null && cached.thumbnailName().equals(thumbnailName) && Files.isRegularFile(thumbnailPath)
                        && FileTools.sha256(thumbnailPath).equals(cached.thumbnailDigest())) {
                    log.debug("{} - 快取命中，沿用 {}", source, thumbnailPath);
                    CatalogueEntry entry = new CatalogueEntry(thumbnailName, cached.color(), cached.ratio());
                    return PreprocessReport.success(source, PreprocessResult.CACHED, entry, Files.size(thumbnailPath));
                }
            } catch (IOException e) {
                log.debug("{} - 無法讀取檔案屬性，不使用快取", source, e);
                key = null;
            }
        }

        try (DecodedImage decoded = DecodedImage.decode(source)) {
            if (decoded == null) {
                log.warn("{} - 不是可辨識的圖片格式，跳過", source);
                return PreprocessReport.failure(source, PreprocessResult.FAILED_DECODE, "不是可辨識的圖片格式");
            }
            BufferedImage image = decoded.image();
            Ratio ratio = Ratio.of(image.getWidth(), image.getHeight());

            Ratio.Dimensions thumbDim = ratio.dimensionsFor(params.thumbnailSize());
            BufferedImage thumbnail = ImageTools.adjustContrast(
                    ImageTools.resizeImage(image, thumbDim.width(), thumbDim.height()), params.contrast());
            try {
                if (!ImageTools.writeImage(thumbnail, thumbnailPath)) {
                    log.warn("{} - 找不到 {} 的圖片寫入器，跳過", source, thumbnailPath.getFileName());
                    discardThumbnail(thumbnailPath);
                    return PreprocessReport.failure(source, PreprocessResult.FAILED_WRITE, "不支援的縮圖格式");
                }
            } catch (IOException e) {
                log.warn("{} - 無法寫入縮圖 {}", source, thumbnailPath, e);
                discardThumbnail(thumbnailPath);
                return PreprocessReport.failure(source, PreprocessResult.FAILED_WRITE, e.getMessage());
            } finally {
                thumbnail.flush();
            }

            // 代表色以原圖計算，而不是縮圖
            RgbColor color = extractor.extract(image);
            CatalogueEntry entry = new CatalogueEntry(thumbnailName, color, ratio);
            if (key != null) {
                cache.put(key, new CachedPicture(thumbnailName, FileTools.sha256(thumbnailPath), color, ratio));
            }
            return PreprocessReport.success(source, PreprocessResult.PROCESSED, entry, Files.size(thumbnailPath));

        } catch (IOException | IllegalArgumentException e) {
            log.warn("{} - 解碼失敗 (可能非支援格式或檔案損毀)", source, e);
            return PreprocessReport.failure(source, PreprocessResult.FAILED_DECODE, String.valueOf(e.getMessage()));
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理檔案時發生記憶體溢位錯誤 (圖片可能過大)", source, e);
            return PreprocessReport.failure(source, PreprocessResult.FAILED_OUT_OF_MEMORY, "記憶體溢位");
        } catch (Exception e) {
            log.error("{} - 處理檔案時發生未知錯誤", source, e);
            return PreprocessReport.failure(source, PreprocessResult.FAILED_UNKNOWN, String.valueOf(e.getMessage()));
        }
    }

    /**
     * 清除寫到一半的縮圖，避免輸出目錄中留下不完整的檔案。
     */
    private static void discardThumbnail(Path thumbnailPath) {
        try {
            Files.deleteIfExists(thumbnailPath);
        } catch (IOException e) {
            log.warn("{} - 無法刪除不完整的縮圖", thumbnailPath, e);
        }
    }
}
