package work.pollochang.mosaic.report;

import work.pollochang.mosaic.core.ColorStrategy;

/**
 * 預處理參數。
 * @param thumbnailSize 縮圖長邊的像素數
 * @param contrast 縮圖的對比調整量，0 表示不調整
 * @param colorStrategy 代表色策略
 * @param threads 同時處理的檔案數
 * @param timeOutHr 整批處理的逾時 (小時)
 */
public record PreprocessParams(int thumbnailSize, float contrast, ColorStrategy colorStrategy, int threads, long timeOutHr) {

    public static final int DEFAULT_THUMBNAIL_SIZE = 64;
    public static final float DEFAULT_CONTRAST = 20.0f;

    public PreprocessParams {
        if (thumbnailSize <= 0) {
            throw new IllegalArgumentException("縮圖尺寸必須為正數: " + thumbnailSize);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("執行緒數必須為正數: " + threads);
        }
        if (timeOutHr <= 0) {
            throw new IllegalArgumentException("逾時必須為正數: " + timeOutHr);
        }
    }

    /**
     * 影響快取內容的設定，設定不同時快取不可沿用。
     */
    public String signature() {
        return colorStrategy.name() + "/" + thumbnailSize + "/" + contrast;
    }
}
