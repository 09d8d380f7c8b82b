package work.pollochang.mosaic.report;

import work.pollochang.mosaic.core.ChunkEdgePolicy;
import work.pollochang.mosaic.core.ColorDistance;
import work.pollochang.mosaic.core.ColorStrategy;

/**
 * 建立馬賽克的參數。
 * @param thumbnailSize 每格縮圖長邊的像素數
 * @param chunkSize 模型區塊長邊的像素數
 * @param colorStrategy 代表色策略；{@code null} 表示沿用目錄記錄的策略
 * @param distance 顏色距離權重
 * @param edgePolicy 不完整區塊的處理方式
 * @param threads 同時比對的執行緒數
 */
public record MosaicParams(int thumbnailSize, int chunkSize, ColorStrategy colorStrategy,
                           ColorDistance distance, ChunkEdgePolicy edgePolicy, int threads) {

    public static final int DEFAULT_CHUNK_SIZE = 8;

    public MosaicParams {
        if (thumbnailSize <= 0 || chunkSize <= 0) {
            throw new IllegalArgumentException("縮圖與區塊尺寸必須為正數: " + thumbnailSize + ", " + chunkSize);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("執行緒數必須為正數: " + threads);
        }
    }
}
