package work.pollochang.mosaic.core;

/**
 * 模型寬高不是區塊大小整數倍時，最後不完整的一欄/一列如何處理。
 */
public enum ChunkEdgePolicy {
    /** 捨棄不完整的欄與列，區塊數為 floor(W/cw) * floor(H/ch) */
    DROP_PARTIAL,
    /** 保留不完整的欄與列，並裁切到圖片範圍內，區塊數為 ceil(W/cw) * ceil(H/ch) */
    CROP_PARTIAL;

    int cells(int length, int step) {
        return this == DROP_PARTIAL ? length / step : (length + step - 1) / step;
    }
}
