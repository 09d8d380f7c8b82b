package work.pollochang.mosaic.cache;

import work.pollochang.mosaic.core.Ratio;
import work.pollochang.mosaic.core.RgbColor;

/**
 * 用於快取的 Value：已計算過的代表色、比例與縮圖檔名。
 * @param thumbnailDigest 寫出縮圖當下的 SHA-256，縮圖被其他來源覆蓋後即不相符
 */
public record CachedPicture(String thumbnailName, String thumbnailDigest, RgbColor color, Ratio ratio) {}
