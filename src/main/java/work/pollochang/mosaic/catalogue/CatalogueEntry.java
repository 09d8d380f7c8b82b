package work.pollochang.mosaic.catalogue;

import work.pollochang.mosaic.core.Ratio;
import work.pollochang.mosaic.core.RgbColor;

import java.util.Objects;

/**
 * 一張預處理完成的圖片。
 * @param path 縮圖相對於預處理目錄的路徑 (檔名)，在目錄內唯一
 * @param color 原圖的代表色
 * @param ratio 原圖的最簡長寬比
 */
public record CatalogueEntry(String path, RgbColor color, Ratio ratio) {

    public CatalogueEntry {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(color, "color must not be null");
        Objects.requireNonNull(ratio, "ratio must not be null");
    }
}
