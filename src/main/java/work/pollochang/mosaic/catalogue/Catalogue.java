package work.pollochang.mosaic.catalogue;

import work.pollochang.mosaic.core.ColorStrategy;
import work.pollochang.mosaic.core.Ratio;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 預處理結果的目錄。寫入一次後即視為唯讀，每次建立馬賽克都重新載入。
 * @param colorStrategy 產生代表色所用的策略
 * @param entries 依處理順序排列的圖片
 */
public record Catalogue(ColorStrategy colorStrategy, List<CatalogueEntry> entries) {

    public Catalogue {
        Objects.requireNonNull(colorStrategy, "colorStrategy must not be null");
        entries = List.copyOf(entries);
    }

    /**
     * 只保留與指定比例完全相同的圖片，順序不變。
     */
    public List<CatalogueEntry> filterByRatio(Ratio ratio) {
        return entries.stream()
                .filter(entry -> entry.ratio().equals(ratio))
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
