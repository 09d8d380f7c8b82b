package work.pollochang.mosaic.core;

import work.pollochang.mosaic.catalogue.CatalogueEntry;

import java.util.List;
import java.util.Objects;

/**
 * 在已依比例篩選過的目錄中，為每個區塊顏色找出距離最近的圖片。
 *
 * <p>線性搜尋；距離相同時取目錄中較前面的圖片，遇到完全相同的顏色立即回傳。
 * 建構後不再變動，可由多個執行緒同時呼叫 {@link #match(RgbColor)}。</p>
 */
public class TileMatcher {

    private final List<CatalogueEntry> candidates;
    private final ColorDistance distance;

    /**
     * @param candidates 比例與模型相同的圖片，不可為空
     * @param distance 顏色距離的權重
     * @throws IllegalArgumentException 若沒有任何候選圖片
     */
    public TileMatcher(List<CatalogueEntry> candidates, ColorDistance distance) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("候選圖片不可為空，呼叫前必須先檢查目錄");
        }
        this.candidates = List.copyOf(candidates);
        this.distance = Objects.requireNonNull(distance, "distance must not be null");
    }

    public CatalogueEntry match(RgbColor color) {
        CatalogueEntry best = candidates.get(0);
        double bestDistance = distance.distance(best.color(), color);
        if (bestDistance == 0) {
            return best;
        }

        for (int i = 1; i < candidates.size(); i++) {
            CatalogueEntry candidate = candidates.get(i);
            double d = distance.distance(candidate.color(), color);
            if (d == 0) {
                return candidate;
            }
            if (d < bestDistance) {
                best = candidate;
                bestDistance = d;
            }
        }
        return best;
    }
}
