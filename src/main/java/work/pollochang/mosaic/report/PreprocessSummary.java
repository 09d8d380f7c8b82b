package work.pollochang.mosaic.report;

import work.pollochang.mosaic.catalogue.Catalogue;
import work.pollochang.mosaic.core.PreprocessResult;

import java.util.List;
import java.util.Map;

/**
 * 整批預處理的結果：成功的圖片依輸入順序組成目錄，失敗的另列一份。
 */
public record PreprocessSummary(Catalogue catalogue, List<PreprocessReport> failures, Map<PreprocessResult, Long> counts,
                                long thumbnailBytes) {

    public PreprocessSummary {
        failures = List.copyOf(failures);
        counts = Map.copyOf(counts);
    }

    public long count(PreprocessResult result) {
        return counts.getOrDefault(result, 0L);
    }
}
