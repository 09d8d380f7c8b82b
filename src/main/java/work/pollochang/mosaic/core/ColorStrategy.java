package work.pollochang.mosaic.core;

import java.util.function.Supplier;

/**
 * 代表色的計算策略。一次執行只選定一種，預處理與建立馬賽克必須使用同一種。
 */
public enum ColorStrategy {
    AVERAGE("算術平均", AverageColorExtractor::new),
    MEDIAN_CUT("中位切割量化", MedianCutColorExtractor::new);

    private final String description;
    private final Supplier<ColorExtractor> factory;

    ColorStrategy(String description, Supplier<ColorExtractor> factory) {
        this.description = description;
        this.factory = factory;
    }

    public String getDescription() { return description; }

    public ColorExtractor newExtractor() {
        return factory.get();
    }
}
