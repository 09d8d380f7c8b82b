package work.pollochang.mosaic.core;

/**
 * 加權的顏色距離：{@code sqrt(sum((w_i * (a_i - b_i))^2))}，i 依 R、G、B 順序。
 */
public enum ColorDistance {
    UNIFORM(1, 1, 1),
    /** 近似人眼對各通道亮度的敏感度 */
    PERCEPTUAL(22, 43, 34);

    private final int redWeight;
    private final int greenWeight;
    private final int blueWeight;

    ColorDistance(int redWeight, int greenWeight, int blueWeight) {
        this.redWeight = redWeight;
        this.greenWeight = greenWeight;
        this.blueWeight = blueWeight;
    }

    public double distance(RgbColor a, RgbColor b) {
        long dr = (long) redWeight * (a.red() - b.red());
        long dg = (long) greenWeight * (a.green() - b.green());
        long db = (long) blueWeight * (a.blue() - b.blue());
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }
}
