package work.pollochang.mosaic.core;

/**
 * 圖片的長寬比，永遠以最簡整數表示，因此比例是否相同可以直接以整數比較。
 *
 * <p>此類別只能透過 {@link #of(int, int)} 建立，建構時即完成約分。</p>
 *
 * @param width 比例的寬
 * @param height 比例的高
 */
public record Ratio(int width, int height) {

    public Ratio {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("比例必須為正整數: " + width + "/" + height);
        }
        if (gcd(width, height) != 1) {
            throw new IllegalArgumentException("比例未約分: " + width + "/" + height);
        }
    }

    /**
     * 將寬高約分為最簡比例。
     * @param width 圖片寬度 (像素)
     * @param height 圖片高度 (像素)
     * @return 約分後的比例
     * @throws IllegalArgumentException 若寬或高不是正數 (面積為 0 的圖片沒有比例)
     */
    public static Ratio of(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("無法計算面積為 0 的圖片比例: " + width + "x" + height);
        }
        int divisor = gcd(width, height);
        return new Ratio(width / divisor, height / divisor);
    }

    /**
     * 最大公因數，{@code gcd(0, n) == n}。
     */
    public static int gcd(int a, int b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    public boolean isLandscape() {
        return width > height;
    }

    /**
     * 依此比例與目標尺寸換算出實際像素大小。
     *
     * <p>橫向 (寬 &gt; 高) 時長邊 (寬) 等於 {@code size}，短邊依比例以整數截斷縮放；
     * 其餘情況 (直向與正方形) 高等於 {@code size}。短邊最少為 1 像素。</p>
     *
     * @param size 長邊的像素數
     * @return 換算後的尺寸
     */
    public Dimensions dimensionsFor(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("尺寸必須為正數: " + size);
        }
        if (isLandscape()) {
            int shortSide = (int) ((long) size * height / width);
            return new Dimensions(size, Math.max(1, shortSide));
        }
        int shortSide = (int) ((long) size * width / height);
        return new Dimensions(Math.max(1, shortSide), size);
    }

    @Override
    public String toString() {
        return width + "/" + height;
    }

    /**
     * 以像素計的寬高。
     */
    public record Dimensions(int width, int height) {}
}
