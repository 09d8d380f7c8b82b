package work.pollochang.mosaic.core;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;

/**
 * 將圖片 (或其中的矩形區域) 濃縮為單一代表色。
 * 實作必須是純函式：不修改圖片，同樣的像素永遠得到同樣的顏色。
 */
public interface ColorExtractor {

    /**
     * 計算指定區域的代表色，區域必須完全落在圖片內。
     */
    RgbColor extract(BufferedImage image, int x, int y, int width, int height);

    /**
     * 計算整張圖片的代表色。
     */
    default RgbColor extract(BufferedImage image) {
        return extract(image, 0, 0, image.getWidth(), image.getHeight());
    }

    static void checkRegion(BufferedImage image, int x, int y, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("區域面積為 0: " + width + "x" + height);
        }
        if (x < 0 || y < 0 || x + width > image.getWidth() || y + height > image.getHeight()) {
            throw new IllegalArgumentException(String.format("區域 (%d,%d %dx%d) 超出圖片範圍 %dx%d",
                    x, y, width, height, image.getWidth(), image.getHeight()));
        }
    }

    /**
     * 讀取一列像素，存成 {@code 0xRRGGBB}。
     *
     * <p>灰階影像直接取樣本值，不經 {@link BufferedImage#getRGB} 的線性灰階轉換，
     * 否則 128 的灰會被讀成 188，與縮圖實際呈現的亮度不符。</p>
     */
    static void readRow(BufferedImage image, int x, int y, int width, int[] row) {
        ColorModel colorModel = image.getColorModel();
        if (colorModel.getColorSpace().getType() != ColorSpace.TYPE_GRAY) {
            image.getRGB(x, y, width, 1, row, 0, width);
            return;
        }
        image.getRaster().getSamples(x, y, width, 1, 0, row);
        int max = (1 << colorModel.getComponentSize(0)) - 1;
        for (int i = 0; i < width; i++) {
            int v = max == 255 ? row[i] : (int) Math.round(row[i] * 255.0 / max);
            row[i] = (v << 16) | (v << 8) | v;
        }
    }
}
