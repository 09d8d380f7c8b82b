package work.pollochang.mosaic.core;

import java.awt.image.BufferedImage;

/**
 * 以各通道算術平均作為代表色，結果以整數截斷。alpha 通道不參與計算。
 */
public class AverageColorExtractor implements ColorExtractor {

    @Override
    public RgbColor extract(BufferedImage image, int x, int y, int width, int height) {
        ColorExtractor.checkRegion(image, x, y, width, height);

        long redSum = 0, greenSum = 0, blueSum = 0;
        // 一次讀一列
        int[] row = new int[width];
        for (int j = y; j < y + height; j++) {
            ColorExtractor.readRow(image, x, j, width, row);
            for (int argb : row) {
                redSum += (argb >> 16) & 0xFF;
                greenSum += (argb >> 8) & 0xFF;
                blueSum += argb & 0xFF;
            }
        }

        long count = (long) width * height;
        return new RgbColor((int) (redSum / count), (int) (greenSum / count), (int) (blueSum / count));
    }
}
