package work.pollochang.mosaic.tools;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

public class ImageTools {

    /**
     * 將圖片縮放到指定尺寸。輸出固定為 {@link BufferedImage#TYPE_INT_RGB}，透明區域會變成黑色，
     * 這樣存成 JPEG 時不會因 alpha 通道而失敗。
     */
    public static BufferedImage resizeImage(BufferedImage originalImage, int width, int height) {
        BufferedImage resizedImage = new BufferedImage(Math.max(1, width), Math.max(1, height), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = resizedImage.createGraphics();
        try {
            // 使用更高品質的縮放演算法
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.drawImage(originalImage, 0, 0, resizedImage.getWidth(), resizedImage.getHeight(), null);
        } finally {
            g2d.dispose();
        }
        return resizedImage;
    }

    /**
     * 調整對比。{@code contrast} 為正時增加對比，為負時降低，0 則回傳原圖。
     *
     * <p>每個通道：{@code c' = clamp(((c / 255 - 0.5) * ((100 + contrast) / 100)^2 + 0.5) * 255)}，alpha 不變。</p>
     */
    public static BufferedImage adjustContrast(BufferedImage image, float contrast) {
        if (contrast == 0f) {
            return image;
        }
        double factor = Math.pow((100.0 + contrast) / 100.0, 2);

        int[] lookup = new int[256];
        for (int c = 0; c < 256; c++) {
            double value = ((c / 255.0 - 0.5) * factor + 0.5) * 255.0;
            lookup[c] = (int) Math.max(0, Math.min(255, value));
        }

        int width = image.getWidth();
        int height = image.getHeight();
        int type = image.getAlphaRaster() != null ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage result = new BufferedImage(width, height, type);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                row[x] = (argb & 0xFF000000)
                        | (lookup[(argb >> 16) & 0xFF] << 16)
                        | (lookup[(argb >> 8) & 0xFF] << 8)
                        | lookup[argb & 0xFF];
            }
            result.setRGB(0, y, width, 1, row, 0, width);
        }
        return result;
    }

    /**
     * 依副檔名決定格式寫出圖片。
     * @return 找不到對應格式的寫入器時回傳 {@code false}
     * @throws IOException 寫入時發生錯誤
     */
    public static boolean writeImage(BufferedImage image, Path outputFile) throws IOException {
        String format = FileTools.extensionOf(outputFile);
        if (format.isEmpty()) {
            return false;
        }
        BufferedImage toWrite = image;
        if (("jpg".equals(format) || "jpeg".equals(format)) && image.getAlphaRaster() != null) {
            // JPEG 寫入器不接受 alpha 通道
            toWrite = resizeImage(image, image.getWidth(), image.getHeight());
        }
        return ImageIO.write(toWrite, format, outputFile.toFile());
    }
}
