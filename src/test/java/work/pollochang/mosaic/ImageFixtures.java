package work.pollochang.mosaic;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 測試用影像。
 */
public final class ImageFixtures {

    private ImageFixtures() {}

    /**
     * 產生單色測試影像
     */
    public static BufferedImage createTestImage(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * 產生四象限影像：左上、右上、左下、右下。寬高需為偶數。
     */
    public static BufferedImage createQuadrantImage(int width, int height,
                                                    Color topLeft, Color topRight, Color bottomLeft, Color bottomRight) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            int hw = width / 2;
            int hh = height / 2;
            g.setPaint(topLeft);
            g.fillRect(0, 0, hw, hh);
            g.setPaint(topRight);
            g.fillRect(hw, 0, width - hw, hh);
            g.setPaint(bottomLeft);
            g.fillRect(0, hh, hw, height - hh);
            g.setPaint(bottomRight);
            g.fillRect(hw, hh, width - hw, height - hh);
        } finally {
            g.dispose();
        }
        return image;
    }

    public static Path writeImage(BufferedImage image, Path path) throws IOException {
        String name = path.getFileName().toString();
        String format = name.substring(name.lastIndexOf('.') + 1);
        if (!ImageIO.write(image, format, path.toFile())) {
            throw new IOException("no writer for " + format);
        }
        return path;
    }

    public static int rgbAt(BufferedImage image, int x, int y) {
        return image.getRGB(x, y) & 0xFFFFFF;
    }
}
