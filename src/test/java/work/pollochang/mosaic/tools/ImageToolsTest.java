package work.pollochang.mosaic.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static work.pollochang.mosaic.ImageFixtures.createTestImage;
import static work.pollochang.mosaic.ImageFixtures.rgbAt;

class ImageToolsTest {

    @TempDir
    Path tempDir;

    @Test
    void testResizeImage_TargetSizeAndSolidColorKept() {
        BufferedImage resized = ImageTools.resizeImage(createTestImage(40, 30, new Color(50, 100, 150)), 8, 6);

        assertEquals(8, resized.getWidth());
        assertEquals(6, resized.getHeight());
        assertEquals(BufferedImage.TYPE_INT_RGB, resized.getType());
        assertEquals(0x326496, rgbAt(resized, 4, 3));
    }

    /**
     * 對比為 0 時不複製圖片
     */
    @Test
    void testAdjustContrast_ZeroIsIdentity() {
        BufferedImage image = createTestImage(4, 4, Color.GRAY);
        assertSame(image, ImageTools.adjustContrast(image, 0f));
    }

    /**
     * 正對比讓亮的更亮、暗的更暗，極值不變
     */
    @Test
    void testAdjustContrast_PositiveStretchesAwayFromMiddle() {
        BufferedImage image = new BufferedImage(4, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0x000000);
        image.setRGB(1, 0, 0x404040);
        image.setRGB(2, 0, 0xC0C0C0);
        image.setRGB(3, 0, 0xFFFFFF);

        BufferedImage adjusted = ImageTools.adjustContrast(image, 20f);

        assertEquals(0x000000, rgbAt(adjusted, 0, 0));
        assertTrue((rgbAt(adjusted, 1, 0) & 0xFF) < 0x40);
        assertTrue((rgbAt(adjusted, 2, 0) & 0xFF) > 0xC0);
        assertEquals(0xFFFFFF, rgbAt(adjusted, 3, 0));
    }

    @Test
    void testAdjustContrast_NegativeMovesTowardMiddle() {
        BufferedImage adjusted = ImageTools.adjustContrast(createTestImage(2, 2, Color.WHITE), -50f);
        int value = rgbAt(adjusted, 0, 0) & 0xFF;
        assertTrue(value < 255 && value > 127);
    }

    /**
     * 帶 alpha 的圖片也能寫成 JPEG
     */
    @Test
    void testWriteImage_JpegWithAlpha() throws IOException {
        BufferedImage argb = new BufferedImage(8, 8, BufferedImage.TYPE_INT_ARGB);
        Path output = tempDir.resolve("out.jpg");

        assertTrue(ImageTools.writeImage(argb, output));
        assertNotNull(ImageIO.read(output.toFile()));
    }

    @Test
    void testWriteImage_UnknownOrMissingExtension() throws IOException {
        BufferedImage image = createTestImage(4, 4, Color.RED);

        assertFalse(ImageTools.writeImage(image, tempDir.resolve("out.xyz")));
        assertFalse(ImageTools.writeImage(image, tempDir.resolve("noextension")));
        assertFalse(Files.exists(tempDir.resolve("noextension")));
    }
}
