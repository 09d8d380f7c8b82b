package work.pollochang.mosaic.core;

/**
 * 一個 8-bit RGB 顏色，通道順序固定為 R、G、B。
 * @param red 紅色通道 (0-255)
 * @param green 綠色通道 (0-255)
 * @param blue 藍色通道 (0-255)
 */
public record RgbColor(int red, int green, int blue) {

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /**
     * 由 {@link java.awt.image.BufferedImage#getRGB(int, int)} 的 ARGB 整數建立，忽略 alpha。
     */
    public static RgbColor fromPacked(int argb) {
        return new RgbColor((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    public int toPacked() {
        return (red << 16) | (green << 8) | blue;
    }

    @Override
    public String toString() {
        return "(" + red + ", " + green + ", " + blue + ")";
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " 通道超出 0-255: " + value);
        }
    }
}
