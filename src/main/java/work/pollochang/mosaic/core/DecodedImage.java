package work.pollochang.mosaic.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 解碼後的圖片和其讀取器，方便資源管理。
 */
@Slf4j
public record DecodedImage(BufferedImage image, ImageReader reader) implements AutoCloseable {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    /**
     * 解碼圖片檔的第一張影像。
     * @param path 圖片路徑
     * @return 解碼結果；找不到對應的讀取器 (非圖片檔或空檔案) 時回傳 {@code null}
     * @throws IOException 檔案無法讀取或內容損毀
     */
    public static DecodedImage decode(Path path) throws IOException {
        try (InputStream stream = Files.newInputStream(path);
             ImageInputStream in = ImageIO.createImageInputStream(stream)) {
            if (in == null) {
                log.warn("{} - 無法建立圖片輸入流", path);
                return null;
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                log.debug("{} - 找不到對應的圖片讀取器", path);
                return null;
            }

            ImageReader reader = readers.next();
            reader.setInput(in, true, true);
            try {
                BufferedImage image = reader.read(0);
                return new DecodedImage(image, reader);
            } catch (IOException | RuntimeException e) {
                // 讀取失敗時安全地釋放 reader
                reader.dispose();
                throw e;
            }
        }
    }

    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
