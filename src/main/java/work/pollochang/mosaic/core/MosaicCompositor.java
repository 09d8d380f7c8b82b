package work.pollochang.mosaic.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.catalogue.CatalogueEntry;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 依區塊順序把選中的縮圖貼到新畫布上。
 *
 * <p>畫布寬高永遠是縮圖格子的整數倍：{@code columns * thumbWidth} x {@code rows * thumbHeight}，
 * 與模型圖片原本的像素大小無關。</p>
 *
 * <p>縮圖缺漏或無法解碼代表目錄與預處理目錄不一致，會立即以
 * {@link CatalogueInconsistencyException} 中止，不會以空白格子代替。</p>
 */
@Slf4j
public class MosaicCompositor {

    private final Path thumbnailDir;
    private final int thumbnailSize;

    public MosaicCompositor(Path thumbnailDir, int thumbnailSize) {
        this.thumbnailDir = Objects.requireNonNull(thumbnailDir, "thumbnailDir must not be null");
        if (thumbnailSize <= 0) {
            throw new IllegalArgumentException("縮圖尺寸必須為正數: " + thumbnailSize);
        }
        this.thumbnailSize = thumbnailSize;
    }

    /**
     * @param grid 模型的區塊格線
     * @param tiles 每個區塊選中的圖片，順序與 {@code grid.chunks()} 相同
     * @param ratio 模型的比例，用來決定每格縮圖的大小
     * @return 拼好的馬賽克
     */
    public BufferedImage compose(ChunkGrid grid, List<CatalogueEntry> tiles, Ratio ratio) {
        if (grid.isEmpty()) {
            throw new IllegalArgumentException("沒有任何區塊可以拼貼");
        }
        if (tiles.size() != grid.chunks().size()) {
            throw new IllegalArgumentException(String.format("縮圖數量 %d 與區塊數量 %d 不符",
                    tiles.size(), grid.chunks().size()));
        }

        Ratio.Dimensions cell = ratio.dimensionsFor(thumbnailSize);
        int canvasWidth = grid.columns() * cell.width();
        int canvasHeight = grid.rows() * cell.height();
        log.info("建立 {}x{} 的畫布 ({} 欄 x {} 列，每格 {}x{})",
                canvasWidth, canvasHeight, grid.columns(), grid.rows(), cell.width(), cell.height());

        BufferedImage canvas = new BufferedImage(canvasWidth, canvasHeight, BufferedImage.TYPE_INT_RGB);
        // 同一張縮圖在馬賽克裡常重複出現，只解碼一次
        Map<String, BufferedImage> decodedTiles = new HashMap<>();

        Graphics2D g = canvas.createGraphics();
        try {
            int x = 0;
            int y = 0;
            for (CatalogueEntry tile : tiles) {
                BufferedImage thumbnail = decodedTiles.computeIfAbsent(tile.path(), this::readThumbnail);
                g.drawImage(thumbnail, x, y, cell.width(), cell.height(), null);

                x += cell.width();
                if (x >= canvasWidth) {
                    x = 0;
                    y += cell.height();
                }
            }
        } finally {
            g.dispose();
            decodedTiles.values().forEach(BufferedImage::flush);
        }
        log.info("馬賽克完成，共使用 {} 張不同的縮圖", decodedTiles.size());
        return canvas;
    }

    private BufferedImage readThumbnail(String relativePath) {
        Path path = thumbnailDir.resolve(relativePath);
        DecodedImage decoded;
        try {
            decoded = DecodedImage.decode(path);
        } catch (IOException e) {
            throw new CatalogueInconsistencyException(path + " - 無法讀取目錄中的縮圖，預處理目錄與目錄檔不一致", e);
        } catch (RuntimeException e) {
            // 解碼器遇到損毀的資料時常拋出非 IOException 的例外
            throw new CatalogueInconsistencyException(path + " - 目錄中的縮圖已損毀，預處理目錄可能已被修改", e);
        }
        if (decoded == null) {
            throw new CatalogueInconsistencyException(path + " - 目錄中的縮圖不是可辨識的圖片，預處理目錄可能已被修改");
        }
        try (decoded) {
            return decoded.image();
        }
    }
}
