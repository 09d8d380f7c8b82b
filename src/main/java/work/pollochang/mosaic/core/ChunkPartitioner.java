package work.pollochang.mosaic.core;

import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 以固定大小的區塊從左上角開始逐列掃描模型圖片，計算每個區塊的代表色。
 */
@Slf4j
public class ChunkPartitioner {

    private final ColorExtractor extractor;
    private final ChunkEdgePolicy edgePolicy;

    public ChunkPartitioner(ColorExtractor extractor, ChunkEdgePolicy edgePolicy) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.edgePolicy = Objects.requireNonNull(edgePolicy, "edgePolicy must not be null");
    }

    /**
     * @param model 模型圖片
     * @param chunkWidth 區塊寬度 (像素)
     * @param chunkHeight 區塊高度 (像素)
     * @return 依列優先排列的區塊；模型比一個區塊還小時為空的格線
     */
    public ChunkGrid partition(BufferedImage model, int chunkWidth, int chunkHeight) {
        Objects.requireNonNull(model, "model must not be null");
        if (chunkWidth <= 0 || chunkHeight <= 0) {
            throw new IllegalArgumentException("區塊大小必須為正數: " + chunkWidth + "x" + chunkHeight);
        }

        int width = model.getWidth();
        int height = model.getHeight();
        int columns = edgePolicy.cells(width, chunkWidth);
        int rows = edgePolicy.cells(height, chunkHeight);

        List<Chunk> chunks = new ArrayList<>(columns * rows);
        for (int row = 0; row < rows; row++) {
            int y = row * chunkHeight;
            int h = Math.min(chunkHeight, height - y);
            for (int column = 0; column < columns; column++) {
                int x = column * chunkWidth;
                int w = Math.min(chunkWidth, width - x);
                RgbColor color = extractor.extract(model, x, y, w, h);
                chunks.add(new Chunk(column, row, x, y, w, h, color));
            }
        }

        log.debug("模型 {}x{} 以 {}x{} 區塊切為 {} 欄 x {} 列 ({})",
                width, height, chunkWidth, chunkHeight, columns, rows, edgePolicy);
        return new ChunkGrid(columns, rows, chunkWidth, chunkHeight, chunks);
    }
}
