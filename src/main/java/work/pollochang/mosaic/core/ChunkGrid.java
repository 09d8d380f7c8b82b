package work.pollochang.mosaic.core;

import java.util.List;

/**
 * 模型圖片切出的區塊格線，{@code chunks} 依列優先 (row-major) 排列。
 */
public record ChunkGrid(int columns, int rows, int chunkWidth, int chunkHeight, List<Chunk> chunks) {

    public ChunkGrid {
        chunks = List.copyOf(chunks);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }
}
