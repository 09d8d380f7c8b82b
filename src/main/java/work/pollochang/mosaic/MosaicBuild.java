package work.pollochang.mosaic;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.catalogue.Catalogue;
import work.pollochang.mosaic.catalogue.CatalogueEntry;
import work.pollochang.mosaic.catalogue.CatalogueStore;
import work.pollochang.mosaic.core.*;
import work.pollochang.mosaic.report.MosaicParams;
import work.pollochang.mosaic.tools.FileTools;
import work.pollochang.mosaic.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 以預處理目錄與模型圖片建立馬賽克。
 */
@Setter
@Slf4j
public class MosaicBuild {

    private Path preprocessedDir;
    private Path modelPath;
    private Path outputPath;
    private MosaicParams mosaicParams;

    /**
     * 載入目錄、解碼模型、拼出馬賽克並寫入 {@code outputPath}。
     * @return 拼好的馬賽克
     * @throws NoMatchingPicturesException 目錄中沒有與模型比例相同的圖片
     * @throws CatalogueInconsistencyException 目錄列出的縮圖不存在或損毀
     * @throws IOException 目錄、模型或輸出檔讀寫失敗
     */
    public BufferedImage execute() throws IOException {
        Catalogue catalogue = CatalogueStore.load(preprocessedDir);

        BufferedImage model;
        try (DecodedImage decoded = DecodedImage.decode(modelPath)) {
            if (decoded == null) {
                throw new IOException("模型不是可辨識的圖片: " + modelPath);
            }
            model = decoded.image();
        }

        BufferedImage mosaic = build(catalogue, model);

        FileTools.ensureDirectoryExists(outputPath.toAbsolutePath().getParent());
        if (!ImageTools.writeImage(mosaic, outputPath)) {
            throw new IOException("不支援的輸出圖片格式: " + outputPath.getFileName());
        }
        log.info("馬賽克已儲存至 {} ({}x{})", outputPath, mosaic.getWidth(), mosaic.getHeight());
        return mosaic;
    }

    /**
     * 依模型比例篩選目錄，切出區塊、比對顏色並拼貼縮圖。
     */
    BufferedImage build(Catalogue catalogue, BufferedImage model) {
        Ratio ratio = Ratio.of(model.getWidth(), model.getHeight());
        List<CatalogueEntry> candidates = catalogue.filterByRatio(ratio);
        if (candidates.isEmpty()) {
            throw new NoMatchingPicturesException(ratio);
        }
        log.info("找到 {} 張與模型相同比例 ({}) 的圖片", candidates.size(), ratio);

        ColorStrategy strategy = mosaicParams.colorStrategy() != null
                ? mosaicParams.colorStrategy()
                : catalogue.colorStrategy();
        if (strategy != catalogue.colorStrategy()) {
            log.warn("代表色策略 {} 與目錄建立時的 {} 不同，比對結果可能失準", strategy, catalogue.colorStrategy());
        }

        Ratio.Dimensions chunk = ratio.dimensionsFor(mosaicParams.chunkSize());
        ChunkGrid grid = new ChunkPartitioner(strategy.newExtractor(), mosaicParams.edgePolicy())
                .partition(model, chunk.width(), chunk.height());
        if (grid.isEmpty()) {
            throw new IllegalArgumentException(String.format("模型圖片 %dx%d 小於一個 %dx%d 的區塊",
                    model.getWidth(), model.getHeight(), chunk.width(), chunk.height()));
        }

        TileMatcher matcher = new TileMatcher(candidates, mosaicParams.distance());
        List<CatalogueEntry> tiles = matchChunks(grid, matcher);

        return new MosaicCompositor(preprocessedDir, mosaicParams.thumbnailSize()).compose(grid, tiles, ratio);
    }

    /**
     * 平行比對每一列的區塊，結果依區塊索引存放，與完成順序無關。
     */
    private List<CatalogueEntry> matchChunks(ChunkGrid grid, TileMatcher matcher) {
        List<Chunk> chunks = grid.chunks();
        CatalogueEntry[] tiles = new CatalogueEntry[chunks.size()];
        int threads = Math.min(mosaicParams.threads(), grid.rows());

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>(grid.rows());
            for (int row = 0; row < grid.rows(); row++) {
                int from = row * grid.columns();
                int to = from + grid.columns();
                futures.add(executor.submit(() -> {
                    for (int i = from; i < to; i++) {
                        tiles[i] = matcher.match(chunks.get(i).color());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // 恢復中斷狀態
            throw new IllegalStateException("比對區塊時被中斷", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("比對區塊失敗", e.getCause());
        } finally {
            executor.shutdownNow();
        }
        log.debug("已完成 {} 個區塊的顏色比對", tiles.length);
        return Arrays.asList(tiles);
    }
}
