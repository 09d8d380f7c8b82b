package work.pollochang.mosaic;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import work.pollochang.mosaic.core.ColorStrategy;
import work.pollochang.mosaic.report.PreprocessParams;
import work.pollochang.mosaic.report.PreprocessSummary;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "preprocess",
        mixinStandardHelpOptions = true,
        description = "遞迴走訪圖庫，為所有圖片產生縮圖與代表色")
public class PreprocessCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<gallery_folder>", description = "圖庫目錄。")
    private File galleryFolder;

    @Parameters(index = "1", paramLabel = "<output_folder>", description = "縮圖與目錄檔的輸出目錄。")
    private File outputFolder;

    @Option(names = {"-t", "--thumbnail-size"}, defaultValue = "" + PreprocessParams.DEFAULT_THUMBNAIL_SIZE, description = "縮圖長邊的像素數 (預設: ${DEFAULT-VALUE})。")
    private int thumbnailSize;

    @Option(names = {"-c", "--contrast"}, defaultValue = "" + PreprocessParams.DEFAULT_CONTRAST, description = "縮圖的對比調整量，0 表示不調整 (預設: ${DEFAULT-VALUE})。")
    private float contrast;

    @Option(names = {"--color-strategy"}, defaultValue = "AVERAGE", description = "代表色策略: ${COMPLETION-CANDIDATES} (預設: ${DEFAULT-VALUE})。")
    private ColorStrategy colorStrategy;

    @Option(names = {"--threads"}, defaultValue = "0", description = "同時處理的檔案數，0 表示使用所有 CPU 核心 (預設: ${DEFAULT-VALUE})。")
    private int threads;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "設定執行時間超時(小時) (預設: ${DEFAULT-VALUE} 小時)。")
    private long timeOutHr;

    @Option(names = {"--cache-db"}, description = "H2 預處理快取資料庫的檔案路徑，未指定時不使用快取。")
    private File cacheDb;

    @Override
    public Integer call() {
        int threadCount = threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());

        log.info("========================================預處理參數設定========================================");
        log.info("圖庫目錄: {}", galleryFolder.getAbsolutePath());
        log.info("輸出目錄: {}", outputFolder.getAbsolutePath());
        log.info("縮圖尺寸: {}", thumbnailSize);
        log.info("對比調整: {}", contrast);
        log.info("代表色策略: {} ({})", colorStrategy, colorStrategy.getDescription());
        log.info("執行緒數: {}", threadCount);
        log.info("設定超時執行時間: {} 小時", timeOutHr);
        log.info("快取資料庫: {}", cacheDb == null ? "(不使用)" : cacheDb.getAbsolutePath());
        log.info("========================================預處理參數設定========================================");

        try {
            PreprocessParams params = new PreprocessParams(thumbnailSize, contrast, colorStrategy, threadCount, timeOutHr);

            PreprocessBatch batch = new PreprocessBatch();
            batch.setGalleryDir(galleryFolder.toPath());
            batch.setOutputDir(outputFolder.toPath());
            batch.setPreprocessParams(params);
            batch.setCachePath(cacheDb == null ? null : cacheDb.toPath());
            PreprocessSummary summary = batch.execute();

            log.info("預處理完成，目錄共 {} 張圖片", summary.catalogue().size());
            return 0;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            log.error("預處理失敗", e);
            spec.commandLine().getErr().println("預處理失敗: " + e.getMessage());
            return Execute.EXIT_FAILURE;
        } catch (OutOfMemoryError e) {
            log.error("預處理時記憶體不足 (圖片可能過大)", e);
            spec.commandLine().getErr().println("預處理失敗: 記憶體不足");
            return Execute.EXIT_FAILURE;
        }
    }
}
