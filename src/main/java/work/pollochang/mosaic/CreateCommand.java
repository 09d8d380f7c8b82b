package work.pollochang.mosaic;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import work.pollochang.mosaic.core.CatalogueInconsistencyException;
import work.pollochang.mosaic.core.ChunkEdgePolicy;
import work.pollochang.mosaic.core.ColorDistance;
import work.pollochang.mosaic.core.ColorStrategy;
import work.pollochang.mosaic.core.NoMatchingPicturesException;
import work.pollochang.mosaic.report.MosaicParams;
import work.pollochang.mosaic.report.PreprocessParams;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "create",
        mixinStandardHelpOptions = true,
        description = "以預處理過的圖庫與模型圖片建立相片馬賽克")
public class CreateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<preprocessed_folder>", description = "preprocess 的輸出目錄。")
    private File preprocessedFolder;

    @Parameters(index = "1", paramLabel = "<model_image>", description = "模型圖片。")
    private File modelImage;

    @Parameters(index = "2", paramLabel = "<output_image>", description = "馬賽克的輸出路徑，格式由副檔名決定。")
    private File outputImage;

    @Option(names = {"-t", "--thumbnail-size"}, defaultValue = "" + PreprocessParams.DEFAULT_THUMBNAIL_SIZE, description = "每格縮圖長邊的像素數 (預設: ${DEFAULT-VALUE})。")
    private int thumbnailSize;

    @Option(names = {"-k", "--chunk-size"}, defaultValue = "" + MosaicParams.DEFAULT_CHUNK_SIZE, description = "模型區塊長邊的像素數 (預設: ${DEFAULT-VALUE})。")
    private int chunkSize;

    @Option(names = {"--color-strategy"}, description = "代表色策略: ${COMPLETION-CANDIDATES}，未指定時沿用目錄記錄的策略。")
    private ColorStrategy colorStrategy;

    @Option(names = {"--distance"}, defaultValue = "UNIFORM", description = "顏色距離權重: ${COMPLETION-CANDIDATES} (預設: ${DEFAULT-VALUE})。")
    private ColorDistance distance;

    @Option(names = {"--edge-policy"}, defaultValue = "DROP_PARTIAL", description = "不完整區塊的處理方式: ${COMPLETION-CANDIDATES} (預設: ${DEFAULT-VALUE})。")
    private ChunkEdgePolicy edgePolicy;

    @Option(names = {"--threads"}, defaultValue = "0", description = "比對顏色的執行緒數，0 表示使用所有 CPU 核心 (預設: ${DEFAULT-VALUE})。")
    private int threads;

    @Override
    public Integer call() {
        int threadCount = threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());

        log.info("========================================馬賽克參數設定========================================");
        log.info("預處理目錄: {}", preprocessedFolder.getAbsolutePath());
        log.info("模型圖片: {}", modelImage.getAbsolutePath());
        log.info("輸出圖片: {}", outputImage.getAbsolutePath());
        log.info("縮圖尺寸: {}, 區塊尺寸: {}", thumbnailSize, chunkSize);
        log.info("代表色策略: {}", colorStrategy == null ? "(沿用目錄)" : colorStrategy);
        log.info("顏色距離: {}, 邊緣處理: {}", distance, edgePolicy);
        log.info("========================================馬賽克參數設定========================================");

        try {
            MosaicParams params = new MosaicParams(thumbnailSize, chunkSize, colorStrategy, distance, edgePolicy, threadCount);

            MosaicBuild build = new MosaicBuild();
            build.setPreprocessedDir(preprocessedFolder.toPath());
            build.setModelPath(modelImage.toPath());
            build.setOutputPath(outputImage.toPath());
            build.setMosaicParams(params);
            build.execute();
            return 0;
        } catch (NoMatchingPicturesException e) {
            log.error(e.getMessage());
            spec.commandLine().getErr().println(e.getMessage());
            return Execute.EXIT_NO_MATCHING_PICTURES;
        } catch (CatalogueInconsistencyException e) {
            log.error("目錄與預處理目錄不一致，請重新執行 preprocess", e);
            spec.commandLine().getErr().println("目錄與預處理目錄不一致: " + e.getMessage());
            return Execute.EXIT_FAILURE;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            log.error("建立馬賽克失敗", e);
            spec.commandLine().getErr().println("建立馬賽克失敗: " + e.getMessage());
            return Execute.EXIT_FAILURE;
        } catch (OutOfMemoryError e) {
            log.error("建立馬賽克時記憶體不足 (圖片可能過大)", e);
            spec.commandLine().getErr().println("建立馬賽克失敗: 記憶體不足");
            return Execute.EXIT_FAILURE;
        }
    }
}
