package work.pollochang.mosaic;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.cache.CacheKey;
import work.pollochang.mosaic.cache.CachedPicture;
import work.pollochang.mosaic.cache.PreprocessCacheManager;
import work.pollochang.mosaic.catalogue.Catalogue;
import work.pollochang.mosaic.catalogue.CatalogueEntry;
import work.pollochang.mosaic.catalogue.CatalogueStore;
import work.pollochang.mosaic.core.ColorExtractor;
import work.pollochang.mosaic.core.PictureProcessing;
import work.pollochang.mosaic.core.PreprocessResult;
import work.pollochang.mosaic.report.PreprocessParams;
import work.pollochang.mosaic.report.PreprocessReport;
import work.pollochang.mosaic.report.PreprocessSummary;
import work.pollochang.mosaic.tools.FileTools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 進行批次預處理：走訪圖庫、為每張圖片產生縮圖與代表色，最後寫出目錄檔。
 */
@Setter
@Slf4j
public class PreprocessBatch {

    private Path galleryDir;
    private Path outputDir;
    private PreprocessParams preprocessParams;
    private Path cachePath;

    public PreprocessSummary execute() throws IOException {
        FileTools.ensureDirectoryExists(outputDir);

        // 輸出目錄若位於圖庫內，不把上次產生的縮圖當成來源
        Path outputRoot = outputDir.toAbsolutePath().normalize();
        List<Path> files = FileTools.listFiles(galleryDir).stream()
                .filter(file -> !file.toAbsolutePath().normalize().startsWith(outputRoot))
                .collect(Collectors.toList());
        log.info("在 {} 找到 {} 個檔案", galleryDir, files.size());

        List<PreprocessReport> reports;
        if (cachePath != null) {
            try (PreprocessCacheManager cacheManager = new PreprocessCacheManager(cachePath)) {
                cacheManager.initSchema();
                Map<CacheKey, CachedPicture> cache = cacheManager.loadAllToMap();
                reports = processAll(files, cache);
                cacheManager.saveAllFromMap(cache);
            }
        } else {
            log.info("未指定快取資料庫，所有檔案都將重新處理。");
            reports = processAll(files, null);
        }

        List<CatalogueEntry> entries = new ArrayList<>();
        List<PreprocessReport> failures = new ArrayList<>();
        Map<PreprocessResult, Long> counts = new EnumMap<>(PreprocessResult.class);
        long thumbnailBytes = 0;
        for (PreprocessReport report : reports) {
            counts.merge(report.result(), 1L, Long::sum);
            if (report.result().isSuccess()) {
                entries.add(report.entry());
                thumbnailBytes += report.thumbnailBytes();
            } else {
                failures.add(report);
            }
        }

        Catalogue catalogue = new Catalogue(preprocessParams.colorStrategy(), entries);
        CatalogueStore.save(outputDir, catalogue);

        PreprocessSummary summary = new PreprocessSummary(catalogue, failures, counts, thumbnailBytes);
        logSummary(summary, files.size());
        return summary;
    }

    private List<PreprocessReport> processAll(List<Path> files, Map<CacheKey, CachedPicture> cache) {
        List<String> thumbnailNames = assignThumbnailNames(files);
        int total = files.size();
        int threads = Math.max(1, Math.min(preprocessParams.threads(), total));
        log.info("建立固定大小為 {} 的執行緒池。", threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<PreprocessReport>> futures = new ArrayList<>(total);
        try {
            for (int i = 0; i < total; i++) {
                final int index = i;
                Path file = files.get(i);
                futures.add(executor.submit(() -> {
                    ColorExtractor extractor = preprocessParams.colorStrategy().newExtractor();
                    PreprocessReport report = PictureProcessing.processPicture(
                            file, outputDir, thumbnailNames.get(index), preprocessParams, extractor, cache);
                    logProgress(index, total, report);
                    return report;
                }));
            }

            log.info("所有任務已提交，等待處理完成...");
            executor.shutdown();
            try {
                if (!executor.awaitTermination(preprocessParams.timeOutHr(), TimeUnit.HOURS)) {
                    log.warn("執行緒池等待逾時，部分任務可能未完成。");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error("執行緒池被中斷。", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt(); // 恢復中斷狀態
            }
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }

        // 依輸入順序收集結果，與完成順序無關
        List<PreprocessReport> reports = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            reports.add(collect(files.get(i), futures.get(i)));
        }
        return reports;
    }

    private static PreprocessReport collect(Path file, Future<PreprocessReport> future) {
        if (!future.isDone() || future.isCancelled()) {
            future.cancel(true);
            return PreprocessReport.failure(file, PreprocessResult.FAILED_TIMEOUT, "逾時未完成");
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // 恢復中斷狀態
            return PreprocessReport.failure(file, PreprocessResult.FAILED_TIMEOUT, "處理被中斷");
        } catch (ExecutionException e) {
            log.error("{} - 處理檔案時發生未預期的錯誤", file, e.getCause());
            return PreprocessReport.failure(file, PreprocessResult.FAILED_UNKNOWN, String.valueOf(e.getCause()));
        }
    }

    /**
     * 以來源檔名作為縮圖檔名；同名時在副檔名前加上 {@code -1}、{@code -2}...，依走訪順序決定，結果固定。
     * 目錄檔名 {@value CatalogueStore#METADATA_FILENAME} 保留不用。
     */
    static List<String> assignThumbnailNames(List<Path> files) {
        Set<String> used = new HashSet<>();
        used.add(CatalogueStore.METADATA_FILENAME);
        List<String> names = new ArrayList<>(files.size());
        for (Path file : files) {
            String name = file.getFileName().toString();
            int dot = name.lastIndexOf('.');
            String stem = dot > 0 ? name.substring(0, dot) : name;
            String extension = dot > 0 ? name.substring(dot) : "";

            String candidate = name;
            for (int n = 1; !used.add(candidate.toLowerCase(Locale.ROOT)); n++) {
                candidate = stem + "-" + n + extension;
            }
            names.add(candidate);
        }
        return names;
    }

    private static void logProgress(int index, int total, PreprocessReport report) {
        if (report.result().isSuccess()) {
            log.info("[{}/{}] {} rgb: {}", index + 1, total, report.source(), report.entry().color());
        } else {
            log.info("[{}/{}] {} skip ({})", index + 1, total, report.source(), report.result().getDescription());
        }
    }

    private static void logSummary(PreprocessSummary summary, int totalFiles) {
        long processed = summary.count(PreprocessResult.PROCESSED);
        long cached = summary.count(PreprocessResult.CACHED);
        long skipped = summary.count(PreprocessResult.SKIPPED_NOT_FOUND);
        long failed = totalFiles - processed - cached - skipped;

        log.info("處理結果 -> 總計: {}, 處理完成: {}, 沿用快取: {}, 跳過: {}, 失敗: {}",
                totalFiles, processed, cached, skipped, failed);
        for (PreprocessReport failure : summary.failures()) {
            log.info(" {} - {}: {}", failure.source(), failure.result().getDescription(), failure.reason());
        }
        log.info(" 縮圖總大小: {}", FileTools.formatFileSize(summary.thumbnailBytes()));
    }
}
