package work.pollochang.mosaic.catalogue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.core.ColorStrategy;
import work.pollochang.mosaic.core.Ratio;
import work.pollochang.mosaic.core.RgbColor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 讀寫預處理目錄中的 {@code mosaic.json}。
 */
@Slf4j
public final class CatalogueStore {

    public static final String METADATA_FILENAME = "mosaic.json";
    public static final int FORMAT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀

    private CatalogueStore() {}

    public static Path metadataPath(Path processedDir) {
        return processedDir.resolve(METADATA_FILENAME);
    }

    /**
     * 將目錄寫入 {@code processedDir/mosaic.json}，既有檔案會被覆蓋。
     * @param processedDir 預處理輸出目錄
     * @param catalogue 要儲存的目錄
     * @throws IOException 寫入失敗
     */
    public static void save(Path processedDir, Catalogue catalogue) throws IOException {
        List<CatalogueDocument.Picture> pictures = new ArrayList<>(catalogue.size());
        for (CatalogueEntry entry : catalogue.entries()) {
            RgbColor color = entry.color();
            pictures.add(new CatalogueDocument.Picture(
                    entry.path(),
                    new int[]{color.red(), color.green(), color.blue()},
                    entry.ratio().width(),
                    entry.ratio().height()));
        }
        CatalogueDocument document = new CatalogueDocument(FORMAT_VERSION, catalogue.colorStrategy().name(), pictures);

        Path path = metadataPath(processedDir);
        log.info("正在將 {} 筆圖片資料儲存至 {} ...", pictures.size(), path);
        MAPPER.writeValue(path.toFile(), document);
    }

    /**
     * 讀取 {@code processedDir/mosaic.json}。
     * @param processedDir 預處理輸出目錄
     * @return 目錄內容，順序與寫入時相同
     * @throws NoSuchFileException 目錄檔不存在
     * @throws CatalogueFormatException 內容不符合第 {@value #FORMAT_VERSION} 版格式
     * @throws IOException 其他讀取錯誤
     */
    public static Catalogue load(Path processedDir) throws IOException {
        Path path = metadataPath(processedDir);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "找不到預處理目錄檔，請先執行 preprocess");
        }

        CatalogueDocument document;
        try {
            document = MAPPER.readValue(path.toFile(), CatalogueDocument.class);
        } catch (JsonProcessingException e) {
            throw new CatalogueFormatException("無法解析目錄檔: " + path, e);
        }

        if (document.version() != FORMAT_VERSION) {
            throw new CatalogueFormatException(String.format("不支援的目錄檔版本 %d (預期 %d): %s",
                    document.version(), FORMAT_VERSION, path));
        }

        ColorStrategy strategy;
        try {
            strategy = ColorStrategy.valueOf(String.valueOf(document.colorStrategy()));
        } catch (IllegalArgumentException e) {
            throw new CatalogueFormatException("未知的代表色策略: " + document.colorStrategy(), e);
        }

        List<CatalogueDocument.Picture> pictures = document.pictures() == null ? List.of() : document.pictures();
        List<CatalogueEntry> entries = new ArrayList<>(pictures.size());
        for (CatalogueDocument.Picture picture : pictures) {
            entries.add(toEntry(picture, path));
        }
        log.info("從 {} 讀取 {} 筆圖片資料 (代表色策略: {})", path, entries.size(), strategy);
        return new Catalogue(strategy, entries);
    }

    private static CatalogueEntry toEntry(CatalogueDocument.Picture picture, Path path) throws CatalogueFormatException {
        int[] rgb = picture.colorRgb();
        if (picture.path() == null || rgb == null || rgb.length != 3) {
            throw new CatalogueFormatException("目錄檔中的圖片資料不完整: " + path);
        }
        try {
            return new CatalogueEntry(
                    picture.path(),
                    new RgbColor(rgb[0], rgb[1], rgb[2]),
                    new Ratio(picture.ratioWidth(), picture.ratioHeight()));
        } catch (IllegalArgumentException e) {
            throw new CatalogueFormatException(picture.path() + " - 目錄檔數值不合法: " + e.getMessage(), e);
        }
    }
}
