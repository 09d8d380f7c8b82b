package work.pollochang.mosaic.catalogue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.mosaic.core.ColorStrategy;
import work.pollochang.mosaic.core.Ratio;
import work.pollochang.mosaic.core.RgbColor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogueStoreTest {

    @TempDir
    Path tempDir;

    private static final List<CatalogueEntry> ENTRIES = List.of(
            new CatalogueEntry("b.jpg", new RgbColor(255, 0, 0), new Ratio(16, 9)),
            new CatalogueEntry("a.png", new RgbColor(1, 2, 3), new Ratio(4, 3)),
            new CatalogueEntry("c.png", new RgbColor(0, 0, 0), new Ratio(16, 9)));

    @Test
    void testSaveThenLoad_KeepsEntriesInOrder() throws IOException {
        CatalogueStore.save(tempDir, new Catalogue(ColorStrategy.MEDIAN_CUT, ENTRIES));

        Catalogue loaded = CatalogueStore.load(tempDir);

        assertEquals(ColorStrategy.MEDIAN_CUT, loaded.colorStrategy());
        assertEquals(ENTRIES, loaded.entries());
    }

    /**
     * 檔案欄位：version、color_strategy、pictures[].path/color_rgb/ratio_width/ratio_height
     */
    @Test
    void testSave_JsonLayout() throws IOException {
        CatalogueStore.save(tempDir, new Catalogue(ColorStrategy.AVERAGE, ENTRIES));

        Path file = tempDir.resolve("mosaic.json");
        assertEquals(file, CatalogueStore.metadataPath(tempDir));
        JsonNode root = new ObjectMapper().readTree(file.toFile());

        assertEquals(1, root.get("version").asInt());
        assertEquals("AVERAGE", root.get("color_strategy").asText());
        JsonNode first = root.get("pictures").get(0);
        assertEquals("b.jpg", first.get("path").asText());
        assertTrue(first.get("color_rgb").isArray());
        assertEquals(255, first.get("color_rgb").get(0).asInt());
        assertEquals(0, first.get("color_rgb").get(2).asInt());
        assertEquals(16, first.get("ratio_width").asInt());
        assertEquals(9, first.get("ratio_height").asInt());
    }

    @Test
    void testFilterByRatio_KeepsOrder() {
        Catalogue catalogue = new Catalogue(ColorStrategy.AVERAGE, ENTRIES);

        List<CatalogueEntry> wide = catalogue.filterByRatio(new Ratio(16, 9));
        assertEquals(List.of(ENTRIES.get(0), ENTRIES.get(2)), wide);
        assertTrue(catalogue.filterByRatio(new Ratio(1, 1)).isEmpty());
    }

    @Test
    void testLoad_MissingFile() {
        assertThrows(NoSuchFileException.class, () -> CatalogueStore.load(tempDir));
    }

    @Test
    void testLoad_UnsupportedVersion() throws IOException {
        Files.writeString(tempDir.resolve("mosaic.json"),
                "{\"version\":2,\"color_strategy\":\"AVERAGE\",\"pictures\":[]}");

        assertThrows(CatalogueFormatException.class, () -> CatalogueStore.load(tempDir));
    }

    /**
     * 比例未約分或顏色超出範圍的目錄檔視為格式錯誤
     */
    @Test
    void testLoad_InvalidValuesRejected() throws IOException {
        Files.writeString(tempDir.resolve("mosaic.json"),
                "{\"version\":1,\"color_strategy\":\"AVERAGE\",\"pictures\":[" +
                        "{\"path\":\"a.png\",\"color_rgb\":[1,2,3],\"ratio_width\":8,\"ratio_height\":6}]}");
        assertThrows(CatalogueFormatException.class, () -> CatalogueStore.load(tempDir));

        Files.writeString(tempDir.resolve("mosaic.json"),
                "{\"version\":1,\"color_strategy\":\"AVERAGE\",\"pictures\":[" +
                        "{\"path\":\"a.png\",\"color_rgb\":[1,2,300],\"ratio_width\":4,\"ratio_height\":3}]}");
        assertThrows(CatalogueFormatException.class, () -> CatalogueStore.load(tempDir));

        Files.writeString(tempDir.resolve("mosaic.json"),
                "{\"version\":1,\"color_strategy\":\"AVERAGE\",\"pictures\":[" +
                        "{\"path\":\"a.png\",\"color_rgb\":[1,2],\"ratio_width\":4,\"ratio_height\":3}]}");
        assertThrows(CatalogueFormatException.class, () -> CatalogueStore.load(tempDir));
    }

    @Test
    void testLoad_MalformedJsonAndUnknownStrategy() throws IOException {
        Files.writeString(tempDir.resolve("mosaic.json"), "{ not json");
        assertThrows(CatalogueFormatException.class, () -> CatalogueStore.load(tempDir));

        Files.writeString(tempDir.resolve("mosaic.json"),
                "{\"version\":1,\"color_strategy\":\"KMEANS\",\"pictures\":[]}");
        assertThrows(CatalogueFormatException.class, () -> CatalogueStore.load(tempDir));
    }
}
