package work.pollochang.mosaic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.mosaic.catalogue.Catalogue;
import work.pollochang.mosaic.catalogue.CatalogueEntry;
import work.pollochang.mosaic.catalogue.CatalogueStore;
import work.pollochang.mosaic.core.ColorStrategy;
import work.pollochang.mosaic.core.PreprocessResult;
import work.pollochang.mosaic.core.Ratio;
import work.pollochang.mosaic.core.RgbColor;
import work.pollochang.mosaic.report.PreprocessParams;
import work.pollochang.mosaic.report.PreprocessSummary;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static work.pollochang.mosaic.ImageFixtures.createTestImage;
import static work.pollochang.mosaic.ImageFixtures.rgbAt;
import static work.pollochang.mosaic.ImageFixtures.writeImage;

class PreprocessBatchTest {

    @TempDir
    Path tempDir;

    private PreprocessBatch newBatch(Path gallery, Path output, Path cache) {
        PreprocessBatch batch = new PreprocessBatch();
        batch.setGalleryDir(gallery);
        batch.setOutputDir(output);
        batch.setPreprocessParams(new PreprocessParams(16, 0f, ColorStrategy.AVERAGE, 2, 1));
        batch.setCachePath(cache);
        return batch;
    }

    /**
     * 一張正常圖片與一個空的 .jpg：目錄只有一筆，空檔案不會讓整批失敗
     */
    @Test
    void testExecute_UndecodableFileIsSkipped() throws IOException {
        Path gallery = Files.createDirectories(tempDir.resolve("gallery"));
        Path output = tempDir.resolve("processed");
        writeImage(createTestImage(32, 24, new Color(90, 60, 30)), gallery.resolve("valid.jpg"));
        Files.createFile(gallery.resolve("broken.jpg"));

        PreprocessSummary summary = newBatch(gallery, output, null).execute();

        assertEquals(1, summary.catalogue().size());
        CatalogueEntry entry = summary.catalogue().entries().get(0);
        assertEquals("valid.jpg", entry.path());
        assertEquals(new Ratio(4, 3), entry.ratio());
        assertEquals(1, summary.failures().size());
        assertEquals(PreprocessResult.FAILED_DECODE, summary.failures().get(0).result());
        assertEquals(1, summary.count(PreprocessResult.PROCESSED));

        assertTrue(Files.isRegularFile(output.resolve("valid.jpg")));
        assertFalse(Files.exists(output.resolve("broken.jpg")));

        Catalogue loaded = CatalogueStore.load(output);
        assertEquals(summary.catalogue(), loaded);
    }

    @Test
    void testExecute_EntriesFollowSortedWalkOrder() throws IOException {
        Path gallery = Files.createDirectories(tempDir.resolve("gallery"));
        Files.createDirectories(gallery.resolve("sub"));
        writeImage(createTestImage(10, 10, Color.WHITE), gallery.resolve("c.png"));
        writeImage(createTestImage(10, 10, Color.BLACK), gallery.resolve("a.png"));
        writeImage(createTestImage(10, 10, Color.RED), gallery.resolve("sub/b.png"));

        PreprocessSummary summary = newBatch(gallery, tempDir.resolve("out"), null).execute();

        List<String> paths = summary.catalogue().entries().stream()
                .map(CatalogueEntry::path)
                .collect(Collectors.toList());
        assertEquals(List.of("a.png", "c.png", "b.png"), paths);
        assertEquals(new RgbColor(0, 0, 0), summary.catalogue().entries().get(0).color());
        assertEquals(new RgbColor(255, 0, 0), summary.catalogue().entries().get(2).color());
    }

    /**
     * 不同子目錄中的同名檔案不會互相覆蓋
     */
    @Test
    void testExecute_SameNameInSubdirectories() throws IOException {
        Path gallery = Files.createDirectories(tempDir.resolve("gallery"));
        Files.createDirectories(gallery.resolve("x"));
        Files.createDirectories(gallery.resolve("y"));
        writeImage(createTestImage(10, 10, Color.RED), gallery.resolve("x/photo.png"));
        writeImage(createTestImage(10, 10, Color.BLUE), gallery.resolve("y/photo.png"));
        Path output = tempDir.resolve("out");

        PreprocessSummary summary = newBatch(gallery, output, null).execute();

        assertEquals(2, summary.catalogue().size());
        assertEquals("photo.png", summary.catalogue().entries().get(0).path());
        assertEquals("photo-1.png", summary.catalogue().entries().get(1).path());
        assertTrue(Files.isRegularFile(output.resolve("photo.png")));
        assertTrue(Files.isRegularFile(output.resolve("photo-1.png")));
    }

    @Test
    void testAssignThumbnailNames() {
        List<String> names = PreprocessBatch.assignThumbnailNames(List.of(
                Path.of("a/photo.png"),
                Path.of("b/photo.png"),
                Path.of("c/PHOTO.png"),
                Path.of("d/mosaic.json"),
                Path.of("e/README")));

        assertEquals(List.of("photo.png", "photo-1.png", "PHOTO-2.png", "mosaic-1.json", "README"), names);
    }

    /**
     * 輸出目錄位於圖庫內時，第二次執行不會把縮圖當成來源
     */
    @Test
    void testExecute_OutputInsideGalleryIsIgnored() throws IOException {
        Path gallery = Files.createDirectories(tempDir.resolve("gallery"));
        writeImage(createTestImage(10, 10, Color.GREEN), gallery.resolve("g.png"));
        Path output = gallery.resolve("processed");

        newBatch(gallery, output, null).execute();
        PreprocessSummary second = newBatch(gallery, output, null).execute();

        assertEquals(1, second.catalogue().size());
        assertEquals("g.png", second.catalogue().entries().get(0).path());
    }

    @Test
    void testExecute_SecondRunUsesCache() throws IOException {
        Path gallery = Files.createDirectories(tempDir.resolve("gallery"));
        writeImage(createTestImage(10, 10, Color.RED), gallery.resolve("r.png"));
        writeImage(createTestImage(20, 10, Color.BLUE), gallery.resolve("b.png"));
        Path output = tempDir.resolve("out");
        Path cache = tempDir.resolve("cache");

        PreprocessSummary first = newBatch(gallery, output, cache).execute();
        PreprocessSummary second = newBatch(gallery, output, cache).execute();

        assertEquals(2, first.count(PreprocessResult.PROCESSED));
        assertEquals(2, second.count(PreprocessResult.CACHED));
        assertEquals(first.catalogue(), second.catalogue());
    }

    /**
     * 兩個圖庫的同名圖片輸出到同一目錄：縮圖被另一個圖庫覆蓋後，快取不能再沿用
     */
    @Test
    void testExecute_OverwrittenThumbnailIsNotReusedFromCache() throws IOException {
        Path redGallery = Files.createDirectories(tempDir.resolve("red-gallery"));
        Path blueGallery = Files.createDirectories(tempDir.resolve("blue-gallery"));
        writeImage(createTestImage(10, 10, Color.RED), redGallery.resolve("photo.png"));
        writeImage(createTestImage(10, 10, Color.BLUE), blueGallery.resolve("photo.png"));
        Path output = tempDir.resolve("out");
        Path cache = tempDir.resolve("cache");

        newBatch(redGallery, output, cache).execute();
        newBatch(blueGallery, output, cache).execute();
        PreprocessSummary again = newBatch(redGallery, output, cache).execute();

        assertEquals(1, again.count(PreprocessResult.PROCESSED));
        assertEquals(0, again.count(PreprocessResult.CACHED));
        assertEquals(new RgbColor(255, 0, 0), again.catalogue().entries().get(0).color());
        BufferedImage thumbnail = ImageIO.read(output.resolve("photo.png").toFile());
        assertEquals(0xFF0000, rgbAt(thumbnail, 5, 5));
    }

    @Test
    void testExecute_MissingGalleryFails() {
        PreprocessBatch batch = newBatch(tempDir.resolve("nope"), tempDir.resolve("out"), null);
        assertThrows(IOException.class, batch::execute);
    }
}
