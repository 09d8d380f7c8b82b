package work.pollochang.mosaic.core;

import org.junit.jupiter.api.Test;
import work.pollochang.mosaic.catalogue.CatalogueEntry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TileMatcherTest {

    private static final Ratio SQUARE = new Ratio(1, 1);

    private static CatalogueEntry entry(String path, int r, int g, int b) {
        return new CatalogueEntry(path, new RgbColor(r, g, b), SQUARE);
    }

    @Test
    void testMatch_ReturnsNearestColor() {
        TileMatcher matcher = new TileMatcher(List.of(
                entry("black.png", 0, 0, 0),
                entry("gray.png", 128, 128, 128),
                entry("white.png", 255, 255, 255)), ColorDistance.UNIFORM);

        assertEquals("gray.png", matcher.match(new RgbColor(100, 120, 140)).path());
        assertEquals("white.png", matcher.match(new RgbColor(250, 240, 230)).path());
        assertEquals("black.png", matcher.match(new RgbColor(10, 0, 30)).path());
    }

    /**
     * 完全相同的顏色一定勝出，且取目錄中第一個
     */
    @Test
    void testMatch_ExactColorReturnsFirstSuchEntry() {
        TileMatcher matcher = new TileMatcher(List.of(
                entry("near.png", 51, 50, 50),
                entry("exact-1.png", 50, 50, 50),
                entry("exact-2.png", 50, 50, 50)), ColorDistance.PERCEPTUAL);

        assertEquals("exact-1.png", matcher.match(new RgbColor(50, 50, 50)).path());
    }

    /**
     * 距離相同時取目錄中較前面的圖片
     */
    @Test
    void testMatch_TieResolvesToCatalogueOrder() {
        TileMatcher matcher = new TileMatcher(List.of(
                entry("dark.png", 0, 0, 0),
                entry("light.png", 20, 20, 20)), ColorDistance.UNIFORM);

        assertEquals("dark.png", matcher.match(new RgbColor(10, 10, 10)).path());

        TileMatcher reversed = new TileMatcher(List.of(
                entry("light.png", 20, 20, 20),
                entry("dark.png", 0, 0, 0)), ColorDistance.UNIFORM);

        assertEquals("light.png", reversed.match(new RgbColor(10, 10, 10)).path());
    }

    @Test
    void testMatch_WeightsChangeTheWinner() {
        List<CatalogueEntry> candidates = List.of(
                entry("greenish.png", 100, 130, 100),
                entry("reddish.png", 140, 100, 100));
        RgbColor query = new RgbColor(100, 100, 100);

        assertEquals("greenish.png", new TileMatcher(candidates, ColorDistance.UNIFORM).match(query).path());
        assertEquals("reddish.png", new TileMatcher(candidates, ColorDistance.PERCEPTUAL).match(query).path());
    }

    @Test
    void testMatch_RepeatedCallsAreStable() {
        TileMatcher matcher = new TileMatcher(List.of(
                entry("a.png", 10, 200, 30),
                entry("b.png", 200, 10, 30),
                entry("c.png", 30, 10, 200)), ColorDistance.PERCEPTUAL);
        RgbColor query = new RgbColor(90, 90, 90);

        CatalogueEntry first = matcher.match(query);
        for (int i = 0; i < 10; i++) {
            assertSame(first, matcher.match(query));
        }
    }

    @Test
    void testConstructor_EmptyCandidatesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TileMatcher(List.of(), ColorDistance.UNIFORM));
    }
}
