package work.pollochang.mosaic.core;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * 以中位切割 (median cut) 量化建立調色盤，取像素數最多的色桶之加權平均色作為代表色。
 *
 * <p>演算法：
 * <ol>
 *   <li>統計區域內每個顏色的像素數 (直方圖)。</li>
 *   <li>從包含所有顏色的一個色桶開始，反覆挑出通道範圍最大的色桶，沿該通道依像素數的中位數切成兩半。</li>
 *   <li>色桶數達到上限 (預設 256) 或無法再切割時停止。</li>
 *   <li>回傳像素數最多的色桶之平均色；數量相同時取先建立的色桶。</li>
 * </ol>
 *
 * <p>直方圖以顏色值排序，切割順序也有固定的次序，同樣的輸入一定產生同樣的結果。</p>
 */
public class MedianCutColorExtractor implements ColorExtractor {

    public static final int DEFAULT_MAX_BUCKETS = 256;

    private final int maxBuckets;

    public MedianCutColorExtractor() {
        this(DEFAULT_MAX_BUCKETS);
    }

    public MedianCutColorExtractor(int maxBuckets) {
        if (maxBuckets < 1) {
            throw new IllegalArgumentException("色桶上限必須至少為 1: " + maxBuckets);
        }
        this.maxBuckets = maxBuckets;
    }

    @Override
    public RgbColor extract(BufferedImage image, int x, int y, int width, int height) {
        ColorExtractor.checkRegion(image, x, y, width, height);

        Map<Integer, Integer> histogram = new TreeMap<>();
        int[] row = new int[width];
        for (int j = y; j < y + height; j++) {
            ColorExtractor.readRow(image, x, j, width, row);
            for (int argb : row) {
                histogram.merge(argb & 0xFFFFFF, 1, Integer::sum);
            }
        }

        List<ColorCount> colors = new ArrayList<>(histogram.size());
        histogram.forEach((rgb, count) -> colors.add(new ColorCount(rgb, count)));

        List<Bucket> buckets = cut(colors);

        Bucket dominant = buckets.get(0);
        for (Bucket bucket : buckets) {
            if (bucket.pixels > dominant.pixels
                    || (bucket.pixels == dominant.pixels && bucket.sequence < dominant.sequence)) {
                dominant = bucket;
            }
        }
        return dominant.averageColor();
    }

    private List<Bucket> cut(List<ColorCount> colors) {
        int[] sequence = {0};
        // 範圍大的先切；範圍相同時先建立者優先
        PriorityQueue<Bucket> queue = new PriorityQueue<>(
                Comparator.comparingInt(Bucket::range).reversed().thenComparingInt(b -> b.sequence));
        queue.add(new Bucket(colors, sequence[0]++));

        List<Bucket> done = new ArrayList<>();
        while (!queue.isEmpty() && queue.size() + done.size() < maxBuckets) {
            Bucket bucket = queue.poll();
            if (bucket.colors.size() <= 1) {
                done.add(bucket);
                continue;
            }
            Bucket[] halves = bucket.split(sequence);
            queue.add(halves[0]);
            queue.add(halves[1]);
        }
        done.addAll(queue);
        return done;
    }

    private record ColorCount(int rgb, int count) {
        int channel(int index) {
            return (rgb >> (16 - 8 * index)) & 0xFF;
        }
    }

    private static final class Bucket {
        private final List<ColorCount> colors;
        private final int sequence;
        private final long pixels;
        private final int[] min = {255, 255, 255};
        private final int[] max = {0, 0, 0};

        Bucket(List<ColorCount> colors, int sequence) {
            this.colors = colors;
            this.sequence = sequence;
            long total = 0;
            for (ColorCount c : colors) {
                total += c.count();
                for (int i = 0; i < 3; i++) {
                    min[i] = Math.min(min[i], c.channel(i));
                    max[i] = Math.max(max[i], c.channel(i));
                }
            }
            this.pixels = total;
        }

        int range() {
            return Math.max(max[0] - min[0], Math.max(max[1] - min[1], max[2] - min[2]));
        }

        /**
         * 沿範圍最大的通道 (同範圍時 R &gt; G &gt; B) 以像素數中位數切成兩個非空色桶。
         */
        Bucket[] split(int[] sequence) {
            int channel = widestChannel();
            List<ColorCount> sorted = new ArrayList<>(colors);
            sorted.sort(Comparator.comparingInt((ColorCount c) -> c.channel(channel)).thenComparingInt(ColorCount::rgb));

            long half = pixels / 2;
            long running = 0;
            int splitIndex = 1;
            for (int i = 0; i < sorted.size(); i++) {
                running += sorted.get(i).count();
                if (running >= half) {
                    splitIndex = i + 1;
                    break;
                }
            }
            splitIndex = Math.max(1, Math.min(splitIndex, sorted.size() - 1));

            return new Bucket[]{
                    new Bucket(new ArrayList<>(sorted.subList(0, splitIndex)), sequence[0]++),
                    new Bucket(new ArrayList<>(sorted.subList(splitIndex, sorted.size())), sequence[0]++)
            };
        }

        private int widestChannel() {
            int r = max[0] - min[0];
            int g = max[1] - min[1];
            int b = max[2] - min[2];
            if (r >= g && r >= b) {
                return 0;
            }
            return g >= b ? 1 : 2;
        }

        RgbColor averageColor() {
            long[] sums = new long[3];
            for (ColorCount c : colors) {
                for (int i = 0; i < 3; i++) {
                    sums[i] += (long) c.channel(i) * c.count();
                }
            }
            return new RgbColor(
                    (int) Math.round((double) sums[0] / pixels),
                    (int) Math.round((double) sums[1] / pixels),
                    (int) Math.round((double) sums[2] / pixels));
        }
    }
}
