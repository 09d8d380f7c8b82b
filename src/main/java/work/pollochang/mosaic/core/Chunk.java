package work.pollochang.mosaic.core;

/**
 * 模型圖片中的一個矩形區塊及其代表色。
 * @param column 區塊在格線中的欄
 * @param row 區塊在格線中的列
 */
public record Chunk(int column, int row, int x, int y, int width, int height, RgbColor color) {}
