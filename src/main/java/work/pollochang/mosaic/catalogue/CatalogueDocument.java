package work.pollochang.mosaic.catalogue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * {@code mosaic.json} 的檔案格式 (第 1 版)。顏色以 [r, g, b] 三個通道值儲存。
 */
@JsonPropertyOrder({"version", "color_strategy", "pictures"})
public record CatalogueDocument(
        @JsonProperty("version") int version,
        @JsonProperty("color_strategy") String colorStrategy,
        @JsonProperty("pictures") List<Picture> pictures
) {

    @JsonPropertyOrder({"path", "color_rgb", "ratio_width", "ratio_height"})
    public record Picture(
            @JsonProperty("path") String path,
            @JsonProperty("color_rgb") int[] colorRgb,
            @JsonProperty("ratio_width") int ratioWidth,
            @JsonProperty("ratio_height") int ratioHeight
    ) {}
}
