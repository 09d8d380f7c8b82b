package work.pollochang.mosaic.core;

import lombok.Getter;

/**
 * 目錄中沒有任何與模型比例相同的圖片。
 */
@Getter
public class NoMatchingPicturesException extends RuntimeException {

    private final Ratio ratio;

    public NoMatchingPicturesException(Ratio ratio) {
        super("找不到與模型相同比例 (" + ratio + ") 的預處理圖片");
        this.ratio = ratio;
    }
}
