package work.pollochang.mosaic.cache;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.core.Ratio;
import work.pollochang.mosaic.core.RgbColor;

import java.nio.file.Path;
import java.sql.*;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * H2 預處理快取管理器。
 * 負責所有與 H2 資料庫的底層互動，包括連線、資料表初始化、讀取與批次儲存。
 */
@Slf4j
public class PreprocessCacheManager implements AutoCloseable {

    private final Connection connection;

    // 使用 MERGE 陳述式來實現 "upsert" (update or insert) 功能
    private static final String MERGE_SQL = "MERGE INTO PICTURE_CACHE " +
            "(SOURCE_PATH, OUTPUT_DIR, FILE_SIZE, LAST_MODIFIED, SETTINGS, THUMBNAIL_NAME, THUMBNAIL_DIGEST, " +
            "COLOR_RGB, RATIO_WIDTH, RATIO_HEIGHT) " +
            "KEY(SOURCE_PATH, OUTPUT_DIR, FILE_SIZE, LAST_MODIFIED, SETTINGS) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    /**
     * 建構子，開啟 (必要時建立) H2 資料庫。
     * @param dbPath H2 資料庫檔案的路徑。
     */
    public PreprocessCacheManager(Path dbPath) {
        // 移除 .mv.db 副檔名 (如果有的話)，因為 JDBC URL 不需要
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        // 使用 AUTO_SERVER=TRUE 允許多個進程安全地存取同一個資料庫
        String jdbcUrl = String.format("jdbc:h2:%s;AUTO_SERVER=TRUE", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new IllegalStateException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
    }

    /**
     * 初始化資料庫，如果資料表不存在，則建立它。
     */
    public void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS PICTURE_CACHE (" +
                "SOURCE_PATH VARCHAR(4096), " +
                "OUTPUT_DIR VARCHAR(4096), " +
                "FILE_SIZE BIGINT, " +
                "LAST_MODIFIED BIGINT, " +
                "SETTINGS VARCHAR(255), " +
                "THUMBNAIL_NAME VARCHAR(1024), " +
                "THUMBNAIL_DIGEST VARCHAR(64), " +
                "COLOR_RGB INT, " +
                "RATIO_WIDTH INT, " +
                "RATIO_HEIGHT INT, " +
                "PRIMARY KEY (SOURCE_PATH, OUTPUT_DIR, FILE_SIZE, LAST_MODIFIED, SETTINGS)" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.debug("H2 資料表 'PICTURE_CACHE' 已確認存在。");
        } catch (SQLException e) {
            throw new IllegalStateException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 從 H2 資料庫讀取所有快取紀錄，並載入到一個記憶體 Map 中。
     * @return 包含所有快取資料的 ConcurrentHashMap，讀取失敗時為空。
     */
    public Map<CacheKey, CachedPicture> loadAllToMap() {
        Map<CacheKey, CachedPicture> cache = new ConcurrentHashMap<>();
        String selectSql = "SELECT SOURCE_PATH, OUTPUT_DIR, FILE_SIZE, LAST_MODIFIED, SETTINGS, THUMBNAIL_NAME, THUMBNAIL_DIGEST, COLOR_RGB, " +
                "RATIO_WIDTH, RATIO_HEIGHT FROM PICTURE_CACHE";

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {

            while (rs.next()) {
                CacheKey key = new CacheKey(
                        rs.getString("SOURCE_PATH"),
                        rs.getString("OUTPUT_DIR"),
                        rs.getLong("FILE_SIZE"),
                        rs.getLong("LAST_MODIFIED"),
                        rs.getString("SETTINGS")
                );
                try {
                    CachedPicture picture = new CachedPicture(
                            rs.getString("THUMBNAIL_NAME"),
                            rs.getString("THUMBNAIL_DIGEST"),
                            RgbColor.fromPacked(rs.getInt("COLOR_RGB")),
                            new Ratio(rs.getInt("RATIO_WIDTH"), rs.getInt("RATIO_HEIGHT"))
                    );
                    cache.put(key, picture);
                } catch (IllegalArgumentException e) {
                    log.warn("{} - 忽略不合法的快取紀錄: {}", key.sourcePath(), e.getMessage());
                }
            }
        } catch (SQLException e) {
            log.error("從 H2 載入快取時發生錯誤", e);
            // 即使載入失敗，也返回一個空的 map，讓程式可以繼續執行
            cache.clear();
        }
        log.info("從 H2 資料庫載入 {} 筆預處理快取紀錄。", cache.size());
        return cache;
    }

    /**
     * 將記憶體中的快取 Map 批次儲存回 H2 資料庫，整批在同一個交易中完成。
     * @param cache 要儲存的快取 Map。
     */
    public void saveAllFromMap(Map<CacheKey, CachedPicture> cache) {
        if (cache == null || cache.isEmpty()) {
            log.info("記憶體快取為空，無需儲存至 H2。");
            return;
        }

        log.info("準備將 {} 筆快取紀錄批次寫入 H2 資料庫...", cache.size());
        int batchSize = 0;
        final int MAX_BATCH_SIZE = 1000; // 每 1000 筆執行一次

        try (PreparedStatement ps = connection.prepareStatement(MERGE_SQL)) {
            // 關閉自動提交，手動管理交易
            connection.setAutoCommit(false);

            for (Map.Entry<CacheKey, CachedPicture> entry : cache.entrySet()) {
                CacheKey key = entry.getKey();
                CachedPicture picture = entry.getValue();

                ps.setString(1, key.sourcePath());
                ps.setString(2, key.outputDir());
                ps.setLong(3, key.fileSize());
                ps.setLong(4, key.lastModified());
                ps.setString(5, key.settings());
                ps.setString(6, picture.thumbnailName());
                ps.setString(7, picture.thumbnailDigest());
                ps.setInt(8, picture.color().toPacked());
                ps.setInt(9, picture.ratio().width());
                ps.setInt(10, picture.ratio().height());
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }

            // 執行剩餘的批次
            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit();
            log.info("成功將 {} 筆紀錄儲存/更新至 H2 資料庫。", batchSize);

        } catch (SQLException e) {
            log.error("批次儲存快取至 H2 時發生錯誤", e);
            try {
                connection.rollback(); // 如果出錯，則回滾交易
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
        } finally {
            try {
                connection.setAutoCommit(true); // 恢復自動提交模式
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    /**
     * 關閉資料庫連線，釋放資源。
     */
    @Override
    public void close() {
        try {
            log.debug("正在關閉 H2 資料庫連線...");
            connection.close();
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
