package com.stayharvest.crawl.persistence;

import com.stayharvest.crawl.model.DataQualityReport;
import com.stayharvest.crawl.model.DetailRecord;
import com.stayharvest.crawl.model.PendingDetail;
import com.stayharvest.crawl.model.SearchRecord;
import com.stayharvest.crawl.model.StoredRecordState;
import com.stayharvest.crawl.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JDBC access to the crawl state tables. All timestamps are epoch seconds.
 */
@Repository
public class CrawlStateRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlStateRepository.class);
    private static final int CURSOR_ROW_ID = 1;

    private static final String RECORD_COLUMNS = """
        id,
        listing_obj_type,
        room_type_category,
        title,
        name,
        picture,
        checkin,
        checkout,
        price,
        discounted_price,
        original_price,
        link,
        last_scraped_at,
        needs_detail,
        detail_complete,
        reviews_count,
        average_rating,
        host,
        luxe,
        location,
        max_guest_capacity,
        guest_favorite,
        lat,
        lng,
        superhost,
        verified,
        host_rating_count,
        host_user_id,
        host_years,
        host_months,
        host_rating_average
        """;
    private static final String RECORD_VALUES = """
        :id,
        :listingObjType,
        :roomTypeCategory,
        :title,
        :name,
        :picture,
        :checkin,
        :checkout,
        :price,
        :discountedPrice,
        :originalPrice,
        :link,
        :lastScrapedAt,
        :needsDetail,
        :detailComplete,
        :reviewsCount,
        :averageRating,
        :host,
        :luxe,
        :location,
        :maxGuestCapacity,
        :guestFavorite,
        :lat,
        :lng,
        :superhost,
        :verified,
        :hostRatingCount,
        :hostUserId,
        :hostYears,
        :hostMonths,
        :hostRatingAverage
        """;
    private static final String RECORD_ASSIGNMENTS = """
        listing_obj_type = :listingObjType,
        room_type_category = :roomTypeCategory,
        title = :title,
        name = :name,
        picture = :picture,
        checkin = :checkin,
        checkout = :checkout,
        price = :price,
        discounted_price = :discountedPrice,
        original_price = :originalPrice,
        link = :link,
        last_scraped_at = :lastScrapedAt,
        needs_detail = :needsDetail,
        detail_complete = :detailComplete,
        """ + detailAssignments();

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public CrawlStateRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public Optional<Integer> findCursor() {
        List<Integer> values = jdbc.query(
            "SELECT cursor_value FROM crawl_cursor WHERE id = :id",
            new MapSqlParameterSource("id", CURSOR_ROW_ID),
            (rs, rowNum) -> rs.getInt("cursor_value")
        );
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public void saveCursor(int value) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", CURSOR_ROW_ID)
            .addValue("value", Math.max(0, value));
        int updated = jdbc.update("UPDATE crawl_cursor SET cursor_value = :value WHERE id = :id", params);
        if (updated == 0) {
            jdbc.update("INSERT INTO crawl_cursor (id, cursor_value) VALUES (:id, :value)", params);
        }
    }

    public Optional<Long> findTileLastScrapedAt(int tileId) {
        List<Long> values = jdbc.query(
            "SELECT last_scraped_at FROM tiles WHERE id = :id",
            new MapSqlParameterSource("id", tileId),
            (rs, rowNum) -> rs.getLong("last_scraped_at")
        );
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public void upsertTile(Tile tile, int recordCount, long scrapedAtEpochSeconds) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", tile.ordinal())
            .addValue("swLat", tile.swLat())
            .addValue("swLng", tile.swLng())
            .addValue("neLat", tile.neLat())
            .addValue("neLng", tile.neLng())
            .addValue("lastScrapedAt", scrapedAtEpochSeconds)
            .addValue("recordCount", Math.max(0, recordCount));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO tiles (id, sw_lat, sw_lng, ne_lat, ne_lng, last_scraped_at, record_count)
                    VALUES (:id, :swLat, :swLng, :neLat, :neLng, :lastScrapedAt, :recordCount)
                    ON CONFLICT (id)
                    DO UPDATE SET
                        last_scraped_at = EXCLUDED.last_scraped_at,
                        record_count = EXCLUDED.record_count
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO tiles (id, sw_lat, sw_lng, ne_lat, ne_lng, last_scraped_at, record_count)
                KEY(id)
                VALUES (:id, :swLat, :swLng, :neLat, :neLng, :lastScrapedAt, :recordCount)
                """,
            params
        );
    }

    public long countTiles() {
        return count("SELECT COUNT(*) FROM tiles", new MapSqlParameterSource());
    }

    public Optional<StoredRecordState> findRecordState(String id) {
        List<StoredRecordState> values = jdbc.query(
            "SELECT id, last_scraped_at, detail_complete FROM records WHERE id = :id",
            new MapSqlParameterSource("id", id),
            (rs, rowNum) -> new StoredRecordState(
                rs.getString("id"),
                Instant.ofEpochSecond(rs.getLong("last_scraped_at")),
                rs.getBoolean("detail_complete")
            )
        );
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * Writes the whole row. A stored row with a newer {@code last_scraped_at} is left untouched.
     *
     * @return true when the row was inserted or replaced
     */
    public boolean upsertRecord(SearchRecord record, DetailRecord detail, boolean detailComplete, long scrapedAtEpochSeconds) {
        MapSqlParameterSource params = recordParams(record, detail == null ? DetailRecord.empty() : detail)
            .addValue("lastScrapedAt", scrapedAtEpochSeconds)
            .addValue("needsDetail", !detailComplete)
            .addValue("detailComplete", detailComplete);
        if (postgres) {
            int written = jdbc.update(
                "INSERT INTO records (" + RECORD_COLUMNS + ") VALUES (" + RECORD_VALUES + ") "
                    + "ON CONFLICT (id) DO UPDATE SET " + RECORD_ASSIGNMENTS
                    + " WHERE records.last_scraped_at <= EXCLUDED.last_scraped_at",
                params
            );
            return written > 0;
        }
        int updated = jdbc.update(
            "UPDATE records SET " + RECORD_ASSIGNMENTS + " WHERE id = :id AND last_scraped_at <= :lastScrapedAt",
            params
        );
        if (updated > 0) {
            return true;
        }
        if (findRecordState(record.id()).isPresent()) {
            log.debug("Kept newer stored row for listing {}", record.id());
            return false;
        }
        return jdbc.update("INSERT INTO records (" + RECORD_COLUMNS + ") VALUES (" + RECORD_VALUES + ")", params) > 0;
    }

    /**
     * Sets the detail columns of an existing row and marks it complete; basic columns are untouched.
     */
    public boolean applyDetail(String id, DetailRecord detail) {
        MapSqlParameterSource params = detailParams(new MapSqlParameterSource("id", id), detail);
        int updated = jdbc.update(
            "UPDATE records SET " + detailAssignments() + ", needs_detail = FALSE, detail_complete = TRUE WHERE id = :id",
            params
        );
        return updated > 0;
    }

    public List<PendingDetail> findPendingDetail(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id, link, title
                FROM records
                WHERE needs_detail = TRUE AND detail_complete = FALSE
                ORDER BY last_scraped_at DESC, id
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new PendingDetail(rs.getString("id"), rs.getString("link"), rs.getString("title"))
        );
    }

    public long countRecords() {
        return count("SELECT COUNT(*) FROM records", new MapSqlParameterSource());
    }

    public long countRecordsByDetail(boolean detailComplete) {
        return count(
            "SELECT COUNT(*) FROM records WHERE detail_complete = :detailComplete",
            new MapSqlParameterSource("detailComplete", detailComplete)
        );
    }

    public long countPendingDetail() {
        return count(
            "SELECT COUNT(*) FROM records WHERE needs_detail = TRUE AND detail_complete = FALSE",
            new MapSqlParameterSource()
        );
    }

    public long countRecordsScrapedSince(long epochSeconds) {
        return count(
            "SELECT COUNT(*) FROM records WHERE last_scraped_at >= :since",
            new MapSqlParameterSource("since", epochSeconds)
        );
    }

    public DataQualityReport dataQuality() {
        List<DataQualityReport> rows = jdbc.query(
            """
                SELECT COUNT(*) AS total,
                       SUM(CASE WHEN price IS NOT NULL AND price <> '' THEN 1 ELSE 0 END) AS with_price,
                       SUM(CASE WHEN picture IS NOT NULL AND picture <> '' THEN 1 ELSE 0 END) AS with_picture,
                       SUM(CASE WHEN lat IS NOT NULL AND lng IS NOT NULL THEN 1 ELSE 0 END) AS with_coordinates
                FROM records
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new DataQualityReport(
                rs.getLong("total"),
                rs.getLong("with_price"),
                rs.getLong("with_picture"),
                rs.getLong("with_coordinates")
            )
        );
        return rows.isEmpty() ? new DataQualityReport(0, 0, 0, 0) : rows.get(0);
    }

    private long count(String sql, MapSqlParameterSource params) {
        Long value = jdbc.queryForObject(sql, params, Long.class);
        return value == null ? 0L : value;
    }

    private MapSqlParameterSource recordParams(SearchRecord record, DetailRecord detail) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("listingObjType", record.listingObjType())
            .addValue("roomTypeCategory", record.roomTypeCategory())
            .addValue("title", record.title())
            .addValue("name", record.name())
            .addValue("picture", record.picture())
            .addValue("checkin", record.checkin())
            .addValue("checkout", record.checkout())
            .addValue("price", record.price())
            .addValue("discountedPrice", record.discountedPrice())
            .addValue("originalPrice", record.originalPrice())
            .addValue("link", record.link());
        return detailParams(params, detail);
    }

    private MapSqlParameterSource detailParams(MapSqlParameterSource params, DetailRecord detail) {
        return params
            .addValue("reviewsCount", detail.reviewsCount())
            .addValue("averageRating", detail.averageRating())
            .addValue("host", detail.host())
            .addValue("luxe", detail.luxe())
            .addValue("location", detail.location())
            .addValue("maxGuestCapacity", detail.maxGuestCapacity())
            .addValue("guestFavorite", detail.guestFavorite())
            .addValue("lat", detail.lat())
            .addValue("lng", detail.lng())
            .addValue("superhost", detail.superhost())
            .addValue("verified", detail.verified())
            .addValue("hostRatingCount", detail.hostRatingCount())
            .addValue("hostUserId", detail.hostUserId())
            .addValue("hostYears", detail.hostYears())
            .addValue("hostMonths", detail.hostMonths())
            .addValue("hostRatingAverage", detail.hostRatingAverage());
    }

    private static String detailAssignments() {
        return """
            reviews_count = :reviewsCount,
            average_rating = :averageRating,
            host = :host,
            luxe = :luxe,
            location = :location,
            max_guest_capacity = :maxGuestCapacity,
            guest_favorite = :guestFavorite,
            lat = :lat,
            lng = :lng,
            superhost = :superhost,
            verified = :verified,
            host_rating_count = :hostRatingCount,
            host_user_id = :hostUserId,
            host_years = :hostYears,
            host_months = :hostMonths,
            host_rating_average = :hostRatingAverage""";
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upserts", e);
            return false;
        }
    }
}
