package com.propertyintel.listings.source;

import com.propertyintel.listings.model.RawListing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Streams listings straight out of a warehouse table with the dataset-items
 * column layout. The stream holds an open cursor and must be closed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcListingReader {

    static final RowMapper<RawListing> ROW_MAPPER = (rs, rowNum) -> RawListing.builder()
            .id(rs.getString("id"))
            .createdAt(rs.getString("createdAt"))
            .offerType(rs.getString("data_offerType"))
            .propertyType(rs.getString("data_type"))
            .priceTotal(rs.getString("data_priceTotal"))
            .livingArea(rs.getString("data_livingArea"))
            .district(rs.getString("data_district"))
            .latitude(rs.getString("data_gpsCoord_lat"))
            .longitude(rs.getString("data_gpsCoord_lon"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Stream<RawListing> read(String table) {
        String sql = """
            SELECT "id", "createdAt", "data_offerType", "data_type",
                   "data_priceTotal", "data_livingArea", "data_district",
                   "data_gpsCoord_lat", "data_gpsCoord_lon"
            FROM %s
            """.formatted(SqlIdentifiers.requireTableName(table, "source.listings.table"));

        log.info("Streaming listings from table {}", table);
        return jdbcTemplate.queryForStream(sql, ROW_MAPPER);
    }
}
