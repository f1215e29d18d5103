package com.propertyintel.listings.source;

import com.propertyintel.listings.model.RegionReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcRegionReader {

    private final JdbcTemplate jdbcTemplate;

    public List<RegionReference> read(String table) {
        String sql = """
            SELECT DISTINCT "okres_text", "kraj_text"
            FROM %s
            """.formatted(SqlIdentifiers.requireTableName(table, "source.regions.table"));

        List<RegionReference> references = jdbcTemplate.query(sql,
                (rs, rowNum) -> new RegionReference(rs.getString("okres_text"), rs.getString("kraj_text")));

        log.info("Loaded {} region reference rows from table {}", references.size(), table);
        return references;
    }
}
