package com.grantharvest.crawl.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Genre vocabulary and the grant/genre association table. Both writes are idempotent: a name or a
 * pair that already exists is left untouched.
 */
@Repository
public class GenreJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(GenreJdbcRepository.class);
    private static final int ID_BATCH_SIZE = 1000;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public GenreJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public void ensureGenre(String name) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name);
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO genres (name)
                    VALUES (:name)
                    ON CONFLICT (name) DO NOTHING
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO genres (name)
                KEY(name)
                VALUES (:name)
                """,
            params
        );
    }

    public Optional<Long> findGenreId(String name) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name);
        List<Long> ids = jdbc.query(
            """
                SELECT id
                FROM genres
                WHERE name = :name
                """,
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    public void link(long grantId, long genreId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("grantId", grantId)
            .addValue("genreId", genreId);
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO grant_genre (grant_id, genre_id)
                    VALUES (:grantId, :genreId)
                    ON CONFLICT (grant_id, genre_id) DO NOTHING
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO grant_genre (grant_id, genre_id)
                KEY(grant_id, genre_id)
                VALUES (:grantId, :genreId)
                """,
            params
        );
    }

    public List<String> findGenreNames(long grantId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("grantId", grantId);
        return jdbc.query(
            """
                SELECT g.name
                FROM genres g
                JOIN grant_genre gg ON g.id = gg.genre_id
                WHERE gg.grant_id = :grantId
                ORDER BY g.id
                """,
            params,
            (rs, rowNum) -> rs.getString("name")
        );
    }

    public Map<Long, Set<String>> findGenreNamesByGrant(Collection<Long> grantIds) {
        Map<Long, Set<String>> namesByGrant = new LinkedHashMap<>();
        if (grantIds == null || grantIds.isEmpty()) {
            return namesByGrant;
        }
        List<Long> ids = new ArrayList<>(grantIds);
        for (int i = 0; i < ids.size(); i += ID_BATCH_SIZE) {
            List<Long> slice = ids.subList(i, Math.min(ids.size(), i + ID_BATCH_SIZE));
            jdbc.query(
                """
                    SELECT gg.grant_id, g.name
                    FROM grant_genre gg
                    JOIN genres g ON g.id = gg.genre_id
                    WHERE gg.grant_id IN (:grantIds)
                    ORDER BY gg.grant_id, g.id
                    """,
                new MapSqlParameterSource().addValue("grantIds", slice),
                rs -> {
                    namesByGrant
                        .computeIfAbsent(rs.getLong("grant_id"), id -> new LinkedHashSet<>())
                        .add(rs.getString("name"));
                }
            );
        }
        return namesByGrant;
    }

    public long countGenres() {
        return countTable("genres");
    }

    public long countLinks() {
        return countTable("grant_genre");
    }

    private long countTable(String table) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0L : count;
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
            log.warn("Unable to detect database product; defaulting to H2 upsert syntax", e);
            return false;
        }
    }
}
