package com.grantharvest.crawl.persistence;

import com.grantharvest.crawl.model.Grant;
import com.grantharvest.crawl.model.GrantInsertResult;
import com.grantharvest.crawl.model.StoredGrant;
import com.grantharvest.crawl.util.GenreNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Canonical grant records, unique on (issuer, title, deadline). A successful insert also registers
 * and links the grant's genres through {@link GenreJdbcRepository}.
 *
 * <p>The application context closes this repository on shutdown; after {@link #close()} every
 * operation fails with {@link IllegalStateException}. Closing only ends this store's use: the pooled
 * {@code DataSource} belongs to the context and is released there.
 */
@Repository
public class GrantJdbcRepository implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GrantJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final GenreJdbcRepository genreRepository;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public GrantJdbcRepository(NamedParameterJdbcTemplate jdbc, GenreJdbcRepository genreRepository) {
        this.jdbc = jdbc;
        this.genreRepository = genreRepository;
    }

    public GrantInsertResult insert(Grant grant) {
        ensureOpen();
        long grantId;
        try {
            grantId = insertRow(grant);
        } catch (DuplicateKeyException e) {
            return GrantInsertResult.duplicate();
        } catch (DataAccessException e) {
            throw new StorageFaultException("failed to insert grant " + grant.naturalKey(), e);
        }

        try {
            for (String genre : GenreNames.split(grant.genres())) {
                genreRepository.ensureGenre(genre);
                long genreId = genreRepository.findGenreId(genre)
                    .orElseThrow(() -> new IllegalStateException("genre not registered: " + genre));
                genreRepository.link(grantId, genreId);
            }
        } catch (DataAccessException e) {
            throw new StorageFaultException("failed to link genres for grant " + grantId, e);
        }
        return GrantInsertResult.inserted(grantId);
    }

    public List<StoredGrant> findAll() {
        ensureOpen();
        try {
            List<GrantRow> rows = jdbc.query(
                """
                    SELECT id,
                           issuer,
                           title,
                           cash_prize,
                           entry_fee,
                           deadline,
                           genres,
                           description,
                           read_more_link,
                           extra_info
                    FROM grants
                    ORDER BY id
                    """,
                new MapSqlParameterSource(),
                (rs, rowNum) -> new GrantRow(
                    rs.getLong("id"),
                    new Grant(
                        rs.getString("issuer"),
                        rs.getString("title"),
                        nullToEmpty(rs.getString("cash_prize")),
                        nullToEmpty(rs.getString("entry_fee")),
                        rs.getString("deadline"),
                        nullToEmpty(rs.getString("genres")),
                        nullToEmpty(rs.getString("description")),
                        rs.getString("read_more_link"),
                        rs.getString("extra_info")
                    )
                )
            );
            Map<Long, Set<String>> genres = genreRepository.findGenreNamesByGrant(
                rows.stream().map(GrantRow::id).toList()
            );
            List<StoredGrant> grants = new ArrayList<>(rows.size());
            for (GrantRow row : rows) {
                Set<String> names = genres.getOrDefault(row.id(), new LinkedHashSet<>());
                grants.add(new StoredGrant(row.id(), row.grant(), Set.copyOf(names)));
            }
            return grants;
        } catch (DataAccessException e) {
            throw new StorageFaultException("failed to read grants", e);
        }
    }

    public long countGrants() {
        ensureOpen();
        try {
            Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM grants", Long.class);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw new StorageFaultException("failed to count grants", e);
        }
    }

    public boolean isDbReachable() {
        ensureOpen();
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Grant store closed");
        }
    }

    private long insertRow(Grant grant) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("issuer", grant.issuer())
            .addValue("title", grant.title())
            .addValue("cashPrize", grant.cashPrize())
            .addValue("entryFee", grant.entryFee())
            .addValue("deadline", grant.deadline())
            .addValue("genres", grant.genres())
            .addValue("description", grant.description())
            .addValue("readMoreLink", grant.readMoreLink())
            .addValue("extraInfo", grant.hasExtraInfo() ? grant.extraInfo() : null);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO grants (
                    issuer,
                    title,
                    cash_prize,
                    entry_fee,
                    deadline,
                    genres,
                    description,
                    read_more_link,
                    extra_info
                )
                VALUES (
                    :issuer,
                    :title,
                    :cashPrize,
                    :entryFee,
                    :deadline,
                    :genres,
                    :description,
                    :readMoreLink,
                    :extraInfo
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new StorageFaultException("no id generated for grant " + grant.naturalKey(), null);
        }
        return key.longValue();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("grant store is closed");
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record GrantRow(long id, Grant grant) {}
}
