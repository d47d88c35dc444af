package com.grantharvest.crawl.persistence;

import com.grantharvest.crawl.model.Grant;
import com.grantharvest.crawl.model.GrantInsertResult;
import com.grantharvest.crawl.model.StoredGrant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class GrantJdbcRepositoryTest {

    @Autowired
    private GrantJdbcRepository repository;

    @Autowired
    private GenreJdbcRepository genreRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void insertAssignsIdAndResolvesGenres() {
        String issuer = "Issuer " + UUID.randomUUID();
        Grant grant = grant(issuer, "Fiction Prize", "May 1, 2027", "Fiction, , Poetry,Fiction");

        GrantInsertResult result = repository.insert(grant);

        assertTrue(result.isInserted());
        assertNotNull(result.grantId());
        assertThat(genreRepository.findGenreNames(result.grantId()))
            .containsExactlyInAnyOrder("Fiction", "Poetry");
        StoredGrant stored = findStored(result.grantId());
        assertEquals(grant, stored.grant());
        assertThat(stored.genres()).containsExactlyInAnyOrder("Fiction", "Poetry");
    }

    @Test
    void duplicateNaturalKeyLeavesStoreUnchanged() {
        String issuer = "Issuer " + UUID.randomUUID();
        Grant original = grant(issuer, "Essay Award", "June 30, 2027", "Essay");
        Grant sameKey = new Grant(
            issuer,
            "Essay Award",
            "$9,999",
            "$1",
            "June 30, 2027",
            "Poetry, Drama",
            "different description",
            "https://grants.test/other",
            "other"
        );

        GrantInsertResult first = repository.insert(original);
        long grantsBefore = repository.countGrants();
        long genresBefore = genreRepository.countGenres();
        long linksBefore = genreRepository.countLinks();

        GrantInsertResult second = repository.insert(sameKey);

        assertTrue(first.isInserted());
        assertTrue(second.isDuplicate());
        assertNull(second.grantId());
        assertEquals(grantsBefore, repository.countGrants());
        assertEquals(genresBefore, genreRepository.countGenres());
        assertEquals(linksBefore, genreRepository.countLinks());
        assertEquals(original, findStored(first.grantId()).grant());
    }

    @Test
    void differentDeadlineIsADistinctGrant() {
        String issuer = "Issuer " + UUID.randomUUID();
        assertTrue(repository.insert(grant(issuer, "Annual Prize", "2026", "Poetry")).isInserted());
        assertTrue(repository.insert(grant(issuer, "Annual Prize", "2027", "Poetry")).isInserted());

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM grants WHERE issuer = :issuer",
            new MapSqlParameterSource().addValue("issuer", issuer),
            Integer.class
        );
        assertEquals(2, rows);
    }

    @Test
    void findAllReturnsGrantsInInsertionOrder() {
        String issuer = "Issuer " + UUID.randomUUID();
        long first = repository.insert(grant(issuer, "First", "Jan 1", "Fiction")).grantId();
        long second = repository.insert(grant(issuer, "Second", "Jan 2", "")).grantId();

        List<Long> ids = repository.findAll().stream()
            .filter(stored -> issuer.equals(stored.grant().issuer()))
            .map(StoredGrant::id)
            .toList();

        assertEquals(List.of(first, second), ids);
        assertThat(findStored(second).genres()).isEmpty();
    }

    @Test
    void extraInfoIsOptional() {
        String issuer = "Issuer " + UUID.randomUUID();
        Grant withExtra = new Grant(
            issuer, "Residency", "$0", "$0", "Rolling", "Nonfiction", "desc", null, "Housing included"
        );

        long id = repository.insert(withExtra).grantId();

        StoredGrant stored = findStored(id);
        assertEquals("Housing included", stored.grant().extraInfo());
        assertNull(stored.grant().readMoreLink());
    }

    @Test
    void longFreeFormValuesAreStoredWithTheirGenres() {
        String issuer = "Issuer " + UUID.randomUUID();
        String deadline = "x".repeat(300);
        String genre = "G".repeat(300);
        Grant grant = new Grant(
            issuer + "i".repeat(400),
            "t".repeat(400),
            "$".repeat(1200),
            "f".repeat(1200),
            deadline,
            genre + ", Poetry",
            "d".repeat(5000),
            "https://grants.test/" + "p".repeat(2500),
            null
        );

        GrantInsertResult result = repository.insert(grant);

        assertTrue(result.isInserted());
        StoredGrant stored = findStored(result.grantId());
        assertEquals(grant, stored.grant());
        assertThat(stored.genres()).containsExactlyInAnyOrder(genre, "Poetry");
        assertTrue(repository.insert(grant).isDuplicate());
    }

    @Test
    void closedStoreRejectsFurtherOperations() {
        GrantJdbcRepository store = new GrantJdbcRepository(jdbc, genreRepository);
        store.close();
        store.close();

        assertTrue(store.isClosed());
        assertThrows(IllegalStateException.class, store::findAll);
        assertThrows(
            IllegalStateException.class,
            () -> store.insert(grant("Issuer", "Title", "Deadline", "Poetry"))
        );
    }

    private StoredGrant findStored(long id) {
        return repository.findAll().stream()
            .filter(stored -> stored.id() == id)
            .findFirst()
            .orElseThrow();
    }

    private Grant grant(String issuer, String title, String deadline, String genres) {
        return new Grant(
            issuer,
            title,
            "$1,000",
            "$15",
            deadline,
            genres,
            "A prize for " + title,
            "https://grants.test/grants/" + title.replace(' ', '-'),
            null
        );
    }
}
