package com.phillippitts.dictavault.repository.jdbc;

import com.phillippitts.dictavault.domain.ContentUnit;
import com.phillippitts.dictavault.domain.Match;
import com.phillippitts.dictavault.domain.PrivacyLevel;
import com.phillippitts.dictavault.domain.PrivacyTag;
import com.phillippitts.dictavault.domain.TagStatus;
import com.phillippitts.dictavault.domain.Version;
import com.phillippitts.dictavault.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRepositoriesTest {

    private TestDatabase db;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void versionNumbersAreUniquePerDocument() {
        JdbcVersionRepository repo = new JdbcVersionRepository(db.jdbcTemplate());
        repo.insert(new Version("v1", "doc", 1, "raw", "a", Instant.now()));
        repo.insert(new Version("v2", "doc", 2, "edited", "b", Instant.now()));
        repo.insert(new Version("o1", "other", 1, "raw", "x", Instant.now()));

        assertThat(repo.findMaxVersionNumber("doc")).isEqualTo(2);
        assertThat(repo.findMaxVersionNumber("missing")).isZero();
        assertThat(repo.findAllByDocumentIdDesc("doc")).extracting(Version::versionNumber).containsExactly(2, 1);
        assertThat(repo.findLatest("doc")).map(Version::content).contains("b");
        assertThat(repo.find("doc", 1)).map(Version::versionType).contains("raw");
        assertThat(repo.find("doc", 3)).isEmpty();

        assertThatThrownBy(() -> repo.insert(new Version("v3", "doc", 2, "raw", "c", Instant.now())))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void contentProjectionIsUpserted() {
        JdbcDocumentContentRepository repo = new JdbcDocumentContentRepository(db.jdbcTemplate());

        assertThat(repo.findContent("doc")).isEmpty();
        repo.upsert("doc", "first", 1);
        repo.upsert("doc", "second", 2);

        assertThat(repo.findContent("doc")).contains("second");
    }

    @Test
    void privacyLevelsDefaultToAbsentAndCanBeOverwritten() {
        JdbcPrivacyLevelRepository repo = new JdbcPrivacyLevelRepository(db.jdbcTemplate());

        assertThat(repo.find("card-1")).isEmpty();
        repo.save("card-1", PrivacyLevel.PRIVATE);
        repo.save("card-2", PrivacyLevel.PRIVATE);
        repo.save("card-2", PrivacyLevel.PUBLIC);

        assertThat(repo.find("card-1")).contains(PrivacyLevel.PRIVATE);
        assertThat(repo.find("card-2")).contains(PrivacyLevel.PUBLIC);
        assertThat(repo.findAllPrivateEntityIds()).containsExactly("card-1");
        assertThat(repo.findPrivateAmong(List.of("card-1", "card-2", "card-3"))).containsExactly("card-1");
        assertThat(repo.findPrivateAmong(List.of())).isEmpty();
    }

    @Test
    void unknownStoredLevelReadsAsPublic() {
        db.jdbcTemplate().update(
                "INSERT INTO privacy_levels (entity_id, privacy_level, updated_at) VALUES ('s', 'secret', CURRENT_TIMESTAMP)");

        assertThat(new JdbcPrivacyLevelRepository(db.jdbcTemplate()).find("s")).contains(PrivacyLevel.PUBLIC);
    }

    @Test
    void tagsAreOrderedAndCounted() {
        JdbcPrivacyTagRepository repo = new JdbcPrivacyTagRepository(db.jdbcTemplate());
        PrivacyTag late = PrivacyTag.fromMatch("s1", Match.of("Email", "a@b.co", 20, 26));
        PrivacyTag early = PrivacyTag.fromMatch("s1", Match.of("SSN", "123-45-6789", 0, 11));
        repo.insertAll(List.of(late, early));
        repo.insertAll(List.of());

        assertThat(repo.existsForSession("s1")).isTrue();
        assertThat(repo.existsForSession("s2")).isFalse();
        assertThat(repo.findBySession("s1")).extracting(PrivacyTag::tagType).containsExactly("SSN", "Email");

        assertThat(repo.updateStatus(early.id(), TagStatus.ACCEPTED)).isTrue();
        assertThat(repo.updateStatus("nope", TagStatus.ACCEPTED)).isFalse();
        assertThat(repo.countBySessionAndStatus("s1", TagStatus.UNREVIEWED)).isEqualTo(1);
        assertThat(repo.deleteBySession("s1")).isEqualTo(2);
        assertThat(repo.findBySession("s1")).isEmpty();
    }

    @Test
    void vaultCredentialIsASingleRow() {
        JdbcVaultCredentialRepository repo = new JdbcVaultCredentialRepository(db.jdbcTemplate());

        assertThat(repo.findPasswordHash()).isEmpty();
        repo.savePasswordHash("h1");
        repo.savePasswordHash("h2");

        assertThat(repo.findPasswordHash()).contains("h2");
        assertThat(db.jdbcTemplate().queryForObject("SELECT COUNT(*) FROM vault_credentials", Integer.class))
                .isEqualTo(1);
    }

    @Test
    void contentUnitsAreStoredPerSession() {
        JdbcContentUnitRepository repo = new JdbcContentUnitRepository(db.jdbcTemplate());
        repo.insert(new ContentUnit("u1", "s1", "Hello.", ContentUnit.BRAIN_DUMP, ContentUnit.PILE_INBOX, Instant.now()));
        repo.insert(new ContentUnit("u2", "s2", "Other.", ContentUnit.BRAIN_DUMP, ContentUnit.PILE_VAULT, Instant.now()));

        assertThat(repo.findBySession("s1")).singleElement().satisfies(u -> {
            assertThat(u.content()).isEqualTo("Hello.");
            assertThat(u.pile()).isEqualTo(ContentUnit.PILE_INBOX);
        });
    }
}
