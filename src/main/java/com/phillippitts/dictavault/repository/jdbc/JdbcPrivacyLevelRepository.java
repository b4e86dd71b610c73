package com.phillippitts.dictavault.repository.jdbc;

import com.phillippitts.dictavault.domain.PrivacyLevel;
import com.phillippitts.dictavault.repository.PrivacyLevelRepository;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcPrivacyLevelRepository implements PrivacyLevelRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPrivacyLevelRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<PrivacyLevel> find(String entityId) {
        return jdbcTemplate.query(
                "SELECT privacy_level FROM privacy_levels WHERE entity_id = ?",
                (rs, rowNum) -> PrivacyLevel.fromStorageValue(rs.getString("privacy_level")),
                entityId).stream().findFirst();
    }

    @Override
    public List<String> findPrivateAmong(Collection<String> entityIds) {
        if (entityIds == null || entityIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> args = new ArrayList<>(entityIds.size() + 1);
        args.add(PrivacyLevel.PRIVATE.storageValue());
        args.addAll(entityIds);
        String placeholders = String.join(", ", Collections.nCopies(entityIds.size(), "?"));
        return jdbcTemplate.queryForList(
                "SELECT entity_id FROM privacy_levels WHERE privacy_level = ? AND entity_id IN ("
                        + placeholders + ")",
                String.class, args.toArray());
    }

    /**
     * Update first, insert when nothing was updated. A concurrent insert of the same entity
     * surfaces as a duplicate key and is resolved by updating again.
     */
    @Override
    public void save(String entityId, PrivacyLevel level) {
        Timestamp now = Timestamp.from(Instant.now());
        int updated = jdbcTemplate.update(
                "UPDATE privacy_levels SET privacy_level = ?, updated_at = ? WHERE entity_id = ?",
                level.storageValue(), now, entityId);
        if (updated > 0) {
            return;
        }
        try {
            jdbcTemplate.update(
                    "INSERT INTO privacy_levels (entity_id, privacy_level, updated_at) VALUES (?, ?, ?)",
                    entityId, level.storageValue(), now);
        } catch (DuplicateKeyException e) {
            jdbcTemplate.update(
                    "UPDATE privacy_levels SET privacy_level = ?, updated_at = ? WHERE entity_id = ?",
                    level.storageValue(), now, entityId);
        }
    }

    @Override
    public List<String> findAllPrivateEntityIds() {
        return jdbcTemplate.queryForList(
                "SELECT entity_id FROM privacy_levels WHERE privacy_level = ? ORDER BY entity_id",
                String.class, PrivacyLevel.PRIVATE.storageValue());
    }
}
