package com.phillippitts.dictavault.repository.jdbc;

import com.phillippitts.dictavault.repository.VaultCredentialRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class JdbcVaultCredentialRepository implements VaultCredentialRepository {

    private static final int SINGLETON_ID = 1;

    private final JdbcTemplate jdbcTemplate;

    public JdbcVaultCredentialRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<String> findPasswordHash() {
        return jdbcTemplate.query(
                "SELECT password_hash FROM vault_credentials WHERE id = ?",
                (rs, rowNum) -> rs.getString("password_hash"), SINGLETON_ID).stream().findFirst();
    }

    @Override
    public void savePasswordHash(String hash) {
        Timestamp now = Timestamp.from(Instant.now());
        int updated = jdbcTemplate.update(
                "UPDATE vault_credentials SET password_hash = ?, updated_at = ? WHERE id = ?",
                hash, now, SINGLETON_ID);
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO vault_credentials (id, password_hash, updated_at) VALUES (?, ?, ?)",
                    SINGLETON_ID, hash, now);
        }
    }
}
