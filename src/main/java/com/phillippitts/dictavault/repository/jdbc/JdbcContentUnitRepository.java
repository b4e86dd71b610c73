package com.phillippitts.dictavault.repository.jdbc;

import com.phillippitts.dictavault.domain.ContentUnit;
import com.phillippitts.dictavault.repository.ContentUnitRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class JdbcContentUnitRepository implements ContentUnitRepository {

    private static final RowMapper<ContentUnit> ROW_MAPPER = (rs, rowNum) -> new ContentUnit(
            rs.getString("id"),
            rs.getString("session_id"),
            rs.getString("content"),
            rs.getString("tag_type"),
            rs.getString("pile"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcContentUnitRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(ContentUnit unit) {
        jdbcTemplate.update(
                "INSERT INTO content_units (id, session_id, content, tag_type, pile, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?)",
                unit.id(), unit.sessionId(), unit.content(), unit.tagType(), unit.pile(),
                Timestamp.from(unit.createdAt()));
    }

    @Override
    public List<ContentUnit> findBySession(String sessionId) {
        return jdbcTemplate.query(
                "SELECT id, session_id, content, tag_type, pile, created_at FROM content_units "
                        + "WHERE session_id = ? ORDER BY created_at, id",
                ROW_MAPPER, sessionId);
    }
}
