package com.warden.demo.infrastructure.jdbc;

import com.warden.demo.domain.Note;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Notes stored in the {@code notes} table. */
@Repository
public class NoteRepository {

    private final JdbcTemplate jdbc;

    public NoteRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Note> findById(UUID id) {
        return jdbc.query(
                        "SELECT id, owner_id, title FROM notes WHERE id = ?",
                        (rs, row) -> new Note(rs.getObject("id", UUID.class), rs.getString("owner_id"), rs.getString("title")),
                        id)
                .stream()
                .findFirst();
    }
}
