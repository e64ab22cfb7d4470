package com.warden.demo.infrastructure.jdbc;

import com.warden.demo.domain.Document;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Documents stored in the {@code documents} table. */
@Repository
public class DocumentRepository {

    private static final String SQL_SELECT =
            "SELECT id, owner_id, tenant_id, title, content FROM documents";

    private static final String SQL_SELECT_OWNED_IN_TENANT = SQL_SELECT
            + " WHERE " + Document.OWNER.name() + " = ? AND " + Document.TENANT.name() + " = ? ORDER BY title";

    private static final String SQL_UPDATE =
            """
            UPDATE documents
               SET title = ?,
                   content = ?
             WHERE id = ?
            """;

    private final JdbcTemplate jdbc;

    public DocumentRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Document> findById(UUID id) {
        return jdbc.query(SQL_SELECT + " WHERE id = ?", DocumentRepository::map, id).stream().findFirst();
    }

    /** Documents owned by {@code ownerId} within {@code tenantId}, ordered by title. */
    public List<Document> findOwnedInTenant(String ownerId, String tenantId) {
        return jdbc.query(SQL_SELECT_OWNED_IN_TENANT, DocumentRepository::map, ownerId, tenantId);
    }

    public void insert(Document document) {
        jdbc.update("INSERT INTO documents (id, owner_id, tenant_id, title, content) VALUES (?, ?, ?, ?, ?)",
                document.id(), document.ownerId(), document.tenantId(), document.title(), document.content());
    }

    public boolean update(Document document) {
        return jdbc.update(SQL_UPDATE, document.title(), document.content(), document.id()) == 1;
    }

    public boolean delete(UUID id) {
        return jdbc.update("DELETE FROM documents WHERE id = ?", id) == 1;
    }

    private static Document map(ResultSet rs, int row) throws SQLException {
        return new Document(
                rs.getObject("id", UUID.class),
                rs.getString("owner_id"),
                rs.getString("tenant_id"),
                rs.getString("title"),
                rs.getString("content"));
    }
}
