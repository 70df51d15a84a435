package io.docex.tenancy.basket;

import io.docex.tenancy.multitenancy.ConnectionHandle;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class DocumentRepository {

  private static final RowMapper<Document> ROW_MAPPER = DocumentRepository::mapRow;

  public Document insert(ConnectionHandle handle, Document document) {
    handle.execute(
        jdbc ->
            jdbc.sql(
                    """
                    INSERT INTO document (id, basket_id, tenant_id, name, extension, storage_path,
                        created_by, created_at)
                    VALUES (:id, :basketId, :tenantId, :name, :extension, :storagePath,
                        :createdBy, :createdAt)
                    """)
                .param("id", document.id())
                .param("basketId", document.basketId())
                .param("tenantId", handle.tenantId())
                .param("name", document.name())
                .param("extension", document.extension())
                .param("storagePath", document.storagePath())
                .param("createdBy", document.createdBy())
                .param("createdAt", Timestamp.from(document.createdAt()))
                .update());
    return document;
  }

  public Optional<Document> findById(ConnectionHandle handle, String documentId) {
    return handle.execute(
        jdbc ->
            jdbc.sql("SELECT * FROM document WHERE tenant_id = :tenantId AND id = :id")
                .param("tenantId", handle.tenantId())
                .param("id", documentId)
                .query(ROW_MAPPER)
                .optional());
  }

  public List<Document> findByBasket(ConnectionHandle handle, String basketId) {
    return handle.execute(
        jdbc ->
            jdbc.sql(
                    """
                    SELECT * FROM document
                    WHERE tenant_id = :tenantId AND basket_id = :basketId
                    ORDER BY created_at, id
                    """)
                .param("tenantId", handle.tenantId())
                .param("basketId", basketId)
                .query(ROW_MAPPER)
                .list());
  }

  private static Document mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Document(
        rs.getString("id"),
        rs.getString("basket_id"),
        rs.getString("tenant_id"),
        rs.getString("name"),
        rs.getString("extension"),
        rs.getString("storage_path"),
        rs.getString("created_by"),
        rs.getTimestamp("created_at").toInstant());
  }
}
