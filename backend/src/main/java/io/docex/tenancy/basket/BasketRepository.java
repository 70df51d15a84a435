package io.docex.tenancy.basket;

import io.docex.tenancy.exception.ResourceConflictException;
import io.docex.tenancy.multitenancy.ConnectionHandle;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Basket rows of the tenant behind a {@link ConnectionHandle}. Every statement filters on the
 * handle's tenant id, which is what separates row-level tenants sharing one schema.
 */
@Repository
public class BasketRepository {

  private static final RowMapper<Basket> ROW_MAPPER = BasketRepository::mapRow;

  public Basket insert(ConnectionHandle handle, Basket basket) {
    try {
      handle.execute(
          jdbc ->
              jdbc.sql(
                      """
                      INSERT INTO docbasket (id, tenant_id, name, description, storage_path,
                          created_by, created_at)
                      VALUES (:id, :tenantId, :name, :description, :storagePath, :createdBy,
                          :createdAt)
                      """)
                  .param("id", basket.id())
                  .param("tenantId", handle.tenantId())
                  .param("name", basket.name())
                  .param("description", basket.description())
                  .param("storagePath", basket.storagePath())
                  .param("createdBy", basket.createdBy())
                  .param("createdAt", Timestamp.from(basket.createdAt()))
                  .update());
    } catch (DuplicateKeyException e) {
      throw new ResourceConflictException(
          "Basket already exists", "A basket named '" + basket.name() + "' already exists", e);
    }
    return basket;
  }

  public Optional<Basket> findById(ConnectionHandle handle, String basketId) {
    return handle.execute(
        jdbc ->
            jdbc.sql("SELECT * FROM docbasket WHERE tenant_id = :tenantId AND id = :id")
                .param("tenantId", handle.tenantId())
                .param("id", basketId)
                .query(ROW_MAPPER)
                .optional());
  }

  public Optional<Basket> findByName(ConnectionHandle handle, String name) {
    return handle.execute(
        jdbc ->
            jdbc.sql("SELECT * FROM docbasket WHERE tenant_id = :tenantId AND name = :name")
                .param("tenantId", handle.tenantId())
                .param("name", name)
                .query(ROW_MAPPER)
                .optional());
  }

  public List<Basket> findAll(ConnectionHandle handle) {
    return handle.execute(
        jdbc ->
            jdbc.sql("SELECT * FROM docbasket WHERE tenant_id = :tenantId ORDER BY created_at, id")
                .param("tenantId", handle.tenantId())
                .query(ROW_MAPPER)
                .list());
  }

  private static Basket mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Basket(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("storage_path"),
        rs.getString("created_by"),
        rs.getTimestamp("created_at").toInstant());
  }
}
