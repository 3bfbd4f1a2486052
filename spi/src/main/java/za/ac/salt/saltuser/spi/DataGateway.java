package za.ac.salt.saltuser.spi;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Map;

/**
 * Read access to the SALT science database, which is the only source of the facts users' roles and permissions are
 * derived from. The database and its schema are owned elsewhere; implementations of this interface are responsible
 * for connections, timeouts and any retry policy.
 */
public interface DataGateway {

    /**
     * Executes a read-only query and decodes every row of its result.
     * <p>
     * Parameters are referenced by name in the query ({@code :userId}). Implementations must bind them rather than
     * interpolate them into the query text, and must expand collection values used in {@code IN (:codes)} clauses.
     *
     * @param sql        the query
     * @param parameters the named parameters
     * @param rowMapper  decoder for a single row
     * @param <T>        the type each row is decoded to
     * @return the decoded rows, in query order. Never null.
     * @throws DataAccessException if the query cannot be executed
     */
    <T> List<T> query(String sql, Map<String, ?> parameters, RowMapper<T> rowMapper) throws DataAccessException;
}
