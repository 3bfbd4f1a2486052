package za.ac.salt.saltuser.support;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import za.ac.salt.saltuser.gateway.JdbcDataGateway;
import za.ac.salt.saltuser.spi.DataGateway;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.UUID;

/**
 * An in-memory Derby database seeded with db/schema.sql and db/data.sql.
 * Every instance is a separate database, so tests may modify the data freely.
 */
public class SaltTestDatabase implements AutoCloseable {
    private static final String DATABASE_DROPPED = "08006";

    public static final long LEADER_ID = 1;
    public static final long CONTACT_ID = 2;
    public static final long PI_007_ID = 3;
    public static final long ADMIN_ID = 4;
    public static final long BOARD_ID = 5;
    public static final long TAC_RSA_ID = 6;
    public static final long TAC_CHAIR_ID = 7;
    public static final long OUTSIDER_ID = 10;

    public static final String LEADER_PASSWORD = "leader-pw";
    public static final String TWIN_PASSWORD = "twin-pw";

    public static final String PROPOSAL_042 = "2023-1-SCI-042";
    public static final String PROPOSAL_007 = "2023-1-SCI-007";
    public static final long BLOCK_OF_042 = 100;
    public static final long BLOCK_OF_007 = 200;

    private final String databaseName = "saltuser" + UUID.randomUUID().toString().replace("-", "");
    private final DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:derby:memory:" + databaseName + ";create=true");

    public SaltTestDatabase() {
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql"), new ClassPathResource("db/data.sql")).execute(dataSource);
    }

    public DataGateway dataGateway() {
        return new JdbcDataGateway(new NamedParameterJdbcTemplate(dataSource), new SimpleMeterRegistry());
    }

    public JdbcTemplate jdbcTemplate() {
        return new JdbcTemplate(dataSource);
    }

    @Override
    public void close() throws SQLException {
        try {
            DriverManager.getConnection("jdbc:derby:memory:" + databaseName + ";drop=true").close();
        } catch (SQLException e) {
            if (!DATABASE_DROPPED.equals(e.getSQLState())) {
                throw e;
            }
        }
    }
}
