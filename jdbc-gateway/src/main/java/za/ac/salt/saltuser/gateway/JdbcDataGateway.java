package za.ac.salt.saltuser.gateway;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import za.ac.salt.saltuser.spi.DataGateway;

import java.util.List;
import java.util.Map;

/**
 * {@link DataGateway} which runs queries through a {@link NamedParameterJdbcTemplate}.
 * Failed queries are counted and logged, and the exception is rethrown unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcDataGateway implements DataGateway {
    public static final String QUERY_TIMER = "saltuser.gateway.query";
    public static final String GATEWAY_ERROR_METRIC = "saltuser-gateway-error";
    public static final String EXCEPTION_TAG = "exception";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    @Override
    public <T> List<T> query(String sql, Map<String, ?> parameters, RowMapper<T> rowMapper) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return jdbcTemplate.query(sql, parameters, rowMapper);
        } catch (DataAccessException e) {
            log.error("Failed to execute query with parameters {}", parameters.keySet(), e);
            meterRegistry.counter(GATEWAY_ERROR_METRIC, EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(QUERY_TIMER));
        }
    }
}
