package za.ac.salt.saltuser.gateway;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import za.ac.salt.saltuser.spi.DataGateway;

import javax.sql.DataSource;

@Configuration
@ConfigurationPropertiesScan
public class GatewayConfiguration {

    @Bean
    public NamedParameterJdbcTemplate saltUserJdbcTemplate(DataSource dataSource, GatewayProperties gatewayProperties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) gatewayProperties.getQueryTimeout().toSeconds());
        jdbcTemplate.setFetchSize(gatewayProperties.getFetchSize());
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Bean
    public DataGateway dataGateway(NamedParameterJdbcTemplate saltUserJdbcTemplate, MeterRegistry meterRegistry) {
        return new JdbcDataGateway(saltUserJdbcTemplate, meterRegistry);
    }
}
