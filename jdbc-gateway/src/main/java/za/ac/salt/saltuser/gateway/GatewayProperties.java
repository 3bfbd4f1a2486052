package za.ac.salt.saltuser.gateway;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "saltuser.gateway")
@Validated
public class GatewayProperties {
    /**
     * maximum time a single query may take. Sub-second values are rounded down to whole seconds, and zero means no limit
     */
    @NotNull
    private Duration queryTimeout = Duration.ofSeconds(30);

    /**
     * number of rows fetched from the database per round trip
     */
    @Min(1)
    private int fetchSize = 100;
}
