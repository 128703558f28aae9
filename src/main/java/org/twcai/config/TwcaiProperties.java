package org.twcai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Data
@ConfigurationProperties(prefix = "twcai")
public class TwcaiProperties {

    private boolean enabled = true;
    private String baseUrl = "https://agent.timeweb.cloud";
    private String token;

    // whole request, connect to last byte; bare numbers are seconds
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ofSeconds(120);

    // connection pool
    private int maxConnections = 200;
    private int maxConnectionsPerRoute = 50;
}
