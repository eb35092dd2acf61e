package org.carball.pgmaint.config;

import lombok.Data;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

@Data
public class DatabaseConfig {
    private String url;
    private String user;
    @ToString.Exclude
    private String password;
    private String schema = "public";
    /** Overall time limit per command in seconds; 0 means none. */
    private int timeoutSeconds;

    public Optional<Duration> getTimeout() {
        return timeoutSeconds > 0 ? Optional.of(Duration.ofSeconds(timeoutSeconds)) : Optional.empty();
    }
}
