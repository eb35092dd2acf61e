package org.carball.pgmaint.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> env;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Loads thresholds using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public OptimizerThresholds loadThresholds(String yamlPath, String[] args) {
        log.debug("Loading threshold configuration");

        OptimizerThresholds.OptimizerThresholdsBuilder builder = loadThresholdFile(yamlPath).toBuilder();
        applyThresholdEnvironment(builder);
        applyThresholdArguments(builder, args);

        OptimizerThresholds thresholds = builder.build();
        thresholds.validate();
        thresholds.warnOnPolicyOverrides();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Resolves connection settings: CLI args > env vars > defaults. The password is only read from the environment.
     */
    public DatabaseConfig loadDatabaseConfig(String[] args) {
        DatabaseConfig config = new DatabaseConfig();

        if (env.containsKey("PGMAINT_DB_URL")) {
            config.setUrl(env.get("PGMAINT_DB_URL"));
        }
        if (env.containsKey("PGMAINT_DB_USER")) {
            config.setUser(env.get("PGMAINT_DB_USER"));
        }
        if (env.containsKey("PGMAINT_DB_PASSWORD")) {
            config.setPassword(env.get("PGMAINT_DB_PASSWORD"));
        }
        if (env.containsKey("PGMAINT_SCHEMA")) {
            config.setSchema(env.get("PGMAINT_SCHEMA"));
        }
        if (env.containsKey("PGMAINT_TIMEOUT_SECONDS")) {
            parseTimeout("PGMAINT_TIMEOUT_SECONDS", env.get("PGMAINT_TIMEOUT_SECONDS"), config);
        }

        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];
            switch (arg) {
                case "--url":
                    config.setUrl(value);
                    break;
                case "--user":
                    config.setUser(value);
                    break;
                case "--schema":
                    config.setSchema(value);
                    break;
                case "--timeout":
                    parseTimeout(arg, value, config);
                    break;
            }
        }

        log.debug("Database configuration: {}", config);
        return config;
    }

    /**
     * Reads thresholds from a YAML file, falling back to defaults when the file is absent or unreadable.
     */
    OptimizerThresholds loadThresholdFile(String configPath) {
        if (configPath == null || configPath.trim().isEmpty()) {
            return OptimizerThresholds.defaults();
        }

        File configFile = new File(configPath);
        if (!configFile.exists()) {
            log.warn("Threshold config file not found: {}, using defaults", configPath);
            return OptimizerThresholds.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            OptimizerThresholds thresholds = mapper.readValue(configFile, OptimizerThresholds.class);
            log.info("Loaded threshold configuration from: {}", configPath);
            return thresholds;
        } catch (IOException e) {
            log.error("Failed to load threshold config from {}: {}, using defaults", configPath, e.getMessage());
            return OptimizerThresholds.defaults();
        }
    }

    private void applyThresholdEnvironment(OptimizerThresholds.OptimizerThresholdsBuilder builder) {
        try {
            if (env.containsKey("PGMAINT_SLOW_QUERY_THRESHOLD_MS")) {
                builder.slowQueryThresholdMs(Double.parseDouble(env.get("PGMAINT_SLOW_QUERY_THRESHOLD_MS")));
            }
            if (env.containsKey("PGMAINT_SLOW_QUERY_LIMIT")) {
                builder.slowQueryLimit(Integer.parseInt(env.get("PGMAINT_SLOW_QUERY_LIMIT")));
            }
            if (env.containsKey("PGMAINT_REBUILD_DEAD_TUPLE_RATIO")) {
                builder.rebuildDeadTupleRatio(Double.parseDouble(env.get("PGMAINT_REBUILD_DEAD_TUPLE_RATIO")));
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid numeric threshold in environment: {}", e.getMessage());
        }
    }

    private void applyThresholdArguments(OptimizerThresholds.OptimizerThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.slow-query-ms":
                        builder.slowQueryThresholdMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.slow-query-limit":
                        builder.slowQueryLimit(Integer.parseInt(value));
                        break;
                    case "--thresholds.rebuild-ratio":
                        builder.rebuildDeadTupleRatio(Double.parseDouble(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private void parseTimeout(String source, String value, DatabaseConfig config) {
        try {
            config.setTimeoutSeconds(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.slow-query-ms <num>      Mean duration above which a statement is slow (default 1000)
              --thresholds.slow-query-limit <num>   Maximum number of slow statements reported (default 20)
              --thresholds.rebuild-ratio <num>      Dead/live tuple ratio above which indexes are rebuilt (default 0.2)

            Environment Variables:
              PGMAINT_SLOW_QUERY_THRESHOLD_MS       Same as --thresholds.slow-query-ms
              PGMAINT_SLOW_QUERY_LIMIT              Same as --thresholds.slow-query-limit
              PGMAINT_REBUILD_DEAD_TUPLE_RATIO      Same as --thresholds.rebuild-ratio

            YAML file (--thresholds <file>):
              slow_query_threshold_ms, slow_query_limit, rebuild_dead_tuple_ratio

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file
              4. Built-in defaults
            """;
    }
}
