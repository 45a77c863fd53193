package com.lyshra.open.claims.core.engine.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Builds a {@link ClaimsConfig} from layered sources.
 *
 * <h2>Resolution Order</h2>
 * Later sources override earlier ones:
 * <ol>
 *   <li>Built-in defaults</li>
 *   <li>Classpath resource: lyshra-claims.properties</li>
 *   <li>System properties: lyshra.claims.*</li>
 *   <li>Environment variables: LYSHRA_CLAIMS_* (e.g. LYSHRA_CLAIMS_STORE_TYPE)</li>
 * </ol>
 *
 * Durations accept ISO-8601 ({@code PT5M}) or plain milliseconds. Invalid values
 * are logged and ignored.
 */
@Slf4j
public class ClaimsConfigLoader {

    public static final String DEFAULT_RESOURCE = "lyshra-claims.properties";
    public static final String PROPERTY_PREFIX = "lyshra.claims.";
    public static final String ENV_PREFIX = "LYSHRA_CLAIMS_";

    static final String AGENT_TTL = "agent-ttl";
    static final String HUMAN_TTL = "human-ttl";
    static final String EXPIRY_ENABLED = "expiry.enabled";
    static final String EXPIRY_INTERVAL = "expiry.interval";
    static final String EXPIRY_DEADLINE = "expiry.deadline";
    static final String EXPIRY_AGENT_ACTION = "expiry.agent-action";
    static final String EXPIRY_HUMAN_ACTION = "expiry.human-action";
    static final String ABANDON_POLICY = "abandon-policy";
    static final String MAX_STEAL_COUNT = "max-steal-count";
    static final String STORE_TYPE = "store.type";
    static final String STORE_PATH = "store.path";
    static final String STEALING_ENABLED = "stealing.enabled";
    static final String STEALING_INTERVAL = "stealing.interval";
    static final String STEALING_IDLE_THRESHOLD = "stealing.idle-threshold";
    static final String STEALING_STALE_THRESHOLD = "stealing.stale-threshold";
    static final String STEALING_CROSS_DOMAIN = "stealing.cross-domain";
    static final String STEALING_MAX_PER_CYCLE = "stealing.max-per-cycle";
    static final String STEALING_DEADLINE = "stealing.deadline";

    private final String resourceName;
    private final Properties systemProperties;
    private final Map<String, String> environment;

    public ClaimsConfigLoader() {
        this(DEFAULT_RESOURCE, System.getProperties(), System.getenv());
    }

    public ClaimsConfigLoader(String resourceName, Properties systemProperties, Map<String, String> environment) {
        this.resourceName = resourceName;
        this.systemProperties = systemProperties;
        this.environment = environment;
    }

    /**
     * Loads the configuration from the default sources.
     */
    public static ClaimsConfig loadDefault() {
        return new ClaimsConfigLoader().load();
    }

    /**
     * Resolves every source and validates the result.
     *
     * @throws IllegalStateException if the resolved configuration is invalid
     */
    public ClaimsConfig load() {
        Properties resolved = new Properties();
        resolved.putAll(readResource());
        systemProperties.stringPropertyNames().stream()
                .filter(name -> name.startsWith(PROPERTY_PREFIX))
                .forEach(name -> resolved.setProperty(name.substring(PROPERTY_PREFIX.length()),
                        systemProperties.getProperty(name)));
        for (String key : knownKeys()) {
            String value = environment.get(toEnvName(key));
            if (value != null && !value.isBlank()) {
                resolved.setProperty(key, value);
            }
        }

        ClaimsConfig config = apply(resolved);
        config.validate();
        log.info("Loaded claims configuration: storeType={}, agentTtl={}, humanTtl={}, maxStealCount={}",
                config.getStoreType(), config.getAgentTtl(), config.getHumanTtl(), config.getMaxStealCount());
        return config;
    }

    static String toEnvName(String key) {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private Properties readResource() {
        Properties properties = new Properties();
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", resourceName);
                return properties;
            }
            properties.load(in);
            Properties unprefixed = new Properties();
            properties.stringPropertyNames().forEach(name -> unprefixed.setProperty(
                    name.startsWith(PROPERTY_PREFIX) ? name.substring(PROPERTY_PREFIX.length()) : name,
                    properties.getProperty(name)));
            return unprefixed;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resourceName, e);
        }
    }

    private ClaimsConfig apply(Properties p) {
        ClaimsConfig.ClaimsConfigBuilder claims = ClaimsConfig.builder();
        WorkStealingConfig.WorkStealingConfigBuilder stealing = WorkStealingConfig.builder();

        set(p, AGENT_TTL, ClaimsConfigLoader::parseDuration, claims::agentTtl);
        set(p, HUMAN_TTL, ClaimsConfigLoader::parseDuration, claims::humanTtl);
        ClaimsConfigLoader.<Boolean>set(p, EXPIRY_ENABLED, Boolean::parseBoolean, claims::expiryEnabled);
        set(p, EXPIRY_INTERVAL, ClaimsConfigLoader::parseDuration, claims::expiryCheckInterval);
        set(p, EXPIRY_DEADLINE, ClaimsConfigLoader::parseDuration, claims::expiryCycleDeadline);
        ClaimsConfigLoader.<ExpiryAction>set(p, EXPIRY_AGENT_ACTION, v -> ExpiryAction.valueOf(upper(v)), claims::agentExpiryAction);
        ClaimsConfigLoader.<ExpiryAction>set(p, EXPIRY_HUMAN_ACTION, v -> ExpiryAction.valueOf(upper(v)), claims::humanExpiryAction);
        ClaimsConfigLoader.<AbandonPolicy>set(p, ABANDON_POLICY, v -> AbandonPolicy.valueOf(upper(v)), claims::abandonPolicy);
        ClaimsConfigLoader.<Integer>set(p, MAX_STEAL_COUNT, Integer::parseInt, claims::maxStealCount);
        ClaimsConfigLoader.<StoreType>set(p, STORE_TYPE, v -> StoreType.valueOf(upper(v)), claims::storeType);
        ClaimsConfigLoader.<Path>set(p, STORE_PATH, v -> Paths.get(v), claims::storePath);

        ClaimsConfigLoader.<Boolean>set(p, STEALING_ENABLED, Boolean::parseBoolean, stealing::enabled);
        set(p, STEALING_INTERVAL, ClaimsConfigLoader::parseDuration, stealing::checkInterval);
        set(p, STEALING_IDLE_THRESHOLD, ClaimsConfigLoader::parseDuration, stealing::idleThreshold);
        set(p, STEALING_STALE_THRESHOLD, ClaimsConfigLoader::parseDuration, stealing::staleThreshold);
        ClaimsConfigLoader.<Boolean>set(p, STEALING_CROSS_DOMAIN, Boolean::parseBoolean, stealing::allowCrossDomain);
        ClaimsConfigLoader.<Integer>set(p, STEALING_MAX_PER_CYCLE, Integer::parseInt, stealing::maxStealsPerCycle);
        set(p, STEALING_DEADLINE, ClaimsConfigLoader::parseDuration, stealing::cycleDeadline);

        return claims.workStealing(stealing.build()).build();
    }

    private static <T> void set(Properties p, String key, Function<String, T> parser, Consumer<T> target) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            target.accept(parser.apply(raw.trim()));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.warn("Invalid value for {}: '{}'. Using default.", key, raw);
        }
    }

    static Duration parseDuration(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return Duration.ofMillis(Long.parseLong(value));
        }
        return Duration.parse(value.toUpperCase(Locale.ROOT));
    }

    private static String upper(String value) {
        return value.toUpperCase(Locale.ROOT).replace('-', '_');
    }

    private static String[] knownKeys() {
        return new String[]{
                AGENT_TTL, HUMAN_TTL, EXPIRY_ENABLED, EXPIRY_INTERVAL, EXPIRY_DEADLINE,
                EXPIRY_AGENT_ACTION, EXPIRY_HUMAN_ACTION, ABANDON_POLICY, MAX_STEAL_COUNT,
                STORE_TYPE, STORE_PATH, STEALING_ENABLED, STEALING_INTERVAL, STEALING_IDLE_THRESHOLD,
                STEALING_STALE_THRESHOLD, STEALING_CROSS_DOMAIN, STEALING_MAX_PER_CYCLE, STEALING_DEADLINE
        };
    }
}
