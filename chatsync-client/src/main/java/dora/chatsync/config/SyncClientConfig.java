package dora.chatsync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dora.chatsync.shared.SyncDestinations;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;

/**
 * Client settings. {@link #load()} reads the {@code sync} section of {@code application.yml};
 * values may be {@code ${ENV_VAR:default}} placeholders and any key can be overridden with a
 * {@code -Dsync.<key>} system property.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class SyncClientConfig {

    static final String DEFAULT_RESOURCE = "application.yml";
    private static final String SECTION = "sync";

    @Builder.Default
    String serverUrl = "ws://localhost:8080/ws";
    @Builder.Default
    String apiUrl = "http://localhost:8080/api";
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);
    @Builder.Default
    Duration reconnectDelay = Duration.ofSeconds(1);
    @Builder.Default
    Duration reconnectDelayMax = Duration.ofSeconds(5);
    @Builder.Default
    double reconnectRandomization = 0.5;
    /** Zero disables the watchdog. */
    @Builder.Default
    Duration pendingTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration typingTtl = Duration.ofSeconds(6);
    @Builder.Default
    int historyPageSize = 50;
    @Builder.Default
    boolean deliveryReceipts = true;
    @Builder.Default
    int protocolVersion = SyncDestinations.PROTOCOL_VERSION;

    public static SyncClientConfig load() {
        return load(DEFAULT_RESOURCE, System::getenv, System.getProperties());
    }

    static SyncClientConfig load(String resource, Function<String, String> env, Properties overrides) {
        JsonNode section = readSection(resource);
        Source source = new Source(section, env, overrides);
        SyncClientConfig defaults = builder().build();

        SyncClientConfig config = builder()
                .serverUrl(source.string("server-url", defaults.serverUrl))
                .apiUrl(source.string("api-url", defaults.apiUrl))
                .connectTimeout(source.millis("connect-timeout-ms", defaults.connectTimeout))
                .reconnectDelay(source.millis("reconnect-delay-ms", defaults.reconnectDelay))
                .reconnectDelayMax(source.millis("reconnect-delay-max-ms", defaults.reconnectDelayMax))
                .reconnectRandomization(source.decimal("reconnect-randomization", defaults.reconnectRandomization))
                .pendingTimeout(source.millis("pending-timeout-ms", defaults.pendingTimeout))
                .typingTtl(source.millis("typing-ttl-ms", defaults.typingTtl))
                .historyPageSize(source.integer("history-page-size", defaults.historyPageSize))
                .deliveryReceipts(source.bool("delivery-receipts", defaults.deliveryReceipts))
                .protocolVersion(source.integer("protocol-version", defaults.protocolVersion))
                .build();
        log.info("Sync client configuration: server {}, api {}", config.serverUrl, config.apiUrl);
        return config;
    }

    private static JsonNode readSection(String resource) {
        try (InputStream is = SyncClientConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("{} not found on the classpath, using defaults", resource);
                return null;
            }
            JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(is);
            return root != null ? root.get(SECTION) : null;
        } catch (IOException e) {
            log.warn("Failed to load sync config from {}: {}", resource, e.getMessage());
            return null;
        }
    }

    /**
     * Expands a {@code ${NAME:default}} placeholder; anything else is returned as is.
     */
    static String resolvePlaceholder(String value, Function<String, String> env) {
        if (value == null || !value.startsWith("${") || !value.endsWith("}")) {
            return value;
        }
        String body = value.substring(2, value.length() - 1);
        int colon = body.indexOf(':');
        String name = colon >= 0 ? body.substring(0, colon) : body;
        String fallback = colon >= 0 ? body.substring(colon + 1) : null;
        String resolved = env.apply(name);
        return resolved != null ? resolved : fallback;
    }

    private static final class Source {
        private final JsonNode section;
        private final Function<String, String> env;
        private final Properties overrides;

        Source(JsonNode section, Function<String, String> env, Properties overrides) {
            this.section = section;
            this.env = env;
            this.overrides = overrides;
        }

        String raw(String key) {
            String override = overrides.getProperty(SECTION + "." + key);
            if (override != null) {
                return override;
            }
            if (section == null || !section.hasNonNull(key)) {
                return null;
            }
            String value = resolvePlaceholder(section.get(key).asText(), env);
            return value == null || value.isBlank() ? null : value.trim();
        }

        String string(String key, String fallback) {
            String value = raw(key);
            return value != null ? value : fallback;
        }

        Duration millis(String key, Duration fallback) {
            String value = raw(key);
            return value != null ? Duration.ofMillis(parse(key, value, Long::parseLong)) : fallback;
        }

        int integer(String key, int fallback) {
            String value = raw(key);
            return value != null ? parse(key, value, Integer::parseInt) : fallback;
        }

        double decimal(String key, double fallback) {
            String value = raw(key);
            return value != null ? parse(key, value, Double::parseDouble) : fallback;
        }

        boolean bool(String key, boolean fallback) {
            String value = raw(key);
            return value != null ? Boolean.parseBoolean(value) : fallback;
        }

        private static <T> T parse(String key, String value, Function<String, T> parser) {
            try {
                return parser.apply(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + SECTION + "." + key + ": " + value, e);
            }
        }
    }
}
