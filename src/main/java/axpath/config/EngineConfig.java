package axpath.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code axpath.properties} from the classpath and exposes typed engine
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing an {@code axpath.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private static final String CONFIG_FILE       = "axpath.properties";
    private static final String CONFIG_LOCAL_FILE = "axpath.local.properties";

    // Property keys
    private static final String KEY_ANCESTOR_DEPTH    = "identity.ancestor.depth";
    private static final String KEY_PREVIEW_LIMIT     = "resolve.ambiguity.preview.limit";
    private static final String KEY_ACCESSOR_TIMEOUT  = "accessor.timeout.ms";
    private static final String KEY_CAPTURE_MAX_DEPTH = "capture.max.depth";
    private static final String KEY_RETRY_ATTEMPTS    = "retry.max.attempts";
    private static final String KEY_RETRY_DELAY       = "retry.delay.ms";
    private static final String KEY_MAX_SEGMENTS      = "path.validation.max.segments";

    // Defaults
    private static final int  DEFAULT_ANCESTOR_DEPTH    = 5;
    private static final int  DEFAULT_PREVIEW_LIMIT     = 5;
    private static final long DEFAULT_ACCESSOR_TIMEOUT  = 2000L;
    private static final int  DEFAULT_CAPTURE_MAX_DEPTH = 0;
    private static final int  DEFAULT_RETRY_ATTEMPTS    = 3;
    private static final long DEFAULT_RETRY_DELAY       = 250L;
    private static final int  DEFAULT_MAX_SEGMENTS      = 15;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code axpath.local.properties} values override {@code axpath.properties}.
     *
     * @throws IllegalStateException if the base axpath.properties cannot be loaded
     */
    public EngineConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        // Local overrides are optional
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Builds a configuration from an already-populated {@link Properties}
     * instance; keys that are absent fall back to their defaults.
     */
    public EngineConfig(Properties props) {
        this.props = props;
    }

    /** Configuration with every value at its default, without touching the classpath. */
    public static EngineConfig defaults() {
        return new EngineConfig(new Properties());
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Number of ancestor roles mixed into a structural identity (default: 5). */
    public int getIdentityAncestorDepth() {
        return Math.max(0, getInt(KEY_ANCESTOR_DEPTH, DEFAULT_ANCESTOR_DEPTH));
    }

    /** Maximum number of candidates listed in an ambiguity error (default: 5). */
    public int getAmbiguityPreviewLimit() {
        return Math.max(1, getInt(KEY_PREVIEW_LIMIT, DEFAULT_PREVIEW_LIMIT));
    }

    /** Per-call accessor timeout in milliseconds, 0 disables it (default: 2000). */
    public long getAccessorTimeoutMs() {
        return Math.max(0L, getLong(KEY_ACCESSOR_TIMEOUT, DEFAULT_ACCESSOR_TIMEOUT));
    }

    /** Maximum capture depth below the scope root, 0 means unlimited (default: 0). */
    public int getCaptureMaxDepth() {
        return Math.max(0, getInt(KEY_CAPTURE_MAX_DEPTH, DEFAULT_CAPTURE_MAX_DEPTH));
    }

    /** Total attempts made by {@code ResolveRetryPolicy}, including the first (default: 3). */
    public int getRetryMaxAttempts() {
        return Math.max(1, getInt(KEY_RETRY_ATTEMPTS, DEFAULT_RETRY_ATTEMPTS));
    }

    /** Delay between resolution attempts in milliseconds (default: 250). */
    public long getRetryDelayMs() {
        return Math.max(0L, getLong(KEY_RETRY_DELAY, DEFAULT_RETRY_DELAY));
    }

    /** Segment count above which strict validation warns (default: 15). */
    public int getMaxPathSegments() {
        return getInt(KEY_MAX_SEGMENTS, DEFAULT_MAX_SEGMENTS);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
