package pagebind.factory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads {@code pagebind.properties} from the classpath and exposes typed
 * factory settings with defaults.
 *
 * <p>Values can be overridden by a {@code pagebind.local.properties} file on
 * the classpath (higher priority, not committed to VCS).
 */
public class PageObjectConfig {

    private static final Logger log = LoggerFactory.getLogger(PageObjectConfig.class);

    private static final String CONFIG_FILE       = "pagebind.properties";
    private static final String CONFIG_LOCAL_FILE = "pagebind.local.properties";

    // Property keys
    private static final String KEY_UNSUPPORTED_POLICY = "pagebind.unsupported.member.policy";
    private static final String KEY_BIND_SUPERCLASSES  = "pagebind.bind.superclasses";

    // Defaults
    private static final UnsupportedMemberPolicy DEFAULT_UNSUPPORTED_POLICY = UnsupportedMemberPolicy.FAIL;
    private static final boolean                 DEFAULT_BIND_SUPERCLASSES  = true;

    /** What the factory does when a member's type cannot be decorated. */
    public enum UnsupportedMemberPolicy {
        /** Rethrow the {@code UnsupportedMemberTypeException}. */
        FAIL,
        /** Log a warning and leave the member unset. */
        SKIP
    }

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code pagebind.local.properties} values override {@code pagebind.properties}.
     *
     * @throws IllegalStateException if the base pagebind.properties cannot be loaded
     */
    public PageObjectConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Package-private constructor for tests, accepts an already-populated
     * {@link Properties} instance.
     */
    PageObjectConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Policy for members whose type has no supported shape (default: FAIL). */
    public UnsupportedMemberPolicy getUnsupportedMemberPolicy() {
        String raw = props.getProperty(KEY_UNSUPPORTED_POLICY);
        if (raw == null || raw.isBlank()) return DEFAULT_UNSUPPORTED_POLICY;
        try {
            return UnsupportedMemberPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid policy for key '{}': '{}', using default {}",
                    KEY_UNSUPPORTED_POLICY, raw, DEFAULT_UNSUPPORTED_POLICY);
            return DEFAULT_UNSUPPORTED_POLICY;
        }
    }

    /**
     * Whether bindings registered for superclasses of a page also apply to it
     * (default: true).
     */
    public boolean isBindSuperclasses() {
        return getBool(KEY_BIND_SUPERCLASSES, DEFAULT_BIND_SUPERCLASSES);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
