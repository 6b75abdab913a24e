package in.timeos.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Engine settings from environment variables, with system properties as the fallback.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    /**
     * Integer setting. A value that does not parse is logged and replaced by the default.
     */
    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] {}={} is not a number, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Comma-separated set, lower-cased and trimmed. Blank entries are dropped.
     */
    public static Set<String> getSet(String key, Set<String> defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        Set<String> items = new LinkedHashSet<>();
        Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(String::toLowerCase)
            .forEach(items::add);
        return items.isEmpty() ? defaultValue : items;
    }

    private Env() {}
}
