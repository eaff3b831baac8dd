package win.ixuni.cloudbulk.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Driver configuration
 * <p>
 * Generic configuration of one storage backend. Vendor-specific settings (endpoint,
 * credentials, connection limits) live in {@link #properties}.
 */
@Data
public class DriverConfig {

    /**
     * Driver instance name (unique identifier)
     */
    private String name;

    /**
     * Driver type (s3, azure-blob, gcs, memory)
     */
    private String type;

    /**
     * Whether enabled
     */
    private boolean enabled = true;

    /**
     * Driver-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    public static DriverConfig of(String name, String type, Map<String, Object> properties) {
        DriverConfig config = new DriverConfig();
        config.setName(name);
        config.setType(type);
        if (properties != null) {
            config.getProperties().putAll(properties);
        }
        return config;
    }

    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value == null ? defaultValue : value.toString();
    }

    /**
     * Non-blank string value
     *
     * @throws IllegalArgumentException naming the driver and key when the value is missing
     */
    public String getRequiredString(String key) {
        String value = getString(key, "");
        if (value.isBlank()) {
            throw new IllegalArgumentException(
                    "Driver '" + name + "' (" + type + "): property '" + key + "' must be configured");
        }
        return value;
    }

    // Numeric and boolean getters accept native YAML values or strings; blank means unset

    public Integer getInt(String key, Integer defaultValue) {
        return typed(key, defaultValue, Number::intValue, Integer::valueOf);
    }

    public Long getLong(String key, Long defaultValue) {
        return typed(key, defaultValue, Number::longValue, Long::valueOf);
    }

    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return isUnset(value) ? defaultValue : Boolean.valueOf(value.toString().trim());
    }

    private <T> T typed(String key, T defaultValue, Function<Number, T> fromNumber, Function<String, T> parse) {
        Object value = properties.get(key);
        if (value instanceof Number number) {
            return fromNumber.apply(number);
        }
        return isUnset(value) ? defaultValue : parse.apply(value.toString().trim());
    }

    private static boolean isUnset(Object value) {
        return value == null || value.toString().isBlank();
    }
}
