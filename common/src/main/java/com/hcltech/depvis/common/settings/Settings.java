package com.hcltech.depvis.common.settings;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Layered key lookup: environment variable, then system property, then classpath defaults.
 * A key {@code depvis.tree.style} is looked up in the environment as {@code DEPVIS_TREE_STYLE}.
 */
public final class Settings {

    private final Properties defaults;
    private final EnvGetter env;
    private final Properties system;

    public Settings(Properties defaults, EnvGetter env, Properties system) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.env = Objects.requireNonNull(env, "env");
        this.system = Objects.requireNonNull(system, "system");
    }

    /** Defaults from {@code resourceName} on the classpath (empty if absent), real env and system properties. */
    public static Settings fromClasspath(String resourceName) {
        return new Settings(loadProperties(resourceName), EnvGetter.env, System.getProperties());
    }

    public static Properties loadProperties(String resourceName) {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = Settings.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resourceName)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return props;
    }

    public String get(String key, String def) {
        String fromEnv = env.get(toEnvKey(key));
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        String fromSystem = system.getProperty(key);
        if (fromSystem != null && !fromSystem.isBlank()) return fromSystem.trim();
        String fromDefaults = defaults.getProperty(key);
        return fromDefaults != null && !fromDefaults.isBlank() ? fromDefaults.trim() : def;
    }

    /** Enum constant named by the value, case-insensitive; {@code '-'} is read as {@code '_'}. */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E def) {
        String raw = get(key, null);
        if (raw == null) return def;
        String name = raw.toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }

    static String toEnvKey(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }
}
