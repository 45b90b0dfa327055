package com.hcltech.depvis.common.settings;

/**
 * Source of environment values, so tests can supply their own instead of {@link System#getenv(String)}.
 */
@FunctionalInterface
public interface EnvGetter {

    EnvGetter env = System::getenv;

    /** Returns the value of the given variable, or {@code null} if unset. */
    String get(String name);
}
