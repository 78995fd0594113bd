package io.lineprofile.analyzer.config;

import java.util.Optional;

/**
 * Source of environment values consulted when a CLI option is omitted.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
