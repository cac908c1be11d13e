package org.javai.dbresilience.profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the standard layered connection configuration.
 *
 * <p>Layers, lowest priority first:
 * <ol>
 *   <li>The classpath resource {@value #BASE_RESOURCE}, if present.</li>
 *   <li>A credentials file named by system property {@value #CREDENTIALS_PROPERTY} or environment
 *       variable {@value #CREDENTIALS_ENV}, defaulting to {@value #DEFAULT_CREDENTIALS_FILE}
 *       in the user's home directory.</li>
 * </ol>
 *
 * <p>A missing layer is skipped. An unreadable credentials file is logged and skipped, so the
 * base layer still applies; an unreadable base resource is a packaging defect and fails.
 */
public final class ConnectionSources {

    public static final String BASE_RESOURCE = "db-resilience.json";
    public static final String CREDENTIALS_PROPERTY = "dbresilience.credentials";
    public static final String CREDENTIALS_ENV = "DB_RESILIENCE_CREDENTIALS";
    public static final String DEFAULT_CREDENTIALS_FILE = ".db-resilience-creds.json";

    private static final Logger LOGGER = LogManager.getLogger(ConnectionSources.class);

    private ConnectionSources() {
    }

    /**
     * Builds the standard layers.
     *
     * @throws IllegalStateException if the classpath base resource exists but cannot be parsed
     */
    public static LayeredConnectionSource standard() {
        return standard(credentialsPath());
    }

    static LayeredConnectionSource standard(Path credentialsPath) {
        List<ConnectionSource> layers = new ArrayList<>();
        try {
            JsonConnectionSource.fromClasspath(BASE_RESOURCE).ifPresent(layers::add);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read classpath resource " + BASE_RESOURCE, e);
        }

        if (Files.isRegularFile(credentialsPath)) {
            try {
                JsonConnectionSource credentials = JsonConnectionSource.fromFile(credentialsPath);
                layers.add(credentials);
                LOGGER.info("Loaded credentials from: {}", credentialsPath);
            } catch (IOException e) {
                LOGGER.error("Error loading credentials file {}: {}. Continuing without it.",
                        credentialsPath, e.getMessage());
            }
        } else {
            LOGGER.warn("Credentials file not found at: {}", credentialsPath);
        }
        return LayeredConnectionSource.of(layers.toArray(new ConnectionSource[0]));
    }

    /**
     * The credentials file location after applying the property and environment overrides.
     */
    public static Path credentialsPath() {
        return ConfigUtils.resolveOptional(CREDENTIALS_PROPERTY, CREDENTIALS_ENV)
                .map(Path::of)
                .orElseGet(() -> Path.of(System.getProperty("user.home"), DEFAULT_CREDENTIALS_FILE));
    }
}
