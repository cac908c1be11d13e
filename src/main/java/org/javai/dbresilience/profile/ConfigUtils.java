package org.javai.dbresilience.profile;

import java.util.Optional;

/**
 * Shared configuration lookups.
 */
public final class ConfigUtils {

	private ConfigUtils() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable.
	 * The system property wins when both are set.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value, or empty if neither is set
	 */
	public static Optional<String> resolveOptional(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}
}
