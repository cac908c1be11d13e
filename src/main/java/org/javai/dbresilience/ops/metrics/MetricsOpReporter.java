package org.javai.dbresilience.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import org.javai.dbresilience.Failure;
import org.javai.dbresilience.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.executeQuery.orders","attemptNumber":1,"maxAttempts":3,"reason":"connection_failure","sqlState":"08006"}
 * }</pre>
 *
 * <p>The tracking key is {@code operation.resource}, prefixed with the namespace if one is set.
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.dbresilience.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsOpReporter with no namespace and the default logger.
	 */
	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(Failure failure) {
		try {
			ObjectNode event = baseEvent(failure.isTransient() ? "retry_exhausted" : "failure", failure);
			event.put("totalAttempts", failure.attempts());
			event.put("type", failure.classification().type().name());
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException | RuntimeException e) {
			// Reporting should not break the application
		}
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, int maxAttempts) {
		try {
			ObjectNode event = baseEvent("retry_attempt", failure);
			event.put("attemptNumber", attemptNumber);
			event.put("maxAttempts", maxAttempts);
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException | RuntimeException e) {
			// Reporting should not break the application
		}
	}

	@Override
	public void reportBackoff(Failure failure, int attemptNumber, Duration delay) {
		try {
			ObjectNode event = baseEvent("backoff", failure);
			event.put("attemptNumber", attemptNumber);
			event.put("delayMs", delay.toMillis());
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException | RuntimeException e) {
			// Reporting should not break the application
		}
	}

	private ObjectNode baseEvent(String eventType, Failure failure) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", buildTrackingKey(failure));
		event.put("reason", failure.classification().reason());
		failure.diagnosticCode().ifPresent(code -> event.put("sqlState", code));
		return event;
	}

	String buildTrackingKey(Failure failure) {
		String key = failure.operation() + "." + failure.resource();
		if (namespace == null) {
			return key;
		}
		return namespace + "." + key;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
