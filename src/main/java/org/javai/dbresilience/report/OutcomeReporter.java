package org.javai.dbresilience.report;

import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.dbresilience.Failure;
import org.javai.dbresilience.Outcome;

/**
 * Renders an {@link Outcome} into the stable {@link StructuredResult} shape.
 *
 * <p>Rendering never throws. If anything goes wrong while building the result, the fault is
 * logged and {@link StructuredResult#fallback()} is returned instead.
 */
public final class OutcomeReporter {

    public static final String TRANSIENT_SUGGESTION =
            "This appears to be a transient error. The operation was retried automatically.";
    public static final String PERMANENT_SUGGESTION =
            "This error requires attention and cannot be automatically retried.";

    private static final Logger LOGGER = LogManager.getLogger(OutcomeReporter.class);

    private final UnaryOperator<Object> valueConverter;

    public OutcomeReporter() {
        this(UnaryOperator.identity());
    }

    /**
     * @param valueConverter applied to successful values before they are placed in the result
     */
    public OutcomeReporter(UnaryOperator<Object> valueConverter) {
        this.valueConverter = valueConverter;
    }

    public <T> StructuredResult render(Outcome<T> outcome) {
        try {
            if (outcome instanceof Outcome.Ok<T> ok) {
                return StructuredResult.success(valueConverter.apply(ok.value()));
            }
            Failure failure = ((Outcome.Fail<T>) outcome).failure();
            return StructuredResult.failure(
                    failure.message(),
                    failure.diagnosticCode().orElse(null),
                    failure.isTransient(),
                    failure.isTransient() ? TRANSIENT_SUGGESTION : PERMANENT_SUGGESTION,
                    failure.attempts());
        } catch (RuntimeException e) {
            LOGGER.error("Failed to render outcome {}", outcome, e);
            return StructuredResult.fallback();
        }
    }
}
