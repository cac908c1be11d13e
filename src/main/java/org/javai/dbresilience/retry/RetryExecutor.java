package org.javai.dbresilience.retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.dbresilience.Failure;
import org.javai.dbresilience.Outcome;
import org.javai.dbresilience.boundary.FaultTranslator;
import org.javai.dbresilience.boundary.JdbcFaultTranslator;
import org.javai.dbresilience.classify.ErrorClassifier;
import org.javai.dbresilience.classify.FaultKind;
import org.javai.dbresilience.classify.RawFailure;
import org.javai.dbresilience.classify.SqlStateErrorClassifier;
import org.javai.dbresilience.health.HealthValidator;
import org.javai.dbresilience.health.ResourceHandle;
import org.javai.dbresilience.ops.CompositeOpReporter;
import org.javai.dbresilience.ops.OpReporter;
import org.javai.dbresilience.ops.log4j.Log4jOpReporter;
import org.javai.dbresilience.pool.ResourcePool;
import org.javai.dbresilience.profile.ConnectionProfileResolver;
import org.javai.dbresilience.profile.ResourceProfile;

/**
 * Runs operations against a resource with retry on transient failure.
 * Operates entirely over Outcome values: no exception escapes a call.
 *
 * <p>Each attempt resolves the resource profile, acquires a fresh handle from the pool,
 * validates it with a health probe and runs the operation. The handle is released on every exit
 * path. A failed attempt is translated, classified and handed to the {@link RetryPolicy};
 * a permanent failure, or the last permitted attempt, ends the call.
 *
 * <p>Attempts run on the configured executor. Delays between attempts are scheduled, not
 * slept, so no thread is held while backing off.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder(resolver, DataSourceResourcePool.postgres())
 *     .reporter(OpReporter.composite(new Log4jOpReporter(), new MetricsOpReporter("orders")))
 *     .build();
 *
 * Outcome<Long> count = executor.runBlocking("countOrders", "orders", (connection, profile) -> {
 *     try (Statement statement = connection.createStatement()) {
 *         statement.setQueryTimeout((int) profile.operationTimeout().toSeconds());
 *         ResultSet rs = statement.executeQuery("SELECT count(*) FROM orders");
 *         rs.next();
 *         return rs.getLong(1);
 *     }
 * });
 * }</pre>
 */
public final class RetryExecutor {

    static final String HANDLE_UNUSABLE_MESSAGE = "Failed to establish valid database connection";

    private static final Logger LOGGER = LogManager.getLogger(RetryExecutor.class);

    private final ConnectionProfileResolver resolver;
    private final ResourcePool pool;
    private final HealthValidator healthValidator;
    private final FaultTranslator translator;
    private final ErrorClassifier classifier;
    private final RetrySettings settings;
    private final RetryPolicy policy;
    private final OpReporter reporter;
    private final Executor executor;
    private final Delayer delayer;

    private RetryExecutor(Builder builder) {
        this.resolver = builder.resolver;
        this.pool = builder.pool;
        this.healthValidator = builder.healthValidator;
        this.translator = builder.translator;
        this.classifier = builder.classifier;
        this.settings = builder.settings;
        this.policy = builder.policy != null
                ? builder.policy
                : RetryPolicy.exponentialBackoff("exponential-backoff", builder.settings, builder.jitter);
        this.reporter = CompositeOpReporter.of(builder.reporter);
        this.executor = builder.executor != null ? builder.executor : defaultExecutor();
        this.delayer = builder.delayer != null ? builder.delayer : Delayer.scheduled();
    }

    /**
     * Creates a builder for configuring a RetryExecutor.
     *
     * @param resolver resolves resource names to profiles
     * @param pool hands out attempt-scoped handles
     * @return a new builder
     */
    public static Builder builder(ConnectionProfileResolver resolver, ResourcePool pool) {
        return new Builder(resolver, pool);
    }

    public static final class Builder {
        private final ConnectionProfileResolver resolver;
        private final ResourcePool pool;
        private HealthValidator healthValidator = new HealthValidator();
        private FaultTranslator translator = new JdbcFaultTranslator();
        private ErrorClassifier classifier = new SqlStateErrorClassifier();
        private RetrySettings settings = RetrySettings.defaults();
        private RetryPolicy policy;
        private JitterSource jitter = JitterSource.uniform();
        private OpReporter reporter = new Log4jOpReporter();
        private Executor executor;
        private Delayer delayer;

        private Builder(ConnectionProfileResolver resolver, ResourcePool pool) {
            this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
            this.pool = Objects.requireNonNull(pool, "pool must not be null");
        }

        public Builder settings(RetrySettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        /**
         * Replaces the default exponential backoff policy built from the settings.
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public Builder jitter(JitterSource jitter) {
            this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder healthValidator(HealthValidator healthValidator) {
            this.healthValidator = Objects.requireNonNull(healthValidator, "healthValidator must not be null");
            return this;
        }

        public Builder translator(FaultTranslator translator) {
            this.translator = Objects.requireNonNull(translator, "translator must not be null");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the executor attempts run on (optional, defaults to a cached pool of daemon threads).
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        /**
         * Sets how calls wait between attempts (optional, defaults to a scheduled, non-blocking delay).
         */
        public Builder delayer(Delayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }

    /**
     * Runs an operation with retry according to the configured settings.
     *
     * @param operationName The operation name for reporting
     * @param resourceName The logical resource to run against
     * @param operation The work to run on a live connection
     * @return A future of the final Outcome; it never completes exceptionally for an {@link Exception}
     */
    public <T> CompletableFuture<Outcome<T>> run(String operationName, String resourceName, ResourceOperation<T> operation) {
        Objects.requireNonNull(operationName, "operationName must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        Call<T> call = new Call<>(operationName, resourceName, operation);
        return attempt(call, RetryState.idle().start())
                .handle((outcome, error) -> error == null ? outcome : abandoned(call, error));
    }

    /**
     * Runs an operation with retry, waiting for the final Outcome.
     */
    public <T> Outcome<T> runBlocking(String operationName, String resourceName, ResourceOperation<T> operation) {
        return run(operationName, resourceName, operation).join();
    }

    public RetrySettings settings() {
        return settings;
    }

    public ConnectionProfileResolver resolver() {
        return resolver;
    }

    public ResourcePool pool() {
        return pool;
    }

    private <T> CompletableFuture<Outcome<T>> attempt(Call<T> call, RetryState state) {
        CompletableFuture<Outcome<T>> result;
        try {
            result = CompletableFuture.supplyAsync(() -> attemptOnce(call, state), executor);
        } catch (RejectedExecutionException e) {
            call.attempts.set(state.attempt());
            result = CompletableFuture.failedFuture(e);
        }
        return result.thenCompose(outcome -> decide(call, state, outcome));
    }

    private <T> Outcome<T> attemptOnce(Call<T> call, RetryState state) {
        call.attempts.set(state.attempt());

        Outcome<ResourceProfile> profile = resolver.resolve(call.resourceName);
        if (profile instanceof Outcome.Fail<ResourceProfile> fail) {
            return Outcome.fail(fail.failure().withContext(call.operationName, state.attempt()));
        }

        try (ResourceHandle handle = pool.acquire(profile.getOrThrow())) {
            if (!healthValidator.ensureLive(handle, settings.probeTimeout())) {
                return failed(call, state, RawFailure.of(FaultKind.HANDLE_UNUSABLE, HANDLE_UNUSABLE_MESSAGE));
            }
            return Outcome.ok(call.operation.apply(handle.connection(), profile.getOrThrow()));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return failed(call, state, translator.translate(e));
        }
    }

    private <T> CompletableFuture<Outcome<T>> decide(Call<T> call, RetryState state, Outcome<T> result) {
        if (!(result instanceof Outcome.Fail<T> fail)) {
            RetryState done = state.succeeded();
            LOGGER.debug("{} on {} {} after {} attempt(s)", call.operationName, call.resourceName, done.phase(), done.attempt());
            return CompletableFuture.completedFuture(result);
        }

        Failure failure = fail.failure();
        RetryDecision decision = policy.decide(state, failure);
        if (decision instanceof RetryDecision.Retry retry) {
            reporter.reportRetryAttempt(failure, state.attempt(), settings.maxAttempts());
            reporter.reportBackoff(failure, state.attempt(), retry.delay());
            RetryState backingOff = state.backingOff(retry.delay(), failure.cause());
            return delayer.delay(retry.delay())
                    .thenCompose(ignored -> attempt(call, backingOff.nextAttempt()));
        }

        RetryState done = state.failed(failure.cause());
        LOGGER.debug("{} on {} {} after {} attempt(s): {}", call.operationName, call.resourceName,
                done.phase(), done.attempt(), ((RetryDecision.GiveUp) decision).reason());
        reporter.report(failure);
        return CompletableFuture.completedFuture(result);
    }

    private <T> Outcome<T> failed(Call<T> call, RetryState state, RawFailure raw) {
        return Outcome.fail(Failure.of(raw, classifier.classify(raw), state.attempt(), call.operationName, call.resource()));
    }

    private <T> Outcome<T> abandoned(Call<T> call, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof Error fatal) {
            throw fatal;
        }
        LOGGER.warn("{} on {} ended abnormally: {}", call.operationName, call.resourceName, cause.toString());
        RawFailure raw = translator.translate(cause);
        Failure failure = Failure.of(raw, classifier.classify(raw), Math.max(1, call.attempts.get()),
                call.operationName, call.resource());
        reporter.report(failure);
        return Outcome.fail(failure);
    }

    private static ExecutorService defaultExecutor() {
        return Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "db-resilience-attempt-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    private static final class Call<T> {
        private final String operationName;
        private final String resourceName;
        private final ResourceOperation<T> operation;
        private final AtomicInteger attempts = new AtomicInteger(0);

        private Call(String operationName, String resourceName, ResourceOperation<T> operation) {
            this.operationName = operationName;
            this.resourceName = resourceName;
            this.operation = operation;
        }

        private String resource() {
            return String.valueOf(resourceName);
        }
    }
}
