package io.asyncly.core;

import io.asyncly.core.execution.ExecutionListener;
import io.asyncly.core.execution.ExecutorWorkerDispatcher;
import io.asyncly.core.execution.RunLoop;
import io.asyncly.core.execution.WorkerDispatcher;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring asyncly runtimes.
///
/// Provides static factory methods and a fluent {@link Builder} for constructing
/// fully configured {@link AsynclyRuntime} instances.
///
/// ### Usage Patterns
///
/// **Quick start with environment variables**:
/// {@snippet :
/// var runtime = AsynclyFactory.createRuntime();
/// }
///
/// **Builder with explicit components**:
/// {@snippet :
/// var runtime = AsynclyFactory.builder()
///     .config(AsynclyFactory.loadConfig(properties))
///     .listener(metricsListener)
///     .build();
/// }
///
/// ### Configuration Keys
/// | Property | Environment variable | Meaning |
/// |---|---|---|
/// | `asyncly.threads.credit` | `ASYNCLY_THREAD_CREDIT` | root credit, `-1` or `unlimited` for no bound |
/// | `asyncly.workers.pool-size` | `ASYNCLY_WORKER_POOL_SIZE` | fixed worker pool size, `0` for cached |
/// | `asyncly.workers.thread-prefix` | `ASYNCLY_WORKER_THREAD_PREFIX` | worker thread name prefix |
///
/// @implNote This is a utility class with only static methods.
///
/// @see AsynclyRuntime
/// @see AsynclyConfig
public final class AsynclyFactory {

    private static final Logger logger = Logger.getLogger(AsynclyFactory.class.getName());

    public static final String THREAD_CREDIT_PROPERTY = "asyncly.threads.credit";
    public static final String WORKER_POOL_SIZE_PROPERTY = "asyncly.workers.pool-size";
    public static final String WORKER_THREAD_PREFIX_PROPERTY = "asyncly.workers.thread-prefix";

    public static final String THREAD_CREDIT_ENV = "ASYNCLY_THREAD_CREDIT";
    public static final String WORKER_POOL_SIZE_ENV = "ASYNCLY_WORKER_POOL_SIZE";
    public static final String WORKER_THREAD_PREFIX_ENV = "ASYNCLY_WORKER_THREAD_PREFIX";

    private AsynclyFactory() {}

    /// Creates a runtime configured from environment variables.
    ///
    /// @return a fully configured runtime, never null
    /// @see #loadConfigFromEnvironment()
    public static AsynclyRuntime createRuntime() {
        return createRuntime(loadConfigFromEnvironment());
    }

    /// Creates a runtime with the given configuration.
    ///
    /// @param config configuration options, not null
    /// @return a fully configured runtime, never null
    public static AsynclyRuntime createRuntime(AsynclyConfig config) {
        return builder().config(config).build();
    }

    /// Loads configuration from the process environment.
    ///
    /// @return configuration with defaults for unset variables, never null
    /// @throws IllegalArgumentException if a variable holds an invalid value
    public static AsynclyConfig loadConfigFromEnvironment() {
        return loadConfigFromEnvironment(System.getenv());
    }

    /// Loads configuration from the given environment map.
    ///
    /// @param environment environment variables, not null
    /// @return configuration with defaults for unset variables, never null
    public static AsynclyConfig loadConfigFromEnvironment(Map<String, String> environment) {
        AsynclyConfig config = new AsynclyConfig();
        apply(config, THREAD_CREDIT_ENV, environment.get(THREAD_CREDIT_ENV));
        apply(config, WORKER_POOL_SIZE_ENV, environment.get(WORKER_POOL_SIZE_ENV));
        apply(config, WORKER_THREAD_PREFIX_ENV, environment.get(WORKER_THREAD_PREFIX_ENV));
        return config;
    }

    /// Loads configuration from properties.
    ///
    /// @param properties properties using the `asyncly.*` keys, not null
    /// @return configuration with defaults for unset keys, never null
    /// @throws IllegalArgumentException if a property holds an invalid value
    public static AsynclyConfig loadConfigFromProperties(Properties properties) {
        return loadConfig(new AsynclyConfig(), properties);
    }

    /// Loads configuration from the environment, then lets properties override it.
    ///
    /// @param properties properties using the `asyncly.*` keys, not null
    /// @return merged configuration, never null
    public static AsynclyConfig loadConfig(Properties properties) {
        return loadConfig(loadConfigFromEnvironment(), properties);
    }

    private static AsynclyConfig loadConfig(AsynclyConfig config, Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        apply(config, THREAD_CREDIT_PROPERTY, properties.getProperty(THREAD_CREDIT_PROPERTY));
        apply(config, WORKER_POOL_SIZE_PROPERTY, properties.getProperty(WORKER_POOL_SIZE_PROPERTY));
        apply(
                config,
                WORKER_THREAD_PREFIX_PROPERTY,
                properties.getProperty(WORKER_THREAD_PREFIX_PROPERTY));
        return config;
    }

    private static void apply(AsynclyConfig config, String key, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return;
        }
        String value = rawValue.trim();
        switch (key) {
            case THREAD_CREDIT_PROPERTY, THREAD_CREDIT_ENV -> config.setThreadCredit(
                    "unlimited".equalsIgnoreCase(value)
                            ? AsynclyConfig.UNLIMITED_CREDIT
                            : parseInt(key, value));
            case WORKER_POOL_SIZE_PROPERTY, WORKER_POOL_SIZE_ENV -> config.setWorkerPoolSize(
                    parseInt(key, value));
            case WORKER_THREAD_PREFIX_PROPERTY, WORKER_THREAD_PREFIX_ENV -> config.setWorkerThreadPrefix(
                    value);
            default -> throw new IllegalArgumentException("Unknown configuration key: " + key);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link AsynclyRuntime} instances with
    /// fine-grained control.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private AsynclyConfig config = new AsynclyConfig();
        private ExecutorService executorService;
        private WorkerDispatcher workerDispatcher;
        private ExecutionListener listener = ExecutionListener.NOOP;

        /// Sets the configuration options.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(AsynclyConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the pool workers run on instead of one created from the configuration.
        ///
        /// The runtime shuts it down on close.
        ///
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Sets a custom worker dispatcher. When set, no worker pool is created.
        ///
        /// @return this builder for chaining, never null
        public Builder workerDispatcher(WorkerDispatcher workerDispatcher) {
            this.workerDispatcher = workerDispatcher;
            return this;
        }

        /// Sets the listener receiving run lifecycle callbacks.
        ///
        /// @return this builder for chaining, never null
        public Builder listener(ExecutionListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /// Builds the runtime.
        ///
        /// @return a fully configured runtime, never null
        /// @throws IllegalArgumentException if the configuration is invalid
        public AsynclyRuntime build() {
            config.validate();

            ExecutorService workers = executorService;
            WorkerDispatcher dispatcher = workerDispatcher;
            if (dispatcher == null) {
                if (workers == null) {
                    workers = createWorkerExecutor(config);
                }
                dispatcher = new ExecutorWorkerDispatcher(workers);
            }
            ExecutorService drivers =
                    Executors.newCachedThreadPool(
                            new NamedThreadFactory(config.getWorkerThreadPrefix() + "-driver"));

            logger.info(
                    "Created asyncly runtime (threadCredit="
                            + (config.getThreadCredit() < 0 ? "unlimited" : config.getThreadCredit())
                            + ", workerPoolSize="
                            + config.getWorkerPoolSize()
                            + ")");
            RunLoop runLoop = new RunLoop(dispatcher, listener, config.getThreadCredit());
            return new AsynclyRuntime(config, runLoop, workers, drivers);
        }

        private static ExecutorService createWorkerExecutor(AsynclyConfig config) {
            ThreadFactory threads = new NamedThreadFactory(config.getWorkerThreadPrefix());
            return config.getWorkerPoolSize() > 0
                    ? Executors.newFixedThreadPool(config.getWorkerPoolSize(), threads)
                    : Executors.newCachedThreadPool(threads);
        }
    }

    /// Daemon threads named `prefix-N`.
    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
