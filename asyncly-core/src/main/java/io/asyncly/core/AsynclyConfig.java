package io.asyncly.core;

/// Configuration options for the asyncly runtime.
///
/// Controls the root dispatch credit of every run and the worker thread pool.
/// Use the {@link Builder} for fluent configuration or construct directly with
/// setters for mutable configuration.
///
/// ### Default Values
/// - `threadCredit`: `-1` (unlimited; every alternation point may dispatch)
/// - `workerPoolSize`: `0` (cached pool growing with demand)
/// - `workerThreadPrefix`: `"asyncly-worker"`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended
/// to be configured before passing to {@link AsynclyFactory}. Do not modify after
/// runtime creation.
///
/// @see AsynclyFactory#createRuntime(AsynclyConfig)
/// @see Builder
public class AsynclyConfig {

    /// Value of {@link #getThreadCredit()} meaning no bound on dispatched workers.
    public static final int UNLIMITED_CREDIT = -1;

    private int threadCredit = UNLIMITED_CREDIT;
    private int workerPoolSize = 0;
    private String workerThreadPrefix = "asyncly-worker";

    /// Creates a configuration with default values.
    public AsynclyConfig() {}

    /// Returns the root credit of every run: how many workers may be outstanding
    /// outside any `threads` scope.
    ///
    /// @return the credit, 0 for fully inline runs, {@link #UNLIMITED_CREDIT} for no bound
    public int getThreadCredit() {
        return threadCredit;
    }

    /// Sets the root credit of every run.
    ///
    /// @param threadCredit credit, 0 or more, or {@link #UNLIMITED_CREDIT}
    public void setThreadCredit(int threadCredit) {
        this.threadCredit = threadCredit;
    }

    /// Returns the size of the worker thread pool.
    ///
    /// @return the fixed pool size, or 0 for a cached pool
    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    /// Sets the size of the worker thread pool.
    ///
    /// ### Contracts
    /// - **Precondition**: `workerPoolSize` must not be negative
    ///
    /// @param workerPoolSize the fixed pool size, or 0 for a cached pool
    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    /// Returns the name prefix of worker threads.
    ///
    /// @return the prefix, never null
    public String getWorkerThreadPrefix() {
        return workerThreadPrefix;
    }

    public void setWorkerThreadPrefix(String workerThreadPrefix) {
        this.workerThreadPrefix = workerThreadPrefix;
    }

    /// Checks the configured values.
    ///
    /// @throws IllegalArgumentException if a value is out of range
    public void validate() {
        if (threadCredit < UNLIMITED_CREDIT) {
            throw new IllegalArgumentException(
                    "threadCredit must be 0 or more, or -1 for unlimited: " + threadCredit);
        }
        if (workerPoolSize < 0) {
            throw new IllegalArgumentException("workerPoolSize must not be negative: " + workerPoolSize);
        }
        if (workerThreadPrefix == null || workerThreadPrefix.isBlank()) {
            throw new IllegalArgumentException("workerThreadPrefix must not be blank");
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link AsynclyConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final AsynclyConfig config = new AsynclyConfig();

        /// Sets the root credit of every run.
        ///
        /// @param threadCredit credit, 0 or more, or {@link #UNLIMITED_CREDIT}
        /// @return this builder for chaining, never null
        public Builder threadCredit(int threadCredit) {
            config.threadCredit = threadCredit;
            return this;
        }

        /// Removes the bound on dispatched workers.
        ///
        /// @return this builder for chaining, never null
        public Builder unlimitedCredit() {
            config.threadCredit = UNLIMITED_CREDIT;
            return this;
        }

        /// Sets the worker pool size, 0 for a cached pool.
        ///
        /// @return this builder for chaining, never null
        public Builder workerPoolSize(int workerPoolSize) {
            config.workerPoolSize = workerPoolSize;
            return this;
        }

        /// @return this builder for chaining, never null
        public Builder workerThreadPrefix(String workerThreadPrefix) {
            config.workerThreadPrefix = workerThreadPrefix;
            return this;
        }

        /// Builds and returns the configured {@link AsynclyConfig} instance.
        ///
        /// @return the configured instance, never null
        public AsynclyConfig build() {
            return config;
        }
    }
}
