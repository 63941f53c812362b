package io.asyncly.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import io.asyncly.core.computation.Computation;
import io.asyncly.core.execution.Worker;
import io.asyncly.core.execution.WorkerDispatcher;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("AsynclyFactory")
@ExtendWith(MockitoExtension.class)
class AsynclyFactoryTest {

    private AsynclyRuntime runtime;

    @Mock private ExecutorService mockExecutorService;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("runs a trivial computation to completion")
        void shouldRunTrivialComputation() throws Exception {
            runtime = AsynclyFactory.builder().build();

            assertThat(runtime.toList(Computation.of("done"))).containsExactly("done");
        }

        @Test
        @DisplayName("uses defaults when no config is given")
        void shouldUseDefaultConfig() {
            runtime = AsynclyFactory.builder().build();

            assertThat(runtime.getConfig().getThreadCredit()).isEqualTo(AsynclyConfig.UNLIMITED_CREDIT);
            assertThat(runtime.getConfig().getWorkerPoolSize()).isZero();
            assertThat(runtime.getConfig().getWorkerThreadPrefix()).isEqualTo("asyncly-worker");
        }

        @Test
        @DisplayName("shuts down a custom executor on close")
        void shouldShutDownCustomExecutor() {
            runtime = AsynclyFactory.builder().executorService(mockExecutorService).build();

            runtime.close();

            verify(mockExecutorService).shutdown();
        }

        @Test
        @DisplayName("routes workers through a custom dispatcher")
        void shouldUseCustomDispatcher() throws Exception {
            // Given
            AtomicInteger dispatched = new AtomicInteger();
            WorkerDispatcher inline =
                    (worker, work, branch) -> {
                        dispatched.incrementAndGet();
                        new Worker(worker, work, branch).run();
                    };
            runtime = AsynclyFactory.builder().workerDispatcher(inline).build();

            // When
            List<Integer> results = runtime.toList(Computation.each(List.of(1, 2, 3)));

            // Then
            assertThat(results).containsExactlyInAnyOrder(1, 2, 3);
            assertThat(dispatched).hasValue(3);
        }

        @Test
        @DisplayName("rejects an invalid configuration")
        void shouldRejectInvalidConfig() {
            AsynclyConfig config = AsynclyConfig.builder().workerPoolSize(-2).build();

            assertThatThrownBy(() -> AsynclyFactory.builder().config(config).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("workerPoolSize");
        }
    }

    @Nested
    @DisplayName("configuration loading")
    class ConfigLoading {

        @Test
        @DisplayName("reads every key from properties")
        void shouldReadProperties() {
            Properties properties = new Properties();
            properties.setProperty(AsynclyFactory.THREAD_CREDIT_PROPERTY, "4");
            properties.setProperty(AsynclyFactory.WORKER_POOL_SIZE_PROPERTY, " 8 ");
            properties.setProperty(AsynclyFactory.WORKER_THREAD_PREFIX_PROPERTY, "search");

            AsynclyConfig config = AsynclyFactory.loadConfigFromProperties(properties);

            assertThat(config.getThreadCredit()).isEqualTo(4);
            assertThat(config.getWorkerPoolSize()).isEqualTo(8);
            assertThat(config.getWorkerThreadPrefix()).isEqualTo("search");
        }

        @Test
        @DisplayName("reads every key from the environment")
        void shouldReadEnvironment() {
            AsynclyConfig config =
                    AsynclyFactory.loadConfigFromEnvironment(
                            Map.of(
                                    AsynclyFactory.THREAD_CREDIT_ENV, "0",
                                    AsynclyFactory.WORKER_POOL_SIZE_ENV, "2"));

            assertThat(config.getThreadCredit()).isZero();
            assertThat(config.getWorkerPoolSize()).isEqualTo(2);
            assertThat(config.getWorkerThreadPrefix()).isEqualTo("asyncly-worker");
        }

        @Test
        @DisplayName("accepts unlimited as thread credit")
        void shouldAcceptUnlimitedCredit() {
            AsynclyConfig config =
                    AsynclyFactory.loadConfigFromEnvironment(
                            Map.of(AsynclyFactory.THREAD_CREDIT_ENV, "Unlimited"));

            assertThat(config.getThreadCredit()).isEqualTo(AsynclyConfig.UNLIMITED_CREDIT);
        }

        @Test
        @DisplayName("ignores blank values")
        void shouldIgnoreBlankValues() {
            Properties properties = new Properties();
            properties.setProperty(AsynclyFactory.THREAD_CREDIT_PROPERTY, "  ");

            AsynclyConfig config = AsynclyFactory.loadConfigFromProperties(properties);

            assertThat(config.getThreadCredit()).isEqualTo(AsynclyConfig.UNLIMITED_CREDIT);
        }

        @Test
        @DisplayName("names the key holding an invalid number")
        void shouldRejectInvalidNumber() {
            Properties properties = new Properties();
            properties.setProperty(AsynclyFactory.THREAD_CREDIT_PROPERTY, "many");

            assertThatThrownBy(() -> AsynclyFactory.loadConfigFromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid value for asyncly.threads.credit: many");
        }
    }

    @Nested
    @DisplayName("AsynclyConfig")
    class Config {

        @Test
        void shouldRejectCreditBelowUnlimited() {
            AsynclyConfig config = AsynclyConfig.builder().threadCredit(-5).build();

            assertThatThrownBy(config::validate)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("threadCredit");
        }

        @Test
        void shouldRejectBlankThreadPrefix() {
            AsynclyConfig config = AsynclyConfig.builder().workerThreadPrefix(" ").build();

            assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldSwitchBackToUnlimitedCredit() {
            AsynclyConfig config = AsynclyConfig.builder().threadCredit(3).unlimitedCredit().build();

            assertThat(config.getThreadCredit()).isEqualTo(AsynclyConfig.UNLIMITED_CREDIT);
        }
    }
}
