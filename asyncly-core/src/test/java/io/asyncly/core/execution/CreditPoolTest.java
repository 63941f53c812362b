package io.asyncly.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CreditPoolTest {

    @Nested
    class Bounded {

        @Test
        void shouldGrantCreditUpToLimit() {
            CreditPool pool = CreditPool.of(2);

            assertThat(pool.tryAcquire()).isTrue();
            assertThat(pool.tryAcquire()).isTrue();
            assertThat(pool.tryAcquire()).isFalse();
            assertThat(pool.available()).isZero();
            assertThat(pool.outstanding()).isEqualTo(2);
        }

        @Test
        void shouldRestoreCreditOnRelease() {
            CreditPool pool = CreditPool.of(1);
            pool.tryAcquire();

            pool.release();

            assertThat(pool.available()).isEqualTo(1);
            assertThat(pool.tryAcquire()).isTrue();
        }

        @Test
        void shouldNeverGrantCreditWithZeroLimit() {
            CreditPool pool = CreditPool.of(0);

            assertThat(pool.tryAcquire()).isFalse();
            assertThat(pool.available()).isZero();
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, -5, Integer.MIN_VALUE})
        void shouldRejectNegativeLimit(int limit) {
            assertThatThrownBy(() -> CreditPool.of(limit))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("negative");
        }

        @Test
        void shouldRejectReleaseWithoutAcquire() {
            CreditPool pool = CreditPool.of(3);

            assertThatThrownBy(pool::release).isInstanceOf(IllegalStateException.class);
            assertThat(pool.available()).isEqualTo(3);
        }

        @Test
        void shouldNeverExceedLimitUnderContention() throws Exception {
            CreditPool pool = CreditPool.of(3);
            AtomicInteger peak = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Callable<Void>> tasks = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    tasks.add(
                            () -> {
                                for (int round = 0; round < 1_000; round++) {
                                    if (pool.tryAcquire()) {
                                        peak.accumulateAndGet(pool.outstanding(), Math::max);
                                        pool.release();
                                    }
                                }
                                return null;
                            });
                }
                for (Future<Void> future : executor.invokeAll(tasks)) {
                    future.get();
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(peak.get()).isBetween(1, 3);
            assertThat(pool.available()).isEqualTo(3);
        }
    }

    @Nested
    class Unlimited {

        @Test
        void shouldAlwaysGrantCredit() {
            CreditPool pool = CreditPool.unlimited();

            for (int i = 0; i < 1_000; i++) {
                assertThat(pool.tryAcquire()).isTrue();
            }

            assertThat(pool.isUnlimited()).isTrue();
            assertThat(pool.available()).isEqualTo(Integer.MAX_VALUE);
            assertThat(pool.outstanding()).isEqualTo(1_000);
        }
    }
}
