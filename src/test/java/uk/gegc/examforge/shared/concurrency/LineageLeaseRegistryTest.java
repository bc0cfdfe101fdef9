package uk.gegc.examforge.shared.concurrency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.examforge.shared.exception.ConflictException;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineageLeaseRegistryTest {

    private final LineageLeaseRegistry registry = new LineageLeaseRegistry();

    @Test
    @DisplayName("runExclusive: releases the lease after success and after failure")
    void runExclusive_releasesLease() {
        UUID id = UUID.randomUUID();

        assertThat(registry.runExclusive(id, () -> "done")).isEqualTo("done");
        assertThat(registry.isLeased(id)).isFalse();

        assertThatThrownBy(() -> registry.runExclusive(id, () -> {
            throw new IllegalStateException("fail");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(registry.isLeased(id)).isFalse();
    }

    @Test
    @DisplayName("runExclusive: different lineages do not block each other")
    void runExclusive_independentLineages() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        String result = registry.runExclusive(first, () -> registry.runExclusive(second, () -> "nested"));

        assertThat(result).isEqualTo("nested");
    }

    @Test
    @DisplayName("runExclusive: a concurrent caller on the same lineage fails fast")
    void runExclusive_concurrentCaller_conflict() throws Exception {
        UUID id = UUID.randomUUID();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> holder = pool.submit(() -> registry.runExclusive(id, () -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "first";
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> registry.runExclusive(id, () -> "second"))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining(id.toString());

            release.countDown();
            assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("first");
            assertThat(registry.isLeased(id)).isFalse();
        } finally {
            pool.shutdownNow();
        }
    }
}
