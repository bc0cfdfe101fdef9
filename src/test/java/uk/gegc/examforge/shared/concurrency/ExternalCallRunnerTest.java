package uk.gegc.examforge.shared.concurrency;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.examforge.shared.exception.GenerationException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalCallRunnerTest {

    private ThreadPoolTaskExecutor executor;
    private ExternalCallRunner runner;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.initialize();
        runner = new ExternalCallRunner(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("call: returns the callable's result")
    void call_success() {
        String result = runner.call("echo", Duration.ofSeconds(5), GenerationException.class,
                GenerationException::new, () -> "ok");

        assertThat(result).isEqualTo("ok");
    }

    @Test
    @DisplayName("call: timeout cancels the task and raises the domain exception")
    void call_timeout_cancelsTask() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> runner.call("slow model", Duration.ofMillis(200), GenerationException.class,
                GenerationException::new, () -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                    return "late";
                }))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("slow model timed out");

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("call: domain exceptions from the callable pass through unchanged")
    void call_passThroughException() {
        GenerationException original = new GenerationException("bad json");

        assertThatThrownBy(() -> runner.call("parse", Duration.ofSeconds(5), GenerationException.class,
                GenerationException::new, () -> {
                    throw original;
                }))
                .isSameAs(original);
    }

    @Test
    @DisplayName("call: other exceptions are wrapped with their cause")
    void call_otherException_wrapped() {
        assertThatThrownBy(() -> runner.call("render", Duration.ofSeconds(5), GenerationException.class,
                GenerationException::new, () -> {
                    throw new IllegalStateException("disk full");
                }))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("disk full")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("call: saturated executor rejects the call")
    void call_saturated_rejected() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean ran = new AtomicBoolean();
        executor.submit(() -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        try {
            assertThatThrownBy(() -> runner.call("busy", Duration.ofSeconds(1), GenerationException.class,
                    GenerationException::new, () -> {
                        ran.set(true);
                        return "never";
                    }))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("rejected");
            assertThat(ran).isFalse();
        } finally {
            release.countDown();
        }
    }
}
