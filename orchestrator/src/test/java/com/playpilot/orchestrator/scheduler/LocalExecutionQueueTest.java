package com.playpilot.orchestrator.scheduler;

import com.playpilot.orchestrator.config.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/** Real scheduled executor, mocked worker. */
@ExtendWith(MockitoExtension.class)
class LocalExecutionQueueTest {

    @Mock TaskExecutionWorker worker;

    LocalExecutionQueue queue;

    @BeforeEach
    void setUp() {
        queue = new LocalExecutionQueue(worker, TestProperties.defaults());
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    private static JobSpec job(String id) {
        return new JobSpec(id, UUID.randomUUID());
    }

    @Test
    void pastRunAt_runsPromptlyAndIsForgotten() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        doAnswer(inv -> {
            ran.countDown();
            return null;
        }).when(worker).execute(any());

        JobSpec spec = job("now");
        assertThat(queue.enqueue(spec, Instant.now().minusSeconds(5))).isEqualTo("now");

        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        verify(worker).execute(spec);
        // the entry is dropped in the run's finally block
        for (int i = 0; i < 50 && queue.isKnown("now"); i++) {
            Thread.sleep(20);
        }
        assertThat(queue.isKnown("now")).isFalse();
    }

    @Test
    void revokeBeforeStart_workerNeverRuns() throws Exception {
        queue.enqueue(job("later"), Instant.now().plus(Duration.ofMillis(300)));
        assertThat(queue.isKnown("later")).isTrue();

        assertThat(queue.revoke("later")).isTrue();
        assertThat(queue.isKnown("later")).isFalse();

        Thread.sleep(500);
        verifyNoInteractions(worker);
    }

    @Test
    void revokeWhileRunning_refused() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(worker).execute(any());

        queue.enqueue(job("busy"), Instant.now());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(queue.revoke("busy")).isFalse();
        assertThat(queue.isKnown("busy")).isTrue();
        release.countDown();
    }

    @Test
    void revokeUnknown_false() {
        assertThat(queue.revoke("ghost")).isFalse();
        assertThat(queue.isKnown(null)).isFalse();
    }

    @Test
    void duplicateJobId_rejected() {
        queue.enqueue(job("dup"), Instant.now().plusSeconds(60));
        assertThatThrownBy(() -> queue.enqueue(job("dup"), Instant.now().plusSeconds(60)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enqueueAfterShutdown_rejectedAndNotKnown() {
        queue.shutdown();
        assertThatThrownBy(() -> queue.enqueue(job("late"), Instant.now().plusSeconds(60)))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(queue.isKnown("late")).isFalse();
    }
}
