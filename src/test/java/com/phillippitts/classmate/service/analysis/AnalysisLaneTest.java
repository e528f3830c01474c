package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisLaneTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldRunSubmittedTask() {
        AnalysisLane lane = new AnalysisLane("test", new SyncExecutor(), 2, 1,
                AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        List<String> ran = new CopyOnWriteArrayList<>();

        boolean accepted = lane.submit(() -> ran.add("a"));

        assertThat(accepted).isTrue();
        assertThat(ran).containsExactly("a");
        assertThat(lane.pendingCount()).isZero();
    }

    @Test
    void shouldEvictOldestWhenNewestWins() throws InterruptedException {
        CountDownLatch block = new CountDownLatch(1);
        AnalysisLane lane = new AnalysisLane("question", pool, 1, 1, AnalysisLane.OverflowPolicy.DROP_OLDEST);
        List<String> ran = new CopyOnWriteArrayList<>();
        List<String> dropped = new CopyOnWriteArrayList<>();
        lane.submit(() -> await(block));

        lane.submit(() -> ran.add("second"), () -> dropped.add("second"));
        boolean accepted = lane.submit(() -> ran.add("third"), () -> dropped.add("third"));
        block.countDown();

        assertThat(lane.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(accepted).isTrue();
        assertThat(dropped).containsExactly("second");
        assertThat(ran).containsExactly("third");
    }

    @Test
    void shouldRejectNewestWhenOldestWins() {
        CountDownLatch block = new CountDownLatch(1);
        AnalysisLane lane = new AnalysisLane("answer", pool, 1, 1, AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        List<String> ran = new CopyOnWriteArrayList<>();
        List<String> dropped = new CopyOnWriteArrayList<>();
        lane.submit(() -> await(block));

        lane.submit(() -> ran.add("second"), () -> dropped.add("second"));
        boolean accepted = lane.submit(() -> ran.add("third"), () -> dropped.add("third"));
        block.countDown();

        assertThat(lane.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(accepted).isFalse();
        assertThat(dropped).containsExactly("third");
        assertThat(ran).containsExactly("second");
    }

    @Test
    void shouldCancelPendingButLetRunningFinish() {
        CountDownLatch block = new CountDownLatch(1);
        AnalysisLane lane = new AnalysisLane("summary", pool, 4, 1, AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        List<String> ran = new CopyOnWriteArrayList<>();
        List<String> dropped = new CopyOnWriteArrayList<>();
        lane.submit(() -> {
            await(block);
            ran.add("running");
        });
        lane.submit(() -> ran.add("a"), () -> dropped.add("a"));
        lane.submit(() -> ran.add("b"), () -> dropped.add("b"));

        int cancelled = lane.cancelPending();
        block.countDown();

        assertThat(lane.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(cancelled).isEqualTo(2);
        assertThat(dropped).containsExactly("a", "b");
        assertThat(ran).containsExactly("running");
    }

    @Test
    void shouldBoundConcurrency() throws InterruptedException {
        CountDownLatch block = new CountDownLatch(1);
        AnalysisLane lane = new AnalysisLane("idea", pool, 4, 1, AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        lane.submit(() -> await(block));
        lane.submit(() -> { });

        assertThat(lane.runningCount()).isEqualTo(1);
        assertThat(lane.pendingCount()).isEqualTo(1);
        block.countDown();
        assertThat(lane.awaitIdle(Duration.ofSeconds(2))).isTrue();
    }

    @Test
    void shouldReportTimeoutWhenBusy() {
        CountDownLatch block = new CountDownLatch(1);
        AnalysisLane lane = new AnalysisLane("slow", pool, 1, 1, AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        lane.submit(() -> await(block));

        boolean idle = lane.awaitIdle(Duration.ofMillis(50));
        block.countDown();

        assertThat(idle).isFalse();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
