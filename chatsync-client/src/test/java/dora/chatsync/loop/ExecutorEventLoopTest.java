package dora.chatsync.loop;

import net.jqwik.api.Example;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorEventLoopTest {

    @Example
    void shutdownDropsTimersWithoutWaitingForThem() {
        ExecutorEventLoop loop = new ExecutorEventLoop("loop-test", Clock.systemUTC());
        AtomicBoolean fired = new AtomicBoolean();
        loop.schedule(() -> fired.set(true), Duration.ofSeconds(30));

        long started = System.nanoTime();
        loop.shutdown();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMillis).isLessThan(1000);
        assertThat(loop.isTerminated()).isTrue();
        assertThat(fired).isFalse();
    }

    @Example
    void queuedTasksStillRunOnShutdown() {
        ExecutorEventLoop loop = new ExecutorEventLoop("loop-test", Clock.systemUTC());
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();
        loop.execute(() -> {
            try {
                gate.await(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ran.incrementAndGet();
        });
        loop.execute(ran::incrementAndGet);
        gate.countDown();

        loop.shutdown();

        assertThat(ran).hasValue(2);
    }

    @Example
    void failingTaskDoesNotStopTheLoop() throws InterruptedException {
        ExecutorEventLoop loop = new ExecutorEventLoop("loop-test", Clock.systemUTC());
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });
        loop.execute(done::countDown);

        assertThat(done.await(1, TimeUnit.SECONDS)).isTrue();
        loop.shutdown();
    }
}
