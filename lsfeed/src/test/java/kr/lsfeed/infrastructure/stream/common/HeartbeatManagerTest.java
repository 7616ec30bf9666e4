package kr.lsfeed.infrastructure.stream.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HeartbeatManager.
 *
 * Tests:
 * - Periodic ping sending, first ping after one interval
 * - Timeout detection and health callback
 * - Recovery on pong
 * - Failing ping function
 * - Lifecycle: stop and no restart
 */
class HeartbeatManagerTest {

    private HeartbeatManager heartbeat;

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
    }

    @Test
    void testInitialState() {
        AtomicInteger pingCount = new AtomicInteger();
        heartbeat = new HeartbeatManager("test", Duration.ofSeconds(1), Duration.ofSeconds(2),
            pingCount::incrementAndGet, healthy -> {});

        assertEquals(0, pingCount.get(), "No pings sent before start");
        assertNull(heartbeat.getTimeSinceLastPong(), "No pongs received yet");
        assertTrue(heartbeat.isHealthy(), "Healthy until proven otherwise");
        assertFalse(heartbeat.isRunning());
    }

    @Test
    void testPeriodicPingSending() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(100), Duration.ofSeconds(5),
            pingLatch::countDown, healthy -> {});

        heartbeat.start();

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS), "Should send 3 pings within 2 seconds");
    }

    @Test
    void testFirstPingWaitsOneInterval() throws InterruptedException {
        AtomicInteger pingCount = new AtomicInteger();
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(500), Duration.ofSeconds(5),
            pingCount::incrementAndGet, healthy -> {});

        heartbeat.start();
        Thread.sleep(150);

        assertEquals(0, pingCount.get(), "No ping before the first interval elapses");
    }

    @Test
    void testTimeoutMarksUnhealthy() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(50), Duration.ofMillis(100),
            () -> {}, healthy -> {
                if (!healthy) unhealthy.countDown();
            });

        heartbeat.start();

        assertTrue(unhealthy.await(2, TimeUnit.SECONDS), "Missing pong should be reported");
        assertFalse(heartbeat.isHealthy());
    }

    @Test
    void testPongKeepsConnectionHealthy() throws InterruptedException {
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(50), Duration.ofMillis(300),
            () -> heartbeat.recordPong(), changes::add);

        heartbeat.start();
        Thread.sleep(600);

        assertTrue(heartbeat.isHealthy(), "Answered pings keep the connection healthy");
        assertTrue(changes.isEmpty(), "No health change expected: " + changes);
        assertNotNull(heartbeat.getTimeSinceLastPong());
    }

    @Test
    void testRecoveryAfterTimeout() throws InterruptedException {
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        CountDownLatch unhealthy = new CountDownLatch(1);
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(50), Duration.ofMillis(100),
            () -> {}, healthy -> {
                changes.add(healthy);
                if (!healthy) unhealthy.countDown();
            });

        heartbeat.start();
        assertTrue(unhealthy.await(2, TimeUnit.SECONDS));

        heartbeat.recordPong();

        assertTrue(heartbeat.isHealthy(), "Pong should restore health");
        assertEquals(List.of(false, true), changes.subList(0, 2), "Callback fires on each change only");
    }

    @Test
    void testFailingPingMarksUnhealthy() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(50), Duration.ofSeconds(5),
            () -> {
                throw new IllegalStateException("socket gone");
            },
            healthy -> {
                if (!healthy) unhealthy.countDown();
            });

        heartbeat.start();

        assertTrue(unhealthy.await(2, TimeUnit.SECONDS), "Failed ping should be reported");
    }

    @Test
    void testStopHaltsPings() throws InterruptedException {
        AtomicInteger pingCount = new AtomicInteger();
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(50), Duration.ofSeconds(5),
            pingCount::incrementAndGet, healthy -> {});

        heartbeat.start();
        Thread.sleep(200);
        heartbeat.stop();
        int afterStop = pingCount.get();
        Thread.sleep(200);

        assertFalse(heartbeat.isRunning());
        assertEquals(afterStop, pingCount.get(), "No pings after stop");
    }

    @Test
    void testCannotRestartAfterStop() {
        heartbeat = new HeartbeatManager("test", Duration.ofMillis(50), Duration.ofSeconds(5),
            () -> {}, healthy -> {});

        heartbeat.start();
        heartbeat.stop();
        heartbeat.stop();

        assertThrows(IllegalStateException.class, heartbeat::start, "Stopped manager is single-use");
    }
}
