package com.settleworks.core.synchronization;

import com.settleworks.core.TestFixtures;
import com.settleworks.core.economy.TickResult;
import com.settleworks.core.managers.Settlement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SettlementLoopTest {

    private SettlementLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) loop.stop();
    }

    @Test
    void loopDrivesTicksAndPublishesResults() throws InterruptedException {
        Settlement settlement = TestFixtures.settlement();
        CountDownLatch threeTicks = new CountDownLatch(3);
        loop = new SettlementLoop(settlement, 5, r -> threeTicks.countDown());

        loop.start();

        assertTrue(threeTicks.await(5, TimeUnit.SECONDS));
        TickResult last = loop.getLastResult();
        assertNotNull(last);
        assertTrue(last.tick() >= 2);
        assertEquals(0, loop.getFailedTicks());
    }

    @Test
    void submittedTasksRunOnTheLoopThread() throws InterruptedException {
        Settlement settlement = TestFixtures.settlement();
        loop = new SettlementLoop(settlement, 1000, null);
        CountDownLatch done = new CountDownLatch(1);
        String[] threadName = new String[1];

        loop.submit(() -> {
            settlement.registerSettler("late");
            threadName[0] = Thread.currentThread().getName();
            done.countDown();
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals("sw-settlement-loop", threadName[0]);
        assertTrue(settlement.getConsumptionEngine().getSettler("late").isPresent());
    }

    @Test
    void failingTickIsCountedAndLoopSurvives() {
        Settlement settlement = TestFixtures.settlement();
        loop = new SettlementLoop(settlement, 1000, r -> {
            throw new IllegalStateException("listener broke");
        });
        loop.start();

        loop.tickOnce();

        assertEquals(1, loop.getFailedTicks());
        assertTrue(loop.isRunning());
    }

    @Test
    void stopEndsTheLoop() {
        loop = new SettlementLoop(TestFixtures.settlement());
        loop.start();
        loop.stop();

        assertFalse(loop.isRunning());
    }
}
