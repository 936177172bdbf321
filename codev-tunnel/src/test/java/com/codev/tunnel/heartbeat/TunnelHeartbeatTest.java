package com.codev.tunnel.heartbeat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.codev.tunnel.support.TestWait;
import io.netty.channel.Channel;
import io.netty.channel.DefaultEventLoop;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class TunnelHeartbeatTest {

    private DefaultEventLoop loop;
    private EmbeddedChannel channel;
    private final AtomicLong currentGeneration = new AtomicLong(1);
    private final AtomicInteger pings = new AtomicInteger();
    private final List<Long> timeouts = new CopyOnWriteArrayList<>();
    private ListAppender<ILoggingEvent> appender;
    private Logger heartbeatLogger;

    @BeforeEach
    void setUp() {
        loop = new DefaultEventLoop();
        channel = new EmbeddedChannel();
        heartbeatLogger = (Logger) LoggerFactory.getLogger(TunnelHeartbeat.class);
        appender = new ListAppender<>();
        appender.start();
        heartbeatLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() throws Exception {
        heartbeatLogger.detachAppender(appender);
        loop.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
        channel.finishAndReleaseAll();
    }

    private TunnelHeartbeat heartbeat(long pingMs, long pongMs, Consumer<Channel> pinger) {
        return new TunnelHeartbeat(loop, pingMs, pongMs, currentGeneration::get, timeouts::add, pinger);
    }

    private void onLoop(Runnable task) throws Exception {
        loop.submit(task).get(2, TimeUnit.SECONDS);
    }

    private long warnings() {
        return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
    }

    @Test
    void acknowledgedPingsKeepTimeoutDisarmedAndStaySilent() throws Exception {
        AtomicReference<TunnelHeartbeat> ref = new AtomicReference<>();
        TunnelHeartbeat heartbeat = heartbeat(50, 100, ch -> {
            pings.incrementAndGet();
            loop.execute(() -> ref.get().onPong(1));
        });
        ref.set(heartbeat);

        onLoop(() -> heartbeat.start(channel, 1));
        Thread.sleep(400);

        assertTrue(pings.get() >= 4, "pings sent: " + pings.get());
        assertTrue(timeouts.isEmpty());
        assertEquals(0, warnings());
        onLoop(heartbeat::stop);
    }

    @Test
    void missingPongFiresTimeoutOnce() throws Exception {
        TunnelHeartbeat heartbeat = heartbeat(50, 30, ch -> pings.incrementAndGet());

        onLoop(() -> heartbeat.start(channel, 1));
        TestWait.until(() -> !timeouts.isEmpty(), Duration.ofSeconds(2), "pong timeout");
        Thread.sleep(200);

        assertEquals(List.of(1L), timeouts);
        AtomicReference<Boolean> active = new AtomicReference<>();
        onLoop(() -> active.set(heartbeat.isActive()));
        assertFalse(active.get());
        assertEquals(1, warnings());
    }

    @Test
    void pongTimeoutLongerThanIntervalStillExpires() throws Exception {
        TunnelHeartbeat heartbeat = heartbeat(50, 120, ch -> pings.incrementAndGet());

        onLoop(() -> heartbeat.start(channel, 1));
        TestWait.until(() -> !timeouts.isEmpty(), Duration.ofSeconds(2), "pong timeout across pings");

        assertEquals(List.of(1L), timeouts);
        assertTrue(pings.get() >= 2, "pings sent: " + pings.get());
    }

    @Test
    void timerOfReplacedTransportIsIgnored() throws Exception {
        TunnelHeartbeat heartbeat = heartbeat(50, 150, ch -> pings.incrementAndGet());

        onLoop(() -> heartbeat.start(channel, 1));
        TestWait.until(() -> pings.get() >= 1, Duration.ofSeconds(2), "first ping");
        // a newer transport took over without the heartbeat being stopped
        currentGeneration.set(2);
        Thread.sleep(400);

        assertTrue(timeouts.isEmpty());
        assertEquals(0, warnings());
        onLoop(heartbeat::stop);
    }

    @Test
    void restartReplacesScheduleInsteadOfDuplicatingIt() throws Exception {
        AtomicReference<TunnelHeartbeat> ref = new AtomicReference<>();
        TunnelHeartbeat heartbeat = heartbeat(100, 1000, ch -> {
            pings.incrementAndGet();
            loop.execute(() -> ref.get().onPong(1));
        });
        ref.set(heartbeat);

        onLoop(() -> {
            heartbeat.start(channel, 1);
            heartbeat.start(channel, 1);
            heartbeat.start(channel, 1);
        });
        Thread.sleep(550);
        onLoop(heartbeat::stop);

        int sent = pings.get();
        assertTrue(sent >= 3 && sent <= 6, "pings sent: " + sent);
    }

    @Test
    void failingPingStillReliesOnArmedTimeout() throws Exception {
        TunnelHeartbeat heartbeat = heartbeat(50, 50, ch -> {
            pings.incrementAndGet();
            throw new IllegalStateException("stream closed");
        });

        onLoop(() -> heartbeat.start(channel, 1));
        TestWait.until(() -> !timeouts.isEmpty(), Duration.ofSeconds(2), "pong timeout after failed ping");

        assertEquals(1L, timeouts.get(0));
    }

    @Test
    void pongForAnotherGenerationDoesNotDisarm() throws Exception {
        AtomicReference<TunnelHeartbeat> ref = new AtomicReference<>();
        TunnelHeartbeat heartbeat = heartbeat(50, 50, ch -> loop.execute(() -> ref.get().onPong(99)));
        ref.set(heartbeat);

        onLoop(() -> heartbeat.start(channel, 1));

        TestWait.until(() -> !timeouts.isEmpty(), Duration.ofSeconds(2), "pong timeout");
    }

    @Test
    void stopCancelsPings() throws Exception {
        TunnelHeartbeat heartbeat = heartbeat(50, 1000, ch -> pings.incrementAndGet());

        onLoop(() -> {
            heartbeat.start(channel, 1);
            heartbeat.stop();
        });
        Thread.sleep(200);

        assertEquals(0, pings.get());
        assertTrue(timeouts.isEmpty());
    }

    @Test
    void inactiveChannelIsNotPinged() throws Exception {
        TunnelHeartbeat heartbeat = heartbeat(50, 50, ch -> pings.incrementAndGet());
        channel.close();

        onLoop(() -> heartbeat.start(channel, 1));
        Thread.sleep(200);
        onLoop(heartbeat::stop);

        assertEquals(0, pings.get());
        assertTrue(timeouts.isEmpty());
    }
}
