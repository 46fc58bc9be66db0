package com.bingohub.realtime.connection;

import com.bingohub.realtime.error.TransportException;
import com.bingohub.realtime.protocol.EventCodec;
import com.bingohub.realtime.protocol.EventEnvelope;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.NumberCalledPayload;
import com.bingohub.realtime.support.InMemoryBroadcastBus;
import com.bingohub.realtime.support.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionConnectionTest {

    private static final String CALLS = "bingo:v1:session:s1:calls";

    private ManualEventLoop loop;
    private InMemoryBroadcastBus bus;
    private InMemoryBroadcastBus.Endpoint endpoint;
    private ConnectionManager manager;
    private final List<ConnectionState> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        bus = new InMemoryBroadcastBus();
        endpoint = bus.endpoint();
        ConnectionSettings settings = new ConnectionSettings(new BackoffPolicy(1000, 4000, 3), 1000, 2500, "bingo:v1");
        manager = new ConnectionManager(endpoint, loop, settings);
    }

    private SessionConnection connect() {
        SessionConnection conn = manager.connect("s1");
        conn.onStatusChange((prev, cur) -> transitions.add(cur.state()));
        return conn;
    }

    @Test
    void connectsAndDeliversEventsInOrder() {
        SessionConnection conn = connect();
        List<Integer> received = new ArrayList<>();
        conn.subscribe(EventType.NUMBER_CALLED, env -> received.add(env.payloadAs(NumberCalledPayload.class).getNumber()));
        loop.drain();

        assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED), transitions);
        for (int n : new int[]{7, 23, 41}) {
            loop.join(conn.publish(EventType.NUMBER_CALLED, new NumberCalledPayload(n, null, "s1", loop.now(), 0L)));
        }
        loop.drain();
        assertEquals(List.of(7, 23, 41), received);
    }

    @Test
    void publishFailsFastWhenNotConnected() {
        SessionConnection conn = connect();
        CompletableFuture<Void> f = conn.publish(EventType.HEARTBEAT, null);
        CompletionException ex = assertThrows(CompletionException.class, f::join);
        assertInstanceOf(TransportException.class, ex.getCause());
    }

    @Test
    void retriesWithExponentialBackoffThenErrors() {
        endpoint.failNextOpens(1000);
        long start = loop.now();
        SessionConnection conn = connect();
        loop.drain();

        assertEquals(ConnectionState.DISCONNECTED, conn.status().state());
        assertEquals(1, conn.status().retryCount());
        assertEquals(start + 1000, conn.status().nextRetryAt());

        loop.advance(999);
        assertEquals(ConnectionState.DISCONNECTED, conn.status().state());
        assertEquals(1, conn.status().retryCount());

        loop.advance(1);
        assertEquals(2, conn.status().retryCount());
        assertEquals(loop.now() + 2000, conn.status().nextRetryAt());

        loop.advance(2000);
        assertEquals(3, conn.status().retryCount());
        assertEquals(loop.now() + 4000, conn.status().nextRetryAt());

        loop.advance(4000);
        assertEquals(ConnectionState.ERROR, conn.status().state());

        // error 不会自行恢复
        loop.advance(60_000);
        assertEquals(ConnectionState.ERROR, conn.status().state());
        assertEquals(0, loop.pendingTimers());
    }

    @Test
    void explicitReconnectRecoversFromError() {
        endpoint.failNextOpens(1000);
        SessionConnection conn = connect();
        loop.advance(10_000);
        assertEquals(ConnectionState.ERROR, conn.status().state());

        endpoint.failNextOpens(0);
        conn.reconnect();
        loop.drain();

        assertTrue(conn.status().isConnected());
        assertEquals(0, conn.status().retryCount());
    }

    @Test
    void droppedTransportSchedulesReconnect() {
        SessionConnection conn = connect();
        loop.drain();

        endpoint.drop(CALLS);
        loop.drain();
        assertEquals(ConnectionState.DISCONNECTED, conn.status().state());
        assertEquals(1, conn.status().retryCount());

        loop.advance(1000);
        assertTrue(conn.status().isConnected());
        assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED, ConnectionState.DISCONNECTED,
                ConnectionState.CONNECTING, ConnectionState.CONNECTED), transitions);
    }

    @Test
    void heartbeatKeepsHealthyConnectionAlive() {
        SessionConnection conn = connect();
        loop.drain();

        loop.advance(10_000);

        assertTrue(conn.status().isConnected());
        assertEquals(10, bus.published(EventType.HEARTBEAT).size());
    }

    @Test
    void silentSubscriptionTripsLivenessTimeout() {
        SessionConnection conn = connect();
        loop.drain();
        endpoint.deaf(true);

        loop.advance(2000);
        assertTrue(conn.status().isConnected());

        loop.advance(1000);
        assertEquals(ConnectionState.DISCONNECTED, conn.status().state());

        endpoint.deaf(false);
        loop.advance(1000);
        assertTrue(conn.status().isConnected());
    }

    @Test
    void disconnectStopsRetriesAndDelivery() {
        SessionConnection conn = connect();
        List<EventEnvelope> received = new ArrayList<>();
        conn.subscribe(EventType.NUMBER_CALLED, received::add);
        loop.drain();

        conn.disconnect();
        loop.drain();
        assertEquals(ConnectionState.DISCONNECTED, conn.status().state());
        assertEquals(0, loop.pendingTimers());
        assertFalse(endpoint.isOpen(CALLS));

        loop.advance(30_000);
        assertEquals(ConnectionState.DISCONNECTED, conn.status().state());
    }

    @Test
    void dropsEventsAddressedToAnotherSession() {
        SessionConnection conn = connect();
        List<EventEnvelope> received = new ArrayList<>();
        conn.subscribe(EventType.NUMBER_CALLED, received::add);
        loop.drain();

        endpoint.inject(CALLS, EventCodec.encode(EventEnvelope.of(EventType.NUMBER_CALLED, "other",
                new NumberCalledPayload(5, null, "other", 1L, 0L), 1L)));
        endpoint.inject(CALLS, "{not json");
        loop.drain();

        assertTrue(received.isEmpty());
        assertTrue(conn.status().isConnected());
    }

    @Test
    void failingHandlerDoesNotBlockOthers() {
        SessionConnection conn = connect();
        List<Integer> received = new ArrayList<>();
        conn.subscribe(EventType.NUMBER_CALLED, env -> {
            throw new IllegalStateException("boom");
        });
        conn.subscribe(EventType.NUMBER_CALLED, env -> received.add(env.payloadAs(NumberCalledPayload.class).getNumber()));
        loop.drain();

        loop.join(conn.publish(EventType.NUMBER_CALLED, new NumberCalledPayload(9, null, "s1", 1L, null)));
        loop.drain();
        assertEquals(List.of(9), received);
    }

    @Test
    void unsubscribeIsIdempotent() {
        SessionConnection conn = connect();
        List<EventEnvelope> received = new ArrayList<>();
        Registration reg = conn.subscribe(EventType.NUMBER_CALLED, received::add);
        loop.drain();

        reg.unsubscribe();
        reg.unsubscribe();
        loop.join(conn.publish(EventType.NUMBER_CALLED, new NumberCalledPayload(9, null, "s1", 1L, null)));
        loop.drain();
        assertTrue(received.isEmpty());
    }
}
