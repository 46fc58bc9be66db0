package com.bingohub.realtime.connection;

import com.bingohub.realtime.support.InMemoryBroadcastBus;
import com.bingohub.realtime.support.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionManagerTest {

    private ManualEventLoop loop;
    private InMemoryBroadcastBus.Endpoint endpoint;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        endpoint = new InMemoryBroadcastBus().endpoint();
        manager = new ConnectionManager(endpoint, loop, ConnectionSettings.defaults());
    }

    @Test
    void connectIsIdempotentPerSession() {
        SessionConnection a = manager.connect("s1");
        SessionConnection b = manager.connect("s1");
        loop.drain();

        assertSame(a, b);
        // calls + claims 两个频道各打开一次
        assertEquals(2, endpoint.openCalls());
        assertTrue(manager.status("s1").isConnected());
    }

    @Test
    void releaseUnregistersAndNextConnectCreatesFreshConnection() {
        SessionConnection first = manager.connect("s1");
        loop.drain();

        manager.release("s1");
        loop.drain();
        assertTrue(manager.find("s1").isEmpty());
        assertEquals(ConnectionState.DISCONNECTED, first.status().state());

        SessionConnection second = manager.connect("s1");
        loop.drain();
        assertNotSame(first, second);
        assertTrue(second.status().isConnected());
    }

    @Test
    void connectRightAfterReleaseNeverReturnsTheClosingConnection() {
        SessionConnection first = manager.connect("s1");
        loop.drain();

        manager.release("s1");
        SessionConnection second = manager.connect("s1");
        loop.drain();

        assertNotSame(first, second);
        assertEquals(ConnectionState.DISCONNECTED, first.status().state());
        assertTrue(second.status().isConnected());
        assertSame(second, manager.find("s1").orElseThrow());
    }

    @Test
    void unknownSessionReportsInitialStatus() {
        assertEquals(ConnectionStatus.initial(), manager.status("nobody"));
    }

    @Test
    void rejectsBlankSessionId() {
        assertThrows(IllegalArgumentException.class, () -> manager.connect(" "));
    }

    @Test
    void closeShutsEveryConnection() {
        SessionConnection a = manager.connect("s1");
        SessionConnection b = manager.connect("s2");
        loop.drain();

        manager.close();
        loop.drain();

        assertEquals(ConnectionState.DISCONNECTED, a.status().state());
        assertEquals(ConnectionState.DISCONNECTED, b.status().state());
        assertTrue(manager.find("s1").isEmpty());
        assertTrue(manager.find("s2").isEmpty());
    }
}
