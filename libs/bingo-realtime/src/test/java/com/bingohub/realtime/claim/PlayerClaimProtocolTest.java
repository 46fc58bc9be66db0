package com.bingohub.realtime.claim;

import com.bingohub.realtime.connection.ConnectionManager;
import com.bingohub.realtime.connection.ConnectionSettings;
import com.bingohub.realtime.connection.SessionConnection;
import com.bingohub.realtime.error.TransportException;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.ClaimSubmittedPayload;
import com.bingohub.realtime.sync.CallSyncEngine;
import com.bingohub.realtime.support.InMemoryBroadcastBus;
import com.bingohub.realtime.support.InMemoryCallStateStore;
import com.bingohub.realtime.support.InMemoryLocalCache;
import com.bingohub.realtime.support.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlayerClaimProtocolTest {

    private static final Ticket TICKET = new Ticket("t-alice", List.of(
            List.of(7, 0, 23, 0, 41, 0, 56, 0, 72),
            List.of(0, 12, 0, 34, 0, 45, 0, 67, 88)));

    private ManualEventLoop loop;
    private InMemoryBroadcastBus bus;
    private InMemoryBroadcastBus.Endpoint playerEndpoint;
    private CallSyncEngine caller;
    private PlayerClaimProtocol player;

    private final List<String> updates = new ArrayList<>();
    private final List<ClaimView> resolved = new ArrayList<>();

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        bus = new InMemoryBroadcastBus();
        InMemoryCallStateStore store = new InMemoryCallStateStore();

        SessionConnection callerConn = new ConnectionManager(bus.endpoint(), loop, ConnectionSettings.defaults()).connect("s1");
        caller = CallSyncEngine.caller(callerConn, store, loop);
        caller.start();
        new CallerClaimProtocol(callerConn, caller, loop, 3000).start();

        playerEndpoint = bus.endpoint();
        SessionConnection playerConn = new ConnectionManager(playerEndpoint, loop, ConnectionSettings.defaults()).connect("s1");
        CallSyncEngine playerSync = CallSyncEngine.player(playerConn, store, new InMemoryLocalCache(), loop);
        playerSync.start();
        AtomicInteger ids = new AtomicInteger();
        player = new PlayerClaimProtocol(playerConn, playerSync, loop, "p-alice", "Alice", () -> "c-" + ids.incrementAndGet());
        player.start();
        player.onClaimUpdated(v -> updates.add(v.status()));
        player.onClaimResolved(resolved::add);
        loop.drain();

        loop.join(caller.changeWinPattern(WinPattern.ONE_LINE));
    }

    private void call(int... numbers) {
        for (int n : numbers) {
            loop.join(caller.callNumber(n));
        }
        loop.drain();
    }

    @Test
    void claimFollowsCallerThroughToValidated() {
        call(7, 23, 41, 56, 72);

        ClaimView submitted = loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));
        assertEquals("c-1", submitted.claimId());
        assertEquals("pending", submitted.status());
        assertEquals(List.of("validating", "valid"), updates);
        assertEquals("valid", loop.join(player.getClaim("c-1")).orElseThrow().status());

        loop.advance(3000);

        assertEquals(List.of("validating", "valid", "validated"), updates);
        assertEquals(1, resolved.size());
        assertEquals("validated", resolved.get(0).status());
        assertEquals("validated", loop.join(player.getClaim("c-1")).orElseThrow().status());
    }

    @Test
    void snapshotCarriesNumbersThePlayerHasSeen() {
        call(7, 23);

        loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));

        ClaimSubmittedPayload payload = bus.published(EventType.CLAIM_SUBMITTED).get(0)
                .payloadAs(ClaimSubmittedPayload.class);
        assertEquals(List.of(7, 23), payload.getTicketSnapshot().getCalledNumbers());
        assertEquals("oneLine", payload.getPattern());
        assertEquals(0L, payload.getGeneration());
    }

    @Test
    void repeatedSubmissionReturnsExistingClaim() {
        call(7, 23, 41, 56, 72);

        ClaimView first = loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));
        ClaimView second = loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));

        assertEquals(first.claimId(), second.claimId());
        assertEquals(1, bus.published(EventType.CLAIM_SUBMITTED).size());
    }

    @Test
    void invalidClaimCarriesReasonAndMayBeResubmitted() {
        call(7, 23, 41, 56);

        ClaimView first = loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));
        loop.drain();

        ClaimView view = loop.join(player.getClaim(first.claimId())).orElseThrow();
        assertEquals("invalid", view.status());
        assertEquals(InvalidReason.PATTERN_INCOMPLETE.code(), view.reasonCode());
        assertEquals(Integer.valueOf(1), view.toGo());
        assertEquals("图案尚未完成，还差 1 个号码", view.reason());

        call(72);
        ClaimView retry = loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));
        assertNotEquals(first.claimId(), retry.claimId());
        loop.advance(3000);
        assertEquals("validated", loop.join(player.getClaim(retry.claimId())).orElseThrow().status());
    }

    @Test
    void failedBroadcastRollsBackLocalClaim() {
        call(7, 23, 41, 56, 72);
        playerEndpoint.failPublish(true);

        CompletableFuture<ClaimView> failed = player.submitClaim(TICKET, WinPattern.ONE_LINE);
        loop.drain();

        CompletionException ex = assertThrows(CompletionException.class, failed::join);
        assertInstanceOf(TransportException.class, ex.getCause());
        assertTrue(loop.join(player.listClaims()).isEmpty());

        playerEndpoint.failPublish(false);
        ClaimView retried = loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));
        assertEquals("pending", retried.status());
    }

    @Test
    void eventsForUnknownClaimsAreIgnored() {
        call(7, 23, 41, 56, 72);
        loop.join(player.submitClaim(TICKET, WinPattern.ONE_LINE));
        playerEndpoint.inject("bingo:v1:session:s1:claims",
                "{\"v\":1,\"type\":\"claim-resolved\",\"sessionId\":\"s1\",\"ts\":1,"
                        + "\"payload\":{\"claimIds\":[\"someone-else\"],\"result\":\"valid\"}}");
        loop.drain();

        assertTrue(resolved.isEmpty());
        assertEquals(1, loop.join(player.listClaims()).size());
    }
}
