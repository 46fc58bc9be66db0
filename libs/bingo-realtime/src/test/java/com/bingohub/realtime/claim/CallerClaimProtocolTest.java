package com.bingohub.realtime.claim;

import com.bingohub.realtime.connection.ConnectionManager;
import com.bingohub.realtime.connection.ConnectionSettings;
import com.bingohub.realtime.connection.SessionConnection;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.ClaimCheckingPayload;
import com.bingohub.realtime.protocol.payload.ClaimResolvedPayload;
import com.bingohub.realtime.protocol.payload.ClaimSubmittedPayload;
import com.bingohub.realtime.protocol.payload.TicketSnapshot;
import com.bingohub.realtime.sync.CallSyncEngine;
import com.bingohub.realtime.support.InMemoryBroadcastBus;
import com.bingohub.realtime.support.InMemoryCallStateStore;
import com.bingohub.realtime.support.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallerClaimProtocolTest {

    private static final long WINDOW_MS = 3000;
    private static final List<List<Integer>> WINNING_ROWS = List.of(
            List.of(7, 0, 23, 0, 41, 0, 56, 0, 72),
            List.of(0, 12, 0, 34, 0, 45, 0, 67, 88));

    private ManualEventLoop loop;
    private InMemoryBroadcastBus bus;
    private CallSyncEngine callSync;
    private CallerClaimProtocol protocol;
    private SessionConnection playerConn;

    private final List<ClaimResolution> resolutions = new ArrayList<>();
    private final List<GroupView> decisions = new ArrayList<>();
    private final List<ClaimView> submitted = new ArrayList<>();

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        bus = new InMemoryBroadcastBus();
        InMemoryCallStateStore store = new InMemoryCallStateStore();
        SessionConnection callerConn = new ConnectionManager(bus.endpoint(), loop, ConnectionSettings.defaults()).connect("s1");
        callSync = CallSyncEngine.caller(callerConn, store, loop);
        callSync.start();
        AtomicInteger ids = new AtomicInteger();
        protocol = new CallerClaimProtocol(callerConn, callSync, loop, WINDOW_MS, () -> "g-" + ids.incrementAndGet());
        protocol.start();
        protocol.onClaimResolved(resolutions::add);
        protocol.onDecisionRequired(decisions::add);
        protocol.onClaimSubmitted(submitted::add);
        playerConn = new ConnectionManager(bus.endpoint(), loop, ConnectionSettings.defaults()).connect("s1");
        loop.drain();

        loop.join(callSync.changeWinPattern(WinPattern.ONE_LINE));
    }

    private void call(int... numbers) {
        for (int n : numbers) {
            loop.join(callSync.callNumber(n));
        }
    }

    private void submit(String claimId, String playerId, List<List<Integer>> rows, long generation, List<Integer> seen) {
        TicketSnapshot snapshot = new TicketSnapshot("t-" + playerId, rows, seen, null);
        loop.join(playerConn.publish(EventType.CLAIM_SUBMITTED, new ClaimSubmittedPayload(claimId, playerId,
                "name-" + playerId, "s1", snapshot, WinPattern.ONE_LINE.id(), loop.now(), generation)));
        loop.drain();
    }

    private void submit(String claimId, String playerId) {
        submit(claimId, playerId, WINNING_ROWS, callSync.currentState().generation(), callSync.getCalledNumbers());
    }

    private ClaimView claim(String claimId) {
        return loop.join(protocol.listClaims()).stream()
                .filter(c -> c.claimId().equals(claimId))
                .findFirst()
                .orElseThrow();
    }

    private List<ClaimResolvedPayload> resolvedEvents() {
        return bus.published(EventType.CLAIM_RESOLVED).stream()
                .map(e -> e.payloadAs(ClaimResolvedPayload.class))
                .toList();
    }

    @Test
    void singleValidClaimIsValidatedWhenWindowCloses() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");

        assertEquals(1, submitted.size());
        assertEquals("valid", claim("c-1").status());
        assertEquals(List.of("validating", "valid"), bus.published(EventType.CLAIM_CHECKING).stream()
                .map(e -> e.payloadAs(ClaimCheckingPayload.class).getStatus())
                .toList());

        loop.advance(WINDOW_MS - 1);
        assertTrue(resolutions.isEmpty());

        loop.advance(1);
        assertEquals(1, resolutions.size());
        ClaimResolution r = resolutions.get(0);
        assertEquals(ClaimResolution.Kind.SINGLE_WINNER, r.kind());
        assertEquals(List.of("c-1"), r.winnerClaimIds());
        assertNull(r.allocation());
        assertEquals("validated", claim("c-1").status());

        ClaimResolvedPayload event = resolvedEvents().get(0);
        assertEquals("valid", event.getResult());
        assertEquals(List.of("c-1"), event.getClaimIds());
        assertTrue(decisions.isEmpty());
    }

    @Test
    void incompleteClaimIsInvalidWithDiagnostics() {
        call(7, 23, 41, 56);
        submit("c-1", "p-1", WINNING_ROWS, 0, List.of(7, 23, 41, 56, 72));

        ClaimView view = claim("c-1");
        assertEquals("invalid", view.status());
        assertEquals(InvalidReason.PATTERN_INCOMPLETE.code(), view.reasonCode());

        ClaimResolvedPayload event = resolvedEvents().get(0);
        assertEquals("invalid", event.getResult());
        assertEquals(Integer.valueOf(1), event.getToGo());
        assertEquals(List.of(72), event.getNotYetCalled());
        assertTrue(loop.join(protocol.listGroups()).isEmpty());
    }

    @Test
    void tiedClaimsWaitForCallerDecisionAppliedToWholeGroup() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");
        loop.advance(1000);
        submit("c-2", "p-2");
        loop.advance(WINDOW_MS);

        assertTrue(resolutions.isEmpty());
        assertEquals(1, decisions.size());
        GroupView group = decisions.get(0);
        assertEquals("awaiting_decision", group.state());
        assertEquals(List.of("c-1", "c-2"), group.validClaimIds());

        ClaimResolution shared = loop.join(protocol.decide(group.groupId(), PrizeAllocation.SHARED));
        assertEquals(ClaimResolution.Kind.GROUP, shared.kind());
        assertEquals(PrizeAllocation.SHARED, shared.allocation());
        assertEquals(List.of("c-1", "c-2"), shared.winnerClaimIds());
        assertEquals("shared", claim("c-1").allocation());
        assertEquals("shared", claim("c-2").allocation());
        assertEquals("validated", claim("c-2").status());

        // 决定只记录一次
        ClaimResolution again = loop.join(protocol.decide(group.groupId(), PrizeAllocation.EACH_FULL));
        assertEquals(shared.resolutionId(), again.resolutionId());
        assertEquals(PrizeAllocation.SHARED, again.allocation());
        assertEquals(1, resolutions.size());
        assertEquals(1, resolvedEvents().size());
        assertEquals("shared", resolvedEvents().get(0).getAllocation());
    }

    @Test
    void lateValidClaimAfterAwardIsRejected() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");
        loop.advance(WINDOW_MS);

        submit("c-3", "p-3");

        ClaimView late = claim("c-3");
        assertEquals("rejected", late.status());
        assertEquals(ClaimMessages.PRIZE_ALREADY_AWARDED, late.reason());
        assertEquals(InvalidReason.PRIZE_ALREADY_AWARDED.code(), late.reasonCode());
        assertEquals(1, resolutions.size());
    }

    @Test
    void forgedGenerationCannotWinTheSamePrizeTwice() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");
        loop.advance(WINDOW_MS);
        assertEquals("validated", claim("c-1").status());

        submit("c-2", "p-2", WINNING_ROWS, 7, callSync.getCalledNumbers());

        ClaimView forged = claim("c-2");
        assertEquals("invalid", forged.status());
        assertEquals(InvalidReason.GENERATION_MISMATCH.code(), forged.reasonCode());
        assertEquals(1, resolutions.size());
        assertEquals(1, loop.join(protocol.listGroups()).size());
    }

    @Test
    void resetAbandonsUndecidedGroupsOfOldGeneration() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");

        loop.join(callSync.resetGame());
        loop.advance(WINDOW_MS);

        ClaimView view = claim("c-1");
        assertEquals("rejected", view.status());
        assertEquals(InvalidReason.GAME_RESET.code(), view.reasonCode());
        assertTrue(resolutions.isEmpty());
        assertEquals("resolved", loop.join(protocol.listGroups()).get(0).state());
    }

    @Test
    void recordsOlderThanThePreviousGameAreDroppedOnReset() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");
        loop.advance(WINDOW_MS);

        loop.join(callSync.resetGame());
        loop.drain();
        // 上一局仍可查看
        assertEquals("validated", claim("c-1").status());
        assertEquals(1, loop.join(protocol.listGroups()).size());

        loop.join(callSync.resetGame());
        loop.drain();
        assertTrue(loop.join(protocol.listClaims()).isEmpty());
        assertTrue(loop.join(protocol.listGroups()).isEmpty());

        // 清理后新一局照常判定
        loop.join(callSync.changeWinPattern(WinPattern.ONE_LINE));
        call(7, 23, 41, 56, 72);
        submit("c-2", "p-1");
        loop.advance(WINDOW_MS);
        assertEquals("validated", claim("c-2").status());
        assertEquals(2, resolutions.size());
    }

    @Test
    void claimFromPreviousGenerationIsInvalid() {
        call(7, 23, 41, 56, 72);
        loop.join(callSync.resetGame());
        call(7, 23, 41, 56, 72);

        submit("c-1", "p-1", WINNING_ROWS, 0, List.of());

        assertEquals(InvalidReason.GAME_RESET.code(), claim("c-1").reasonCode());
        assertEquals("invalid", claim("c-1").status());
    }

    @Test
    void callerRejectionLeavesSingleRemainingWinner() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");
        submit("c-2", "p-2");
        loop.advance(WINDOW_MS);

        ClaimView rejected = loop.join(protocol.rejectClaim("c-1", null));

        assertEquals("rejected", rejected.status());
        assertEquals(ClaimMessages.CALLER_REJECTED, rejected.reason());
        assertEquals(1, resolutions.size());
        assertEquals(List.of("c-2"), resolutions.get(0).winnerClaimIds());
        assertEquals(ClaimResolution.Kind.SINGLE_WINNER, resolutions.get(0).kind());

        CompletableFuture<ClaimView> again = protocol.rejectClaim("c-1", "再次驳回");
        loop.drain();
        CompletionException ex = assertThrows(CompletionException.class, again::join);
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void resolveClaimsSkipsTheWindow() {
        call(7, 23, 41, 56, 72);
        submit("c-1", "p-1");

        ClaimResolution r = loop.join(protocol.resolveClaims(List.of("c-1")));

        assertEquals(List.of("c-1"), r.winnerClaimIds());
        assertEquals("resolved", loop.join(protocol.listGroups()).get(0).state());
        loop.advance(WINDOW_MS);
        assertEquals(1, resolutions.size());

        CompletableFuture<ClaimResolution> unknown = protocol.resolveClaims(List.of("missing"));
        loop.drain();
        CompletionException ex = assertThrows(CompletionException.class, unknown::join);
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void resubmittingTerminalClaimReplaysResult() {
        call(7, 23, 41, 56);
        submit("c-1", "p-1", WINNING_ROWS, 0, List.of());
        submit("c-1", "p-1", WINNING_ROWS, 0, List.of());

        assertEquals(1, submitted.size());
        List<ClaimResolvedPayload> events = resolvedEvents();
        assertEquals(2, events.size());
        assertEquals(events.get(0).getReason(), events.get(1).getReason());
    }

    @Test
    void malformedTicketIsAnsweredWithoutRegistering() {
        submit("c-bad", "p-1", List.of(List.of(5, 5)), 0, List.of());

        ClaimResolvedPayload event = resolvedEvents().get(0);
        assertEquals("invalid", event.getResult());
        assertEquals(InvalidReason.MALFORMED_TICKET.code(), event.getReasonCode());
        assertTrue(loop.join(protocol.listClaims()).isEmpty());
        assertFalse(submitted.stream().anyMatch(c -> c.claimId().equals("c-bad")));
    }

    @Test
    void decideRejectsUnknownGroup() {
        CompletableFuture<ClaimResolution> f = protocol.decide("nope", PrizeAllocation.SHARED);
        loop.drain();
        CompletionException ex = assertThrows(CompletionException.class, f::join);
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
