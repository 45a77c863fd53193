package com.lyshra.open.claims.core.engine.claim.impl;

import com.lyshra.open.claims.core.engine.activity.impl.InMemoryActivityTracker;
import com.lyshra.open.claims.core.engine.config.AbandonPolicy;
import com.lyshra.open.claims.core.engine.config.ClaimsConfig;
import com.lyshra.open.claims.core.engine.event.impl.InMemoryClaimEventBus;
import com.lyshra.open.claims.core.engine.store.impl.InMemoryClaimStore;
import com.lyshra.open.claims.core.engine.support.MutableClock;
import com.lyshra.open.claims.integration.enumerations.ClaimEventType;
import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import com.lyshra.open.claims.integration.enumerations.ClaimType;
import com.lyshra.open.claims.integration.exception.ClaimAlreadyClaimedException;
import com.lyshra.open.claims.integration.exception.ClaimErrorCode;
import com.lyshra.open.claims.integration.exception.ClaimNotFoundException;
import com.lyshra.open.claims.integration.exception.ClaimNotOwnerException;
import com.lyshra.open.claims.integration.exception.ClaimStealLimitExceededException;
import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import com.lyshra.open.claims.integration.exception.InvalidClaimTransitionException;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.ClaimEvent;
import com.lyshra.open.claims.integration.models.ClaimFilter;
import com.lyshra.open.claims.integration.models.ClaimHistoryEntry;
import com.lyshra.open.claims.integration.models.ClaimMetrics;
import com.lyshra.open.claims.integration.models.ClaimResult;
import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.ExpirySweepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ClaimServiceImpl}.
 * Tests the claim lifecycle, ownership checks, expiry, stealing and handoff against an in-memory store.
 */
class ClaimServiceImplTest {

    private static final Claimant AGENT_A = Claimant.agent("agent-a", "frontend");
    private static final Claimant AGENT_B = Claimant.agent("agent-b", "frontend");
    private static final Claimant AGENT_C = Claimant.agent("agent-c", "frontend");
    private static final Claimant HUMAN = Claimant.human("alice", "Alice", "frontend");

    private MutableClock clock;
    private InMemoryClaimStore store;
    private InMemoryActivityTracker tracker;
    private InMemoryClaimEventBus eventBus;
    private ClaimServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        useConfig(ClaimsConfig.defaultConfig());
    }

    private void useConfig(ClaimsConfig config) {
        store = new InMemoryClaimStore(clock);
        tracker = new InMemoryActivityTracker(clock);
        tracker.start();
        eventBus = new InMemoryClaimEventBus();
        service = new ClaimServiceImpl(store, tracker, eventBus, config, clock);
    }

    private Claim newClaim(ClaimPriority priority, String domain) {
        return service.createClaim(ClaimType.COVERAGE_GAP, priority, domain, "Cover " + domain, null).block();
    }

    private Claim newClaim() {
        return newClaim(ClaimPriority.P1, "frontend");
    }

    private List<ClaimEventType> eventTypes(String claimId) {
        return eventBus.getRecentEvents(claimId).stream().map(ClaimEvent::getType).toList();
    }

    // ========================================================================
    // CLAIMING TESTS
    // ========================================================================

    @Nested
    @DisplayName("Claiming")
    class ClaimingTests {

        @Test
        @DisplayName("should grant an agent a five minute lease and refuse a second claimant")
        void shouldGrantAgentLeaseAndRefuseSecondClaimant() {
            // Given
            Claim claim = newClaim();

            // When
            Claim claimed = service.claim(claim.getId(), AGENT_A).block();

            // Then
            assertEquals(ClaimStatus.CLAIMED, claimed.getStatus());
            assertEquals(300_000L, claimed.getTtlMs());
            assertEquals("agent-a", claimed.getClaimantId());
            assertEquals(clock.instant(), claimed.getClaimedAt());
            assertEquals(clock.instant(), claimed.getLastActivityAt());

            StepVerifier.create(service.claim(claim.getId(), AGENT_B))
                    .expectErrorSatisfies(error -> {
                        ClaimAlreadyClaimedException taken = assertInstanceOf(ClaimAlreadyClaimedException.class, error);
                        assertEquals("agent-a", taken.getCurrentOwner());
                        assertEquals(ClaimErrorCode.ALREADY_CLAIMED, taken.getErrorCode());
                    })
                    .verify();
        }

        @Test
        @DisplayName("should grant a human a one hour lease")
        void shouldGrantHumanOneHourLease() {
            Claim claim = newClaim();

            Claim claimed = service.claim(claim.getId(), HUMAN).block();

            assertEquals(3_600_000L, claimed.getTtlMs());
        }

        @Test
        @DisplayName("should honor a TTL override")
        void shouldHonorTtlOverride() {
            Claim claim = newClaim();

            Claim claimed = service.claim(claim.getId(), AGENT_A, Duration.ofSeconds(90)).block();

            assertEquals(Duration.ofSeconds(90), claimed.getTtl());
            StepVerifier.create(service.claim(newClaim().getId(), AGENT_A, Duration.ZERO))
                    .expectError(ClaimValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report a terminal claim as already claimed")
        void shouldRefuseTerminalClaim() {
            // Given
            Claim completed = newClaim();
            service.claim(completed.getId(), AGENT_A).block();
            service.complete(completed.getId(), "agent-a", ClaimResult.success("done")).block();
            Claim abandoned = newClaim();
            service.claim(abandoned.getId(), AGENT_A).block();
            service.abandon(abandoned.getId(), "agent-a", "wrong area").block();

            // When / Then
            StepVerifier.create(service.claim(completed.getId(), AGENT_B))
                    .expectErrorSatisfies(error -> assertEquals(ClaimStatus.COMPLETED,
                            assertInstanceOf(ClaimAlreadyClaimedException.class, error).getSnapshot()
                                    .orElseThrow().getStatus()))
                    .verify();
            StepVerifier.create(service.claim(abandoned.getId(), AGENT_B))
                    .expectError(ClaimAlreadyClaimedException.class)
                    .verify();
            assertEquals(ClaimStatus.COMPLETED, store.get(completed.getId()).block().getStatus());
        }

        @Test
        @DisplayName("should report an unknown claim")
        void shouldReportUnknownClaim() {
            StepVerifier.create(service.claim("claim-missing", AGENT_A))
                    .expectError(ClaimNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should let exactly one of many concurrent claimants win")
        void shouldLetExactlyOneConcurrentClaimantWin() {
            // Given
            Claim claim = newClaim();
            int contenders = 16;

            // When
            List<Boolean> outcomes = Flux.range(0, contenders)
                    .flatMap(i -> service.claim(claim.getId(), Claimant.agent("agent-" + i, "frontend"))
                            .map(won -> true)
                            .onErrorResume(ClaimAlreadyClaimedException.class, e -> Mono.just(false))
                            .subscribeOn(Schedulers.parallel()))
                    .collectList()
                    .block(Duration.ofSeconds(10));

            // Then
            assertEquals(contenders, outcomes.size());
            assertEquals(1, outcomes.stream().filter(won -> won).count());
            Claim stored = store.get(claim.getId()).block();
            assertEquals(ClaimStatus.CLAIMED, stored.getStatus());
            assertEquals(2L, stored.getVersion());
            assertEquals(1, stored.getHistory().size());
        }

        @Test
        @DisplayName("should register the claimant with the activity tracker")
        void shouldRegisterClaimantWithTracker() {
            Claim claim = newClaim();

            service.claim(claim.getId(), AGENT_A).block();

            assertEquals(1, tracker.getActiveClaimCount("agent-a"));
            assertEquals(clock.instant(), tracker.getLastActivity("agent-a").orElseThrow());
        }
    }

    // ========================================================================
    // LIFECYCLE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should walk the full lifecycle and record every step in history")
        void shouldWalkFullLifecycle() {
            // Given
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            // When
            clock.advance(Duration.ofMinutes(1));
            service.startWork(claim.getId(), "agent-a").block();
            service.block(claim.getId(), "agent-a", "waiting for fixture").block();
            service.unblock(claim.getId(), "agent-a").block();
            Claim completed = service.complete(claim.getId(), "agent-a", ClaimResult.success("covered")).block();

            // Then
            assertEquals(ClaimStatus.COMPLETED, completed.getStatus());
            assertTrue(completed.getResultOptional().orElseThrow().isSuccess());
            assertEquals(List.of(ClaimStatus.CLAIMED, ClaimStatus.IN_PROGRESS, ClaimStatus.BLOCKED,
                            ClaimStatus.IN_PROGRESS, ClaimStatus.COMPLETED),
                    completed.getHistory().stream().map(ClaimHistoryEntry::getToStatus).toList());
            assertEquals("waiting for fixture", completed.getHistory().get(2).getReason());
            assertEquals(List.of(ClaimEventType.CREATED, ClaimEventType.CLAIMED, ClaimEventType.STATUS_CHANGED,
                            ClaimEventType.STATUS_CHANGED, ClaimEventType.STATUS_CHANGED, ClaimEventType.COMPLETED),
                    eventTypes(claim.getId()));
            assertEquals(0, tracker.getActiveClaimCount("agent-a"));
        }

        @Test
        @DisplayName("should refuse touch after completion")
        void shouldRefuseTouchAfterCompletion() {
            // Given
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            service.complete(claim.getId(), "agent-a", ClaimResult.success("done")).block();

            // When / Then
            StepVerifier.create(service.touch(claim.getId(), "agent-a"))
                    .expectErrorSatisfies(error -> assertEquals(ClaimErrorCode.INVALID_TRANSITION,
                            assertInstanceOf(InvalidClaimTransitionException.class, error).getErrorCode()))
                    .verify();
        }

        @Test
        @DisplayName("should refuse transitions not allowed from the current status")
        void shouldRefuseDisallowedTransitions() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            StepVerifier.create(service.block(claim.getId(), "agent-a", "too early"))
                    .expectError(InvalidClaimTransitionException.class)
                    .verify();
            StepVerifier.create(service.unblock(claim.getId(), "agent-a"))
                    .expectError(InvalidClaimTransitionException.class)
                    .verify();

            service.startWork(claim.getId(), "agent-a").block();
            StepVerifier.create(service.startWork(claim.getId(), "agent-a"))
                    .expectError(InvalidClaimTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("should release a claim back to the pool")
        void shouldReleaseClaimBackToPool() {
            // Given
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            // When
            Claim released = service.release(claim.getId(), "agent-a", "wrong domain").block();

            // Then
            assertEquals(ClaimStatus.AVAILABLE, released.getStatus());
            assertNull(released.getClaimant());
            assertNull(released.getTtl());
            assertEquals(ClaimStatus.AVAILABLE, released.getLastHistoryEntry().orElseThrow().getToStatus());
            assertEquals("agent-b", service.claim(claim.getId(), AGENT_B).block().getClaimantId());
        }

        @Test
        @DisplayName("should leave an abandoned claim terminal by default")
        void shouldLeaveAbandonedClaimTerminal() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            Claim abandoned = service.abandon(claim.getId(), "agent-a", "cannot reproduce").block();

            assertEquals(ClaimStatus.ABANDONED, abandoned.getStatus());
            assertEquals(1L, store.count(ClaimFilter.all()).block());
            assertEquals(0L, service.getMetrics().totalRequeued());
        }

        @Test
        @DisplayName("should requeue an abandoned claim as a fresh claim when configured")
        void shouldRequeueAbandonedClaimWhenConfigured() {
            // Given
            useConfig(ClaimsConfig.builder().abandonPolicy(AbandonPolicy.REQUEUE).build());
            Claim claim = service.createClaim(ClaimType.FLAKY_TEST, ClaimPriority.P2, "frontend",
                    "Flaky checkout", Map.of("suite", "e2e")).block();
            service.claim(claim.getId(), AGENT_A).block();

            // When
            service.abandon(claim.getId(), "agent-a", "out of budget").block();

            // Then
            List<Claim> available = service.findClaims(ClaimFilter.byStatus(ClaimStatus.AVAILABLE)).collectList().block();
            assertEquals(1, available.size());
            Claim requeued = available.get(0);
            assertNotEquals(claim.getId(), requeued.getId());
            assertEquals(claim.getId(), requeued.getMetadata().get(ClaimServiceImpl.REQUEUED_FROM_KEY));
            assertEquals("e2e", requeued.getMetadata().get("suite"));
            assertEquals(claim.getId(), requeued.getCorrelationId());
            assertEquals(ClaimPriority.P2, requeued.getPriority());
            assertEquals(1L, service.getMetrics().totalRequeued());
        }

        @Test
        @DisplayName("should touch idempotently without history or events")
        void shouldTouchIdempotently() {
            // Given
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            clock.advance(Duration.ofMinutes(2));

            // When
            Claim first = service.touch(claim.getId(), "agent-a").block();
            Claim second = service.touch(claim.getId(), "agent-a").block();

            // Then
            assertEquals(ClaimStatus.CLAIMED, second.getStatus());
            assertEquals(clock.instant(), second.getLastActivityAt());
            assertEquals(first.getLastActivityAt(), second.getLastActivityAt());
            assertEquals(1, second.getHistory().size());
            assertEquals(List.of(ClaimEventType.CREATED, ClaimEventType.CLAIMED), eventTypes(claim.getId()));
            assertEquals(clock.instant(), tracker.getLastActivity("agent-a").orElseThrow());
        }
    }

    // ========================================================================
    // OWNERSHIP TESTS
    // ========================================================================

    @Nested
    @DisplayName("Ownership checks")
    class OwnershipTests {

        @Test
        @DisplayName("should reject operations by a non-owner")
        void shouldRejectNonOwner() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            StepVerifier.create(service.touch(claim.getId(), "agent-b"))
                    .expectError(ClaimNotOwnerException.class)
                    .verify();
            StepVerifier.create(service.complete(claim.getId(), "agent-b", ClaimResult.success("stolen glory")))
                    .expectError(ClaimNotOwnerException.class)
                    .verify();
            assertEquals(ClaimStatus.CLAIMED, store.get(claim.getId()).block().getStatus());
        }

        @Test
        @DisplayName("should report a terminal claim before checking ownership")
        void shouldReportTerminalBeforeOwnership() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            service.complete(claim.getId(), "agent-a", ClaimResult.success("done")).block();

            StepVerifier.create(service.release(claim.getId(), "agent-b", "mine now"))
                    .expectError(InvalidClaimTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report ownership before checking the transition")
        void shouldReportOwnershipBeforeTransition() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            StepVerifier.create(service.unblock(claim.getId(), "agent-b"))
                    .expectError(ClaimNotOwnerException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject owner operations on an available claim")
        void shouldRejectOwnerOperationsOnAvailableClaim() {
            Claim claim = newClaim();

            StepVerifier.create(service.startWork(claim.getId(), "agent-a"))
                    .expectError(ClaimNotOwnerException.class)
                    .verify();
        }
    }

    // ========================================================================
    // PRIORITY TESTS
    // ========================================================================

    @Nested
    @DisplayName("Priority escalation")
    class PriorityTests {

        @Test
        @DisplayName("should escalate one level and publish the change")
        void shouldEscalateOneLevel() {
            Claim claim = newClaim(ClaimPriority.P2, "frontend");

            Claim escalated = service.escalatePriority(claim.getId()).block();

            assertEquals(ClaimPriority.P1, escalated.getPriority());
            ClaimEvent event = eventBus.getRecentEvents(ClaimEventType.PRIORITY_ESCALATED).get(0);
            assertEquals("p2 -> p1", event.getContext());
            assertEquals(ClaimServiceImpl.SYSTEM_ACTOR, event.getActor());
        }

        @Test
        @DisplayName("should escalate to an explicit higher priority only")
        void shouldEscalateToExplicitHigherPriorityOnly() {
            Claim claim = newClaim(ClaimPriority.P2, "frontend");

            assertEquals(ClaimPriority.P0, service.escalatePriority(claim.getId(), ClaimPriority.P0).block().getPriority());
            StepVerifier.create(service.escalatePriority(claim.getId(), ClaimPriority.P3))
                    .expectError(ClaimValidationException.class)
                    .verify();
            StepVerifier.create(service.escalatePriority(claim.getId()))
                    .expectError(ClaimValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse to escalate a terminal claim")
        void shouldRefuseToEscalateTerminalClaim() {
            Claim claim = newClaim(ClaimPriority.P2, "frontend");
            service.claim(claim.getId(), AGENT_A).block();
            service.abandon(claim.getId(), "agent-a", null).block();

            StepVerifier.create(service.escalatePriority(claim.getId()))
                    .expectError(InvalidClaimTransitionException.class)
                    .verify();
        }
    }

    // ========================================================================
    // EXPIRY TESTS
    // ========================================================================

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should keep a human claim fresh for thirty minutes of silence")
        void shouldKeepHumanClaimFresh() {
            // Given
            Claim claim = newClaim();
            service.claim(claim.getId(), HUMAN).block();

            // When
            clock.advance(Duration.ofMinutes(30));

            // Then
            StepVerifier.create(store.findStale(clock.instant()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should requeue stale agent claims and expire stale human claims")
        void shouldApplyExpiryActionPerKind() {
            // Given
            Claim agentClaim = newClaim();
            Claim humanClaim = newClaim();
            Claim freshClaim = newClaim();
            service.claim(agentClaim.getId(), AGENT_A).block();
            service.claim(humanClaim.getId(), HUMAN, Duration.ofMinutes(10)).block();
            service.claim(freshClaim.getId(), AGENT_B).block();

            // When
            clock.advance(Duration.ofMinutes(11));
            service.touch(freshClaim.getId(), "agent-b").block();
            ExpirySweepResult result = service.expireStale(clock.instant()).block();

            // Then
            assertEquals(List.of(agentClaim.getId()), result.requeued());
            assertEquals(List.of(humanClaim.getId()), result.expired());
            assertTrue(result.skipped().isEmpty());
            assertTrue(result.failed().isEmpty());

            Claim requeued = store.get(agentClaim.getId()).block();
            assertEquals(ClaimStatus.AVAILABLE, requeued.getStatus());
            assertNull(requeued.getClaimant());
            ClaimHistoryEntry entry = requeued.getLastHistoryEntry().orElseThrow();
            assertEquals(ClaimServiceImpl.EXPIRY_ACTOR, entry.getActor());
            assertEquals("agent-a", entry.getPreviousClaimantId());

            Claim expired = store.get(humanClaim.getId()).block();
            assertEquals(ClaimStatus.EXPIRED, expired.getStatus());
            assertEquals(ClaimStatus.CLAIMED, store.get(freshClaim.getId()).block().getStatus());

            ClaimMetrics metrics = service.getMetrics();
            assertEquals(2L, metrics.totalExpired());
            assertEquals(1L, metrics.totalRequeued());
            assertEquals(0, tracker.getActiveClaimCount("agent-a"));
        }

        @Test
        @DisplayName("should do nothing when no claim is stale")
        void shouldDoNothingWhenNothingIsStale() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            ExpirySweepResult result = service.expireStale(clock.instant(), Duration.ofSeconds(5)).block();

            assertTrue(result.isEmpty());
            assertEquals(0, result.processedCount());
        }
    }

    // ========================================================================
    // STEALING TESTS
    // ========================================================================

    @Nested
    @DisplayName("Stealing")
    class StealingTests {

        @Test
        @DisplayName("should refuse to steal a claim whose owner is still active")
        void shouldRefuseToStealFreshClaim() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            clock.advance(Duration.ofMinutes(4));

            StepVerifier.create(service.steal(claim.getId(), AGENT_C, "stale"))
                    .expectError(InvalidClaimTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("should hand a stale in-progress claim to the thief as claimed")
        void shouldStealStaleClaim() {
            // Given
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            service.startWork(claim.getId(), "agent-a").block();
            clock.advance(Duration.ofMinutes(6));

            // When
            Claim stolen = service.steal(claim.getId(), AGENT_C, "stale").block();

            // Then
            assertEquals(ClaimStatus.CLAIMED, stolen.getStatus());
            assertEquals("agent-c", stolen.getClaimantId());
            assertEquals(1, stolen.getStealCount());
            assertEquals(List.of("agent-a"), stolen.getPreviousClaimantIds());
            assertEquals(clock.instant(), stolen.getLastActivityAt());
            ClaimHistoryEntry entry = stolen.getLastHistoryEntry().orElseThrow();
            assertEquals("stale", entry.getReason());
            assertEquals("agent-a", entry.getPreviousClaimantId());
            assertEquals(ClaimStatus.IN_PROGRESS, entry.getFromStatus());

            ClaimEvent event = eventBus.getRecentEvents(ClaimEventType.STOLEN).get(0);
            assertEquals("agent-a", event.getPreviousClaimantId());
            assertEquals("agent-c", event.getNewClaimantId());
            assertEquals(1, tracker.getActiveClaimCount("agent-c"));
            assertEquals(0, tracker.getActiveClaimCount("agent-a"));
        }

        @Test
        @DisplayName("should refuse to let an owner steal its own claim")
        void shouldRefuseSelfSteal() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            clock.advance(Duration.ofMinutes(6));

            StepVerifier.create(service.steal(claim.getId(), AGENT_A, "stale"))
                    .expectError(ClaimValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should stop stealing once the steal limit is reached")
        void shouldEnforceStealLimit() {
            // Given
            useConfig(ClaimsConfig.builder().maxStealCount(1).build());
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            clock.advance(Duration.ofMinutes(6));
            service.steal(claim.getId(), AGENT_B, "stale").block();

            // When
            clock.advance(Duration.ofMinutes(6));

            // Then
            StepVerifier.create(service.steal(claim.getId(), AGENT_C, "stale"))
                    .expectErrorSatisfies(error -> assertEquals(ClaimErrorCode.STEAL_LIMIT_EXCEEDED,
                            assertInstanceOf(ClaimStealLimitExceededException.class, error).getErrorCode()))
                    .verify();
            assertEquals("agent-b", store.get(claim.getId()).block().getClaimantId());
        }
    }

    // ========================================================================
    // HANDOFF TESTS
    // ========================================================================

    @Nested
    @DisplayName("Handoff")
    class HandoffTests {

        @Test
        @DisplayName("should move ownership and keep the status")
        void shouldMoveOwnershipAndKeepStatus() {
            // Given
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();
            service.startWork(claim.getId(), "agent-a").block();

            // When
            Claim handedOff = service.handoff(claim.getId(), "agent-a", HUMAN, "check edge cases", "handoff-1").block();

            // Then
            assertEquals(ClaimStatus.IN_PROGRESS, handedOff.getStatus());
            assertEquals("alice", handedOff.getClaimantId());
            assertEquals(Duration.ofHours(1), handedOff.getTtl());
            assertEquals(List.of("agent-a"), handedOff.getPreviousClaimantIds());
            ClaimEvent event = eventBus.getRecentEvents(ClaimEventType.HANDOFF).get(0);
            assertEquals("check edge cases", event.getContext());
            assertEquals("handoff-1", event.getHandoffId());
            assertEquals(1L, service.getMetrics().totalHandoffs());
        }

        @Test
        @DisplayName("should refuse a handoff by a non-owner or to the owner itself")
        void shouldRefuseInvalidHandoff() {
            Claim claim = newClaim();
            service.claim(claim.getId(), AGENT_A).block();

            StepVerifier.create(service.handoff(claim.getId(), "agent-b", HUMAN, null, null))
                    .expectError(ClaimNotOwnerException.class)
                    .verify();
            StepVerifier.create(service.handoff(claim.getId(), "agent-a", AGENT_A, null, null))
                    .expectError(ClaimValidationException.class)
                    .verify();
        }
    }

    // ========================================================================
    // QUERY TESTS
    // ========================================================================

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("should offer agents available work in their own domain by priority")
        void shouldOfferAgentsTheirDomain() {
            // Given
            Claim low = newClaim(ClaimPriority.P3, "frontend");
            clock.advance(Duration.ofSeconds(1));
            Claim high = newClaim(ClaimPriority.P0, "frontend");
            clock.advance(Duration.ofSeconds(1));
            Claim other = newClaim(ClaimPriority.P0, "backend");
            Claim taken = newClaim(ClaimPriority.P0, "frontend");
            service.claim(taken.getId(), AGENT_B).block();

            // When / Then
            StepVerifier.create(service.getAvailableForClaimant(AGENT_A).map(Claim::getId))
                    .expectNext(high.getId(), low.getId())
                    .verifyComplete();
            StepVerifier.create(service.getAvailableForClaimant(Claimant.human("bob", "Bob", "frontend")).map(Claim::getId))
                    .expectNext(high.getId(), other.getId(), low.getId())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should count committed operations")
        void shouldCountCommittedOperations() {
            Claim first = newClaim();
            Claim second = newClaim();
            service.claim(first.getId(), AGENT_A).block();
            service.complete(first.getId(), "agent-a", ClaimResult.success("done")).block();
            service.claim(second.getId(), AGENT_B).block();
            service.release(second.getId(), "agent-b", null).block();

            ClaimMetrics metrics = service.getMetrics();

            assertEquals(2L, metrics.totalCreated());
            assertEquals(2L, metrics.totalClaimed());
            assertEquals(1L, metrics.totalCompleted());
            assertEquals(1L, metrics.totalReleased());
            assertEquals(0L, metrics.totalStolen());
        }
    }
}
