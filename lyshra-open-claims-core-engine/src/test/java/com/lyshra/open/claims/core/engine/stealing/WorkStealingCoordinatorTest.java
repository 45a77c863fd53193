package com.lyshra.open.claims.core.engine.stealing;

import com.lyshra.open.claims.core.engine.activity.impl.InMemoryActivityTracker;
import com.lyshra.open.claims.core.engine.claim.impl.ClaimServiceImpl;
import com.lyshra.open.claims.core.engine.config.ClaimsConfig;
import com.lyshra.open.claims.core.engine.config.WorkStealingConfig;
import com.lyshra.open.claims.core.engine.event.impl.InMemoryClaimEventBus;
import com.lyshra.open.claims.core.engine.store.impl.InMemoryClaimStore;
import com.lyshra.open.claims.core.engine.support.MutableClock;
import com.lyshra.open.claims.integration.contract.IClaimStore;
import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import com.lyshra.open.claims.integration.enumerations.ClaimType;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.ClaimHistoryEntry;
import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.IdleClaimant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WorkStealingCoordinator}.
 * Time is simulated; cycles are run directly rather than on the schedule.
 */
class WorkStealingCoordinatorTest {

    private static final Claimant AGENT_A = Claimant.agent("agent-a", "frontend");
    private static final Claimant AGENT_C = Claimant.agent("agent-c", "frontend");

    private MutableClock clock;
    private InMemoryClaimStore store;
    private InMemoryActivityTracker tracker;
    private ClaimServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        useClaimsConfig(ClaimsConfig.defaultConfig());
    }

    private void useClaimsConfig(ClaimsConfig config) {
        store = new InMemoryClaimStore(clock);
        tracker = new InMemoryActivityTracker(clock);
        tracker.start();
        service = new ClaimServiceImpl(store, tracker, new InMemoryClaimEventBus(), config, clock);
    }

    private WorkStealingCoordinator coordinator(WorkStealingConfig config) {
        return coordinator(config, store);
    }

    private WorkStealingCoordinator coordinator(WorkStealingConfig config, IClaimStore staleSource) {
        return new WorkStealingCoordinator(service, staleSource, tracker, config, clock);
    }

    private Claim heldClaim(ClaimPriority priority, String domain, Claimant owner) {
        Claim claim = service.createClaim(ClaimType.FLAKY_TEST, priority, domain, "Flaky " + domain, null).block();
        return service.claim(claim.getId(), owner).block();
    }

    // ========================================================================
    // CYCLE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Stealing cycle")
    class CycleTests {

        @Test
        @DisplayName("should give a stale claim to an idle claimant of the same domain")
        void shouldGiveStaleClaimToIdleClaimant() {
            // Given
            Claim claim = heldClaim(ClaimPriority.P1, "frontend", AGENT_A);
            tracker.registerClaimant(AGENT_C);
            clock.advance(Duration.ofMinutes(6));

            // When
            StealCycleResult result = coordinator(WorkStealingConfig.defaultConfig()).runCycle().block();

            // Then
            assertEquals(1, result.stealCount());
            assertEquals(new StealCycleResult.Steal(claim.getId(), "agent-a", "agent-c"), result.steals().get(0));
            Claim stolen = store.get(claim.getId()).block();
            assertEquals("agent-c", stolen.getClaimantId());
            assertEquals(ClaimStatus.CLAIMED, stolen.getStatus());
            assertEquals(2, stolen.getHistory().size());
            ClaimHistoryEntry steal = stolen.getHistory().get(1);
            assertEquals(WorkStealingCoordinator.STEAL_REASON, steal.getReason());
            assertEquals("agent-c", steal.getActor());
            assertEquals("agent-a", stolen.getHistory().get(0).getActor());
        }

        @Test
        @DisplayName("should not steal across domains unless allowed")
        void shouldRespectDomains() {
            // Given
            Claim claim = heldClaim(ClaimPriority.P1, "frontend", AGENT_A);
            tracker.registerClaimant(Claimant.agent("agent-backend", "backend"));
            clock.advance(Duration.ofMinutes(6));

            // When
            StealCycleResult sameDomainOnly = coordinator(WorkStealingConfig.defaultConfig()).runCycle().block();

            // Then
            assertEquals(0, sameDomainOnly.stealCount());
            assertEquals(1, sameDomainOnly.staleClaimCount());
            assertEquals("agent-a", store.get(claim.getId()).block().getClaimantId());

            StealCycleResult crossDomain = coordinator(WorkStealingConfig.builder().allowCrossDomain(true).build())
                    .runCycle().block();
            assertEquals(1, crossDomain.stealCount());
            assertEquals("agent-backend", store.get(claim.getId()).block().getClaimantId());
        }

        @Test
        @DisplayName("should hand out the highest priority stale claim first")
        void shouldPreferHighestPriority() {
            // Given
            heldClaim(ClaimPriority.P3, "frontend", AGENT_A);
            Claim urgent = heldClaim(ClaimPriority.P0, "frontend", Claimant.agent("agent-b", "frontend"));
            tracker.registerClaimant(AGENT_C);
            clock.advance(Duration.ofMinutes(6));

            // When
            StealCycleResult result = coordinator(WorkStealingConfig.defaultConfig()).runCycle().block();

            // Then
            assertEquals(1, result.stealCount());
            assertEquals(urgent.getId(), result.steals().get(0).claimId());
        }

        @Test
        @DisplayName("should stop at the per-cycle steal limit")
        void shouldStopAtPerCycleLimit() {
            // Given
            for (int i = 0; i < 3; i++) {
                heldClaim(ClaimPriority.P2, "frontend", Claimant.agent("owner-" + i, "frontend"));
                tracker.registerClaimant(Claimant.agent("idle-" + i, "frontend"));
            }
            clock.advance(Duration.ofMinutes(6));

            // When
            WorkStealingCoordinator coordinator = coordinator(WorkStealingConfig.builder().maxStealsPerCycle(2).build());
            StealCycleResult result = coordinator.runCycle().block();

            // Then
            assertEquals(3, result.idleClaimantCount());
            assertEquals(3, result.staleClaimCount());
            assertEquals(2, result.stealCount());
            assertEquals(2L, coordinator.getMetrics().steals());
            assertEquals(1L, coordinator.getMetrics().cycles());
            assertEquals(clock.instant(), coordinator.getMetrics().lastCycleAt());
        }

        @Test
        @DisplayName("should leave claims alone until they pass the stale threshold")
        void shouldHonorStaleThreshold() {
            heldClaim(ClaimPriority.P1, "frontend", AGENT_A);
            tracker.registerClaimant(AGENT_C);
            clock.advance(Duration.ofMinutes(6));

            StealCycleResult result = coordinator(WorkStealingConfig.builder()
                    .staleThreshold(Duration.ofMinutes(10)).build()).runCycle().block();

            assertEquals(0, result.staleClaimCount());
            assertEquals(0, result.stealCount());
        }

        @Test
        @DisplayName("should skip a claim that recovered after it was found stale")
        void shouldSkipRecoveredClaim() {
            // Given
            Claim claim = heldClaim(ClaimPriority.P1, "frontend", AGENT_A);
            tracker.registerClaimant(AGENT_C);
            clock.advance(Duration.ofMinutes(6));
            Claim staleSnapshot = store.get(claim.getId()).block();
            service.touch(claim.getId(), "agent-a").block();
            InMemoryClaimStore outdatedView = new InMemoryClaimStore(clock) {
                @Override
                public Flux<Claim> findStale(Instant now) {
                    return Flux.just(staleSnapshot);
                }
            };
            WorkStealingCoordinator coordinator = coordinator(WorkStealingConfig.defaultConfig(), outdatedView);

            // When
            StealCycleResult result = coordinator.runCycle().block();

            // Then
            assertEquals(0, result.stealCount());
            assertEquals(1, result.conflicts());
            assertEquals(0, result.failures());
            assertEquals("agent-a", store.get(claim.getId()).block().getClaimantId());
            assertEquals(1L, coordinator.getMetrics().conflicts());
        }

        @Test
        @DisplayName("should count a steal-limited claim as a failure and finish the cycle")
        void shouldCountStealLimitAsFailure() {
            // Given
            useClaimsConfig(ClaimsConfig.builder().maxStealCount(1).build());
            Claim claim = heldClaim(ClaimPriority.P1, "frontend", AGENT_A);
            clock.advance(Duration.ofMinutes(6));
            service.steal(claim.getId(), Claimant.agent("agent-b", "frontend"), "stale").block();
            tracker.registerClaimant(AGENT_C);
            clock.advance(Duration.ofMinutes(6));

            // When
            StealCycleResult result = coordinator(WorkStealingConfig.defaultConfig()).runCycle().block();

            // Then
            assertEquals(0, result.stealCount());
            assertEquals(1, result.failures());
            assertEquals("agent-b", store.get(claim.getId()).block().getClaimantId());
        }

        @Test
        @DisplayName("should skip a cycle while another is in flight")
        void shouldSkipOverlappingCycle() {
            // Given
            InMemoryClaimStore slowStore = new InMemoryClaimStore(clock) {
                @Override
                public Flux<Claim> findStale(Instant now) {
                    return Flux.never();
                }
            };
            WorkStealingCoordinator coordinator = coordinator(WorkStealingConfig.defaultConfig(), slowStore);
            Disposable inFlight = coordinator.runCycle().subscribe();

            // When
            StealCycleResult second = coordinator.runCycle().block();

            // Then
            assertTrue(second.skipped());
            assertEquals(1L, coordinator.getMetrics().skippedCycles());
            inFlight.dispose();
        }
    }

    // ========================================================================
    // PLANNING TESTS
    // ========================================================================

    @Nested
    @DisplayName("Planning")
    class PlanningTests {

        @Test
        @DisplayName("should never plan a steal of a claimant's own claim")
        void shouldNeverPlanSelfSteal() {
            Claim own = heldClaim(ClaimPriority.P0, "frontend", AGENT_A);
            Instant now = clock.instant().plus(Duration.ofMinutes(6));
            IdleClaimant self = new IdleClaimant(AGENT_A, clock.instant(), Duration.ofMinutes(6));

            List<WorkStealingCoordinator.Assignment> plan = coordinator(WorkStealingConfig.defaultConfig())
                    .plan(now, List.of(self), List.of(own));

            assertTrue(plan.isEmpty());
        }

        @Test
        @DisplayName("should give each claimant at most one claim and each claim at most one claimant")
        void shouldMatchOneToOne() {
            Claim first = heldClaim(ClaimPriority.P1, "frontend", AGENT_A);
            Claim second = heldClaim(ClaimPriority.P2, "frontend", Claimant.agent("agent-b", "frontend"));
            Instant now = clock.instant().plus(Duration.ofMinutes(6));
            IdleClaimant longest = new IdleClaimant(AGENT_C, clock.instant(), Duration.ofMinutes(9));
            IdleClaimant shorter = new IdleClaimant(Claimant.agent("agent-d", "frontend"), clock.instant(),
                    Duration.ofMinutes(3));

            List<WorkStealingCoordinator.Assignment> plan = coordinator(WorkStealingConfig.defaultConfig())
                    .plan(now, List.of(longest, shorter), List.of(second, first));

            assertEquals(2, plan.size());
            assertEquals(first.getId(), plan.get(0).claim().getId());
            assertEquals("agent-c", plan.get(0).claimant().claimantId());
            assertEquals(second.getId(), plan.get(1).claim().getId());
            assertEquals("agent-d", plan.get(1).claimant().claimantId());
        }

        @Test
        @DisplayName("should prefer same-domain claims before falling back across domains")
        void shouldPreferSameDomain() {
            Claim backendUrgent = heldClaim(ClaimPriority.P0, "backend", Claimant.agent("agent-x", "backend"));
            Claim frontendLow = heldClaim(ClaimPriority.P3, "frontend", AGENT_A);
            Instant now = clock.instant().plus(Duration.ofMinutes(6));
            IdleClaimant idle = new IdleClaimant(AGENT_C, clock.instant(), Duration.ofMinutes(6));

            List<WorkStealingCoordinator.Assignment> plan = coordinator(WorkStealingConfig.builder()
                    .allowCrossDomain(true).build())
                    .plan(now, List.of(idle), List.of(backendUrgent, frontendLow));

            assertEquals(1, plan.size());
            assertEquals(frontendLow.getId(), plan.get(0).claim().getId());
        }
    }

    // ========================================================================
    // LIFECYCLE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should not start when disabled")
        void shouldNotStartWhenDisabled() {
            WorkStealingCoordinator coordinator = coordinator(WorkStealingConfig.builder().enabled(false).build());

            coordinator.start().block();

            assertFalse(coordinator.isRunning());
        }

        @Test
        @DisplayName("should start and stop the schedule")
        void shouldStartAndStop() {
            WorkStealingCoordinator coordinator = coordinator(WorkStealingConfig.builder()
                    .checkInterval(Duration.ofHours(1)).build());

            coordinator.start().block();
            assertTrue(coordinator.isRunning());

            coordinator.stop().block();
            assertFalse(coordinator.isRunning());
        }
    }
}
