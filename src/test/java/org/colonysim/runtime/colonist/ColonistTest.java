package org.colonysim.runtime.colonist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.colonysim.junit.extensions.logging.ExpectLog;
import org.colonysim.junit.extensions.logging.LogLevel;
import org.colonysim.junit.extensions.logging.LogWatchExtension;
import org.colonysim.runtime.pool.HarvestResult;
import org.colonysim.runtime.pool.ResourcePool;
import org.colonysim.runtime.presence.Activity;
import org.colonysim.runtime.presence.PresenceAggregator;
import org.colonysim.runtime.presence.PresenceCounts;
import org.colonysim.runtime.rules.ForagingLocation;
import org.colonysim.runtime.rules.ResourceKind;
import org.colonysim.runtime.rules.RuleOutcome;
import org.colonysim.runtime.rules.RuleViolation;
import org.colonysim.runtime.spi.IColonistListener;
import org.colonysim.test.utils.ColonyTestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@DisplayName("Colonist Unit Tests")
class ColonistTest {

    private ResourcePool pool;
    private PresenceAggregator presence;
    private Colonist colonist;

    @BeforeEach
    void setUp() {
        pool = ColonyTestUtils.defaultPool(17);
        presence = ColonyTestUtils.defaultPresence(17);
        presence.register("c-1");
        colonist = new Colonist("c-1", ColonyTestUtils.defaultRules(), pool, presence,
                ColonyTestUtils.DIRECT_EXECUTOR);
    }

    private void ticks(int n) {
        for (int i = 0; i < n; i++) {
            assertThat(colonist.deliverTick()).isTrue();
        }
    }

    @Test
    void newColonistIsIdleWithInitialResources() {
        ColonistSnapshot state = colonist.getState();

        assertThat(state.colonistId()).isEqualTo("c-1");
        assertThat(state.status()).isEqualTo(Activity.IDLE);
        assertThat(state.currentLocation()).isEmpty();
        assertThat(state.resources()).containsOnly(
                Map.entry(ResourceKind.FOOD, 100),
                Map.entry(ResourceKind.WATER, 100),
                Map.entry(ResourceKind.ENERGY, 100));
        assertThat(state.tickCounter()).isZero();
    }

    @Nested
    @DisplayName("Foraging trip")
    class ForagingTrip {

        @Test
        void fullTripHarvestsOnceAndReturnsIdle() {
            pool.setAmount(ForagingLocation.FOREST, 20);

            RuleOutcome<ColonistSnapshot> begun = colonist.submitCommand(new ColonistCommand.BeginForaging("forest"));
            assertThat(begun.isOk()).isTrue();
            assertThat(begun.value().status()).isEqualTo(Activity.FORAGING);
            assertThat(begun.value().remainingTicks()).isEqualTo(5);
            assertThat(presence.getSummary().counts()).isEqualTo(new PresenceCounts(1, 0, 1));

            ticks(5);

            ColonistSnapshot state = colonist.getState();
            int harvested = 20 - pool.getLocations().get(ForagingLocation.FOREST);
            assertThat(harvested).isBetween(1, 5);
            assertThat(state.status()).isEqualTo(Activity.IDLE);
            assertThat(state.tickCounter()).isEqualTo(5);
            assertThat(state.resource(ResourceKind.FOOD)).isEqualTo(99 + harvested);
            assertThat(state.resource(ResourceKind.WATER)).isEqualTo(100);
            assertThat(state.resource(ResourceKind.ENERGY)).isEqualTo(100);
            assertThat(presence.getSummary().counts()).isEqualTo(new PresenceCounts(1, 1, 0));
        }

        @Test
        void harvestIsRequestedExactlyOncePerTrip() {
            ResourcePool mockPool = mock(ResourcePool.class);
            when(mockPool.harvest(ForagingLocation.CAVE))
                    .thenReturn(new HarvestResult(ForagingLocation.CAVE, ResourceKind.ENERGY, 4));
            Colonist forager = new Colonist("c-2", ColonyTestUtils.defaultRules(), mockPool, presence,
                    ColonyTestUtils.DIRECT_EXECUTOR);

            forager.submitCommand(ColonistCommand.BeginForaging.at(ForagingLocation.CAVE));
            for (int i = 0; i < 4; i++) {
                forager.deliverTick();
            }
            verify(mockPool, never()).harvest(any());

            for (int i = 0; i < 10; i++) {
                forager.deliverTick();
            }

            verify(mockPool, times(1)).harvest(ForagingLocation.CAVE);
            assertThat(forager.getState().resource(ResourceKind.ENERGY)).isEqualTo(104);
        }

        @Test
        void emptySiteCreditsNothing() {
            pool.setAmount(ForagingLocation.RIVER, 0);

            colonist.submitCommand(ColonistCommand.BeginForaging.at(ForagingLocation.RIVER));
            ticks(5);

            ColonistSnapshot state = colonist.getState();
            assertThat(state.status()).isEqualTo(Activity.IDLE);
            assertThat(state.resource(ResourceKind.WATER)).isEqualTo(100);
            assertThat(state.resource(ResourceKind.FOOD)).isEqualTo(99);
        }

        @Test
        void defaultCommandForagesInTheForest() {
            RuleOutcome<ColonistSnapshot> outcome = colonist.submitCommand(new ColonistCommand.BeginForaging());

            assertThat(outcome.value().currentLocation()).contains(ForagingLocation.FOREST);
        }

        @Test
        void secondCommandWhileForagingIsRejected() {
            colonist.submitCommand(new ColonistCommand.BeginForaging("forest"));
            ticks(2);

            RuleOutcome<ColonistSnapshot> again = colonist.submitCommand(new ColonistCommand.BeginForaging("cave"));

            assertThat(again.violation()).contains(RuleViolation.ALREADY_FORAGING);
            assertThat(colonist.getState().currentLocation()).contains(ForagingLocation.FOREST);
            assertThat(colonist.getState().remainingTicks()).isEqualTo(3);
        }

        @Test
        void invalidLocationLeavesColonistIdle() {
            RuleOutcome<ColonistSnapshot> outcome = colonist.submitCommand(new ColonistCommand.BeginForaging("moon"));

            assertThat(outcome.violation()).contains(RuleViolation.INVALID_LOCATION);
            assertThat(colonist.getState().status()).isEqualTo(Activity.IDLE);
            assertThat(presence.getSummary().counts()).isEqualTo(new PresenceCounts(1, 1, 0));
        }
    }

    @Nested
    @DisplayName("Resource deltas")
    class ResourceDeltas {

        @Test
        void deltaIsClampedAtZero() {
            assertThat(colonist.applyResourceDelta(Map.of(ResourceKind.WATER, -500, ResourceKind.FOOD, 5))).isTrue();

            assertThat(colonist.getState().resource(ResourceKind.WATER)).isZero();
            assertThat(colonist.getState().resource(ResourceKind.FOOD)).isEqualTo(105);
        }
    }

    @Nested
    @DisplayName("Listeners")
    class Listeners {

        @Test
        void everyOperationPublishesASnapshot() {
            List<ColonistSnapshot> seen = new ArrayList<>();
            colonist.addListener(seen::add);

            colonist.submitCommand(new ColonistCommand.BeginForaging("forest"));
            ticks(2);

            assertThat(seen).hasSize(3);
            assertThat(seen.get(2).tickCounter()).isEqualTo(2);
            assertThat(seen.get(2)).isEqualTo(colonist.getState());
        }

        @Test
        void rejectedCommandPublishesNothing() {
            CountingListener stub = new CountingListener();
            colonist.addListener(stub);

            colonist.submitCommand(new ColonistCommand.BeginForaging("nowhere"));

            assertThat(stub.count).isZero();
        }

        @Test
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Snapshot listener for colonist c-1 failed: nope")
        void failingListenerDoesNotStopTheColonist() {
            colonist.addListener(snapshot -> {
                throw new IllegalStateException("nope");
            });

            ticks(1);

            assertThat(colonist.getState().tickCounter()).isEqualTo(1);
        }

        private static final class CountingListener implements IColonistListener {
            private int count;

            @Override
            public void onSnapshot(ColonistSnapshot snapshot) {
                count++;
            }
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void terminatedColonistRefusesWork() {
            colonist.terminate();

            assertThat(colonist.isAlive()).isFalse();
            assertThat(colonist.deliverTick()).isFalse();
            assertThat(colonist.applyResourceDelta(Map.of(ResourceKind.FOOD, 1))).isFalse();
            assertThatThrownBy(() -> colonist.submitCommand(new ColonistCommand.BeginForaging()))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(colonist.getState().tickCounter()).isZero();
        }

        @Test
        void colonistOnAShutDownDispatcherFailsCommandsAndDies() {
            ExecutorService dispatcher = Executors.newSingleThreadExecutor();
            dispatcher.shutdown();
            Colonist orphan = new Colonist("c-3", ColonyTestUtils.defaultRules(), pool, presence, dispatcher);

            assertThatThrownBy(() -> orphan.submitCommandAsync(new ColonistCommand.BeginForaging("forest"))
                    .get(2, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(orphan.isAlive()).isFalse();
            assertThat(orphan.deliverTick()).isFalse();
            assertThatThrownBy(() -> orphan.submitCommand(new ColonistCommand.BeginForaging()))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(presence.getSummary().counts()).isEqualTo(new PresenceCounts(1, 1, 0));
        }

        @Test
        void terminatedColonistStopsReportingToPresence() {
            List<Runnable> queued = new ArrayList<>();
            Colonist queuedColonist = new Colonist("c-1", ColonyTestUtils.defaultRules(), pool, presence, queued::add);
            queuedColonist.submitCommandAsync(new ColonistCommand.BeginForaging("river"));

            queuedColonist.terminate();
            queued.forEach(Runnable::run);

            assertThat(queuedColonist.getState().status()).isEqualTo(Activity.FORAGING);
            assertThat(presence.getSummary().counts()).isEqualTo(new PresenceCounts(1, 1, 0));
        }

        @Test
        void operationsFromManyThreadsAreAllApplied() throws Exception {
            ExecutorService dispatcher = Executors.newFixedThreadPool(3);
            ExecutorService callers = Executors.newFixedThreadPool(4);
            try {
                Colonist concurrent = new Colonist("c-9", ColonyTestUtils.defaultRules(), pool, presence, dispatcher);
                for (int t = 0; t < 4; t++) {
                    callers.submit(() -> {
                        for (int i = 0; i < 250; i++) {
                            concurrent.deliverTick();
                        }
                    });
                }
                callers.shutdown();
                assertThat(callers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

                ColonistSnapshot state = concurrent.fetchState().get(10, TimeUnit.SECONDS);

                assertThat(state.tickCounter()).isEqualTo(1_000);
                assertThat(state.resource(ResourceKind.FOOD)).isEqualTo(0);
                assertThat(state.resource(ResourceKind.WATER)).isEqualTo(0);
                assertThat(state.resource(ResourceKind.ENERGY)).isEqualTo(100 - 1_000 / 15);
            } finally {
                dispatcher.shutdownNow();
                callers.shutdownNow();
            }
        }
    }
}
