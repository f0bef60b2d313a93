package org.colonysim.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.colonysim.junit.extensions.logging.LogWatchExtension;
import org.colonysim.runtime.colonist.Colonist;
import org.colonysim.runtime.colonist.ColonistCommand;
import org.colonysim.runtime.colonist.ColonistSnapshot;
import org.colonysim.runtime.presence.Activity;
import org.colonysim.runtime.presence.PresenceCounts;
import org.colonysim.runtime.rules.ForagingLocation;
import org.colonysim.runtime.rules.ResourceKind;
import org.colonysim.test.utils.ColonyTestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@DisplayName("ColonySimulation Integration Tests")
class ColonySimulationTest {

    private ColonySimulation simulation;

    @AfterEach
    void tearDown() {
        if (simulation != null) {
            simulation.close();
        }
    }

    private ColonySimulation create(String overrides) {
        simulation = new ColonySimulation(ColonyTestUtils.colonyConfig(overrides), ColonyTestUtils.fixedClock());
        return simulation;
    }

    private static void awaitAll(List<Colonist> colonists) throws Exception {
        CompletableFuture.allOf(colonists.stream()
                .map(Colonist::fetchState)
                .toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);
    }

    @Test
    void manyColonistsForageConcurrentlyAndReturnIdle() throws Exception {
        create("dispatch.threads = 4");
        List<Colonist> colonists = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            colonists.add(simulation.getColony().spawn("c-" + i));
        }
        ForagingLocation[] locations = ForagingLocation.values();
        for (int i = 0; i < colonists.size(); i++) {
            assertThat(colonists.get(i).submitCommand(ColonistCommand.BeginForaging.at(locations[i % locations.length])).isOk())
                    .isTrue();
        }
        assertThat(simulation.getPresence().getSummary().counts()).isEqualTo(new PresenceCounts(50, 0, 50));

        for (int i = 0; i < 5; i++) {
            simulation.getScheduler().fireOnce();
        }
        awaitAll(colonists);

        for (Colonist colonist : colonists) {
            ColonistSnapshot state = colonist.getState();
            assertThat(state.status()).isEqualTo(Activity.IDLE);
            assertThat(state.tickCounter()).isEqualTo(5);
            assertThat(state.resource(ResourceKind.FOOD)).isBetween(99, 104);
        }
        assertThat(simulation.getPresence().getSummary().counts()).isEqualTo(new PresenceCounts(50, 50, 0));
        assertThat(simulation.getPresence().recount()).isEqualTo(new PresenceCounts(50, 50, 0));
        assertThat(simulation.getPool().getLocations().values()).allSatisfy(amount -> assertThat(amount).isGreaterThanOrEqualTo(0));
    }

    @Test
    void wallClockSchedulerDrivesColonists() {
        create("tick-interval = 20ms\ndispatch.threads = 2");
        Colonist colonist = simulation.getColony().spawn("ticker");

        simulation.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> colonist.getState().tickCounter() >= 5);
        assertThat(simulation.getScheduler().getState()).isEqualTo(TickScheduler.State.RUNNING);
    }

    @Test
    void despawnedColonistStopsReceivingTicks() throws Exception {
        create("dispatch.threads = 2");
        Colonist kept = simulation.getColony().spawn("kept");
        Colonist gone = simulation.getColony().spawn("gone");

        simulation.getScheduler().fireOnce();
        simulation.getColony().despawn("gone");
        simulation.getScheduler().fireOnce();
        awaitAll(List.of(kept));
        await().atMost(Duration.ofSeconds(5)).until(() -> gone.getState().tickCounter() == 1);

        assertThat(kept.getState().tickCounter()).isEqualTo(2);
        assertThat(gone.isAlive()).isFalse();
        assertThat(simulation.getScheduler().getDeliveriesDropped()).isZero();
        assertThat(simulation.getPresence().getSummary().totalCount()).isEqualTo(1);
    }

    @Test
    void closeTerminatesEverything() {
        create("dispatch.threads = 1");
        Colonist colonist = simulation.getColony().spawn("x");
        simulation.start();

        simulation.close();

        assertThat(colonist.isAlive()).isFalse();
        assertThat(simulation.getScheduler().getState()).isEqualTo(TickScheduler.State.STOPPED);
    }

    @Test
    void spawnAfterCloseIsRefused() {
        create("dispatch.threads = 1");
        simulation.close();

        assertThatThrownBy(() -> simulation.getColony().spawn("late"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(simulation.getColony().liveColonists()).isEmpty();
        assertThat(simulation.getPresence().getSummary().totalCount()).isZero();
    }

    @Test
    void despawnThenRespawnUnderLoadKeepsPresenceExact() throws Exception {
        create("dispatch.threads = 4");
        for (int round = 0; round < 20; round++) {
            Colonist old = simulation.getColony().spawn("cycled");
            old.submitCommandAsync(new ColonistCommand.BeginForaging("cave"));
            simulation.getScheduler().fireOnce();
            simulation.getColony().despawn("cycled");
        }
        Colonist fresh = simulation.getColony().spawn("cycled");
        awaitAll(List.of(fresh));
        simulation.getScheduler().fireOnce();
        awaitAll(List.of(fresh));

        assertThat(fresh.getState().status()).isEqualTo(Activity.IDLE);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> simulation.getPresence().recount().equals(new PresenceCounts(1, 1, 0)));
        assertThat(simulation.getPresence().getSummary().counts()).isEqualTo(new PresenceCounts(1, 1, 0));
    }

    @Test
    void sameSeedGivesSamePool() {
        Integer forest = create("seed = 5").getPool().getLocations().get(ForagingLocation.FOREST);
        simulation.close();

        Integer again = create("seed = 5").getPool().getLocations().get(ForagingLocation.FOREST);

        assertThat(again).isEqualTo(forest);
    }

    @Test
    void negativeThreadCountIsRejected() {
        assertThatThrownBy(() -> ColonySimulation.resolveThreads(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(ColonySimulation.resolveThreads(0)).isGreaterThanOrEqualTo(1);
        assertThat(ColonySimulation.resolveThreads(3)).isEqualTo(3);
    }
}
