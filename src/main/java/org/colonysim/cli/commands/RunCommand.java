package org.colonysim.cli.commands;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Callable;

import org.colonysim.cli.CommandLineInterface;
import org.colonysim.runtime.ColonySimulation;
import org.colonysim.runtime.colonist.Colonist;
import org.colonysim.runtime.colonist.ColonistCommand;
import org.colonysim.runtime.presence.PresenceSummary;
import org.colonysim.runtime.rules.ForagingLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a colony headless.
 * <p>
 * With {@code --ticks N} the command drives exactly N ticks as fast as the colonists process
 * them and prints the final presence summary and pool levels. Without it the wall-clock
 * scheduler runs until the JVM is interrupted.
 */
@Command(
    name = "run",
    description = "Spawn colonists and run the colony simulation"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"--colonists"},
        description = "Number of colonists to spawn (default: ${DEFAULT-VALUE})",
        defaultValue = "5"
    )
    private int colonists;

    @Option(
        names = {"--ticks"},
        description = "Drive this many ticks immediately instead of running the wall-clock scheduler (default: run until interrupted)",
        defaultValue = "0"
    )
    private int ticks;

    @Option(
        names = {"--forage-every"},
        description = "Send idle colonists foraging every N ticks (default: ${DEFAULT-VALUE})",
        defaultValue = "6"
    )
    private int forageEvery;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws InterruptedException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (colonists < 0 || ticks < 0 || forageEvery <= 0) {
            err.println("Error: --colonists and --ticks must be >= 0, --forage-every must be > 0.");
            return 1;
        }

        final Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try (ColonySimulation simulation = new ColonySimulation(config.getConfig("colony"), Clock.systemUTC())) {
            List<Colonist> spawned = new ArrayList<>();
            for (int i = 1; i <= colonists; i++) {
                spawned.add(simulation.getColony().spawn("colonist-" + i));
            }

            if (ticks > 0) {
                runTicks(simulation, spawned);
                printSummary(out, simulation);
                return 0;
            }

            CountDownLatch shutdown = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "colony-shutdown"));
            simulation.getPresence().addListener(summary -> log.info("Presence: {} total, {} idle, {} foraging",
                    summary.totalCount(), summary.idleCount(), summary.foragingCount()));
            simulation.start();
            shutdown.await();
            return 0;
        } catch (ConfigException e) {
            err.println("Error: invalid colony configuration: " + e.getMessage());
            return 1;
        }
    }

    private void runTicks(ColonySimulation simulation, List<Colonist> spawned) {
        ForagingLocation[] locations = ForagingLocation.values();
        for (int tick = 0; tick < ticks; tick++) {
            if (tick % forageEvery == 0) {
                for (int i = 0; i < spawned.size(); i++) {
                    ForagingLocation location = locations[(tick / forageEvery + i) % locations.length];
                    spawned.get(i).submitCommand(ColonistCommand.BeginForaging.at(location));
                }
            }
            simulation.getScheduler().fireOnce();
            CompletableFuture.allOf(spawned.stream()
                    .map(Colonist::fetchState)
                    .toArray(CompletableFuture[]::new)).join();
        }
        log.info("Drove {} tick(s) for {} colonist(s)", ticks, spawned.size());
    }

    private void printSummary(PrintWriter out, ColonySimulation simulation) {
        PresenceSummary summary = simulation.getPresence().getSummary();
        out.printf("Ticks issued: %d%n", simulation.getScheduler().getTicksIssued());
        out.printf("Presence: %d total, %d idle, %d foraging%n",
                summary.totalCount(), summary.idleCount(), summary.foragingCount());
        for (Map.Entry<ForagingLocation, Integer> site : simulation.getPool().getLocations().entrySet()) {
            out.printf("Site %s: %d%n", site.getKey().key(), site.getValue());
        }
        for (Colonist colonist : simulation.getColony().liveColonists()) {
            out.printf("%s: %s %s%n", colonist.getId(), colonist.getState().status(), colonist.getState().resources());
        }
        out.flush();
    }
}
