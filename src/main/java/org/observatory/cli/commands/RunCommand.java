package org.observatory.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.observatory.cli.CommandLineInterface;
import org.observatory.datapipeline.api.services.IService;
import org.observatory.node.WorldNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Creates or recovers the configured world and runs its tick loop."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-t", "--ticks"}, description = "Stop after this many ticks (default: run until interrupted).")
    private Long ticks;

    @Override
    public Integer call() throws Exception {
        Config config = parent.getConfig();
        if (ticks != null) {
            if (ticks <= 0) {
                throw new IllegalArgumentException("--ticks must be positive, got " + ticks);
            }
            config = ConfigFactory.parseMap(Map.of("observatory.scheduler.maxTicks", ticks)).withFallback(config);
        }

        try (WorldNode node = new WorldNode(config)) {
            node.start();
            if (ticks == null) {
                LOGGER.info("Running until interrupted.");
            }
            IService.State finalState = node.awaitTermination();
            return finalState == IService.State.ERROR ? 1 : 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("World stopped gracefully.");
            return 0;
        }
    }
}
