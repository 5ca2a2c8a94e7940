package org.observatory.cli.commands;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.typesafe.config.Config;
import org.observatory.cli.CliResourceFactory;
import org.observatory.cli.CommandLineInterface;
import org.observatory.datapipeline.replay.ReplayEngine;
import org.observatory.datapipeline.resources.ledger.FileSystemLedger;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.internal.services.WorldCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "replay",
    description = "Reconstructs the world at a committed tick and prints it as JSON."
)
public class ReplayCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-t", "--tick"}, required = true, description = "Tick to reconstruct")
    private long tick;

    @Option(names = {"-p", "--pretty"}, description = "Pretty-print the snapshot")
    private boolean pretty;

    @Override
    public Integer call() throws Exception {
        Config config = parent.getConfig();
        try (FileSystemLedger ledger = CliResourceFactory.openLedger(config)) {
            if (tick < 0 || tick > ledger.lastCommittedTick()) {
                spec.commandLine().getErr().println("Tick " + tick + " is not committed (last committed tick: "
                    + ledger.lastCommittedTick() + ")");
                return 1;
            }
            ReplayEngine replayEngine = new ReplayEngine(ledger, CliResourceFactory.openSnapshots(config));
            WorldSnapshot snapshot = replayEngine.replay(tick);
            ObjectWriter writer = pretty
                ? WorldCodec.mapper().writerWithDefaultPrettyPrinter()
                : WorldCodec.mapper().writer();
            spec.commandLine().getOut().println(writer.writeValueAsString(snapshot));
            return 0;
        }
    }
}
