package org.observatory.cli.commands;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.typesafe.config.Config;
import org.observatory.cli.CliResourceFactory;
import org.observatory.cli.CommandLineInterface;
import org.observatory.datapipeline.resources.ledger.FileSystemLedger;
import org.observatory.runtime.events.LedgerEvent;
import org.observatory.runtime.internal.services.WorldCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "events",
    description = "Prints committed ledger events as JSON lines."
)
public class EventsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-a", "--agent"}, description = "Only events naming this agent")
    private String agentId;

    @Option(names = {"-f", "--from"}, description = "First tick (default: 0)")
    private long fromTick = 0;

    @Option(names = {"-t", "--to"}, description = "Last tick (default: last committed tick)")
    private Long toTick;

    @Override
    public Integer call() throws Exception {
        Config config = parent.getConfig();
        try (FileSystemLedger ledger = CliResourceFactory.openLedger(config)) {
            long to = toTick != null ? toTick : ledger.lastCommittedTick();
            List<LedgerEvent> events = agentId != null
                ? ledger.readForAgent(agentId, fromTick, to)
                : ledger.readRange(fromTick, to);
            ObjectWriter writer = WorldCodec.mapper().writer();
            PrintWriter out = spec.commandLine().getOut();
            for (LedgerEvent event : events) {
                out.println(writer.writeValueAsString(event));
            }
            out.flush();
            return 0;
        }
    }
}
