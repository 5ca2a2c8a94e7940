package org.observatory.cli.commands;

import com.typesafe.config.Config;
import org.observatory.cli.CliResourceFactory;
import org.observatory.cli.CommandLineInterface;
import org.observatory.datapipeline.replay.ReplayEngine;
import org.observatory.datapipeline.replay.ReplayIntegrityException;
import org.observatory.datapipeline.replay.VerificationReport;
import org.observatory.datapipeline.resources.ledger.FileSystemLedger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "verify",
    description = "Replays the full ledger and checks every recorded state hash and stored snapshot."
)
public class VerifyCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        try (FileSystemLedger ledger = CliResourceFactory.openLedger(config)) {
            if (ledger.isEmpty()) {
                spec.commandLine().getErr().println("Ledger '" + ledger.getFile() + "' is empty, nothing to verify");
                return 1;
            }
            VerificationReport report = new ReplayEngine(ledger, CliResourceFactory.openSnapshots(config)).verify();
            out.println("=== Verification OK ===");
            out.println("Final tick: " + report.finalTick());
            out.println("Events applied: " + report.eventsApplied());
            out.println("Ticks verified: " + report.ticksVerified());
            out.println("Snapshots checked: " + report.snapshotsChecked());
            out.println("Final state hash: " + report.finalStateHash());
            return 0;
        } catch (ReplayIntegrityException e) {
            spec.commandLine().getErr().println("Verification FAILED: " + e.getMessage());
            return 2;
        }
    }
}
