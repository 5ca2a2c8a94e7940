package org.observatory.datapipeline.resources.diagnostics;

import com.typesafe.config.ConfigFactory;
import org.observatory.runtime.RejectedAction;
import org.observatory.runtime.actions.ActionType;
import org.observatory.runtime.validation.RejectionReason;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@Tag("integration")
class FileSystemRejectionLogTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsAcrossCallsAndReadsBack() throws Exception {
        Path file = tempDir.resolve("diag/rejections.jsonl");
        FileSystemRejectionLog log = new FileSystemRejectionLog("rejections", ConfigFactory.parseMap(Map.of("file", file.toString())));
        RejectedAction full = new RejectedAction(4, ActionType.MOVE, "b", RejectionReason.REGION_FULL, "Region 'nexus' is full");
        RejectedAction unknown = new RejectedAction(5, ActionType.OBSERVE, "ghost", RejectionReason.UNKNOWN_AGENT, "No agent 'ghost'");

        assertThat(log.readAll()).isEmpty();
        log.record(List.of());
        assertFalse(Files.exists(file));

        log.record(List.of(full));
        log.record(List.of(unknown));

        assertThat(log.readAll()).containsExactly(full, unknown);
        assertEquals(2, Files.readAllLines(file).size());
        assertEquals(2L, log.getMetrics().get("rejections_recorded"));
    }
}
