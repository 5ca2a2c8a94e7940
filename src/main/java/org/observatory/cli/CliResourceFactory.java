package org.observatory.cli;

import com.typesafe.config.Config;
import org.observatory.datapipeline.resources.ledger.FileSystemLedger;
import org.observatory.datapipeline.resources.snapshots.FileSystemSnapshotStore;

/**
 * Opens the storage resources of a configured world for the offline commands, without creating or
 * running the world.
 */
public final class CliResourceFactory {

    private static final String STORAGE_CONFIG_PATH = "observatory.storage";

    private CliResourceFactory() {
        // Utility class
    }

    public static FileSystemLedger openLedger(Config config) {
        return new FileSystemLedger("ledger", config.getConfig(STORAGE_CONFIG_PATH + ".ledger"));
    }

    public static FileSystemSnapshotStore openSnapshots(Config config) {
        return new FileSystemSnapshotStore("snapshots", config.getConfig(STORAGE_CONFIG_PATH + ".snapshots"));
    }
}
