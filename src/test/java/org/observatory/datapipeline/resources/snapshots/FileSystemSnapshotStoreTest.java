package org.observatory.datapipeline.resources.snapshots;

import com.typesafe.config.ConfigFactory;
import org.observatory.runtime.WorldEngine;
import org.observatory.runtime.actions.RegisterAction;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.internal.services.WorldCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.observatory.runtime.WorldFixtures.commit;
import static org.observatory.runtime.WorldFixtures.engine;
import static org.observatory.runtime.WorldFixtures.region;
import static org.observatory.runtime.WorldFixtures.staticRules;

@Tag("integration")
class FileSystemSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemSnapshotStore store;
    private WorldEngine engine;

    @BeforeEach
    void setUp() {
        store = new FileSystemSnapshotStore("snapshots",
            ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("state").toString())));
        engine = engine(5L, staticRules(), region("nexus", 0, 0, 10));
    }

    @Test
    void savedSnapshotLoadsWithIntactHash() throws Exception {
        commit(engine, List.of(new RegisterAction("alice", null, 0)));
        WorldSnapshot snapshot = engine.latestSnapshot();

        store.save(snapshot);
        WorldSnapshot loaded = store.load(1);

        assertEquals(snapshot, loaded);
        assertTrue(WorldCodec.hasValidHash(loaded));
        assertTrue(Files.exists(store.getDirectory().resolve("snapshot_1.json")));
        assertEquals(1L, store.getMetrics().get("snapshots_written"));
    }

    @Test
    void latestAtOrBeforePicksClosestEarlierTick() throws Exception {
        store.save(engine.latestSnapshot());
        for (int i = 0; i < 6; i++) {
            commit(engine, List.of());
            if (engine.getCurrentTick() % 3 == 0) {
                store.save(engine.latestSnapshot());
            }
        }

        assertThat(store.listTicks()).containsExactly(0L, 3L, 6L);
        assertEquals(3L, store.loadLatestAtOrBefore(5).orElseThrow().tick());
        assertEquals(6L, store.loadLatestAtOrBefore(6).orElseThrow().tick());
        assertEquals(0L, store.loadLatestAtOrBefore(2).orElseThrow().tick());
    }

    @Test
    void ignoresTempAndForeignFiles() throws Exception {
        Files.writeString(store.getDirectory().resolve("snapshot_9.json.1234.tmp"), "{");
        Files.writeString(store.getDirectory().resolve("notes.txt"), "hello");

        assertThat(store.listTicks()).isEmpty();
        assertTrue(store.loadLatestAtOrBefore(100).isEmpty());
    }

    @Test
    void missingSnapshotIsReported() {
        assertThrows(NoSuchFileException.class, () -> store.load(42));
        assertThrows(IllegalArgumentException.class, () -> store.load(-1));
        assertThrows(IllegalArgumentException.class, () -> new FileSystemSnapshotStore("bad", ConfigFactory.empty()));
    }
}
