package org.observatory.datapipeline.api.resources.snapshots;

import org.observatory.datapipeline.api.resources.IResource;
import org.observatory.runtime.api.WorldSnapshot;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of periodic world snapshots. Snapshots only shorten replay; a world with no
 * snapshots at all can still be fully reconstructed from the ledger.
 */
public interface ISnapshotStore extends IResource {

    /**
     * Persists a snapshot atomically: readers see either the complete file or none.
     */
    void save(WorldSnapshot snapshot) throws IOException;

    /**
     * @return the snapshot stored for exactly this tick
     * @throws java.nio.file.NoSuchFileException if none exists
     */
    WorldSnapshot load(long tick) throws IOException;

    /**
     * @return the snapshot with the highest tick not greater than {@code tick}
     */
    Optional<WorldSnapshot> loadLatestAtOrBefore(long tick) throws IOException;

    /**
     * @return ticks of all stored snapshots in ascending order
     */
    List<Long> listTicks() throws IOException;
}
