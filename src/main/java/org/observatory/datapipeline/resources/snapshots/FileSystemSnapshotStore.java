package org.observatory.datapipeline.resources.snapshots;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.observatory.datapipeline.api.resources.snapshots.ISnapshotStore;
import org.observatory.datapipeline.resources.AbstractResource;
import org.observatory.datapipeline.utils.PathExpansion;
import org.observatory.runtime.api.WorldSnapshot;
import org.observatory.runtime.internal.services.WorldCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores snapshots as {@code snapshot_<tick>.json} files in a state directory.
 * <p>
 * Writes go to a uniquely named temp file first and are then moved into place with
 * {@link StandardCopyOption#ATOMIC_MOVE}, so a crash never leaves a half-written snapshot under
 * the final name. Leftover temp files are ignored by all readers.
 */
public class FileSystemSnapshotStore extends AbstractResource implements ISnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSnapshotStore.class);
    private static final Pattern SNAPSHOT_NAME = Pattern.compile("snapshot_(\\d+)\\.json");

    private final ObjectMapper mapper = WorldCodec.mapper();
    private final Path directory;
    private final AtomicLong snapshotsWritten = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();

    /**
     * @param name    The name of the resource.
     * @param options Requires {@code directory}, the state directory (created if missing).
     */
    public FileSystemSnapshotStore(String name, Config options) {
        super(name);
        if (!options.hasPath("directory")) {
            throw new IllegalArgumentException("directory is required for FileSystemSnapshotStore '" + name + "'");
        }
        this.directory = PathExpansion.resolve(options.getString("directory"));
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create snapshot directory " + directory, e);
        }
    }

    @Override
    public void save(WorldSnapshot snapshot) throws IOException {
        Path target = pathFor(snapshot.tick());
        Path tempFile = directory.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        byte[] data = mapper.writeValueAsBytes(snapshot);
        Files.write(tempFile, data);
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile);
            }
            throw e;
        }
        snapshotsWritten.incrementAndGet();
        bytesWritten.addAndGet(data.length);
        log.debug("Wrote snapshot of tick {} to '{}' ({} bytes)", snapshot.tick(), target, data.length);
    }

    @Override
    public WorldSnapshot load(long tick) throws IOException {
        Path path = pathFor(tick);
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return mapper.readValue(path.toFile(), WorldSnapshot.class);
    }

    @Override
    public Optional<WorldSnapshot> loadLatestAtOrBefore(long tick) throws IOException {
        Long best = null;
        for (Long candidate : listTicks()) {
            if (candidate <= tick) {
                best = candidate;
            }
        }
        return best == null ? Optional.empty() : Optional.of(load(best));
    }

    @Override
    public List<Long> listTicks() throws IOException {
        List<Long> ticks = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.forEach(path -> {
                Matcher matcher = SNAPSHOT_NAME.matcher(path.getFileName().toString());
                if (matcher.matches()) {
                    ticks.add(Long.parseLong(matcher.group(1)));
                }
            });
        }
        ticks.sort(null);
        return ticks;
    }

    private Path pathFor(long tick) {
        if (tick < 0) {
            throw new IllegalArgumentException("Tick must not be negative: " + tick);
        }
        return directory.resolve("snapshot_" + tick + ".json");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public ResourceState getState() {
        return ResourceState.ACTIVE;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("snapshots_written", snapshotsWritten.get());
        metrics.put("bytes_written", bytesWritten.get());
    }
}
