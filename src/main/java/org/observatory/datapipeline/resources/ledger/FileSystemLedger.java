package org.observatory.datapipeline.resources.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.observatory.datapipeline.api.resources.ledger.ILedgerResource;
import org.observatory.datapipeline.api.resources.ledger.LedgerCorruptedException;
import org.observatory.datapipeline.api.resources.ledger.LedgerWriteException;
import org.observatory.datapipeline.resources.AbstractResource;
import org.observatory.datapipeline.utils.PathExpansion;
import org.observatory.runtime.events.EventPayloads;
import org.observatory.runtime.events.EventType;
import org.observatory.runtime.events.LedgerEvent;
import org.observatory.runtime.internal.services.WorldCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only ledger stored as one JSON object per line in a single file.
 * <p>
 * <strong>Batches:</strong> each append writes one tick's events with a single channel write and
 * forces them to the device before returning. Every batch ends with a terminator event
 * ({@code WORLD_CREATED} or {@code TICK_COMPLETED}), which makes a crash in the middle of a write
 * detectable: on open, everything after the last complete terminator line is truncated. If a
 * write fails, the file is truncated back to its length before the write; if even that fails, the
 * ledger refuses all further appends ({@link ResourceState#FAILED}).
 * <p>
 * <strong>Reads:</strong> committed events are mirrored in memory, so range queries never touch
 * the file and never observe a partial batch.
 * <p>
 * <strong>Thread Safety:</strong> one writer, any number of concurrent readers.
 */
public class FileSystemLedger extends AbstractResource implements ILedgerResource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemLedger.class);
    private static final byte NEWLINE = '\n';

    private final ObjectMapper mapper = WorldCodec.mapper();
    private final Path file;
    private final FileChannel channel;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<LedgerEvent> events = new ArrayList<>();
    private final NavigableMap<Long, String> tickHashes = new TreeMap<>();
    private long lastTick = -1;
    private long committedLength;
    private volatile boolean failed = false;

    private long batchesAppended = 0;
    private long bytesWritten = 0;
    private long truncatedBytesOnOpen = 0;

    /**
     * Opens (or creates) the ledger file named by the {@code file} option and recovers its
     * committed content.
     *
     * @throws IllegalArgumentException if {@code file} is missing
     * @throws LedgerCorruptedException if committed content is structurally broken
     * @throws UncheckedIOException     if the file cannot be opened or read
     */
    public FileSystemLedger(String name, Config options) {
        super(name);
        if (!options.hasPath("file")) {
            throw new IllegalArgumentException("file is required for FileSystemLedger '" + name + "'");
        }
        this.file = PathExpansion.resolve(options.getString("file"));
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.error("Cannot open ledger file '{}'", file);
            throw new UncheckedIOException("Cannot open ledger file " + file, e);
        }
        try {
            recover();
        } catch (IOException e) {
            closeQuietly();
            log.error("Cannot read ledger file '{}'", file);
            throw new UncheckedIOException("Cannot read ledger file " + file, e);
        } catch (RuntimeException e) {
            closeQuietly();
            throw e;
        }
    }

    private void recover() throws IOException {
        byte[] content = Files.readAllBytes(file);
        List<LedgerEvent> pending = new ArrayList<>();
        boolean pendingBroken = false;
        int lineStart = 0;

        for (int i = 0; i < content.length; i++) {
            if (content[i] != NEWLINE) {
                continue;
            }
            String line = new String(content, lineStart, i - lineStart, StandardCharsets.UTF_8);
            int lineEnd = i + 1;
            lineStart = lineEnd;
            if (line.isBlank()) {
                continue;
            }

            LedgerEvent event;
            try {
                event = mapper.readValue(line, LedgerEvent.class);
            } catch (IOException e) {
                log.debug("Unreadable ledger line ending at byte {}: {}", lineEnd, e.getMessage());
                pendingBroken = true;
                continue;
            }

            long expectedSequence = events.size() + pending.size();
            if (event.sequence() != expectedSequence) {
                pendingBroken = true;
            }
            pending.add(event);

            if (event.type().isBatchTerminator()) {
                if (pendingBroken) {
                    throw new LedgerCorruptedException("Ledger " + file + " holds a damaged batch ending at sequence "
                        + event.sequence() + " followed by committed data");
                }
                commitInMemory(pending);
                committedLength = lineEnd;
                pending.clear();
            }
        }

        long tornBytes = content.length - committedLength;
        if (tornBytes > 0) {
            log.warn("Ledger '{}' ends with {} bytes of an incomplete batch after sequence {}, truncating",
                file, tornBytes, events.size() - 1);
            channel.truncate(committedLength);
            channel.force(true);
            truncatedBytesOnOpen = tornBytes;
        }
        log.debug("Ledger '{}' opened with {} events up to tick {}", file, events.size(), lastTick);
    }

    private void commitInMemory(List<LedgerEvent> batch) {
        long tick = batch.get(0).tick();
        for (LedgerEvent event : batch) {
            if (event.tick() != tick) {
                throw new LedgerCorruptedException("Batch ending at sequence " + batch.get(batch.size() - 1).sequence()
                    + " mixes ticks " + tick + " and " + event.tick());
            }
        }
        if (tick <= lastTick) {
            throw new LedgerCorruptedException("Batch for tick " + tick + " does not advance past tick " + lastTick);
        }
        LedgerEvent terminator = batch.get(batch.size() - 1);
        if (terminator.type() == EventType.TICK_COMPLETED) {
            String hash = WorldCodec.fromPayload(terminator.payload(), EventPayloads.TickCompleted.class).stateHash();
            if (hash != null) {
                tickHashes.put(tick, hash);
            }
        }
        events.addAll(batch);
        lastTick = tick;
    }

    @Override
    public void appendBatch(List<LedgerEvent> batch) throws LedgerWriteException {
        lock.writeLock().lock();
        try {
            if (failed) {
                throw new LedgerWriteException("Ledger '" + resourceName + "' is in FAILED state and refuses appends");
            }
            checkContinuation(batch);

            byte[] bytes = encode(batch);
            long before = committedLength;
            try {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                long position = before;
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(true);
            } catch (IOException e) {
                rollback(before);
                throw new LedgerWriteException("Failed to append batch for tick " + batch.get(0).tick()
                    + " to ledger '" + resourceName + "'", e);
            }

            committedLength = before + bytes.length;
            commitInMemory(batch);
            batchesAppended++;
            bytesWritten += bytes.length;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void checkContinuation(List<LedgerEvent> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch");
        }
        long expected = events.size();
        for (int i = 0; i < batch.size(); i++) {
            LedgerEvent event = batch.get(i);
            if (event.sequence() != expected + i) {
                throw new IllegalArgumentException("Event at batch position " + i + " has sequence " + event.sequence()
                    + ", expected " + (expected + i));
            }
            boolean last = i == batch.size() - 1;
            if (event.type().isBatchTerminator() != last) {
                throw new IllegalArgumentException("Batch must end with exactly one terminator event, found "
                    + event.type() + " at position " + i);
            }
        }
        long tick = batch.get(0).tick();
        if (tick <= lastTick) {
            throw new IllegalArgumentException("Batch tick " + tick + " does not advance past tick " + lastTick);
        }
    }

    private byte[] encode(List<LedgerEvent> batch) throws LedgerWriteException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            for (LedgerEvent event : batch) {
                out.write(mapper.writeValueAsBytes(event));
                out.write(NEWLINE);
            }
        } catch (IOException e) {
            throw new LedgerWriteException("Cannot serialize batch for tick " + batch.get(0).tick(), e);
        }
        return out.toByteArray();
    }

    private void rollback(long length) {
        try {
            channel.truncate(length);
            channel.force(true);
            log.debug("Rolled back ledger '{}' to {} bytes after failed append", resourceName, length);
        } catch (IOException e) {
            failed = true;
            log.error("Ledger '{}' could not be rolled back to {} bytes, refusing further appends", resourceName, length);
            log.debug("Rollback failure details:", e);
        }
    }

    @Override
    public List<LedgerEvent> readAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<LedgerEvent> readRange(long fromTick, long toTick) {
        if (fromTick > toTick) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            int from = firstIndexAtOrAfter(fromTick);
            int to = firstIndexAtOrAfter(toTick + 1);
            return List.copyOf(events.subList(from, to));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<LedgerEvent> readForAgent(String agentId, long fromTick, long toTick) {
        return readRange(fromTick, toTick).stream()
            .filter(event -> event.concerns(agentId))
            .toList();
    }

    /**
     * Binary search over the tick-ordered event list.
     */
    private int firstIndexAtOrAfter(long tick) {
        int low = 0;
        int high = events.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (events.get(mid).tick() < tick) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @Override
    public long lastCommittedTick() {
        lock.readLock().lock();
        try {
            return lastTick;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long nextSequence() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<String> recordedStateHash(long tick) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tickHashes.get(tick));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return ticks whose TICK_COMPLETED event recorded a state hash, ascending
     */
    public List<Long> hashedTicks() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(tickHashes.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getFile() {
        return file;
    }

    @Override
    public ResourceState getState() {
        return failed ? ResourceState.FAILED : ResourceState.ACTIVE;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        lock.readLock().lock();
        try {
            metrics.put("events_total", events.size());
            metrics.put("last_tick", lastTick);
            metrics.put("batches_appended", batchesAppended);
            metrics.put("bytes_written", bytesWritten);
            metrics.put("truncated_bytes_on_open", truncatedBytesOnOpen);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException e) {
            log.warn("Failed to close ledger file '{}': {}", file, e.getMessage());
            recordError("CLOSE_FAILED", "Failed to close ledger file", e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void closeQuietly() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure after failed open of '{}'", file, e);
        }
    }
}
