package org.observatory.datapipeline.resources.diagnostics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.observatory.datapipeline.api.resources.diagnostics.IRejectionLog;
import org.observatory.datapipeline.resources.AbstractResource;
import org.observatory.datapipeline.utils.PathExpansion;
import org.observatory.runtime.RejectedAction;
import org.observatory.runtime.internal.services.WorldCodec;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Appends rejected actions to a JSON-lines file. Writes are best effort: no fsync, and a failure
 * is reported to the caller without affecting the tick.
 */
public class FileSystemRejectionLog extends AbstractResource implements IRejectionLog {

    private final ObjectMapper mapper = WorldCodec.mapper();
    private final Path file;
    private final AtomicLong recorded = new AtomicLong();

    /**
     * @param name    The name of the resource.
     * @param options Requires {@code file}.
     */
    public FileSystemRejectionLog(String name, Config options) {
        super(name);
        if (!options.hasPath("file")) {
            throw new IllegalArgumentException("file is required for FileSystemRejectionLog '" + name + "'");
        }
        this.file = PathExpansion.resolve(options.getString("file"));
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory for rejection log " + file, e);
        }
    }

    @Override
    public synchronized void record(List<RejectedAction> rejections) throws IOException {
        if (rejections.isEmpty()) {
            return;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (RejectedAction rejection : rejections) {
            out.write(mapper.writeValueAsBytes(rejection));
            out.write('\n');
        }
        Files.write(file, out.toByteArray(), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        recorded.addAndGet(rejections.size());
    }

    @Override
    public synchronized List<RejectedAction> readAll() throws IOException {
        List<RejectedAction> result = new ArrayList<>();
        if (!Files.exists(file)) {
            return result;
        }
        try (BufferedReader reader = Files.newBufferedReader(file)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    result.add(mapper.readValue(line, RejectedAction.class));
                }
            }
        }
        return result;
    }

    @Override
    public ResourceState getState() {
        return ResourceState.ACTIVE;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("rejections_recorded", recorded.get());
    }
}
