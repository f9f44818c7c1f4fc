package io.histingest.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.histingest.core.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * One JSON file per job id under a directory. Each write replaces the file atomically.
 */
public class FileOperationStateStore implements OperationStateStore {
    private static final Logger log = LoggerFactory.getLogger(FileOperationStateStore.class);

    private final Path dir;
    private final ObjectMapper mapper = Json.mapper();
    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public FileOperationStateStore(Path dir) throws IOException {
        this.dir = dir;
        Files.createDirectories(dir);
    }

    @Override
    public Optional<OperationSnapshot> get(String jobId) throws IOException {
        Path p = fileFor(jobId);
        synchronized (lockFor(jobId)) {
            if (!Files.exists(p)) return Optional.empty();
            return Optional.of(mapper.readValue(p.toFile(), OperationSnapshot.class));
        }
    }

    @Override
    public void put(OperationSnapshot snapshot) throws IOException {
        Path target = fileFor(snapshot.jobId());
        Path tmp = dir.resolve("." + target.getFileName() + ".tmp");
        synchronized (lockFor(snapshot.jobId())) {
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    @Override
    public List<OperationSnapshot> list() throws IOException {
        List<OperationSnapshot> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : files.filter(f -> f.getFileName().toString().endsWith(".json")).toList()) {
                try {
                    out.add(mapper.readValue(p.toFile(), OperationSnapshot.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable state file {}: {}", p, e.getMessage());
                }
            }
        }
        out.sort(Comparator.comparing(OperationSnapshot::startedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return out;
    }

    @Override
    public boolean delete(String jobId) throws IOException {
        synchronized (lockFor(jobId)) {
            return Files.deleteIfExists(fileFor(jobId));
        }
    }

    private Object lockFor(String jobId) {
        return locks.computeIfAbsent(jobId, k -> new Object());
    }

    private Path fileFor(String jobId) {
        return dir.resolve(jobId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }
}
