package io.histingest.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.histingest.core.ErrorKind;
import io.histingest.core.Json;
import io.histingest.core.PipelineError;
import io.histingest.core.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Writes each entry as a pretty-printed JSON document under {@code <base>/<job name>/}.
 * Files are written to a temp name and moved into place, so readers never see partial entries.
 */
public class FileQuarantineSink implements QuarantineSink {
    private static final Logger log = LoggerFactory.getLogger(FileQuarantineSink.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Path baseDir;
    private final ObjectMapper mapper;

    public FileQuarantineSink(Path baseDir) {
        this.baseDir = baseDir;
        this.mapper = Json.mapper();
    }

    public Path baseDir() { return baseDir; }

    @Override
    public Result<String> record(QuarantineEntry entry) {
        Path dir = baseDir.resolve(safe(entry.jobName()));
        Object chunk = entry.context().getOrDefault("chunk_seq", "na");
        String name = STAMP.format(entry.timestamp()) + "_chunk-" + chunk + "_" + safe(entry.errorType())
                + "_" + UUID.randomUUID().toString().substring(0, 8) + ".json";
        Path target = dir.resolve(name);
        Path tmp = dir.resolve("." + name + ".tmp");
        try {
            Files.createDirectories(dir);
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entry);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return Result.ok(target.toString());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to quarantine {} records for job {}: {}", entry.recordCount(), entry.jobName(), e.getMessage());
            deleteQuietly(tmp);
            return Result.err(PipelineError.of(ErrorKind.QUARANTINE_PERSISTENCE, "write_failed",
                    "could not write quarantine entry to " + target + ": " + e.getMessage(), e));
        }
    }

    @Override
    public String locationFor(String jobName) {
        return baseDir.resolve(safe(jobName)).toString();
    }

    /**
     * Reads back every entry written for a job, oldest first.
     */
    public List<QuarantineEntry> entries(String jobName) throws IOException {
        Path dir = baseDir.resolve(safe(jobName));
        if (!Files.isDirectory(dir)) return List.of();
        List<QuarantineEntry> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            List<Path> sorted = files
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
            for (Path p : sorted) {
                out.add(mapper.readValue(p.toFile(), QuarantineEntry.class));
            }
        }
        return out;
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", p, e.getMessage());
        }
    }

    static String safe(String s) {
        if (s == null || s.isBlank()) return "unnamed";
        return s.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
