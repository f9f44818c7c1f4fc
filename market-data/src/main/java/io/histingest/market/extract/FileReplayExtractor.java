package io.histingest.market.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.histingest.core.Chunk;
import io.histingest.core.Json;
import io.histingest.market.job.JobConfig;
import io.histingest.market.model.RawRecord;
import io.histingest.market.schema.SymbolType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Replays provider-native records from JSON-lines files laid out as
 * {@code <root>/<dataset>/<schema>/*.jsonl}. An optional {@code <root>/<dataset>/symbols.txt}
 * lists the symbols the dataset knows; requesting any other symbol fails the job up front.
 */
public class FileReplayExtractor implements Extractor {
    public static final String PROVIDER = "replay";
    public static final String ALL_SYMBOLS = "ALL_SYMBOLS";

    private static final Logger log = LoggerFactory.getLogger(FileReplayExtractor.class);
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() { };
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Path root;
    private final ObjectMapper mapper = Json.mapper();

    public FileReplayExtractor(Path root) {
        this.root = root;
    }

    @Override
    public String provider() { return PROVIDER; }

    @Override
    public ChunkStream stream(JobConfig job) throws ProviderException {
        Path datasetDir = root.resolve(job.dataset());
        if (!Files.isDirectory(datasetDir)) {
            throw ProviderException.permanentFailure("dataset_unavailable",
                    "dataset '" + job.dataset() + "' is not available", "available datasets: " + listDirs(root));
        }
        String schemaName = job.schemaRef().canonicalName();
        Path schemaDir = datasetDir.resolve(schemaName);
        if (!Files.isDirectory(schemaDir)) {
            throw ProviderException.permanentFailure("schema_unavailable",
                    "schema '" + schemaName + "' is not available for dataset '" + job.dataset() + "'",
                    "available schemas: " + listDirs(datasetDir));
        }
        checkSymbols(datasetDir, job);
        List<Path> files;
        try (Stream<Path> s = Files.list(schemaDir)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(".jsonl")).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw ProviderException.transientFailure("list_failed", "cannot list " + schemaDir + ": " + e.getMessage(), e);
        }
        log.info("Replaying {} file(s) from {} for {} {}", files.size(), schemaDir, job.symbols(), job.schemaRef());
        return new ReplayStream(files, job);
    }

    private void checkSymbols(Path datasetDir, JobConfig job) throws ProviderException {
        Path index = datasetDir.resolve("symbols.txt");
        if (!Files.exists(index) || job.symbols().contains(ALL_SYMBOLS)) return;
        Set<String> known;
        try (Stream<String> lines = Files.lines(index)) {
            known = lines.map(String::trim).filter(l -> !l.isEmpty()).collect(Collectors.toSet());
        } catch (IOException e) {
            throw ProviderException.transientFailure("index_unreadable", "cannot read " + index + ": " + e.getMessage(), e);
        }
        List<String> unknown = job.symbols().stream().filter(s -> !known.contains(s)).collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw ProviderException.permanentFailure("symbol_not_found",
                    "symbol(s) " + unknown + " not recognized for dataset '" + job.dataset() + "'",
                    "check the symbol spelling and the stype_in mode (" + job.stypeIn().wireName() + ")");
        }
    }

    private static String listDirs(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isDirectory).map(p -> p.getFileName().toString()).sorted().collect(Collectors.joining(", "));
        } catch (IOException e) {
            return "unknown";
        }
    }

    private final class ReplayStream implements ChunkStream {
        private final List<Path> files;
        private final JobConfig job;
        private final Set<String> symbols;
        private final boolean allSymbols;
        private int fileIndex;
        private BufferedReader reader;
        private List<RawRecord> pending = new ArrayList<>();
        private long seq;

        ReplayStream(List<Path> files, JobConfig job) {
            this.files = files;
            this.job = job;
            this.symbols = new HashSet<>(job.symbols());
            this.allSymbols = symbols.contains(ALL_SYMBOLS);
        }

        @Override
        public synchronized Optional<Chunk<RawRecord>> next() throws ProviderException {
            while (pending.size() < job.chunkSize()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw ProviderException.transientFailure("interrupted", "replay of " + job.dataset() + " interrupted", null);
                }
                String line;
                try {
                    if (reader == null) {
                        if (fileIndex >= files.size()) break;
                        reader = Files.newBufferedReader(files.get(fileIndex));
                    }
                    line = reader.readLine();
                } catch (IOException e) {
                    throw ProviderException.transientFailure("read_failed",
                            "failed reading " + files.get(fileIndex) + ": " + e.getMessage(), e);
                }
                if (line == null) {
                    closeReader();
                    fileIndex++;
                    continue;
                }
                if (line.isBlank()) continue;
                RawRecord r = parse(line);
                if (matches(r)) pending.add(r);
            }
            if (pending.isEmpty()) return Optional.empty();
            Chunk<RawRecord> chunk = new Chunk<>(seq++, pending);
            pending = new ArrayList<>();
            return Optional.of(chunk);
        }

        /** Counts matching records with a separate pass over the files. */
        @Override
        public OptionalLong estimatedTotal() {
            long total = 0;
            for (Path f : files) {
                try (Stream<String> lines = Files.lines(f)) {
                    total += lines.filter(l -> !l.isBlank()).map(this::parse).filter(this::matches).count();
                } catch (IOException | UncheckedIOException e) {
                    log.debug("Cannot size replay file {}: {}", f, e.getMessage());
                    return OptionalLong.empty();
                }
            }
            return OptionalLong.of(total);
        }

        private RawRecord parse(String line) {
            try {
                return RawRecord.of(mapper.readValue(line, MAP));
            } catch (JsonProcessingException e) {
                return RawRecord.unparsable(line, "malformed JSON: " + e.getOriginalMessage());
            }
        }

        private boolean matches(RawRecord r) {
            if (r.isUnparsable()) return true;
            if (!allSymbols) {
                Object id = job.stypeIn() == SymbolType.INSTRUMENT_ID ? r.get("instrument_id")
                        : (r.has("symbol") ? r.get("symbol") : r.get("raw_symbol"));
                if (id != null && !symbols.contains(id.toString())) return false;
            }
            LocalDate day = eventDate(r.get("ts_event"));
            return day == null || (!day.isBefore(job.startDate()) && !day.isAfter(job.endDate()));
        }

        @Override
        public synchronized void close() {
            closeReader();
        }

        private void closeReader() {
            if (reader == null) return;
            try {
                reader.close();
            } catch (IOException e) {
                log.debug("Closing replay file failed: {}", e.getMessage());
            }
            reader = null;
        }
    }

    /** Event date in UTC, or null when the value cannot be read (the transformer reports it). */
    static LocalDate eventDate(Object ts) {
        Instant at = null;
        if (ts instanceof Long || ts instanceof Integer) {
            long n = ((Number) ts).longValue();
            at = Instant.ofEpochSecond(Math.floorDiv(n, NANOS_PER_SECOND), Math.floorMod(n, NANOS_PER_SECOND));
        } else if (ts instanceof BigInteger) {
            return null;
        } else if (ts instanceof String) {
            String s = ((String) ts).trim();
            try {
                if (s.length() == 10) return LocalDate.parse(s);
                at = Instant.parse(s);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return at == null ? null : at.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
