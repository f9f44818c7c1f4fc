package io.histingest.market.extract;

import io.histingest.core.Chunk;
import io.histingest.core.ErrorKind;
import io.histingest.market.job.JobConfig;
import io.histingest.market.model.RawRecord;
import io.histingest.market.schema.SymbolType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FileReplayExtractorTest {
    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);

    private Path root;
    private FileReplayExtractor extractor;

    @BeforeEach
    void setup() throws Exception {
        root = Files.createTempDirectory("replay");
        extractor = new FileReplayExtractor(root);
        List<String> lines = new ArrayList<>();
        for (int d = 0; d < 10; d++) {
            lines.add(ReplayFixtures.bar(1, JAN_1.plusDays(d), "ESH4", "10", "12", "9", "11", 100));
            lines.add(ReplayFixtures.bar(2, JAN_1.plusDays(d), "NQH4", "10", "12", "9", "11", 100));
        }
        ReplayFixtures.write(root, "GLBX.MDP3", "ohlcv-1d", "part-0.jsonl", lines);
        ReplayFixtures.symbols(root, "GLBX.MDP3", "ESH4", "NQH4");
    }

    private static JobConfig.Builder job() {
        return JobConfig.builder().name("t").provider(FileReplayExtractor.PROVIDER).dataset("GLBX.MDP3")
                .schema("ohlcv-1d").symbols("ESH4").dates(JAN_1, JAN_1.plusDays(9)).chunkSize(4);
    }

    private static List<Chunk<RawRecord>> drain(ChunkStream s) throws ProviderException {
        List<Chunk<RawRecord>> out = new ArrayList<>();
        Optional<Chunk<RawRecord>> c;
        while ((c = s.next()).isPresent()) out.add(c.get());
        return out;
    }

    @Test
    void chunks_filtered_records_in_order() throws Exception {
        try (ChunkStream s = extractor.stream(job().build())) {
            List<Chunk<RawRecord>> chunks = drain(s);

            assertEquals(3, chunks.size());
            assertEquals(List.of(0L, 1L, 2L), List.of(chunks.get(0).seq(), chunks.get(1).seq(), chunks.get(2).seq()));
            assertEquals(4, chunks.get(0).size());
            assertEquals(2, chunks.get(2).size());
            assertTrue(chunks.stream().flatMap(c -> c.records().stream()).allMatch(r -> "ESH4".equals(r.get("symbol"))));
            assertTrue(s.next().isEmpty());
        }
    }

    @Test
    void estimates_the_matching_record_count_up_front() throws Exception {
        try (ChunkStream s = extractor.stream(job().dates(JAN_1, JAN_1.plusDays(4)).build())) {
            assertEquals(5, s.estimatedTotal().orElseThrow());
            assertEquals(5, drain(s).stream().mapToInt(Chunk::size).sum());
        }
    }

    @Test
    void date_range_is_inclusive() throws Exception {
        JobConfig c = job().dates(JAN_1.plusDays(2), JAN_1.plusDays(3)).symbols("ESH4", "NQH4").build();
        try (ChunkStream s = extractor.stream(c)) {
            assertEquals(4, drain(s).stream().mapToInt(Chunk::size).sum());
        }
    }

    @Test
    void filters_by_instrument_id_when_requested() throws Exception {
        JobConfig c = job().symbols("2").stypeIn(SymbolType.INSTRUMENT_ID).build();
        Files.delete(root.resolve("GLBX.MDP3").resolve("symbols.txt"));
        try (ChunkStream s = extractor.stream(c)) {
            List<Chunk<RawRecord>> chunks = drain(s);
            assertEquals(10, chunks.stream().mapToInt(Chunk::size).sum());
            assertTrue(chunks.stream().flatMap(ch -> ch.records().stream()).allMatch(r -> "NQH4".equals(r.get("symbol"))));
        }
    }

    @Test
    void empty_range_yields_no_chunks() throws Exception {
        JobConfig c = job().dates(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 1, 31)).build();
        try (ChunkStream s = extractor.stream(c)) {
            assertTrue(s.next().isEmpty());
        }
    }

    @Test
    void unknown_symbol_is_permanent_with_remediation() {
        ProviderException e = assertThrows(ProviderException.class, () -> extractor.stream(job().symbols("ZZZ9").build()));

        assertEquals("symbol_not_found", e.code());
        assertEquals(ErrorKind.PROVIDER_PERMANENT, e.kind());
        assertFalse(e.isTransient());
        assertTrue(e.remediation().contains("continuous"));
    }

    @Test
    void all_symbols_bypasses_the_index() throws Exception {
        try (ChunkStream s = extractor.stream(job().symbols(FileReplayExtractor.ALL_SYMBOLS).build())) {
            assertEquals(20, drain(s).stream().mapToInt(Chunk::size).sum());
        }
    }

    @Test
    void unknown_dataset_and_schema_are_permanent() {
        ProviderException ds = assertThrows(ProviderException.class, () -> extractor.stream(job().dataset("XNAS.ITCH").build()));
        assertEquals("dataset_unavailable", ds.code());
        assertTrue(ds.remediation().contains("GLBX.MDP3"));

        ProviderException schema = assertThrows(ProviderException.class, () -> extractor.stream(job().schema("trades").build()));
        assertEquals("schema_unavailable", schema.code());
    }

    @Test
    void malformed_lines_surface_as_unparsable_records() throws Exception {
        ReplayFixtures.write(root, "GLBX.MDP3", "ohlcv-1d", "part-1.jsonl", List.of("{not json"));
        try (ChunkStream s = extractor.stream(job().chunkSize(100).build())) {
            List<RawRecord> all = new ArrayList<>();
            drain(s).forEach(c -> all.addAll(c.records()));

            assertEquals(11, all.size());
            RawRecord last = all.get(all.size() - 1);
            assertTrue(last.isUnparsable());
            assertEquals("{not json", last.get(RawRecord.UNPARSED));
        }
    }
}
