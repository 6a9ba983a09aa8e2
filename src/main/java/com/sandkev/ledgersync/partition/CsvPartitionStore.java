package com.sandkev.ledgersync.partition;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.sandkev.ledgersync.domain.CanonicalTx;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CSV files under a root directory. A write goes to a temp file in the target directory
 * and is then moved over the partition atomically, so readers never see a half-written file.
 */
@Slf4j
public class CsvPartitionStore implements PartitionStore {

    private final Path root;
    private final CsvMapper csv;
    private final CsvSchema schema;

    public CsvPartitionStore(Path root) {
        this.root = root;
        this.csv = CsvMapper.builder()
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .build();
        this.schema = csv.schemaFor(PartitionRow.class).withHeader();
    }

    @Override
    public Optional<List<CanonicalTx>> read(PartitionKey key) {
        Path file = key.resolve(root);
        if (!Files.exists(file)) return Optional.empty();
        List<CanonicalTx> out = new ArrayList<>();
        try (MappingIterator<PartitionRow> it = csv.readerFor(PartitionRow.class).with(schema).readValues(file.toFile())) {
            while (it.hasNext()) {
                out.add(it.next().toCanonical());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read partition " + key, e);
        }
        return Optional.of(out);
    }

    @Override
    public void write(PartitionKey key, List<CanonicalTx> rows) {
        Path file = key.resolve(root);
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), "." + key.fileName(), ".tmp");
            List<PartitionRow> flat = rows.stream().map(PartitionRow::of).toList();
            csv.writer(schema).writeValue(tmp.toFile(), flat);
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Wrote {} row(s) to {}", rows.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Cannot write partition " + key, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
