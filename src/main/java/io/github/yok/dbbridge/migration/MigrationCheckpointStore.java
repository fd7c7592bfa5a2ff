package io.github.yok.dbbridge.migration;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Persists a {@link MigrationCursor} as a YAML file so a run can be resumed by another process.
 *
 * <pre>
 * version: 1
 * tables:
 *   users:
 *     committed-offset: 1000
 *     committed-ranges:
 *     - start: 1500
 *       end: 2000
 * </pre>
 *
 * <p>
 * Writes go to a temporary file that replaces the checkpoint, so a crash never leaves a truncated
 * file behind.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MigrationCheckpointStore {

    static final int FORMAT_VERSION = 1;

    private final Path file;

    /**
     * Creates a store for a checkpoint file.
     *
     * @param file checkpoint path; need not exist yet
     */
    public MigrationCheckpointStore(Path file) {
        this.file = file;
    }

    /**
     * Loads the cursor from the checkpoint file.
     *
     * @return stored cursor, or an empty cursor if the file does not exist
     * @throws UncheckedIOException if the file cannot be read
     * @throws IllegalStateException if the file is not a checkpoint
     */
    public MigrationCursor load() {
        MigrationCursor cursor = new MigrationCursor();
        if (!Files.exists(file)) {
            log.info("Checkpoint {} not found → starting from offset 0", file.toAbsolutePath());
            return cursor;
        }
        Object root;
        try (InputStream in = Files.newInputStream(file)) {
            root = new Yaml().load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint: " + file, e);
        }
        if (root == null) {
            return cursor;
        }
        Map<?, ?> tables = asMap(asMap(root, "checkpoint").get("tables"), "tables");
        for (Map.Entry<?, ?> entry : tables.entrySet()) {
            String table = String.valueOf(entry.getKey());
            Map<?, ?> progress = asMap(entry.getValue(), table);
            long offset = asLong(progress.get("committed-offset"), table + ".committed-offset");
            List<RowRange> ranges = new ArrayList<>();
            Object rawRanges = progress.get("committed-ranges");
            if (rawRanges != null) {
                if (!(rawRanges instanceof List)) {
                    throw new IllegalStateException(
                            "Malformed checkpoint " + file + ": " + table + ".committed-ranges");
                }
                for (Object rawRange : (List<?>) rawRanges) {
                    Map<?, ?> range = asMap(rawRange, table + ".committed-ranges");
                    ranges.add(new RowRange(asLong(range.get("start"), table + ".start"),
                            asLong(range.get("end"), table + ".end")));
                }
            }
            cursor.restore(table, offset, ranges);
        }
        log.info("Checkpoint loaded from {}: {}", file.toAbsolutePath(), cursor.offsets());
        return cursor;
    }

    /**
     * Writes the cursor to the checkpoint file, replacing its previous content.
     *
     * @param cursor cursor to persist
     * @throws UncheckedIOException if the file cannot be written
     */
    public synchronized void save(MigrationCursor cursor) {
        MigrationCursor snapshot = cursor.copy();
        Map<String, Object> tables = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : snapshot.offsets().entrySet()) {
            Map<String, Object> progress = new LinkedHashMap<>();
            progress.put("committed-offset", entry.getValue());
            List<RowRange> ranges = snapshot.committedRanges(entry.getKey());
            if (!ranges.isEmpty()) {
                List<Map<String, Object>> rendered = new ArrayList<>();
                for (RowRange range : ranges) {
                    Map<String, Object> r = new LinkedHashMap<>();
                    r.put("start", range.getStart());
                    r.put("end", range.getEnd());
                    rendered.add(r);
                }
                progress.put("committed-ranges", rendered);
            }
            tables.put(entry.getKey(), progress);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", FORMAT_VERSION);
        root.put("tables", tables);

        DumperOptions opts = new DumperOptions();
        opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        opts.setPrettyFlow(true);
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                new Yaml(opts).dump(root, writer);
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint: " + file, e);
        }
        log.debug("Checkpoint written to {}: {}", file, snapshot.offsets());
    }

    /**
     * Returns a listener that saves the cursor after every committed batch.
     *
     * @return commit listener bound to this store
     */
    public BatchCommitListener asListener() {
        return (table, range, cursor) -> save(cursor);
    }

    /**
     * Returns the checkpoint path.
     *
     * @return file
     */
    public Path getFile() {
        return file;
    }

    private Map<?, ?> asMap(Object value, String key) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalStateException("Malformed checkpoint " + file + ": " + key);
        }
        return (Map<?, ?>) value;
    }

    private long asLong(Object value, String key) {
        if (!(value instanceof Number)) {
            throw new IllegalStateException(
                    "Malformed checkpoint " + file + ": " + key + " must be a number");
        }
        return ((Number) value).longValue();
    }
}
