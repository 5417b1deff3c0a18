package com.pavan.orderedmap.snapshot;

import com.pavan.orderedmap.collection.OrderedMap;
import com.pavan.orderedmap.json.JsonOptions;
import com.pavan.orderedmap.json.OrderedMapCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Keeps JSON copies of an {@link OrderedMap} in a directory, one file per save,
 * named {@code snapshot-<millis>.json}. Key order survives the round trip.
 */
public class SnapshotManager {
    
    private static final Logger logger = LoggerFactory.getLogger(SnapshotManager.class);
    
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".json";
    
    private final Path directory;
    private final OrderedMapCodec codec;
    private final JsonOptions options;
    
    public SnapshotManager(String directory) throws IOException {
        this(directory, new OrderedMapCodec(), JsonOptions.defaults());
    }
    
    /**
     * @param directory where snapshot files live; created if missing
     * @param codec encodes and decodes the files
     * @param options used for both saving and loading
     * @throws IOException if the directory cannot be created
     */
    public SnapshotManager(String directory, OrderedMapCodec codec, JsonOptions options) throws IOException {
        this.directory = Files.createDirectories(Paths.get(directory));
        this.codec = codec;
        this.options = options;
    }
    
    /**
     * Encodes the map into a new snapshot file. The file is written under a temporary
     * name first, so a reader never sees a half-written snapshot.
     *
     * @return the snapshot file
     * @throws IOException if encoding or writing fails; no snapshot file is left behind
     */
    public Path saveSnapshot(OrderedMap<?, ?> map) throws IOException {
        byte[] json = codec.serialize(map, options);
        Path target = directory.resolve(PREFIX + System.currentTimeMillis() + SUFFIX);
        Path staging = directory.resolve(target.getFileName() + ".tmp");
        Files.write(staging, json);
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Saved {} entries to {}", map.size(), target);
        return target;
    }
    
    /**
     * Replaces the map's content with the newest snapshot in the directory.
     *
     * @return false if the directory holds no snapshot
     * @throws IOException if the newest snapshot cannot be read or decoded
     */
    public boolean loadLatestSnapshot(OrderedMap<Object, Object> map) throws IOException {
        Optional<Path> latest = findLatestSnapshot();
        if (latest.isEmpty()) {
            return false;
        }
        return loadSnapshot(map, latest.get());
    }
    
    /**
     * Replaces the map's content with the given snapshot. A file that fails to
     * decode leaves the map unchanged.
     *
     * @return false if the file does not exist
     * @throws IOException if the file cannot be read or decoded
     */
    public boolean loadSnapshot(OrderedMap<Object, Object> map, Path snapshot) throws IOException {
        if (!Files.isRegularFile(snapshot)) {
            return false;
        }
        codec.deserialize(Files.readAllBytes(snapshot), map, options);
        logger.info("Loaded snapshot {} ({} entries)", snapshot, map.size());
        return true;
    }
    
    /**
     * Finds the snapshot with the greatest timestamp in its name.
     */
    public Optional<Path> findLatestSnapshot() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(file -> timestampOf(file).isPresent())
                .max(Comparator.comparingLong(file -> timestampOf(file).getAsLong()));
        }
    }
    
    // Names carry the save time; file modification times are too coarse on some file systems
    static OptionalLong timestampOf(Path file) {
        String name = file.getFileName().toString();
        if (!name.startsWith(PREFIX) || !name.endsWith(SUFFIX)) {
            return OptionalLong.empty();
        }
        String digits = name.substring(PREFIX.length(), name.length() - SUFFIX.length());
        try {
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
