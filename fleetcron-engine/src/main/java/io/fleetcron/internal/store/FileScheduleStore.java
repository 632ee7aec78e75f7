package io.fleetcron.internal.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleetcron.core.PersistenceException;
import io.fleetcron.core.ScheduleSnapshot;
import io.fleetcron.spi.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Stores the registry as one JSON document. Writes go to a sibling temp file which is
 * fsynced and then renamed over the target.
 */
public class FileScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(FileScheduleStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileScheduleStore(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the stored snapshot. A file that is not a valid snapshot is moved to
     * {@code <file>.corrupt} and an empty snapshot is returned.
     */
    @Override
    public ScheduleSnapshot load() {
        if (!Files.exists(file)) {
            log.info("No stored schedule at path={}, starting empty", file);
            return ScheduleSnapshot.empty();
        }
        try {
            return objectMapper.readValue(file.toFile(), ScheduleSnapshot.class);
        } catch (JsonProcessingException ex) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt");
            log.error("Stored schedule is corrupt, moving it to path={} msg={}", aside, ex.getOriginalMessage(), ex);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveEx) {
                throw new PersistenceException("Failed to move corrupt schedule file " + file, moveEx);
            }
            return ScheduleSnapshot.empty();
        } catch (IOException ex) {
            throw new PersistenceException("Failed to read schedule file " + file, ex);
        }
    }

    @Override
    public void save(ScheduleSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Schedule saved path={} jobs={}", file, snapshot.jobs().size());
        } catch (IOException ex) {
            throw new PersistenceException("Failed to write schedule file " + file, ex);
        }
    }
}
