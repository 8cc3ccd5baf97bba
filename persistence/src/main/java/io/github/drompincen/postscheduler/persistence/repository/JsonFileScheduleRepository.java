package io.github.drompincen.postscheduler.persistence.repository;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.postscheduler.persistence.document.ScheduleDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Keeps every record in one pretty-printed JSON object keyed by id.
 * Each mutation rewrites the whole document to a temp file and renames it over the original;
 * all reads and read-modify-write cycles run under a single per-instance lock.
 */
public class JsonFileScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileScheduleRepository.class);
    private static final TypeReference<LinkedHashMap<String, ScheduleDocument>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileScheduleRepository(Path path) {
        this.path = path.toAbsolutePath();
        this.mapper = storeMapper();
        bootstrap();
    }

    static ObjectMapper storeMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private void bootstrap() {
        lock.lock();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            if (Files.notExists(path)) {
                writeAll(new LinkedHashMap<>());
                log.info("Created empty schedule store at {}", path);
            }
        } catch (IOException e) {
            throw new ScheduleStoreException("Cannot initialise schedule store at " + path, e);
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public List<ScheduleDocument> findAll() {
        lock.lock();
        try {
            return new ArrayList<>(readAll().values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScheduleDocument> findById(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(readAll().get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ScheduleDocument save(ScheduleDocument doc) {
        if (doc.getId() == null) {
            throw new IllegalArgumentException("Schedule record has no id");
        }
        lock.lock();
        try {
            Map<String, ScheduleDocument> data = readAll();
            data.put(doc.getId(), doc);
            writeAll(data);
            return doc;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean deleteById(String id) {
        lock.lock();
        try {
            Map<String, ScheduleDocument> data = readAll();
            if (data.remove(id) == null) return false;
            writeAll(data);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScheduleDocument> update(String id, Consumer<ScheduleDocument> mutator) {
        lock.lock();
        try {
            Map<String, ScheduleDocument> data = readAll();
            ScheduleDocument doc = data.get(id);
            if (doc == null) return Optional.empty();
            mutator.accept(doc);
            writeAll(data);
            return Optional.of(doc);
        } finally {
            lock.unlock();
        }
    }

    private Map<String, ScheduleDocument> readAll() {
        try {
            if (Files.size(path) == 0) return new LinkedHashMap<>();
            Map<String, ScheduleDocument> data = mapper.readValue(path.toFile(), DOCUMENT_TYPE);
            return data != null ? data : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new ScheduleStoreException("Failed to read schedule store " + path, e);
        }
    }

    private void writeAll(Map<String, ScheduleDocument> data) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), data);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} schedule records to {}", data.size(), path);
        } catch (IOException e) {
            throw new ScheduleStoreException("Failed to write schedule store " + path, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }
}
