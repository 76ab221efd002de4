package io.github.drompincen.devgateway.persistence.store;

import io.github.drompincen.devgateway.protocol.api.SessionState;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps chat session records in a single JSON array file. The file is read once, kept in
 * memory and rewritten atomically on every save.
 */
public class JsonFileChatSessionRepository implements ChatSessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileChatSessionRepository.class);

    public static final String FILE_NAME = "chat-sessions.json";

    private final Path file;
    private final ObjectMapper objectMapper;
    private final int maxRecords;
    private final Map<String, ChatSessionRecord> records = new LinkedHashMap<>();

    public JsonFileChatSessionRepository(Path storeDir, ObjectMapper objectMapper, int maxRecords) {
        this.file = storeDir.resolve(FILE_NAME);
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.maxRecords = maxRecords;
        load();
    }

    private void load() {
        if (!Files.exists(file)) return;
        try {
            List<ChatSessionRecord> stored = objectMapper.readValue(file.toFile(), new TypeReference<>() {});
            int dropped = 0;
            for (ChatSessionRecord rec : stored) {
                if (rec.getId() == null || rec.getState() == null || rec.getState() == SessionState.RUNNING) {
                    dropped++;
                    continue;
                }
                records.put(rec.getId(), rec);
            }
            log.info("Loaded {} chat session records from {} ({} dropped)", records.size(), file, dropped);
        } catch (IOException e) {
            log.error("Failed to read chat session store {}, starting empty", file, e);
        }
    }

    @Override
    public synchronized List<ChatSessionRecord> findAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public synchronized List<ChatSessionRecord> findRecent(int limit) {
        return records.values().stream()
                .sorted(Comparator.comparing(ChatSessionRecord::lastActivity).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized Optional<ChatSessionRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized ChatSessionRecord save(ChatSessionRecord record) {
        records.put(record.getId(), record);
        trim();
        write();
        return record;
    }

    private void trim() {
        if (records.size() <= maxRecords) return;
        List<ChatSessionRecord> oldestFirst = records.values().stream()
                .sorted(Comparator.comparing(ChatSessionRecord::lastActivity))
                .toList();
        for (int i = 0; i < oldestFirst.size() - maxRecords; i++) {
            records.remove(oldestFirst.get(i).getId());
        }
    }

    private void write() {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
            objectMapper.writeValue(tmp.toFile(), new ArrayList<>(records.values()));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to write chat session store {}", file, e);
        }
    }
}
