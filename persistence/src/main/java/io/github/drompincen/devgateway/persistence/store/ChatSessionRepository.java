package io.github.drompincen.devgateway.persistence.store;

import java.util.List;
import java.util.Optional;

public interface ChatSessionRepository {

    /** Every stored record that was not left running by a previous process. */
    List<ChatSessionRecord> findAll();

    List<ChatSessionRecord> findRecent(int limit);

    Optional<ChatSessionRecord> findById(String id);

    /** Inserts or replaces the record with the same id. */
    ChatSessionRecord save(ChatSessionRecord record);
}
