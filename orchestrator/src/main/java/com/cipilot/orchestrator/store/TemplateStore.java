package com.cipilot.orchestrator.store;

import java.util.List;
import java.util.Map;

/**
 * Boundary to the external vector store. Both operations are idempotent
 * and safe to call from concurrent workflows without client-side locking.
 */
public interface TemplateStore {

    /**
     * Return up to {@code limit} documents whose metadata equals every entry of {@code filter}.
     *
     * @throws StoreException if the store is unreachable or answers with an error
     */
    List<StoreDocument> query(String collection, Map<String, Object> filter, int limit);

    /**
     * Insert or replace the document with the given id.
     *
     * @throws StoreException if the store is unreachable or answers with an error
     */
    void upsert(String collection, String id, String content, Map<String, Object> metadata);
}
