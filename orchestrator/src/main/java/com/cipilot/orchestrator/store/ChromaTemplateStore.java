package com.cipilot.orchestrator.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP client for the Chroma vector store (REST API v1).
 *
 * Collections are addressed by name in our code but by id on the wire, so the
 * first call for a collection resolves it with get_or_create and caches the id.
 * The cache only ever gains entries and a duplicate resolve returns the same id,
 * which is why no locking is needed.
 */
@Component
public class ChromaTemplateStore implements TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(ChromaTemplateStore.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CollectionResponse(String id, String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GetResponse(List<String> ids, List<String> documents, List<Map<String, Object>> metadatas) {}

    private final HttpClient          http;
    private final ObjectMapper        json;
    private final String              baseUrl;
    private final Duration            timeout;
    private final Map<String, String> collectionIds = new ConcurrentHashMap<>();

    public ChromaTemplateStore(@Value("${cipilot.store.base-url}") String baseUrl,
                               @Value("${cipilot.store.request-timeout:10s}") Duration timeout,
                               ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    // ------------------------------------------------------------------
    // TemplateStore
    // ------------------------------------------------------------------

    @Override
    public List<StoreDocument> query(String collection, Map<String, Object> filter, int limit) {
        String id = collectionId(collection);

        Map<String, Object> body = new LinkedHashMap<>();
        if (filter != null && !filter.isEmpty()) {
            body.put("where", where(filter));
        }
        body.put("limit",   limit);
        body.put("include", List.of("documents", "metadatas"));

        String respBody = post("/api/v1/collections/" + id + "/get", toJson(body),
                "query " + collection);
        GetResponse resp = fromJson(respBody, GetResponse.class, "query " + collection);

        List<StoreDocument> docs = new ArrayList<>();
        if (resp.ids() == null) return docs;
        for (int i = 0; i < resp.ids().size(); i++) {
            String content = resp.documents() != null && i < resp.documents().size()
                    ? resp.documents().get(i) : null;
            Map<String, Object> meta = resp.metadatas() != null && i < resp.metadatas().size()
                    ? resp.metadatas().get(i) : Map.of();
            docs.add(new StoreDocument(resp.ids().get(i), content, meta));
        }
        log.debug("Store query {} {} returned {} documents", collection, filter, docs.size());
        return docs;
    }

    @Override
    public void upsert(String collection, String docId, String content, Map<String, Object> metadata) {
        String id = collectionId(collection);
        String body = toJson(Map.of(
                "ids",       List.of(docId),
                "documents", List.of(content),
                "metadatas", List.of(metadata)));
        post("/api/v1/collections/" + id + "/upsert", body, "upsert " + docId);
        log.info("Upserted document '{}' into '{}'", docId, collection);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String collectionId(String name) {
        String cached = collectionIds.get(name);
        if (cached != null) return cached;

        String respBody = post("/api/v1/collections",
                toJson(Map.of("name", name, "get_or_create", true)),
                "resolve collection " + name);
        CollectionResponse resp = fromJson(respBody, CollectionResponse.class, "resolve collection " + name);
        if (resp.id() == null) {
            throw new StoreException("Store returned no id for collection " + name);
        }
        collectionIds.put(name, resp.id());
        return resp.id();
    }

    /** Chroma accepts a single equality directly; several must be wrapped in $and. */
    static Map<String, Object> where(Map<String, Object> filter) {
        if (filter.size() == 1) {
            return new LinkedHashMap<>(filter);
        }
        List<Map<String, Object>> clauses = new ArrayList<>();
        filter.forEach((k, v) -> clauses.add(Map.of(k, v)));
        return Map.of("$and", clauses);
    }

    private String post(String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new StoreException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (StoreException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new StoreException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new StoreException("JSON serialization failed", e);
        }
    }

    private <T> T fromJson(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to parse " + opName + " response", e);
        }
    }
}
