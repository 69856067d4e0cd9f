package com.routely.backend.repository.firestore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.routely.backend.repository.DataRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Firestore-backed {@link DataRepository}. Documents are mapped through Jackson so money fields
 * stored as numbers come back as {@code BigDecimal}.
 *
 * @param <T>  The entity type
 */
@Slf4j
public class GenericFirestoreRepository<T> implements DataRepository<T> {

    protected final Firestore firestore;
    protected final String collectionName;
    protected final Class<T> entityClass;
    protected final ObjectMapper objectMapper;

    public GenericFirestoreRepository(Firestore firestore, String collectionName,
            Class<T> entityClass, ObjectMapper objectMapper) {
        this.firestore = firestore;
        this.collectionName = collectionName;
        this.entityClass = entityClass;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<T> findAll() {
        if (firestore == null) {
            log.warn("⚠️ Firestore unavailable, cannot read {}", collectionName);
            return new ArrayList<>();
        }
        try {
            ApiFuture<QuerySnapshot> future = firestore.collection(collectionName).get();
            List<T> results = toEntities(future.get().getDocuments());
            log.info("DATA: 🟢 Loaded {} documents from {}", results.size(), collectionName);
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("fetch all", e);
        } catch (ExecutionException e) {
            throw failure("fetch all", e);
        }
    }

    private List<T> toEntities(List<QueryDocumentSnapshot> documents) {
        List<T> results = new ArrayList<>(documents.size());
        for (QueryDocumentSnapshot doc : documents) {
            results.add(toEntity(doc.getData()));
        }
        return results;
    }

    T toEntity(Map<String, Object> data) {
        return objectMapper.convertValue(data, entityClass);
    }

    private IllegalStateException failure(String operation, Exception e) {
        log.error("Failed to {} in {}", operation, collectionName, e);
        return new IllegalStateException("Firestore " + operation + " failed for " + collectionName, e);
    }
}
