package com.routely.backend.repository;

import java.util.List;

/**
 * Read side of a document store collection.
 *
 * @param <T>  The entity type
 */
public interface DataRepository<T> {

    /**
     * Get all entities.
     */
    List<T> findAll();
}
