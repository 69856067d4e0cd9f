package com.routely.backend.repository;

import com.routely.backend.model.NetworkData;

/**
 * Supplies the topology, fare rules and passenger types a snapshot is built from.
 */
public interface NetworkDataSource {

    NetworkData load();

    String describe();
}
