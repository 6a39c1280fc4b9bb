package com.plcmodel.core.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-keyed collection that keeps the first record inserted under each name.
 *
 * @param <T> record type
 */
class NamedCollection<T> {

    private final Map<String, T> records = new LinkedHashMap<>();

    /**
     * Inserts a record unless the name is taken.
     *
     * @return true if inserted, false if a record with this name already exists
     */
    boolean addIfAbsent(String name, T record) {
        return records.putIfAbsent(name, record) == null;
    }

    int size() {
        return records.size();
    }

    List<T> values() {
        return new ArrayList<>(records.values());
    }
}
