package org.logsim.compiler.frontend.names;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps name strings (keywords, device names, pins, punctuation) to stable integer ids.
 * <p>
 * Ids are insertion indices and stay valid for the lifetime of the table. The table
 * also mints unique integer error codes on demand, so that independently built
 * collaborators can define their own result codes without a central registry.
 * Ids and codes from two different tables must never be mixed.
 */
public class NameTable {

    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private int errorCodeCount = 0;

    /**
     * Returns the id of the given name, adding it to the table if it is not yet present.
     * @param name The name string.
     * @return The id of the name.
     */
    public int intern(String name) {
        Integer id = index.get(name);
        if (id != null) {
            return id;
        }
        int newId = names.size();
        names.add(name);
        index.put(name, newId);
        return newId;
    }

    /**
     * Interns every name of the list, preserving order.
     * @param nameList The names to intern.
     * @return The ids, one per input name.
     */
    public List<Integer> internAll(List<String> nameList) {
        List<Integer> ids = new ArrayList<>(nameList.size());
        for (String name : nameList) {
            ids.add(intern(name));
        }
        return ids;
    }

    /**
     * Looks up a name without inserting it.
     * @param name The name string.
     * @return The id, or empty if the name is unknown.
     */
    public Optional<Integer> query(String name) {
        return Optional.ofNullable(index.get(name));
    }

    /**
     * Returns the name string for an id.
     * @param id The id to resolve.
     * @return The name, or empty if the id is out of range.
     */
    public Optional<String> resolve(int id) {
        if (id < 0 || id >= names.size()) {
            return Optional.empty();
        }
        return Optional.of(names.get(id));
    }

    /**
     * Mints {@code count} fresh error codes. Codes are never handed out twice by the same table.
     * @param count The number of codes to allocate.
     * @return The allocated codes in ascending order.
     */
    public List<Integer> allocate(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Cannot allocate a negative number of error codes: " + count);
        }
        List<Integer> codes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            codes.add(errorCodeCount++);
        }
        return Collections.unmodifiableList(codes);
    }

    /**
     * @return The number of interned names.
     */
    public int size() {
        return names.size();
    }
}
