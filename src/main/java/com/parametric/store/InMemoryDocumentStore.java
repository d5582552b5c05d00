package com.parametric.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parametric.error.NotFoundException;
import com.parametric.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Process-local {@link DocumentStore}. Each document is held as a Jackson snapshot
 * so that readers and writers never share mutable instances, mirroring what a
 * document database returns.
 */
public class InMemoryDocumentStore<T> implements DocumentStore<T> {

    private final String entityName;
    private final Class<T> type;
    private final Function<T, String> idOf;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<String, T> documents = new ConcurrentHashMap<>();

    public InMemoryDocumentStore(String entityName, Class<T> type, Function<T, String> idOf, ObjectMapper mapper) {
        this.entityName = entityName;
        this.type = type;
        this.idOf = idOf;
        this.mapper = mapper;
    }

    @Override
    public T insert(T document) {
        String id = requireId(document);
        T snapshot = copy(document);
        if (documents.putIfAbsent(id, snapshot) != null) {
            throw new ValidationException(entityName + " already exists: " + id);
        }
        return copy(snapshot);
    }

    @Override
    public T save(T document) {
        String id = requireId(document);
        T snapshot = copy(document);
        documents.put(id, snapshot);
        return copy(snapshot);
    }

    @Override
    public Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(id)).map(this::copy);
    }

    @Override
    public T require(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException(entityName, id));
    }

    @Override
    public List<T> find(Predicate<T> filter, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return documents.values().stream()
            .filter(filter)
            .limit(limit)
            .map(this::copy)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long count(Predicate<T> filter) {
        return documents.values().stream().filter(filter).count();
    }

    @Override
    public T update(String id, UnaryOperator<T> mutation) {
        T updated = documents.compute(id, (key, current) -> {
            if (current == null) {
                throw new NotFoundException(entityName, key);
            }
            T result = mutation.apply(copy(current));
            if (!key.equals(idOf.apply(result))) {
                throw new IllegalStateException(entityName + " identifier changed during update: " + key);
            }
            return copy(result);
        });
        return copy(updated);
    }

    private String requireId(T document) {
        Objects.requireNonNull(document, entityName + " cannot be null");
        String id = idOf.apply(document);
        if (id == null || id.isBlank()) {
            throw new ValidationException(entityName + " identifier is required");
        }
        return id;
    }

    private T copy(T document) {
        return mapper.convertValue(document, type);
    }
}
