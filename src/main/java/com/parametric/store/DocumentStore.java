package com.parametric.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Persistence port for one entity family, keyed by its business identifier
 * ({@code policyId}, {@code attestationId}, {@code payoutId}, ...).
 *
 * <p>Documents handed out are detached copies; changes only become visible
 * through {@link #save} or {@link #update}.
 */
public interface DocumentStore<T> {

    /** Stores a new document; fails if the identifier is already taken. */
    T insert(T document);

    /** Inserts or replaces the document with the same identifier. */
    T save(T document);

    Optional<T> findById(String id);

    /** Returns the document or throws {@link com.parametric.error.NotFoundException}. */
    T require(String id);

    List<T> find(Predicate<T> filter, int limit);

    long count(Predicate<T> filter);

    /**
     * Atomic read-modify-write of a single document. The mutation runs while no
     * other update of the same identifier can interleave; an exception thrown from
     * the mutation aborts the update and leaves the stored document unchanged.
     */
    T update(String id, UnaryOperator<T> mutation);
}
