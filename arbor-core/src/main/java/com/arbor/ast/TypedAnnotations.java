package com.arbor.ast;

/**
 * Strongly typed annotation slot: at most one value per type per node.
 *
 * <pre>{@code
 * node.tags().set(GeneratorSkeleton.class, skeleton);
 * GeneratorSkeleton skeleton = node.tags().get(GeneratorSkeleton.class);
 * }</pre>
 */
public interface TypedAnnotations {

    /**
     * Returns the value stored for {@code type}, or null if there is none.
     */
    <T> T get(Class<T> type);

    /**
     * Stores {@code annotation} as the value for {@code type}.
     *
     * @throws DuplicateAnnotationException if a value for {@code type} is already stored
     */
    <T> void set(Class<T> type, T annotation);
}
