package com.arbor.ast;

/**
 * Thrown when a keyed annotation is added to a node that already carries the key.
 *
 * <p>Signals a pass annotating the same node twice. Callers that want overwrite or skip
 * semantics check {@link Node#containsAnnotation(Object)} first.</p>
 */
public class DuplicateAnnotationException extends RuntimeException {

    private final transient Object key;

    public DuplicateAnnotationException(Object key) {
        super("Node is already annotated with key '" + key + "'");
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
