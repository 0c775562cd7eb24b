package com.arbor.ast;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered child slots of a composite node.
 *
 * <p>Every element inserted is linked to the owning node. Elements are checked against the
 * element type, so a rewrite cannot put a statement where an expression belongs.</p>
 */
public final class NodeList<T extends Node> extends AbstractList<T> {

    private final Node parent;
    private final Class<T> elementType;
    private final List<T> items = new ArrayList<>();

    public NodeList(Node parent, Class<T> elementType) {
        this.parent = parent;
        this.elementType = elementType;
    }

    public Node getParentNode() {
        return parent;
    }

    public Class<T> getElementType() {
        return elementType;
    }

    @Override
    public T get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public T set(int index, T element) {
        T item = checkElement(element);
        T previous = items.set(index, item);
        parent.adopt(item);
        return previous;
    }

    @Override
    public void add(int index, T element) {
        T item = checkElement(element);
        items.add(index, item);
        parent.adopt(item);
    }

    @Override
    public T remove(int index) {
        return items.remove(index);
    }

    /**
     * Replaces {@code existing} (by identity) with {@code newNode}; a null {@code newNode} removes it.
     *
     * @return false if {@code existing} is not in this list
     */
    public boolean replace(Node existing, Node newNode) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == existing) {
                if (newNode == null) {
                    items.remove(i);
                } else {
                    set(i, elementType.cast(newNode));
                }
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces the contents with {@code nodes}. Passing this list itself is a no-op.
     */
    public void assign(Iterable<? extends T> nodes) {
        if (nodes == this) {
            return;
        }
        List<T> copy = new ArrayList<>();
        if (nodes != null) {
            for (T node : nodes) {
                copy.add(node);
            }
        }
        clear();
        addAll(copy);
    }

    NodeList<T> cloneFor(Node newParent) {
        NodeList<T> clone = new NodeList<>(newParent, elementType);
        for (T item : items) {
            clone.add(elementType.cast(item.cloneNode()));
        }
        return clone;
    }

    void clearTypeSystemBindings() {
        for (T item : items) {
            item.clearTypeSystemBindings();
        }
    }

    private T checkElement(T element) {
        if (element == null) {
            throw new IllegalArgumentException("NodeList does not accept null elements");
        }
        return elementType.cast(element);
    }
}
