package com.arbor.ast;

import com.arbor.ast.visitors.CodePrinter;
import com.arbor.typesystem.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Base class for every node in the syntax tree.
 *
 * <p>A node owns its children; the parent reference is for navigation only and is set by the
 * composite node that attaches the child (a setter or a {@link NodeList}). Moving a node does not
 * update it.</p>
 */
public abstract sealed class Node permits Program, Statement, Expression {

    private static final Logger LOG = LoggerFactory.getLogger(Node.class);

    private SourceSpan span = SourceSpan.EMPTY;

    // Parent's span at attach time; never persisted
    private SourceSpan inheritedSpan = SourceSpan.EMPTY;

    private SourceSpan endSpan = SourceSpan.EMPTY;

    private Node parent;

    private String documentation;

    private Map<Object, Object> annotations;

    private Entity entity;

    private boolean synthetic;

    protected Node() {
    }

    protected Node(SourceSpan span) {
        if (span == null) {
            throw new IllegalArgumentException("span must not be null");
        }
        this.span = span;
    }

    // ========================================================================
    // Structural matching helpers
    // ========================================================================

    public static boolean matches(Node lhs, Node rhs) {
        return lhs == null ? rhs == null : lhs.matches(rhs);
    }

    /**
     * A missing block matches an empty one, in either position.
     */
    public static boolean matches(BlockStatement lhs, BlockStatement rhs) {
        if (lhs == null) {
            return rhs == null || rhs.isEmpty();
        }
        if (rhs == null) {
            return lhs.isEmpty();
        }
        return lhs.matches(rhs);
    }

    /**
     * Pairwise match of two ordered sequences. A null sequence matches only a null or empty one.
     */
    public static boolean allMatch(Iterable<? extends Node> lhs, Iterable<? extends Node> rhs) {
        if (lhs == null) {
            return rhs == null || isEmpty(rhs);
        }
        if (rhs == null) {
            return isEmpty(lhs);
        }
        Iterator<? extends Node> r = rhs.iterator();
        for (Node item : lhs) {
            if (!r.hasNext()) {
                return false;
            }
            if (!matches(item, r.next())) {
                return false;
            }
        }
        return !r.hasNext();
    }

    private static boolean isEmpty(Iterable<? extends Node> items) {
        return !items.iterator().hasNext();
    }

    // ========================================================================
    // Variant contract
    // ========================================================================

    public abstract NodeType getNodeType();

    public abstract void accept(AstVisitor visitor);

    /**
     * Structural equality: same variant and matching meaningful fields, recursively. Spans,
     * documentation, the synthetic flag, annotations and entities are ignored.
     */
    public abstract boolean matches(Node other);

    /**
     * Deep copy. The clone keeps span, end span, synthetic flag, documentation and entity, gets its
     * own copy of the annotations and has no parent.
     */
    public abstract Node cloneNode();

    /**
     * Returns a clone of this node with annotations and entities removed from the whole subtree.
     */
    public Node cleanClone() {
        Node clone = cloneNode();
        clone.clearTypeSystemBindings();
        return clone;
    }

    /**
     * Replaces the child slot holding {@code existing} (by identity) with {@code newNode}.
     *
     * @return false if {@code existing} is not a direct child of this node
     */
    public boolean replace(Node existing, Node newNode) {
        if (existing == null) {
            throw new IllegalArgumentException("existing must not be null");
        }
        return false;
    }

    protected boolean noMatch(String fieldName) {
        LOG.trace("No match for '{}'", fieldName);
        return false;
    }

    protected void copyBaseFieldsTo(Node clone) {
        clone.span = span;
        clone.inheritedSpan = inheritedSpan;
        clone.endSpan = endSpan;
        clone.synthetic = synthetic;
        clone.documentation = documentation;
        clone.entity = entity;
        if (annotations != null) {
            clone.annotations = new HashMap<>(annotations);
        }
    }

    /**
     * Links {@code child} to this node unless it already is. Returns the child for assignment.
     */
    protected final <T extends Node> T adopt(T child) {
        if (child != null && child.getParentNode() != this) {
            child.initializeParent(this);
        }
        return child;
    }

    void initializeParent(Node parent) {
        this.parent = parent;
        if (parent != null && span.isEmpty()) {
            inheritedSpan = parent.getSpan();
        }
    }

    // ========================================================================
    // Properties
    // ========================================================================

    public Node getParentNode() {
        return parent;
    }

    /**
     * Where this node appears in the source. Falls back to the nearest ancestor with a span when
     * the node has none of its own; the fallback does not modify the node.
     */
    public SourceSpan getSpan() {
        if (!span.isEmpty()) {
            return span;
        }
        if (!inheritedSpan.isEmpty()) {
            return inheritedSpan;
        }
        return parent == null ? SourceSpan.EMPTY : parent.getSpan();
    }

    public void setSpan(SourceSpan span) {
        if (span == null) {
            throw new IllegalArgumentException("span must not be null");
        }
        this.span = span;
    }

    /**
     * The span assigned to this node itself. Spans inherited from ancestors, at attach time or
     * through the fallback of {@link #getSpan()}, are not included.
     */
    public SourceSpan getOwnSpan() {
        return span;
    }

    /**
     * Where this node ends in the source. Generally only set for blocks and declarations.
     */
    public SourceSpan getEndSpan() {
        return endSpan;
    }

    public void setEndSpan(SourceSpan endSpan) {
        if (endSpan == null) {
            throw new IllegalArgumentException("endSpan must not be null");
        }
        this.endSpan = endSpan;
    }

    /**
     * True when the node was constructed by the compiler.
     */
    public boolean isSynthetic() {
        return synthetic;
    }

    public void setSynthetic(boolean synthetic) {
        this.synthetic = synthetic;
    }

    public String getDocumentation() {
        return documentation;
    }

    public void setDocumentation(String documentation) {
        this.documentation = documentation;
    }

    public Entity getEntity() {
        return entity;
    }

    public void setEntity(Entity entity) {
        this.entity = entity;
    }

    // ========================================================================
    // Annotations
    // ========================================================================

    /**
     * Strongly typed view of the annotations, one value per type.
     */
    public TypedAnnotations tags() {
        return new Tags();
    }

    public boolean hasAnnotations() {
        return annotations != null && !annotations.isEmpty();
    }

    public Object getAnnotation(Object key) {
        if (annotations == null) {
            return null;
        }
        return annotations.get(key);
    }

    /**
     * Stores {@code value} under {@code key}, overwriting any previous value.
     */
    public void setAnnotation(Object key, Object value) {
        requireKey(key);
        annotationMap().put(key, value);
    }

    public void annotate(Object key) {
        annotate(key, key);
    }

    /**
     * Adds {@code value} under {@code key}.
     *
     * @throws DuplicateAnnotationException if the node is already annotated with {@code key}
     */
    public void annotate(Object key, Object value) {
        requireKey(key);
        Map<Object, Object> map = annotationMap();
        if (map.containsKey(key)) {
            throw new DuplicateAnnotationException(key);
        }
        map.put(key, value);
    }

    public boolean containsAnnotation(Object key) {
        return annotations != null && annotations.containsKey(key);
    }

    public void removeAnnotation(Object key) {
        if (annotations != null) {
            annotations.remove(key);
        }
    }

    /**
     * Drops all annotations and the entity binding. Composite nodes also clear their children.
     */
    public void clearTypeSystemBindings() {
        annotations = null;
        entity = null;
    }

    private Map<Object, Object> annotationMap() {
        if (annotations == null) {
            annotations = new HashMap<>();
        }
        return annotations;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("annotation key must not be null");
        }
    }

    private final class Tags implements TypedAnnotations {
        @Override
        public <T> T get(Class<T> type) {
            return type.cast(getAnnotation(type));
        }

        @Override
        public <T> void set(Class<T> type, T annotation) {
            annotate(type, annotation);
        }
    }

    // ========================================================================
    // Rewriting
    // ========================================================================

    /**
     * Replaces every node matching {@code pattern} with a clone of {@code template}.
     *
     * @return the number of nodes replaced
     * @see #replaceNodes(Predicate, Node)
     */
    public int replaceNodes(Node pattern, Node template) {
        return replaceNodes(pattern::matches, template);
    }

    /**
     * Replaces every node accepted by {@code predicate} with a fresh clone of {@code template}.
     *
     * <p>The tree is walked once, depth-first. A replaced subtree is not descended into, neither the
     * original nor the clone, so a template that itself satisfies the predicate is not rewritten
     * again. Only descendants are candidates, never this node itself. If the predicate throws, the
     * exception propagates and the tree stays partially rewritten.</p>
     *
     * @return the number of nodes replaced
     */
    public int replaceNodes(Predicate<Node> predicate, Node template) {
        ReplaceVisitor visitor = new ReplaceVisitor(predicate, template);
        accept(visitor);
        LOG.debug("Replaced {} node(s) under {}", visitor.getMatchCount(), getNodeType());
        return visitor.getMatchCount();
    }

    private static final class ReplaceVisitor extends DepthFirstTransformer {
        private final Predicate<Node> predicate;
        private final Node template;
        private int matchCount;

        ReplaceVisitor(Predicate<Node> predicate, Node template) {
            this.predicate = predicate;
            this.template = template;
        }

        int getMatchCount() {
            return matchCount;
        }

        @Override
        protected void onNode(Node node) {
            if (predicate.test(node)) {
                ++matchCount;
                replaceCurrentNode(template.cloneNode());
            } else {
                super.onNode(node);
            }
        }
    }

    // ========================================================================
    // Ancestor queries
    // ========================================================================

    /**
     * Returns the closest ancestor of the given kind, or null.
     */
    public Node getAncestor(NodeType ancestorType) {
        return getAncestor(ancestorType, Integer.MAX_VALUE);
    }

    /**
     * Returns the closest ancestor of the given kind at most {@code limitDepth} levels up, or null.
     * A limit of 0 never finds anything.
     */
    public Node getAncestor(NodeType ancestorType, int limitDepth) {
        Node current = parent;
        while (current != null && limitDepth > 0) {
            if (current.getNodeType() == ancestorType) {
                return current;
            }
            current = current.parent;
            limitDepth--;
        }
        return null;
    }

    /**
     * Returns the closest ancestor that is an instance of {@code ancestorType}, or null.
     */
    public <T extends Node> T getAncestor(Class<T> ancestorType) {
        for (Node current = parent; current != null; current = current.parent) {
            if (ancestorType.isInstance(current)) {
                return ancestorType.cast(current);
            }
        }
        return null;
    }

    /**
     * Returns the farthest ancestor that is an instance of {@code ancestorType}, or null.
     */
    public <T extends Node> T getRootAncestor(Class<T> ancestorType) {
        T root = null;
        for (T ancestor : getAncestors(ancestorType)) {
            root = ancestor;
        }
        return root;
    }

    /**
     * Ancestors that are instances of {@code ancestorType}, closest first. The walk is lazy and
     * every call to {@code iterator()} starts over from this node's parent.
     */
    public <T extends Node> Iterable<T> getAncestors(Class<T> ancestorType) {
        return () -> new AncestorIterator<>(parent, ancestorType);
    }

    private static final class AncestorIterator<T extends Node> implements Iterator<T> {
        private final Class<T> ancestorType;
        private Node next;

        AncestorIterator(Node start, Class<T> ancestorType) {
            this.ancestorType = ancestorType;
            this.next = advance(start);
        }

        private Node advance(Node from) {
            Node current = from;
            while (current != null && !ancestorType.isInstance(current)) {
                current = current.parent;
            }
            return current;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            T result = ancestorType.cast(next);
            next = advance(next.parent);
            return result;
        }
    }

    // ========================================================================
    // Rendering
    // ========================================================================

    public String toCodeString() {
        StringBuilder out = new StringBuilder();
        accept(new CodePrinter(out));
        return out.toString();
    }

    @Override
    public String toString() {
        return toCodeString();
    }
}
