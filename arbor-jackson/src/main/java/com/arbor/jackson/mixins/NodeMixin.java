package com.arbor.jackson.mixins;

import com.arbor.ast.SourceSpan;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Mixin for {@code Node} and its abstract subclasses.
 *
 * <p>Nodes are written with their variant name in {@code "type"}. The own span travels as
 * {@code "loc"}; the resolved span, end span, parent, entity and node type are never written.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonIgnoreProperties(value = {"span", "endSpan", "parentNode", "entity", "nodeType", "empty"}, ignoreUnknown = true)
public abstract class NodeMixin {

    @JsonIgnore
    abstract SourceSpan getSpan();

    @JsonProperty("loc")
    @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = EmptySpanFilter.class)
    abstract SourceSpan getOwnSpan();

    @JsonProperty("loc")
    abstract void setSpan(SourceSpan span);

    /**
     * Suppresses {@link SourceSpan#EMPTY}.
     */
    public static class EmptySpanFilter {
        @Override
        public boolean equals(Object value) {
            return value == null || (value instanceof SourceSpan span && span.isEmpty());
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }
}
