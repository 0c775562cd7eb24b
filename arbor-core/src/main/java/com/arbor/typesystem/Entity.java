package com.arbor.typesystem;

/**
 * Result of semantic analysis bound to a node, such as a resolved declaration or type.
 *
 * <p>The syntax tree stores and clears entities but never interprets them.</p>
 */
public interface Entity {

    String getName();

    String getFullName();

    EntityType getEntityType();
}
