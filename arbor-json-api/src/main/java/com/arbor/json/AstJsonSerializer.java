package com.arbor.json;

import com.arbor.ast.Node;

/**
 * Writes trees as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes {@code node} and its subtree.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)} with line breaks and indentation.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
