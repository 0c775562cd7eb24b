package com.arbor.json;

import com.arbor.ast.Node;
import com.arbor.ast.Program;

/**
 * Reads trees back from JSON. Parent links are rebuilt as the nodes are assembled.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if {@code json} is malformed or not a program
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Reads a subtree whose root is expected to be a {@code type}.
     *
     * @throws AstJsonException if {@code json} is malformed or its root is not a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
