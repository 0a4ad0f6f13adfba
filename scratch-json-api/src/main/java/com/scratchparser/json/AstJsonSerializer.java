package com.scratchparser.json;

import com.scratchparser.ast.Node;

/**
 * Writes syntax tree nodes as JSON documents.
 *
 * <p>Every node becomes an object whose {@code "type"} property names the node kind, followed
 * by the node's own fields at the same level. Absent optional children are written as
 * {@code null}; empty lists as {@code []}.</p>
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node to a single-line JSON string.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node to JSON indented by two spaces, one property or array element per line.
     *
     * @param node the node to serialize
     * @return the pretty-printed JSON representation of the node, without a trailing newline
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
