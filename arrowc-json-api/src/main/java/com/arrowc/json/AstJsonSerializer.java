package com.arrowc.json;

import com.arrowc.Token;
import com.arrowc.ast.Node;
import com.arrowc.target.TargetNode;

import java.util.List;

/**
 * Serializes the intermediate results of a compilation to JSON.
 * Nodes carry their kind in a {@code type} property.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a source tree node to a JSON string.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a generated function tree node to a JSON string.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(TargetNode node) throws AstJsonException;

    /**
     * Serializes a token list to a JSON array.
     *
     * @param tokens the tokens, in source order
     * @return the JSON array
     * @throws AstJsonException if serialization fails
     */
    String serializeTokens(List<Token> tokens) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, pretty-printed.
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(TargetNode)}, pretty-printed.
     */
    String serializePretty(TargetNode node) throws AstJsonException;

    /**
     * Same as {@link #serializeTokens(List)}, pretty-printed.
     */
    String serializeTokensPretty(List<Token> tokens) throws AstJsonException;
}
