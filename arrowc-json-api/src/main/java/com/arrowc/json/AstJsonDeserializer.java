package com.arrowc.json;

import com.arrowc.ast.Program;
import com.arrowc.target.TargetProgram;

/**
 * Interface for deserializing trees from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a source Program.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized Program
     * @throws AstJsonException if deserialization fails
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a generated function tree, ready for code generation.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized TargetProgram
     * @throws AstJsonException if deserialization fails
     */
    TargetProgram deserializeTargetProgram(String json) throws AstJsonException;
}
