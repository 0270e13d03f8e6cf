package com.arrowc.codegen;

import com.arrowc.ParseException;

/**
 * Thrown when the code generator is handed a node it cannot render.
 */
public class GenerationException extends ParseException {

    public GenerationException(String message) {
        super("GenerationError", null, null, null, message);
    }
}
