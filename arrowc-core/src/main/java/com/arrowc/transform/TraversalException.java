package com.arrowc.transform;

import com.arrowc.ParseException;

/**
 * Thrown when the source tree handed to the transformer is malformed.
 */
public class TraversalException extends ParseException {

    public TraversalException(String context, String message) {
        super("TraversalError", null, null, context, message);
    }
}
