package com.arrowc.transform;

/**
 * The part of the enclosing function a visited leaf belongs to.
 */
public enum Section {
    PARAMS,
    BODY
}
