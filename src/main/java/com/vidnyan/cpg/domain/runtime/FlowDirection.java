package com.vidnyan.cpg.domain.runtime;

/**
 * FORWARD when the point defines values, BACKWARD when it only reads them.
 */
public enum FlowDirection {
    FORWARD,
    BACKWARD,
    NONE
}
