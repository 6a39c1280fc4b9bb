package com.plcmodel.core.model;

/**
 * Bounds of one array dimension, kept as written in the export.
 *
 * @param lower lower bound expression
 * @param upper upper bound expression
 */
public record ArrayDimension(String lower, String upper) {

    public ArrayDimension {
        if (lower == null) {
            lower = "0";
        }
        if (upper == null) {
            upper = "0";
        }
    }
}
