package com.plcmodel.core.model;

/**
 * Item counts of a canonical model.
 *
 * @param dataTypes basic data types
 * @param programUnits program units
 * @param globalVariables global variables
 * @param enums enumerations
 * @param unions unions
 * @param structures structures
 * @param actions actions across all program units
 * @param methods methods across all program units
 */
public record ModelSummary(
    int dataTypes,
    int programUnits,
    int globalVariables,
    int enums,
    int unions,
    int structures,
    int actions,
    int methods
) {
    /**
     * @return sum of all counts
     */
    public int totalItems() {
        return dataTypes + programUnits + globalVariables + enums + unions + structures + actions + methods;
    }
}
