package com.plcmodel.core.model;

/**
 * Named collections of the canonical model, with their output keys.
 */
public enum ModelCollection {
    DATA_TYPES("DataTypes"),
    PROGRAM_UNITS("POUs"),
    GLOBAL_VARIABLES("GlobalVariables"),
    ENUMS("Enums"),
    UNIONS("Unions"),
    STRUCTURES("Structures");

    private final String key;

    ModelCollection(String key) {
        this.key = key;
    }

    /**
     * @return key used for this collection in serialized output and diagnostics
     */
    public String key() {
        return key;
    }
}
