package com.plcmodel.core.locator;

/**
 * Path expressions for the sections of a PLCopen export.
 */
public final class SectionPaths {

    public static final String RESOURCE = ".//resource";
    public static final String TYPES = ".//types";
    public static final String DATA_TYPE = ".//dataType";
    public static final String POU = ".//pou";
    public static final String GLOBAL_VARS = ".//globalVars";
    public static final String VARIABLE = ".//variable";
    public static final String CONFIGURATION = ".//configuration";
    public static final String UNION = ".//union";
    public static final String UNION_CAPITALIZED = ".//Union";

    private SectionPaths() {
    }

    /**
     * Returns the path of auxiliary-data blocks with the given name.
     *
     * @param blockName value of the block's {@code name} attribute
     * @return path expression
     */
    public static String dataBlock(String blockName) {
        if (blockName.indexOf('\'') >= 0) {
            throw new IllegalArgumentException("Block name must not contain quotes: " + blockName);
        }
        return ".//addData/data[@name='" + blockName + "']";
    }
}
