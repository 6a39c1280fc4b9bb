package com.plcmodel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One value of an enumeration.
 *
 * @param name value name, {@code Value_<index>} when the export does not name it
 * @param literalValue raw {@code value} attribute, empty if absent
 * @param details auxiliary details
 */
public record EnumValue(String name, String literalValue, Map<String, String> details) {

    public EnumValue {
        Objects.requireNonNull(name, "name must not be null");
        if (literalValue == null) {
            literalValue = "";
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
