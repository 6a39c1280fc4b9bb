package com.plcmodel.core.resolver;

import com.plcmodel.core.model.CanonicalModel;
import com.plcmodel.core.model.TypeDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name index over every user-defined type of a model.
 *
 * <p>Enums, structures, unions and basic data types share one namespace. Classification
 * already keeps names unique across kinds, so each name maps to exactly one definition.
 * Lookups accept declared type strings and unwrap {@code ARRAY[..] OF} and
 * {@code POINTER TO} before matching.
 */
public final class TypeRegistry {

    private static final Pattern ARRAY_OF = Pattern.compile("^ARRAY\\s*\\[.*]\\s*OF\\s+(.+)$");
    private static final String POINTER_TO = "POINTER TO ";

    private final Map<String, TypeDefinition> types;

    private TypeRegistry(Map<String, TypeDefinition> types) {
        this.types = Collections.unmodifiableMap(types);
    }

    /**
     * Indexes the type collections of a model.
     *
     * @param model finished model
     * @return registry keyed by type name
     */
    public static TypeRegistry of(CanonicalModel model) {
        Map<String, TypeDefinition> types = new LinkedHashMap<>();
        register(types, model.enums());
        register(types, model.structures());
        register(types, model.unions());
        register(types, model.dataTypes());
        return new TypeRegistry(types);
    }

    private static void register(Map<String, TypeDefinition> types, Collection<? extends TypeDefinition> definitions) {
        for (TypeDefinition definition : definitions) {
            types.putIfAbsent(definition.name(), definition);
        }
    }

    /**
     * Strips array and pointer wrappers from a declared type.
     *
     * <p>{@code "ARRAY[0..3] OF POINTER TO ST_Axis"} yields {@code "ST_Axis"}.
     *
     * @param declaredType declared type, may be null
     * @return innermost referenced name, empty for null input
     */
    public static String referencedName(String declaredType) {
        if (declaredType == null) {
            return "";
        }
        String name = declaredType.trim();
        while (true) {
            Matcher array = ARRAY_OF.matcher(name);
            if (array.matches()) {
                name = array.group(1).trim();
            } else if (name.startsWith(POINTER_TO)) {
                name = name.substring(POINTER_TO.length()).trim();
            } else {
                return name;
            }
        }
    }

    /**
     * Finds the definition a declared type refers to.
     *
     * @param declaredType declared type, wrappers allowed
     * @return matching definition, empty for elementary or unknown types
     */
    public Optional<TypeDefinition> lookup(String declaredType) {
        return Optional.ofNullable(types.get(referencedName(declaredType)));
    }

    public Map<String, TypeDefinition> types() {
        return types;
    }

    public int size() {
        return types.size();
    }
}
