package com.plcmodel.core.extract;

import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;
import com.plcmodel.core.model.ArrayDimension;
import com.plcmodel.core.model.TypeInfo;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads type descriptions from {@code type} and {@code baseType} elements.
 *
 * <p>Both elements share one content model: a single child naming an elementary type
 * ({@code <INT/>}), a reference ({@code <derived name="T"/>}), a string with optional length,
 * a pointer or an array whose element type is again a {@code baseType}. Array and pointer
 * names are rendered in IEC 61131-3 notation, e.g. {@code ARRAY[0..9] OF INT}.
 */
public class TypeInfoExtractor {

    private static final String DERIVED = "derived";
    private static final String ARRAY = "array";
    private static final String POINTER = "pointer";
    private static final String STRING = "string";
    private static final String WSTRING = "wstring";
    private static final String NAME = "name";
    private static final String BASE_TYPE = "baseType";
    private static final String DIMENSION = "dimension";

    private final TreeQuery query;

    public TypeInfoExtractor(TreeQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
    }

    /**
     * Describes the type held by a {@code type} or {@code baseType} element.
     *
     * @param typeNode type element, may be empty
     * @return type information, {@link TypeInfo#unknown()} if nothing can be read
     */
    public TypeInfo describe(Optional<DocumentNode> typeNode) {
        return typeNode.map(this::describe).orElseGet(TypeInfo::unknown);
    }

    /**
     * Describes the type held by a {@code type} or {@code baseType} element.
     *
     * @param typeNode type element
     * @return type information
     */
    public TypeInfo describe(DocumentNode typeNode) {
        List<DocumentNode> children = typeNode.children();
        if (children.isEmpty()) {
            String text = typeNode.text();
            return text.isEmpty() ? TypeInfo.unknown() : basic(text);
        }

        DocumentNode declared = children.get(0);
        String tag = declared.localName();

        if (DERIVED.equals(tag)) {
            String referenced = declared.attribute(NAME).orElse(TypeInfo.UNKNOWN);
            return new TypeInfo(referenced, TypeInfo.CATEGORY_DERIVED, referenced, null, List.of());
        }
        if (ARRAY.equals(tag)) {
            return describeArray(declared);
        }
        if (POINTER.equals(tag)) {
            TypeInfo target = describe(declared.child(BASE_TYPE));
            return new TypeInfo("POINTER TO " + target.name(), TypeInfo.CATEGORY_POINTER, null, null, List.of());
        }
        if (STRING.equalsIgnoreCase(tag) || WSTRING.equalsIgnoreCase(tag)) {
            String length = declared.attribute("length").orElse(null);
            return new TypeInfo(tag.toUpperCase(Locale.ROOT), TypeInfo.CATEGORY_STRING, null, length, List.of());
        }
        if (NAME.equals(tag)) {
            String text = declared.text();
            return text.isEmpty() ? TypeInfo.unknown() : basic(text);
        }
        return basic(tag);
    }

    private TypeInfo describeArray(DocumentNode array) {
        List<ArrayDimension> dimensions = query.findAll(array, "./" + DIMENSION).stream()
            .map(dimension -> new ArrayDimension(
                dimension.attribute("lower").orElse(null),
                dimension.attribute("upper").orElse(null)))
            .toList();
        TypeInfo element = describe(array.child(BASE_TYPE));

        String bounds = dimensions.stream()
            .map(dimension -> dimension.lower() + ".." + dimension.upper())
            .collect(Collectors.joining(", "));
        String name = "ARRAY[" + bounds + "] OF " + element.name();
        return new TypeInfo(name, TypeInfo.CATEGORY_ARRAY, element.derivedFrom(), null, dimensions);
    }

    private static TypeInfo basic(String name) {
        return new TypeInfo(name, TypeInfo.CATEGORY_BASIC, null, null, List.of());
    }
}
