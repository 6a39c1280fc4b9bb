package com.plcmodel.core.document;

import java.util.Objects;

/**
 * Namespace-agnostic path expression over export documents.
 *
 * <p>Export files put their content in a default namespace (PLCopen TC6) while embedded
 * documentation uses XHTML and some tools prefix elements. Paths are therefore written by
 * local name and translated to XPath that matches on {@code local-name()} only:
 *
 * <pre>{@code
 * .//dataType                    -> .//*[local-name()='dataType']
 * ./baseType/enum                -> ./*[local-name()='baseType']/*[local-name()='enum']
 * .//data[@name='urn:x']         -> .//*[local-name()='data'][@name='urn:x']
 * .                              -> .
 * }</pre>
 *
 * <p>Predicates in square brackets are copied verbatim; {@code *} matches any element.
 *
 * @param source path as written
 * @param xpath translated XPath
 * @since 1.0.0
 */
public record PathExpression(String source, String xpath) {

    public PathExpression {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(xpath, "xpath must not be null");
    }

    /**
     * Translates a path into its XPath form.
     *
     * @param path path in local-name form
     * @return compiled path expression
     * @throws IllegalArgumentException if the path is blank or a predicate is not closed
     */
    public static PathExpression of(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }

        StringBuilder xpath = new StringBuilder();
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '/' || c == '.') {
                xpath.append(c);
                i++;
                continue;
            }

            int start = i;
            while (i < path.length() && path.charAt(i) != '/' && path.charAt(i) != '[') {
                i++;
            }
            String name = path.substring(start, i);
            xpath.append("*".equals(name) ? "*" : "*[local-name()='" + name + "']");

            while (i < path.length() && path.charAt(i) == '[') {
                int close = path.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed predicate in path: " + path);
                }
                xpath.append(path, i, close + 1);
                i = close + 1;
            }
        }
        return new PathExpression(path, xpath.toString());
    }
}
