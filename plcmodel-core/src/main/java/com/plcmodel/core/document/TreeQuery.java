package com.plcmodel.core.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered-fallback tree queries.
 *
 * <p>Each query receives an ordered list of {@link PathExpression paths}. Paths are tried in
 * order and the first one that yields a result wins; later paths are not evaluated. This is
 * how callers express "look here, else there" without nesting conditionals:
 *
 * <pre>{@code
 * List<DocumentNode> values = query.findAll(enumNode,
 *     ".//values/value", ".//enumValue", ".//enum/value");
 * }</pre>
 *
 * <p>Compiled expressions are cached per instance. Instances are not thread-safe; use one
 * per extraction run.
 *
 * @since 1.0.0
 */
public class TreeQuery {

    private static final Logger log = LoggerFactory.getLogger(TreeQuery.class);

    private final XPath xpath;
    private final Map<String, XPathExpression> compiled = new HashMap<>();

    public TreeQuery() {
        this.xpath = XPathFactory.newInstance().newXPath();
    }

    /**
     * Returns the first element matched by the first path that matches anything.
     *
     * @param node context node
     * @param paths ordered candidate paths
     * @return first match, or empty if no path matches
     * @throws StructuralFailureException if a path cannot be evaluated
     */
    public Optional<DocumentNode> findFirst(DocumentNode node, List<String> paths) {
        for (String path : paths) {
            List<DocumentNode> matches = evaluate(node, path);
            if (!matches.isEmpty()) {
                return Optional.of(matches.get(0));
            }
        }
        return Optional.empty();
    }

    public Optional<DocumentNode> findFirst(DocumentNode node, String... paths) {
        return findFirst(node, List.of(paths));
    }

    /**
     * Returns all elements matched by the first path that matches anything.
     *
     * @param node context node
     * @param paths ordered candidate paths
     * @return matches in document order, empty if no path matches
     * @throws StructuralFailureException if a path cannot be evaluated
     */
    public List<DocumentNode> findAll(DocumentNode node, List<String> paths) {
        for (String path : paths) {
            List<DocumentNode> matches = evaluate(node, path);
            if (!matches.isEmpty()) {
                return matches;
            }
        }
        return List.of();
    }

    public List<DocumentNode> findAll(DocumentNode node, String... paths) {
        return findAll(node, List.of(paths));
    }

    /**
     * Returns the trimmed text of the first match, if it is not blank.
     *
     * @param node context node
     * @param paths ordered candidate paths
     * @return non-blank text of the first match, or empty
     */
    public Optional<String> findText(DocumentNode node, String... paths) {
        return findFirst(node, paths)
            .map(DocumentNode::text)
            .filter(text -> !text.isEmpty());
    }

    /**
     * Returns true if any of the paths matches.
     *
     * @param node context node
     * @param paths candidate paths
     * @return true if at least one element matches
     */
    public boolean exists(DocumentNode node, String... paths) {
        return findFirst(node, paths).isPresent();
    }

    private List<DocumentNode> evaluate(DocumentNode node, String path) {
        XPathExpression expression = compiled.computeIfAbsent(path, this::compile);
        NodeList nodes;
        try {
            nodes = (NodeList) expression.evaluate(node.element(), XPathConstants.NODESET);
        } catch (XPathExpressionException e) {
            throw new StructuralFailureException("Tree query failed on " + node + " for path: " + path, e);
        }

        List<DocumentNode> matches = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Node match = nodes.item(i);
            if (match.getNodeType() == Node.ELEMENT_NODE) {
                matches.add(DocumentNode.of((Element) match));
            }
        }
        return matches;
    }

    private XPathExpression compile(String path) {
        PathExpression expression = PathExpression.of(path);
        try {
            log.trace("Compiling path {} as {}", path, expression.xpath());
            return xpath.compile(expression.xpath());
        } catch (XPathExpressionException e) {
            throw new StructuralFailureException("Invalid path expression: " + path, e);
        }
    }
}
