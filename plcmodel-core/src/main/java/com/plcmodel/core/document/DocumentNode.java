package com.plcmodel.core.document;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only handle on an element of a loaded export document.
 *
 * <p>Wraps a DOM {@link Element} and exposes only what extraction needs: the namespace-free
 * local name, attribute lookup, trimmed text content, and navigation to children and
 * ancestors. The underlying document is borrowed for the duration of extraction and is
 * never mutated through this type.
 *
 * <p>Two handles are equal when they wrap the same DOM element.
 *
 * @since 1.0.0
 */
public final class DocumentNode {

    private final Element element;

    private DocumentNode(Element element) {
        this.element = Objects.requireNonNull(element, "element must not be null");
    }

    /**
     * Wraps a DOM element.
     *
     * @param element element to wrap
     * @return node handle
     */
    public static DocumentNode of(Element element) {
        return new DocumentNode(element);
    }

    /**
     * Returns the wrapped DOM element.
     *
     * @return DOM element
     */
    public Element element() {
        return element;
    }

    /**
     * Returns the element name without any namespace prefix.
     *
     * @return local name, e.g. {@code dataType}
     */
    public String localName() {
        String localName = element.getLocalName();
        if (localName != null) {
            return localName;
        }
        String nodeName = element.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    /**
     * Looks up an attribute value.
     *
     * @param name attribute name
     * @return the value, or empty if the attribute is missing or blank
     */
    public Optional<String> attribute(String name) {
        if (!element.hasAttribute(name)) {
            return Optional.empty();
        }
        String value = element.getAttribute(name);
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Returns the text content of this element and its descendants, trimmed.
     *
     * @return trimmed text, empty string if none
     */
    public String text() {
        String content = element.getTextContent();
        return content == null ? "" : content.trim();
    }

    /**
     * Returns the direct child elements in document order.
     *
     * @return child elements
     */
    public List<DocumentNode> children() {
        List<DocumentNode> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                children.add(new DocumentNode((Element) node));
            }
        }
        return children;
    }

    /**
     * Returns the first direct child element with the given local name.
     *
     * @param localName local name to match
     * @return matching child, or empty
     */
    public Optional<DocumentNode> child(String localName) {
        return children().stream()
            .filter(child -> child.localName().equals(localName))
            .findFirst();
    }

    /**
     * Returns the parent element, if this element is not the document root.
     *
     * @return parent element or empty
     */
    public Optional<DocumentNode> parent() {
        Node parent = element.getParentNode();
        if (parent != null && parent.getNodeType() == Node.ELEMENT_NODE) {
            return Optional.of(new DocumentNode((Element) parent));
        }
        return Optional.empty();
    }

    /**
     * Returns the nearest ancestor element with the given local name.
     *
     * @param localName local name to match
     * @return nearest matching ancestor, or empty
     */
    public Optional<DocumentNode> ancestor(String localName) {
        Optional<DocumentNode> current = parent();
        while (current.isPresent()) {
            if (current.get().localName().equals(localName)) {
                return current;
            }
            current = current.get().parent();
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentNode that)) {
            return false;
        }
        return element.isSameNode(that.element);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return attribute("name")
            .map(name -> "<" + localName() + " name=\"" + name + "\">")
            .orElse("<" + localName() + ">");
    }
}
