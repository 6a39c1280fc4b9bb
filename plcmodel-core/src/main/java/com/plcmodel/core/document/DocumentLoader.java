package com.plcmodel.core.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads export files into a namespace-aware DOM and returns the root element.
 *
 * <p>Document type declarations are rejected and external entities are never resolved.
 * Documents that are not well-formed, or that have no root element, fail with a
 * {@link StructuralFailureException}; they are never repaired.
 *
 * @since 1.0.0
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private static final String FEATURE_DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    /**
     * Loads an export file.
     *
     * @param file path to the XML export
     * @return root node
     * @throws IOException if the file cannot be read
     * @throws StructuralFailureException if the content is not a usable XML document
     */
    public DocumentNode load(Path file) throws IOException {
        log.debug("Loading export document: {}", file);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a readable file: " + file);
        }
        try {
            Document document = newBuilder().parse(file.toFile());
            return rootOf(document, file.toString());
        } catch (SAXException e) {
            throw new StructuralFailureException("Malformed XML in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses an export held in memory.
     *
     * @param xml XML content
     * @return root node
     * @throws StructuralFailureException if the content is not a usable XML document
     */
    public DocumentNode parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new StructuralFailureException("Document is empty");
        }
        try {
            Document document = newBuilder().parse(new InputSource(new StringReader(xml)));
            return rootOf(document, "<string>");
        } catch (SAXException e) {
            throw new StructuralFailureException("Malformed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StructuralFailureException("Failed to read XML content: " + e.getMessage(), e);
        }
    }

    private DocumentNode rootOf(Document document, String source) {
        Element root = document.getDocumentElement();
        if (root == null) {
            throw new StructuralFailureException("Document has no root element: " + source);
        }
        DocumentNode node = DocumentNode.of(root);
        log.debug("Loaded {} with root element {}", source, node.localName());
        return node;
    }

    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(FEATURE_DISALLOW_DOCTYPE, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new FailFastErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration is not supported", e);
        }
    }

    /**
     * Turns parser errors into exceptions instead of printing them to stderr.
     */
    private static final class FailFastErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException e) {
            log.warn("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
