package com.phillippitts.pptxmerger.service.xml;

import com.phillippitts.pptxmerger.exception.ArchiveWriteException;
import com.phillippitts.pptxmerger.exception.PartParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and saves XML parts as DOM documents.
 *
 * <p>Parsing is namespace-aware and rejects DOCTYPE declarations (presentation parts never carry
 * one). Serialization always writes {@code <?xml version="1.0" encoding="UTF-8" standalone="yes"?>}
 * and creates missing parent folders, since a merged package may gain folders the base never had.
 */
@Component
public class XmlPartStore {

    private static final Logger LOG = LogManager.getLogger(XmlPartStore.class);

    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            LOG.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private final DocumentBuilderFactory builderFactory;
    private final TransformerFactory transformerFactory;

    public XmlPartStore() {
        this.builderFactory = newBuilderFactory();
        this.transformerFactory = TransformerFactory.newInstance();
    }

    /**
     * Parses an XML part into an editable document.
     *
     * @param path file to parse
     * @return parsed document
     * @throws PartParseException if the file is missing, unreadable or not well-formed XML
     */
    public Document load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            DocumentBuilder builder = builderFactory.newDocumentBuilder();
            builder.setErrorHandler(STRICT_ERRORS);
            Document document = builder.parse(in);
            LOG.trace("Parsed XML part {}", path);
            return document;
        } catch (SAXException | IOException e) {
            throw new PartParseException(path, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a document to the given file, replacing it if present.
     *
     * @param document document to write
     * @param path     destination file; parent folders are created as needed
     * @throws ArchiveWriteException if the file cannot be written
     */
    public void save(Document document, Path path) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(path, "path must not be null");
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            document.setXmlStandalone(true);
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.STANDALONE, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            try (OutputStream out = Files.newOutputStream(path)) {
                transformer.transform(new DOMSource(document), new StreamResult(out));
                out.flush();
            }
            LOG.trace("Wrote XML part {}", path);
        } catch (IOException | TransformerException e) {
            throw new ArchiveWriteException(path, e);
        }
    }

    private static DocumentBuilderFactory newBuilderFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing: " + e.getMessage(), e);
        }
        return factory;
    }
}
