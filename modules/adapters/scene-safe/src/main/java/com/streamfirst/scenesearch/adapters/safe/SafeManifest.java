package com.streamfirst.scenesearch.adapters.safe;

import com.streamfirst.scenesearch.domain.SceneSearchException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * The {@code manifest.safe} of an unpacked SAFE product. Elements are looked up by local name, so
 * the lookups do not depend on namespace prefixes.
 */
final class SafeManifest {

    static final String FILE_NAME = "manifest.safe";

    private final Path file;
    private final Document document;

    private SafeManifest(Path file, Document document) {
        this.file = file;
        this.document = document;
    }

    /**
     * Parses the manifest of the product at {@code location}.
     *
     * @throws SceneSearchException if the manifest is missing or not well-formed
     */
    static SafeManifest read(String location) {
        Path file = Path.of(location, FILE_NAME);
        try (InputStream in = Files.newInputStream(file)) {
            return new SafeManifest(file, builder().parse(in));
        } catch (IOException | SAXException e) {
            throw new SceneSearchException("cannot read " + file, e);
        }
    }

    /** First element with the given local name, in document order. */
    Optional<Element> first(String localName) {
        NodeList nodes = document.getElementsByTagNameNS("*", localName);
        return nodes.getLength() == 0 ? Optional.empty() : Optional.of((Element) nodes.item(0));
    }

    /** First element with the given local name whose {@code type} attribute matches. */
    Optional<Element> first(String localName, String type) {
        NodeList nodes = document.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            Element element = (Element) nodes.item(i);
            if (type.equals(element.getAttribute("type"))) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    Optional<String> text(String localName) {
        return first(localName).map(e -> e.getTextContent().trim());
    }

    Optional<Integer> integer(String localName) {
        return text(localName).map(Integer::parseInt);
    }

    Path file() {
        return file;
    }

    private static DocumentBuilder builder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }
}
