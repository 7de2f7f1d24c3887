package org.dxworks.formframe.analyzer.infopath;

import org.w3c.dom.Document;
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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads view documents into namespace-aware DOM trees. External entities and DTDs are
 * never fetched.
 */
public class ViewDocumentLoader {

    public static final long DEFAULT_MAX_VIEW_BYTES = 20L * 1024 * 1024;

    private final long maxViewBytes;

    public ViewDocumentLoader() {
        this(DEFAULT_MAX_VIEW_BYTES);
    }

    public ViewDocumentLoader(long maxViewBytes) {
        this.maxViewBytes = maxViewBytes;
    }

    public Document load(Path path) throws ViewLoadException {
        String content;
        try {
            long size = Files.size(path);
            if (size > maxViewBytes) {
                throw new ViewLoadException("View " + path.getFileName() + " has " + size
                        + " bytes, more than the configured limit of " + maxViewBytes);
            }
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ViewLoadException("Cannot read view " + path + ": " + e.getMessage(), e);
        }
        return parse(content, path.toString());
    }

    public Document parse(String content, String systemId) throws ViewLoadException {
        // Remove BOM if present
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        try {
            DocumentBuilder builder = newBuilder();
            InputSource source = new InputSource(new StringReader(content));
            source.setSystemId(systemId);
            return builder.parse(source);
        } catch (SAXException e) {
            throw new ViewLoadException("Malformed view " + systemId + ": " + e.getMessage(), e);
        } catch (IOException | ParserConfigurationException e) {
            throw new ViewLoadException("Cannot parse view " + systemId + ": " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setValidating(false);
        dbf.setExpandEntityReferences(false);
        dbf.setXIncludeAware(false);
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);

        DocumentBuilder builder = dbf.newDocumentBuilder();
        // Never resolve external entities: hand back an empty document instead.
        builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                System.err.println("[ViewDocumentLoader] " + e.getSystemId() + ":" + e.getLineNumber() + " " + e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                throw e;
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });
        return builder;
    }
}
