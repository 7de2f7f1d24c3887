package org.dxworks.formframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.formframe.analyzer.infopath.ViewDocumentLoader;
import org.dxworks.formframe.analyzer.infopath.ViewLoadException;
import org.w3c.dom.Document;

import java.nio.file.Path;
import java.nio.file.Paths;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static final Path SAMPLES = Paths.get("src/test/resources/samples/infopath");

    private static final String STYLESHEET_OPEN =
            "<xsl:stylesheet version=\"1.0\""
                    + " xmlns:xsl=\"http://www.w3.org/1999/XSL/Transform\""
                    + " xmlns:xd=\"http://schemas.microsoft.com/office/infopath/2003\""
                    + " xmlns:my=\"http://schemas.microsoft.com/office/infopath/2003/myXSD/2024-01-01T00:00:00\">";

    public static Path sample(String form, String view) {
        return SAMPLES.resolve(form).resolve(view);
    }

    public static Document loadSample(String form, String view) throws ViewLoadException {
        return new ViewDocumentLoader().load(sample(form, view));
    }

    /**
     * Parses the given templates wrapped in a stylesheet declaring the xsl, xd and my prefixes.
     */
    public static Document stylesheet(String templates) throws ViewLoadException {
        return new ViewDocumentLoader().parse(STYLESHEET_OPEN + templates + "</xsl:stylesheet>", "inline.xsl");
    }
}
