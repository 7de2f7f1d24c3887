package org.dxworks.formframe.analyzer.infopath;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import static org.dxworks.formframe.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

public class ViewDocumentLoaderTest {

    @Test
    void parse_ByteOrderMark_IsIgnored() throws Exception {
        Document document = new ViewDocumentLoader().parse("\uFEFF<root><child/></root>", "bom.xsl");

        assertEquals("root", document.getDocumentElement().getTagName());
    }

    @Test
    void parse_ExternalEntity_IsNeverResolved() throws Exception {
        String xml = "<?xml version=\"1.0\"?>"
                + "<!DOCTYPE root [<!ENTITY ext SYSTEM \"file:///etc/hostname\">]>"
                + "<root>&ext;</root>";

        Document document;
        try {
            document = new ViewDocumentLoader().parse(xml, "xxe.xsl");
        } catch (ViewLoadException e) {
            // rejecting the document outright is just as good
            return;
        }
        assertEquals("", document.getDocumentElement().getTextContent().trim());
    }

    @Test
    void load_MalformedView_ThrowsWithFileName() {
        ViewLoadException e = assertThrows(ViewLoadException.class,
                () -> new ViewDocumentLoader().load(sample("broken", "view1.xsl")));

        assertTrue(e.getMessage().startsWith("Malformed view"));
        assertTrue(e.getMessage().contains("view1.xsl"));
    }

    @Test
    void load_ViewOverSizeLimit_IsRejected() {
        ViewLoadException e = assertThrows(ViewLoadException.class,
                () -> new ViewDocumentLoader(10).load(sample("employee", "view1.xsl")));

        assertTrue(e.getMessage().contains("more than the configured limit of 10"));
    }

    @Test
    void load_MissingFile_IsALoadError() {
        assertThrows(ViewLoadException.class,
                () -> new ViewDocumentLoader().load(sample("employee", "view9.xsl")));
    }
}
