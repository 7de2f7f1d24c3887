package org.dxworks.formframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.dxworks.formframe.TestUtils.SAMPLES;
import static org.junit.jupiter.api.Assertions.*;

public class ViewFileDetectorTest {

    @Test
    void isViewFile_MatchesViewStylesheetsOnly() {
        assertTrue(ViewFileDetector.isViewFile(Paths.get("forms/a/view1.xsl")));
        assertTrue(ViewFileDetector.isViewFile(Paths.get("forms/a/View2.XSL")));
        assertFalse(ViewFileDetector.isViewFile(Paths.get("forms/a/manifest.xsf")));
        assertFalse(ViewFileDetector.isViewFile(Paths.get("forms/a/upgrade.xsl")));
    }

    @Test
    void collectForms_GroupsViewsByDirectory() throws Exception {
        Map<Path, List<Path>> forms = ViewFileDetector.collectForms(SAMPLES);

        assertEquals(5, forms.size());
        List<Path> expenses = forms.get(SAMPLES.resolve("expenses"));
        assertEquals(2, expenses.size());
        assertEquals("view1.xsl", expenses.get(0).getFileName().toString());
        assertEquals("view2.xsl", expenses.get(1).getFileName().toString());
        assertEquals(1, forms.get(SAMPLES.resolve("travel")).size());
    }

    @Test
    void collectForms_OrdersViewsByNumber(@TempDir Path dir) throws Exception {
        Path form = dir.resolve("budget");
        Files.createDirectories(form);
        for (String name : List.of("view10.xsl", "view2.xsl", "view1.xsl", "view11.xsl")) {
            Files.writeString(form.resolve(name), "<xsl:stylesheet/>");
        }

        List<Path> views = ViewFileDetector.collectForms(dir).get(form);

        assertEquals(List.of("view1.xsl", "view2.xsl", "view10.xsl", "view11.xsl"),
                views.stream().map(v -> v.getFileName().toString()).collect(Collectors.toList()));
    }

    @Test
    void viewNumber_ReadsTheSuffix() {
        assertEquals(12, ViewFileDetector.viewNumber(Paths.get("view12.xsl")));
        assertEquals(Integer.MAX_VALUE, ViewFileDetector.viewNumber(Paths.get("view.xsl")));
        assertEquals(Integer.MAX_VALUE, ViewFileDetector.viewNumber(Paths.get("viewPrint.xsl")));
    }

    @Test
    void collectForms_SingleViewFileIsItsOwnForm() throws Exception {
        Path view = SAMPLES.resolve("items").resolve("view1.xsl");

        Map<Path, List<Path>> forms = ViewFileDetector.collectForms(view);

        assertEquals(Map.of(view, List.of(view)), forms);
    }
}
