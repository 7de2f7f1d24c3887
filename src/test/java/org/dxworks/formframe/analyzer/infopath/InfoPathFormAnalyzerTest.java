package org.dxworks.formframe.analyzer.infopath;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.model.infopath.AnalysisMessage;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.DataColumn;
import org.dxworks.formframe.model.infopath.FormAnalysis;
import org.dxworks.formframe.model.infopath.MessageSeverity;
import org.dxworks.formframe.model.infopath.ViewModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.dxworks.formframe.TestUtils.APPROVAL_MAPPER;
import static org.dxworks.formframe.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

public class InfoPathFormAnalyzerTest {

    private final InfoPathFormAnalyzer analyzer = new InfoPathFormAnalyzer(FormframeConfig.with(5, false, 100, 0));

    @Test
    void analyze_Employee_LabelsAreAssociatedAndMerged() {
        FormAnalysis form = analyze("employee", "view1.xsl");

        List<Control> controls = form.views.get(0).controls;
        Control firstName = find(controls, "firstName");
        assertEquals("First Name:", firstName.label);
        assertEquals("FIRSTNAME", firstName.associatedLabelId);
        assertEquals("firstName", find(controls, "FIRSTNAME").associatedControlId);
        assertEquals("Department:", find(controls, "department").label);

        Control wrapped = find(controls, "PLEASEDESCRIBETHE");
        assertEquals("Please describe the reason for this request:", wrapped.label);
        assertTrue(wrapped.multiLineLabel);
        assertTrue(find(controls, "REASONFORTHISREQUEST").mergedIntoParent);
    }

    @Test
    void analyze_Employee_DataColumnsAndMetadata() {
        FormAnalysis form = analyze("employee", "view1.xsl");

        assertEquals(7, form.data.size());
        DataColumn department = column(form, "department");
        assertEquals("IT", department.defaultValue);
        assertEquals(3, department.validValues.size());
        assertEquals("Department:", department.displayName);
        DataColumn approved = column(form, "approved");
        assertEquals(2, approved.validValues.size());
        assertEquals("No", approved.defaultValue);
        assertEquals("true", column(form, "fullTime").defaultValue);
        assertEquals("Contact", column(form, "email").owningSection);

        assertEquals(1, form.metadata.viewCount);
        assertEquals(12, form.metadata.totalControls);
        assertEquals(1, form.metadata.totalSections);
        assertEquals(0, form.metadata.repeatingSectionCount);
        assertEquals(0, form.metadata.dynamicSectionCount);
        assertEquals(3, form.metadata.controlTypes.get("Label").intValue());
        assertEquals(2, form.metadata.controlTypes.get("RadioButton").intValue());
        assertEquals(1, form.metadata.controlTypes.get("PeoplePicker").intValue());
    }

    @Test
    void analyze_Employee_MessagesFlagPeoplePicker() {
        FormAnalysis form = analyze("employee", "view1.xsl");

        AnalysisMessage first = form.messages.get(0);
        assertEquals(MessageSeverity.INFO, first.severity);
        assertTrue(first.message.startsWith("Successfully analyzed form: "));
        assertEquals("Found 1 view(s) with 12 controls", first.details);

        AnalysisMessage data = message(form, "Data structure: 7 columns");
        assertEquals("Standard: 7, Repeating: 0, Dropdowns: 2", data.details);

        AnalysisMessage picker = message(form, "Complex control type detected: PeoplePicker");
        assertEquals(MessageSeverity.WARNING, picker.severity);
        assertEquals("Controls: Manager. People Picker controls will need user lookup functionality", picker.details);

        assertTrue(form.messages.stream().noneMatch(m -> m.message.startsWith("Nested repeating")));
        assertTrue(form.messages.stream().noneMatch(m -> m.severity == MessageSeverity.ERROR));
    }

    @Test
    void analyze_Travel_RepetitionVisibilityAndWarnings() {
        FormAnalysis form = analyze("travel", "view1.xsl");

        assertEquals(List.of("CTRL42", "CTRL51"), form.conditionalVisibility.get("isRoundTrip"));
        assertEquals(2, form.dynamicSections.size());
        assertEquals(4, form.metadata.repeatingSectionCount);
        assertEquals(4, form.metadata.totalSections);
        assertEquals(List.of("isRoundTrip"), form.metadata.conditionalFields);

        assertEquals(7, form.data.size());
        DataColumn returnDate = column(form, "returnDate");
        assertTrue(returnDate.repeating);
        assertEquals("Trips", returnDate.owningSection);
        assertTrue(returnDate.conditional);
        assertEquals("isRoundTrip", returnDate.conditionalOnField);
        assertEquals("Expense Items_Receipts", column(form, "receiptNumber").owningSection);

        AnalysisMessage repeating = message(form, "Form contains 4 repeating structure(s)");
        assertTrue(repeating.details.startsWith("Sections: 3, Tables: 1."));
        assertEquals(MessageSeverity.WARNING, message(form, "Nested repeating sections detected").severity);
    }

    @Test
    void analyze_Broken_UnreadableViewBecomesError() {
        FormAnalysis form = analyze("broken", "view1.xsl", "view2.xsl");

        assertEquals(2, form.views.size());
        assertNotNull(form.views.get(0).loadError);
        assertTrue(form.views.get(0).controls.isEmpty());
        assertNull(form.views.get(1).loadError);
        assertEquals("title", form.views.get(1).controls.get(0).name);

        AnalysisMessage error = form.messages.get(0);
        assertEquals(MessageSeverity.ERROR, error.severity);
        assertEquals("Failed to load view: view1.xsl", error.message);
        assertTrue(error.details.startsWith("Malformed view"));
        assertEquals("Loading", error.source);
        assertEquals(1, form.data.size());
    }

    @Test
    void analyze_ParallelViews_KeepInputOrder() {
        InfoPathFormAnalyzer parallel = new InfoPathFormAnalyzer(FormframeConfig.with(5, true, 100, 0));
        Path first = sample("expenses", "view1.xsl");
        Path second = sample("expenses", "view2.xsl");

        FormAnalysis form = parallel.analyze("expenses", List.of(first, second));

        assertEquals("view1.xsl", form.views.get(0).viewName);
        assertEquals("view2.xsl", form.views.get(1).viewName);
        assertEquals(2, form.data.size());
        assertEquals("Expenses", form.data.get(0).owningSection);
        assertEquals("Trips", form.data.get(1).owningSection);
    }

    @Test
    void analyze_SmallThreshold_WarnsAboutLargeForm() {
        InfoPathFormAnalyzer strict = new InfoPathFormAnalyzer(FormframeConfig.with(5, false, 10, 0));

        FormAnalysis form = strict.analyze("employee", List.of(sample("employee", "view1.xsl")));

        AnalysisMessage large = message(form, "Large form detected");
        assertTrue(large.details.startsWith("This form has 12 controls."));
    }

    @Test
    void analyze_ParserFailure_KeepsTheOtherViews() {
        ViewStructuralParser failing = new ViewStructuralParser() {
            @Override
            public ViewModel parse(Document document, String viewName) {
                if (viewName.equals("view2.xsl")) {
                    throw new StackOverflowError();
                }
                return super.parse(document, viewName);
            }
        };
        InfoPathFormAnalyzer guarded = new InfoPathFormAnalyzer(FormframeConfig.with(5, false, 100, 0), failing);

        FormAnalysis form = guarded.analyze("expenses",
                List.of(sample("expenses", "view1.xsl"), sample("expenses", "view2.xsl")));

        assertEquals(2, form.views.size());
        assertEquals(1, form.views.get(0).controls.size());
        ViewModel failed = form.views.get(1);
        assertEquals("view2.xsl", failed.viewName);
        assertEquals("StackOverflowError", failed.parseError);
        assertNull(failed.loadError);
        assertTrue(failed.controls.isEmpty());

        AnalysisMessage error = message(form, "Failed to parse view: view2.xsl");
        assertEquals(MessageSeverity.ERROR, error.severity);
        assertEquals("Parsing", error.source);
        assertEquals(1, form.data.size());
    }

    @Test
    void analyze_RuntimeFailureInOneView_IsReportedWithItsMessage() {
        ViewStructuralParser failing = new ViewStructuralParser() {
            @Override
            public ViewModel parse(Document document, String viewName) {
                throw new IllegalStateException("unexpected markup");
            }
        };
        InfoPathFormAnalyzer guarded = new InfoPathFormAnalyzer(FormframeConfig.with(5, true, 100, 0), failing);

        FormAnalysis form = guarded.analyze("items", List.of(sample("items", "view1.xsl")));

        assertEquals("IllegalStateException: unexpected markup", form.views.get(0).parseError);
        assertEquals(0, form.metadata.totalControls);
    }

    @Test
    void analyze_RecursiveSectionTemplateNextToGoodView_AnalyzesBoth(@TempDir Path dir) throws Exception {
        Path good = dir.resolve("view1.xsl");
        Files.copy(sample("items", "view1.xsl"), good);
        Path recursive = dir.resolve("view2.xsl");
        Files.writeString(recursive, "<xsl:stylesheet version=\"1.0\""
                + " xmlns:xsl=\"http://www.w3.org/1999/XSL/Transform\""
                + " xmlns:xd=\"http://schemas.microsoft.com/office/infopath/2003\""
                + " xmlns:my=\"http://schemas.microsoft.com/office/infopath/2003/myXSD/2024-01-01T00:00:00\">"
                + "<xsl:template match=\"my:myFields\"><div>"
                + "<div><xsl:apply-templates select=\"my:group\" mode=\"_1\"/></div>"
                + "</div></xsl:template>"
                + "<xsl:template match=\"my:group\" mode=\"_1\">"
                + "<div class=\"xdSection\" xd:xctname=\"Section\" xd:CtrlId=\"CTRL2\">"
                + "<span class=\"xdTextBox\" xd:xctname=\"PlainText\" xd:CtrlId=\"CTRL3\" xd:binding=\"my:field\"/>"
                + "<xsl:apply-templates select=\"my:group\" mode=\"_1\"/>"
                + "</div></xsl:template>"
                + "</xsl:stylesheet>", StandardCharsets.UTF_8);

        FormAnalysis form = analyzer.analyze("recursive", List.of(good, recursive));

        assertEquals(2, form.views.size());
        assertNull(form.views.get(1).parseError);
        assertEquals(1, form.views.get(1).controls.size());
        assertEquals(2, form.metadata.totalControls);
        assertTrue(form.messages.stream().noneMatch(m -> m.severity == MessageSeverity.ERROR));
    }

    @Test
    void analyze_Employee_SerializesToJson() throws Exception {
        FormAnalysis form = analyze("employee", "view1.xsl");

        JsonNode json = APPROVAL_MAPPER.readTree(APPROVAL_MAPPER.writeValueAsString(form));

        assertEquals("infopath", json.get("format").asText());
        assertEquals("employee", json.get("formPath").asText());
        JsonNode firstName = json.get("views").get(0).get("controls").get(1);
        assertEquals("firstName", firstName.get("name").asText());
        assertEquals("TextField", firstName.get("kind").asText());
        assertEquals("2A", firstName.get("gridPosition").asText());
        assertEquals("CTRL1", firstName.get("properties").get("CtrlId").asText());
        assertFalse(firstName.has("ctrlId"));
        assertEquals("Cosmetic", json.get("views").get(0).get("sections").get(0).get("kind").asText());
        assertEquals("INFO", json.get("messages").get(0).get("severity").asText());
    }

    private FormAnalysis analyze(String formName, String... views) {
        List<Path> paths = new ArrayList<>();
        for (String view : views) {
            paths.add(sample(formName, view));
        }
        return analyzer.analyze(formName, paths);
    }

    private static Control find(List<Control> controls, String name) {
        return controls.stream().filter(c -> name.equals(c.name)).findFirst()
                .orElseThrow(() -> new AssertionError("No control named " + name));
    }

    private static DataColumn column(FormAnalysis form, String name) {
        return form.data.stream().filter(c -> name.equals(c.columnName)).findFirst()
                .orElseThrow(() -> new AssertionError("No column named " + name));
    }

    private static AnalysisMessage message(FormAnalysis form, String text) {
        return form.messages.stream().filter(m -> text.equals(m.message)).findFirst()
                .orElseThrow(() -> new AssertionError("No message " + text));
    }
}
