package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.AnalysisMessage;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;
import org.dxworks.formframe.model.infopath.FormAnalysis;
import org.dxworks.formframe.model.infopath.MessageSeverity;
import org.dxworks.formframe.model.infopath.ViewModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MigrationAdvisorTest {

    @Test
    void advise_EmptyForm_ReportsSuccessAndMissingData() {
        FormAnalysis form = form("forms/empty");

        List<AnalysisMessage> messages = new MigrationAdvisor().advise(form);

        assertEquals(List.of("Successfully analyzed form: forms/empty", "No data columns detected"),
                messages.stream().map(m -> m.message).collect(Collectors.toList()));
        assertEquals("Found 1 view(s) with 0 controls", messages.get(0).details);
        assertEquals(MessageSeverity.WARNING, messages.get(1).severity);
    }

    @Test
    void advise_ComplexControls_AreGroupedByKindAndCapped() {
        FormAnalysis form = form("forms/attachments");
        for (int i = 1; i <= 7; i++) {
            form.views.get(0).controls.add(control("file" + i, ControlKind.FILE_ATTACHMENT, ""));
        }
        form.views.get(0).controls.add(control("sig", ControlKind.SIGNATURE_LINE, "Approver signature"));

        List<AnalysisMessage> messages = new MigrationAdvisor().advise(form);

        AnalysisMessage files = messages.stream()
                .filter(m -> m.message.equals("Complex control type detected: FileAttachment"))
                .findFirst().orElseThrow();
        assertEquals("Controls: file1, file2, file3, file4, file5. File attachments will require binary storage in database",
                files.details);
        assertEquals("ControlAnalysis", files.source);
        assertTrue(messages.stream().anyMatch(m -> m.details != null
                && m.details.equals("Controls: Approver signature. Digital signatures will need special security handling")));
    }

    @Test
    void advise_LoadErrorsComeFirst() {
        FormAnalysis form = form("forms/broken");
        ViewModel failed = new ViewModel();
        failed.viewName = "view2.xsl";
        failed.loadError = "Malformed view view2.xsl";
        form.views.add(failed);

        List<AnalysisMessage> messages = new MigrationAdvisor().advise(form);

        assertEquals(MessageSeverity.ERROR, messages.get(0).severity);
        assertEquals("Failed to load view: view2.xsl", messages.get(0).message);
        assertEquals("Malformed view view2.xsl", messages.get(0).details);
    }

    @Test
    void advise_ThresholdIsExclusive() {
        FormAnalysis form = form("forms/medium");
        form.metadata.totalControls = 3;

        assertTrue(new MigrationAdvisor(3).advise(form).stream().noneMatch(m -> m.message.equals("Large form detected")));
        assertTrue(new MigrationAdvisor(2).advise(form).stream().anyMatch(m -> m.message.equals("Large form detected")));
    }

    private static FormAnalysis form(String path) {
        FormAnalysis form = new FormAnalysis();
        form.formPath = path;
        ViewModel view = new ViewModel();
        view.viewName = "view1.xsl";
        form.views.add(view);
        return form;
    }

    private static Control control(String name, ControlKind kind, String label) {
        Control control = new Control();
        control.name = name;
        control.kind = kind;
        control.type = kind.getDisplayName();
        control.label = label;
        return control;
    }
}
