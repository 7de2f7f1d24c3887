package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.AnalysisMessage;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;
import org.dxworks.formframe.model.infopath.DataColumn;
import org.dxworks.formframe.model.infopath.FormAnalysis;
import org.dxworks.formframe.model.infopath.MessageSeverity;
import org.dxworks.formframe.model.infopath.SectionKind;
import org.dxworks.formframe.model.infopath.SectionScope;
import org.dxworks.formframe.model.infopath.ViewModel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarises an analysed form for whoever plans its migration: what was found, and
 * which parts will need manual attention on the target platform.
 */
public class MigrationAdvisor {

    public static final int DEFAULT_LARGE_FORM_THRESHOLD = 100;

    private static final int MAX_LISTED_CONTROLS = 5;

    private static final Map<ControlKind, String> COMPLEX_CONTROLS = new EnumMap<>(ControlKind.class);

    static {
        COMPLEX_CONTROLS.put(ControlKind.PEOPLE_PICKER, "People Picker controls will need user lookup functionality");
        COMPLEX_CONTROLS.put(ControlKind.FILE_ATTACHMENT, "File attachments will require binary storage in database");
        COMPLEX_CONTROLS.put(ControlKind.SHAREPOINT_FILE_ATTACHMENT, "SharePoint attachments may need special handling");
        COMPLEX_CONTROLS.put(ControlKind.ACTIVE_X, "ActiveX controls may not be supported in modern platforms");
        COMPLEX_CONTROLS.put(ControlKind.INLINE_PICTURE, "Inline pictures will need binary storage");
        COMPLEX_CONTROLS.put(ControlKind.SIGNATURE_LINE, "Digital signatures will need special security handling");
    }

    private final int largeFormThreshold;

    public MigrationAdvisor() {
        this(DEFAULT_LARGE_FORM_THRESHOLD);
    }

    public MigrationAdvisor(int largeFormThreshold) {
        this.largeFormThreshold = largeFormThreshold;
    }

    public List<AnalysisMessage> advise(FormAnalysis form) {
        List<AnalysisMessage> messages = new ArrayList<>();

        for (ViewModel view : form.views) {
            if (view.loadError != null) {
                messages.add(new AnalysisMessage(MessageSeverity.ERROR, "Failed to load view: " + view.viewName,
                        view.loadError, "Loading"));
            }
            if (view.parseError != null) {
                messages.add(new AnalysisMessage(MessageSeverity.ERROR, "Failed to parse view: " + view.viewName,
                        view.parseError, "Parsing"));
            }
        }

        messages.add(new AnalysisMessage(MessageSeverity.INFO, "Successfully analyzed form: " + form.formPath,
                "Found " + form.views.size() + " view(s) with " + form.metadata.totalControls + " controls", "Analysis"));

        addRepeatingSummary(form, messages);
        addDataSummary(form, messages);
        addComplexControls(form, messages);

        if (form.metadata.totalControls > largeFormThreshold) {
            messages.add(new AnalysisMessage(MessageSeverity.WARNING, "Large form detected",
                    "This form has " + form.metadata.totalControls
                            + " controls. Consider breaking it into smaller forms for better performance.",
                    "MigrationAnalysis"));
        }
        if (hasNestedRepeating(form)) {
            messages.add(new AnalysisMessage(MessageSeverity.WARNING, "Nested repeating sections detected",
                    "Nested repeating sections increase complexity and may need special handling in the target platform",
                    "MigrationAnalysis"));
        }
        if (form.data.isEmpty()) {
            messages.add(new AnalysisMessage(MessageSeverity.WARNING, "No data columns detected",
                    "This form may be display-only or the data structure could not be determined",
                    "MigrationAnalysis"));
        }
        return messages;
    }

    private void addRepeatingSummary(FormAnalysis form, List<AnalysisMessage> messages) {
        int sections = 0;
        int tables = 0;
        for (ViewModel view : form.views) {
            for (SectionScope section : view.sections) {
                if (section.kind == SectionKind.REPEATING) sections++;
            }
            for (Control control : view.controls) {
                if (control.kind == ControlKind.REPEATING_TABLE) tables++;
            }
        }
        if (sections + tables == 0) return;
        messages.add(new AnalysisMessage(MessageSeverity.INFO,
                "Form contains " + (sections + tables) + " repeating structure(s)",
                "Sections: " + sections + ", Tables: " + tables + ". These will be created as separate related tables in SQL.",
                "Structure"));
    }

    private void addDataSummary(FormAnalysis form, List<AnalysisMessage> messages) {
        if (form.data.isEmpty()) return;
        long repeating = form.data.stream().filter(c -> c.repeating).count();
        long dropdowns = form.data.stream().filter(DataColumn::hasConstraints).count();
        messages.add(new AnalysisMessage(MessageSeverity.INFO, "Data structure: " + form.data.size() + " columns",
                "Standard: " + (form.data.size() - repeating) + ", Repeating: " + repeating + ", Dropdowns: " + dropdowns,
                "Data"));
    }

    private void addComplexControls(FormAnalysis form, List<AnalysisMessage> messages) {
        Map<ControlKind, List<String>> found = new LinkedHashMap<>();
        for (ViewModel view : form.views) {
            for (Control control : view.controls) {
                if (!COMPLEX_CONTROLS.containsKey(control.kind)) continue;
                String identifier = control.label != null && !control.label.isEmpty() ? control.label : control.name;
                List<String> names = found.computeIfAbsent(control.kind, k -> new ArrayList<>());
                if (identifier != null && !identifier.isEmpty()) {
                    names.add(identifier);
                }
            }
        }
        for (Map.Entry<ControlKind, List<String>> entry : found.entrySet()) {
            List<String> names = entry.getValue();
            List<String> listed = names.subList(0, Math.min(MAX_LISTED_CONTROLS, names.size()));
            messages.add(new AnalysisMessage(MessageSeverity.WARNING,
                    "Complex control type detected: " + entry.getKey().getDisplayName(),
                    "Controls: " + String.join(", ", listed) + ". " + COMPLEX_CONTROLS.get(entry.getKey()),
                    "ControlAnalysis"));
        }
    }

    private static boolean hasNestedRepeating(FormAnalysis form) {
        for (ViewModel view : form.views) {
            for (Control control : view.controls) {
                String parents = control.properties.get("ParentRepeatingSections");
                if (parents != null && !parents.isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }
}
