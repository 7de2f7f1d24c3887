package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;
import org.dxworks.formframe.model.infopath.DynamicSection;
import org.dxworks.formframe.model.infopath.FormMetadata;
import org.dxworks.formframe.model.infopath.SectionKind;
import org.dxworks.formframe.model.infopath.SectionScope;
import org.dxworks.formframe.model.infopath.ViewModel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class FormMetadataBuilder {

    public FormMetadata build(List<ViewModel> views, List<DynamicSection> dynamicSections,
                              Map<String, List<String>> visibility) {
        FormMetadata metadata = new FormMetadata();
        metadata.viewCount = views.size();
        metadata.dynamicSectionCount = dynamicSections.size();
        metadata.conditionalFields = new ArrayList<>(visibility.keySet());

        Set<String> sectionNames = new HashSet<>();
        int repeating = 0;
        for (ViewModel view : views) {
            for (SectionScope section : view.sections) {
                sectionNames.add(section.name);
                if (section.kind == SectionKind.REPEATING) repeating++;
            }
            for (Control control : view.controls) {
                if (control.kind == ControlKind.REPEATING_TABLE || control.kind == ControlKind.REPEATING_SECTION) {
                    repeating++;
                }
                if (control.mergedIntoParent) continue;
                metadata.totalControls++;
                metadata.controlTypes.merge(control.type, 1, Integer::sum);
            }
        }
        metadata.totalSections = sectionNames.size();
        metadata.repeatingSectionCount = repeating;
        return metadata;
    }
}
