package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.DynamicSection;
import org.dxworks.formframe.model.infopath.ViewModel;

import java.util.List;

/**
 * Everything produced from one view document.
 */
final class ViewAnalysis {
    final ViewModel view;
    final List<DynamicSection> dynamicSections;

    ViewAnalysis(ViewModel view, List<DynamicSection> dynamicSections) {
        this.view = view;
        this.dynamicSections = dynamicSections;
    }
}
