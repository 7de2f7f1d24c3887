package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.analyzer.DomHelper;
import org.dxworks.formframe.model.infopath.DynamicSection;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the conditionally visible fragments of a view: for every mode applied in the
 * document, the first {@code xsl:if} of the template declaring that mode.
 * Runs on the raw document, independent of the structural walk.
 */
public class DynamicSectionExtractor {

    public List<DynamicSection> extract(Document document) {
        List<DynamicSection> result = new ArrayList<>();
        Element root = document.getDocumentElement();
        if (root == null) return result;

        List<Element> all = new ArrayList<>();
        all.add(root);
        all.addAll(DomHelper.descendants(root));

        Map<String, Element> templates = new LinkedHashMap<>();
        for (Element element : all) {
            if (DomHelper.isXsl(element, "template") && DomHelper.hasAttr(element, "mode")) {
                templates.putIfAbsent(DomHelper.attr(element, "mode"), element);
            }
        }

        Set<String> seenModes = new LinkedHashSet<>();
        for (Element element : all) {
            if (!DomHelper.isXsl(element, "apply-templates") || !DomHelper.hasAttr(element, "mode")) continue;
            String mode = DomHelper.attr(element, "mode");
            if (!seenModes.add(mode)) continue;

            Element template = templates.get(mode);
            if (template == null) continue;
            DynamicSection section = parse(template, mode);
            if (section != null) {
                result.add(section);
            }
        }
        return result;
    }

    private DynamicSection parse(Element template, String mode) {
        Element fragment = DomHelper.firstDescendant(template, d -> DomHelper.isXsl(d, "if"));
        if (fragment == null) return null;

        String condition = DomHelper.attr(fragment, "test");
        Element owner = DomHelper.firstDescendant(fragment, d -> !DomHelper.attr(d, "CtrlId").isEmpty());
        String ctrlId = owner == null ? null : DomHelper.attr(owner, "CtrlId");
        String caption = null;
        if (owner != null) {
            String value = DomHelper.firstNonEmptyAttr(owner, "caption_0", "caption");
            caption = value.isEmpty() ? null : value;
        }

        Set<String> members = new LinkedHashSet<>();
        for (Element d : DomHelper.descendants(fragment)) {
            String id = DomHelper.attr(d, "CtrlId");
            if (!id.isEmpty() && !id.equals(ctrlId)) {
                members.add(id);
            }
        }

        return new DynamicSection(mode, ctrlId, caption, condition,
                ConditionExpressions.conditionField(condition),
                ConditionExpressions.conditionValue(condition),
                new ArrayList<>(members));
    }

    /**
     * Adds the members of every section to the entry of its condition field, keeping
     * first-seen order and no duplicates. Sections without a field are ignored.
     */
    public static void foldVisibility(List<DynamicSection> sections, Map<String, List<String>> visibility) {
        for (DynamicSection section : sections) {
            if (section.conditionField == null || section.conditionField.isEmpty()) continue;
            List<String> ids = visibility.computeIfAbsent(section.conditionField, k -> new ArrayList<>());
            for (String id : section.controls) {
                if (!ids.contains(id)) {
                    ids.add(id);
                }
            }
        }
    }
}
