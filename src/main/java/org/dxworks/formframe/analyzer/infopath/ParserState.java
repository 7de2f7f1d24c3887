package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.analyzer.DomHelper;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.GridPosition;
import org.dxworks.formframe.model.infopath.SectionScope;
import org.dxworks.formframe.model.infopath.ViewModel;
import org.w3c.dom.Element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one view parse. Created per call, never shared between views.
 */
final class ParserState {

    final String viewName;

    private final int lookbackCapacity;
    private final Deque<LabelCandidate> lookback = new ArrayDeque<>();

    private final List<Control> controls = new ArrayList<>();
    private final List<SectionScope> sections = new ArrayList<>();
    private final Map<String, List<Control>> controlsByCtrlId = new HashMap<>();
    private final NameUniquifier controlNames = new NameUniquifier();
    private final NameUniquifier scopeNames = new NameUniquifier();
    private final Map<String, Integer> typeOrdinals = new HashMap<>();

    private final Map<String, Element> templatesByMode = new LinkedHashMap<>();
    private final Set<String> referencedModes = new HashSet<>();
    final Set<TemplateExpansionKey> expandingTemplates = new HashSet<>();
    final Set<String> expandingSelects = new HashSet<>();
    final Set<String> handledConditionals = new HashSet<>();

    private int docIndex;
    private int currentRow = 1;
    private int currentColumn = 1;
    boolean inTableRow;

    private int repeatingSectionCounter;
    private int repeatingTableCounter;

    ParserState(String viewName, int lookbackCapacity) {
        this.viewName = viewName;
        this.lookbackCapacity = Math.max(1, lookbackCapacity);
    }

    /**
     * Indexes every moded template and every mode referenced by an apply-templates,
     * in document order. The first template wins when a mode is declared twice.
     */
    void indexTemplates(Element root) {
        List<Element> all = new ArrayList<>();
        all.add(root);
        all.addAll(DomHelper.descendants(root));
        for (Element element : all) {
            String mode = DomHelper.attr(element, "mode");
            if (mode.isEmpty()) continue;
            if (DomHelper.isXsl(element, "template")) {
                templatesByMode.putIfAbsent(mode, element);
            } else if (DomHelper.isXsl(element, "apply-templates")) {
                referencedModes.add(mode);
            }
        }
    }

    Element template(String mode) {
        return templatesByMode.get(mode);
    }

    boolean isReferencedMode(String mode) {
        return referencedModes.contains(mode);
    }

    // --- grid ---

    int currentRow() {
        return currentRow;
    }

    int currentColumn() {
        return currentColumn;
    }

    void advanceRow() {
        if (currentColumn > 1) {
            currentRow++;
        }
        currentColumn = 1;
    }

    int nextDocIndex() {
        return ++docIndex;
    }

    int lastDocIndex() {
        return docIndex;
    }

    /**
     * Stamps the control with the next doc index and the current cell, then moves to the next column.
     */
    void place(Control control) {
        control.docIndex = nextDocIndex();
        control.gridPosition = new GridPosition(currentRow, currentColumn);
        currentColumn++;
    }

    // --- lookback ---

    void rememberCaption(String text) {
        if (lookback.size() == lookbackCapacity) {
            lookback.removeFirst();
        }
        lookback.addLast(new LabelCandidate(text, docIndex, currentRow, currentColumn));
    }

    /**
     * Newest unused caption within two rows of the current one, marked used. Null when none fits.
     */
    String takeCaption(Set<String> excluded) {
        Iterator<LabelCandidate> it = lookback.descendingIterator();
        while (it.hasNext()) {
            LabelCandidate candidate = it.next();
            if (candidate.used || Math.abs(candidate.row - currentRow) > 2) continue;
            if (isExcludedCaption(candidate.text, excluded)) continue;
            candidate.used = true;
            return candidate.text;
        }
        return null;
    }

    private static boolean isExcludedCaption(String text, Set<String> excluded) {
        for (String word : excluded) {
            if (text.equalsIgnoreCase(word) || text.startsWith(word + " ")) {
                return true;
            }
        }
        return false;
    }

    // --- names ---

    String claimScopeName(String base) {
        return scopeNames.claim(base);
    }

    boolean isScopeNameUsed(String name) {
        return scopeNames.isUsed(name);
    }

    void reserveScopeName(String name) {
        scopeNames.reserve(name);
    }

    String claimControlName(String base) {
        return controlNames.claim(base);
    }

    void releaseControlName(String name) {
        controlNames.release(name);
    }

    int nextTypeOrdinal(String type) {
        return typeOrdinals.merge(type, 1, Integer::sum);
    }

    int nextRepeatingSectionNumber() {
        return ++repeatingSectionCounter;
    }

    int nextRepeatingTableNumber() {
        return ++repeatingTableCounter;
    }

    // --- output ---

    /**
     * Every captured control still in the output with the given id, in capture order.
     */
    List<Control> findByCtrlId(String ctrlId) {
        List<Control> found = controlsByCtrlId.get(ctrlId);
        return found == null ? List.of() : new ArrayList<>(found);
    }

    void addControl(Control control) {
        controls.add(control);
        String ctrlId = control.getCtrlId();
        if (ctrlId != null && !ctrlId.isEmpty()) {
            controlsByCtrlId.computeIfAbsent(ctrlId, k -> new ArrayList<>()).add(control);
        }
    }

    void removeControl(Control control) {
        controls.remove(control);
        releaseControlName(control.name);
        String ctrlId = control.getCtrlId();
        List<Control> occurrences = ctrlId == null ? null : controlsByCtrlId.get(ctrlId);
        if (occurrences != null) {
            occurrences.remove(control);
        }
    }

    List<Control> controls() {
        return controls;
    }

    void addSection(SectionScope section) {
        sections.add(section);
    }

    /**
     * Fills in the end row and the ids of controls captured after {@code startDocIndex}.
     */
    void closeSection(SectionScope section, int startDocIndex) {
        section.endRow = currentRow;
        for (Control control : controls) {
            String ctrlId = control.getCtrlId();
            if (control.docIndex > startDocIndex && ctrlId != null && !section.controlIds.contains(ctrlId)) {
                section.controlIds.add(ctrlId);
            }
        }
    }

    ViewModel toViewModel() {
        ViewModel view = new ViewModel();
        view.viewName = viewName;
        view.controls = new ArrayList<>(controls);
        view.sections = new ArrayList<>(sections);
        return view;
    }
}
