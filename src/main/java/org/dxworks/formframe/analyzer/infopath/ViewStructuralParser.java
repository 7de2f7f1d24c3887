package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.analyzer.DomHelper;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;
import org.dxworks.formframe.model.infopath.ControlOrigin;
import org.dxworks.formframe.model.infopath.RepeatingKind;
import org.dxworks.formframe.model.infopath.RepeatingScope;
import org.dxworks.formframe.model.infopath.SectionKind;
import org.dxworks.formframe.model.infopath.SectionScope;
import org.dxworks.formframe.model.infopath.ViewModel;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Walks one InfoPath view document and reconstructs its controls and sections.
 *
 * <p>Every element is classified once ({@link ElementClassifier}) and dispatched on its
 * {@link ElementKind}. Section and repeating scopes travel down the recursion in an
 * immutable {@link WalkContext}; counters, the grid cursor and the name registries live
 * in a {@link ParserState} created for each call, so one parser instance can serve
 * several views concurrently.</p>
 *
 * <p>Captured controls receive the next doc index and the current grid cell, and are
 * tagged with the innermost cosmetic/conditional section and, independently, the
 * innermost repeating scope.</p>
 */
public class ViewStructuralParser {

    public static final int DEFAULT_LABEL_LOOKBACK = 5;

    private static final Set<String> EXCLUDED_SCOPE_CAPTIONS = Set.of("Notes", "Comments", "Description", "Add", "Insert");

    private final int labelLookback;
    private final ElementClassifier classifier = new ElementClassifier();
    private final ControlExtractor extractor = new ControlExtractor();

    public ViewStructuralParser() {
        this(DEFAULT_LABEL_LOOKBACK);
    }

    public ViewStructuralParser(int labelLookback) {
        this.labelLookback = labelLookback;
    }

    public ViewModel parse(Document document, String viewName) {
        ParserState state = new ParserState(viewName, labelLookback);
        Element root = document.getDocumentElement();
        if (root == null) {
            return state.toViewModel();
        }
        state.indexTemplates(root);
        walk(root, WalkContext.root(), state);
        return state.toViewModel();
    }

    private void walk(Element element, WalkContext ctx, ParserState state) {
        dispatch(element, classifier.classify(element, ctx, state), ctx, state);
    }

    private void walkChildren(Element element, WalkContext ctx, ParserState state) {
        for (Element child : DomHelper.childElements(element)) {
            walk(child, ctx, state);
        }
    }

    private void dispatch(Element element, ElementKind kind, WalkContext ctx, ParserState state) {
        switch (kind) {
            case REPEATING_SECTION -> handleRepeatingSection(element, ctx, state);
            case MODED_TEMPLATE -> handleModedTemplate(element, ctx, state);
            case MODED_APPLY_TEMPLATES -> handleApplyTemplates(element, ctx, state);
            case CONDITIONAL_FRAGMENT -> handleConditionalFragment(element, ctx, state);
            case CAPTION -> handleCaption(element, state);
            case ROW_BREAK -> handleRowBreak(element, ctx, state);
            case PLACEHOLDER -> walkChildren(element, ctx, state);
            case SECTION -> handleSection(element, ctx, state);
            case REPEATING_TABLE -> handleRepeatingTable(element, ctx, state);
            case CONTROL_CANDIDATE -> handleControlCandidate(element, ctx, state);
        }
    }

    // --- layout ---

    private void handleCaption(Element element, ParserState state) {
        String text = ElementClassifier.captionText(element);
        if (text == null || text.startsWith("Add ") || text.startsWith("Insert ")) {
            return;
        }
        state.rememberCaption(text);
    }

    private void handleRowBreak(Element element, WalkContext ctx, ParserState state) {
        state.advanceRow();
        ElementKind layoutKind = classifier.classifyLayout(element);
        if (!DomHelper.isNamed(element, "tr")) {
            dispatch(element, layoutKind, ctx, state);
            return;
        }
        boolean previous = state.inTableRow;
        state.inTableRow = true;
        try {
            dispatch(element, layoutKind, ctx, state);
        } finally {
            state.inTableRow = previous;
        }
    }

    private void handleSection(Element element, WalkContext ctx, ParserState state) {
        if (ctx.inRepeating()) {
            // layout inside a repeated item, not a section of its own
            walkChildren(element, ctx, state);
            return;
        }
        String ctrlId = DomHelper.attr(element, "CtrlId");
        SectionScope section = new SectionScope();
        section.name = state.claimScopeName(firstNonEmpty(
                DomHelper.firstNonEmptyAttr(element, "caption_0", "caption"), ctrlId, "Section"));
        section.kind = SectionKind.COSMETIC;
        section.ctrlId = ctrlId;
        section.startRow = state.currentRow();
        section.optional = DomHelper.attr(element, "class").contains("xdOptional")
                || DomHelper.attr(element, "xctname").equalsIgnoreCase("OptionalSection");

        walkSection(section, DomHelper.childElements(element), ctx.withSection(section), state);
    }

    private void walkSection(SectionScope section, List<Element> children, WalkContext inner, ParserState state) {
        state.addSection(section);
        int start = state.lastDocIndex();
        for (Element child : children) {
            walk(child, inner, state);
        }
        state.closeSection(section, start);
    }

    // --- repetition ---

    private void handleRepeatingSection(Element element, WalkContext ctx, ParserState state) {
        state.advanceRow();

        Element apply = DomHelper.firstChild(element, c -> DomHelper.isXsl(c, "apply-templates"));
        String select = apply == null ? "" : DomHelper.attr(apply, "select");
        Element forEach = DomHelper.firstDescendant(element, d -> DomHelper.isXsl(d, "for-each"));
        boolean collection = BindingPaths.isCollectionPattern(select) || forEach != null;

        if (!collection && ctx.inRepeating()) {
            walkChildren(element, ctx, state);
            return;
        }

        String binding;
        if (BindingPaths.isCollectionPattern(select)) {
            binding = select;
        } else if (forEach != null) {
            binding = DomHelper.attr(forEach, "select");
        } else {
            binding = firstNonEmpty(DomHelper.attr(element, "binding"), select);
        }
        if (!binding.isEmpty() && ctx.hasRepeatingBinding(binding)) {
            // the same collection re-entered through a recursive template
            walkChildren(element, ctx, state);
            return;
        }

        String base = state.takeCaption(EXCLUDED_SCOPE_CAPTIONS);
        if (base == null) base = BindingPaths.collectionName(binding);
        if (base.isEmpty()) base = "Section_Repeating" + state.nextRepeatingSectionNumber();

        RepeatingScope scope = openRepeating(base, binding, RepeatingKind.SECTION, ctx, state);
        walkRepeating(scope, DomHelper.attr(element, "CtrlId"), DomHelper.childElements(element), ctx, state);
    }

    private void walkRepeating(RepeatingScope scope, String ctrlId, List<Element> children, WalkContext ctx, ParserState state) {
        SectionScope snapshot = new SectionScope();
        snapshot.name = scope.displayName;
        snapshot.kind = SectionKind.REPEATING;
        snapshot.ctrlId = ctrlId;
        snapshot.startRow = state.currentRow();

        WalkContext inner = ctx.withRepeating(scope);
        state.addSection(snapshot);
        int start = state.lastDocIndex();
        for (Element child : children) {
            walk(child, inner, state);
        }
        state.closeSection(snapshot, start);
    }

    /**
     * Creates a repeating scope below the current one. Nested scopes are named
     * {@code outer_local}; only the local part is suffixed when the composed name is taken.
     */
    private RepeatingScope openRepeating(String base, String binding, RepeatingKind kind, WalkContext ctx, ParserState state) {
        RepeatingScope outer = ctx.currentRepeating();
        String local;
        String display;
        if (outer == null) {
            display = state.claimScopeName(base);
            local = display;
        } else {
            local = base;
            int suffix = 2;
            while (state.isScopeNameUsed(outer.displayName + "_" + local)) {
                local = base + "_" + suffix++;
            }
            display = outer.displayName + "_" + local;
            state.reserveScopeName(display);
        }

        RepeatingScope scope = new RepeatingScope();
        scope.name = display;
        scope.localName = local;
        scope.binding = binding;
        scope.kind = kind;
        scope.displayName = display;
        scope.depth = ctx.repeating.depth() + 1;
        return scope;
    }

    private void handleRepeatingTable(Element table, WalkContext ctx, ParserState state) {
        String binding = tableBinding(table);

        String base = DomHelper.firstNonEmptyAttr(table, "caption", "title");
        if (base.isEmpty()) {
            String caption = state.takeCaption(EXCLUDED_SCOPE_CAPTIONS);
            base = caption != null ? caption : BindingPaths.collectionName(binding);
        }
        if (base.isEmpty()) base = "Table_Repeating" + state.nextRepeatingTableNumber();

        RepeatingScope scope = openRepeating(base, binding, RepeatingKind.TABLE, ctx, state);

        Control tableControl = new Control();
        tableControl.kind = ControlKind.REPEATING_TABLE;
        tableControl.type = ControlKind.REPEATING_TABLE.getDisplayName();
        tableControl.label = scope.displayName;
        tableControl.binding = binding;
        String ctrlId = DomHelper.attr(table, "CtrlId");
        if (!ctrlId.isEmpty()) {
            tableControl.properties.put("CtrlId", ctrlId);
        }
        tableControl.properties.put("TableType", "Repeating");
        tableControl.properties.put("DisplayName", scope.displayName);
        capture(tableControl, scope.displayName.replace(" ", ""), ctx, state);

        WalkContext inner = ctx.withRepeating(scope);
        for (Element child : DomHelper.childElements(table)) {
            if (DomHelper.isNamed(child, "thead")) {
                walk(child, ctx, state);
            } else if (DomHelper.isNamed(child, "tbody")) {
                walkChildren(child, inner, state);
            } else {
                walk(child, inner, state);
            }
        }
    }

    private static String tableBinding(Element table) {
        String own = DomHelper.attr(table, "binding");
        if (!own.isEmpty()) return own;
        Element source = DomHelper.firstDescendant(table, d ->
                (DomHelper.isXsl(d, "for-each") || DomHelper.isXsl(d, "apply-templates"))
                        && !DomHelper.attr(d, "select").isEmpty());
        return source == null ? "" : DomHelper.attr(source, "select");
    }

    // --- template indirection ---

    private void handleModedTemplate(Element template, WalkContext ctx, ParserState state) {
        String mode = DomHelper.attr(template, "mode");
        if (state.isReferencedMode(mode)) {
            // expanded where it is applied
            return;
        }
        expandTemplate(template, mode, ctx, state);
    }

    private void handleApplyTemplates(Element apply, WalkContext ctx, ParserState state) {
        String mode = DomHelper.attr(apply, "mode");
        String select = DomHelper.attr(apply, "select");
        Element template = state.template(mode);
        if (template == null) {
            System.err.println("[ViewStructuralParser] " + state.viewName + ": no template for mode '" + mode + "', skipped");
            return;
        }

        if (!BindingPaths.isCollectionPattern(select) || isConditionalSectionTemplate(template)) {
            expandTemplate(template, mode, ctx, state);
            return;
        }
        if (ctx.hasRepeatingBinding(select)) {
            expandTemplate(template, mode, ctx, state);
            return;
        }
        if (!state.expandingSelects.add(select)) {
            return;
        }
        try {
            String base = BindingPaths.collectionName(select);
            if (base.isEmpty()) base = "Section_Repeating" + state.nextRepeatingSectionNumber();
            RepeatingScope scope = openRepeating(base, select, RepeatingKind.SECTION, ctx, state);

            SectionScope snapshot = new SectionScope();
            snapshot.name = scope.displayName;
            snapshot.kind = SectionKind.REPEATING;
            snapshot.ctrlId = "";
            snapshot.startRow = state.currentRow();
            state.addSection(snapshot);
            int start = state.lastDocIndex();
            expandTemplate(template, mode, ctx.withRepeating(scope), state);
            state.closeSection(snapshot, start);
        } finally {
            state.expandingSelects.remove(select);
        }
    }

    private void expandTemplate(Element template, String mode, WalkContext ctx, ParserState state) {
        TemplateExpansionKey key = new TemplateExpansionKey(mode, ctx.repeatingBindings());
        if (!state.expandingTemplates.add(key)) {
            return;
        }
        try {
            walkChildren(template, ctx.inTemplate(mode), state);
        } finally {
            state.expandingTemplates.remove(key);
        }
    }

    private static boolean isConditionalSectionTemplate(Element template) {
        return DomHelper.anyDescendant(template, d -> DomHelper.isXsl(d, "if"))
                && DomHelper.anyDescendant(template, ElementClassifier::isSectionContainer);
    }

    private void handleConditionalFragment(Element fragment, WalkContext ctx, ParserState state) {
        String test = DomHelper.attr(fragment, "test");
        if (!ctx.inRepeating() && ConditionExpressions.referencesParentContext(test)) {
            // belongs to a repeated item that is not being walked here
            return;
        }

        Element container = DomHelper.firstDescendant(fragment, ElementClassifier::isSectionContainer);
        if (container == null) {
            walkChildren(fragment, ctx, state);
            return;
        }

        String ctrlId = DomHelper.attr(container, "CtrlId");
        String handledKey = (ctrlId.isEmpty() ? "#" + ctx.templateMode : ctrlId) + "|" + String.join("/", ctx.repeatingPath());
        if (!state.handledConditionals.add(handledKey)) {
            return;
        }

        SectionScope section = new SectionScope();
        section.name = state.claimScopeName(conditionalSectionName(container, test, ctrlId, ctx.templateMode));
        section.kind = SectionKind.CONDITIONAL;
        section.ctrlId = ctrlId;
        section.startRow = state.currentRow();
        section.nestedInRepeating = ctx.inRepeating();

        walkSection(section, DomHelper.childElements(container), ctx.withSection(section), state);
    }

    private static String conditionalSectionName(Element container, String test, String ctrlId, String mode) {
        String caption = DomHelper.firstNonEmptyAttr(container, "caption_0", "caption");
        if (!caption.isEmpty()) return caption;

        String field = ConditionExpressions.sectionField(test);
        if (field != null) {
            String readable = ConditionExpressions.toReadableFieldName(field);
            if (readable != null && !readable.isEmpty()) return readable;
        }
        if (!ctrlId.isEmpty()) return "Section_" + ctrlId;
        return "Section_" + mode;
    }

    // --- controls ---

    private void handleControlCandidate(Element element, WalkContext ctx, ParserState state) {
        Control control = extractor.extract(element);
        if (control == null) {
            walkChildren(element, ctx, state);
            return;
        }
        capture(control, null, ctx, state);
    }

    /**
     * Deduplicates by control id, then places, names and tags the control. An occurrence
     * is dropped when any earlier one with the same id has the same origin and binding; a
     * main-flow occurrence replaces the template copies of its id.
     */
    private void capture(Control control, String preferredName, WalkContext ctx, ParserState state) {
        control.origin = ctx.origin();

        String ctrlId = control.getCtrlId();
        if (ctrlId != null && !ctrlId.isEmpty()) {
            List<Control> existing = state.findByCtrlId(ctrlId);
            for (Control other : existing) {
                if (other.origin == control.origin
                        && Objects.equals(nullToEmpty(other.binding), nullToEmpty(control.binding))) {
                    return;
                }
            }
            if (control.origin == ControlOrigin.MAIN) {
                for (Control other : existing) {
                    if (other.origin == ControlOrigin.TEMPLATE) {
                        state.removeControl(other);
                    }
                }
            }
        }

        state.place(control);
        String base = preferredName != null && !preferredName.isEmpty() ? preferredName : baseName(control, state);
        control.name = state.claimControlName(base);
        tag(control, ctx);
        state.addControl(control);
    }

    private static String baseName(Control control, ParserState state) {
        String leaf = BindingPaths.leaf(control.binding);
        if (!leaf.isEmpty()) return leaf;

        String fromLabel = ControlExtractor.sanitizeName(control.label);
        if (!fromLabel.isEmpty()) return fromLabel;

        String ctrlId = control.getCtrlId();
        if (ctrlId != null && !ctrlId.isEmpty()) return ctrlId;

        String type = ControlExtractor.sanitizeName(control.type);
        if (type.isEmpty()) type = control.kind.getDisplayName();
        return type + "_" + state.nextTypeOrdinal(type);
    }

    private static void tag(Control control, WalkContext ctx) {
        RepeatingScope repeating = ctx.currentRepeating();
        if (repeating != null) {
            control.inRepeatingSection = true;
            control.repeatingSectionName = repeating.displayName;
            control.repeatingSectionBinding = repeating.binding;
            if (ctx.repeating.depth() > 1) {
                List<String> outer = new ArrayList<>();
                for (RepeatingScope scope : ctx.repeating.outermostFirst()) {
                    if (scope != repeating) outer.add(scope.displayName);
                }
                control.properties.put("ParentRepeatingSections", String.join("|", outer));
            }
        }

        SectionScope section = ctx.currentSection();
        if (section != null) {
            control.parentSection = section.name;
            control.sectionType = section.kind;
            if (section.kind == SectionKind.CONDITIONAL && section.nestedInRepeating) {
                control.properties.put("ConditionalSection", section.name);
                control.properties.put("ConditionalSectionId", nullToEmpty(section.ctrlId));
            } else if (section.kind == SectionKind.COSMETIC && section.ctrlId != null && !section.ctrlId.isEmpty()) {
                control.properties.put("SectionCtrlId", section.ctrlId);
            }
        }
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) return value;
        }
        return "";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
