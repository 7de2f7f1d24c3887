package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.ChoiceOption;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;
import org.dxworks.formframe.model.infopath.DataColumn;
import org.dxworks.formframe.model.infopath.ViewModel;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns the controls of all views into the logical data columns of the form.
 *
 * <p>A column is identified by its name (the binding leaf) and the grouping that owns
 * it: the repeating scope for repeated controls, otherwise the enclosing section. The
 * same field rendered in several views collapses into one column; the same field name
 * under two different repeating scopes stays two columns.</p>
 */
public class DataColumnConsolidator {

    private static final Set<ControlKind> NON_DATA_KINDS = EnumSet.of(
            ControlKind.LABEL, ControlKind.BUTTON, ControlKind.SECTION, ControlKind.REPEATING_SECTION,
            ControlKind.OPTIONAL_SECTION, ControlKind.REPEATING_TABLE, ControlKind.EXPRESSION_BOX);

    public List<DataColumn> consolidate(List<ViewModel> views, Map<String, List<String>> visibility) {
        Map<ColumnKey, DataColumn> columns = new LinkedHashMap<>();
        for (ViewModel view : views) {
            for (Control control : view.controls) {
                DataColumn column = toColumn(control, visibility);
                if (column == null) continue;

                ColumnKey key = new ColumnKey(column.columnName, column.owningSection);
                DataColumn existing = columns.get(key);
                if (existing == null) {
                    columns.put(key, column);
                } else {
                    merge(existing, column);
                }
            }
        }
        return new ArrayList<>(columns.values());
    }

    /**
     * Column described by a single control, or null for controls that hold no data.
     */
    DataColumn toColumn(Control control, Map<String, List<String>> visibility) {
        if (control.mergedIntoParent || NON_DATA_KINDS.contains(control.kind)) return null;

        String columnName = BindingPaths.leaf(control.binding);
        if (columnName.isEmpty()) columnName = control.name;
        if (columnName == null || columnName.isEmpty()) return null;

        DataColumn column = new DataColumn();
        column.columnName = columnName;
        column.type = control.type;
        column.repeating = control.inRepeatingSection;
        column.owningSection = control.inRepeatingSection ? control.repeatingSectionName : control.parentSection;
        column.repeatingSectionPath = control.inRepeatingSection ? control.repeatingSectionBinding : null;
        column.displayName = control.label;

        if (control.hasChoiceOptions()) {
            column.validValues = new ArrayList<>();
            for (ChoiceOption option : control.choiceOptions) {
                column.validValues.add(option.copy());
            }
            column.defaultValue = control.choiceOptions.stream()
                    .filter(o -> o.isDefault)
                    .map(o -> o.value)
                    .findFirst()
                    .orElse(null);
        }
        if (isEmpty(column.defaultValue)) {
            column.defaultValue = control.properties.get("DefaultValue");
        }

        String ctrlId = control.getCtrlId();
        if (ctrlId != null && visibility != null) {
            for (Map.Entry<String, List<String>> entry : visibility.entrySet()) {
                if (entry.getValue() != null && entry.getValue().contains(ctrlId)) {
                    column.conditional = true;
                    column.conditionalOnField = entry.getKey();
                    break;
                }
            }
        }
        return column;
    }

    /**
     * Fills the empty fields of {@code target} from {@code source} and adds the options
     * whose value {@code target} does not have yet.
     */
    static void merge(DataColumn target, DataColumn source) {
        if (isEmpty(target.type)) target.type = source.type;
        if (isEmpty(target.displayName)) target.displayName = source.displayName;
        if (isEmpty(target.defaultValue)) target.defaultValue = source.defaultValue;
        if (isEmpty(target.repeatingSectionPath)) target.repeatingSectionPath = source.repeatingSectionPath;
        if (isEmpty(target.conditionalOnField)) target.conditionalOnField = source.conditionalOnField;
        target.conditional = target.conditional || source.conditional;
        target.repeating = target.repeating || source.repeating;

        if (source.validValues == null || source.validValues.isEmpty()) return;
        if (target.validValues == null) {
            target.validValues = new ArrayList<>();
        }
        for (ChoiceOption option : source.validValues) {
            boolean present = target.validValues.stream().anyMatch(o -> Objects.equals(o.value, option.value));
            if (!present) {
                ChoiceOption copy = option.copy();
                copy.order = target.validValues.size();
                target.validValues.add(copy);
            }
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static final class ColumnKey {
        private final String columnName;
        private final String owner;

        ColumnKey(String columnName, String owner) {
            this.columnName = columnName;
            this.owner = owner;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ColumnKey)) return false;
            ColumnKey that = (ColumnKey) o;
            return columnName.equals(that.columnName) && Objects.equals(owner, that.owner);
        }

        @Override
        public int hashCode() {
            return Objects.hash(columnName, owner);
        }
    }
}
