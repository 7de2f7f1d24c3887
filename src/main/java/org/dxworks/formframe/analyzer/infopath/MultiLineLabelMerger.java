package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;

import java.util.List;
import java.util.Objects;

/**
 * Joins consecutive label fragments of one wrapped caption. The continuation stays in
 * the list, flagged {@code mergedIntoParent}, so doc indexes keep their meaning.
 */
public class MultiLineLabelMerger {

    public void apply(List<Control> controls) {
        for (int i = 0; i < controls.size() - 1; i++) {
            Control current = controls.get(i);
            Control next = controls.get(i + 1);
            if (current.kind != ControlKind.LABEL || next.kind != ControlKind.LABEL) continue;
            if (!areRelated(current, next)) continue;

            // a third fragment joins the label that absorbed the second
            int rootIndex = i;
            while (rootIndex > 0 && controls.get(rootIndex).mergedIntoParent) {
                rootIndex--;
            }
            Control root = controls.get(rootIndex);
            root.label = join(root.label, next.label);
            root.multiLineLabel = true;
            next.mergedIntoParent = true;
        }
    }

    static boolean areRelated(Control first, Control second) {
        if (first.gridPosition != null && Objects.equals(first.gridPosition, second.gridPosition)) {
            return true;
        }
        if (second.docIndex - first.docIndex == 1 && first.gridPosition != null && second.gridPosition != null) {
            return Math.abs(first.gridPosition.getRow() - second.gridPosition.getRow()) <= 1;
        }
        return false;
    }

    private static String join(String first, String second) {
        if (first == null || first.isEmpty()) return second;
        if (second == null || second.isEmpty()) return first;
        return first + " " + second;
    }
}
