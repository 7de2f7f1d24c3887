package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Links each unbound label to the data control it most likely describes: first the
 * nearest control to its right on the same row, then the first control of the next
 * row, then simply the next captured control.
 */
public class LabelAssociationPass {

    public void apply(List<Control> controls) {
        List<Control> targets = new ArrayList<>();
        for (Control control : controls) {
            if (control.kind != ControlKind.LABEL && control.kind != ControlKind.SECTION) {
                targets.add(control);
            }
        }

        for (Control label : controls) {
            if (label.kind != ControlKind.LABEL || (label.binding != null && !label.binding.isEmpty())) continue;

            Control target = findTarget(label, targets);
            if (target == null) continue;

            label.associatedControlId = target.name;
            target.associatedLabelId = label.name;
            if (target.label == null || target.label.isEmpty()) {
                target.label = label.label;
            }
        }
    }

    private Control findTarget(Control label, List<Control> targets) {
        if (label.gridPosition == null) return null;
        int row = label.gridPosition.getRow();
        int column = label.gridPosition.getColumn();

        Control sameRow = targets.stream()
                .filter(c -> c.gridPosition != null && c.gridPosition.getRow() == row && c.gridPosition.getColumn() > column)
                .min(Comparator.comparingInt(c -> c.gridPosition.getColumn()))
                .orElse(null);
        if (sameRow != null) return sameRow;

        Control nextRow = targets.stream()
                .filter(c -> c.gridPosition != null && c.gridPosition.getRow() == row + 1)
                .min(Comparator.comparingInt(c -> c.gridPosition.getColumn()))
                .orElse(null);
        if (nextRow != null) return nextRow;

        return targets.stream()
                .filter(c -> c.docIndex > label.docIndex)
                .min(Comparator.comparingInt(c -> c.docIndex))
                .orElse(null);
    }
}
