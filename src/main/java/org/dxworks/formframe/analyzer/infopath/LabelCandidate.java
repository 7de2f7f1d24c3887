package org.dxworks.formframe.analyzer.infopath;

/**
 * Caption text seen near the current grid position, kept to name the next
 * repeating section or table.
 */
final class LabelCandidate {
    final String text;
    final int docIndex;
    final int row;
    final int column;
    boolean used;

    LabelCandidate(String text, int docIndex, int row, int column) {
        this.text = text;
        this.docIndex = docIndex;
        this.row = row;
        this.column = column;
    }
}
