package org.dxworks.formframe.model.infopath;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Spreadsheet-like cell coordinate of a captured control: a 1-based row and a
 * 1-based column rendered as letters ({@code 3B}, {@code 12AA}).
 */
public final class GridPosition {
    private final int row;
    private final int column;

    public GridPosition(int row, int column) {
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String getColumnLetters() {
        return columnLetters(column);
    }

    public static String columnLetters(int columnNumber) {
        StringBuilder name = new StringBuilder();
        int n = columnNumber;
        while (n > 0) {
            n--;
            name.insert(0, (char) ('A' + n % 26));
            n /= 26;
        }
        return name.toString();
    }

    @JsonValue
    @Override
    public String toString() {
        return row + getColumnLetters();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridPosition)) return false;
        GridPosition that = (GridPosition) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }
}
