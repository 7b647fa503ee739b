package com.tyron.syntaxkit.api.mutation;

/**
 * Picks one token among those starting on a line.
 *
 * @param strategy how to choose
 * @param column   1-based target column, only meaningful for {@link Strategy#AT_COLUMN}
 */
public record LineNodeSelection(Strategy strategy, int column) {

    public static final LineNodeSelection FIRST = new LineNodeSelection(Strategy.FIRST, 0);
    public static final LineNodeSelection LAST = new LineNodeSelection(Strategy.LAST, 0);
    public static final LineNodeSelection LARGEST = new LineNodeSelection(Strategy.LARGEST, 0);
    public static final LineNodeSelection SMALLEST = new LineNodeSelection(Strategy.SMALLEST, 0);

    public enum Strategy {
        FIRST,
        LAST,
        LARGEST,
        SMALLEST,
        /**
         * The token whose column is closest to {@link LineNodeSelection#column()}.
         */
        AT_COLUMN
    }

    public LineNodeSelection {
        if (strategy == null) throw new IllegalArgumentException("strategy == null");
        if (strategy == Strategy.AT_COLUMN && column < 1) {
            throw new IllegalArgumentException("column < 1: " + column);
        }
    }

    public static LineNodeSelection atColumn(int column) {
        return new LineNodeSelection(Strategy.AT_COLUMN, column);
    }
}
