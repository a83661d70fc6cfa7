package org.kube.core.algebra;

/**
 * One of the twelve quarter turns, the finest-grained input and output unit of the solver.
 *
 * <p>Notation symbols follow the usual convention: the upper-case face letter is the
 * clockwise turn and the lower-case letter is the counter-clockwise turn.</p>
 */
public enum Turn {
    F(Face.FRONT, Direction.CLOCKWISE),
    F_PRIME(Face.FRONT, Direction.COUNTER_CLOCKWISE),
    R(Face.RIGHT, Direction.CLOCKWISE),
    R_PRIME(Face.RIGHT, Direction.COUNTER_CLOCKWISE),
    U(Face.UP, Direction.CLOCKWISE),
    U_PRIME(Face.UP, Direction.COUNTER_CLOCKWISE),
    B(Face.BACK, Direction.CLOCKWISE),
    B_PRIME(Face.BACK, Direction.COUNTER_CLOCKWISE),
    L(Face.LEFT, Direction.CLOCKWISE),
    L_PRIME(Face.LEFT, Direction.COUNTER_CLOCKWISE),
    D(Face.DOWN, Direction.CLOCKWISE),
    D_PRIME(Face.DOWN, Direction.COUNTER_CLOCKWISE);

    private static final Turn[] VALUES = values();

    private final Face face;
    private final Direction direction;
    private final String symbol;

    Turn(Face face, Direction direction) {
        this.face = face;
        this.direction = direction;
        char letter = face.letter();
        this.symbol = String.valueOf(direction == Direction.CLOCKWISE ? letter : Character.toLowerCase(letter));
    }

    public Face face() {
        return face;
    }

    public Direction direction() {
        return direction;
    }

    /**
     * Returns the one-letter notation symbol ({@code "F"}, {@code "f"}, ...).
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Returns the turn of the same face in the opposite direction.
     */
    public Turn inverse() {
        return of(face, direction.inverse());
    }

    /**
     * Returns whether this turn undoes {@code other} when applied right after it.
     */
    public boolean cancels(Turn other) {
        return other != null && other.face == face && other.direction == direction.inverse();
    }

    /**
     * Returns whether both turns rotate the same face, in either direction.
     */
    public boolean sameFace(Turn other) {
        return other != null && other.face == face;
    }

    /**
     * Resolves the turn for a face and direction.
     */
    public static Turn of(Face face, Direction direction) {
        int base = face.ordinal() * 2;
        return VALUES[direction == Direction.CLOCKWISE ? base : base + 1];
    }
}
