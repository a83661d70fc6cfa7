package org.kube.core.algebra;

/**
 * The six outer faces of the cube, each identified by its notation letter.
 */
public enum Face {
    FRONT('F'),
    RIGHT('R'),
    UP('U'),
    BACK('B'),
    LEFT('L'),
    DOWN('D');

    private final char letter;

    Face(char letter) {
        this.letter = letter;
    }

    /**
     * Returns the upper-case notation letter of this face.
     */
    public char letter() {
        return letter;
    }
}
