package org.kube.core.id;

import lombok.experimental.StandardException;
import org.kube.core.algebra.Turn;

import java.util.List;

/**
 * Bidirectional mapping between external turn symbols and turns.
 *
 * <p>This is the seam a presentation layer uses to turn keypresses into solver input and
 * solver output back into animatable symbols.</p>
 */
public interface TurnMapper {

    /**
     * Converts an external symbol to the internal turn index ({@link Turn#ordinal()}).
     * @param symbol the client-facing symbol, for example {@code "F"} or {@code "f"}.
     * @return the internal turn index.
     * @throws UnknownTokenException If the symbol is not one of the recognized quarter turns.
     */
    int toInternal(String symbol) throws UnknownTokenException;

    /**
     * Converts an internal turn index back to its external symbol.
     * @param internalId the internal turn index.
     * @return the client-facing symbol.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String toExternal(int internalId);

    /**
     * Resolves a symbol directly to its turn.
     *
     * @param symbol external symbol.
     * @return mapped turn.
     * @throws UnknownTokenException If the symbol is not recognized.
     */
    Turn toTurn(String symbol) throws UnknownTokenException;

    /**
     * Resolves an ordered symbol list, failing on the first unknown symbol.
     *
     * @param symbols external symbols in application order.
     * @return turns in the same order.
     * @throws UnknownTokenException If any symbol is not recognized.
     */
    List<Turn> toTurns(List<String> symbols) throws UnknownTokenException;

    /**
     * Maps turns back to external symbols.
     *
     * @param turns turns in application order.
     * @return symbols in the same order.
     */
    List<String> toSymbols(List<Turn> turns);

    /**
     * Parses free-form scramble text. Whitespace and commas separate nothing more than
     * readability, since every symbol is one character: {@code "F R u"}, {@code "F,R,u"}
     * and {@code "FRu"} are the same scramble.
     *
     * @param text scramble text.
     * @return turns in written order.
     * @throws UnknownTokenException If any character is not a recognized symbol.
     */
    List<Turn> parse(String text) throws UnknownTokenException;

    /**
     * Checks whether a symbol is recognized.
     *
     * @param symbol symbol to test.
     * @return true when the symbol maps to a turn.
     */
    boolean containsExternal(String symbol);

    /**
     * Returns number of recognized symbols.
     *
     * @return mapping size.
     */
    int size();

    /**
     * Exception thrown when a symbol is not one of the recognized quarter turns.
     */
    @StandardException
    class UnknownTokenException extends RuntimeException {
    }

    /**
     * Returns the process-wide mapper for the twelve standard symbols.
     *
     * @return immutable shared mapper.
     */
    static TurnMapper standard() {
        return FastUtilTurnMapper.STANDARD;
    }
}
