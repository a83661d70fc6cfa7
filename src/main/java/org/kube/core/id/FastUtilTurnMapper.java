package org.kube.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.kube.core.algebra.Turn;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TurnMapper backed by a fastutil open hash map.
 * * Forward lookup avoids boxing, reverse lookup is a plain array read.
 * * Immutable and safe for concurrent reads.
 */
public class FastUtilTurnMapper implements TurnMapper {

    static final FastUtilTurnMapper STANDARD = new FastUtilTurnMapper(Turn.values());

    private final Object2IntOpenHashMap<String> forward;
    private final Turn[] reverse;

    /**
     * Builds the mapper from the turns it should recognize.
     * Every turn must appear at its own ordinal so internal ids stay dense.
     */
    public FastUtilTurnMapper(Turn[] turns) {
        if (turns == null) {
            throw new IllegalArgumentException("Turns cannot be null");
        }
        this.forward = new Object2IntOpenHashMap<>(turns.length);
        this.forward.defaultReturnValue(-1);
        this.reverse = new Turn[turns.length];

        for (int i = 0; i < turns.length; i++) {
            Turn turn = turns[i];
            if (turn == null || turn.ordinal() != i) {
                throw new IllegalArgumentException(
                        "Turns must be dense and in ordinal order. Found " + turn + " at index " + i
                );
            }
            forward.put(turn.symbol(), i);
            reverse[i] = turn;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String symbol) throws UnknownTokenException {
        int id = forward.getInt(symbol);
        if (id == -1) {
            throw new UnknownTokenException("Unknown turn symbol: " + symbol);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        return turnAt(internalId).symbol();
    }

    @Override
    public Turn toTurn(String symbol) throws UnknownTokenException {
        return reverse[toInternal(symbol)];
    }

    @Override
    public List<Turn> toTurns(List<String> symbols) throws UnknownTokenException {
        Objects.requireNonNull(symbols, "symbols");
        List<Turn> turns = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            turns.add(toTurn(symbol));
        }
        return turns;
    }

    @Override
    public List<String> toSymbols(List<Turn> turns) {
        Objects.requireNonNull(turns, "turns");
        List<String> symbols = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            symbols.add(toExternal(turn.ordinal()));
        }
        return symbols;
    }

    @Override
    public List<Turn> parse(String text) throws UnknownTokenException {
        Objects.requireNonNull(text, "text");
        List<Turn> turns = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                continue;
            }
            turns.add(toTurn(String.valueOf(c)));
        }
        return turns;
    }

    @Override
    public boolean containsExternal(String symbol) {
        return forward.containsKey(symbol);
    }

    @Override
    public int size() {
        return reverse.length;
    }

    private Turn turnAt(int internalId) {
        try {
            return reverse[internalId];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Internal turn id out of bounds: " + internalId);
        }
    }
}
