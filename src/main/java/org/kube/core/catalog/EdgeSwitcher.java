package org.kube.core.catalog;

import org.kube.core.algebra.Move;

import java.util.Objects;

/**
 * An edge 3-cycle together with the zone of slots it cycles.
 *
 * <p>The switcher sends the cubie in {@code second} to {@code first}; a connector that
 * brings the cubie to fix into {@code second} and the slot to fill into {@code first}
 * therefore repairs that slot once conjugated.</p>
 *
 * @param move the 3-cycle.
 * @param first zone slot receiving the cubie from {@code second}.
 * @param second zone slot whose cubie moves to {@code first}.
 * @param third remaining zone slot.
 */
public record EdgeSwitcher(Move move, int first, int second, int third) {
    public EdgeSwitcher {
        Objects.requireNonNull(move, "move");
    }
}
