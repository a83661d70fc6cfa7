package org.kube.solving.search;

/**
 * How a candidate's placement is checked against a {@link ConnectorQuery}.
 */
public enum MatchMode {
    /** Two labels onto two slots, in either assignment order. */
    PERMISSIVE_PAIR,
    /** Two labels onto two slots, in the given order. */
    STRICT_PAIR,
    /**
     * Two labels onto two slots in order, and the third label anywhere after the first slot.
     */
    ZONE_TRIPLE
}
