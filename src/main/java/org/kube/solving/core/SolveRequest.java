package org.kube.solving.core;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Client-facing solve request.
 *
 * <p>Symbols are the twelve quarter-turn letters; translation into turns is handled by
 * {@link SolveCore}.</p>
 */
@Value
@Builder
public class SolveRequest {
    /** Scramble applied to the solved cube, first symbol first. */
    List<String> scrambleTokens;
}
