package org.kube.solving.core;

import lombok.Builder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kube.core.algebra.Move;
import org.kube.core.algebra.Turn;
import org.kube.core.id.TurnMapper;
import org.kube.core.state.Configuration;
import org.kube.core.state.StateModel;
import org.kube.solving.search.ConnectorSearch;
import org.kube.solving.search.SearchBudget;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main solve entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Translate scramble symbols into turns, rejecting unknown symbols up front.</li>
 * <li>Replay the scramble into a configuration.</li>
 * <li>Run the four reduction phases: corner position, corner orientation, edge position,
 * edge orientation.</li>
 * <li>Replay scramble plus solution and require the solved configuration.</li>
 * <li>Map the solution back to external symbols.</li>
 * </ul>
 *
 * <p>Holds no mutable state, so one instance can serve concurrent callers.</p>
 */
public final class SolveCore implements SolverService {
    public static final String REASON_REQUEST_REQUIRED = "KUBE_REQUEST_REQUIRED";
    public static final String REASON_TOKENS_REQUIRED = "KUBE_TOKENS_REQUIRED";
    public static final String REASON_INVALID_TOKEN = "KUBE_INVALID_TOKEN";
    public static final String REASON_SEARCH_EXHAUSTED = "KUBE_SEARCH_EXHAUSTED";
    public static final String REASON_SOLVE_FAILED = "KUBE_SOLVE_FAILED";

    private static final Logger log = LogManager.getLogger(SolveCore.class);

    private final TurnMapper turnMapper;
    private final StateModel stateModel;
    private final SearchBudget searchBudget;
    private final ConnectorSearch connectorSearch;
    private final ReductionPipeline pipeline;

    /**
     * Creates the solver; every argument is optional.
     *
     * @param turnMapper symbol mapper, defaults to the twelve standard symbols.
     * @param searchBudget connector depth bounds, defaults to {@link SearchBudget#defaults()}.
     * @param connectorSearch connector search, defaults to the quarter- and half-turn set.
     */
    @Builder
    public SolveCore(TurnMapper turnMapper, SearchBudget searchBudget, ConnectorSearch connectorSearch) {
        this(turnMapper, searchBudget, connectorSearch, new ReductionPipeline());
    }

    SolveCore(
            TurnMapper turnMapper,
            SearchBudget searchBudget,
            ConnectorSearch connectorSearch,
            ReductionPipeline pipeline
    ) {
        this.turnMapper = turnMapper == null ? TurnMapper.standard() : turnMapper;
        this.stateModel = new StateModel(this.turnMapper);
        this.searchBudget = searchBudget == null ? SearchBudget.defaults() : searchBudget;
        this.connectorSearch = connectorSearch == null ? new ConnectorSearch() : connectorSearch;
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    /**
     * Solves one scramble.
     *
     * @param request scramble in external symbols.
     * @return verified solution with per-phase telemetry.
     * @throws SolveCoreException when the request is invalid or no verified solution is found.
     */
    @Override
    public SolveResponse solve(SolveRequest request) {
        if (request == null) {
            throw new SolveCoreException(REASON_REQUEST_REQUIRED, "solve request must be provided");
        }
        List<Turn> scramble = toTurns(request.getScrambleTokens());
        Configuration start = Configuration.of(stateModel.replayTurns(scramble));

        ReductionPipeline.PipelineResult result = pipeline.run(start, connectorSearch, searchBudget);
        Move solution = result.solution();
        verify(scramble, solution);

        long generated = 0L;
        for (PhaseTelemetry phase : result.phases()) {
            generated += phase.getGeneratedCandidates();
        }
        log.info("solved scramble of {} turns in {} turns ({} candidates searched)",
                scramble.size(), solution.length(), generated);

        return SolveResponse.builder()
                .scrambleLength(scramble.size())
                .turnCount(solution.length())
                .generatedCandidates(generated)
                .phases(result.phases())
                .solutionTokens(turnMapper.toSymbols(solution.turns()))
                .build();
    }

    /**
     * Convenience form for presentation code: scramble symbols in, solution symbols out.
     *
     * @throws SolveCoreException when the scramble is invalid or no verified solution is found.
     */
    public List<String> solveTokens(List<String> scrambleTokens) {
        return solve(SolveRequest.builder().scrambleTokens(scrambleTokens).build()).getSolutionTokens();
    }

    private List<Turn> toTurns(List<String> tokens) {
        if (tokens == null) {
            throw new SolveCoreException(REASON_TOKENS_REQUIRED, "scramble token list must be provided");
        }
        List<Turn> turns = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token == null) {
                throw new SolveCoreException(REASON_TOKENS_REQUIRED, "scramble token " + i + " is null");
            }
            try {
                turns.add(turnMapper.toTurn(token));
            } catch (TurnMapper.UnknownTokenException ex) {
                throw new SolveCoreException(
                        REASON_INVALID_TOKEN,
                        "scramble token " + i + " '" + token + "' is not a quarter-turn symbol",
                        ex
                );
            }
        }
        return turns;
    }

    /**
     * Replays scramble then solution from the solved cube and requires the solved cube back.
     */
    private void verify(List<Turn> scramble, Move solution) {
        List<Turn> replay = new ArrayList<>(scramble.size() + solution.length());
        replay.addAll(scramble);
        replay.addAll(solution.turns());
        Configuration end = Configuration.of(stateModel.replayTurns(replay));
        if (!end.isSolved()) {
            throw new SolveCoreException(
                    REASON_SOLVE_FAILED,
                    "solution of " + solution.length() + " turns does not restore the cube: " + end
            );
        }
    }
}
