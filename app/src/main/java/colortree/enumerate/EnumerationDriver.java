package colortree.enumerate;

import colortree.core.ColoringException;
import colortree.core.ColoringOptions;
import colortree.core.diagnostics.EnumerationDiagnostic;
import colortree.core.model.ExclusionSet;
import colortree.core.model.Graph;
import colortree.core.model.LabelAssignment;
import colortree.solver.ResultDecoder;
import colortree.solver.SolverOracle;
import colortree.solver.SolverProcessException;
import colortree.solver.SolverProgram;
import colortree.solver.SolverProgramGenerator;
import colortree.solver.SolverResponse;
import colortree.solver.SolverResultFile;
import colortree.tree.LeafClassifier;
import colortree.tree.SearchTree;
import colortree.util.Timing;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates every valid coloring through the solver with blocking clauses.
 *
 * <p>Each iteration regenerates the solver program with one exclusion per coloring found so far,
 * invokes the solver and re-validates everything it reports with {@link LeafClassifier}. The loop
 * stops at the first invocation that yields no new coloring (the fixed point), or when the
 * iteration budget, the time budget or the per-iteration process retries run out, or on
 * cancellation. A response whose results were all rejected counts as a failed attempt, not as
 * a fixed point. Afterwards the tree's valid leaves are reconciled against the found colorings.
 *
 * <p>The current {@link EnumerationState} is replaced as a whole after every completed
 * iteration; {@link #snapshot()} never observes a half-applied update.
 */
public final class EnumerationDriver {
  private static final Logger LOG = LoggerFactory.getLogger(EnumerationDriver.class);
  private static final String UNUSABLE_OUTPUT = "UNUSABLE_OUTPUT";

  private final SolverOracle oracle;
  private final SolverProgramGenerator generator;
  private final ColoringOptions options;
  private final Reconciler reconciler = new Reconciler();
  private final AtomicReference<EnumerationState> published =
      new AtomicReference<>(EnumerationState.initial());

  public EnumerationDriver(SolverOracle oracle, ColoringOptions options) {
    this(oracle, new SolverProgramGenerator(), options);
  }

  public EnumerationDriver(
      SolverOracle oracle, SolverProgramGenerator generator, ColoringOptions options) {
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.options = ColoringOptions.normalize(options);
  }

  /** Latest published state of the current or most recent run. */
  public EnumerationState snapshot() {
    return published.get();
  }

  public EnumerationResult enumerate(Graph graph, int labelCount, SearchTree tree) {
    return enumerate(graph, labelCount, tree, CancellationToken.create(), EnumerationListener.NONE);
  }

  public EnumerationResult enumerate(
      Graph graph,
      int labelCount,
      SearchTree tree,
      CancellationToken cancellation,
      EnumerationListener listener) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(tree, "tree");
    if (!tree.graph().equals(graph) || tree.labelCount() != labelCount) {
      throw ColoringException.invalidConfiguration(
          "tree was built for a different graph or label count", graph.nodeCount(), labelCount);
    }

    Timing timer = Timing.start();
    EnumerationState state = EnumerationState.initial();
    published.set(state);
    LOG.info(
        "Enumerating colorings for n={} k={} (max {} iterations)",
        graph.nodeCount(),
        labelCount,
        options.maxIterations());

    while (!state.isTerminated()) {
      TerminationReason stop = checkBudgets(state, timer, cancellation);
      if (stop != null) {
        state = state.terminate(stop);
        break;
      }

      int iteration = state.iterations() + 1;
      SolverProgram program = generator.generate(graph, labelCount, state.exclusions());
      List<EnumerationDiagnostic> diagnostics = new ArrayList<>();
      Invocation invocation =
          invokeWithRetries(
              program, graph, labelCount, state.exclusions(), iteration, timer, cancellation,
              diagnostics);
      if (invocation.termination() != null) {
        state = state.withDiagnostics(diagnostics).terminate(invocation.termination());
        break;
      }

      List<LabelAssignment> fresh = invocation.fresh();
      state = state.advance(fresh, diagnostics);
      if (fresh.isEmpty()) {
        TerminationReason reason =
            invocation.infeasible()
                ? TerminationReason.SOLVER_INFEASIBLE
                : TerminationReason.FIXED_POINT;
        LOG.info("Iteration {}: no new coloring, stopping ({})", iteration, reason);
        state = state.terminate(reason);
        break;
      }

      LOG.info(
          "Iteration {}: {} new coloring(s), {} excluded so far",
          iteration,
          fresh.size(),
          state.exclusions().size());
      published.set(state);
      for (LabelAssignment coloring : fresh) {
        listener.onColoringFound(coloring, iteration);
      }
      listener.onIterationCompleted(state);
    }

    published.set(state);
    if (!state.termination().isExhaustive()) {
      LOG.warn(
          "Enumeration incomplete after {} iteration(s): {}",
          state.iterations(),
          state.termination());
    }
    ReconciliationReport report = reconciler.reconcile(tree, state);
    return new EnumerationResult(tree, state, report, timer.elapsedMillis());
  }

  private TerminationReason checkBudgets(
      EnumerationState state, Timing timer, CancellationToken cancellation) {
    if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
      return TerminationReason.CANCELLED;
    }
    if (state.iterations() >= options.maxIterations()) {
      return TerminationReason.ITERATION_BUDGET_EXCEEDED;
    }
    if (timer.exceeded(options.timeBudgetMs())) {
      return TerminationReason.TIME_BUDGET_EXCEEDED;
    }
    return null;
  }

  /** Outcome of one iteration's solver call: accepted colorings, or why the run must stop. */
  private record Invocation(
      List<LabelAssignment> fresh, boolean infeasible, TerminationReason termination) {
    static Invocation stopped(TerminationReason termination) {
      return new Invocation(List.of(), false, termination);
    }
  }

  /** Colorings not seen before, plus how many results were usable at all (new or repeats). */
  private record Accepted(List<LabelAssignment> fresh, int usable) {}

  /**
   * Invokes the solver, retrying after process failures and after responses whose results were
   * all rejected. Only a response with at least one usable result, or none at all, is final.
   */
  private Invocation invokeWithRetries(
      SolverProgram program,
      Graph graph,
      int labelCount,
      ExclusionSet exclusions,
      int iteration,
      Timing timer,
      CancellationToken cancellation,
      List<EnumerationDiagnostic> diagnostics) {
    int attempts = options.solverRetries() + 1;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      if (attempt > 1) {
        TerminationReason stop = cancellation.isCancelled() ? TerminationReason.CANCELLED : null;
        if (stop == null && timer.exceeded(options.timeBudgetMs())) {
          stop = TerminationReason.TIME_BUDGET_EXCEEDED;
        }
        if (stop != null) {
          return Invocation.stopped(stop);
        }
      }
      SolverResponse response = null;
      try {
        response = oracle.solve(program, invocationTimeout(timer));
      } catch (SolverProcessException ex) {
        LOG.warn(
            "Solver attempt {}/{} of iteration {} failed ({}): {}",
            attempt,
            attempts,
            iteration,
            ex.failure(),
            ex.getMessage());
        diagnostics.add(
            EnumerationDiagnostic.processFailure(
                iteration, attempt, ex.failure().name(), ex.getMessage()));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        LOG.info("Enumeration interrupted during iteration {}", iteration);
        return Invocation.stopped(TerminationReason.CANCELLED);
      }
      if (response == null) {
        continue;
      }

      Accepted accepted =
          acceptResults(response, graph, labelCount, exclusions, iteration, diagnostics);
      if (accepted.usable() == 0 && !response.results().isEmpty()) {
        LOG.warn(
            "Solver attempt {}/{} of iteration {} returned {} result(s), none usable",
            attempt,
            attempts,
            iteration,
            response.results().size());
        diagnostics.add(
            EnumerationDiagnostic.processFailure(
                iteration,
                attempt,
                UNUSABLE_OUTPUT,
                "all " + response.results().size() + " result(s) were rejected"));
        continue;
      }
      return new Invocation(accepted.fresh(), response.infeasible(), null);
    }
    return Invocation.stopped(TerminationReason.SOLVER_PROCESS_FAILURE);
  }

  private Duration invocationTimeout(Timing timer) {
    long timeout = options.solverTimeoutMs();
    if (options.hasTimeBudget()) {
      long remaining = options.timeBudgetMs() - timer.elapsedMillis();
      timeout = Math.max(1, Math.min(timeout, remaining));
    }
    return Duration.ofMillis(timeout);
  }

  /** Decodes and re-validates every reported result; returns the colorings not seen before. */
  private Accepted acceptResults(
      SolverResponse response,
      Graph graph,
      int labelCount,
      ExclusionSet exclusions,
      int iteration,
      List<EnumerationDiagnostic> diagnostics) {
    Set<LabelAssignment> fresh = new LinkedHashSet<>();
    int usable = 0;
    for (SolverResultFile result : response.results()) {
      ResultDecoder.Decoded decoded =
          ResultDecoder.decode(result, graph.nodeCount(), labelCount);
      if (!decoded.isOk()) {
        reject(result, decoded.problem(), null, iteration, diagnostics);
        continue;
      }
      LabelAssignment coloring = decoded.assignment();
      LeafClassifier.Classification classification =
          LeafClassifier.classify(coloring, graph.edges());
      if (!classification.valid()) {
        reject(
            result,
            "coloring violates " + classification.violatedEdges().size() + " edge(s)",
            coloring,
            iteration,
            diagnostics);
        continue;
      }
      usable++;
      if (exclusions.contains(coloring)) {
        LOG.debug("{} repeats excluded coloring {}", result.source(), coloring);
        continue;
      }
      fresh.add(coloring);
    }
    return new Accepted(List.copyOf(fresh), usable);
  }

  private static void reject(
      SolverResultFile result,
      String problem,
      LabelAssignment coloring,
      int iteration,
      List<EnumerationDiagnostic> diagnostics) {
    LOG.warn("Discarding solver result {}: {}", result.source(), problem);
    diagnostics.add(
        EnumerationDiagnostic.malformedResult(
            iteration, result.source(), problem, coloring == null ? null : coloring.toString()));
  }
}
