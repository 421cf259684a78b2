package colortree.core;

/**
 * Configuration for tree construction, layout and solver-driven enumeration.
 *
 * @param maxLeaves ceiling on {@code k^n}; builds and layouts above it are refused
 * @param maxIterations maximum number of solver invocations per enumeration
 * @param solverTimeoutMs time limit for a single solver invocation
 * @param solverRetries extra attempts per iteration after a solver process failure
 * @param timeBudgetMs overall enumeration budget, 0 for none
 * @param horizontalGap distance between neighbouring leaves in the layout
 * @param levelHeight vertical distance between tree levels
 * @param topMargin y coordinate of the root
 */
public record ColoringOptions(
    long maxLeaves,
    int maxIterations,
    long solverTimeoutMs,
    int solverRetries,
    long timeBudgetMs,
    double horizontalGap,
    double levelHeight,
    double topMargin) {

  /**
   * Default leaf ceiling. Trees up to 2^20 leaves are built and laid out; larger inputs such as
   * n = 12 with k = 4 (4^12 leaves) are refused unless {@code maxLeaves} is raised.
   */
  public static final long DEFAULT_MAX_LEAVES = 1L << 20;

  public static ColoringOptions defaults() {
    return new ColoringOptions(DEFAULT_MAX_LEAVES, 1_000, 30_000, 2, 0, 50.0, 70.0, 0.0);
  }

  public static ColoringOptions normalize(ColoringOptions options) {
    if (options == null) {
      return defaults();
    }
    ColoringOptions defaults = defaults();
    long maxLeaves = options.maxLeaves() > 0 ? options.maxLeaves() : defaults.maxLeaves();
    int maxIterations =
        options.maxIterations() > 0 ? options.maxIterations() : defaults.maxIterations();
    long solverTimeoutMs =
        options.solverTimeoutMs() > 0 ? options.solverTimeoutMs() : defaults.solverTimeoutMs();
    int solverRetries = Math.max(0, options.solverRetries());
    long timeBudgetMs = Math.max(0, options.timeBudgetMs());
    double horizontalGap =
        options.horizontalGap() > 0 ? options.horizontalGap() : defaults.horizontalGap();
    double levelHeight =
        options.levelHeight() > 0 ? options.levelHeight() : defaults.levelHeight();
    return new ColoringOptions(
        maxLeaves,
        maxIterations,
        solverTimeoutMs,
        solverRetries,
        timeBudgetMs,
        horizontalGap,
        levelHeight,
        options.topMargin());
  }

  public ColoringOptions withMaxLeaves(long value) {
    return new ColoringOptions(
        value, maxIterations, solverTimeoutMs, solverRetries, timeBudgetMs, horizontalGap,
        levelHeight, topMargin);
  }

  public ColoringOptions withMaxIterations(int value) {
    return new ColoringOptions(
        maxLeaves, value, solverTimeoutMs, solverRetries, timeBudgetMs, horizontalGap,
        levelHeight, topMargin);
  }

  public ColoringOptions withSolverRetries(int value) {
    return new ColoringOptions(
        maxLeaves, maxIterations, solverTimeoutMs, value, timeBudgetMs, horizontalGap,
        levelHeight, topMargin);
  }

  public ColoringOptions withTimeBudgetMs(long value) {
    return new ColoringOptions(
        maxLeaves, maxIterations, solverTimeoutMs, solverRetries, value, horizontalGap,
        levelHeight, topMargin);
  }

  public boolean hasTimeBudget() {
    return timeBudgetMs > 0;
  }
}
