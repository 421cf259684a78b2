package colortree.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Emits a C program for KLEE.
 *
 * <p>Compound assumptions use the non-short-circuit {@code &} and {@code |} operators so that a
 * single {@code klee_assume} never forks the symbolic execution.
 */
public final class KleeProgramEmitter implements ProgramEmitter {
  private static final String INDENT = "    ";

  private final List<String> declarations = new ArrayList<>();
  private final List<String> assumptions = new ArrayList<>();
  private final List<String> recorded = new ArrayList<>();
  private boolean finished;

  @Override
  public void declareSymbolic(String variable) {
    checkOpen();
    declarations.add(INDENT + "int " + variable + ";");
    declarations.add(
        INDENT + "klee_make_symbolic(&" + variable + ", sizeof(int), \"" + variable + "\");");
  }

  @Override
  public void assume(Predicate predicate) {
    checkOpen();
    assumptions.add(INDENT + "klee_assume(" + render(predicate) + ");");
  }

  @Override
  public void recordValues(List<String> variables) {
    checkOpen();
    recorded.addAll(variables);
  }

  @Override
  public String finish() {
    checkOpen();
    finished = true;
    List<String> lines = new ArrayList<>();
    lines.add("#include <klee/klee.h>");
    lines.add("");
    lines.add("int main() {");
    lines.addAll(declarations);
    lines.add("");
    lines.addAll(assumptions);
    lines.add("");
    if (!recorded.isEmpty()) {
      // ktest files carry the concrete value of every symbolic object by name
      lines.add(INDENT + "// recorded: " + String.join(", ", recorded));
    }
    lines.add(INDENT + "return 0;");
    lines.add("}");
    return String.join("\n", lines) + "\n";
  }

  static String render(Predicate predicate) {
    if (predicate instanceof Predicate.Domain domain) {
      return "(" + domain.variable() + " >= 0) & (" + domain.variable() + " < "
          + domain.labelCount() + ")";
    }
    if (predicate instanceof Predicate.Distinct distinct) {
      return distinct.left() + " != " + distinct.right();
    }
    if (predicate instanceof Predicate.Exclusion exclusion) {
      StringJoiner joiner = new StringJoiner(" | ");
      for (int i = 0; i < exclusion.variables().size(); i++) {
        joiner.add("(" + exclusion.variables().get(i) + " != " + exclusion.values().get(i) + ")");
      }
      return joiner.toString();
    }
    throw new IllegalArgumentException("Unsupported predicate: " + predicate);
  }

  private void checkOpen() {
    if (finished) {
      throw new IllegalStateException("program already finished");
    }
  }
}
