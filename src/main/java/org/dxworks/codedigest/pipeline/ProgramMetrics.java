package org.dxworks.codedigest.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.codedigest.model.RawAST;
import org.dxworks.codedigest.model.Statement;
import org.dxworks.codedigest.model.StatementType;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Simple complexity figures of one program.
 * <ul>
 *     <li>cyclomatic complexity: decision points, i.e. IF and EVALUATE, loops, PERFORMs and CALLs;</li>
 *     <li>nesting depth: deepest stack of IF, EVALUATE and inline PERFORM scopes;</li>
 *     <li>dependencies: distinct CALL and PERFORM targets, sorted.</li>
 * </ul>
 */
@JsonPropertyOrder({"cyclomatic_complexity", "nesting_depth", "dependencies"})
public final class ProgramMetrics {
    private final int cyclomaticComplexity;
    private final int nestingDepth;
    private final List<String> dependencies;

    public ProgramMetrics(int cyclomaticComplexity, int nestingDepth, List<String> dependencies) {
        this.cyclomaticComplexity = cyclomaticComplexity;
        this.nestingDepth = nestingDepth;
        this.dependencies = List.copyOf(dependencies);
    }

    public static ProgramMetrics of(RawAST ast) {
        int complexity = 0;
        int depth = 0;
        int maxDepth = 0;
        int procedure = Integer.MIN_VALUE;
        Set<String> dependencies = new TreeSet<>();

        for (Statement statement : ast.getStatements()) {
            if (statement.getProcedureIndex() != procedure) {
                procedure = statement.getProcedureIndex();
                depth = 0;
            }
            String verb = statement.field(Statement.VERB);

            if (isDecision(statement, verb)) {
                complexity++;
            }
            if (opensScope(statement, verb)) {
                depth++;
                maxDepth = Math.max(maxDepth, depth);
            } else if (closesScope(verb)) {
                depth = Math.max(0, depth - 1);
            }
            // a period ends every open scope
            if (statement.getRawText().endsWith(".")) {
                depth = 0;
            }

            String target = statement.field(Statement.TARGET);
            if (target != null && (statement.getType() == StatementType.CALL
                    || statement.getType() == StatementType.INVOKE
                    || statement.getType() == StatementType.LOOP)) {
                dependencies.add(target.toUpperCase(Locale.ROOT));
            }
        }
        return new ProgramMetrics(complexity, maxDepth, List.copyOf(dependencies));
    }

    private static boolean isDecision(Statement statement, String verb) {
        switch (statement.getType()) {
            case CONDITIONAL:
                return "IF".equals(verb) || "EVALUATE".equals(verb);
            case LOOP:
            case INVOKE:
            case CALL:
                return true;
            default:
                return false;
        }
    }

    private static boolean opensScope(Statement statement, String verb) {
        if (statement.getType() == StatementType.CONDITIONAL) {
            return "IF".equals(verb) || "EVALUATE".equals(verb);
        }
        return statement.getType() == StatementType.LOOP && statement.field(Statement.TARGET) == null;
    }

    private static boolean closesScope(String verb) {
        return "END-IF".equals(verb) || "END-EVALUATE".equals(verb) || "END-PERFORM".equals(verb);
    }

    @JsonProperty("cyclomatic_complexity")
    public int getCyclomaticComplexity() {
        return cyclomaticComplexity;
    }

    @JsonProperty("nesting_depth")
    public int getNestingDepth() {
        return nestingDepth;
    }

    @JsonProperty("dependencies")
    public List<String> getDependencies() {
        return dependencies;
    }
}
