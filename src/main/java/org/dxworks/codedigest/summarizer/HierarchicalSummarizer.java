package org.dxworks.codedigest.summarizer;

import org.dxworks.codedigest.model.Procedure;
import org.dxworks.codedigest.model.RawAST;
import org.dxworks.codedigest.model.Statement;
import org.dxworks.codedigest.model.StatementType;
import org.dxworks.codedigest.model.Variable;
import org.dxworks.codedigest.model.summary.HierarchicalSummary;
import org.dxworks.codedigest.model.summary.ProcedureGroup;
import org.dxworks.codedigest.model.summary.StatementExample;
import org.dxworks.codedigest.model.summary.StatementGroup;
import org.dxworks.codedigest.model.summary.VariableGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups a {@link RawAST} into a {@link HierarchicalSummary}.
 * <p>
 * Statements are grouped by type, procedures and variables by category. Group maps keep the order
 * in which each key first appears in the source, counts are exact and examples are always the
 * first members in source order, so the same input always gives the same document.
 */
public class HierarchicalSummarizer {

    static final int CONTENT_LIMIT = 80;
    static final int CONDITION_LIMIT = 50;
    static final String ELLIPSIS = "...";

    public HierarchicalSummary summarize(RawAST ast, SummaryThresholds thresholds) {
        return summarize(ast.getProgramId(), null, ast, thresholds);
    }

    public HierarchicalSummary summarize(String name, String languageVariant, RawAST ast, SummaryThresholds thresholds) {
        Objects.requireNonNull(ast, "ast");
        Objects.requireNonNull(thresholds, "thresholds");

        return new HierarchicalSummary(name, languageVariant,
                ast.getStatements().size(), ast.getProcedures().size(), ast.getVariables().size(),
                groupStatements(ast.getStatements(), thresholds),
                groupProcedures(ast.getProcedures(), thresholds),
                groupVariables(ast.getVariables(), thresholds),
                false);
    }

    private Map<String, StatementGroup> groupStatements(List<Statement> statements, SummaryThresholds thresholds) {
        Map<StatementType, List<Statement>> byType = new LinkedHashMap<>();
        for (Statement statement : statements) {
            byType.computeIfAbsent(statement.getType(), t -> new ArrayList<>()).add(statement);
        }

        Map<String, StatementGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<StatementType, List<Statement>> entry : byType.entrySet()) {
            List<Statement> members = entry.getValue();
            int minLine = Integer.MAX_VALUE;
            int maxLine = Integer.MIN_VALUE;
            for (Statement member : members) {
                minLine = Math.min(minLine, member.getLine());
                maxLine = Math.max(maxLine, member.getLine());
            }

            int exampleCount = members.size() <= thresholds.getFullExampleLimit()
                    ? members.size()
                    : Math.min(thresholds.getExampleCap(), members.size());
            List<StatementExample> examples = new ArrayList<>(exampleCount);
            for (Statement member : members.subList(0, exampleCount)) {
                examples.add(toExample(member));
            }
            groups.put(entry.getKey().getLabel(),
                    new StatementGroup(entry.getKey(), members.size(), examples, minLine, maxLine));
        }
        return groups;
    }

    private Map<String, ProcedureGroup> groupProcedures(List<Procedure> procedures, SummaryThresholds thresholds) {
        Map<String, List<String>> byCategory = new LinkedHashMap<>();
        for (Procedure procedure : procedures) {
            byCategory.computeIfAbsent(procedure.getCategory(), c -> new ArrayList<>()).add(procedure.getName());
        }
        Map<String, ProcedureGroup> groups = new LinkedHashMap<>();
        byCategory.forEach((category, names) ->
                groups.put(category, new ProcedureGroup(category, names.size(), capNames(names, thresholds.getNameCap()))));
        return groups;
    }

    private Map<String, VariableGroup> groupVariables(List<Variable> variables, SummaryThresholds thresholds) {
        Map<String, List<String>> byCategory = new LinkedHashMap<>();
        for (Variable variable : variables) {
            byCategory.computeIfAbsent(variable.getCategory(), c -> new ArrayList<>()).add(variable.getName());
        }
        Map<String, VariableGroup> groups = new LinkedHashMap<>();
        byCategory.forEach((category, names) ->
                groups.put(category, new VariableGroup(category, names.size(), capNames(names, thresholds.getNameCap()))));
        return groups;
    }

    /** First {@code cap} names followed by a {@code "+N more"} marker when some were left out. */
    static List<String> capNames(List<String> names, int cap) {
        if (names.size() <= cap) {
            return List.copyOf(names);
        }
        List<String> capped = new ArrayList<>(names.subList(0, cap));
        capped.add("+" + (names.size() - cap) + " more");
        return capped;
    }

    static StatementExample toExample(Statement statement) {
        return new StatementExample(statement.getLine(),
                abbreviate(statement.getRawText(), CONTENT_LIMIT),
                abbreviate(statement.field(Statement.CONDITION), CONDITION_LIMIT),
                statement.field(Statement.TARGET));
    }

    static String abbreviate(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + ELLIPSIS;
    }
}
