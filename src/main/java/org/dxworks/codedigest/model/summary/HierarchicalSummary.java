package org.dxworks.codedigest.model.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Grouped, size-bounded view of one source unit. The only artifact that leaves the core.
 * <p>
 * Instances are immutable; every {@code with*} method returns a new summary.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "language_variant", "truncated", "total_statements", "total_procedures",
        "total_variables", "statement_hierarchy", "procedure_groups", "variable_hierarchy"})
public final class HierarchicalSummary {
    private final String name;
    private final String languageVariant;
    private final int totalStatements;
    private final int totalProcedures;
    private final int totalVariables;
    private final Map<String, StatementGroup> statementHierarchy;
    private final Map<String, ProcedureGroup> procedureGroups;
    private final Map<String, VariableGroup> variableHierarchy;
    private final boolean truncated;

    public HierarchicalSummary(String name, String languageVariant,
                               int totalStatements, int totalProcedures, int totalVariables,
                               Map<String, StatementGroup> statementHierarchy,
                               Map<String, ProcedureGroup> procedureGroups,
                               Map<String, VariableGroup> variableHierarchy,
                               boolean truncated) {
        this.name = name;
        this.languageVariant = languageVariant;
        this.totalStatements = totalStatements;
        this.totalProcedures = totalProcedures;
        this.totalVariables = totalVariables;
        this.statementHierarchy = Collections.unmodifiableMap(new LinkedHashMap<>(statementHierarchy));
        this.procedureGroups = Collections.unmodifiableMap(new LinkedHashMap<>(procedureGroups));
        this.variableHierarchy = Collections.unmodifiableMap(new LinkedHashMap<>(variableHierarchy));
        this.truncated = truncated;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("language_variant")
    public String getLanguageVariant() {
        return languageVariant;
    }

    @JsonProperty("total_statements")
    public int getTotalStatements() {
        return totalStatements;
    }

    @JsonProperty("total_procedures")
    public int getTotalProcedures() {
        return totalProcedures;
    }

    @JsonProperty("total_variables")
    public int getTotalVariables() {
        return totalVariables;
    }

    @JsonProperty("statement_hierarchy")
    public Map<String, StatementGroup> getStatementHierarchy() {
        return statementHierarchy;
    }

    @JsonProperty("procedure_groups")
    public Map<String, ProcedureGroup> getProcedureGroups() {
        return procedureGroups;
    }

    @JsonProperty("variable_hierarchy")
    public Map<String, VariableGroup> getVariableHierarchy() {
        return variableHierarchy;
    }

    /** Serialized only when set, right after the metadata so that a cut payload still carries it. */
    @JsonProperty("truncated")
    public Boolean getTruncatedFlag() {
        return truncated ? Boolean.TRUE : null;
    }

    public boolean truncated() {
        return truncated;
    }

    public HierarchicalSummary withStatementGroups(UnaryOperator<StatementGroup> transform) {
        return new HierarchicalSummary(name, languageVariant, totalStatements, totalProcedures, totalVariables,
                mapValues(statementHierarchy, transform), procedureGroups, variableHierarchy, truncated);
    }

    public HierarchicalSummary withProcedureGroups(UnaryOperator<ProcedureGroup> transform) {
        return new HierarchicalSummary(name, languageVariant, totalStatements, totalProcedures, totalVariables,
                statementHierarchy, mapValues(procedureGroups, transform), variableHierarchy, truncated);
    }

    public HierarchicalSummary withVariableGroups(UnaryOperator<VariableGroup> transform) {
        return new HierarchicalSummary(name, languageVariant, totalStatements, totalProcedures, totalVariables,
                statementHierarchy, procedureGroups, mapValues(variableHierarchy, transform), truncated);
    }

    public HierarchicalSummary asTruncated() {
        if (truncated) {
            return this;
        }
        return new HierarchicalSummary(name, languageVariant, totalStatements, totalProcedures, totalVariables,
                statementHierarchy, procedureGroups, variableHierarchy, true);
    }

    private static <V> Map<String, V> mapValues(Map<String, V> source, UnaryOperator<V> transform) {
        Map<String, V> result = new LinkedHashMap<>();
        for (Map.Entry<String, V> entry : source.entrySet()) {
            result.put(entry.getKey(), transform.apply(entry.getValue()));
        }
        return result;
    }
}
