package org.dxworks.codedigest.model;

import java.util.List;

/**
 * Complete, ungrouped extraction of one source unit. Built once by the parser and read only
 * afterwards.
 */
public final class RawAST {
    private final String programId;
    private final List<Statement> statements;
    private final List<Procedure> procedures;
    private final List<Variable> variables;
    private final List<String> fileNames;
    private final List<String> copybooks;
    private final List<Diagnostic> diagnostics;

    public RawAST(String programId, List<Statement> statements, List<Procedure> procedures,
                  List<Variable> variables, List<String> fileNames, List<String> copybooks,
                  List<Diagnostic> diagnostics) {
        this.programId = programId;
        this.statements = List.copyOf(statements);
        this.procedures = List.copyOf(procedures);
        this.variables = List.copyOf(variables);
        this.fileNames = List.copyOf(fileNames);
        this.copybooks = List.copyOf(copybooks);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static RawAST of(List<Statement> statements, List<Procedure> procedures, List<Variable> variables) {
        return new RawAST(null, statements, procedures, variables, List.of(), List.of(), List.of());
    }

    /** PROGRAM-ID when the source declares one. */
    public String getProgramId() {
        return programId;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public List<Procedure> getProcedures() {
        return procedures;
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public List<String> getFileNames() {
        return fileNames;
    }

    public List<String> getCopybooks() {
        return copybooks;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
