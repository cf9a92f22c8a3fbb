package storagesizing.solver;

public enum VariableKind {
    INTEGER,
    CONTINUOUS
}
