package storagesizing.solver;

/**
 * Переменная решения, объявленная в {@link SolverEngine}.
 * Значение читается только через движок и только после успешного решения.
 */
public interface DecisionVariable {

    String name();

    VariableKind kind();

    double lowerBound();

    double upperBound();
}
