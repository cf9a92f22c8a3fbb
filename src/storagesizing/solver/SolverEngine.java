package storagesizing.solver;

import java.time.Duration;

/**
 * Узкий интерфейс внешнего MILP-движка.
 * Модель только объявляет переменные, ограничения и цель; сам алгоритм решения целиком
 * на стороне движка. Один экземпляр = одна модель.
 */
public interface SolverEngine extends AutoCloseable {

    /** Значение "плюс бесконечность" для неограниченных сверху переменных. */
    double infinity();

    DecisionVariable makeIntegerVariable(double lowerBound, double upperBound, String name);

    DecisionVariable makeContinuousVariable(double lowerBound, double upperBound, String name);

    /**
     * Добавить ограничение {@code expression (relation) rhs}.
     * Константа выражения переносится в правую часть.
     */
    void addConstraint(String name, LinearExpression expression, Relation relation, double rhs);

    void minimize(LinearExpression objective);

    int numVariables();

    int numConstraints();

    /** Собранная модель в LP-формате. */
    String exportModelAsLp();

    void enableOutput();

    void setTimeLimit(Duration limit);

    /** Одна блокирующая попытка решения. */
    SolveStatus solve();

    /** Статус последнего solve(); NOT_SOLVED до первого вызова. */
    SolveStatus lastStatus();

    double objectiveValue();

    double solutionValue(DecisionVariable variable);

    @Override
    void close();
}
