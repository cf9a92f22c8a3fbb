package storagesizing.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Линейное выражение sum(coef * var) + constant.
 * Коэффициенты одной и той же переменной складываются; порядок добавления сохраняется.
 */
public final class LinearExpression {

    private final Map<DecisionVariable, Double> terms = new LinkedHashMap<>();
    private double constant;

    public static LinearExpression create() {
        return new LinearExpression();
    }

    public static LinearExpression of(DecisionVariable variable) {
        return new LinearExpression().add(variable, 1.0);
    }

    public LinearExpression add(DecisionVariable variable, double coefficient) {
        if (variable == null) {
            throw new IllegalArgumentException("variable == null");
        }
        if (!Double.isFinite(coefficient)) {
            throw new IllegalArgumentException(
                    "Коэффициент при " + variable.name() + " не конечен: " + coefficient);
        }
        terms.merge(variable, coefficient, Double::sum);
        return this;
    }

    public LinearExpression subtract(DecisionVariable variable, double coefficient) {
        return add(variable, -coefficient);
    }

    /**
     * this += factor * other.
     */
    public LinearExpression addScaled(LinearExpression other, double factor) {
        for (Map.Entry<DecisionVariable, Double> e : other.terms.entrySet()) {
            add(e.getKey(), e.getValue() * factor);
        }
        constant += other.constant * factor;
        return this;
    }

    public LinearExpression addConstant(double value) {
        constant += value;
        return this;
    }

    public double coefficient(DecisionVariable variable) {
        return terms.getOrDefault(variable, 0.0);
    }

    public Map<DecisionVariable, Double> getTerms() {
        return Collections.unmodifiableMap(terms);
    }

    public double getConstant() {
        return constant;
    }

    /**
     * Значение выражения при заданных значениях переменных.
     */
    public double evaluate(ToDoubleFunction<DecisionVariable> values) {
        double sum = constant;
        for (Map.Entry<DecisionVariable, Double> e : terms.entrySet()) {
            sum += e.getValue() * values.applyAsDouble(e.getKey());
        }
        return sum;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<DecisionVariable, Double> e : terms.entrySet()) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(e.getValue()).append(' ').append(e.getKey().name());
        }
        if (constant != 0.0 || sb.length() == 0) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(constant);
        }
        return sb.toString();
    }
}
