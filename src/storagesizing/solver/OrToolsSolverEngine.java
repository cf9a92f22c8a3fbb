package storagesizing.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * {@link SolverEngine} поверх OR-Tools MPSolver.
 */
public final class OrToolsSolverEngine implements SolverEngine {

    private static final Logger log = LoggerFactory.getLogger(OrToolsSolverEngine.class);

    static {
        Loader.loadNativeLibraries();
    }

    private final String solverId;
    private final MPSolver solver;
    private SolveStatus lastStatus = SolveStatus.NOT_SOLVED;
    private boolean closed;

    /**
     * @throws SolverException если бэкенд с таким id недоступен в сборке OR-Tools
     */
    public OrToolsSolverEngine(String solverId) {
        MPSolver created = MPSolver.createSolver(solverId);
        if (created == null) {
            throw new SolverException(SolveStatus.ERROR, "Не удалось создать солвер " + solverId);
        }
        this.solverId = solverId;
        this.solver = created;
        log.debug("created OR-Tools solver {}", solverId);
    }

    @Override
    public double infinity() {
        return MPSolver.infinity();
    }

    @Override
    public DecisionVariable makeIntegerVariable(double lowerBound, double upperBound, String name) {
        checkBounds(lowerBound, upperBound, name);
        return new OrToolsVariable(solver.makeIntVar(lowerBound, upperBound, name), VariableKind.INTEGER);
    }

    @Override
    public DecisionVariable makeContinuousVariable(double lowerBound, double upperBound, String name) {
        checkBounds(lowerBound, upperBound, name);
        return new OrToolsVariable(solver.makeNumVar(lowerBound, upperBound, name), VariableKind.CONTINUOUS);
    }

    @Override
    public void addConstraint(String name, LinearExpression expression, Relation relation, double rhs) {
        double bound = rhs - expression.getConstant();
        double inf = MPSolver.infinity();

        MPConstraint c = switch (relation) {
            case EQUAL -> solver.makeConstraint(bound, bound, name);
            case LESS_OR_EQUAL -> solver.makeConstraint(-inf, bound, name);
            case GREATER_OR_EQUAL -> solver.makeConstraint(bound, inf, name);
        };
        for (Map.Entry<DecisionVariable, Double> e : expression.getTerms().entrySet()) {
            c.setCoefficient(unwrap(e.getKey()), e.getValue());
        }
    }

    @Override
    public void minimize(LinearExpression objective) {
        MPObjective o = solver.objective();
        o.clear();
        for (Map.Entry<DecisionVariable, Double> e : objective.getTerms().entrySet()) {
            o.setCoefficient(unwrap(e.getKey()), e.getValue());
        }
        o.setOffset(objective.getConstant());
        o.setMinimization();
    }

    @Override
    public int numVariables() {
        return solver.numVariables();
    }

    @Override
    public int numConstraints() {
        return solver.numConstraints();
    }

    @Override
    public String exportModelAsLp() {
        return solver.exportModelAsLpFormat();
    }

    @Override
    public void enableOutput() {
        solver.enableOutput();
    }

    @Override
    public void setTimeLimit(Duration limit) {
        solver.setTimeLimit(limit.toMillis());
    }

    @Override
    public SolveStatus solve() {
        long start = System.currentTimeMillis();
        MPSolver.ResultStatus result = solver.solve();
        lastStatus = map(result);
        log.info("{} finished with {} ({}) in {} ms",
                solverId, lastStatus, result, System.currentTimeMillis() - start);
        return lastStatus;
    }

    @Override
    public SolveStatus lastStatus() {
        return lastStatus;
    }

    @Override
    public double objectiveValue() {
        requireSolution();
        return solver.objective().value();
    }

    @Override
    public double solutionValue(DecisionVariable variable) {
        requireSolution();
        return unwrap(variable).solutionValue();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            solver.delete();
        }
    }

    private void requireSolution() {
        if (!lastStatus.hasSolution()) {
            throw new IllegalStateException("Решения нет, статус " + lastStatus);
        }
    }

    private static void checkBounds(double lowerBound, double upperBound, String name) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(
                    "Границы переменной " + name + " несовместны: " + lowerBound + " > " + upperBound);
        }
    }

    private static MPVariable unwrap(DecisionVariable variable) {
        if (variable instanceof OrToolsVariable v) {
            return v.delegate;
        }
        throw new IllegalArgumentException("Переменная " + variable.name() + " объявлена не в OR-Tools");
    }

    static SolveStatus map(MPSolver.ResultStatus result) {
        return switch (result) {
            case OPTIMAL -> SolveStatus.OPTIMAL;
            case FEASIBLE -> SolveStatus.FEASIBLE;
            case INFEASIBLE -> SolveStatus.INFEASIBLE;
            case UNBOUNDED -> SolveStatus.UNBOUNDED;
            case NOT_SOLVED -> SolveStatus.NOT_SOLVED;
            default -> SolveStatus.ERROR;
        };
    }

    private static final class OrToolsVariable implements DecisionVariable {

        private final MPVariable delegate;
        private final VariableKind kind;

        private OrToolsVariable(MPVariable delegate, VariableKind kind) {
            this.delegate = delegate;
            this.kind = kind;
        }

        @Override public String name()        { return delegate.name(); }
        @Override public VariableKind kind()  { return kind; }
        @Override public double lowerBound()  { return delegate.lb(); }
        @Override public double upperBound()  { return delegate.ub(); }

        @Override
        public String toString() {
            return delegate.name();
        }
    }
}
