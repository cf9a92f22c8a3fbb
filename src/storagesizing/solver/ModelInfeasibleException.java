package storagesizing.solver;

public class ModelInfeasibleException extends SolverException {

    public ModelInfeasibleException(String message) {
        super(SolveStatus.INFEASIBLE, message);
    }
}
