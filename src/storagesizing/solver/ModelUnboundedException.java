package storagesizing.solver;

public class ModelUnboundedException extends SolverException {

    public ModelUnboundedException(String message) {
        super(SolveStatus.UNBOUNDED, message);
    }
}
