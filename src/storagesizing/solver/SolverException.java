package storagesizing.solver;

import java.util.Optional;

/**
 * Ошибка движка: бэкенд недоступен, решение не найдено или солвер сломался.
 */
public class SolverException extends RuntimeException {

    private final SolveStatus status;

    public SolverException(SolveStatus status, String message) {
        super(message);
        this.status = status;
    }

    public Optional<SolveStatus> getStatus() {
        return Optional.ofNullable(status);
    }
}
