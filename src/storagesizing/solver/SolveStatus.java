package storagesizing.solver;

/**
 * Итог одной попытки решения.
 */
public enum SolveStatus {
    /** Доказанный оптимум. */
    OPTIMAL,
    /** Допустимое решение без доказательства оптимальности (например, истёк лимит времени). */
    FEASIBLE,
    INFEASIBLE,
    UNBOUNDED,
    /** Решение не запускалось или прервано без допустимой точки. */
    NOT_SOLVED,
    /** Внутренняя ошибка солвера или некорректная модель. */
    ERROR;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
