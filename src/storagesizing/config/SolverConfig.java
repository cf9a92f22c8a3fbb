package storagesizing.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Конфигурация запуска: бэкенд солвера, seed, лимит времени, пути выгрузки.
 * Параметры самой задачи сюда не кладём - они в ProblemConfiguration.
 */
public class SolverConfig {

    /** Идентификатор бэкенда OR-Tools (SCIP, CBC, ...). */
    private final String solverId;

    /** Базовый seed выборки сценариев. */
    private final long baseSeed;

    /** Выводить ли диагностический лог солвера. */
    private final boolean enableSolverOutput;

    /** Лимит времени решения; null - без лимита. */
    private final Duration timeLimit;

    /** Куда писать модель в LP-формате; null - не писать. */
    private final String lpExportPath;

    /** Куда писать xlsx-отчёт; null - не писать. */
    private final String xlsxReportPath;

    public SolverConfig(String solverId,
                        long baseSeed,
                        boolean enableSolverOutput,
                        Duration timeLimit,
                        String lpExportPath,
                        String xlsxReportPath) {
        if (solverId == null || solverId.isBlank()) {
            throw new ConfigurationException("solverId не задан");
        }
        if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
            throw new ConfigurationException("timeLimit должен быть > 0, получено " + timeLimit);
        }
        this.solverId = solverId;
        this.baseSeed = baseSeed;
        this.enableSolverOutput = enableSolverOutput;
        this.timeLimit = timeLimit;
        this.lpExportPath = lpExportPath;
        this.xlsxReportPath = xlsxReportPath;
    }

    public static SolverConfig defaults() {
        return new SolverConfig(
                ModelConstants.DEFAULT_SOLVER_ID,
                ModelConstants.DEFAULT_BASE_SEED,
                false,
                null,
                ModelConstants.DEFAULT_LP_EXPORT_PATH,
                null
        );
    }

    public SolverConfig withBaseSeed(long seed) {
        return new SolverConfig(solverId, seed, enableSolverOutput, timeLimit, lpExportPath, xlsxReportPath);
    }

    public SolverConfig withTimeLimit(Duration limit) {
        return new SolverConfig(solverId, baseSeed, enableSolverOutput, limit, lpExportPath, xlsxReportPath);
    }

    public SolverConfig withSolverOutput(boolean enable) {
        return new SolverConfig(solverId, baseSeed, enable, timeLimit, lpExportPath, xlsxReportPath);
    }

    public SolverConfig withLpExportPath(String path) {
        return new SolverConfig(solverId, baseSeed, enableSolverOutput, timeLimit, path, xlsxReportPath);
    }

    public SolverConfig withXlsxReportPath(String path) {
        return new SolverConfig(solverId, baseSeed, enableSolverOutput, timeLimit, lpExportPath, path);
    }

    public String getSolverId() {
        return solverId;
    }

    public long getBaseSeed() {
        return baseSeed;
    }

    public boolean isEnableSolverOutput() {
        return enableSolverOutput;
    }

    public Optional<Duration> getTimeLimit() {
        return Optional.ofNullable(timeLimit);
    }

    public Optional<String> getLpExportPath() {
        return Optional.ofNullable(lpExportPath);
    }

    public Optional<String> getXlsxReportPath() {
        return Optional.ofNullable(xlsxReportPath);
    }
}
