package storagesizing.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagesizing.config.ModelConstants;
import storagesizing.config.ProblemConfiguration;
import storagesizing.sampling.ScenarioProfile;
import storagesizing.solver.ModelInfeasibleException;
import storagesizing.solver.ModelUnboundedException;
import storagesizing.solver.SolveStatus;
import storagesizing.solver.SolverEngine;
import storagesizing.solver.SolverException;

import java.util.List;

/**
 * Чтение решения из движка. Статус проверяется ДО чтения любых значений.
 */
final class SolutionReader {

    private static final Logger log = LoggerFactory.getLogger(SolutionReader.class);

    private SolutionReader() {}

    static SizingSolution read(SolverEngine engine,
                               ProblemConfiguration configuration,
                               BaseVariables base,
                               ScenarioVariables vars,
                               ObjectiveBuilder objective,
                               List<ScenarioProfile> profiles) {

        SolveStatus status = engine.lastStatus();
        switch (status) {
            case OPTIMAL -> { }
            case FEASIBLE -> log.warn("solution is feasible but not proven optimal (time limit?)");
            case INFEASIBLE -> throw new ModelInfeasibleException(
                    "Модель недопустима: нет решения, удовлетворяющего балансу и ограничениям накопителя");
            case UNBOUNDED -> throw new ModelUnboundedException(
                    "Модель неограничена: целевая функция уходит в минус бесконечность");
            default -> throw new SolverException(status, "Солвер не нашёл решения, статус " + status);
        }

        double modulesRaw = engine.solutionValue(base.numberOfModules());
        int modules = (int) Math.round(modulesRaw);
        if (Math.abs(modulesRaw - modules) > ModelConstants.EPSILON) {
            log.warn("numberOfModules = {} is not integral, rounded to {}", modulesRaw, modules);
        }
        double storageKwh = engine.solutionValue(base.sizeOfStorageKwh());

        final int scenarios = vars.getScenarioCount();
        final int timeslots = vars.getTimeslotCount();
        double[] values = new double[vars.size()];
        int i = 0;
        for (int s = 0; s < scenarios; s++) {
            for (int t = 0; t < timeslots; t++) {
                for (OperationalField f : OperationalField.values()) {
                    values[i++] = engine.solutionValue(vars.get(s, t, f));
                }
            }
        }

        double[] recourse = new double[scenarios];
        double recourseSum = 0.0;
        for (int s = 0; s < scenarios; s++) {
            recourse[s] = objective.scenarioRecourse(s, profiles.get(s)).evaluate(engine::solutionValue);
            recourseSum += recourse[s];
        }

        return new SizingSolution(
                status,
                engine.objectiveValue(),
                modules,
                storageKwh,
                ObjectiveBuilder.investmentCost(configuration, modulesRaw, storageKwh),
                recourseSum / scenarios,
                recourse,
                scenarios,
                timeslots,
                values
        );
    }
}
