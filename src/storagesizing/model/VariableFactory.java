package storagesizing.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagesizing.config.ModelConstants;
import storagesizing.config.ProblemConfiguration;
import storagesizing.solver.SolverEngine;

/**
 * Объявление переменных модели в движке.
 * <p>
 * Инвестиционные: numberOfModules (целая) и sizeOfStorageInKwh (непрерывная).
 * Операционные (Вт·ч) на каждую пару (сценарий, таймслот):
 * уровень накопителя, изменение уровня, выработка, потребление, покупка, продажа.
 */
public final class VariableFactory {

    private static final Logger log = LoggerFactory.getLogger(VariableFactory.class);

    private final SolverEngine engine;
    private final ProblemConfiguration configuration;

    public VariableFactory(SolverEngine engine, ProblemConfiguration configuration) {
        this.engine = engine;
        this.configuration = configuration;
    }

    public BaseVariables createBaseVariables() {
        return new BaseVariables(
                engine.makeIntegerVariable(
                        configuration.getMinNumberOfModules(),
                        configuration.getMaxNumberOfModules(),
                        BaseVariables.NUMBER_OF_MODULES),
                engine.makeContinuousVariable(
                        configuration.getMinStorageSizeKwh(),
                        configuration.getMaxStorageSizeKwh(),
                        BaseVariables.SIZE_OF_STORAGE_KWH)
        );
    }

    public ScenarioVariables createScenarioVariables() {
        final int scenarios = configuration.getNumberOfScenarios();
        final int timeslots = configuration.getTimeslotCount();
        ScenarioVariables vars = new ScenarioVariables(scenarios, timeslots);

        for (int s = 0; s < scenarios; s++) {
            for (int t = 0; t < timeslots; t++) {
                declareTimeslot(vars, s, t);
            }
            log.debug("declared variables of scenario {}", s);
        }
        return vars;
    }

    private void declareTimeslot(ScenarioVariables vars, int s, int t) {
        // ёмкость ограничиваем верхней границей инвестиции; реальный предел задаёт ограничение по размеру
        final double maxStorageWh = configuration.getMaxStorageSizeKwh() * ModelConstants.WH_PER_KWH;
        final double inf = engine.infinity();

        for (OperationalField f : OperationalField.values()) {
            double lb;
            double ub;
            switch (f) {
                case STORAGE_LEVEL -> {
                    lb = 0.0;
                    ub = maxStorageWh;
                }
                case STORAGE_ENERGY_DELTA -> {
                    lb = -maxStorageWh;
                    ub = maxStorageWh;
                }
                default -> {
                    lb = 0.0;
                    ub = inf;
                }
            }
            vars.set(s, t, f, engine.makeContinuousVariable(lb, ub, ScenarioVariables.name(s, t, f)));
        }
    }
}
