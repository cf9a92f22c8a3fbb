package storagesizing.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagesizing.config.ModelConstants;
import storagesizing.config.ProblemConfiguration;
import storagesizing.sampling.ScenarioProfile;
import storagesizing.solver.LinearExpression;
import storagesizing.solver.SolverEngine;

import java.util.List;

/**
 * Целевая функция двухэтапной задачи:
 * инвестиции + среднее по равновероятным сценариям от стоимости покупки минус выручка от продажи.
 * <p>
 * Цены в евро/кВт·ч, переменные в Вт·ч, отсюда деление на 1000.
 */
public final class ObjectiveBuilder {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveBuilder.class);

    private final SolverEngine engine;
    private final ProblemConfiguration configuration;
    private final BaseVariables base;
    private final ScenarioVariables vars;

    public ObjectiveBuilder(SolverEngine engine,
                            ProblemConfiguration configuration,
                            BaseVariables base,
                            ScenarioVariables vars) {
        this.engine = engine;
        this.configuration = configuration;
        this.base = base;
        this.vars = vars;
    }

    /**
     * Собрать и передать движку цель minimize(investment + expectedRecourse).
     *
     * @param profiles профили всех сценариев, profiles.get(s) - сценарий s
     */
    public LinearExpression buildObjective(List<ScenarioProfile> profiles) {
        final int scenarios = vars.getScenarioCount();
        if (profiles.size() != scenarios) {
            throw new IllegalArgumentException(
                    "Профилей " + profiles.size() + ", сценариев " + scenarios);
        }

        LinearExpression objective = investment();

        final double weight = 1.0 / scenarios;
        for (int s = 0; s < scenarios; s++) {
            objective.addScaled(scenarioRecourse(s, profiles.get(s)), weight);
            log.debug("added recourse cost of scenario {}", s);
        }

        engine.minimize(objective);
        return objective;
    }

    public LinearExpression investment() {
        return LinearExpression.create()
                .add(base.numberOfModules(), configuration.getPricePerModuleEuro())
                .add(base.sizeOfStorageKwh(), configuration.getStoragePricePerKwhEuro());
    }

    /**
     * Стоимость второго этапа сценария s, евро.
     */
    public LinearExpression scenarioRecourse(int s, ScenarioProfile profile) {
        LinearExpression cost = LinearExpression.create();
        for (int t = 0; t < vars.getTimeslotCount(); t++) {
            cost.add(vars.get(s, t, OperationalField.BOUGHT_ENERGY),
                    profile.purchasePricePerKwh(t) / ModelConstants.WH_PER_KWH);
            cost.subtract(vars.get(s, t, OperationalField.SOLD_ENERGY),
                    profile.sellPricePerKwh(t) / ModelConstants.WH_PER_KWH);
        }
        return cost;
    }

    public static double investmentCost(ProblemConfiguration configuration,
                                        double numberOfModules,
                                        double sizeOfStorageKwh) {
        return numberOfModules * configuration.getPricePerModuleEuro()
                + sizeOfStorageKwh * configuration.getStoragePricePerKwhEuro();
    }
}
