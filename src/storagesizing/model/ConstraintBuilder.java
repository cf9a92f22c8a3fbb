package storagesizing.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagesizing.config.ModelConstants;
import storagesizing.sampling.ScenarioProfile;
import storagesizing.solver.DecisionVariable;
import storagesizing.solver.LinearExpression;
import storagesizing.solver.Relation;
import storagesizing.solver.SolverEngine;

import static storagesizing.model.OperationalField.*;

/**
 * Ограничения одного сценария. Ровно пять на таймслот:
 * <ol>
 *   <li>выработка = solar[t] * numberOfModules</li>
 *   <li>потребление = consumption[t]</li>
 *   <li>баланс: produced - consumed = sold + delta - bought</li>
 *   <li>t == 0: level = 0; t > 0: level[t] = level[t-1] + delta[t-1]</li>
 *   <li>level[t] <= 1000 * sizeOfStorageInKwh</li>
 * </ol>
 * Таймслоты обходятся строго по возрастанию из-за рекурсии уровня накопителя.
 * Одновременные покупка и продажа в одном часе не запрещены.
 */
public final class ConstraintBuilder {

    public static final int CONSTRAINTS_PER_TIMESLOT = 5;

    private static final Logger log = LoggerFactory.getLogger(ConstraintBuilder.class);

    private final SolverEngine engine;
    private final BaseVariables base;
    private final ScenarioVariables vars;

    public ConstraintBuilder(SolverEngine engine, BaseVariables base, ScenarioVariables vars) {
        this.engine = engine;
        this.base = base;
        this.vars = vars;
    }

    public void buildScenarioConstraints(int s, ScenarioProfile profile) {
        final int n = vars.getTimeslotCount();
        if (profile.getTimeslotCount() != n) {
            throw new IllegalArgumentException("Профиль сценария " + s + " длины "
                    + profile.getTimeslotCount() + ", ожидалось " + n);
        }

        for (int t = 0; t < n; t++) {
            final String prefix = "s" + s + "_t" + t + "_";

            DecisionVariable produced = vars.get(s, t, PRODUCED_ENERGY);
            DecisionVariable consumed = vars.get(s, t, CONSUMED_ENERGY);
            DecisionVariable bought = vars.get(s, t, BOUGHT_ENERGY);
            DecisionVariable sold = vars.get(s, t, SOLD_ENERGY);
            DecisionVariable delta = vars.get(s, t, STORAGE_ENERGY_DELTA);
            DecisionVariable level = vars.get(s, t, STORAGE_LEVEL);

            // 1) единственный коэффициент, зависящий от сценария и часа
            engine.addConstraint(prefix + "production",
                    LinearExpression.of(produced)
                            .subtract(base.numberOfModules(), profile.solarWattsPerModule(t)),
                    Relation.EQUAL, 0.0);

            // 2)
            engine.addConstraint(prefix + "consumption",
                    LinearExpression.of(consumed),
                    Relation.EQUAL, profile.consumptionW(t));

            // 3)
            engine.addConstraint(prefix + "balance",
                    LinearExpression.of(produced)
                            .subtract(consumed, 1.0)
                            .subtract(sold, 1.0)
                            .subtract(delta, 1.0)
                            .add(bought, 1.0),
                    Relation.EQUAL, 0.0);

            // 4) накопитель в начале каждого сценария пуст
            if (t == 0) {
                engine.addConstraint(prefix + "initialLevel",
                        LinearExpression.of(level),
                        Relation.EQUAL, 0.0);
            } else {
                engine.addConstraint(prefix + "storageRecursion",
                        LinearExpression.of(level)
                                .subtract(vars.get(s, t - 1, STORAGE_LEVEL), 1.0)
                                .subtract(vars.get(s, t - 1, STORAGE_ENERGY_DELTA), 1.0),
                        Relation.EQUAL, 0.0);
            }

            // 5) кВт·ч -> Вт·ч
            engine.addConstraint(prefix + "capacity",
                    LinearExpression.of(level)
                            .subtract(base.sizeOfStorageKwh(), ModelConstants.WH_PER_KWH),
                    Relation.LESS_OR_EQUAL, 0.0);
        }
        log.debug("built {} constraints of scenario {}", n * CONSTRAINTS_PER_TIMESLOT, s);
    }
}
