package storagesizing.model;

import org.junit.jupiter.api.Test;
import storagesizing.config.ModelConstants;
import storagesizing.config.ProblemConfiguration;
import storagesizing.config.ProblemConfigurationBuilder;
import storagesizing.config.SamplingParameters;
import storagesizing.config.SolverConfig;
import storagesizing.sampling.ScenarioProfile;
import storagesizing.sampling.ScenarioSampler;
import storagesizing.solver.SolveStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static storagesizing.model.OperationalField.*;

/**
 * Решение на настоящем SCIP через OR-Tools.
 */
class StorageSelectionProblemSolveTest {

    private static final long SEED = 20_240_601L;

    private static SizingSolution solve(ProblemConfiguration cfg, long seed) {
        try (StorageSelectionProblem problem =
                     StorageSelectionProblem.create(cfg, SolverConfig.defaults().withBaseSeed(seed))) {
            problem.buildModel();
            return problem.solve();
        }
    }

    private static double tolerance(double magnitude) {
        return ModelConstants.SOLVER_TOLERANCE_WH + 1e-6 * Math.abs(magnitude);
    }

    @Test
    void singleHourlyScenarioMatchesEnumeratedOptimum() {
        ProblemConfiguration cfg = new ProblemConfigurationBuilder()
                .setNumberOfScenarios(1)
                .setNumberOfDays(1)
                .setMinNumberOfModules(0)
                .setMaxNumberOfModules(1)
                .setMinStorageSizeKwh(0)
                .setMaxStorageSizeKwh(0)
                .build();
        ScenarioProfile profile = new ScenarioSampler(cfg, SEED).sample(0);

        double best = Double.POSITIVE_INFINITY;
        for (int m = 0; m <= 1; m++) {
            double cost = m * cfg.getPricePerModuleEuro();
            for (int t = 0; t < 24; t++) {
                double net = profile.consumptionW(t) - profile.solarWattsPerModule(t) * m;
                cost += (Math.max(net, 0.0) * profile.purchasePricePerKwh(t)
                        - Math.max(-net, 0.0) * profile.sellPricePerKwh(t)) / 1000.0;
            }
            best = Math.min(best, cost);
        }

        SizingSolution solution = solve(cfg, SEED);

        assertThat(solution.status).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(solution.objectiveValue).isCloseTo(best, within(1e-4 * Math.max(1.0, Math.abs(best))));
        assertThat(solution.sizeOfStorageKwh).isCloseTo(0.0, within(1e-9));
        for (int t = 0; t < 24; t++) {
            assertThat(solution.value(0, t, STORAGE_LEVEL)).isCloseTo(0.0, within(1e-6));
            assertThat(solution.value(0, t, STORAGE_ENERGY_DELTA)).isCloseTo(0.0, within(1e-6));
        }
    }

    @Test
    void solvedScheduleRespectsBalanceAndStorageDynamics() {
        ProblemConfiguration cfg = new ProblemConfigurationBuilder()
                .setNumberOfScenarios(2)
                .setNumberOfDays(2)
                .setMinNumberOfModules(0)
                .setMaxNumberOfModules(30)
                .setMinStorageSizeKwh(0)
                .setMaxStorageSizeKwh(50)
                .setStoragePricePerKwhEuro(5)
                .build();

        SizingSolution s = solve(cfg, SEED);
        ScenarioSampler sampler = new ScenarioSampler(cfg, SEED);

        assertThat(s.status.hasSolution()).isTrue();
        assertThat(s.numberOfModules).isBetween(0, 30);
        assertThat(s.sizeOfStorageKwh).isBetween(-1e-9, 50.0 + 1e-9);
        assertThat(s.objectiveValue)
                .isCloseTo(s.investmentCost + s.expectedRecourseCost, within(1e-4 * Math.max(1.0, Math.abs(s.objectiveValue))));

        double capacityWh = s.sizeOfStorageKwh * 1000.0;
        for (int sc = 0; sc < 2; sc++) {
            ScenarioProfile p = sampler.sample(sc);
            assertThat(s.value(sc, 0, STORAGE_LEVEL)).isCloseTo(0.0, within(tolerance(0)));

            for (int t = 0; t < 48; t++) {
                double level = s.value(sc, t, STORAGE_LEVEL);
                double delta = s.value(sc, t, STORAGE_ENERGY_DELTA);
                double produced = s.value(sc, t, PRODUCED_ENERGY);
                double consumed = s.value(sc, t, CONSUMED_ENERGY);
                double bought = s.value(sc, t, BOUGHT_ENERGY);
                double sold = s.value(sc, t, SOLD_ENERGY);

                assertThat(level).isBetween(-tolerance(0), capacityWh + tolerance(capacityWh));
                assertThat(produced).isCloseTo(p.solarWattsPerModule(t) * s.numberOfModules, within(tolerance(produced)));
                assertThat(consumed).isCloseTo(p.consumptionW(t), within(tolerance(consumed)));
                assertThat(produced - consumed)
                        .isCloseTo(sold + delta - bought, within(tolerance(consumed + produced)));
                assertThat(bought).isGreaterThanOrEqualTo(-tolerance(0));
                assertThat(sold).isGreaterThanOrEqualTo(-tolerance(0));

                if (t > 0) {
                    double expected = s.value(sc, t - 1, STORAGE_LEVEL) + s.value(sc, t - 1, STORAGE_ENERGY_DELTA);
                    assertThat(level).isCloseTo(expected, within(tolerance(capacityWh)));
                }
            }
        }
    }

    @Test
    void identicalScenariosGiveSameOptimumForAnyScenarioCount() {
        // без разброса все сценарии совпадают: 600 Вт на модуль против 10 кВт нагрузки
        ProblemConfigurationBuilder base = new ProblemConfigurationBuilder()
                .setNumberOfDays(2)
                .setPricePerModuleEuro(10)
                .setMinNumberOfModules(0)
                .setMaxNumberOfModules(30)
                .setMinStorageSizeKwh(0)
                .setMaxStorageSizeKwh(0)
                .setSamplingParameters(SamplingParameters.defaults().withoutVariance());

        SizingSolution two = solve(base.setNumberOfScenarios(2).build(), SEED);
        SizingSolution four = solve(base.setNumberOfScenarios(4).build(), SEED + 1);

        // m = 17: 170 - 48 * 200 Вт·ч * 0.12 / 1000
        for (SizingSolution s : new SizingSolution[]{two, four}) {
            assertThat(s.numberOfModules).isEqualTo(17);
            assertThat(s.sizeOfStorageKwh).isCloseTo(0.0, within(1e-6));
            assertThat(s.objectiveValue).isCloseTo(168.848, within(1e-3));
            assertThat(s.expectedRecourseCost).isCloseTo(-1.152, within(1e-3));
        }
        assertThat(two.getScenarioCount()).isEqualTo(2);
        assertThat(four.getScenarioCount()).isEqualTo(4);
    }

    @Test
    void lastHourDeltaIsLimitedOnlyByVariableBounds() {
        // delta последнего часа не входит ни в одну рекурсию: солвер продаёт 10 кВт·ч "из ниоткуда"
        ProblemConfiguration cfg = new ProblemConfigurationBuilder()
                .setNumberOfScenarios(2)
                .setNumberOfDays(2)
                .setPricePerModuleEuro(10)
                .setMinNumberOfModules(0)
                .setMaxNumberOfModules(30)
                .setMinStorageSizeKwh(0)
                .setMaxStorageSizeKwh(10)
                .setSamplingParameters(SamplingParameters.defaults().withoutVariance())
                .build();

        SizingSolution s = solve(cfg, SEED);

        // 168.848 - 10 000 Вт·ч * 0.12 / 1000
        assertThat(s.numberOfModules).isEqualTo(17);
        assertThat(s.sizeOfStorageKwh).isCloseTo(0.0, within(1e-6));
        assertThat(s.objectiveValue).isCloseTo(167.648, within(1e-3));
        assertThat(s.expectedRecourseCost).isCloseTo(-2.352, within(1e-3));
        for (int sc = 0; sc < 2; sc++) {
            assertThat(s.value(sc, 47, STORAGE_LEVEL)).isCloseTo(0.0, within(tolerance(0)));
            assertThat(s.value(sc, 47, STORAGE_ENERGY_DELTA)).isCloseTo(-10_000.0, within(tolerance(10_000)));
            assertThat(s.value(sc, 47, SOLD_ENERGY)).isCloseTo(10_200.0, within(tolerance(10_200)));
        }
    }
}
