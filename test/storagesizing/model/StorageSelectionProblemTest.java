package storagesizing.model;

import org.junit.jupiter.api.Test;
import storagesizing.config.ProblemConfiguration;
import storagesizing.config.ProblemConfigurationBuilder;
import storagesizing.solver.ModelInfeasibleException;
import storagesizing.solver.ModelUnboundedException;
import storagesizing.solver.RecordingSolverEngine;
import storagesizing.solver.RecordingSolverEngine.RecordedConstraint;
import storagesizing.solver.SolveStatus;
import storagesizing.solver.SolverException;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Структура модели и обработка статусов без настоящего солвера.
 */
class StorageSelectionProblemTest {

    private static ProblemConfiguration config(int scenarios, int days) {
        return new ProblemConfigurationBuilder()
                .setNumberOfScenarios(scenarios)
                .setNumberOfDays(days)
                .build();
    }

    private static List<String> canonicalModel(ProblemConfiguration cfg, long seed) {
        RecordingSolverEngine engine = new RecordingSolverEngine();
        try (StorageSelectionProblem problem = new StorageSelectionProblem(cfg, engine, seed)) {
            problem.buildModel();
        }
        List<String> lines = engine.getConstraints().stream()
                .map(RecordedConstraint::canonical)
                .collect(Collectors.toList());
        lines.add(engine.getObjective().toString());
        return lines;
    }

    @Test
    void modelSizeFollowsScenarioAndTimeslotCounts() {
        int[][] shapes = {{1, 1}, {3, 1}, {2, 2}};
        for (int[] shape : shapes) {
            RecordingSolverEngine engine = new RecordingSolverEngine();
            try (StorageSelectionProblem problem =
                         new StorageSelectionProblem(config(shape[0], shape[1]), engine, 1L)) {
                problem.buildModel();
            }
            int st = shape[0] * shape[1] * 24;
            assertThat(engine.numVariables()).isEqualTo(2 + 6 * st);
            assertThat(engine.numConstraints()).isEqualTo(5 * st);
            assertThat(engine.isClosed()).isTrue();
        }
    }

    @Test
    void sameSeedBuildsIdenticalModel() {
        ProblemConfiguration cfg = config(3, 1);

        assertThat(canonicalModel(cfg, 123L)).isEqualTo(canonicalModel(cfg, 123L));
        assertThat(canonicalModel(cfg, 123L)).isNotEqualTo(canonicalModel(cfg, 124L));
    }

    @Test
    void scenarioProfilesAreStableWhenScenarioCountGrows() {
        RecordingSolverEngine small = new RecordingSolverEngine();
        RecordingSolverEngine large = new RecordingSolverEngine();
        StorageSelectionProblem p2 = new StorageSelectionProblem(config(2, 1), small, 9L);
        StorageSelectionProblem p5 = new StorageSelectionProblem(config(5, 1), large, 9L);
        p2.buildModel();
        p5.buildModel();

        assertThat(p5.getProfiles().subList(0, 2)).isEqualTo(p2.getProfiles());
        assertThat(large.constraint("s1_t17_production").canonical())
                .isEqualTo(small.constraint("s1_t17_production").canonical());
    }

    @Test
    void buildTwiceIsRejected() {
        StorageSelectionProblem problem = new StorageSelectionProblem(config(1, 1), new RecordingSolverEngine(), 1L);
        problem.buildModel();

        assertThatThrownBy(problem::buildModel).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedBuildCannotBeRetriedAndLeavesNoPartialProfiles() {
        RecordingSolverEngine engine = new RecordingSolverEngine();
        engine.failOnConstraint("s1_t3_balance");
        StorageSelectionProblem problem = new StorageSelectionProblem(config(3, 1), engine, 1L);

        assertThatThrownBy(problem::buildModel).isInstanceOf(SolverException.class);
        assertThat(problem.getProfiles()).isEmpty();

        assertThatThrownBy(problem::buildModel)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("прерывалось");
        assertThat(problem.getProfiles()).isEmpty();
        assertThatThrownBy(problem::solve).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void solveAndExportRequireBuiltModel() {
        StorageSelectionProblem problem = new StorageSelectionProblem(config(1, 1), new RecordingSolverEngine(), 1L);

        assertThatThrownBy(problem::solve).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(problem::exportModelAsLp).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(problem::getScenarioVariables).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void exportContainsNamedConstraints() {
        StorageSelectionProblem problem = new StorageSelectionProblem(config(1, 1), new RecordingSolverEngine(), 1L);
        problem.buildModel();

        assertThat(problem.exportModelAsLp())
                .contains("s0_t0_initialLevel")
                .contains("s0_t23_capacity");
    }

    @Test
    void infeasibleStatusIsReportedBeforeAnyValueIsRead() {
        RecordingSolverEngine engine = new RecordingSolverEngine();
        engine.stubSolve(SolveStatus.INFEASIBLE, v -> {
            throw new AssertionError("value read for " + v.name());
        });
        StorageSelectionProblem problem = new StorageSelectionProblem(config(1, 1), engine, 1L);
        problem.buildModel();

        SolverException e = assertThrows(ModelInfeasibleException.class, problem::solve);
        assertThat(e.getStatus()).contains(SolveStatus.INFEASIBLE);
    }

    @Test
    void unboundedStatusHasItsOwnException() {
        RecordingSolverEngine engine = new RecordingSolverEngine();
        engine.stubSolve(SolveStatus.UNBOUNDED, v -> 0.0);
        StorageSelectionProblem problem = new StorageSelectionProblem(config(1, 1), engine, 1L);
        problem.buildModel();

        assertThatThrownBy(problem::solve).isInstanceOf(ModelUnboundedException.class);
    }

    @Test
    void notSolvedAndErrorAreGenericSolverFailures() {
        for (SolveStatus status : new SolveStatus[]{SolveStatus.NOT_SOLVED, SolveStatus.ERROR}) {
            RecordingSolverEngine engine = new RecordingSolverEngine();
            engine.stubSolve(status, v -> 0.0);
            StorageSelectionProblem problem = new StorageSelectionProblem(config(1, 1), engine, 1L);
            problem.buildModel();

            SolverException e = assertThrows(SolverException.class, problem::solve);
            assertThat(e).isNotInstanceOf(ModelInfeasibleException.class)
                    .isNotInstanceOf(ModelUnboundedException.class);
            assertThat(e.getStatus()).contains(status);
        }
    }

    @Test
    void solutionIsReadBackFromEngine() {
        ProblemConfiguration cfg = config(2, 1);
        RecordingSolverEngine engine = new RecordingSolverEngine();
        engine.stubSolve(SolveStatus.FEASIBLE, v -> {
            switch (v.name()) {
                case "numberOfModules": return 3.0000001;
                case "sizeOfStorageInKwh": return 1.5;
                case "s0_t0_boughtEnergy": return 4000.0;
                case "s1_t2_soldEnergy": return 1000.0;
                default: return 0.0;
            }
        });
        StorageSelectionProblem problem = new StorageSelectionProblem(cfg, engine, 5L);
        problem.buildModel();

        SizingSolution solution = problem.solve();

        assertThat(solution.status).isEqualTo(SolveStatus.FEASIBLE);
        assertThat(solution.isProvenOptimal()).isFalse();
        assertThat(solution.numberOfModules).isEqualTo(3);
        assertThat(solution.sizeOfStorageKwh).isEqualTo(1.5);
        assertThat(solution.getScenarioCount()).isEqualTo(2);
        assertThat(solution.getTimeslotCount()).isEqualTo(24);
        assertThat(solution.value(0, 0, OperationalField.BOUGHT_ENERGY)).isEqualTo(4000.0);
        assertThat(solution.value(1, 2, OperationalField.SOLD_ENERGY)).isEqualTo(1000.0);

        double buy0 = problem.getProfiles().get(0).purchasePricePerKwh(0);
        double sell1 = problem.getProfiles().get(1).sellPricePerKwh(2);
        assertThat(solution.scenarioRecourseCost(0)).isCloseTo(4.0 * buy0, within(1e-9));
        assertThat(solution.scenarioRecourseCost(1)).isCloseTo(-1.0 * sell1, within(1e-9));
        assertThat(solution.expectedRecourseCost)
                .isCloseTo((4.0 * buy0 - sell1) / 2, within(1e-9));
        assertThat(solution.objectiveValue)
                .isCloseTo(solution.investmentCost + solution.expectedRecourseCost,
                        within(1e-6));
    }
}
