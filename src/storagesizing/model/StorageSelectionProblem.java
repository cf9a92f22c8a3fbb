package storagesizing.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagesizing.config.ProblemConfiguration;
import storagesizing.config.SolverConfig;
import storagesizing.sampling.ScenarioProfile;
import storagesizing.sampling.ScenarioSampler;
import storagesizing.solver.OrToolsSolverEngine;
import storagesizing.solver.SolveStatus;
import storagesizing.solver.SolverEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Двухэтапная стохастическая задача выбора числа модулей и ёмкости накопителя.
 * <p>
 * ВАЖНО:
 * - один экземпляр владеет одним движком и строит ровно одну модель;
 * - построение строго последовательное: сценарий выбирается перед своими ограничениями,
 *   таймслоты обходятся по возрастанию;
 * - общего изменяемого состояния между экземплярами нет.
 */
public final class StorageSelectionProblem implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StorageSelectionProblem.class);

    private final ProblemConfiguration configuration;
    private final SolverEngine engine;
    private final ScenarioSampler sampler;

    private BaseVariables baseVariables;
    private ScenarioVariables scenarioVariables;
    private ObjectiveBuilder objectiveBuilder;
    private final List<ScenarioProfile> profiles = new ArrayList<>();
    private boolean buildStarted;

    public StorageSelectionProblem(ProblemConfiguration configuration, SolverEngine engine, long baseSeed) {
        this.configuration = configuration;
        this.engine = engine;
        this.sampler = new ScenarioSampler(configuration, baseSeed);
    }

    /**
     * Создать задачу на движке OR-Tools с настройками запуска.
     */
    public static StorageSelectionProblem create(ProblemConfiguration configuration, SolverConfig solverConfig) {
        SolverEngine engine = new OrToolsSolverEngine(solverConfig.getSolverId());
        if (solverConfig.isEnableSolverOutput()) {
            engine.enableOutput();
        }
        solverConfig.getTimeLimit().ifPresent(engine::setTimeLimit);
        return new StorageSelectionProblem(configuration, engine, solverConfig.getBaseSeed());
    }

    /**
     * Строит модель в движке. Вызывается один раз: после ошибки построения
     * движок содержит часть модели, поэтому повторная попытка тоже запрещена.
     */
    public void buildModel() {
        if (buildStarted) {
            throw new IllegalStateException(baseVariables != null
                    ? "Модель уже построена"
                    : "Построение модели уже прерывалось ошибкой, создайте новую задачу");
        }
        buildStarted = true;
        try {
            declareModel();
        } catch (RuntimeException e) {
            profiles.clear();
            throw e;
        }
    }

    private void declareModel() {
        VariableFactory factory = new VariableFactory(engine, configuration);
        log.debug("building base variables");
        BaseVariables base = factory.createBaseVariables();
        log.debug("building scenario variables");
        ScenarioVariables vars = factory.createScenarioVariables();
        log.debug("finished setting up decision variables");

        log.debug("start setting up constraints");
        ConstraintBuilder constraints = new ConstraintBuilder(engine, base, vars);
        for (int s = 0; s < configuration.getNumberOfScenarios(); s++) {
            log.debug("processing scenario {} of {}", s + 1, configuration.getNumberOfScenarios());
            ScenarioProfile profile = sampler.sample(s);
            profiles.add(profile);
            constraints.buildScenarioConstraints(s, profile);
        }
        log.debug("finished setting up constraints");

        log.debug("start setting up objective");
        ObjectiveBuilder objective = new ObjectiveBuilder(engine, configuration, base, vars);
        objective.buildObjective(profiles);
        log.debug("finished setting up objective");

        this.baseVariables = base;
        this.scenarioVariables = vars;
        this.objectiveBuilder = objective;
        log.info("model built: {} variables, {} constraints", engine.numVariables(), engine.numConstraints());
    }

    /**
     * Одна попытка решения. Статус проверяется до чтения значений.
     *
     * @throws storagesizing.solver.ModelInfeasibleException модель недопустима
     * @throws storagesizing.solver.ModelUnboundedException  модель неограничена
     * @throws storagesizing.solver.SolverException          решение не найдено / ошибка солвера
     */
    public SizingSolution solve() {
        requireBuilt();
        log.info("starting to solve: {} variables, {} constraints", engine.numVariables(), engine.numConstraints());
        SolveStatus status = engine.solve();
        log.debug("solve status {}", status);
        return SolutionReader.read(engine, configuration, baseVariables, scenarioVariables, objectiveBuilder, profiles);
    }

    public String exportModelAsLp() {
        requireBuilt();
        return engine.exportModelAsLp();
    }

    private void requireBuilt() {
        if (baseVariables == null) {
            throw new IllegalStateException("Модель ещё не построена: вызовите buildModel()");
        }
    }

    public ProblemConfiguration getConfiguration() {
        return configuration;
    }

    public SolverEngine getEngine() {
        return engine;
    }

    public ScenarioVariables getScenarioVariables() {
        requireBuilt();
        return scenarioVariables;
    }

    public List<ScenarioProfile> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }

    @Override
    public void close() {
        engine.close();
    }
}
