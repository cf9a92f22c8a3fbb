package storagesizing;

import storagesizing.config.ProblemConfiguration;
import storagesizing.config.ProblemConfigurationBuilder;
import storagesizing.config.SolverConfig;

public final class ProblemFactory {

    private ProblemFactory() {}

    /**
     * Базовые параметры: 800 Вт, 1.2 м2, 670 евро за модуль, 0..100 модулей,
     * 1400 евро/кВт·ч, 0..1000 кВт·ч, 10 сценариев, 365 суток.
     */
    public static ProblemConfiguration defaultConfiguration() {
        return new ProblemConfigurationBuilder().build();
    }

    /**
     * Демонстрационный набор. Значения не слишком реалистичны, но подобраны так,
     * чтобы решение не было очевидным: чем больше суток, тем полезнее накопитель.
     */
    public static ProblemConfiguration demoConfiguration() {
        return ProblemConfigurationBuilder.from(defaultConfiguration())
                .setNumberOfScenarios(5)
                .setMinStorageSizeKwh(0)
                .setMaxStorageSizeKwh(100)
                .setMinNumberOfModules(0)
                .setMaxNumberOfModules(200)
                .setNumberOfDays(365)
                .setStoragePricePerKwhEuro(50)
                .setPricePerModuleEuro(850)
                .build();
    }

    public static SolverConfig demoSolverConfig() {
        return SolverConfig.defaults().withSolverOutput(true);
    }
}
