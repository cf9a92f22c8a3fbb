package storagesizing.config;

/**
 * Параметры задачи выбора мощности СЭС и накопителя (immutable).
 * Создаётся только через {@link ProblemConfigurationBuilder}, который проверяет границы.
 */
public final class ProblemConfiguration {

    /**
     * Максимальная мощность одного модуля, Вт.
     */
    private final double maxWattsPerModule;

    /**
     * Площадь одного модуля, м2.
     */
    private final double areaPerModuleM2;

    /**
     * Цена одного модуля, евро.
     */
    private final double pricePerModuleEuro;

    /**
     * Допустимое количество модулей [min, max].
     */
    private final int minNumberOfModules;
    private final int maxNumberOfModules;

    /**
     * Цена накопителя за 1 кВт·ч ёмкости, евро.
     */
    private final double storagePricePerKwhEuro;

    /**
     * Допустимая ёмкость накопителя [min, max], кВт·ч.
     */
    private final double minStorageSizeKwh;
    private final double maxStorageSizeKwh;

    /**
     * Количество сценариев (равновероятных).
     */
    private final int numberOfScenarios;

    /**
     * Горизонт планирования, сутки.
     */
    private final int numberOfDays;

    /**
     * Параметры распределений для выборки профилей.
     */
    private final SamplingParameters samplingParameters;

    ProblemConfiguration(double maxWattsPerModule,
                         double areaPerModuleM2,
                         double pricePerModuleEuro,
                         int minNumberOfModules,
                         int maxNumberOfModules,
                         double storagePricePerKwhEuro,
                         double minStorageSizeKwh,
                         double maxStorageSizeKwh,
                         int numberOfScenarios,
                         int numberOfDays,
                         SamplingParameters samplingParameters) {
        this.maxWattsPerModule = maxWattsPerModule;
        this.areaPerModuleM2 = areaPerModuleM2;
        this.pricePerModuleEuro = pricePerModuleEuro;
        this.minNumberOfModules = minNumberOfModules;
        this.maxNumberOfModules = maxNumberOfModules;
        this.storagePricePerKwhEuro = storagePricePerKwhEuro;
        this.minStorageSizeKwh = minStorageSizeKwh;
        this.maxStorageSizeKwh = maxStorageSizeKwh;
        this.numberOfScenarios = numberOfScenarios;
        this.numberOfDays = numberOfDays;
        this.samplingParameters = samplingParameters;
    }

    /**
     * Количество таймслотов (часов) на сценарий.
     */
    public int getTimeslotCount() {
        return numberOfDays * ModelConstants.HOURS_PER_DAY;
    }

    public double getMaxWattsPerModule() {
        return maxWattsPerModule;
    }

    public double getAreaPerModuleM2() {
        return areaPerModuleM2;
    }

    public double getPricePerModuleEuro() {
        return pricePerModuleEuro;
    }

    public int getMinNumberOfModules() {
        return minNumberOfModules;
    }

    public int getMaxNumberOfModules() {
        return maxNumberOfModules;
    }

    public double getStoragePricePerKwhEuro() {
        return storagePricePerKwhEuro;
    }

    public double getMinStorageSizeKwh() {
        return minStorageSizeKwh;
    }

    public double getMaxStorageSizeKwh() {
        return maxStorageSizeKwh;
    }

    public int getNumberOfScenarios() {
        return numberOfScenarios;
    }

    public int getNumberOfDays() {
        return numberOfDays;
    }

    public SamplingParameters getSamplingParameters() {
        return samplingParameters;
    }

    @Override
    public String toString() {
        return "ProblemConfiguration{" +
                "modules=[" + minNumberOfModules + ", " + maxNumberOfModules + "]" +
                ", storageKwh=[" + minStorageSizeKwh + ", " + maxStorageSizeKwh + "]" +
                ", pricePerModule=" + pricePerModuleEuro +
                ", storagePricePerKwh=" + storagePricePerKwhEuro +
                ", maxWattsPerModule=" + maxWattsPerModule +
                ", areaPerModuleM2=" + areaPerModuleM2 +
                ", scenarios=" + numberOfScenarios +
                ", days=" + numberOfDays +
                '}';
    }
}
