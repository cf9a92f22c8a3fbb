package storagesizing.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder для ProblemConfiguration.
 * {@link #build()} проверяет все ограничения и сообщает обо всех нарушениях сразу.
 */
public class ProblemConfigurationBuilder {

    private double maxWattsPerModule = 800;
    private double areaPerModuleM2 = 1.2;
    private double pricePerModuleEuro = 670;

    private int minNumberOfModules = 0;
    private int maxNumberOfModules = 100;

    private double storagePricePerKwhEuro = 1400;
    private double minStorageSizeKwh = 0;
    private double maxStorageSizeKwh = 1000;

    private int numberOfScenarios = 10;
    private int numberOfDays = 365;

    private SamplingParameters samplingParameters = SamplingParameters.defaults();

    public ProblemConfigurationBuilder() {
    }

    /**
     * Создать builder на основе уже существующей конфигурации.
     */
    public static ProblemConfigurationBuilder from(ProblemConfiguration base) {
        ProblemConfigurationBuilder b = new ProblemConfigurationBuilder();
        b.maxWattsPerModule = base.getMaxWattsPerModule();
        b.areaPerModuleM2 = base.getAreaPerModuleM2();
        b.pricePerModuleEuro = base.getPricePerModuleEuro();
        b.minNumberOfModules = base.getMinNumberOfModules();
        b.maxNumberOfModules = base.getMaxNumberOfModules();
        b.storagePricePerKwhEuro = base.getStoragePricePerKwhEuro();
        b.minStorageSizeKwh = base.getMinStorageSizeKwh();
        b.maxStorageSizeKwh = base.getMaxStorageSizeKwh();
        b.numberOfScenarios = base.getNumberOfScenarios();
        b.numberOfDays = base.getNumberOfDays();
        b.samplingParameters = base.getSamplingParameters();
        return b;
    }

    public ProblemConfiguration build() {
        List<String> violations = validate();
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
        return new ProblemConfiguration(
                maxWattsPerModule,
                areaPerModuleM2,
                pricePerModuleEuro,
                minNumberOfModules,
                maxNumberOfModules,
                storagePricePerKwhEuro,
                minStorageSizeKwh,
                maxStorageSizeKwh,
                numberOfScenarios,
                numberOfDays,
                samplingParameters
        );
    }

    private List<String> validate() {
        List<String> v = new ArrayList<>();

        if (numberOfScenarios < 1) {
            v.add("numberOfScenarios должно быть >= 1, получено " + numberOfScenarios);
        }
        if (numberOfDays < 1) {
            v.add("numberOfDays должно быть >= 1, получено " + numberOfDays);
        }
        if (numberOfScenarios >= 1 && numberOfDays >= 1) {
            // плотный массив переменных индексируется int
            long operationalVariables = (long) numberOfDays * ModelConstants.HOURS_PER_DAY
                    * ModelConstants.OPERATIONAL_FIELDS_PER_TIMESLOT * numberOfScenarios;
            if (operationalVariables > Integer.MAX_VALUE) {
                v.add("Модель слишком велика: numberOfScenarios * numberOfDays * 24 * "
                        + ModelConstants.OPERATIONAL_FIELDS_PER_TIMESLOT + " = " + operationalVariables
                        + " > " + Integer.MAX_VALUE);
            }
        }
        if (minNumberOfModules < 0) {
            v.add("minNumberOfModules < 0: " + minNumberOfModules);
        }
        if (minNumberOfModules > maxNumberOfModules) {
            v.add("minNumberOfModules > maxNumberOfModules: "
                    + minNumberOfModules + " > " + maxNumberOfModules);
        }
        requireNonNegative(v, "minStorageSizeKwh", minStorageSizeKwh);
        if (minStorageSizeKwh > maxStorageSizeKwh) {
            v.add("minStorageSizeKwh > maxStorageSizeKwh: "
                    + minStorageSizeKwh + " > " + maxStorageSizeKwh);
        }
        requireNonNegative(v, "maxStorageSizeKwh", maxStorageSizeKwh);
        requireNonNegative(v, "maxWattsPerModule", maxWattsPerModule);
        requireNonNegative(v, "areaPerModuleM2", areaPerModuleM2);
        requireNonNegative(v, "pricePerModuleEuro", pricePerModuleEuro);
        requireNonNegative(v, "storagePricePerKwhEuro", storagePricePerKwhEuro);

        if (samplingParameters == null) {
            v.add("samplingParameters не задан");
        } else {
            SamplingParameters sp = samplingParameters;
            requireFinite(v, "solarIrradianceMean", sp.getSolarIrradianceMean());
            requireNonNegative(v, "solarIrradianceStd", sp.getSolarIrradianceStd());
            requireFinite(v, "consumptionMeanW", sp.getConsumptionMeanW());
            requireNonNegative(v, "consumptionStdW", sp.getConsumptionStdW());
            requireFinite(v, "purchasePriceMean", sp.getPurchasePriceMean());
            requireNonNegative(v, "purchasePriceStd", sp.getPurchasePriceStd());
            requireFinite(v, "sellPriceMean", sp.getSellPriceMean());
            requireNonNegative(v, "sellPriceStd", sp.getSellPriceStd());
        }
        return v;
    }

    private static void requireFinite(List<String> v, String name, double value) {
        if (!Double.isFinite(value)) {
            v.add(name + " должно быть конечным числом, получено " + value);
        }
    }

    private static void requireNonNegative(List<String> v, String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            v.add(name + " должно быть конечным и >= 0, получено " + value);
        }
    }

    // --------- сеттеры ---------

    public ProblemConfigurationBuilder setMaxWattsPerModule(double maxWattsPerModule) {
        this.maxWattsPerModule = maxWattsPerModule;
        return this;
    }

    public ProblemConfigurationBuilder setAreaPerModuleM2(double areaPerModuleM2) {
        this.areaPerModuleM2 = areaPerModuleM2;
        return this;
    }

    public ProblemConfigurationBuilder setPricePerModuleEuro(double pricePerModuleEuro) {
        this.pricePerModuleEuro = pricePerModuleEuro;
        return this;
    }

    public ProblemConfigurationBuilder setMinNumberOfModules(int minNumberOfModules) {
        this.minNumberOfModules = minNumberOfModules;
        return this;
    }

    public ProblemConfigurationBuilder setMaxNumberOfModules(int maxNumberOfModules) {
        this.maxNumberOfModules = maxNumberOfModules;
        return this;
    }

    public ProblemConfigurationBuilder setStoragePricePerKwhEuro(double storagePricePerKwhEuro) {
        this.storagePricePerKwhEuro = storagePricePerKwhEuro;
        return this;
    }

    public ProblemConfigurationBuilder setMinStorageSizeKwh(double minStorageSizeKwh) {
        this.minStorageSizeKwh = minStorageSizeKwh;
        return this;
    }

    public ProblemConfigurationBuilder setMaxStorageSizeKwh(double maxStorageSizeKwh) {
        this.maxStorageSizeKwh = maxStorageSizeKwh;
        return this;
    }

    public ProblemConfigurationBuilder setNumberOfScenarios(int numberOfScenarios) {
        this.numberOfScenarios = numberOfScenarios;
        return this;
    }

    public ProblemConfigurationBuilder setNumberOfDays(int numberOfDays) {
        this.numberOfDays = numberOfDays;
        return this;
    }

    public ProblemConfigurationBuilder setSamplingParameters(SamplingParameters samplingParameters) {
        this.samplingParameters = samplingParameters;
        return this;
    }
}
