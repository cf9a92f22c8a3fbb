package storagesizing.sampling;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import storagesizing.config.ModelConstants;
import storagesizing.config.ProblemConfiguration;
import storagesizing.config.SamplingParameters;

/**
 * Генерация профилей сценариев.
 * <p>
 * Каждый сценарий получает СВОЙ генератор с seed = baseSeed + k * stride,
 * поэтому профиль сценария k не зависит ни от числа сценариев, ни от порядка вызовов.
 * Порядок выборки внутри сценария: солнце, потребление, цена покупки, цена продажи.
 */
public final class ScenarioSampler {

    private final ProblemConfiguration configuration;
    private final long baseSeed;

    public ScenarioSampler(ProblemConfiguration configuration, long baseSeed) {
        this.configuration = configuration;
        this.baseSeed = baseSeed;
    }

    public ScenarioProfile sample(int scenarioIndex) {
        if (scenarioIndex < 0) {
            throw new IllegalArgumentException("scenarioIndex < 0: " + scenarioIndex);
        }
        final int n = configuration.getTimeslotCount();
        final SamplingParameters sp = configuration.getSamplingParameters();
        final RandomGenerator rng = new Well19937c(seedFor(baseSeed, scenarioIndex));

        // инсоляция Вт/м2 -> Вт на модуль, не больше паспортной мощности
        double[] solar = NormalSeries.sample(rng, "solar",
                sp.getSolarIrradianceMean(), sp.getSolarIrradianceStd(), n);
        NormalSeries.clipBelow(solar, 0.0);
        NormalSeries.scale(solar, configuration.getAreaPerModuleM2());
        NormalSeries.clipAbove(solar, configuration.getMaxWattsPerModule());

        double[] consumption = NormalSeries.sample(rng, "consumption",
                sp.getConsumptionMeanW(), sp.getConsumptionStdW(), n);
        NormalSeries.clipBelow(consumption, 0.0);

        double[] purchase = NormalSeries.sample(rng, "purchasePrice",
                sp.getPurchasePriceMean(), sp.getPurchasePriceStd(), n);
        double[] sell = NormalSeries.sample(rng, "sellPrice",
                sp.getSellPriceMean(), sp.getSellPriceStd(), n);

        return new ScenarioProfile(scenarioIndex, solar, consumption, purchase, sell);
    }

    static long seedFor(long baseSeed, int scenarioIndex) {
        return baseSeed + (long) scenarioIndex * ModelConstants.SCENARIO_SEED_STRIDE;
    }
}
