package storagesizing.sampling;

import java.util.Arrays;

/**
 * Экзогенные ряды одного сценария (immutable).
 * Все ряды имеют длину timeslotCount.
 */
public final class ScenarioProfile {

    private final int scenarioIndex;

    /** Выработка одного модуля за час, Вт (уже с учётом площади и ограничения мощности). */
    private final double[] solarWattsPerModule;

    /** Потребление за час, Вт. */
    private final double[] consumptionW;

    /** Цена покупки, евро/кВт·ч. */
    private final double[] purchasePricePerKwh;

    /** Цена продажи, евро/кВт·ч. */
    private final double[] sellPricePerKwh;

    public ScenarioProfile(int scenarioIndex,
                           double[] solarWattsPerModule,
                           double[] consumptionW,
                           double[] purchasePricePerKwh,
                           double[] sellPricePerKwh) {
        int n = solarWattsPerModule.length;
        if (consumptionW.length != n || purchasePricePerKwh.length != n || sellPricePerKwh.length != n) {
            throw new IllegalArgumentException(
                    "Ряды сценария " + scenarioIndex + " разной длины: солнце " + n
                            + ", потребление " + consumptionW.length
                            + ", покупка " + purchasePricePerKwh.length
                            + ", продажа " + sellPricePerKwh.length);
        }
        this.scenarioIndex = scenarioIndex;
        this.solarWattsPerModule = solarWattsPerModule.clone();
        this.consumptionW = consumptionW.clone();
        this.purchasePricePerKwh = purchasePricePerKwh.clone();
        this.sellPricePerKwh = sellPricePerKwh.clone();
    }

    public int getScenarioIndex() {
        return scenarioIndex;
    }

    public int getTimeslotCount() {
        return solarWattsPerModule.length;
    }

    public double solarWattsPerModule(int t)   { return solarWattsPerModule[t]; }
    public double consumptionW(int t)          { return consumptionW[t]; }
    public double purchasePricePerKwh(int t)   { return purchasePricePerKwh[t]; }
    public double sellPricePerKwh(int t)       { return sellPricePerKwh[t]; }

    public double[] getSolarWattsPerModule()  { return solarWattsPerModule.clone(); }
    public double[] getConsumptionW()         { return consumptionW.clone(); }
    public double[] getPurchasePricePerKwh()  { return purchasePricePerKwh.clone(); }
    public double[] getSellPricePerKwh()      { return sellPricePerKwh.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScenarioProfile other)) return false;
        return scenarioIndex == other.scenarioIndex
                && Arrays.equals(solarWattsPerModule, other.solarWattsPerModule)
                && Arrays.equals(consumptionW, other.consumptionW)
                && Arrays.equals(purchasePricePerKwh, other.purchasePricePerKwh)
                && Arrays.equals(sellPricePerKwh, other.sellPricePerKwh);
    }

    @Override
    public int hashCode() {
        int h = Integer.hashCode(scenarioIndex);
        h = 31 * h + Arrays.hashCode(solarWattsPerModule);
        h = 31 * h + Arrays.hashCode(consumptionW);
        h = 31 * h + Arrays.hashCode(purchasePricePerKwh);
        h = 31 * h + Arrays.hashCode(sellPricePerKwh);
        return h;
    }
}
