package storagesizing.config;

/**
 * Параметры нормальных распределений для выборки сценариев (immutable).
 * Нулевое стандартное отклонение даёт постоянный ряд, равный среднему.
 */
public final class SamplingParameters {

    /** Инсоляция, Вт/м2. */
    private final double solarIrradianceMean;
    private final double solarIrradianceStd;

    /** Потребление, Вт. */
    private final double consumptionMeanW;
    private final double consumptionStdW;

    /** Цена покупки, евро/кВт·ч. */
    private final double purchasePriceMean;
    private final double purchasePriceStd;

    /** Цена продажи, евро/кВт·ч. */
    private final double sellPriceMean;
    private final double sellPriceStd;

    public SamplingParameters(double solarIrradianceMean,
                              double solarIrradianceStd,
                              double consumptionMeanW,
                              double consumptionStdW,
                              double purchasePriceMean,
                              double purchasePriceStd,
                              double sellPriceMean,
                              double sellPriceStd) {
        this.solarIrradianceMean = solarIrradianceMean;
        this.solarIrradianceStd = solarIrradianceStd;
        this.consumptionMeanW = consumptionMeanW;
        this.consumptionStdW = consumptionStdW;
        this.purchasePriceMean = purchasePriceMean;
        this.purchasePriceStd = purchasePriceStd;
        this.sellPriceMean = sellPriceMean;
        this.sellPriceStd = sellPriceStd;
    }

    public static SamplingParameters defaults() {
        return new SamplingParameters(
                ModelConstants.SOLAR_IRRADIANCE_MEAN, ModelConstants.SOLAR_IRRADIANCE_STD,
                ModelConstants.CONSUMPTION_MEAN_W, ModelConstants.CONSUMPTION_STD_W,
                ModelConstants.PURCHASE_PRICE_MEAN, ModelConstants.PURCHASE_PRICE_STD,
                ModelConstants.SELL_PRICE_MEAN, ModelConstants.SELL_PRICE_STD
        );
    }

    /**
     * Копия без разброса: все ряды постоянны. Удобно для проверки нормировки по сценариям.
     */
    public SamplingParameters withoutVariance() {
        return new SamplingParameters(
                solarIrradianceMean, 0.0,
                consumptionMeanW, 0.0,
                purchasePriceMean, 0.0,
                sellPriceMean, 0.0
        );
    }

    public SamplingParameters withPriceStd(double purchaseStd, double sellStd) {
        return new SamplingParameters(
                solarIrradianceMean, solarIrradianceStd,
                consumptionMeanW, consumptionStdW,
                purchasePriceMean, purchaseStd,
                sellPriceMean, sellStd
        );
    }

    public double getSolarIrradianceMean()  { return solarIrradianceMean; }
    public double getSolarIrradianceStd()   { return solarIrradianceStd; }
    public double getConsumptionMeanW()     { return consumptionMeanW; }
    public double getConsumptionStdW()      { return consumptionStdW; }
    public double getPurchasePriceMean()    { return purchasePriceMean; }
    public double getPurchasePriceStd()     { return purchasePriceStd; }
    public double getSellPriceMean()        { return sellPriceMean; }
    public double getSellPriceStd()         { return sellPriceStd; }
}
