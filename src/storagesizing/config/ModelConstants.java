// File: storagesizing/config/ModelConstants.java
package storagesizing.config;

/**
 * Глобальные константы модели.
 * Все коэффициенты пересчёта единиц должны находиться здесь.
 */
public final class ModelConstants {

    /** Погрешность вычислений */
    public static final double EPSILON = 1e-6;

    /** Допуск при проверке решения солвера (Вт·ч) */
    public static final double SOLVER_TOLERANCE_WH = 1e-3;

    /** Часов в сутках: один таймслот = один час */
    public static final int HOURS_PER_DAY = 24;

    /**
     * Пересчёт кВт·ч -> Вт·ч.
     * Конфигурация и цены заданы в кВт·ч, операционные переменные модели - в Вт·ч.
     */
    public static final double WH_PER_KWH = 1000.0;

    /** Операционных переменных на пару (сценарий, таймслот); совпадает с OperationalField.COUNT */
    public static final int OPERATIONAL_FIELDS_PER_TIMESLOT = 6;

    /** Шаг seed между сценариями: профиль сценария k зависит только от (baseSeed, k) */
    public static final long SCENARIO_SEED_STRIDE = 10_000L;

    // =========================================================================
    // ===========================    ВЫБОРКА  =================================
    // =========================================================================

    /** Солнечная инсоляция, Вт/м2 */
    public static final double SOLAR_IRRADIANCE_MEAN = 500.0;
    public static final double SOLAR_IRRADIANCE_STD = 200.0;

    /** Потребление, Вт */
    public static final double CONSUMPTION_MEAN_W = 10_000.0;
    public static final double CONSUMPTION_STD_W = 2_000.0;

    /** Цена покупки энергии из сети, евро/кВт·ч */
    public static final double PURCHASE_PRICE_MEAN = 0.50;
    public static final double PURCHASE_PRICE_STD = 0.0;

    /** Цена продажи энергии в сеть, евро/кВт·ч */
    public static final double SELL_PRICE_MEAN = 0.12;
    public static final double SELL_PRICE_STD = 0.0;

    // =========================================================================
    // ===========================    СОЛВЕР  ==================================
    // =========================================================================

    public static final String DEFAULT_SOLVER_ID = "SCIP";
    public static final long DEFAULT_BASE_SEED = 1_000_000L;
    public static final String DEFAULT_LP_EXPORT_PATH = "model.lp";

    private ModelConstants() {}
}
