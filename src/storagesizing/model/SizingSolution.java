package storagesizing.model;

import storagesizing.solver.SolveStatus;

/**
 * Снимок решения (immutable). Значения операционных переменных в Вт·ч.
 */
public final class SizingSolution {

    /** Статус решения: OPTIMAL или FEASIBLE. */
    public final SolveStatus status;

    /** Значение целевой функции, евро. */
    public final double objectiveValue;

    /** Выбранное количество модулей. */
    public final int numberOfModules;

    /** Выбранная ёмкость накопителя, кВт·ч. */
    public final double sizeOfStorageKwh;

    /** Инвестиции первого этапа, евро. */
    public final double investmentCost;

    /** Средняя по сценариям стоимость второго этапа, евро. */
    public final double expectedRecourseCost;

    /** Стоимость второго этапа по каждому сценарию, евро. */
    private final double[] scenarioRecourseCosts;

    private final int scenarioCount;
    private final int timeslotCount;

    /** Плотный массив в порядке ScenarioVariables. */
    private final double[] operationalValues;

    SizingSolution(SolveStatus status,
                   double objectiveValue,
                   int numberOfModules,
                   double sizeOfStorageKwh,
                   double investmentCost,
                   double expectedRecourseCost,
                   double[] scenarioRecourseCosts,
                   int scenarioCount,
                   int timeslotCount,
                   double[] operationalValues) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.numberOfModules = numberOfModules;
        this.sizeOfStorageKwh = sizeOfStorageKwh;
        this.investmentCost = investmentCost;
        this.expectedRecourseCost = expectedRecourseCost;
        this.scenarioRecourseCosts = scenarioRecourseCosts;
        this.scenarioCount = scenarioCount;
        this.timeslotCount = timeslotCount;
        this.operationalValues = operationalValues;
    }

    public boolean isProvenOptimal() {
        return status == SolveStatus.OPTIMAL;
    }

    public int getScenarioCount() {
        return scenarioCount;
    }

    public int getTimeslotCount() {
        return timeslotCount;
    }

    public double scenarioRecourseCost(int scenario) {
        return scenarioRecourseCosts[scenario];
    }

    public double value(int scenario, int timeslot, OperationalField field) {
        if (scenario < 0 || scenario >= scenarioCount || timeslot < 0 || timeslot >= timeslotCount) {
            throw new IndexOutOfBoundsException("(" + scenario + ", " + timeslot + ") вне решения "
                    + scenarioCount + "x" + timeslotCount);
        }
        return operationalValues[(scenario * timeslotCount + timeslot) * OperationalField.COUNT + field.ordinal()];
    }
}
