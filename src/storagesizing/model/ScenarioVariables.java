package storagesizing.model;

import storagesizing.solver.DecisionVariable;

/**
 * Плотный контейнер операционных переменных с адресацией (scenario, timeslot, field).
 * Размер ровно scenarioCount * timeslotCount * 6; пустых ячеек после заполнения нет.
 */
public final class ScenarioVariables {

    private final int scenarioCount;
    private final int timeslotCount;
    private final DecisionVariable[] cells;

    ScenarioVariables(int scenarioCount, int timeslotCount) {
        this.scenarioCount = scenarioCount;
        this.timeslotCount = timeslotCount;
        this.cells = new DecisionVariable[Math.multiplyExact(
                Math.multiplyExact(scenarioCount, timeslotCount), OperationalField.COUNT)];
    }

    public DecisionVariable get(int scenario, int timeslot, OperationalField field) {
        DecisionVariable v = cells[index(scenario, timeslot, field)];
        if (v == null) {
            throw new IllegalStateException("Переменная не объявлена: " + name(scenario, timeslot, field));
        }
        return v;
    }

    void set(int scenario, int timeslot, OperationalField field, DecisionVariable variable) {
        int i = index(scenario, timeslot, field);
        if (cells[i] != null) {
            throw new IllegalStateException("Переменная уже объявлена: " + name(scenario, timeslot, field));
        }
        cells[i] = variable;
    }

    public int getScenarioCount() {
        return scenarioCount;
    }

    public int getTimeslotCount() {
        return timeslotCount;
    }

    public int size() {
        return cells.length;
    }

    static String name(int scenario, int timeslot, OperationalField field) {
        return "s" + scenario + "_t" + timeslot + "_" + field.fieldName();
    }

    private int index(int scenario, int timeslot, OperationalField field) {
        if (scenario < 0 || scenario >= scenarioCount) {
            throw new IndexOutOfBoundsException("scenario " + scenario + " вне [0, " + scenarioCount + ")");
        }
        if (timeslot < 0 || timeslot >= timeslotCount) {
            throw new IndexOutOfBoundsException("timeslot " + timeslot + " вне [0, " + timeslotCount + ")");
        }
        return (scenario * timeslotCount + timeslot) * OperationalField.COUNT + field.ordinal();
    }
}
