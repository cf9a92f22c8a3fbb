package storagesizing.model;

/**
 * Шесть операционных переменных на пару (сценарий, таймслот). Все в Вт·ч.
 */
public enum OperationalField {
    STORAGE_LEVEL("storageLevel"),
    STORAGE_ENERGY_DELTA("storageEnergyDelta"),
    PRODUCED_ENERGY("producedEnergy"),
    CONSUMED_ENERGY("consumedEnergy"),
    BOUGHT_ENERGY("boughtEnergy"),
    SOLD_ENERGY("soldEnergy");

    public static final int COUNT = values().length;

    private final String fieldName;

    OperationalField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
