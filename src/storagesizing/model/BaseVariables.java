package storagesizing.model;

import storagesizing.solver.DecisionVariable;

/**
 * Инвестиционные переменные первого этапа. Общие для всех сценариев, только чтение.
 */
public record BaseVariables(DecisionVariable numberOfModules, DecisionVariable sizeOfStorageKwh) {

    public static final String NUMBER_OF_MODULES = "numberOfModules";
    public static final String SIZE_OF_STORAGE_KWH = "sizeOfStorageInKwh";
}
