package storagesizing.config;

import java.util.List;

/**
 * Ошибка конфигурации задачи: нарушены границы, горизонт или параметры распределений.
 * Бросается до объявления переменных модели.
 */
public class ConfigurationException extends IllegalArgumentException {

    private final List<String> violations;

    public ConfigurationException(String message) {
        this(List.of(message));
    }

    public ConfigurationException(List<String> violations) {
        super("Некорректная конфигурация: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
