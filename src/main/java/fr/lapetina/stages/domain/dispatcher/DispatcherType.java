package fr.lapetina.stages.domain.dispatcher;

/**
 * The closed set of dispatcher strategies a producing stage can use.
 */
public enum DispatcherType {
    DEMAND("demand"),
    BROADCAST("broadcast"),
    PARTITION("partition");

    private final String configName;

    DispatcherType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configuration name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DispatcherType fromName(String name) {
        for (DispatcherType type : values()) {
            if (type.configName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown dispatcher type: " + name);
    }
}
