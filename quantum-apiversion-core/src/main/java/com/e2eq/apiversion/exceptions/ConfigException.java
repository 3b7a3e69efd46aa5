package com.e2eq.apiversion.exceptions;

/**
 * Thrown when the API group configuration is missing or inconsistent.
 * The message always names the offending group by index and name when one is involved.
 */
public class ConfigException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    private final Integer groupIndex;
    private final String groupName;

    public ConfigException(String message) {
        super(message);
        this.groupIndex = null;
        this.groupName = null;
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.groupIndex = null;
        this.groupName = null;
    }

    public ConfigException(int groupIndex, String groupName, String message) {
        super(String.format("groups[%d] (%s): %s", groupIndex,
                groupName == null || groupName.isBlank() ? "<unnamed>" : groupName, message));
        this.groupIndex = groupIndex;
        this.groupName = groupName;
    }

    public Integer getGroupIndex() {
        return groupIndex;
    }

    public String getGroupName() {
        return groupName;
    }
}
