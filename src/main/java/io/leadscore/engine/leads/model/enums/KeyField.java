package io.leadscore.engine.leads.model.enums;

/**
 * Scoring dimension. The key name of {@link #LEAD_DATE} rows is an English month
 * name ("January"), not a literal date.
 */
public enum KeyField {
    SERVICE("service"),
    AD_SET_NAME("adSetName"),
    AD_NAME("adName"),
    LEAD_DATE("leadDate"),
    ZIP("zip");

    private final String key;

    KeyField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static KeyField fromKey(String key) {
        for (KeyField field : values()) {
            if (field.key.equals(key) || field.name().equals(key)) return field;
        }
        throw new IllegalArgumentException("Unknown key field: " + key);
    }
}
