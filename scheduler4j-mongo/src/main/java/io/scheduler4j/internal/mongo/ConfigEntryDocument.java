package io.scheduler4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Global scheduler setting, keyed by name.
 */
@Document(collection = "scheduler_config")
public class ConfigEntryDocument {

    @Id
    private String key;

    private String value;

    public ConfigEntryDocument() {
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
