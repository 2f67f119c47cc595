package io.taskrelay.spring;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "taskrelay.store")
public class RelayStoreProperties {

    public enum StoreType {
        MEMORY,
        JDBC
    }

    @NotNull
    private StoreType type = StoreType.MEMORY;
    private boolean initializeSchema = true;

    public StoreType getType() {
        return type;
    }

    public void setType(StoreType type) {
        this.type = type;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }
}
