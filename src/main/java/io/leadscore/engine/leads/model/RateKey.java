package io.leadscore.engine.leads.model;

import io.leadscore.engine.leads.model.enums.KeyField;

public record RateKey(KeyField keyField, String keyName) {
}
