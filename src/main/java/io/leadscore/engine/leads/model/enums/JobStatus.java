package io.leadscore.engine.leads.model.enums;

public enum JobStatus {
    STARTED,
    SUCCESS,
    FAILURE
}
