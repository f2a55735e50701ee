package com.editflow.orchestrator.actuator;

public record RollbackResult(boolean ok, String error) {

    public static RollbackResult success() {
        return new RollbackResult(true, null);
    }

    public static RollbackResult failure(String error) {
        return new RollbackResult(false, error);
    }
}
