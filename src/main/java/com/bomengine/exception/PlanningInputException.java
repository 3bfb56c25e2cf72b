package com.bomengine.exception;

public class PlanningInputException extends BomEngineException {
    public PlanningInputException(String message) {
        super("PLANNING_INPUT_ERROR", message);
    }
}
