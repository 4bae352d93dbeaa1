package com.pagepilot.orchestrator.planner;

public class PlannerNotFoundException extends RuntimeException {
    public PlannerNotFoundException(String name) {
        super("Unknown provider: '" + name + "'");
    }
}
