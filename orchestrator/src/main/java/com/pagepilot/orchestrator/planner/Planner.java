package com.pagepilot.orchestrator.planner;

import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;

/**
 * A planning strategy: turns a goal plus a page snapshot into steps.
 *
 * Every planner answers with the same {@link PlanResponse} shape. Planners
 * declared as Spring {@code @Component}s are picked up by
 * {@link PlannerRegistry} under their {@link #name()}.
 */
public interface Planner {

    /** Provider name used in requests, e.g. "rule_based". */
    String name();

    /**
     * @return a plan; an empty step list means no confident plan.
     *         Implementations may instead set {@code error} or throw when
     *         planning itself failed, and the registry will fall back.
     */
    PlanResponse plan(PlanRequest request);

    /** False when the planner is registered but cannot currently serve, e.g. missing credentials. */
    default boolean available() {
        return true;
    }
}
