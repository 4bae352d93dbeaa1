package com.pagepilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One atomic action of a plan.
 *
 * Wire shape: {@code {tool, selector?, text?, deltaY?, url?, note?}}. The
 * {@code tool} tag selects the concrete record; a missing or unknown tag, or a
 * missing required field, fails deserialisation so a malformed plan can never
 * be loaded.
 *
 * Dispatch goes through {@link StepVisitor}, so adding a tool is a compile
 * error at every executor until it is handled.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "tool")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClickStep.class,    name = "CLICK"),
        @JsonSubTypes.Type(value = TypeStep.class,     name = "TYPE"),
        @JsonSubTypes.Type(value = ScrollStep.class,   name = "SCROLL"),
        @JsonSubTypes.Type(value = NavigateStep.class, name = "NAVIGATE")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Step permits ClickStep, TypeStep, ScrollStep, NavigateStep {

    Tool tool();

    /** Optional human-readable explanation; may be null. */
    String note();

    <R> R accept(StepVisitor<R> visitor);

    /** Target selector for element-bound steps, null otherwise. */
    default String targetSelector() {
        return null;
    }

    static String requireText(String value, Tool tool, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(tool + " step requires a non-empty " + field);
        }
        return value;
    }
}
