package com.pagepilot.orchestrator.observe;

/**
 * No element matching a selector became visible and interactable before
 * the wait timed out. Terminal for the action that needed it.
 */
public class ElementNotInteractableException extends RuntimeException {

    public enum Reason { NOT_FOUND, NOT_INTERACTABLE }

    private final String selector;
    private final Reason reason;

    public ElementNotInteractableException(String selector, Reason reason) {
        super((reason == Reason.NOT_FOUND ? "Element not found: " : "Element not interactable: ") + selector);
        this.selector = selector;
        this.reason   = reason;
    }

    public String selector() { return selector; }
    public Reason reason()   { return reason; }
}
