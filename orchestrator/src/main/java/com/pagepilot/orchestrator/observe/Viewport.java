package com.pagepilot.orchestrator.observe;

public record Viewport(double width, double height) {}
