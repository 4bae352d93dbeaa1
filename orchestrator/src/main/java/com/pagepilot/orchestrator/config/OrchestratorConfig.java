package com.pagepilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.orchestrator.browser.BrowserProperties;
import com.pagepilot.orchestrator.browser.DocumentDriver;
import com.pagepilot.orchestrator.browser.PlaywrightDocumentDriver;
import com.pagepilot.orchestrator.client.HttpPlanningBackend;
import com.pagepilot.orchestrator.client.LocalPlanningBackend;
import com.pagepilot.orchestrator.client.PlanningBackend;
import com.pagepilot.orchestrator.client.PlanningClientProperties;
import com.pagepilot.orchestrator.execution.Actuator;
import com.pagepilot.orchestrator.execution.DocumentActuator;
import com.pagepilot.orchestrator.observe.InteractableWaiter;
import com.pagepilot.orchestrator.observe.ObservationCollector;
import com.pagepilot.orchestrator.observe.ObservationProperties;
import com.pagepilot.orchestrator.planner.PlannerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the document side (driver → collector / waiter → actuator) and picks
 * the planning backend from {@code pagepilot.planning.mode}.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // The browser itself starts lazily on first use.
    @Bean(destroyMethod = "close")
    public PlaywrightDocumentDriver documentDriver(BrowserProperties props, ObjectMapper objectMapper) {
        return new PlaywrightDocumentDriver(props, objectMapper);
    }

    @Bean
    public ObservationCollector observationCollector(DocumentDriver driver, ObservationProperties props) {
        return new ObservationCollector(driver, props);
    }

    @Bean
    public InteractableWaiter interactableWaiter(DocumentDriver driver, ObservationProperties props, Clock clock) {
        return new InteractableWaiter(driver, props, clock);
    }

    @Bean
    public Actuator actuator(DocumentDriver driver, ObservationCollector collector, InteractableWaiter waiter) {
        return new DocumentActuator(driver, collector, waiter);
    }

    @Bean
    public PlanningBackend planningBackend(PlanningClientProperties props,
                                           PlannerRegistry planners,
                                           ObjectMapper objectMapper,
                                           @Value("${pagepilot.version:0.2.0}") String version) {
        if (props.mode() == PlanningClientProperties.Mode.REMOTE) {
            log.info("Planning backend: remote at {}", props.baseUrl());
            return new HttpPlanningBackend(props.baseUrl(), objectMapper);
        }
        log.info("Planning backend: in-process planners {}", planners.providers());
        return new LocalPlanningBackend(planners, version);
    }
}
