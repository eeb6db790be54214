package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.config.Environment;
import com.github.k8soperators.conductor.config.PhasePlanLoader;
import com.github.k8soperators.conductor.config.PreflightValidator;
import com.github.k8soperators.conductor.graph.DependencyGraphBuilder;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.model.Phase;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Validation pass shared by every command: plan parsing, graph construction and pre-flight checks, all before the
 * first platform call.
 */
@ApplicationScoped
public class PlanService {

    private final PhasePlanLoader loader;
    private final DependencyGraphBuilder graphBuilder;
    private final PreflightValidator preflight;
    private final String defaultPlanPath;

    @Inject
    public PlanService(PhasePlanLoader loader,
            DependencyGraphBuilder graphBuilder,
            Environment environment,
            @ConfigProperty(name = "conductor.plan-path", defaultValue = "platform-plan.yaml") String defaultPlanPath) {
        this.loader = loader;
        this.graphBuilder = graphBuilder;
        this.preflight = new PreflightValidator(environment);
        this.defaultPlanPath = defaultPlanPath;
    }

    public PhaseGraph prepare(Path planOverride, boolean secretsEngineUsed) throws ConfigurationException {
        Path plan = planOverride != null ? planOverride : Paths.get(defaultPlanPath);
        List<Phase> phases = loader.load(plan);
        PhaseGraph graph = graphBuilder.build(phases);
        preflight.validate(phases, secretsEngineUsed);
        return graph;
    }
}
