package com.github.k8soperators.conductor.graph;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.model.Phase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    @Test
    void ordersEveryPhaseAfterItsDependencies() throws ConfigurationException {
        PhaseGraph graph = builder.build(List.of(
                Phase.builder("apps").dependsOn("secrets", "storage").build(),
                Phase.builder("secrets").dependsOn("vault").build(),
                Phase.builder("storage").dependsOn("namespaces").build(),
                Phase.builder("vault").dependsOn("namespaces").build(),
                Phase.builder("namespaces").build()));

        List<String> order = names(graph.order());

        for (Phase phase : graph.order()) {
            for (String dependency : phase.getDependsOn()) {
                assertThat(order.indexOf(dependency)).isLessThan(order.indexOf(phase.getName()));
            }
        }
        assertThat(order).hasSize(5).first().isEqualTo("namespaces");
    }

    @Test
    void breaksTiesByDeclarationOrder() throws ConfigurationException {
        PhaseGraph graph = builder.build(List.of(
                Phase.builder("a").build(),
                Phase.builder("c").dependsOn("a").build(),
                Phase.builder("b").dependsOn("a").build(),
                Phase.builder("d").build()));

        assertThat(names(graph.order())).containsExactly("a", "c", "b", "d");
        assertThat(names(graph.reverseOrder())).containsExactly("d", "b", "c", "a");
    }

    @Test
    void rejectsCycleNamingItsMembers() {
        List<Phase> phases = List.of(
                Phase.builder("root").build(),
                Phase.builder("a").dependsOn("root", "c").build(),
                Phase.builder("b").dependsOn("a").build(),
                Phase.builder("c").dependsOn("b").build());

        assertThatThrownBy(() -> builder.build(phases))
                .isInstanceOf(CycleDetectedException.class)
                .hasMessageContaining("Dependency cycle detected")
                .satisfies(e -> assertThat(((CycleDetectedException) e).getCycle())
                        .contains("a", "b", "c")
                        .doesNotContain("root"));
    }

    @Test
    void rejectsSelfDependency() {
        assertThatThrownBy(() -> builder.build(List.of(Phase.builder("loop").dependsOn("loop").build())))
                .isInstanceOf(CycleDetectedException.class)
                .hasMessageContaining("loop -> loop");
    }

    @Test
    void rejectsUnknownDependencyNamingPhaseAndField() {
        assertThatThrownBy(() -> builder.build(List.of(Phase.builder("apps").dependsOn("missing").build())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Phase 'apps'")
                .hasMessageContaining("dependsOn")
                .hasMessageContaining("'missing'");
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> builder.build(List.of(Phase.builder("a").build(), Phase.builder("a").build())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("declared more than once");
    }

    @Test
    void tracksTransitiveDependents() throws ConfigurationException {
        PhaseGraph graph = builder.build(List.of(
                Phase.builder("a").build(),
                Phase.builder("b").dependsOn("a").build(),
                Phase.builder("c").dependsOn("b").build(),
                Phase.builder("d").build()));

        assertThat(graph.directDependents("a")).containsExactly("b");
        assertThat(graph.transitiveDependents("a")).containsExactly("b", "c");
        assertThat(graph.transitiveDependents("d")).isEmpty();
    }

    static List<String> names(List<Phase> phases) {
        return phases.stream().map(Phase::getName).collect(Collectors.toList());
    }
}
