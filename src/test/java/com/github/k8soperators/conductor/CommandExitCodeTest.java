package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.config.Environment;
import com.github.k8soperators.conductor.config.PhasePlanLoader;
import com.github.k8soperators.conductor.config.PreflightValidator;
import com.github.k8soperators.conductor.graph.DependencyGraphBuilder;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.retry.FailureKind;
import com.github.k8soperators.conductor.support.Harness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CommandExitCodeTest {

    @TempDir
    Path directory;

    private final Harness harness = new Harness();
    private final Map<String, String> variables = new HashMap<>(Map.of(PreflightValidator.KUBERNETES_SERVICE_HOST, "10.96.0.1"));
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private Path plan;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(directory.resolve("manifests"));
        Files.writeString(directory.resolve("manifests/namespaces.yaml"),
                "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: namespaces\n  namespace: platform\n");
        Files.writeString(directory.resolve("manifests/storage.yaml"),
                "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: storage\n  namespace: kyuubi\n");
        plan = write("plan.yaml", ""
                + "phases:\n"
                + "  - name: namespaces\n"
                + "    resources: [manifests/namespaces.yaml]\n"
                + "    healthChecks: [{ kind: ConfigMap, namespace: platform, name: namespaces }]\n"
                + "  - name: object-storage\n"
                + "    dependsOn: [namespaces]\n"
                + "    resources: [manifests/storage.yaml]\n");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void deploySucceedsWithZero() {
        int exit = execute(new DeployCommand(plans(), harness.orchestrator, harness.reconciler, harness.cancellation),
                "--plan", plan.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("namespaces").contains("SUCCEEDED").contains("1/1");
        assertThat(harness.platform.find(new ResourceRef("v1", "ConfigMap", "kyuubi", "storage"))).isPresent();
    }

    @Test
    void fatalPhaseExitsWithOne() {
        harness.platform.failAlways("create", new ResourceRef("v1", "ConfigMap", "platform", "namespaces"), FailureKind.FATAL, 1);

        int exit = execute(new DeployCommand(plans(), harness.orchestrator, harness.reconciler, harness.cancellation),
                "--plan", plan.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(out.toString()).contains("FATAL").contains("SKIPPED");
    }

    @Test
    void invalidPlanExitsWithTwoBeforeAnyPlatformCall() throws IOException {
        Path cyclic = write("cyclic.yaml", ""
                + "phases:\n"
                + "  - { name: a, dependsOn: [b], resources: [] }\n"
                + "  - { name: b, dependsOn: [a], resources: [] }\n");

        int exit = execute(new DeployCommand(plans(), harness.orchestrator, harness.reconciler, harness.cancellation),
                "--plan", cyclic.toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).startsWith("Invalid configuration: ").contains("a -> b -> a");
        assertThat(harness.platform.calls()).isEmpty();
    }

    @Test
    void missingSecretsEngineCredentialsExitWithTwo() throws IOException {
        Path secrets = write("secrets.yaml", ""
                + "phases:\n"
                + "  - name: vault-bootstrap\n"
                + "    secretsBootstrap:\n"
                + "      kvMounts: [secret]\n");

        int exit = execute(new DeployCommand(plans(), harness.orchestrator, harness.reconciler, harness.cancellation),
                "--plan", secrets.toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("VAULT_ADDR is not set").contains("VAULT_TOKEN is not set");
        assertThat(harness.platform.calls()).isEmpty();
    }

    @Test
    void statusExitsWithOneOnlyWhenAPhaseIsFatal() throws IOException {
        execute(new DeployCommand(plans(), harness.orchestrator, harness.reconciler, harness.cancellation), "--plan", plan.toString());

        assertThat(execute(new StatusCommand(plans(), harness.inspector), "--plan", plan.toString())).isZero();

        Path gated = write("gated.yaml", ""
                + "phases:\n"
                + "  - name: namespaces\n"
                + "    resources: [manifests/namespaces.yaml]\n"
                + "    healthChecks: [{ kind: Deployment, namespace: platform, name: minio, condition: WORKLOAD_AVAILABLE }]\n");
        out.getBuffer().setLength(0);

        assertThat(execute(new StatusCommand(plans(), harness.inspector), "--plan", gated.toString())).isEqualTo(1);
        assertThat(out.toString()).contains("FATAL").contains("Deployment{namespace=platform, name=minio} WORKLOAD_AVAILABLE: not found");
    }

    @Test
    void cleanupIsRepeatable() {
        execute(new DeployCommand(plans(), harness.orchestrator, harness.reconciler, harness.cancellation), "--plan", plan.toString());

        assertThat(execute(new CleanupCommand(plans(), harness.teardown), "--plan", plan.toString())).isZero();
        assertThat(execute(new CleanupCommand(plans(), harness.teardown), "--plan", plan.toString())).isZero();
        assertThat(harness.platform.size()).isZero();
        assertThat(out.toString()).contains("Teardown: deleted=0, absent=2, failed=0");
    }

    @Test
    void reconcileExitsWithZeroEvenWhenItFails() {
        harness.platform.failAlways("get", new ResourceRef("v1", "ConfigMap", "platform", "namespaces"), FailureKind.FATAL, 1);

        int exit = execute(new ReconcileCommand(plans(), harness.reconciler), "--plan", plan.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("failed=1");
    }

    private PlanService plans() {
        Environment environment = new Environment(variables, directory);
        return new PlanService(new PhasePlanLoader(environment), new DependencyGraphBuilder(), environment, plan.toString());
    }

    private int execute(Object command, String... args) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = directory.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
