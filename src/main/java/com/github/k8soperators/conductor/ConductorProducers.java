package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.config.Environment;
import com.github.k8soperators.conductor.config.PreflightValidator;
import com.github.k8soperators.conductor.retry.FailureKind;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import com.github.k8soperators.conductor.secrets.JdkVaultTransport;
import com.github.k8soperators.conductor.secrets.SecretsEngineClient;
import com.github.k8soperators.conductor.secrets.VaultHttpClient;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.enterprise.inject.Disposes;
import javax.enterprise.inject.Produces;
import javax.inject.Singleton;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class ConductorProducers {

    private static final Logger log = Logger.getLogger(ConductorProducers.class);

    @Produces
    @Singleton
    Environment environment(Config config) {
        return Environment.fromConfig(config);
    }

    @Produces
    @Singleton
    ExecutorService applyWorkers(@ConfigProperty(name = "conductor.apply-parallelism", defaultValue = "4") int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "conductor-apply-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.debugf("Applying resources with %d worker(s)", parallelism);
        return Executors.newFixedThreadPool(Math.max(1, parallelism), threads);
    }

    void shutdown(@Disposes ExecutorService workers) {
        workers.shutdownNow();
    }

    /**
     * Created on first use only, so plans without a secrets bootstrap phase never need Vault credentials.
     */
    @Produces
    @ApplicationScoped
    SecretsEngineClient secretsEngine(Environment environment,
            @ConfigProperty(name = "conductor.vault.request-timeout", defaultValue = "30S") Duration requestTimeout) {
        String address = environment.get(PreflightValidator.VAULT_ADDR)
                .orElseThrow(() -> new OrchestrationException(FailureKind.FATAL, PreflightValidator.VAULT_ADDR + " is not set"));
        String token = environment.get(PreflightValidator.VAULT_TOKEN)
                .orElseThrow(() -> new OrchestrationException(FailureKind.FATAL, PreflightValidator.VAULT_TOKEN + " is not set"));

        log.infof("Secrets engine at %s", address);
        return new VaultHttpClient(new JdkVaultTransport(address, token, requestTimeout));
    }
}
