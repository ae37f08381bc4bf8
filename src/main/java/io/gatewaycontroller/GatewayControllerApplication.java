package io.gatewaycontroller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.Client;
import io.gatewaycontroller.config.GatewayControllerConfig;
import io.gatewaycontroller.metrics.GatewayMetrics;
import io.gatewaycontroller.queue.ChangeQueue;
import io.gatewaycontroller.queue.ExponentialBackoffRateLimiter;
import io.gatewaycontroller.queue.RateLimitingChangeQueue;
import io.gatewaycontroller.reconcile.GatewayStatusParser;
import io.gatewaycontroller.reconcile.GatewayStatusReconciler;
import io.gatewaycontroller.reconcile.LastKnownStateCache;
import io.gatewaycontroller.store.EtcdPathResolver;
import io.gatewaycontroller.table.GatewayStatusTable;
import io.gatewaycontroller.watch.EtcdWatchSource;
import io.gatewaycontroller.watch.WatchSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

/**
 * Main Spring Boot application class for the Gateway Status Controller.
 *
 * Watches mesh gateway status objects in etcd and keeps an in-memory table of which
 * remote clusters are reachable through the active gateway. Service discovery reads the
 * table through {@link io.gatewaycontroller.table.ClusterReachability}; a read-only REST
 * view is exposed for operators.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.gatewaycontroller")
public class GatewayControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Gateway Status Controller Application");

        try {
            SpringApplication.run(GatewayControllerApplication.class, args);
            log.info("Gateway Status Controller started successfully");

        } catch (Exception e) {
            log.error("Failed to start Gateway Status Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public GatewayControllerConfig config() {
        GatewayControllerConfig config = new GatewayControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    /**
     * etcd client shared by every component that talks to etcd.
     */
    @Bean(destroyMethod = "close")
    public Client etcdClient(GatewayControllerConfig config) {
        log.info("Connecting to etcd at {}", String.join(",", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public EtcdPathResolver etcdPathResolver(GatewayControllerConfig config) {
        return new EtcdPathResolver(config.getGatewayRootPath());
    }

    @Bean
    public WatchSource gatewayWatchSource(Client etcdClient,
                                          EtcdPathResolver pathResolver,
                                          ObjectMapper objectMapper,
                                          GatewayControllerConfig config) {
        log.info("Initializing etcd watch source for gateway status objects");
        return new EtcdWatchSource(etcdClient, pathResolver, objectMapper, config.getResyncPeriod());
    }

    @Bean
    public ChangeQueue<String> gatewayChangeQueue(GatewayControllerConfig config) {
        return new RateLimitingChangeQueue<>("gateway-status",
            new ExponentialBackoffRateLimiter<>(config.getQueueBaseDelay(), config.getQueueMaxDelay()));
    }

    /**
     * The published reachability table; also the bean service discovery depends on.
     */
    @Bean
    @Primary
    public GatewayStatusTable gatewayStatusTable() {
        return new GatewayStatusTable();
    }

    @Bean
    public GatewayStatusReconciler gatewayStatusReconciler(GatewayStatusTable table,
                                                           GatewayControllerConfig config,
                                                           GatewayMetrics metrics) {
        return new GatewayStatusReconciler(table, new GatewayStatusParser(), config.getAbsentClusterPolicy(), metrics);
    }

    /**
     * Started here so that a failed initial listing aborts application startup.
     */
    @Bean(destroyMethod = "stop")
    public GatewayStatusController gatewayStatusController(WatchSource watchSource,
                                                           ChangeQueue<String> queue,
                                                           GatewayStatusReconciler reconciler,
                                                           GatewayStatusTable table,
                                                           GatewayMetrics metrics) {
        GatewayStatusController controller = new GatewayStatusController(
            watchSource, queue, reconciler, table, new LastKnownStateCache(), metrics);
        try {
            controller.start();
            log.info("GatewayStatusController started");
            return controller;
        } catch (Exception e) {
            log.error("Failed to start GatewayStatusController: {}", e.getMessage(), e);
            throw new RuntimeException("GatewayStatusController startup failed", e);
        }
    }
}
