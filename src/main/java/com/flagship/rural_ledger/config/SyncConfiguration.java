package com.flagship.rural_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.rural_ledger.auth.AppUserService;
import com.flagship.rural_ledger.ledger.LedgerStore;
import com.flagship.rural_ledger.observability.HealthIndicators;
import com.flagship.rural_ledger.observability.SyncMetrics;
import com.flagship.rural_ledger.realtime.BoundedChangeDispatcher;
import com.flagship.rural_ledger.realtime.ChangeDispatcher;
import com.flagship.rural_ledger.realtime.ChangeFeedTransport;
import com.flagship.rural_ledger.realtime.DetachedChangeDispatcher;
import com.flagship.rural_ledger.realtime.PhoenixChangeFeedTransport;
import com.flagship.rural_ledger.realtime.RealtimeChannel;
import com.flagship.rural_ledger.realtime.RealtimeLedgerMirror;
import com.flagship.rural_ledger.remote.RemoteLedgerGateway;
import com.flagship.rural_ledger.sync.PostgrestRemoteSession;
import com.flagship.rural_ledger.sync.RemoteSessionFactory;
import com.flagship.rural_ledger.sync.SyncBridge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Duration;

/**
 * Remote side of the application: the sync bridge with its session, the
 * change feed and the services that run on the bridge.
 *
 * Nothing here touches the network at startup; the session is created by
 * the first submitted operation.
 */
@Configuration
@Slf4j
public class SyncConfiguration {

    @Bean
    public SyncMetrics syncMetrics(MeterRegistry meterRegistry) {
        return new SyncMetrics(meterRegistry);
    }

    @Bean
    public RemoteSessionFactory remoteSessionFactory(RestTemplateBuilder restTemplateBuilder,
                                                     RemoteProperties properties) {
        return () -> new PostgrestRemoteSession(
            restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build(),
            properties.getUrl(), properties.getKey());
    }

    @Bean(destroyMethod = "shutdown")
    public SyncBridge syncBridge(RemoteSessionFactory sessionFactory, SyncMetrics metrics,
                                 RemoteProperties properties) {
        return new SyncBridge(sessionFactory, metrics, properties.getShutdownTimeout());
    }

    @Bean("syncBridgeHealth")
    public HealthIndicators.SyncBridgeHealthIndicator syncBridgeHealthIndicator(SyncBridge bridge) {
        return new HealthIndicators.SyncBridgeHealthIndicator(bridge);
    }

    @Bean
    public ChangeFeedTransport changeFeedTransport(SyncBridge bridge, ObjectMapper objectMapper,
                                                   RemoteProperties properties) {
        return new PhoenixChangeFeedTransport(new StandardWebSocketClient(), bridge, objectMapper,
            properties.getUrl(), properties.getKey());
    }

    @Bean(destroyMethod = "close")
    public ChangeDispatcher changeDispatcher(RealtimeProperties properties, SyncMetrics metrics) {
        if (properties.getDispatch() == RealtimeProperties.DispatchMode.BOUNDED) {
            return new BoundedChangeDispatcher(properties.getPoolSize(), properties.getQueueCapacity(), metrics);
        }
        return new DetachedChangeDispatcher();
    }

    @Bean
    public RealtimeChannel realtimeChannel(SyncBridge bridge, ChangeFeedTransport transport,
                                           ChangeDispatcher dispatcher, SyncMetrics metrics,
                                           RemoteProperties properties) {
        return new RealtimeChannel(bridge, transport, dispatcher, metrics, properties.getSchema());
    }

    @Bean
    public RemoteLedgerGateway remoteLedgerGateway(SyncBridge bridge) {
        return new RemoteLedgerGateway(bridge);
    }

    @Bean
    public AppUserService appUserService(SyncBridge bridge) {
        return new AppUserService(bridge);
    }

    @Bean
    @ConditionalOnProperty(name = "realtime.mirror.enabled", havingValue = "true")
    public RealtimeLedgerMirror realtimeLedgerMirror(LedgerStore ledgerStore, ObjectMapper objectMapper) {
        return new RealtimeLedgerMirror(ledgerStore, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "realtime.mirror.enabled", havingValue = "true")
    public ApplicationRunner realtimeMirrorRunner(RealtimeChannel channel, RealtimeLedgerMirror mirror,
                                                  RemoteProperties properties) {
        return args -> {
            channel.subscribe(properties.getTable(), mirror);
            log.info("Mirroring remote changes of {} into the local store", properties.getTable());
        };
    }
}
