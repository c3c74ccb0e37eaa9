package relay.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import relay.Relay;
import relay.dead.DeadLetterManager;
import relay.inbound.InboundRelay;
import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.store.AbstractJdbcStatusStore;
import relay.jdbc.store.JdbcStatusStores;
import relay.outbound.OutboundDispatcher;
import relay.retry.ExponentialBackoffRetryPolicy;
import relay.retry.RetryEngine;
import relay.retry.RetrySchedule;
import relay.spi.AccountDirectory;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.OperatorAlerts;
import relay.spi.PlatformClient;
import relay.spi.StatusStore;
import relay.spi.WebhookTransport;
import relay.status.StatusQueries;

import javax.sql.DataSource;

/**
 * Auto-configuration for the CRM relay.
 *
 * <p>Wires a {@link Relay} composite from a {@link DataSource} and {@link RelayProperties}.
 * The application supplies the {@link AccountDirectory} and {@link PlatformClient} beans;
 * {@link OperatorAlerts}, {@link WebhookTransport} and {@link MetricsExporter} beans are
 * picked up when present.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Relay.class)
@ConditionalOnBean({DataSource.class, AccountDirectory.class, PlatformClient.class})
@ConditionalOnProperty(prefix = "relay", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(StatusStore.class)
    public AbstractJdbcStatusStore statusStore(DataSource dataSource) {
        return JdbcStatusStores.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrySchedule retrySchedule(RelayProperties props) {
        RelayProperties.Retry retry = props.getRetry();
        return RetrySchedule.builder()
                .baseDelay(retry.getBaseDelay())
                .backoffAttempts(retry.getBackoffAttempts())
                .extendedInterval(retry.getExtendedInterval())
                .retryWindow(retry.getRetryWindow())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Relay relay(RelayProperties props,
                       ConnectionProvider connectionProvider,
                       StatusStore statusStore,
                       AccountDirectory accountDirectory,
                       PlatformClient platformClient,
                       RetrySchedule retrySchedule,
                       ObjectProvider<WebhookTransport> transportProvider,
                       ObjectProvider<OperatorAlerts> alertsProvider,
                       ObjectProvider<MetricsExporter> metricsProvider) {
        RelayProperties.Outbound outbound = props.getOutbound();
        RelayProperties.Retry retry = props.getRetry();
        RelayProperties.Webhook webhook = props.getWebhook();

        long baseDelayMs = outbound.getBaseDelay().toMillis();
        long maxDelayMs = Math.max(baseDelayMs,
                new ExponentialBackoffRetryPolicy(baseDelayMs, Long.MAX_VALUE).computeDelayMs(outbound.getMaxRetries()));

        return Relay.builder()
                .connectionProvider(connectionProvider)
                .statusStore(statusStore)
                .accountDirectory(accountDirectory)
                .platformClient(platformClient)
                .webhookTransport(transportProvider.getIfAvailable())
                .alerts(alertsProvider.getIfAvailable())
                .metrics(metricsProvider.getIfAvailable())
                .retrySchedule(retrySchedule)
                .sendRetryPolicy(new ExponentialBackoffRetryPolicy(baseDelayMs, maxDelayMs))
                .sendMaxRetries(outbound.getMaxRetries())
                .sendWorkerCount(outbound.getWorkerCount())
                .pendingGrace(outbound.getPendingGrace())
                .retryIntervalMs(retry.getTickInterval().toMillis())
                .retryBatchSize(retry.getBatchSize())
                .retryWorkerCount(retry.getWorkerCount())
                .deliveringLease(retry.getDeliveringLease())
                .immediateTimeout(webhook.getImmediateTimeout())
                .attemptTimeout(webhook.getAttemptTimeout())
                .userAgent(webhook.getUserAgent())
                .drainTimeoutMs(props.getDrainTimeout().toMillis())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboundDispatcher outboundDispatcher(Relay relay) {
        return relay.dispatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public InboundRelay inboundRelay(Relay relay) {
        return relay.inbound();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryEngine retryEngine(Relay relay) {
        return relay.retryEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterManager deadLetterManager(Relay relay) {
        return relay.deadLetters();
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusQueries statusQueries(Relay relay) {
        return relay.queries();
    }
}
