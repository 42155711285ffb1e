package com.demo.loadclient;

import com.demo.loadclient.client.ClientConfig;
import com.demo.loadclient.client.HttpClients;
import com.demo.loadclient.client.LoadClient;
import com.demo.loadclient.client.StatusCheck;
import com.demo.loadclient.errors.ErrorClassifier;
import com.demo.loadclient.metrics.ExecutionState;
import com.demo.loadclient.metrics.ExpectedStatuses;
import com.demo.loadclient.metrics.SampleSink;
import com.demo.loadclient.metrics.SystemTag;
import com.demo.loadclient.metrics.TagsAndMeta;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Wires the load client from application properties.
 */
@Configuration
public class LoadClientConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(LoadClientConfiguration.class);

    @Value("${client.user-agent:}")
    private String userAgent;

    @Value("${client.dial-timeout-seconds:5}")
    private long dialTimeoutSeconds;

    @Value("${client.read-timeout-seconds:0}")
    private long readTimeoutSeconds;

    @Value("${client.write-timeout-seconds:0}")
    private long writeTimeoutSeconds;

    @Value("${client.idle-conn-timeout-seconds:0}")
    private long idleConnTimeoutSeconds;

    @Value("${client.max-idle-conns:1}")
    private int maxIdleConns;

    @Value("${client.proxy:}")
    private String proxy;

    @Value("${client.tls.insecure-skip-verify:false}")
    private boolean insecureSkipVerify;

    @Value("${client.tls.certificate:}")
    private String certificate;

    @Value("${client.tls.private-key:}")
    private String privateKey;

    @Value("${client.blocked-ips:}")
    private List<String> blockedIps;

    @Value("${client.blocked-hostnames:}")
    private List<String> blockedHostnames;

    @Value("${metrics.system-tags:}")
    private String systemTags;

    @Value("${metrics.expected-statuses:200-399}")
    private String expectedStatuses;

    @Value("${metrics.tags:}")
    private List<String> runTags;

    @Bean
    public ClientConfig clientConfig() {
        return new ClientConfig(
            userAgent.isBlank() ? null : userAgent,
            Duration.ofSeconds(dialTimeoutSeconds),
            Duration.ofSeconds(readTimeoutSeconds),
            Duration.ofSeconds(writeTimeoutSeconds),
            Duration.ofSeconds(idleConnTimeoutSeconds),
            maxIdleConns,
            proxy,
            new ClientConfig.TlsConfig(insecureSkipVerify, privateKey, certificate),
            blockedIps,
            blockedHostnames
        );
    }

    @Bean
    public OkHttpClient okHttpClient(ClientConfig clientConfig) {
        logger.info("Building HTTP client: dialTimeout={}, maxIdleConns={}, proxy={}, blockedIps={}, blockedHostnames={}",
            clientConfig.dialTimeout(), clientConfig.maxIdleConns(), clientConfig.proxy(),
            clientConfig.blockedIps(), clientConfig.blockedHostnames());
        return HttpClients.build(clientConfig);
    }

    @Bean
    public ExecutionState executionState(SampleSink sink) {
        Set<SystemTag> enabled = SystemTag.parse(systemTags);
        ExpectedStatuses callback = expectedStatuses.isBlank() ? null : ExpectedStatuses.parse(expectedStatuses);
        logger.info("System tags {}, expected statuses {}", enabled, callback == null ? "disabled" : expectedStatuses);
        return new ExecutionState(parseRunTags(runTags), enabled, sink, callback);
    }

    @Bean(destroyMethod = "close")
    public LoadClient loadClient(OkHttpClient okHttpClient, ExecutionState executionState,
                                 ErrorClassifier errorClassifier) {
        return new LoadClient(okHttpClient, executionState, errorClassifier);
    }

    @Bean
    public StatusCheck statusCheck(ExecutionState executionState) {
        return new StatusCheck(executionState);
    }

    /**
     * Parse {@code key=value} entries into run tags.
     */
    static TagsAndMeta parseRunTags(List<String> entries) {
        TagsAndMeta tags = new TagsAndMeta();
        for (String entry : entries) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Invalid run tag '" + trimmed + "', expected key=value");
            }
            tags.setTag(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
        }
        return tags;
    }
}
