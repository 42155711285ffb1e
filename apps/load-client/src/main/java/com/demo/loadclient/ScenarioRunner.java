package com.demo.loadclient;

import com.demo.loadclient.client.ClientResponse;
import com.demo.loadclient.client.LoadClient;
import com.demo.loadclient.client.RequestDefinition;
import com.demo.loadclient.client.ResponseType;
import com.demo.loadclient.client.StatusCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Runs a fixed number of iterations of a single request at startup.
 */
@Component
@ConditionalOnProperty(name = "scenario.enabled", havingValue = "true")
public class ScenarioRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(ScenarioRunner.class);

    @Value("${scenario.url}")
    private String url;

    @Value("${scenario.method:GET}")
    private String method;

    @Value("${scenario.iterations:10}")
    private int iterations;

    @Value("${scenario.expected-status:200}")
    private int expectedStatus;

    @Value("${scenario.name:}")
    private String name;

    @Value("${scenario.body:}")
    private String body;

    @Value("${scenario.response-type:text}")
    private String responseType;

    @Autowired
    private LoadClient loadClient;

    @Autowired
    private StatusCheck statusCheck;

    @Override
    public void run(ApplicationArguments args) {
        RequestDefinition.Builder builder = RequestDefinition.builder(url)
            .responseType(ResponseType.fromString(responseType));
        if (!body.isEmpty()) {
            builder.body(body);
        }
        if (!name.isBlank()) {
            builder.tag("name", name);
        }
        RequestDefinition definition = builder.build();
        String verb = method.toUpperCase(Locale.ROOT);

        logger.info("Starting scenario: {} {} x{}", verb, url, iterations);
        int passed = 0;
        int failed = 0;
        for (int i = 0; i < iterations; i++) {
            try {
                ClientResponse response = loadClient.request(verb, definition);
                if (statusCheck.check(expectedStatus, response, Map.of())) {
                    passed++;
                } else {
                    failed++;
                }
            } catch (IOException e) {
                // only raised when the request could not be prepared
                logger.error("Iteration {} aborted", i, e);
                failed++;
            } finally {
                loadClient.flush();
            }
        }
        logger.info("Scenario finished: {} passed, {} failed", passed, failed);
    }
}
