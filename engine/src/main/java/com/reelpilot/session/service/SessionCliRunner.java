package com.reelpilot.session.service;

import com.reelpilot.config.SessionProperties;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.ScrapeSource;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.WorkflowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Runs one workflow at startup when {@code session.cli.run=true}. SIGINT/SIGTERM request a
 * cooperative stop so the final stats are still written.
 */
@Component
public class SessionCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SessionCliRunner.class);

    private final SessionProperties properties;
    private final SessionRunService sessionRunService;
    private final ConfigurableApplicationContext applicationContext;

    public SessionCliRunner(
        SessionProperties properties,
        SessionRunService sessionRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.sessionRunService = sessionRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        RunConfig config = buildConfig(properties);
        Thread stopHook = new Thread(sessionRunService::stop, "session-stop-hook");
        Runtime.getRuntime().addShutdownHook(stopHook);

        Stats stats = sessionRunService.run(config);
        log.info(
            "Workflow {} finished with {}: {}",
            config.workflowType(),
            stats.completionReason().code(),
            stats.toMap()
        );

        if (properties.getCli().isExitAfterRun()) {
            try {
                Runtime.getRuntime().removeShutdownHook(stopHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down", e);
            }
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static RunConfig buildConfig(SessionProperties properties) {
        SessionProperties.Cli cli = properties.getCli();
        WorkflowType type = WorkflowType.fromString(cli.getWorkflow());
        if (type == null) {
            throw new IllegalArgumentException("Unknown workflow: " + cli.getWorkflow());
        }
        List<String> targets = Arrays.stream(cli.getTargets().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        RunConfig.Builder builder = properties.newRunConfig(type)
            .searchQuery(cli.getQuery())
            .targetUsernames(targets)
            .hashtag(cli.getHashtag());
        if (type == WorkflowType.SCRAPER && !cli.getHashtag().isBlank()) {
            builder.scrapeSource(ScrapeSource.HASHTAG);
        }
        return builder.build();
    }
}
