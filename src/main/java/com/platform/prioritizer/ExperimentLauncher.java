package com.platform.prioritizer;

import com.platform.prioritizer.domain.RunManifest;
import com.platform.prioritizer.error.PrioritizerException;
import com.platform.prioritizer.experiment.ExperimentConfig;
import com.platform.prioritizer.experiment.ExperimentConfigLoader;
import com.platform.prioritizer.service.ExperimentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the experiment named by {@code prioritizer.experiment.config} once the context is up.
 * Without that property the application starts idle.
 */
@Component
public class ExperimentLauncher implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ExperimentLauncher.class);

    private final ExperimentConfigLoader configLoader;
    private final ExperimentService experimentService;

    @Value("${prioritizer.experiment.config:}")
    private String experimentConfig;

    public ExperimentLauncher(ExperimentConfigLoader configLoader, ExperimentService experimentService) {
        this.configLoader = configLoader;
        this.experimentService = experimentService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (experimentConfig == null || experimentConfig.isBlank()) {
            log.info("No prioritizer.experiment.config set; not starting a run");
            return;
        }
        RunManifest manifest;
        try {
            ExperimentConfig config = configLoader.load(Path.of(experimentConfig));
            manifest = experimentService.run(config);
        } catch (PrioritizerException e) {
            log.error("Cannot load experiment {}", experimentConfig, e);
            manifest = experimentService.abortBeforeStart(e);
        }
        if (manifest.status() == RunManifest.Status.ABORTED) {
            log.error("Experiment {} aborted: {}", experimentConfig, manifest.abortCause());
        }
    }
}
