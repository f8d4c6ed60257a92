package com.shop.stockkeeper.service;

import com.shop.stockkeeper.config.ShopProperties;
import com.shop.stockkeeper.dto.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured update command (typically a {@code git pull} followed by
 * a dependency install) through {@code sh -c}.
 */
@Component
public class CommandDeploymentTrigger implements DeploymentTrigger {

    public static final String NOT_CONFIGURED = "Self-update is not configured.";
    public static final String UPDATE_COMPLETED = "Update completed.";

    private static final Logger log = LoggerFactory.getLogger(CommandDeploymentTrigger.class);

    private final ShopProperties properties;

    public CommandDeploymentTrigger(ShopProperties properties) {
        this.properties = properties;
    }

    @Override
    public OperationResult triggerUpdate() {
        ShopProperties.Deployment deployment = properties.getDeployment();
        String command = deployment.getUpdateCommand();
        if (command == null || command.isBlank()) {
            return OperationResult.failure(NOT_CONFIGURED);
        }

        Path output = null;
        try {
            output = Files.createTempFile("shop-update", ".log");
            ProcessBuilder pb = new ProcessBuilder(List.of("sh", "-c", command))
                    .directory(new File(deployment.getWorkingDirectory()))
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile());

            log.info("Running self-update: {}", command);
            Process process = pb.start();
            if (!process.waitFor(deployment.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.error("Self-update timed out after {}s", deployment.getTimeoutSeconds());
                return OperationResult.failure("Update failed: timed out after " + deployment.getTimeoutSeconds()
                        + " seconds.");
            }

            String text = Files.readString(output).trim();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.error("Self-update exited with {}: {}", exitCode, text);
                return OperationResult.failure("Update failed: exit code " + exitCode + ".");
            }
            log.info("Self-update finished: {}", text);
            return OperationResult.success(UPDATE_COMPLETED);
        } catch (IOException e) {
            log.error("Self-update could not run", e);
            return OperationResult.failure("Update failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure("Update failed: interrupted.");
        } finally {
            deleteQuietly(output);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not remove {}: {}", file, e.getMessage());
        }
    }
}
