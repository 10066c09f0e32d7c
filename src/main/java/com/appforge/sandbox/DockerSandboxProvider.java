package com.appforge.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Docker-backed sandboxes for local development and self-hosted deployments.
 * <p>
 * Each sandbox is a long-lived container idling on {@code sleep infinity}; commands
 * run through {@code docker exec} wrapped in coreutils {@code timeout} so the
 * process is killed inside the container when it overruns. The client also stops
 * waiting after the timeout plus a grace period, so a wedged daemon cannot hang a run.
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    private static final String BASE_TAG = "base";
    private static final long CLIENT_GRACE_MS = 5_000;
    private static final int KILLED_EXIT_CODE = 137;

    private final DockerClient dockerClient;
    private final SandboxProperties properties;

    public DockerSandboxProvider(DockerClient dockerClient, SandboxProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    @Override
    public String create(String imageTag) {
        String imageName = properties.imageFor(imageTag != null ? imageTag : BASE_TAG);

        // Fall back to the base template when the stack image was never pulled
        try {
            dockerClient.inspectImageCmd(imageName).exec();
        } catch (NotFoundException e) {
            log.warn("Image {} not found locally, falling back to base", imageName);
            imageName = properties.imageFor(BASE_TAG);
        }

        String containerName = "appforge-sandbox-" + UUID.randomUUID().toString().substring(0, 8);
        var hostConfig = HostConfig.newHostConfig()
                .withMemory((long) properties.getMemoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) properties.getCpuCount());

        try {
            var response = dockerClient.createContainerCmd(imageName)
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withLabels(Map.of("appforge.managed", "true"))
                    .withWorkingDir(properties.getWorkdir())
                    .withCmd("sleep", "infinity")
                    .exec();
            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Sandbox container {} started from {} ({})", containerName, imageName, containerId);
            return containerId;
        } catch (DockerException e) {
            throw new SandboxException("Failed to create sandbox from " + imageName + ": " + e.getMessage(), e,
                    SandboxErrorClassifier.isPermanent(e));
        }
    }

    @Override
    public CommandResult runCommand(String handle, String command, Duration timeout, OutputSink sink) {
        long start = System.currentTimeMillis();
        long timeoutSeconds = Math.max(timeout.toSeconds(), 1);
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        var stdoutDecoder = new Utf8StreamDecoder();
        var stderrDecoder = new Utf8StreamDecoder();

        ExecCreateCmdResponse exec;
        try {
            exec = dockerClient.execCreateCmd(handle)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withCmd("timeout", "-s", "KILL", String.valueOf(timeoutSeconds),
                            "sh", "-c", "cd " + properties.getWorkdir() + " && " + command)
                    .exec();
        } catch (DockerException e) {
            throw new SandboxException("Failed to start command in " + handle + ": " + e.getMessage(), e,
                    SandboxErrorClassifier.isPermanent(e));
        }

        var callback = dockerClient.execStartCmd(exec.getId()).exec(new ResultCallback.Adapter<Frame>() {
            @Override
            public void onNext(Frame frame) {
                if (frame.getStreamType() == StreamType.STDERR) {
                    emit(stderrDecoder.decode(frame.getPayload()), stderr, OutputSink.Channel.STDERR, sink);
                } else {
                    emit(stdoutDecoder.decode(frame.getPayload()), stdout, OutputSink.Channel.STDOUT, sink);
                }
            }
        });

        boolean finished;
        try {
            finished = callback.awaitCompletion(timeout.toMillis() + CLIENT_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(callback, handle);
            throw new SandboxException("Interrupted while running command in " + handle, e, false);
        }

        long elapsed = System.currentTimeMillis() - start;
        emit(stdoutDecoder.finish(), stdout, OutputSink.Channel.STDOUT, sink);
        emit(stderrDecoder.finish(), stderr, OutputSink.Channel.STDERR, sink);
        if (!finished) {
            closeQuietly(callback, handle);
            log.warn("Command in {} exceeded {}s; abandoned", handle, timeoutSeconds);
            return new CommandResult(stdout.toString(), stderr.toString(), KILLED_EXIT_CODE, true, elapsed);
        }

        InspectExecResponse inspect = dockerClient.inspectExecCmd(exec.getId()).exec();
        Long exitCode = inspect.getExitCodeLong();
        int code = exitCode != null ? exitCode.intValue() : -1;
        boolean timedOut = code == KILLED_EXIT_CODE && elapsed >= timeout.toMillis();
        return new CommandResult(stdout.toString(), stderr.toString(), code, timedOut, elapsed);
    }

    private static void emit(String chunk, StringBuilder buffer, OutputSink.Channel channel, OutputSink sink) {
        if (chunk.isEmpty()) {
            return;
        }
        synchronized (buffer) {
            buffer.append(chunk);
        }
        sink.accept(channel, chunk);
    }

    @Override
    public void destroy(String handle) {
        try {
            dockerClient.stopContainerCmd(handle).exec();
        } catch (DockerException e) {
            log.debug("Container {} may already be stopped: {}", handle, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(handle).withForce(true).exec();
            log.info("Sandbox container {} removed", handle);
        } catch (NotFoundException e) {
            log.debug("Container {} already gone", handle);
        } catch (DockerException e) {
            throw new SandboxException("Failed to remove container " + handle + ": " + e.getMessage(), e, false);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.warn("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(ResultCallback.Adapter<Frame> callback, String handle) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Failed to close exec stream for {}: {}", handle, e.getMessage());
        }
    }
}
