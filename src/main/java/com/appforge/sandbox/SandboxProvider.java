package com.appforge.sandbox;

import com.appforge.core.model.GeneratedFile;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Remote sandbox service. Implementations throw {@link SandboxException} (or any
 * runtime exception) on upstream failure; a command that merely exits non-zero or
 * times out is a normal {@link CommandResult}.
 */
public interface SandboxProvider {

    /** Upper bound on one write script, keeping exec payloads well under ARG_MAX. */
    int WRITE_BATCH_BYTES = 96 * 1024;

    /**
     * Creates and starts a sandbox from the given template.
     *
     * @return provider handle used for every later call
     */
    String create(String imageTag);

    /**
     * Runs a shell command in the sandbox workspace, streaming output to {@code sink}.
     * A command still running at {@code timeout} is killed and reported with
     * {@code timedOut = true}.
     */
    CommandResult runCommand(String handle, String command, Duration timeout, OutputSink sink);

    void destroy(String handle);

    /** Cheap reachability check for the health view. */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Materializes files under the workspace. The default implementation ships them
     * as base64 inside shell scripts, batched by size.
     */
    default void writeFiles(String handle, List<GeneratedFile> files, Duration timeout) {
        for (String script : writeScripts(files)) {
            CommandResult result = runCommand(handle, script, timeout, OutputSink.NONE);
            if (result.exitCode() != 0 || result.timedOut()) {
                throw new SandboxException("Writing files failed (exit " + result.exitCode() + "): "
                        + result.stderr(), false);
            }
        }
    }

    static List<String> writeScripts(List<GeneratedFile> files) {
        var scripts = new ArrayList<String>();
        var current = new StringBuilder();
        for (GeneratedFile file : files) {
            String encoded = Base64.getEncoder().encodeToString(file.content().getBytes(StandardCharsets.UTF_8));
            String path = shellQuote(file.path());
            String line = "mkdir -p \"$(dirname " + path + ")\" && printf '%s' '" + encoded
                    + "' | base64 -d > " + path + "\n";
            if (current.length() > 0 && current.length() + line.length() > WRITE_BATCH_BYTES) {
                scripts.add("set -e\n" + current);
                current.setLength(0);
            }
            current.append(line);
        }
        if (current.length() > 0) {
            scripts.add("set -e\n" + current);
        }
        return scripts;
    }

    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
