package com.appforge.core.nodes;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.llm.LlmService;
import com.appforge.core.model.GeneratedCode;
import com.appforge.core.model.GeneratedFile;
import com.appforge.core.model.RunPlan;
import com.appforge.core.model.RunStage;
import com.appforge.core.model.TargetStack;
import com.appforge.core.model.ValidationReport;
import com.appforge.core.state.AgentRunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The coder. Emits the project's files for the selected stack from the plan, or,
 * on a repair cycle, from the plan plus the failing validation output. Repair
 * output is overlaid on the previous file set by path.
 */
@Component
public class GenerateCodeNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateCodeNode.class);

    static final String STAGE = "generate_code";

    /** Upper bound on validation output fed back to the model. */
    private static final int MAX_REPORT_CHARS = 8_000;

    private static final String SYSTEM_PROMPT = """
            You are a senior frontend engineer generating a complete, buildable project.

            Stack: %s
            Conventions: %s

            Rules:
            1. Return every file you create or change, with full contents. Template files you
               do not return are kept as-is.
            2. Paths are relative to the project root and use forward slashes.
            3. Only use packages already in the template's package.json unless you also return
               an updated package.json.
            4. The project must pass "npm run lint" and "npm run build".

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final AgentProperties properties;

    public GenerateCodeNode(LlmService llmService, AgentProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    public Map<String, Object> apply(AgentRunState state) {
        if (!state.files().isEmpty() && !state.repairPending()) {
            return Map.of("stage", RunStage.CODING.name());
        }

        TargetStack stack = state.framework().orElse(TargetStack.DEFAULT);
        String systemPrompt = SYSTEM_PROMPT.formatted(stack.id(), stack.conventions());
        String userPrompt = state.repairPending()
                ? repairPrompt(state)
                : buildPrompt(state.request(), state.plan().orElse(null));

        GeneratedCode code = AgentOutputRetry.call(STAGE, properties.getMaxOutputAttempts(),
                () -> llmService.structuredCall(systemPrompt, userPrompt, GeneratedCode.class),
                this::rejection);
        List<GeneratedFile> files = state.repairPending()
                ? normalize(state.files(), code.files())
                : normalize(List.of(), code.files());

        if (state.repairPending()) {
            log.info("Repair {} produced {} files", state.repairCount(), files.size());
        } else {
            log.info("Generated {} files: {}", files.size(), code.summary());
        }
        return Map.of(
                "files", files,
                "filesWritten", false,
                "repairPending", false,
                "stage", RunStage.CODING.name());
    }

    String buildPrompt(String request, RunPlan plan) {
        var sb = new StringBuilder();
        sb.append("Request:\n").append(request).append("\n");
        if (plan != null) {
            sb.append("\nImplementation steps:\n");
            for (int i = 0; i < plan.steps().size(); i++) {
                sb.append(i + 1).append(". ").append(plan.steps().get(i)).append("\n");
            }
            if (!plan.assumptions().isEmpty()) {
                sb.append("\nAssumptions:\n");
                plan.assumptions().forEach(a -> sb.append("- ").append(a).append("\n"));
            }
        }
        return sb.toString();
    }

    String repairPrompt(AgentRunState state) {
        var sb = new StringBuilder(buildPrompt(state.request(), state.plan().orElse(null)));
        ValidationReport report = state.lastReport().orElse(null);
        sb.append("\nThe previous version FAILED validation");
        if (report != null) {
            sb.append(" (").append(report.command()).append(", exit code ").append(report.exitCode()).append(")");
            String output = report.combinedOutput();
            if (output.length() > MAX_REPORT_CHARS) {
                output = output.substring(output.length() - MAX_REPORT_CHARS);
            }
            sb.append(":\n").append(output).append("\n");
        } else {
            sb.append(".\n");
        }
        sb.append("\nFix the root cause and return every file you change.\n");
        sb.append("\nCurrent files:\n");
        for (GeneratedFile file : state.files()) {
            sb.append("--- ").append(file.path()).append(" ---\n").append(file.content()).append("\n");
        }
        return sb.toString();
    }

    private String rejection(GeneratedCode code) {
        if (code.files() == null || code.files().isEmpty()) {
            return "no files";
        }
        if (code.files().size() > properties.getMaxFiles()) {
            return code.files().size() + " files exceeds the limit of " + properties.getMaxFiles();
        }
        for (GeneratedFile file : code.files()) {
            if (file == null || !isSafePath(file.path())) {
                return "invalid path " + (file == null ? "null" : "'" + file.path() + "'");
            }
            if (file.content() == null) {
                return "no content for " + file.path();
            }
        }
        return null;
    }

    static boolean isSafePath(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String p = path.strip().replace('\\', '/');
        if (p.startsWith("/") || p.contains("\0")) {
            return false;
        }
        for (String segment : p.split("/")) {
            if (segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    /** Strips "./" prefixes; later entries replace earlier ones with the same path. */
    private static List<GeneratedFile> normalize(List<GeneratedFile> base, List<GeneratedFile> files) {
        var byPath = new LinkedHashMap<String, GeneratedFile>();
        base.forEach(f -> byPath.put(f.path(), f));
        for (GeneratedFile file : files) {
            String path = file.path().strip().replace('\\', '/');
            while (path.startsWith("./")) {
                path = path.substring(2);
            }
            byPath.put(path, new GeneratedFile(path, file.content()));
        }
        return new ArrayList<>(byPath.values());
    }
}
