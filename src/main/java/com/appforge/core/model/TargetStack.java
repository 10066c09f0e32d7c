package com.appforge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Closed set of application stacks the coder can target. Each stack maps to a
 * sandbox image tag and the dev-server port its template listens on.
 */
public enum TargetStack {
    NEXTJS("nextjs", "nextjs", 3000,
            "Next.js 15 App Router with TypeScript, Tailwind CSS and Shadcn UI. Pages live under app/.",
            List.of("next.js", "nextjs", "next js")),
    ANGULAR("angular", "angular", 4200,
            "Angular 19 with standalone components, TypeScript and Tailwind CSS. Sources live under src/app/.",
            List.of("angular")),
    REACT("react", "react", 5173,
            "React 18 on Vite with TypeScript and Tailwind CSS. Entry point is src/main.tsx.",
            List.of("react")),
    VUE("vue", "vue", 5173,
            "Vue 3 on Vite with the Composition API, TypeScript and Tailwind CSS. Entry point is src/main.ts.",
            List.of("vue", "vuejs", "vue.js", "nuxt")),
    SVELTE("svelte", "svelte", 5173,
            "SvelteKit with TypeScript and Tailwind CSS. Routes live under src/routes/.",
            List.of("svelte", "sveltekit"));

    /** Used when the request does not point at a specific stack. */
    public static final TargetStack DEFAULT = NEXTJS;

    private final String id;
    private final String imageTag;
    private final int port;
    private final String conventions;
    private final List<String> keywords;

    TargetStack(String id, String imageTag, int port, String conventions, List<String> keywords) {
        this.id = id;
        this.imageTag = imageTag;
        this.port = port;
        this.conventions = conventions;
        this.keywords = keywords;
    }

    public String id() { return id; }
    public String imageTag() { return imageTag; }
    public int port() { return port; }
    public String conventions() { return conventions; }

    /**
     * Parses a selector answer. Only exact identifiers (case-insensitive, surrounding
     * whitespace and quotes ignored) are accepted.
     */
    public static Optional<TargetStack> fromId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = raw.strip().replace("\"", "").replace("'", "").toLowerCase(Locale.ROOT);
        for (TargetStack stack : values()) {
            if (stack.id.equals(cleaned)) {
                return Optional.of(stack);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the stack a request names explicitly, when it names exactly one.
     * "Build a React dashboard" maps to REACT; "port this React app to Vue" is ambiguous.
     */
    public static Optional<TargetStack> detectExplicit(String request) {
        if (request == null || request.isBlank()) {
            return Optional.empty();
        }
        String lower = request.toLowerCase(Locale.ROOT);
        var matched = new ArrayList<TargetStack>();
        for (TargetStack stack : values()) {
            for (String keyword : stack.keywords) {
                if (Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lower).find()) {
                    matched.add(stack);
                    break;
                }
            }
        }
        // Next.js requests usually mention React too
        if (matched.size() == 2 && matched.contains(NEXTJS) && matched.contains(REACT)) {
            return Optional.of(NEXTJS);
        }
        return matched.size() == 1 ? Optional.of(matched.get(0)) : Optional.empty();
    }
}
