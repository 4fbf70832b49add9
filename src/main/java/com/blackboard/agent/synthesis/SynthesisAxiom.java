package com.blackboard.agent.synthesis;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural rules a generated artifact must follow.
 *
 * Each rule inspects one fragment; {@code artifact} is the text of every current
 * fragment for the same target, for rules that need to see the rest of the artifact.
 */
public enum SynthesisAxiom {

    INIT_PURITY("initializers perform no side effects") {
        private final Pattern initializer = Pattern.compile("(?<![.\\w])init\\s*\\(");
        private final List<String> sideEffects = List.of("fetch", "load", "start", "URLSession");

        @Override
        Outcome check(String fragment, String artifact) {
            Matcher matcher = initializer.matcher(fragment);
            while (matcher.find()) {
                String body = blockAfter(fragment, matcher.end());
                if (sideEffects.stream().anyMatch(body::contains)) {
                    return Outcome.fail("side effects detected in init");
                }
            }
            return Outcome.pass();
        }
    },

    WEAK_CAPTURE("closures capture self weakly") {
        private final Pattern strongSelf = Pattern.compile("\\{\\s*\\w+\\s+in\\s*\\n?\\s*self\\.");

        @Override
        Outcome check(String fragment, String artifact) {
            return strongSelf.matcher(fragment).find() && !fragment.contains("[weak self]")
                ? Outcome.fail("strong self capture in closure")
                : Outcome.pass();
        }
    },

    OBSERVABLE_STATE("view state is backed by an observable type") {
        @Override
        Outcome check(String fragment, String artifact) {
            boolean holdsState = fragment.contains("@State") || fragment.contains("@StateObject");
            boolean observable = artifact.contains("@Observable") || artifact.contains("ObservableObject");
            return holdsState && !observable
                ? Outcome.fail("state held without an observable model")
                : Outcome.pass();
        }
    },

    MAIN_ACTOR("async UI updates run on the main actor") {
        @Override
        Outcome check(String fragment, String artifact) {
            boolean updatesUi = List.of("@Published", "self.items", "self.isLoading").stream().anyMatch(fragment::contains);
            boolean mainActor = fragment.contains("@MainActor") || fragment.contains("MainActor.run");
            return updatesUi && fragment.contains("async") && !mainActor
                ? Outcome.fail("async UI updates without MainActor")
                : Outcome.pass();
        }
    },

    ERROR_HANDLING("no forced try or forced cast") {
        @Override
        Outcome check(String fragment, String artifact) {
            return fragment.contains("try!") || fragment.contains("as!")
                ? Outcome.fail("forced try or cast")
                : Outcome.pass();
        }
    },

    INTERPOSABLE_CONFIG("build configuration keeps -interposable") {
        @Override
        Outcome check(String fragment, String artifact) {
            String lower = fragment.toLowerCase();
            boolean isConfig = lower.contains("project.yml") || lower.contains("xcodegen");
            return isConfig && !fragment.contains("-interposable")
                ? Outcome.fail("build configuration missing -interposable")
                : Outcome.pass();
        }
    };

    private final String statement;

    SynthesisAxiom(String statement) {
        this.statement = statement;
    }

    public String statement() {
        return statement;
    }

    abstract Outcome check(String fragment, String artifact);

    /**
     * Text of the brace-delimited block opening after {@code from}, or the rest of
     * the text when the block is never closed.
     */
    private static String blockAfter(String text, int from) {
        int open = text.indexOf('{', from);
        if (open < 0) {
            return "";
        }
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return text.substring(open + 1, i);
            }
        }
        return text.substring(open + 1);
    }

    record Outcome(boolean passed, String reason) {

        static Outcome pass() {
            return new Outcome(true, null);
        }

        static Outcome fail(String reason) {
            return new Outcome(false, reason);
        }
    }
}
