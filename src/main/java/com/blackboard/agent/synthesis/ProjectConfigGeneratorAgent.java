package com.blackboard.agent.synthesis;

import com.blackboard.contract.Fact;
import com.blackboard.contract.ProposedFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Generates the XcodeGen {@code project.yml} for a project request as a single
 * fragment. Debug builds link with {@code -Xlinker -interposable} so views can be
 * hot reloaded; a seed with {@code hot_reload: false} leaves the flag out.
 */
public class ProjectConfigGeneratorAgent extends ArtifactGeneratorAgent {

    private static final Logger log = LoggerFactory.getLogger(ProjectConfigGeneratorAgent.class);

    public static final String NAME = "project-config-generator";
    public static final String ARTIFACT_TYPE = "project";

    private static final String DEPLOYMENT_TARGET = "17.0";

    public ProjectConfigGeneratorAgent() {
        super(NAME, ARTIFACT_TYPE);
    }

    @Override
    protected void generate(Fact request, List<ProposedFact> out) {
        String name = request.text("target");
        boolean hotReload = request.flag("hot_reload", true);
        out.add(fragment(request, 10, "project_config", projectYml(name, hotReload)));
        if (!hotReload) {
            log.info("Project {} generated without hot reload linker flags", name);
        }
    }

    private String projectYml(String name, boolean hotReload) {
        String linkerFlags = hotReload
            ? "\n          OTHER_LDFLAGS: [\"-Xlinker\", \"-interposable\"]"
            : "";
        return """
            # project.yml
            # XcodeGen configuration

            name: %1$s
            options:
              bundleIdPrefix: com.example
              deploymentTarget:
                iOS: "%2$s"

            settings:
              base:
                SWIFT_VERSION: "5.9"
                ENABLE_USER_SCRIPT_SANDBOXING: YES

            targets:
              %1$s:
                type: application
                platform: iOS
                deploymentTarget: "%2$s"
                sources:
                  - path: %1$s
                settings:
                  configs:
                    Debug:%3$s
                      SWIFT_ACTIVE_COMPILATION_CONDITIONS: DEBUG
                    Release:
                      SWIFT_OPTIMIZATION_LEVEL: -O
                dependencies: []

            schemes:
              %1$s:
                build:
                  targets:
                    %1$s: all
                run:
                  config: Debug
                test:
                  config: Debug""".formatted(name, DEPLOYMENT_TARGET, linkerFlags);
    }
}
