package com.blackboard.agent.synthesis;

import com.blackboard.contract.Fact;
import com.blackboard.contract.ProposedFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Generates a dependency-injectable service for each service request: imports, a
 * protocol, the implementation taking its URLSession through init, and a debug-only
 * mock conforming to the same protocol.
 *
 * Seed payload: {@code target}, optional {@code methods} (names of async throwing
 * methods returning {@code [String]}, default {@code fetchData}).
 */
public class ServiceGeneratorAgent extends ArtifactGeneratorAgent {

    private static final Logger log = LoggerFactory.getLogger(ServiceGeneratorAgent.class);

    public static final String NAME = "service-generator";
    public static final String ARTIFACT_TYPE = "service";
    public static final List<String> DEFAULT_METHODS = List.of("fetchData");

    private static final String RETURN_TYPE = "[String]";

    public ServiceGeneratorAgent() {
        super(NAME, ARTIFACT_TYPE);
    }

    @Override
    protected void generate(Fact request, List<ProposedFact> out) {
        String name = request.text("target");
        List<String> methods = request.texts("methods");
        if (methods.isEmpty()) {
            methods = DEFAULT_METHODS;
        }
        out.add(fragment(request, 10, "imports", "import Foundation"));
        out.add(fragment(request, 20, "protocol", protocol(name, methods)));
        out.add(fragment(request, 30, "implementation", implementation(name, methods)));
        out.add(fragment(request, 40, "mock", mock(name, methods)));
        log.info("Generated 4 fragments for service {} with methods {}", name, methods);
    }

    private String protocol(String name, List<String> methods) {
        String signatures = methods.stream()
            .map(method -> "    " + signature(method))
            .collect(Collectors.joining("\n"));
        return "protocol " + name + "Protocol {\n" + signatures + "\n}";
    }

    private String implementation(String name, List<String> methods) {
        String bodies = methods.stream()
            .map(method -> """

                    %s {
                        throw ServiceError.notImplemented
                    }
                """.formatted(signature(method)))
            .collect(Collectors.joining());
        return """
            final class %1$s: %1$sProtocol {

                enum ServiceError: Error {
                    case notImplemented
                    case networkError(Error)
                    case invalidResponse
                }

                private let session: URLSession

                init(session: URLSession = .shared) {
                    self.session = session
                }
            %2$s}""".formatted(name, bodies);
    }

    private String mock(String name, List<String> methods) {
        String bodies = methods.stream()
            .map(method -> """

                    %s {
                        stubbed
                    }
                """.formatted(signature(method)))
            .collect(Collectors.joining());
        return """
            #if DEBUG
            final class Mock%1$s: %1$sProtocol {
                var stubbed: %2$s = []
            %3$s}
            #endif""".formatted(name, RETURN_TYPE, bodies);
    }

    private static String signature(String method) {
        return "func " + method + "() async throws -> " + RETURN_TYPE;
    }
}
