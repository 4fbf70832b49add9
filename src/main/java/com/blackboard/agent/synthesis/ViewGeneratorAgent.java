package com.blackboard.agent.synthesis;

import com.blackboard.contract.Fact;
import com.blackboard.contract.ProposedFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Generates a SwiftUI view for each view request as four ordered fragments:
 * imports, view, view model and preview. Seeds without an artifact type are
 * treated as view requests.
 */
public class ViewGeneratorAgent extends ArtifactGeneratorAgent {

    private static final Logger log = LoggerFactory.getLogger(ViewGeneratorAgent.class);

    public static final String NAME = "view-generator";
    public static final String ARTIFACT_TYPE = "view";

    public ViewGeneratorAgent() {
        super(NAME, ARTIFACT_TYPE);
    }

    @Override
    protected boolean accepts(String requestedType) {
        return requestedType == null || super.accepts(requestedType);
    }

    @Override
    protected void generate(Fact request, List<ProposedFact> out) {
        String name = request.text("target");
        boolean async = request.flag("async", true);
        out.add(fragment(request, 10, "imports", "import SwiftUI"));
        out.add(fragment(request, 20, "view", view(name, async)));
        out.add(fragment(request, 30, "view_model", viewModel(name)));
        out.add(fragment(request, 40, "preview", "#Preview {\n    " + name + "()\n}"));
        log.info("Generated 4 fragments for view {}", name);
    }

    private String view(String name, boolean async) {
        String task = async ? "\n        .task { await viewModel.loadData() }" : "";
        return """
            struct %1$s: View {
                @State private var viewModel = %1$sViewModel()

                var body: some View {
                    NavigationStack {
                        content
                            .navigationTitle("%1$s")
                    }%2$s
                }

                @ViewBuilder
                private var content: some View {
                    if viewModel.isLoading {
                        ProgressView()
                    } else {
                        List(viewModel.items, id: \\.self) { item in
                            Text(item)
                        }
                    }
                }
            }""".formatted(name, task);
    }

    private String viewModel(String name) {
        return """
            @Observable
            class %sViewModel {
                var items: [String] = []
                var isLoading = false
                var error: Error?

                @MainActor
                func loadData() async {
                    isLoading = true
                    defer { isLoading = false }

                    do {
                        try await Task.sleep(for: .seconds(1))
                        items = ["Item 1", "Item 2", "Item 3"]
                    } catch {
                        self.error = error
                    }
                }
            }""".formatted(name);
    }
}
