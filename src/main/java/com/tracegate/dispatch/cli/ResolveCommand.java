package com.tracegate.dispatch.cli;

import com.tracegate.core.model.AnchorRefs;
import com.tracegate.core.resolve.AnchorResolution;
import com.tracegate.core.resolve.AnchorResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: tracegate resolve --anchor &lt;id&gt; | --development-item &lt;id&gt; | --requirement &lt;id&gt;
 */
@Command(name = "resolve", mixinStandardHelpOptions = true,
        description = "Resolve upstream references to a level-3 process anchor")
@Component
public class ResolveCommand implements Runnable {

    @Option(names = {"--anchor", "-a"}, description = "Explicit process node id")
    private String anchorId;

    @Option(names = {"--development-item", "-d"}, description = "Development item id")
    private String developmentItemId;

    @Option(names = {"--requirement", "-r"}, description = "Requirement id")
    private String requirementId;

    private final AnchorResolver resolver;

    public ResolveCommand(AnchorResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var refs = new AnchorRefs(anchorId, developmentItemId, requirementId);
        if (refs.isEmpty()) {
            ConsoleOutput.error("Give at least one of --anchor, --development-item, --requirement");
            return;
        }
        AnchorResolution resolution = resolver.resolve(refs);
        if (resolution.resolved()) {
            ConsoleOutput.success("Anchor: " + resolution.anchorId() + " (via " + resolution.path() + ")");
        } else {
            ConsoleOutput.warn("No level-3 anchor could be resolved");
        }
    }
}
