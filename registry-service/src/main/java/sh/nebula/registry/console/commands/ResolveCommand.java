package sh.nebula.registry.console.commands;

import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.peer.EndpointResolution;
import sh.nebula.registry.peer.PeerDiscovery;

import java.io.PrintStream;
import java.util.Optional;

public record ResolveCommand(PeerDiscovery peerDiscovery, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        if (args.length < 2) {
            out.println("Usage: " + getUsage());
            return false;
        }
        String preferEnvironment = args.length > 2 ? args[2] : null;
        Optional<EndpointResolution> resolution =
                peerDiscovery.getEndpointWithFallback(args[1], preferEnvironment, false);
        if (resolution.isEmpty()) {
            out.println("No endpoint found for " + args[1]);
            return false;
        }
        out.println(args[1] + " -> " + resolution.get().endpoint() + " (" + resolution.get().source() + ")");
        return true;
    }

    @Override
    public String getName() {
        return "resolve";
    }

    @Override
    public String getDescription() {
        return "Resolve a capability to an endpoint using registry, config and defaults";
    }

    @Override
    public String getUsage() {
        return "resolve <capability> [environment]";
    }
}
