package sh.nebula.registry.console.commands;

import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.ServiceListing;

import java.io.PrintStream;
import java.time.Clock;

public record PeersCommand(ServiceRegistry registry, Clock clock, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        ServiceListing.print(out, registry.getHealthyPeers().join(), clock, "No healthy peers");
        return true;
    }

    @Override
    public String getName() {
        return "peers";
    }

    @Override
    public String getDescription() {
        return "List services with a recent heartbeat";
    }

    @Override
    public String getUsage() {
        return "peers";
    }
}
