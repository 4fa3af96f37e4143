package sh.nebula.registry.console.commands;

import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.ServiceListing;

import java.io.PrintStream;
import java.time.Clock;

public record CapabilityCommand(ServiceRegistry registry, Clock clock, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        if (args.length < 2) {
            out.println("Usage: " + getUsage());
            return false;
        }
        ServiceListing.print(out, registry.discoverByCapability(args[1]).join(), clock,
                "No healthy service offers " + args[1]);
        return true;
    }

    @Override
    public String getName() {
        return "capability";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"cap"};
    }

    @Override
    public String getDescription() {
        return "List healthy services offering a capability";
    }

    @Override
    public String getUsage() {
        return "capability <capability>";
    }
}
