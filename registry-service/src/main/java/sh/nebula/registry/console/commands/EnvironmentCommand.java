package sh.nebula.registry.console.commands;

import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.ServiceListing;

import java.io.PrintStream;
import java.time.Clock;

public record EnvironmentCommand(ServiceRegistry registry, Clock clock, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        if (args.length < 2) {
            out.println("Usage: " + getUsage());
            return false;
        }
        ServiceListing.print(out, registry.discoverByEnvironment(args[1]).join(), clock,
                "No services registered in " + args[1]);
        return true;
    }

    @Override
    public String getName() {
        return "environment";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"env"};
    }

    @Override
    public String getDescription() {
        return "List services registered from an environment";
    }

    @Override
    public String getUsage() {
        return "environment <environment>";
    }
}
