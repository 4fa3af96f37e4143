package sh.nebula.registry.console.commands;

import sh.nebula.api.discovery.RegisteredService;
import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.ServiceListing;

import java.io.PrintStream;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

public record DiscoverCommand(ServiceRegistry registry, Clock clock, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        if (args.length < 2) {
            out.println("Usage: " + getUsage());
            return false;
        }
        Optional<RegisteredService> service = registry.discover(args[1]).join();
        if (service.isEmpty()) {
            out.println("No service named " + args[1]);
            return false;
        }
        ServiceListing.print(out, List.of(service.get()), clock, "");
        if (!service.get().metadata().isEmpty()) {
            out.println("Metadata:");
            service.get().metadata().forEach((key, value) -> out.println("  " + key + " = " + value));
        }
        return true;
    }

    @Override
    public String getName() {
        return "discover";
    }

    @Override
    public String getDescription() {
        return "Look up the most recent registration of a service";
    }

    @Override
    public String getUsage() {
        return "discover <name>";
    }
}
