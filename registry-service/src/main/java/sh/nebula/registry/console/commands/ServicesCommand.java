package sh.nebula.registry.console.commands;

import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.ServiceListing;

import java.io.PrintStream;
import java.time.Clock;

public record ServicesCommand(ServiceRegistry registry, Clock clock, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        ServiceListing.print(out, registry.getAllServices().join(), clock, "No services registered");
        return true;
    }

    @Override
    public String getName() {
        return "services";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"ls", "list"};
    }

    @Override
    public String getDescription() {
        return "List every registered service, healthy or not";
    }

    @Override
    public String getUsage() {
        return "services";
    }
}
