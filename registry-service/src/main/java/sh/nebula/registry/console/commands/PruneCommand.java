package sh.nebula.registry.console.commands;

import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.console.CommandHandler;

import java.io.PrintStream;
import java.time.Duration;

public record PruneCommand(ServiceRegistry registry, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        Duration maxAge = ServiceRegistry.DEFAULT_RETENTION;
        if (args.length > 1) {
            try {
                long hours = Long.parseLong(args[1]);
                if (hours <= 0) {
                    out.println("Hours must be positive");
                    return false;
                }
                maxAge = Duration.ofHours(hours);
            } catch (NumberFormatException ex) {
                out.println("Invalid hours: " + args[1]);
                return false;
            }
        }
        int removed = registry.pruneStaleServices(maxAge).join();
        out.println("Pruned " + removed + " registration(s) older than " + maxAge.toHours() + "h");
        return true;
    }

    @Override
    public String getName() {
        return "prune";
    }

    @Override
    public String getDescription() {
        return "Delete registrations without a heartbeat for the given hours";
    }

    @Override
    public String getUsage() {
        return "prune [hours]";
    }
}
