package sh.nebula.registry.console;

import sh.nebula.api.discovery.RegisteredService;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Renders registered services as a console table.
 */
public final class ServiceListing {

    private ServiceListing() {
    }

    public static void print(PrintStream out, Collection<RegisteredService> services, Clock clock, String emptyMessage) {
        if (services.isEmpty()) {
            out.println(emptyMessage);
            return;
        }
        TableFormatter table = new TableFormatter()
                .addHeaders("Name", "Environment", "Endpoint", "Capabilities", "Last Seen", "Status");
        Instant now = clock.instant();
        for (RegisteredService service : services) {
            table.addRow(
                    service.name(),
                    service.environment(),
                    service.endpoint(),
                    String.join(",", service.capabilities()),
                    formatAge(Duration.between(service.lastSeen(), now)),
                    service.healthy() ? TableFormatter.green("HEALTHY") : TableFormatter.red("STALE"));
        }
        out.println(table.build());
        out.println("Total: " + services.size());
    }

    public static String formatAge(Duration age) {
        if (age.isNegative()) {
            return "just now";
        }
        long seconds = age.getSeconds();
        if (seconds < 60) {
            return seconds + "s ago";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m ago";
        }
        if (seconds < 86400) {
            return (seconds / 3600) + "h ago";
        }
        return (seconds / 86400) + "d ago";
    }
}
