package sh.nebula.registry.console.commands;

import sh.nebula.api.discovery.ServiceHealthSummary;
import sh.nebula.api.discovery.ServiceRegistry;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.TableFormatter;

import java.io.PrintStream;

public record HealthCommand(ServiceRegistry registry, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        ServiceHealthSummary summary = registry.getServiceHealth().join();
        out.println("Total services: " + summary.totalServices());
        out.println("Healthy: " + TableFormatter.green(String.valueOf(summary.healthyServices())));
        out.println("Unhealthy: " + (summary.unhealthyServices() > 0
                ? TableFormatter.red(String.valueOf(summary.unhealthyServices()))
                : "0"));
        if (!summary.byEnvironment().isEmpty()) {
            TableFormatter table = new TableFormatter().addHeaders("Environment", "Services");
            summary.byEnvironment().forEach((environment, count) -> table.addRow(environment, String.valueOf(count)));
            out.println(table.build());
        }
        return true;
    }

    @Override
    public String getName() {
        return "health";
    }

    @Override
    public String getDescription() {
        return "Show aggregate registry health";
    }

    @Override
    public String getUsage() {
        return "health";
    }
}
