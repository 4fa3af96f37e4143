package sh.nebula.registry.console.commands;

import sh.nebula.registry.client.RegistryClient;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.ServiceListing;
import sh.nebula.registry.store.RegistrationStore;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public record StatusCommand(RegistryClient client, Instant startedAt, Clock clock, PrintStream out)
        implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        out.println("Environment: " + client.environment());
        out.println("Identity: " + client.currentIdentity().map(Object::toString).orElse("not registered"));
        out.println("Backend: " + client.activeBackend());
        out.println("Local store: " + client.localStore().map(RegistrationStore::describe).orElse("none"));
        out.println("Remote registry: " + client.remote().settings().baseUrl());
        out.println("Heartbeat: " + (client.heartbeatScheduler().isRunning()
                ? "every " + client.heartbeatScheduler().interval().getSeconds() + "s"
                : "stopped"));
        out.println("Uptime: " + formatUptime(Duration.between(startedAt, clock.instant())));
        return true;
    }

    static String formatUptime(Duration uptime) {
        long seconds = Math.max(0, uptime.getSeconds());
        return String.format("%dh %dm %ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    @Override
    public String getName() {
        return "status";
    }

    @Override
    public String getDescription() {
        return "Show registration identity, backend and uptime";
    }

    @Override
    public String getUsage() {
        return "status";
    }
}
