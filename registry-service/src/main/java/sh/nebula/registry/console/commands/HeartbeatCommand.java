package sh.nebula.registry.console.commands;

import sh.nebula.registry.client.RegistryClient;
import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.TableFormatter;

import java.io.PrintStream;

public record HeartbeatCommand(RegistryClient client, PrintStream out) implements CommandHandler {

    @Override
    public boolean execute(String[] args) {
        if (client.currentIdentity().isEmpty()) {
            out.println(TableFormatter.yellow("This service is not registered"));
            return false;
        }
        boolean sent = client.heartbeat().join();
        out.println(sent
                ? "Heartbeat sent for " + client.currentIdentity().get()
                : TableFormatter.red("Heartbeat failed"));
        return sent;
    }

    @Override
    public String getName() {
        return "heartbeat";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"hb"};
    }

    @Override
    public String getDescription() {
        return "Send a heartbeat for this service now";
    }

    @Override
    public String getUsage() {
        return "heartbeat";
    }
}
