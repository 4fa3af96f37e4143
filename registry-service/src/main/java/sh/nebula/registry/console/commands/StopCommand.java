package sh.nebula.registry.console.commands;

import sh.nebula.registry.console.CommandHandler;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Runs the shutdown action on its own thread so the console can answer first.
 */
public record StopCommand(Runnable shutdownAction, PrintStream out) implements CommandHandler {

    public StopCommand {
        Objects.requireNonNull(shutdownAction, "shutdownAction");
    }

    @Override
    public boolean execute(String[] args) {
        out.println("Initiating graceful shutdown...");
        new Thread(shutdownAction, "Shutdown-Thread").start();
        return true;
    }

    @Override
    public String getName() {
        return "stop";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"exit", "quit"};
    }

    @Override
    public String getDescription() {
        return "Gracefully shutdown the registry service";
    }

    @Override
    public String getUsage() {
        return "stop";
    }
}
