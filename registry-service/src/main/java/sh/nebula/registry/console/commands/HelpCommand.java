package sh.nebula.registry.console.commands;

import sh.nebula.registry.console.CommandHandler;
import sh.nebula.registry.console.CommandRegistry;
import sh.nebula.registry.console.TableFormatter;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.Objects;

public record HelpCommand(CommandRegistry commandRegistry, PrintStream out) implements CommandHandler {

    public HelpCommand {
        Objects.requireNonNull(commandRegistry, "commandRegistry");
        Objects.requireNonNull(out, "out");
    }

    @Override
    public boolean execute(String[] args) {
        if (args.length > 1) {
            CommandHandler handler = commandRegistry.getCommand(args[1]);
            if (handler == null) {
                out.println("Unknown command: " + args[1]);
                return false;
            }
            out.println(handler.getName() + " - " + handler.getDescription());
            out.println("Usage: " + handler.getUsage());
            if (handler.getAliases().length > 0) {
                out.println("Aliases: " + String.join(", ", handler.getAliases()));
            }
            return true;
        }

        TableFormatter table = new TableFormatter().addHeaders("Command", "Usage", "Description");
        commandRegistry.getAllCommands().stream()
                .sorted(Comparator.comparing(CommandHandler::getName))
                .forEach(handler -> table.addRow(handler.getName(), handler.getUsage(), handler.getDescription()));
        out.println(table.build());
        return true;
    }

    @Override
    public String getName() {
        return "help";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"?", "h"};
    }

    @Override
    public String getDescription() {
        return "Show available commands";
    }

    @Override
    public String getUsage() {
        return "help [command]";
    }
}
