package sh.nebula.registry.console;

/**
 * A console command of the registry service.
 */
public interface CommandHandler {
    /**
     * @param args command arguments, the first element being the command name itself
     * @return true if the command completed successfully
     */
    boolean execute(String[] args);

    String getName();

    default String[] getAliases() {
        return new String[0];
    }

    String getDescription();

    String getUsage();
}
