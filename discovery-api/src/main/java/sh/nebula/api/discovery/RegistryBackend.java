package sh.nebula.api.discovery;

/**
 * Backend that served a registry operation.
 */
public enum RegistryBackend {
    /**
     * The local registration store of this environment.
     */
    LOCAL,
    /**
     * The HTTP registry API of the home environment.
     */
    REMOTE,
    /**
     * Neither backend produced a result.
     */
    NONE
}
