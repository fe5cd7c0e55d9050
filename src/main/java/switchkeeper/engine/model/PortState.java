package switchkeeper.engine.model;

/**
 * One row of a device's port table at the time it was fetched.
 */
public record PortState(
        int portIdx,
        String name,
        boolean up,
        String poeMode,
        String forward,
        String nativeNetworkId) {
}
