package switchkeeper.engine.model;

import java.util.List;

/**
 * Returned by a "run site now" request once every cycle has been dispatched.
 */
public record BulkDispatch(String siteDisplayName, int count, List<String> runIds) {
}
