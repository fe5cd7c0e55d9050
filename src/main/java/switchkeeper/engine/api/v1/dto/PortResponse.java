package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.PortState;

/**
 * Response DTO for one row of a switch port table.
 * GET /api/v1/devices/{deviceId}/ports
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortResponse(
        @JsonProperty("portIdx") int portIdx,
        @JsonProperty("name") String name,
        @JsonProperty("up") boolean up,
        @JsonProperty("poeMode") String poeMode,
        @JsonProperty("forward") String forward,
        @JsonProperty("nativeNetworkId") String nativeNetworkId) {

    public static PortResponse from(PortState port) {
        return new PortResponse(port.portIdx(), port.name(), port.up(), port.poeMode(), port.forward(),
                port.nativeNetworkId());
    }
}
