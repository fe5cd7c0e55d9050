package switchkeeper.engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time view of a controller device. Never cached: remote state changes
 * between polls, so callers fetch a fresh handle before every decision.
 */
public record DeviceHandle(
        String id,
        String mac,
        String name,
        String model,
        String type,
        boolean online,
        List<PortState> ports,
        List<PortOverride> overrides) {

    public DeviceHandle {
        ports = List.copyOf(ports);
        overrides = List.copyOf(overrides);
    }

    /**
     * Maps a controller device object ({@code stat/device} entry).
     */
    public static DeviceHandle fromJson(JsonNode node) {
        List<PortState> ports = new ArrayList<>();
        for (JsonNode p : node.path("port_table")) {
            ports.add(new PortState(
                    p.path("port_idx").asInt(),
                    textOrNull(p, "name"),
                    p.path("up").asBoolean(false),
                    textOrNull(p, "poe_mode"),
                    textOrNull(p, "forward"),
                    textOrNull(p, "native_networkconf_id")));
        }

        List<PortOverride> overrides = new ArrayList<>();
        for (JsonNode o : node.path("port_overrides")) {
            if (o.hasNonNull(PortOverride.PORT_IDX)) {
                overrides.add(PortOverride.of(o));
            }
        }

        return new DeviceHandle(
                node.path("_id").asText(""),
                node.path("mac").asText(""),
                node.path("name").asText("Unknown"),
                node.path("model").asText("Unknown"),
                node.path("type").asText("unknown"),
                node.path("state").asInt(0) == 1,
                ports,
                overrides);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public boolean matches(String idOrMac) {
        return id.equals(idOrMac) || mac.equalsIgnoreCase(idOrMac);
    }

    public Optional<PortState> port(int portIdx) {
        return ports.stream().filter(p -> p.portIdx() == portIdx).findFirst();
    }

    public Optional<PortOverride> override(int portIdx) {
        return overrides.stream().filter(o -> o.portIdx() == portIdx).findFirst();
    }

    /** MAC when known, otherwise the id; reboot commands address devices by MAC */
    public String commandAddress() {
        return mac.isEmpty() ? id : mac;
    }
}
