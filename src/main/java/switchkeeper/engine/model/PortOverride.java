package switchkeeper.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * The controller's per-port configuration object.
 * <p>
 * Treated as an opaque JSON value: it is captured by deep copy and written back whole,
 * so fields this class knows nothing about (VLAN, security, storm control, anything the
 * controller adds later) survive a round trip. Only {@link #disabledVariant} reads named
 * fields.
 */
public final class PortOverride {

    public static final String PORT_IDX = "port_idx";
    public static final String NAME = "name";
    public static final String FORWARD = "forward";
    public static final String NATIVE_NETWORK = "native_networkconf_id";

    private final ObjectNode json;

    private PortOverride(ObjectNode json) {
        this.json = json;
    }

    /** Wraps a deep copy of the given controller object; it must carry {@code port_idx} */
    public static PortOverride of(JsonNode node) {
        if (node == null || !node.isObject() || !node.hasNonNull(PORT_IDX)) {
            throw new IllegalArgumentException("port override must be an object with port_idx");
        }
        return new PortOverride(((ObjectNode) node).deepCopy());
    }

    /**
     * Builds an override from port table values for a port that had none.
     */
    public static PortOverride synthesize(PortState port, int portIdx) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(PORT_IDX, portIdx);
        node.put(NAME, port != null && port.name() != null ? port.name() : "Port " + portIdx);
        node.put(NATIVE_NETWORK, port != null && port.nativeNetworkId() != null ? port.nativeNetworkId() : "");
        node.put(FORWARD, port != null && port.forward() != null ? port.forward() : "all");
        return new PortOverride(node);
    }

    /**
     * Full-field override that takes the port down. The controller firmware ignores
     * partial overrides for this transition, so every field is set explicitly.
     */
    public static PortOverride disabledVariant(PortOverride saved) {
        int portIdx = saved.portIdx();
        String name = saved.text(NAME);

        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(PORT_IDX, portIdx);
        node.put("setting_preference", "auto");
        node.put(NAME, name != null ? name : "Port " + portIdx);
        node.put("port_security_enabled", true);
        node.putArray("port_security_mac_address");
        node.put(NATIVE_NETWORK, "");
        node.put("tagged_vlan_mgmt", "block_all");
        node.putArray("multicast_router_networkconf_ids");
        node.put("lldpmed_enabled", true);
        node.put("voice_networkconf_id", "");
        node.put("stormctrl_bcast_enabled", false);
        node.put("stormctrl_bcast_rate", 100);
        node.put("stormctrl_mcast_enabled", false);
        node.put("stormctrl_mcast_rate", 100);
        node.put("stormctrl_ucast_enabled", false);
        node.put("stormctrl_ucast_rate", 100);
        node.put("egress_rate_limit_kbps_enabled", false);
        node.put("autoneg", true);
        node.put("isolation", false);
        node.put("stp_port_mode", true);
        node.put("port_keepalive_enabled", false);
        node.put(FORWARD, "disabled");
        return new PortOverride(node);
    }

    public int portIdx() {
        return json.get(PORT_IDX).asInt();
    }

    public String text(String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public String forward() {
        return text(FORWARD);
    }

    public String nativeNetworkId() {
        return text(NATIVE_NETWORK);
    }

    /** Copy with one text field replaced; everything else is kept */
    public PortOverride withText(String field, String value) {
        ObjectNode copy = json.deepCopy();
        copy.put(field, value);
        return new PortOverride(copy);
    }

    public PortOverride deepCopy() {
        return new PortOverride(json.deepCopy());
    }

    /** A fresh copy of the JSON, safe to embed in a request body */
    public ObjectNode toJson() {
        return json.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PortOverride that))
            return false;
        return json.equals(that.json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(json);
    }

    @Override
    public String toString() {
        return json.toString();
    }
}
