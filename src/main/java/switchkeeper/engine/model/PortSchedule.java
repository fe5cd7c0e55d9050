package switchkeeper.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable port cycle schedule for a single device port.
 */
public final class PortSchedule {

    public static final int MIN_OFF_DURATION = 5;
    public static final int MAX_OFF_DURATION = 300;

    private final String id;
    private final String name;
    private final String description;
    private final String deviceId;
    private final String siteName;
    private final int portIdx; // 1-based
    private final Recurrence recurrence;
    private final boolean poeOnly;
    private final int offDuration; // seconds
    private final boolean enabled;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastRunAt;

    private PortSchedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId is required");
        this.siteName = builder.siteName;
        this.portIdx = builder.portIdx;
        this.recurrence = Objects.requireNonNull(builder.recurrence, "recurrence is required");
        this.poeOnly = builder.poeOnly;
        this.offDuration = builder.offDuration;
        this.enabled = builder.enabled;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.lastRunAt = builder.lastRunAt;

        if (portIdx < 1) {
            throw new IllegalArgumentException("portIdx must be >= 1");
        }
        if (offDuration < MIN_OFF_DURATION || offDuration > MAX_OFF_DURATION) {
            throw new IllegalArgumentException(
                    "offDuration must be between " + MIN_OFF_DURATION + " and " + MAX_OFF_DURATION + " seconds");
        }
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String deviceId() {
        return deviceId;
    }

    public String siteName() {
        return siteName;
    }

    public int portIdx() {
        return portIdx;
    }

    public Recurrence recurrence() {
        return recurrence;
    }

    public boolean poeOnly() {
        return poeOnly;
    }

    public int offDuration() {
        return offDuration;
    }

    public boolean enabled() {
        return enabled;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public boolean hasSite() {
        return siteName != null && !siteName.isBlank();
    }

    public JobKind jobKind() {
        return JobKind.forPortCycle(poeOnly);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .deviceId(deviceId)
                .siteName(siteName)
                .portIdx(portIdx)
                .recurrence(recurrence)
                .poeOnly(poeOnly)
                .offDuration(offDuration)
                .enabled(enabled)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastRunAt(lastRunAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String deviceId;
        private String siteName;
        private int portIdx = 1;
        private Recurrence recurrence;
        private boolean poeOnly = true;
        private int offDuration = 15;
        private boolean enabled = true;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastRunAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder siteName(String siteName) {
            this.siteName = siteName;
            return this;
        }

        public Builder portIdx(int portIdx) {
            this.portIdx = portIdx;
            return this;
        }

        public Builder recurrence(Recurrence recurrence) {
            this.recurrence = recurrence;
            return this;
        }

        public Builder poeOnly(boolean poeOnly) {
            this.poeOnly = poeOnly;
            return this;
        }

        public Builder offDuration(int offDuration) {
            this.offDuration = offDuration;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public PortSchedule build() {
            return new PortSchedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PortSchedule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PortSchedule{id='" + id + "', device='" + deviceId + "', port=" + portIdx + ", poeOnly=" + poeOnly
                + ", enabled=" + enabled + "}";
    }
}
