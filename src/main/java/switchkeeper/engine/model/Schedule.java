package switchkeeper.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable device reboot schedule.
 * Consumed by the trigger scheduler only while enabled.
 */
public final class Schedule {
    private final String id;
    private final String name;
    private final String description;
    private final List<String> deviceIds; // id or MAC, in rolling order
    private final String siteName;
    private final Recurrence recurrence;
    private final RebootMode mode;
    private final int delayBetweenDevices; // seconds
    private final int maxWaitTime; // seconds
    private final boolean continueOnFailure;
    private final boolean enabled;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastRunAt;

    private Schedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.deviceIds = List.copyOf(Objects.requireNonNull(builder.deviceIds, "deviceIds is required"));
        this.siteName = builder.siteName;
        this.recurrence = Objects.requireNonNull(builder.recurrence, "recurrence is required");
        this.mode = Objects.requireNonNull(builder.mode, "mode is required");
        this.delayBetweenDevices = builder.delayBetweenDevices;
        this.maxWaitTime = builder.maxWaitTime;
        this.continueOnFailure = builder.continueOnFailure;
        this.enabled = builder.enabled;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.lastRunAt = builder.lastRunAt;
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

    public List<String> deviceIds() {
        return deviceIds;
    }

    public String siteName() {
        return siteName;
    }

    public Recurrence recurrence() {
        return recurrence;
    }

    public RebootMode mode() {
        return mode;
    }

    public int delayBetweenDevices() {
        return delayBetweenDevices;
    }

    public int maxWaitTime() {
        return maxWaitTime;
    }

    public boolean continueOnFailure() {
        return continueOnFailure;
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

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .deviceIds(deviceIds)
                .siteName(siteName)
                .recurrence(recurrence)
                .mode(mode)
                .delayBetweenDevices(delayBetweenDevices)
                .maxWaitTime(maxWaitTime)
                .continueOnFailure(continueOnFailure)
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
        private List<String> deviceIds = List.of();
        private String siteName;
        private Recurrence recurrence;
        private RebootMode mode = RebootMode.ROLLING;
        private int delayBetweenDevices = 300;
        private int maxWaitTime = 300;
        private boolean continueOnFailure = false;
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

        public Builder deviceIds(List<String> deviceIds) {
            this.deviceIds = deviceIds;
            return this;
        }

        public Builder siteName(String siteName) {
            this.siteName = siteName;
            return this;
        }

        public Builder recurrence(Recurrence recurrence) {
            this.recurrence = recurrence;
            return this;
        }

        public Builder mode(RebootMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder delayBetweenDevices(int delayBetweenDevices) {
            this.delayBetweenDevices = delayBetweenDevices;
            return this;
        }

        public Builder maxWaitTime(int maxWaitTime) {
            this.maxWaitTime = maxWaitTime;
            return this;
        }

        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
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

        public Schedule build() {
            return new Schedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schedule schedule))
            return false;
        return Objects.equals(id, schedule.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Schedule{id='" + id + "', name='" + name + "', mode=" + mode + ", devices=" + deviceIds.size()
                + ", enabled=" + enabled + "}";
    }
}
