package switchkeeper.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one maintenance operation's execution.
 * Owned by the step that created it until a terminal status is written.
 */
public final class RunRecord {
    private final String id;
    private final String scheduleId;
    private final JobKind kind;
    private final String deviceId;
    private final String deviceName;
    private final Integer portIdx;
    private final RunStatus status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Long durationSeconds;
    private final String errorMessage;
    private final Map<String, Object> metadata;

    private RunRecord(Builder builder) {
        this.id = builder.id;
        this.scheduleId = builder.scheduleId;
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId is required");
        this.deviceName = builder.deviceName;
        this.portIdx = builder.portIdx;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.durationSeconds = builder.durationSeconds;
        this.errorMessage = builder.errorMessage;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public String id() {
        return id;
    }

    public String scheduleId() {
        return scheduleId;
    }

    public JobKind kind() {
        return kind;
    }

    public String deviceId() {
        return deviceId;
    }

    public String deviceName() {
        return deviceName;
    }

    public Integer portIdx() {
        return portIdx;
    }

    public RunStatus status() {
        return status;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Long durationSeconds() {
        return durationSeconds;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Terminal copy of this record, as the ledger stores it on finish */
    public RunRecord finished(RunStatus terminal, Instant at, String error, Map<String, Object> extraMetadata) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        Builder b = toBuilder()
                .status(terminal)
                .completedAt(at)
                .errorMessage(error);
        if (startedAt != null) {
            b.durationSeconds(Duration.between(startedAt, at).toSeconds());
        }
        if (extraMetadata != null) {
            extraMetadata.forEach(b::metadata);
        }
        return b.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .scheduleId(scheduleId)
                .kind(kind)
                .deviceId(deviceId)
                .deviceName(deviceName)
                .portIdx(portIdx)
                .status(status)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationSeconds(durationSeconds)
                .errorMessage(errorMessage)
                .metadata(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String scheduleId;
        private JobKind kind;
        private String deviceId;
        private String deviceName;
        private Integer portIdx;
        private RunStatus status = RunStatus.RUNNING;
        private Instant startedAt;
        private Instant completedAt;
        private Long durationSeconds;
        private String errorMessage;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder scheduleId(String scheduleId) {
            this.scheduleId = scheduleId;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder deviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder portIdx(Integer portIdx) {
            this.portIdx = portIdx;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder durationSeconds(Long durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder source(TriggerSource source) {
            return metadata("source", source.wireName());
        }

        public RunRecord build() {
            return new RunRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RunRecord run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RunRecord{id='" + id + "', kind=" + kind + ", device='" + deviceId + "', status=" + status + "}";
    }
}
