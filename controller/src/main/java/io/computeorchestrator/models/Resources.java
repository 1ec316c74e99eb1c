package io.computeorchestrator.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable amount of compute resources along the three accounted dimensions.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Resources {

    public static final Resources ZERO = new Resources(0, 0, 0);

    @JsonProperty("vcpus")
    private final int vcpus;

    @JsonProperty("memory_mb")
    private final long memoryMb;

    @JsonProperty("disk_gb")
    private final long diskGb;

    @JsonCreator
    public Resources(@JsonProperty("vcpus") int vcpus,
                     @JsonProperty("memory_mb") long memoryMb,
                     @JsonProperty("disk_gb") long diskGb) {
        this.vcpus = vcpus;
        this.memoryMb = memoryMb;
        this.diskGb = diskGb;
    }

    public static Resources of(int vcpus, long memoryMb, long diskGb) {
        return new Resources(vcpus, memoryMb, diskGb);
    }

    public Resources plus(Resources other) {
        return new Resources(vcpus + other.vcpus, memoryMb + other.memoryMb, diskGb + other.diskGb);
    }

    /**
     * Subtracts per dimension, never going below zero.
     */
    public Resources minus(Resources other) {
        return new Resources(
            Math.max(0, vcpus - other.vcpus),
            Math.max(0L, memoryMb - other.memoryMb),
            Math.max(0L, diskGb - other.diskGb));
    }

    /**
     * True when {@code request} fits inside this amount on every dimension.
     */
    public boolean fits(Resources request) {
        return request.vcpus <= vcpus
            && request.memoryMb <= memoryMb
            && request.diskGb <= diskGb;
    }

    @JsonIgnore
    public boolean isNegative() {
        return vcpus < 0 || memoryMb < 0 || diskGb < 0;
    }
}
