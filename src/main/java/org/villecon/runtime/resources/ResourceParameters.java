package org.villecon.runtime.resources;

import java.util.EnumMap;
import java.util.Map;

import org.villecon.runtime.model.ResourceType;
import org.villecon.runtime.model.TerrainType;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable tuning of tile depletion and recovery.
 * <p>
 * Parsed from a block such as {@code villecon.resources}:
 * <ul>
 *   <li><b>recoveryRate:</b> fraction of a tile's maximum restored per recovery step, in {@code [0, 1]}.</li>
 *   <li><b>recoveryDelay:</b> time a resource must rest after a harvest before it recovers.</li>
 *   <li><b>typeMultipliers:</b> per terrain and resource factor applied to the recovery rate.
 *   A factor of 0 disables recovery for that combination.</li>
 *   <li><b>preset:</b> optional name of a block under {@code presets} that supplies the values above.
 *   Keys given next to {@code preset} override the preset.</li>
 * </ul>
 */
public final class ResourceParameters {

    private static final Config DEFAULTS = ConfigFactory.parseString("""
            recoveryRate = 0.02
            recoveryDelay = 5
            typeMultipliers {
              water    { food = 0.0, wood = 0.0, ore = 0.0 }
              land     { food = 1.5, wood = 0.5, ore = 0.3 }
              forest   { food = 0.8, wood = 2.0, ore = 0.2 }
              mountain { food = 0.3, wood = 0.5, ore = 2.5 }
              road     { food = 0.1, wood = 0.1, ore = 0.1 }
            }
            """);

    private final double recoveryRate;
    private final double recoveryDelay;
    private final Map<TerrainType, double[]> typeMultipliers;

    private ResourceParameters(double recoveryRate, double recoveryDelay, Map<TerrainType, double[]> typeMultipliers) {
        if (!Double.isFinite(recoveryRate) || recoveryRate < 0 || recoveryRate > 1) {
            throw new IllegalArgumentException("recoveryRate must be in [0, 1], got " + recoveryRate);
        }
        if (!Double.isFinite(recoveryDelay) || recoveryDelay < 0) {
            throw new IllegalArgumentException("recoveryDelay must be non-negative, got " + recoveryDelay);
        }
        for (Map.Entry<TerrainType, double[]> entry : typeMultipliers.entrySet()) {
            for (ResourceType r : ResourceType.values()) {
                double m = entry.getValue()[r.ordinal()];
                if (!Double.isFinite(m) || m < 0) {
                    throw new IllegalArgumentException("typeMultipliers." + entry.getKey().key() + "." + r.key()
                            + " must be non-negative, got " + m);
                }
            }
        }
        this.recoveryRate = recoveryRate;
        this.recoveryDelay = recoveryDelay;
        this.typeMultipliers = typeMultipliers;
    }

    /**
     * @return the built-in defaults (the {@code normal} preset).
     */
    public static ResourceParameters defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Parses resource parameters, resolving an optional {@code preset}.
     *
     * @param options the configuration block.
     * @return the validated parameters.
     * @throws IllegalArgumentException if the preset is unknown or a value is invalid.
     */
    public static ResourceParameters fromConfig(Config options) {
        try {
            Config effective = options;
            if (options.hasPath("preset")) {
                String preset = options.getString("preset");
                String presetPath = "presets." + preset;
                if (!options.hasPath(presetPath)) {
                    throw new IllegalArgumentException("Unknown resource preset: " + preset);
                }
                effective = options.withoutPath("preset").withoutPath("presets")
                        .withFallback(options.getConfig(presetPath));
            }
            effective = effective.withFallback(DEFAULTS);

            Map<TerrainType, double[]> multipliers = new EnumMap<>(TerrainType.class);
            for (TerrainType terrain : TerrainType.values()) {
                double[] values = new double[ResourceType.values().length];
                for (ResourceType r : ResourceType.values()) {
                    values[r.ordinal()] = effective.getDouble("typeMultipliers." + terrain.key() + "." + r.key());
                }
                multipliers.put(terrain, values);
            }
            return new ResourceParameters(
                    effective.getDouble("recoveryRate"),
                    effective.getDouble("recoveryDelay"),
                    multipliers);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for resource parameters: " + e.getMessage(), e);
        }
    }

    public double getRecoveryRate() {
        return recoveryRate;
    }

    public double getRecoveryDelay() {
        return recoveryDelay;
    }

    /**
     * @param terrain  the terrain type.
     * @param resource the resource.
     * @return the recovery multiplier of this combination.
     */
    public double getTypeMultiplier(TerrainType terrain, ResourceType resource) {
        return typeMultipliers.get(terrain)[resource.ordinal()];
    }

    @Override
    public String toString() {
        return "ResourceParameters{recoveryRate=" + recoveryRate + ", recoveryDelay=" + recoveryDelay + "}";
    }
}
