package org.smpels.mcs.diagnostics;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable rule switches, one per {@link DiagnosticCode}. Every rule is enabled unless switched off.
 */
public final class DiagnosticsConfig {

    /** The HOCON path holding one boolean per rule code. */
    public static final String PATH = "smpe.lint.diagnostics";

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsConfig.class);
    private static final DiagnosticsConfig DEFAULTS = new DiagnosticsConfig(EnumSet.noneOf(DiagnosticCode.class));

    private final Set<DiagnosticCode> disabled;

    private DiagnosticsConfig(Set<DiagnosticCode> disabled) {
        this.disabled = Collections.unmodifiableSet(EnumSet.copyOf(
                disabled.isEmpty() ? EnumSet.noneOf(DiagnosticCode.class) : disabled));
    }

    /**
     * @return A configuration with every rule enabled.
     */
    public static DiagnosticsConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the switches from a configuration tree. Missing keys keep their default, unknown keys are logged and ignored.
     * @param config The root configuration; the switches are read below {@link #PATH}.
     * @return The resulting switches.
     * @throws com.typesafe.config.ConfigException.WrongType if a switch is not a boolean.
     */
    public static DiagnosticsConfig fromConfig(Config config) {
        if (!config.hasPath(PATH)) {
            return DEFAULTS;
        }
        Config section = config.getConfig(PATH);
        EnumSet<DiagnosticCode> disabled = EnumSet.noneOf(DiagnosticCode.class);
        for (Map.Entry<String, ConfigValue> entry : section.root().entrySet()) {
            String key = entry.getKey();
            Optional<DiagnosticCode> code = DiagnosticCode.fromKey(key);
            if (code.isEmpty()) {
                log.warn("Ignoring unknown diagnostic switch '{}.{}'", PATH, key);
                continue;
            }
            if (!section.getBoolean(key)) {
                disabled.add(code.get());
            }
        }
        return new DiagnosticsConfig(disabled);
    }

    /**
     * @param code A rule category.
     * @return {@code true} if the rule runs.
     */
    public boolean isEnabled(DiagnosticCode code) {
        return !disabled.contains(code);
    }

    /**
     * @return The switched-off rules.
     */
    public Set<DiagnosticCode> disabledCodes() {
        return disabled;
    }

    /**
     * Returns a copy with additional rules switched off.
     * @param codes The rules to switch off.
     * @return The new configuration.
     */
    public DiagnosticsConfig withDisabled(Collection<DiagnosticCode> codes) {
        EnumSet<DiagnosticCode> merged = EnumSet.noneOf(DiagnosticCode.class);
        merged.addAll(disabled);
        merged.addAll(codes);
        return new DiagnosticsConfig(merged);
    }

    /**
     * Returns a copy with the given rules switched off.
     * @param codes The rules to switch off.
     * @return The new configuration.
     */
    public DiagnosticsConfig withDisabled(DiagnosticCode... codes) {
        return withDisabled(Arrays.asList(codes));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DiagnosticsConfig other && disabled.equals(other.disabled);
    }

    @Override
    public int hashCode() {
        return disabled.hashCode();
    }

    @Override
    public String toString() {
        return "DiagnosticsConfig{disabled=" + disabled + "}";
    }
}
