package com.platform.driftengine.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.driftengine.domain.*;
import com.platform.driftengine.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Parses and validates drift monitor YAML.
 * <p>
 * Expected format:
 * <pre>
 * time_travel_days: 7
 * monitors:
 *   - name: status_drift
 *     type: distribution
 *     column: STATUS
 *     threshold: 0.1
 *     stattest: psi
 *   - type: schema
 *   - type: volume
 *     threshold: 0.2
 * </pre>
 * A config is accepted whole or not at all: any error means no {@link DriftConfig}.
 * Warnings never block.
 */
@Component
public class MonitorConfigParser {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfigParser.class);
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigValidation parse(String yaml) {
        return parse(yaml, ThresholdDefaults.STANDARD);
    }

    /**
     * @param defaults thresholds for monitors that declare none
     */
    public ConfigValidation parse(String yaml, ThresholdDefaults defaults) {
        List<ConfigIssue> errors = new ArrayList<>();
        List<ConfigIssue> warnings = new ArrayList<>();

        JsonNode root;
        try {
            root = yaml == null ? null : yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            errors.add(ConfigIssue.global("parse_error", "Invalid YAML: " + e.getOriginalMessage()));
            return new ConfigValidation(errors, warnings, 0, null);
        }

        if (root == null || !root.isObject()) {
            errors.add(ConfigIssue.global("structure_error", "YAML must be a mapping"));
            return new ConfigValidation(errors, warnings, 0, null);
        }

        int timeTravelDays = parseTimeTravelDays(root, errors);

        JsonNode monitorsNode = root.get("monitors");
        if (monitorsNode == null || monitorsNode.isNull()) {
            errors.add(ConfigIssue.global("missing_key", "Missing required 'monitors' key"));
            return new ConfigValidation(errors, warnings, 0, null);
        }
        if (!monitorsNode.isArray()) {
            errors.add(ConfigIssue.global("structure_error", "'monitors' must be a list"));
            return new ConfigValidation(errors, warnings, 0, null);
        }

        List<Draft> drafts = new ArrayList<>();
        Set<String> explicitNames = new HashSet<>();
        for (int i = 0; i < monitorsNode.size(); i++) {
            JsonNode node = monitorsNode.get(i);
            if (!node.isObject()) {
                errors.add(ConfigIssue.atMonitor(i, "invalid_monitor", "Monitor at index " + i + " must be a mapping"));
                continue;
            }
            Draft draft = parseMonitor(i, node, defaults, errors, warnings);
            if (draft.name != null && !explicitNames.add(draft.name)) {
                errors.add(ConfigIssue.atMonitor(i, "duplicate_name",
                        "Duplicate monitor name '" + draft.name + "' at index " + i));
            }
            drafts.add(draft);
        }
        int monitorCount = drafts.size();

        if (!errors.isEmpty()) {
            return new ConfigValidation(errors, warnings, monitorCount, null);
        }

        assignGeneratedNames(drafts, explicitNames);
        List<MonitorSpec> monitors = new ArrayList<>(drafts.size());
        for (Draft d : drafts) {
            monitors.add(new MonitorSpec(d.name, d.kind, d.column, d.threshold, d.statTest));
        }
        DriftConfig config = new DriftConfig(timeTravelDays, monitors);
        log.debug("Parsed drift config: {} monitors, time_travel_days={}, {} warnings",
                monitors.size(), timeTravelDays, warnings.size());
        return new ConfigValidation(errors, warnings, monitorCount, config);
    }

    /**
     * @throws ConfigException listing every error when the config is invalid
     */
    public DriftConfig parseOrThrow(String yaml) {
        ConfigValidation validation = parse(yaml);
        if (!validation.valid()) {
            throw new ConfigException(validation.errors());
        }
        return validation.config();
    }

    private int parseTimeTravelDays(JsonNode root, List<ConfigIssue> errors) {
        JsonNode node = root.get("time_travel_days");
        if (node == null || node.isNull()) {
            return DriftConfig.DEFAULT_TIME_TRAVEL_DAYS;
        }
        if (!node.isIntegralNumber() || node.asInt() < 1) {
            errors.add(ConfigIssue.global("invalid_time_travel",
                    "'time_travel_days' must be a positive integer, got '" + node.asText() + "'"));
            return DriftConfig.DEFAULT_TIME_TRAVEL_DAYS;
        }
        return node.asInt();
    }

    private Draft parseMonitor(int i, JsonNode node, ThresholdDefaults defaults,
                               List<ConfigIssue> errors, List<ConfigIssue> warnings) {
        Draft draft = new Draft(i);

        JsonNode type = node.get("type");
        if (type == null || type.isNull()) {
            errors.add(ConfigIssue.atMonitor(i, "missing_field", "Monitor at index " + i + " missing 'type' field"));
        } else {
            draft.kind = MonitorKind.fromConfigName(type.asText()).orElse(null);
            if (draft.kind == null) {
                errors.add(ConfigIssue.atMonitor(i, "invalid_type",
                        "Invalid drift type '" + type.asText() + "' at index " + i
                                + " (valid: schema, volume, distribution, dataset)"));
            }
        }

        JsonNode name = node.get("name");
        if (name == null || name.isNull() || name.asText().isBlank()) {
            warnings.add(ConfigIssue.atMonitor(i, "missing_name",
                    "Monitor at index " + i + " has no 'name' - using auto-generated name"));
        } else {
            draft.name = name.asText().trim();
        }

        JsonNode stattest = node.get("stattest");
        if (stattest != null && !stattest.isNull()) {
            draft.statTest = StatTest.fromConfigName(stattest.asText()).orElse(null);
            if (draft.statTest == null) {
                warnings.add(ConfigIssue.atMonitor(i, "unknown_stattest",
                        "Unknown statistical test '" + stattest.asText() + "' at index " + i + " - using default"));
            } else if (draft.kind != null && draft.kind != MonitorKind.DISTRIBUTION) {
                warnings.add(ConfigIssue.atMonitor(i, "ignored_stattest",
                        "'stattest' is only used by distribution monitors (index " + i + ")"));
                draft.statTest = null;
            }
        }

        JsonNode column = node.get("column");
        boolean hasColumn = column != null && !column.isNull() && !column.asText().isBlank();
        if (draft.kind == MonitorKind.DISTRIBUTION) {
            if (!hasColumn) {
                errors.add(ConfigIssue.atMonitor(i, "missing_column",
                        "Distribution monitor at index " + i + " requires 'column' field"));
            } else {
                draft.column = column.asText().trim();
            }
        } else if (hasColumn && draft.kind != null) {
            warnings.add(ConfigIssue.atMonitor(i, "ignored_column",
                    "'column' is only used by distribution monitors (index " + i + ")"));
        }

        JsonNode threshold = node.get("threshold");
        if (threshold == null || threshold.isNull()) {
            warnings.add(ConfigIssue.atMonitor(i, "missing_threshold",
                    "Monitor at index " + i + " has no threshold - using default"));
            draft.threshold = draft.kind == null ? 0.0 : defaults.thresholdFor(draft.kind, draft.statTest);
        } else if (!threshold.isNumber()) {
            errors.add(ConfigIssue.atMonitor(i, "invalid_threshold",
                    "Threshold at index " + i + " must be a number, got '" + threshold.asText() + "'"));
        } else if (threshold.asDouble() < 0) {
            errors.add(ConfigIssue.atMonitor(i, "invalid_threshold",
                    "Threshold at index " + i + " must be non-negative, got " + threshold.asDouble()));
        } else {
            draft.threshold = threshold.asDouble();
        }
        return draft;
    }

    /**
     * Unnamed monitors become {@code <kind>_monitor}, or {@code <kind>_monitor_<index>}
     * when that name is taken or shared with another unnamed monitor of the same kind.
     */
    private void assignGeneratedNames(List<Draft> drafts, Set<String> explicitNames) {
        Map<MonitorKind, Integer> unnamedPerKind = new EnumMap<>(MonitorKind.class);
        for (Draft d : drafts) {
            if (d.name == null) {
                unnamedPerKind.merge(d.kind, 1, Integer::sum);
            }
        }
        Set<String> taken = new HashSet<>(explicitNames);
        for (Draft d : drafts) {
            if (d.name != null) continue;
            String base = d.kind.configName() + "_monitor";
            String candidate = (unnamedPerKind.get(d.kind) > 1 || taken.contains(base))
                    ? base + "_" + d.index
                    : base;
            while (!taken.add(candidate)) {
                candidate = candidate + "_" + d.index;
            }
            d.name = candidate;
        }
    }

    private static final class Draft {
        final int index;
        String name;
        MonitorKind kind;
        String column;
        double threshold;
        StatTest statTest;

        Draft(int index) {
            this.index = index;
        }
    }
}
