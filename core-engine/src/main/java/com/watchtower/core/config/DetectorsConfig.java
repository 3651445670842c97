package com.watchtower.core.config;

import com.watchtower.core.condition.InMemoryConditionGroupRepository;
import com.watchtower.core.model.DataConditionGroup;
import com.watchtower.core.model.Detector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the detectors YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * conditionGroups:
 *   - id: 1
 *     conditions:
 *       - id: 11
 *         type: gt
 *         comparison: 10
 *         result: warning
 * detectors:
 *   - id: 100
 *     name: queue_depth
 *     type: metric
 *     conditionGroupId: 1
 *     counterNames: [breaches]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the catalogue.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(DetectorsConfig.class);

    private List<DataConditionGroup> conditionGroups = new ArrayList<>();
    private List<Detector> detectors = new ArrayList<>();

    /**
     * @return unmodifiable list of condition groups
     */
    public List<DataConditionGroup> getConditionGroups() {
        return Collections.unmodifiableList(conditionGroups);
    }

    /**
     * Set the condition groups (used by SnakeYAML during deserialization).
     */
    public void setConditionGroups(List<DataConditionGroup> conditionGroups) {
        this.conditionGroups = conditionGroups != null ? new ArrayList<>(conditionGroups) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of detectors
     */
    public List<Detector> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Set the detectors (used by SnakeYAML during deserialization).
     */
    public void setDetectors(List<Detector> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    /**
     * Validate every group and detector, and check that ids are unique.
     *
     * <p>
     * Collects all errors and throws a single exception. A detector that
     * references an undefined condition group is accepted with a warning: it
     * evaluates as having no condition group.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        Set<Long> groupIds = new HashSet<>();
        for (int i = 0; i < conditionGroups.size(); i++) {
            DataConditionGroup group = conditionGroups.get(i);
            if (group == null) {
                errors.add("Condition group at index " + i + " is null");
                continue;
            }
            try {
                group.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (!groupIds.add(group.getId())) {
                errors.add("Duplicate condition group id: " + group.getId());
            }
        }

        Set<Long> detectorIds = new HashSet<>();
        for (int i = 0; i < detectors.size(); i++) {
            Detector detector = detectors.get(i);
            if (detector == null) {
                errors.add("Detector at index " + i + " is null");
                continue;
            }
            try {
                detector.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (!detectorIds.add(detector.getId())) {
                errors.add("Duplicate detector id: " + detector.getId());
            }
            Long groupId = detector.getConditionGroupId();
            if (groupId != null && !groupIds.contains(groupId)) {
                LOG.warn("Detector {} references undefined condition group {}", detector.getId(), groupId);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detectors configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Build a repository holding every configured condition group.
     */
    public InMemoryConditionGroupRepository toConditionGroupRepository() {
        InMemoryConditionGroupRepository repository = new InMemoryConditionGroupRepository();
        for (DataConditionGroup group : conditionGroups) {
            repository.saveGroup(group);
        }
        return repository;
    }

    @Override
    public String toString() {
        return "DetectorsConfig{conditionGroups=" + conditionGroups + ", detectors=" + detectors + '}';
    }
}
