package com.seasonalesd.core.config;

import com.seasonalesd.core.model.DetectionProfile;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the detection profiles YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * profiles:
 *   - name: daily_clicks
 *     period: 7
 *     maxAnoms: 0.02
 *     direction: both
 *     onlyLast: 7
 *     expectedValues: true
 *     breakout:
 *       minSize: 7
 *       method: multi
 *       beta: 0.008
 * </pre>
 *
 * @since 1.0.0
 */
public class ProfilesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DetectionProfile> profiles = new ArrayList<>();

    /**
     * @return unmodifiable list of profiles
     */
    public List<DetectionProfile> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }

    /**
     * Set the profiles (used by SnakeYAML during deserialization).
     *
     * @param profiles the detection profiles
     */
    public void setProfiles(List<DetectionProfile> profiles) {
        this.profiles = profiles != null ? new ArrayList<>(profiles) : new ArrayList<>();
    }

    /**
     * Validate every profile and require unique names.
     *
     * @throws IllegalStateException if one or more profiles are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < profiles.size(); i++) {
            DetectionProfile profile = Objects.requireNonNull(profiles.get(i),
                    "Profile at index " + i + " is null");
            try {
                profile.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (profile.getName() != null && !names.add(profile.getName())) {
                errors.add("Duplicate profile name: '" + profile.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Profiles configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "ProfilesConfig{profiles=" + profiles + '}';
    }
}
