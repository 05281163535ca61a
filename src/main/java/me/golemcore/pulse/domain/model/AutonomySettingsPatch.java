package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial update of {@link AutonomySettings}; {@code null} fields are left
 * unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutonomySettingsPatch {

    private String globalLevel;
    private Map<String, String> categoryLevels;
    private Integer dailyActionLimit;
    private Boolean notifyOnAction;
    private List<String> notifyChannels;
    private String timezone;
}
