package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Advisor output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Advice {

    private String content;
    private String model;
}
