package io.github.riemr.wave.application.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ScorePoint {
    private long timeMillis;
    private long iteration;
    private long hardScore;
    private long softScore;
    private double objective;
}
