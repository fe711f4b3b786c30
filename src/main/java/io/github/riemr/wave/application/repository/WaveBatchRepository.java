package io.github.riemr.wave.application.repository;

import io.github.riemr.wave.domain.model.WaveBatch;

import java.util.List;
import java.util.Optional;

public interface WaveBatchRepository {
    Optional<WaveBatch> findById(String waveId);

    void save(WaveBatch batch);

    void delete(String waveId);

    List<String> listWaveIds();
}
