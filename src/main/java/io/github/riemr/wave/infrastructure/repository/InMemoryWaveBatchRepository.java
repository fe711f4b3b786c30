package io.github.riemr.wave.infrastructure.repository;

import io.github.riemr.wave.application.repository.WaveBatchRepository;
import io.github.riemr.wave.domain.model.WaveBatch;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryWaveBatchRepository implements WaveBatchRepository {

    private final Map<String, WaveBatch> batches = new ConcurrentHashMap<>();

    @Override
    public Optional<WaveBatch> findById(String waveId) {
        return Optional.ofNullable(batches.get(waveId));
    }

    @Override
    public void save(WaveBatch batch) {
        batches.put(batch.getWaveId(), batch);
    }

    @Override
    public void delete(String waveId) {
        batches.remove(waveId);
    }

    @Override
    public List<String> listWaveIds() {
        return batches.keySet().stream().sorted().toList();
    }
}
