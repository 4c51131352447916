package org.operaton.trainload.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.exception.StoredStateException;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.IntensityBand;
import org.operaton.trainload.model.ScalingProfile;
import org.operaton.trainload.model.StratumFactor;
import org.operaton.trainload.model.entity.ScalingProfileState;
import org.operaton.trainload.repository.ScalingProfileStateRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Holds the current scaling profile snapshot.
 *
 * Readers get an immutable snapshot and never see a half-written profile.
 * {@link #replace(ScalingProfile)} persists the next version and swaps it in; callers serialize writes.
 */
@Service
@Slf4j
public class ScalingProfileStore {

    private static final TypeReference<Map<String, StoredFactor>> FACTOR_MAP = new TypeReference<>() {
    };

    private final ScalingProfileStateRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final int minSamples;
    private final double minConfidence;
    private final double minFactor;
    private final double maxFactor;

    private final AtomicReference<ScalingProfile> snapshot = new AtomicReference<>();

    record StoredFactor(double factor, int sampleCount, double confidence) {
    }

    public ScalingProfileStore(ScalingProfileStateRepository repository,
                               ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${trainload.calibration.min-samples:3}") int minSamples,
                               @Value("${trainload.calibration.min-confidence:0.5}") double minConfidence,
                               @Value("${trainload.calibration.min-factor:0.8}") double minFactor,
                               @Value("${trainload.calibration.max-factor:1.5}") double maxFactor) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.minSamples = minSamples;
        this.minConfidence = minConfidence;
        this.minFactor = minFactor;
        this.maxFactor = maxFactor;
    }

    /**
     * Current snapshot, loaded from the database on first access.
     */
    public ScalingProfile current() {
        ScalingProfile profile = snapshot.get();
        if (profile == null) {
            ScalingProfile loaded = repository.findById(ScalingProfileState.SINGLETON_ID)
                    .map(this::fromState)
                    .orElseGet(this::neutral);
            snapshot.compareAndSet(null, loaded);
            profile = snapshot.get();
        }
        return profile;
    }

    /**
     * Profile with no learned factors and the configured gating thresholds.
     */
    public ScalingProfile neutral() {
        return ScalingProfile.builder()
                .minSamples(minSamples)
                .minConfidence(minConfidence)
                .minFactor(minFactor)
                .maxFactor(maxFactor)
                .build();
    }

    /**
     * Persist {@code next} as the following version and make it the current snapshot.
     *
     * @return the stored snapshot, with version and timestamp set
     */
    public ScalingProfile replace(ScalingProfile next) {
        long version = current().getVersion() + 1;
        ScalingProfile stored = next.toBuilder()
                .version(version)
                .minSamples(minSamples)
                .minConfidence(minConfidence)
                .minFactor(minFactor)
                .maxFactor(maxFactor)
                .updatedAt(LocalDateTime.now(clock))
                .build();

        ScalingProfileState state = repository.findById(ScalingProfileState.SINGLETON_ID)
                .orElseGet(ScalingProfileState::new);
        state.setId(ScalingProfileState.SINGLETON_ID);
        state.setVersion(version);
        state.setGlobalFactor(stored.getGlobalFactor());
        state.setGlobalConfidence(stored.getGlobalConfidence());
        state.setGlobalSampleCount(stored.getGlobalSampleCount());
        state.setSportFactorsJson(writeFactors(stored.getPerSport()));
        state.setBandFactorsJson(writeFactors(stored.getPerIntensityBand()));
        state.setLearningEnabled(stored.isLearningEnabled());
        repository.save(state);

        snapshot.set(stored);
        log.info("Scaling profile v{}: factor={}, confidence={}, samples={}, learningEnabled={}",
                version, stored.getGlobalFactor(), stored.getGlobalConfidence(),
                stored.getGlobalSampleCount(), stored.isLearningEnabled());
        return stored;
    }

    /**
     * Drop the cached snapshot so the next read goes to the database. Used after a rolled back write.
     */
    public void evict() {
        snapshot.set(null);
    }

    private ScalingProfile fromState(ScalingProfileState state) {
        ScalingProfile.ScalingProfileBuilder builder = neutral().toBuilder()
                .version(state.getVersion())
                .globalFactor(state.getGlobalFactor())
                .globalConfidence(state.getGlobalConfidence())
                .globalSampleCount(state.getGlobalSampleCount())
                .learningEnabled(state.isLearningEnabled())
                .updatedAt(state.getUpdatedAt());
        readFactors(state.getSportFactorsJson(), ActivityCategory.class, ActivityCategory::valueOf)
                .forEach(builder::sportFactor);
        readFactors(state.getBandFactorsJson(), IntensityBand.class, IntensityBand::valueOf)
                .forEach(builder::bandFactor);
        return builder.build();
    }

    private String writeFactors(Map<? extends Enum<?>, StratumFactor> factors) {
        Map<String, StoredFactor> stored = new LinkedHashMap<>();
        factors.forEach((key, value) ->
                stored.put(key.name(), new StoredFactor(value.getFactor(), value.getSampleCount(), value.getConfidence())));
        try {
            return objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new StoredStateException("Failed to serialize scaling factors to JSON", e);
        }
    }

    private <K extends Enum<K>> Map<K, StratumFactor> readFactors(String json, Class<K> type, Function<String, K> parse) {
        Map<K, StratumFactor> factors = new EnumMap<>(type);
        if (json == null || json.isBlank()) {
            return factors;
        }
        try {
            objectMapper.readValue(json, FACTOR_MAP).forEach((key, value) ->
                    factors.put(parse.apply(key), new StratumFactor(value.factor(), value.sampleCount(), value.confidence())));
        } catch (JsonProcessingException e) {
            throw new StoredStateException("Failed to read stored scaling factors", e);
        }
        return factors;
    }
}
