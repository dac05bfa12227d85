package com.weatherdecision.common.profile;

import com.weatherdecision.common.exception.ConfigurationException;
import com.weatherdecision.common.model.IndexId;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates a raw {@link UserProfile} and turns it into a {@link ResolvedProfile}.
 *
 * <p>Weight rule, per index: when the user supplied any weight of that index, the
 * unspecified ones count as 0; otherwise the catalog defaults apply. The resulting
 * weights are then normalized to sum to 1.
 *
 * <p>Every rejection raises {@link ConfigurationException} carrying the offending key.
 * Nothing is clamped or silently dropped.
 *
 * <p>Pure, stateless apart from the immutable defaults. No logging.
 */
public final class UserProfileResolver {

    private static final String KNOWN_WEIGHTS = Arrays.stream(ProfileMetric.values())
        .map(ProfileMetric::key).collect(Collectors.joining(", "));
    private static final String KNOWN_THRESHOLDS = Arrays.stream(ProfileThreshold.values())
        .map(ProfileThreshold::key).collect(Collectors.joining(", "));

    private final ProfileDefaults defaults;

    public UserProfileResolver(ProfileDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    /**
     * @param profile   raw preferences
     * @param requested indices the profile will be used for; empty means all of them
     */
    public ResolvedProfile resolve(UserProfile profile, Collection<IndexId> requested) {
        Objects.requireNonNull(profile, "profile");
        Set<IndexId> indices = requested == null || requested.isEmpty()
            ? EnumSet.allOf(IndexId.class)
            : EnumSet.copyOf(requested);

        Map<ProfileMetric, Double> supplied = suppliedWeights(profile.weights());
        Map<ProfileThreshold, Double> thresholds = resolveThresholds(profile.thresholds(), indices);

        Map<IndexId, Map<ProfileMetric, Double>> weights = new EnumMap<>(IndexId.class);
        for (IndexId index : indices) {
            List<ProfileMetric> metrics = ProfileMetric.forIndex(index);
            if (!metrics.isEmpty()) {
                weights.put(index, normalize(index, metrics, supplied));
            }
        }
        return new ResolvedProfile(profile.userId(), weights, thresholds);
    }

    /**
     * Key and range checks only, independent of any index selection. Required thresholds
     * and all-zero weights are checked later, by {@link #resolve}, for the indices requested.
     */
    public void validate(UserProfile profile) {
        Objects.requireNonNull(profile, "profile");
        suppliedWeights(profile.weights());
        resolveThresholds(profile.thresholds(), EnumSet.noneOf(IndexId.class));
    }

    // ── Weights ───────────────────────────────────────────────────────────────

    private static Map<ProfileMetric, Double> suppliedWeights(Map<String, Double> raw) {
        Map<ProfileMetric, Double> supplied = new EnumMap<>(ProfileMetric.class);
        raw.forEach((key, value) -> {
            ProfileMetric metric = ProfileMetric.fromKey(key).orElseThrow(() ->
                new ConfigurationException(key, "Unknown weight key; recognized: " + KNOWN_WEIGHTS));
            if (value == null || !Double.isFinite(value)) {
                throw new ConfigurationException(key, "Weight must be a finite number, got " + value);
            }
            if (value < 0.0) {
                throw new ConfigurationException(key, "Weight must not be negative, got " + value);
            }
            if (value > 1.0) {
                throw new ConfigurationException(key, "Weight must not exceed 1, got " + value);
            }
            supplied.put(metric, value);
        });
        return supplied;
    }

    private Map<ProfileMetric, Double> normalize(IndexId index, List<ProfileMetric> metrics,
                                                 Map<ProfileMetric, Double> supplied) {
        boolean userSupplied = metrics.stream().anyMatch(supplied::containsKey);
        Map<ProfileMetric, Double> raw = new EnumMap<>(ProfileMetric.class);
        double sum = 0.0;
        for (ProfileMetric metric : metrics) {
            double w = userSupplied
                ? supplied.getOrDefault(metric, 0.0)
                : defaults.weights().getOrDefault(metric, 0.0);
            raw.put(metric, w);
            sum += w;
        }
        if (sum <= 0.0) {
            throw new ConfigurationException(index.key(), "All weights are zero");
        }
        Map<ProfileMetric, Double> normalized = new EnumMap<>(ProfileMetric.class);
        for (Map.Entry<ProfileMetric, Double> e : raw.entrySet()) {
            normalized.put(e.getKey(), e.getValue() / sum);
        }
        return normalized;
    }

    // ── Thresholds ────────────────────────────────────────────────────────────

    private Map<ProfileThreshold, Double> resolveThresholds(Map<String, Double> raw, Set<IndexId> indices) {
        Map<ProfileThreshold, Double> resolved = new EnumMap<>(ProfileThreshold.class);
        resolved.putAll(defaults.thresholds());
        raw.forEach((key, value) -> {
            ProfileThreshold threshold = ProfileThreshold.fromKey(key).orElseThrow(() ->
                new ConfigurationException(key, "Unknown threshold key; recognized: " + KNOWN_THRESHOLDS));
            if (value == null || !Double.isFinite(value)) {
                throw new ConfigurationException(key, "Threshold must be a finite number, got " + value);
            }
            if (!threshold.inRange(value)) {
                throw new ConfigurationException(key, String.format(
                    "Threshold %s outside [%s, %s]", value, threshold.min(), threshold.max()));
            }
            resolved.put(threshold, value);
        });

        for (ProfileThreshold threshold : ProfileThreshold.values()) {
            if (threshold.isRequiredFor(indices) && !resolved.containsKey(threshold)) {
                throw new ConfigurationException(threshold.key(), "Required threshold missing");
            }
        }

        Double min = resolved.get(ProfileThreshold.COMFORT_TEMP_MIN);
        Double max = resolved.get(ProfileThreshold.COMFORT_TEMP_MAX);
        if (min != null && max != null && min > max) {
            throw new ConfigurationException(ProfileThreshold.COMFORT_TEMP_MAX.key(), String.format(
                "comfort.temp.max (%s) is below comfort.temp.min (%s)", max, min));
        }
        return resolved;
    }
}
