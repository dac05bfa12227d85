package com.weatherdecision.common.catalog;

import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ProfileThreshold;
import com.weatherdecision.common.profile.ResolvedProfile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Post-swim cold-shock risk.
 *
 * <pre>
 *   risk    = sensitivity × [tempCoeff × max(0, neutral − T) + windCoeff × wind × (1 + humidityCoeff × (1 − RH/100))]
 *   minutes = maxMinutes × exp(−risk / decayScale)
 * </pre>
 * T is the water temperature, or the air temperature as a proxy (confidence scaled by
 * {@code airProxyConfidence}). A missing humidity falls back to {@code referenceHumidity}
 * (confidence scaled by {@code missingHumidityConfidence}). Wind is mandatory.
 */
public final class ColdShockFormula implements IndexFormula {

    private final CatalogParameters.ColdShock params;

    public ColdShockFormula(CatalogParameters.ColdShock params) {
        this.params = params;
    }

    @Override
    public IndexOutput apply(WeatherSample sample, ResolvedProfile profile) {
        Double wind = sample.windSpeed();
        Double temperature = sample.waterTemperature();
        boolean proxy = false;
        if (temperature == null) {
            temperature = sample.temperature();
            proxy = true;
        }
        if (wind == null || temperature == null) {
            return null;
        }
        boolean humidityMissing = sample.relativeHumidity() == null;
        double humidity = humidityMissing ? params.referenceHumidity() : sample.relativeHumidity();

        double sensitivity = profile.threshold(ProfileThreshold.COLD_SHOCK_SENSITIVITY);
        double thermal = params.temperatureCoefficient() * Math.max(0.0, params.neutralTemperature() - temperature);
        double evaporative = params.windCoefficient() * wind * (1.0 + params.humidityCoefficient() * (1.0 - humidity / 100.0));
        double risk = IndexOutput.clampScore(sensitivity * (thermal + evaporative));
        double minutes = params.maxMinutes() * Math.exp(-risk / params.decayScale());

        double confidence = (proxy ? params.airProxyConfidence() : 1.0)
            * (humidityMissing ? params.missingHumidityConfidence() : 1.0);

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("minutesToDiscomfort", minutes);
        details.put("effectiveWaterTemperature", temperature);
        details.put("airTemperatureProxy", proxy ? 1.0 : 0.0);
        return new IndexOutput(risk, confidence, params.bands().bandFor(risk).label(), details);
    }
}
