package com.visitsense.loadgen.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.ConfigurationException;
import com.visitsense.loadgen.config.LoadGeneratorConfig;

/**
 * Construit la liste des cibles à partir de MULTI_TARGET_CONFIG.
 *
 * Format attendu :
 * <pre>
 * {"targets": [{"name": "EU", "url": "https://eu.example.com", "site_id": 1,
 *               "token_auth": "...", "weight": 70, "enabled": true}],
 *  "distribution_strategy": "weighted"}
 * </pre>
 * Sans configuration (ou si elle est illisible), une cible unique est dérivée de
 * MATOMO_URL / MATOMO_SITE_ID / MATOMO_TOKEN_AUTH.
 */
public final class TargetConfigParser {
    private static final Logger logger = LoggerFactory.getLogger(TargetConfigParser.class);

    public static final String DEFAULT_TARGET_NAME = "default";

    private TargetConfigParser() {
    }

    /**
     * Construit le routeur complet à partir de la configuration.
     */
    public static TargetRouter createRouter(LoadGeneratorConfig config) {
        String blob = config.getMultiTargetConfig();
        List<Target> targets = parseTargets(blob);
        if (targets == null) {
            targets = Collections.singletonList(defaultTarget(config));
        }
        return new TargetRouter(targets, parseStrategy(blob));
    }

    public static Target defaultTarget(LoadGeneratorConfig config) {
        return new Target(DEFAULT_TARGET_NAME, config.getMatomoUrl(), config.getSiteId(),
            config.getTokenAuth(), 1, true);
    }

    /**
     * @return les cibles déclarées, ou null si le blob est absent, vide ou mal formé
     */
    public static List<Target> parseTargets(String blob) {
        if (blob == null || blob.trim().isEmpty()) {
            return null;
        }
        try {
            JSONObject root = new JSONObject(blob);
            JSONArray array = root.optJSONArray("targets");
            if (array == null || array.length() == 0) {
                return null;
            }
            List<Target> targets = new ArrayList<>();
            for (int i = 0; i < array.length(); i++) {
                JSONObject t = array.getJSONObject(i);
                targets.add(new Target(
                    t.getString("name"),
                    t.getString("url"),
                    t.getInt("site_id"),
                    t.isNull("token_auth") ? null : t.optString("token_auth", null),
                    t.optInt("weight", 1),
                    t.optBoolean("enabled", true)
                ));
            }
            return targets;
        } catch (JSONException e) {
            logger.warn("Failed to parse MULTI_TARGET_CONFIG, using single target: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Stratégie déclarée dans le blob ; round-robin par défaut ou si le blob est illisible.
     */
    public static DistributionStrategy parseStrategy(String blob) {
        if (blob == null || blob.trim().isEmpty()) {
            return DistributionStrategy.ROUND_ROBIN;
        }
        try {
            JSONObject root = new JSONObject(blob);
            String label = root.optString("distribution_strategy", DistributionStrategy.ROUND_ROBIN.getLabel());
            return DistributionStrategy.fromLabel(label);
        } catch (JSONException e) {
            return DistributionStrategy.ROUND_ROBIN;
        } catch (ConfigurationException e) {
            logger.warn("{}; falling back to round-robin", e.getMessage());
            return DistributionStrategy.ROUND_ROBIN;
        }
    }
}
