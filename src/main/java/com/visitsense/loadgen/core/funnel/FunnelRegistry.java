package com.visitsense.loadgen.core.funnel;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.visitsense.loadgen.config.ConfigurationException;

/**
 * Détient la liste active des funnels, chargée depuis un tableau JSON.
 *
 * Les entrées invalides sont ignorées avec un avertissement, les funnels désactivés
 * sont écartés et la liste est triée par priorité croissante (ordre du fichier à égalité).
 * Les lecteurs obtiennent toujours un instantané immuable ; {@link #reload()} le remplace.
 */
public class FunnelRegistry {
    private static final Logger logger = LoggerFactory.getLogger(FunnelRegistry.class);

    private static final Gson GSON = new GsonBuilder()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .create();

    private final Path source;
    private volatile List<Funnel> funnels;

    /**
     * Registre vide, sans fichier source.
     */
    public FunnelRegistry() {
        this.source = null;
        this.funnels = Collections.emptyList();
    }

    public FunnelRegistry(Path source) {
        this.source = source;
        this.funnels = Collections.emptyList();
        reload();
    }

    public FunnelRegistry(List<Funnel> funnels) {
        this.source = null;
        this.funnels = activeSorted(funnels);
    }

    /**
     * Relit le fichier source. Un fichier absent ou illisible donne une liste vide.
     * @return le nombre de funnels actifs après rechargement
     */
    public int reload() {
        if (source == null) {
            return funnels.size();
        }
        List<Funnel> loaded;
        try {
            loaded = loadFile(source);
        } catch (IOException e) {
            logger.warn("Unable to load funnels from {}: {}", source, e.getMessage());
            loaded = Collections.emptyList();
        }
        this.funnels = activeSorted(loaded);
        logger.info("Funnel registry loaded {} active funnel(s) from {}", funnels.size(), source);
        return funnels.size();
    }

    public static List<Funnel> loadFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Funnel file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static List<Funnel> parse(String json) throws IOException {
        return parse(new StringReader(json));
    }

    /**
     * Lit un tableau JSON de funnels ; chaque entrée est validée indépendamment.
     * Les funnels désactivés sont conservés ici (filtrés par le registre).
     */
    public static List<Funnel> parse(Reader reader) throws IOException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Funnel definitions are not valid JSON", e);
        }
        if (!root.isJsonArray()) {
            throw new IOException("Funnel definitions must be a JSON array");
        }

        JsonArray array = root.getAsJsonArray();
        List<Funnel> result = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            try {
                FunnelDefinition definition = GSON.fromJson(array.get(i), FunnelDefinition.class);
                if (definition == null) {
                    throw new ConfigurationException("null entry");
                }
                result.add(definition.toFunnel());
            } catch (JsonParseException | ConfigurationException | IllegalArgumentException e) {
                logger.warn("Skipping invalid funnel at index {}: {}", i, e.getMessage());
            }
        }
        return result;
    }

    private static List<Funnel> activeSorted(List<Funnel> all) {
        List<Funnel> active = new ArrayList<>();
        for (Funnel funnel : all) {
            if (funnel.isEnabled()) {
                active.add(funnel);
            }
        }
        // tri stable : l'ordre du fichier départage les priorités égales
        active.sort(Comparator.comparingInt(Funnel::getPriority));
        return Collections.unmodifiableList(active);
    }

    public List<Funnel> getFunnels() {
        return funnels;
    }

    public boolean isEmpty() {
        return funnels.isEmpty();
    }

    public Path getSource() {
        return source;
    }

    /**
     * Forme JSON d'un funnel (noms de champs en snake_case).
     */
    static final class FunnelDefinition {
        String name;
        String description;
        Double probability;
        Integer priority;
        Boolean enabled;
        Boolean exitAfterCompletion;
        List<StepDefinition> steps;

        Funnel toFunnel() {
            List<FunnelStep> built = new ArrayList<>();
            if (steps != null) {
                for (StepDefinition step : steps) {
                    if (step == null) {
                        throw new ConfigurationException("Funnel '" + name + "' contains a null step");
                    }
                    built.add(step.toStep());
                }
            }
            return new Funnel(
                name,
                description,
                probability != null ? probability : 0.0,
                priority != null ? priority : 0,
                enabled == null || enabled,
                exitAfterCompletion == null || exitAfterCompletion,
                built
            );
        }
    }

    static final class StepDefinition {
        String type;
        String url;
        String actionName;
        Double delaySecondsMin;
        Double delaySecondsMax;
        String eventCategory;
        String eventAction;
        String eventName;
        Double eventValue;
        String searchKeyword;
        String searchCategory;
        Integer searchResults;
        String targetUrl;
        Double ecommerceRevenue;
        Double ecommerceSubtotal;
        Double ecommerceTax;
        Double ecommerceShipping;
        String ecommerceCurrency;

        FunnelStep toStep() {
            double min = delaySecondsMin != null ? delaySecondsMin : 0.0;
            double max = delaySecondsMax != null ? delaySecondsMax : min;
            return FunnelStep.builder(StepType.fromLabel(type))
                .url(url)
                .actionName(actionName)
                .delay(min, max)
                .event(eventCategory, eventAction, eventName, eventValue)
                .search(searchKeyword, searchCategory, searchResults)
                .targetUrl(targetUrl)
                .ecommerce(ecommerceRevenue, ecommerceSubtotal, ecommerceTax, ecommerceShipping, ecommerceCurrency)
                .build();
        }
    }
}
