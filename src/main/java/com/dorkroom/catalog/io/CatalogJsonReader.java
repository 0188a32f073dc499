package com.dorkroom.catalog.io;

import com.dorkroom.catalog.core.exception.CatalogParseException;
import com.dorkroom.catalog.core.model.ColorType;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Dilution;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.FilmOrPaper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the catalog's three JSON array documents into records.
 *
 * <p>Field names are camelCase as published ({@code isoSpeed}, {@code filmStockId}, ...).
 * Unknown properties are ignored. {@code discontinued} may be a boolean or 0/1.
 * Any structural problem, including a missing required field, is reported as a
 * {@link CatalogParseException} naming the document and the record index.</p>
 *
 * <p>Reading never touches the network or writes anything.</p>
 */
public class CatalogJsonReader {
    private static final Logger log = LoggerFactory.getLogger(CatalogJsonReader.class);

    public static final String FILMS_DOCUMENT = "film_stocks.json";
    public static final String DEVELOPERS_DOCUMENT = "developers.json";
    public static final String COMBINATIONS_DOCUMENT = "development_combinations.json";

    private final ObjectMapper objectMapper;

    public CatalogJsonReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public CatalogJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads all three documents.
     */
    public CatalogData read(InputStream films, InputStream developers, InputStream combinations) {
        return new CatalogData(
                readFilms(films, FILMS_DOCUMENT),
                readDevelopers(developers, DEVELOPERS_DOCUMENT),
                readCombinations(combinations, COMBINATIONS_DOCUMENT));
    }

    public List<Film> readFilms(InputStream input, String source) {
        return readFilms(utf8(input), source);
    }

    public List<Film> readFilms(Reader reader, String source) {
        return readArray(reader, source, this::toFilm);
    }

    public List<Developer> readDevelopers(InputStream input, String source) {
        return readDevelopers(utf8(input), source);
    }

    public List<Developer> readDevelopers(Reader reader, String source) {
        return readArray(reader, source, this::toDeveloper);
    }

    public List<Combination> readCombinations(InputStream input, String source) {
        return readCombinations(utf8(input), source);
    }

    public List<Combination> readCombinations(Reader reader, String source) {
        return readArray(reader, source, this::toCombination);
    }

    private <T> List<T> readArray(Reader reader, String source, Function<JsonNode, T> mapper) {
        JsonNode root;
        try (Reader r = reader) {
            root = objectMapper.readTree(r);
        } catch (JsonProcessingException e) {
            throw new CatalogParseException(source + ": malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogParseException(source + ": could not be read", e);
        }
        if (root == null || !root.isArray()) {
            throw new CatalogParseException(source + ": expected a JSON array of records");
        }

        List<T> records = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode node = root.get(i);
            if (!node.isObject()) {
                throw new CatalogParseException(source + "[" + i + "]: expected a JSON object");
            }
            try {
                records.add(mapper.apply(node));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new CatalogParseException(source + "[" + i + "]: " + e.getMessage(), e);
            }
        }
        log.debug("catalog.read source={} records={}", source, records.size());
        return records;
    }

    private Film toFilm(JsonNode node) {
        String staticImage = text(node, "staticImageURL");
        return Film.builder()
                .id(requiredText(node, "id"))
                .brand(requiredText(node, "brand"))
                .name(requiredText(node, "name"))
                .isoSpeed(requiredNumber(node, "isoSpeed"))
                .colorType(ColorType.fromValue(requiredText(node, "colorType")))
                .description(text(node, "description"))
                .discontinued(flag(node, "discontinued"))
                .manufacturerNotes(textList(node, "manufacturerNotes"))
                .grainStructure(text(node, "grainStructure"))
                .reciprocityFailure(text(node, "reciprocityFailure"))
                .staticImageUrl(staticImage != null ? staticImage : text(node, "staticImageUrl"))
                .dateAdded(text(node, "dateAdded"))
                .build();
    }

    private Developer toDeveloper(JsonNode node) {
        List<Dilution> dilutions = new ArrayList<>();
        JsonNode dilutionNodes = node.get("dilutions");
        if (dilutionNodes != null && dilutionNodes.isArray()) {
            for (JsonNode d : dilutionNodes) {
                dilutions.add(new Dilution(
                        (int) requiredNumber(d, "id"),
                        requiredText(d, "name"),
                        requiredText(d, "dilution")));
            }
        }
        return Developer.builder()
                .id(requiredText(node, "id"))
                .name(requiredText(node, "name"))
                .manufacturer(requiredText(node, "manufacturer"))
                .type(requiredText(node, "type"))
                .filmOrPaper(FilmOrPaper.fromValue(requiredText(node, "filmOrPaper")))
                .dilutions(dilutions)
                .workingLifeHours(integer(node, "workingLifeHours"))
                .stockLifeMonths(integer(node, "stockLifeMonths"))
                .notes(text(node, "notes"))
                .mixingInstructions(text(node, "mixingInstructions"))
                .safetyNotes(text(node, "safetyNotes"))
                .datasheetUrls(textList(node, "datasheetUrl"))
                .discontinued(flag(node, "discontinued"))
                .build();
    }

    private Combination toCombination(JsonNode node) {
        return Combination.builder()
                .id(requiredText(node, "id"))
                .name(requiredText(node, "name"))
                .filmStockId(requiredText(node, "filmStockId"))
                .developerId(requiredText(node, "developerId"))
                .dilutionId(integer(node, "dilutionId"))
                .customDilution(text(node, "customDilution"))
                .temperatureF(requiredNumber(node, "temperatureF"))
                .timeMinutes(requiredNumber(node, "timeMinutes"))
                .shootingIso(requiredNumber(node, "shootingIso"))
                .pushPull(node.path("pushPull").isNumber() ? node.get("pushPull").asInt() : 0)
                .agitationSchedule(text(node, "agitationSchedule"))
                .notes(text(node, "notes"))
                .build();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing required field '" + field + "'");
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException("field '" + field + "' must be a scalar");
        }
        return value.asText();
    }

    private static double requiredNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing required field '" + field + "'");
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException("field '" + field + "' must be a number");
        }
        return value.asDouble();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException("field '" + field + "' must be a number");
        }
        return value.asInt();
    }

    private static boolean flag(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.asInt() != 0;
        }
        throw new IllegalArgumentException("field '" + field + "' must be a boolean or 0/1");
    }

    private static List<String> textList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            return values;
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException("field '" + field + "' must be an array");
        }
        for (JsonNode item : array) {
            values.add(item.asText());
        }
        return values;
    }

    private static Reader utf8(InputStream input) {
        return new InputStreamReader(input, StandardCharsets.UTF_8);
    }
}
