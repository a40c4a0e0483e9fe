package org.contagio.experiment.checkpoint;

import java.util.LinkedHashMap;
import java.util.Map;

import org.contagio.experiment.ExperimentRecord;
import org.contagio.runtime.TrialOutcome;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

/**
 * Converts experiment records to and from single-line JSON objects.
 * <p>
 * Parameter values are written as JSON numbers, strings or booleans and read back as
 * {@link Double}, {@link String} or {@link Boolean}, the same types a
 * {@link org.contagio.experiment.ParameterCombination} holds. A {@code NaN} adaptive fraction
 * is written as {@code null}.
 */
public final class ExperimentRecordCodec {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private ExperimentRecordCodec() {
    }

    /**
     * @param record the record.
     * @return one line of JSON, without a line terminator.
     */
    public static String encode(ExperimentRecord record) {
        JsonObject json = new JsonObject();
        json.addProperty("combinationIndex", record.combinationIndex());
        json.addProperty("combinationKey", record.combinationKey());
        JsonObject parameters = new JsonObject();
        for (Map.Entry<String, Object> entry : record.parameters().entrySet()) {
            parameters.add(entry.getKey(), toJson(entry.getValue()));
        }
        json.add("parameters", parameters);
        json.addProperty("replicate", record.replicate());
        json.addProperty("outcome", record.outcome().name());
        json.addProperty("terminalStep", record.terminalStep());
        if (Double.isNaN(record.finalAdaptiveFraction())) {
            json.add("finalAdaptiveFraction", JsonNull.INSTANCE);
        } else {
            json.addProperty("finalAdaptiveFraction", record.finalAdaptiveFraction());
        }
        if (record.failureMessage() != null) {
            json.addProperty("failureMessage", record.failureMessage());
        }
        return GSON.toJson(json);
    }

    /**
     * @param line one line of JSON.
     * @return the record.
     * @throws JsonParseException if the line is not a complete record.
     */
    public static ExperimentRecord decode(String line) {
        JsonObject json;
        try {
            json = GSON.fromJson(line, JsonObject.class);
        } catch (RuntimeException e) {
            throw new JsonParseException("Malformed record: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new JsonParseException("Empty record");
        }
        try {
            Map<String, Object> parameters = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : required(json, "parameters").getAsJsonObject().entrySet()) {
                parameters.put(entry.getKey(), fromJson(entry.getKey(), entry.getValue()));
            }
            JsonElement fraction = json.get("finalAdaptiveFraction");
            JsonElement failure = json.get("failureMessage");
            return new ExperimentRecord(
                    required(json, "combinationIndex").getAsInt(),
                    required(json, "combinationKey").getAsString(),
                    parameters,
                    required(json, "replicate").getAsInt(),
                    TrialOutcome.valueOf(required(json, "outcome").getAsString()),
                    required(json, "terminalStep").getAsLong(),
                    fraction == null || fraction.isJsonNull() ? Double.NaN : fraction.getAsDouble(),
                    failure == null || failure.isJsonNull() ? null : failure.getAsString());
        } catch (IllegalStateException | UnsupportedOperationException | IllegalArgumentException e) {
            throw new JsonParseException("Invalid record: " + e.getMessage(), e);
        }
    }

    private static JsonElement required(JsonObject json, String name) {
        JsonElement element = json.get(name);
        if (element == null || element.isJsonNull()) {
            throw new JsonParseException("Record is missing '" + name + "'");
        }
        return element;
    }

    private static JsonElement toJson(Object value) {
        if (value instanceof Number number) {
            return new JsonPrimitive(number.doubleValue());
        }
        if (value instanceof Boolean bool) {
            return new JsonPrimitive(bool);
        }
        return new JsonPrimitive(String.valueOf(value));
    }

    private static Object fromJson(String name, JsonElement element) {
        if (!element.isJsonPrimitive()) {
            throw new JsonParseException("Parameter '" + name + "' is not a scalar: " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsDouble();
        }
        return primitive.getAsString();
    }
}
