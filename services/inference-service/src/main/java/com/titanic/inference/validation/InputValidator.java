package com.titanic.inference.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.titanic.inference.common.RequestContextHolder;
import com.titanic.inference.features.Embarked;
import com.titanic.inference.features.PassengerFeatures;
import com.titanic.inference.features.Sex;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a raw JSON payload into {@link PassengerFeatures}. All field problems are
 * collected before failing so a client sees every error at once.
 */
@Component
public class InputValidator {
    private static final Logger log = LoggerFactory.getLogger(InputValidator.class);

    static final int MAX_STRING_LENGTH = 100;
    static final double MIN_AGE = 0;
    static final double MAX_AGE = 120;
    static final double MIN_FARE = 0;
    static final double MAX_FARE = 1000;
    static final int MAX_RELATIVES = 20;

    private static final double TYPICAL_MAX_AGE = 80;
    private static final double TYPICAL_MAX_FARE = 500;
    private static final int TYPICAL_MAX_SIBSP = 8;
    private static final int TYPICAL_MAX_PARCH = 9;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F]");
    private static final Pattern MARKUP_INJECTION = Pattern.compile(
        "(<script|<iframe|<object|<embed|javascript:|vbscript:|on\\w+\\s*=)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SQL_INJECTION = Pattern.compile(
        "(\\b(union|select|insert|update|delete|drop|create|alter|exec|execute)\\b|['\";]|--|\\*|/\\*|\\*/)",
        Pattern.CASE_INSENSITIVE
    );

    public PassengerFeatures validate(JsonNode payload) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (payload == null || !payload.isObject()) {
            addError(errors, "body", "request body must be a JSON object");
            throw new ValidationException(errors);
        }

        scanStrings("", payload, errors);

        Integer pclass = requiredInteger(payload, "pclass", errors);
        if (pclass != null && (pclass < 1 || pclass > 3)) {
            addError(errors, "pclass", "must be 1, 2 or 3");
        }

        Sex sex = null;
        String rawSex = requiredString(payload, "sex", errors);
        if (rawSex != null) {
            sex = Sex.from(rawSex);
            if (sex == null) {
                addError(errors, "sex", "must be 'male' or 'female'");
            }
        }

        Double age = requiredNumber(payload, "age", errors);
        if (age != null && (age < MIN_AGE || age > MAX_AGE)) {
            addError(errors, "age", "must be between 0 and 120");
        }

        Integer sibsp = requiredInteger(payload, "sibsp", errors);
        if (sibsp != null && (sibsp < 0 || sibsp > MAX_RELATIVES)) {
            addError(errors, "sibsp", "must be between 0 and " + MAX_RELATIVES);
        }

        Integer parch = requiredInteger(payload, "parch", errors);
        if (parch != null && (parch < 0 || parch > MAX_RELATIVES)) {
            addError(errors, "parch", "must be between 0 and " + MAX_RELATIVES);
        }

        Double fare = requiredNumber(payload, "fare", errors);
        if (fare != null && (fare < MIN_FARE || fare > MAX_FARE)) {
            addError(errors, "fare", "must be between 0 and 1000");
        }

        Embarked embarked = null;
        String rawEmbarked = requiredString(payload, "embarked", errors);
        if (rawEmbarked != null) {
            embarked = Embarked.from(rawEmbarked);
            if (embarked == null) {
                addError(errors, "embarked", "must be 'C', 'Q' or 'S'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        PassengerFeatures features = new PassengerFeatures(pclass, sex, age, sibsp, parch, fare, embarked);
        List<String> anomalies = detectAnomalies(features);
        if (!anomalies.isEmpty()) {
            log.warn("input anomalies request_id={} anomalies={}", RequestContextHolder.currentRequestId(), anomalies);
        }
        return features;
    }

    public List<String> detectAnomalies(PassengerFeatures features) {
        List<String> anomalies = new ArrayList<>();
        Double age = features.age();
        Double fare = features.fare();
        if (fare != null && fare == 0.0) {
            anomalies.add("zero_fare");
        }
        if (age != null && age > TYPICAL_MAX_AGE) {
            anomalies.add("age_above_typical");
        }
        if (fare != null && fare > TYPICAL_MAX_FARE) {
            anomalies.add("fare_above_typical");
        }
        if (features.sibsp() > TYPICAL_MAX_SIBSP) {
            anomalies.add("sibsp_above_typical");
        }
        if (features.parch() > TYPICAL_MAX_PARCH) {
            anomalies.add("parch_above_typical");
        }
        if (age != null && fare != null && age < 12 && fare > 100) {
            anomalies.add("child_high_fare");
        }
        if (features.familySize() > 10) {
            anomalies.add("large_family_size");
        }
        if (fare != null && features.pclass() == 1 && fare > 0 && fare < 20) {
            anomalies.add("first_class_low_fare");
        }
        if (fare != null && features.pclass() == 3 && fare > 100) {
            anomalies.add("third_class_high_fare");
        }
        return anomalies;
    }

    private void scanStrings(String path, JsonNode node, Map<String, List<String>> errors) {
        if (node.isTextual()) {
            checkString(path.isEmpty() ? "body" : path, node.asText(), errors);
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String childPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
                checkString(childPath, field.getKey(), errors);
                scanStrings(childPath, field.getValue(), errors);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                scanStrings(path + "[" + i + "]", node.get(i), errors);
            }
        }
    }

    private void checkString(String field, String raw, Map<String, List<String>> errors) {
        String value = Normalizer.normalize(raw, Normalizer.Form.NFKC);
        if (value.length() > MAX_STRING_LENGTH) {
            addError(errors, field, "must be at most " + MAX_STRING_LENGTH + " characters");
        }
        if (CONTROL_CHARS.matcher(value).find()) {
            addError(errors, field, "contains control characters");
        }
        if (MARKUP_INJECTION.matcher(value).find()) {
            addError(errors, field, "contains a script or markup injection pattern");
        }
        if (SQL_INJECTION.matcher(value).find()) {
            addError(errors, field, "contains a SQL injection pattern");
        }
    }

    private Integer requiredInteger(JsonNode payload, String field, Map<String, List<String>> errors) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            addError(errors, field, "is required");
            return null;
        }
        if (!node.isNumber()) {
            addError(errors, field, "must be an integer");
            return null;
        }
        double value = node.asDouble();
        if (!Double.isFinite(value) || value != Math.rint(value)
            || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            addError(errors, field, "must be an integer");
            return null;
        }
        return (int) value;
    }

    private Double requiredNumber(JsonNode payload, String field, Map<String, List<String>> errors) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            addError(errors, field, "is required");
            return null;
        }
        if (!node.isNumber() || !Double.isFinite(node.asDouble())) {
            addError(errors, field, "must be a number");
            return null;
        }
        return node.asDouble();
    }

    private String requiredString(JsonNode payload, String field, Map<String, List<String>> errors) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            addError(errors, field, "is required");
            return null;
        }
        return stringValue(node, field, errors);
    }

    private String stringValue(JsonNode node, String field, Map<String, List<String>> errors) {
        if (!node.isTextual()) {
            addError(errors, field, "must be a string");
            return null;
        }
        if (errors.containsKey(field)) {
            return null;
        }
        return Normalizer.normalize(node.asText(), Normalizer.Form.NFKC);
    }

    private static void addError(Map<String, List<String>> errors, String field, String message) {
        List<String> messages = errors.computeIfAbsent(field, k -> new ArrayList<>());
        if (!messages.contains(message)) {
            messages.add(message);
        }
    }
}
