package dev.surveyflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.surveyflow.model.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads survey flow definitions from JSON files.
 */
public final class SurveyLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SurveyLoader() {}

    /**
     * Load a single survey from a JSON file.
     */
    public static SurveyDefinition loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseSurvey(root);
    }

    /**
     * Load a single survey from a JSON string.
     */
    public static SurveyDefinition loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseSurvey(root);
    }

    private static SurveyDefinition parseSurvey(JsonNode root) {
        int surveyId = required(root, "id").asInt();
        String title = root.path("title").asText("");
        boolean active = root.path("active").asBoolean(false);

        FlowSettings settings = parseSettings(root.get("settings"));

        List<Question> questions = new ArrayList<>();
        JsonNode questionsNode = root.get("questions");
        if (questionsNode != null) {
            questionsNode.forEach(q -> questions.add(parseQuestion(q, surveyId)));
        }

        List<BranchingRule> rules = new ArrayList<>();
        JsonNode rulesNode = root.get("branchingRules");
        if (rulesNode != null) {
            rulesNode.forEach(r -> rules.add(parseRule(r)));
        }

        return new SurveyDefinition(new Survey(surveyId, title, active), questions, rules, settings);
    }

    private static FlowSettings parseSettings(JsonNode node) {
        if (node == null) {
            return FlowSettings.defaults();
        }
        int labelLength = node.has("questionLabelLength")
            ? node.get("questionLabelLength").asInt() : FlowSettings.DEFAULT_QUESTION_LABEL_LENGTH;
        boolean lock = node.has("lockActiveSurveys")
            ? node.get("lockActiveSurveys").asBoolean() : FlowSettings.DEFAULT_LOCK_ACTIVE_SURVEYS;
        return new FlowSettings(labelLength, lock);
    }

    private static Question parseQuestion(JsonNode node, int surveyId) {
        int id = required(node, "id").asInt();
        int order = required(node, "order").asInt();
        String text = node.path("text").asText("");
        QuestionType type = node.has("type") ? QuestionType.parse(node.get("type").asText()) : QuestionType.TEXT;
        boolean required = node.path("required").asBoolean(true);

        List<QuestionOption> options = new ArrayList<>();
        JsonNode optionsNode = node.get("options");
        if (optionsNode != null) {
            int position = 0;
            for (JsonNode o : optionsNode) {
                options.add(new QuestionOption(
                    required(o, "id").asInt(),
                    id,
                    o.has("order") ? o.get("order").asInt() : position,
                    o.path("text").asText(""),
                    parseNextStep(o.get("next"))));
                position++;
            }
        }

        return new Question(id, surveyId, order, text, type, required, parseNextStep(node.get("next")), options);
    }

    private static NextStep parseNextStep(JsonNode node) {
        if (node == null || node.isNull()) {
            return NextStep.unset();
        } else if (node.has("goTo")) {
            return NextStep.toQuestion(node.get("goTo").asInt());
        } else if (node.has("action")) {
            String action = node.get("action").asText();
            if ("end".equals(action)) {
                return NextStep.end();
            } else if ("unset".equals(action)) {
                return NextStep.unset();
            }
        }
        throw new IllegalArgumentException("Unknown next step format: " + node);
    }

    private static BranchingRule parseRule(JsonNode node) {
        JsonNode conditionNode = required(node, "condition");
        List<String> values = new ArrayList<>();
        JsonNode valuesNode = conditionNode.get("values");
        if (valuesNode != null) {
            valuesNode.forEach(v -> values.add(v.asText()));
        }
        Condition condition = new Condition(required(conditionNode, "operator").asText(), values);
        return new BranchingRule(
            required(node, "id").asInt(),
            required(node, "source").asInt(),
            required(node, "target").asInt(),
            condition);
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '%s' in %s".formatted(field, node));
        }
        return value;
    }
}
