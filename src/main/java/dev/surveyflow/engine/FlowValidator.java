package dev.surveyflow.engine;

import dev.surveyflow.model.BranchingRule;
import dev.surveyflow.model.FlowSettings;
import dev.surveyflow.model.NextStep;
import dev.surveyflow.model.Question;
import dev.surveyflow.model.QuestionOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a survey's flow graph before it may go live.
 * All checks are pure functions of the snapshot they are given.
 */
public final class FlowValidator {

    private static final Logger log = LoggerFactory.getLogger(FlowValidator.class);

    private FlowValidator() {}

    /**
     * Look for a loop among explicit jumps (question defaults and option next steps).
     * Sequential fallback is not an edge. Runs an iterative depth-first search that
     * visits each question and each jump once.
     */
    public static CycleDetectionResult detectCycle(FlowGraph graph, FlowSettings settings) {
        Map<Integer, Question> byId = graph.questionsById();
        Set<Integer> finished = new HashSet<>();
        Set<Integer> onStack = new HashSet<>();
        List<Integer> path = new ArrayList<>();
        Deque<Iterator<Integer>> pending = new ArrayDeque<>();

        for (Question root : graph.questions()) {
            if (finished.contains(root.id())) {
                continue;
            }
            push(root, path, onStack, pending);

            while (!pending.isEmpty()) {
                Iterator<Integer> targets = pending.peek();
                if (!targets.hasNext()) {
                    int done = path.remove(path.size() - 1);
                    onStack.remove(done);
                    finished.add(done);
                    pending.pop();
                    continue;
                }

                int next = targets.next();
                if (onStack.contains(next)) {
                    List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    String message = formatCycle(cycle, byId, settings);
                    log.warn("Survey {}: {}", graph.surveyId(), message);
                    return new CycleDetectionResult(true, cycle, message);
                }
                if (finished.contains(next)) {
                    continue;
                }
                Question target = byId.get(next);
                if (target == null) {
                    // dangling jumps are reported by validate()
                    log.debug("Question {} jumps to unknown question {}", path.get(path.size() - 1), next);
                    continue;
                }
                push(target, path, onStack, pending);
            }
        }

        log.debug("No cycle in survey {}", graph.surveyId());
        return CycleDetectionResult.none();
    }

    public static CycleDetectionResult detectCycle(FlowGraph graph) {
        return detectCycle(graph, FlowSettings.defaults());
    }

    /**
     * Find the questions from which some chain of explicit jumps reaches the end of the survey.
     * Works backwards from every question that ends the survey directly. Option steps
     * count only where the resolver follows them (single choice and rating questions).
     *
     * @return anchor question ids in order index order
     */
    public static Set<Integer> findEndpoints(FlowGraph graph) {
        Map<Integer, List<Integer>> incoming = new HashMap<>();
        Deque<Integer> frontier = new ArrayDeque<>();
        Set<Integer> anchors = new HashSet<>();

        for (Question question : graph.questions()) {
            for (int target : FlowGraph.routingTargets(question)) {
                incoming.computeIfAbsent(target, k -> new ArrayList<>()).add(question.id());
            }
            if (FlowGraph.endsSurveyDirectly(question)) {
                anchors.add(question.id());
                frontier.add(question.id());
            }
        }

        while (!frontier.isEmpty()) {
            int reached = frontier.poll();
            for (int source : incoming.getOrDefault(reached, List.of())) {
                if (anchors.add(source)) {
                    frontier.add(source);
                }
            }
        }

        Set<Integer> ordered = new LinkedHashSet<>();
        for (Question question : graph.questions()) {
            if (anchors.contains(question.id())) {
                ordered.add(question.id());
            }
        }
        log.debug("Survey {} has {} endpoint(s): {}", graph.surveyId(), ordered.size(), ordered);
        return ordered;
    }

    /**
     * Run every activation check and collect all problems found.
     */
    public static ActivationReport validate(FlowGraph graph, FlowSettings settings) {
        var errors = new ArrayList<String>();

        if (graph.questions().isEmpty()) {
            errors.add("Survey %d has no questions".formatted(graph.surveyId()));
            return new ActivationReport(graph.surveyId(), false, List.of(), Set.of(), errors);
        }

        Map<Integer, Question> byId = graph.questionsById();

        // order index must be unique
        Map<Integer, List<Integer>> byOrder = graph.questions().stream()
            .collect(Collectors.groupingBy(Question::orderIndex,
                Collectors.mapping(Question::id, Collectors.toList())));
        byOrder.forEach((order, ids) -> {
            if (ids.size() > 1) {
                errors.add("Questions %s share order index %d".formatted(ids, order));
            }
        });

        // every jump must land on a question of this survey
        for (Question question : graph.questions()) {
            checkTarget(question.defaultNext(), "Question %d default next".formatted(question.id()), byId, errors);
            for (QuestionOption option : question.options()) {
                checkTarget(option.next(),
                    "Question %d option %d next".formatted(question.id(), option.id()), byId, errors);
            }
        }
        for (BranchingRule rule : graph.branchingRules()) {
            if (!byId.containsKey(rule.targetQuestionId())) {
                errors.add("Branching rule %d targets question %d which is not in survey %d"
                    .formatted(rule.id(), rule.targetQuestionId(), graph.surveyId()));
            }
            if (rule.condition().knownOperator().isEmpty()) {
                errors.add("Branching rule %d uses unknown operator '%s'"
                    .formatted(rule.id(), rule.condition().operator()));
            }
        }

        CycleDetectionResult cycle = detectCycle(graph, settings);
        if (cycle.hasCycle()) {
            errors.add(cycle.errorMessage());
        }

        Set<Integer> endpoints = findEndpoints(graph);
        if (endpoints.isEmpty()) {
            errors.add("Survey %d has no endpoint: no question leads to the end of the survey"
                .formatted(graph.surveyId()));
        }

        if (errors.isEmpty()) {
            log.info("Survey {} flow is valid: no cycles, {} endpoint(s)", graph.surveyId(), endpoints.size());
        } else {
            log.warn("Survey {} flow has {} problem(s)", graph.surveyId(), errors.size());
        }
        return new ActivationReport(graph.surveyId(), cycle.hasCycle(), cycle.cyclePath(), endpoints, errors);
    }

    private static void push(Question question, List<Integer> path, Set<Integer> onStack,
                             Deque<Iterator<Integer>> pending) {
        path.add(question.id());
        onStack.add(question.id());
        pending.push(FlowGraph.explicitTargets(question).iterator());
    }

    private static void checkTarget(NextStep step, String where, Map<Integer, Question> byId, List<String> errors) {
        if (step instanceof NextStep.GoToQuestion go && !byId.containsKey(go.questionId())) {
            errors.add("%s points to question %d which is not in this survey".formatted(where, go.questionId()));
        }
    }

    static String formatCycle(List<Integer> cycle, Map<Integer, Question> byId, FlowSettings settings) {
        String rendered = cycle.stream()
            .map(id -> {
                Question q = byId.get(id);
                return q == null
                    ? "Q%d (unknown)".formatted(id)
                    : "Q%d (%s)".formatted(id, truncate(q.text(), settings.questionLabelLength()));
            })
            .collect(Collectors.joining(" → "));
        return "Cycle detected in question flow: " + rendered;
    }

    static String truncate(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return "(empty)";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
