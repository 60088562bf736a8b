package dev.surveyflow.engine;

import dev.surveyflow.model.FlowSettings;
import dev.surveyflow.store.InMemoryFlowStore;

/**
 * Wires the engine components over one store.
 */
public final class SurveyFlowEngine {

    private final FlowEditor editor;
    private final SurveyActivator activator;
    private final FlowResolver resolver;
    private final ResponseTracker tracker;

    public SurveyFlowEngine(InMemoryFlowStore store, FlowSettings settings) {
        this.editor = new FlowEditor(store, store, store, settings);
        this.activator = new SurveyActivator(store, store, store, settings);
        this.resolver = new FlowResolver(store, new BranchingRuleEvaluator(store));
        this.tracker = new ResponseTracker(store, resolver);
    }

    public FlowEditor editor() { return editor; }
    public SurveyActivator activator() { return activator; }
    public FlowResolver resolver() { return resolver; }
    public ResponseTracker tracker() { return tracker; }
}
