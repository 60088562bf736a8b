package dev.surveyflow.model;

/**
 * A survey header. While {@code active} the flow graph is frozen.
 */
public record Survey(int id, String title, boolean active) {

    public Survey withActive(boolean active) {
        return new Survey(id, title, active);
    }
}
