package com.vmreconciler.core.engine;

/**
 * Asks the operator before an irreversible action.
 */
@FunctionalInterface
public interface Confirmer {

    boolean confirm(String question);
}
