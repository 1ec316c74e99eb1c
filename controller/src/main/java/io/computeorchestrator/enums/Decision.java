package io.computeorchestrator.enums;

/**
 * Placement decision result.
 *
 * Merge precedence: NO > YES
 */
public enum Decision {
    YES, NO;

    public Decision merge(Decision other) {
        if (this == NO || other == NO) return NO;
        return YES;
    }
}
