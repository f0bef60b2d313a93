package org.colonysim.runtime.presence;

import org.colonysim.runtime.rules.ActivityState;

/**
 * Coarse activity class shown in the presence view.
 */
public enum Activity {
    IDLE,
    FORAGING;

    public static Activity of(ActivityState state) {
        return state instanceof ActivityState.Foraging ? FORAGING : IDLE;
    }
}
