package com.vision_assistant_service.safety;

@FunctionalInterface
public interface SafetyTransitionListener {

    /**
     * Called on the thread that caused the transition, after the monitor released its lock.
     */
    void onTransition(SafetyTransition transition);
}
