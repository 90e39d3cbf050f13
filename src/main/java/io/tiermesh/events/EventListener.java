package io.tiermesh.events;

@FunctionalInterface
public interface EventListener {
    void onEvent(CoreEvent event);
}
