package io.github.eutro.exir.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that fires events of type {@code S}, which listeners can subscribe to.
 *
 * @param <S> The supertype of the events fired.
 */
public interface EventDispatcher<S> {
    /**
     * Subscribe a listener to an event type.
     * <p>
     * Listeners are keyed by the exact class: a listener for a superclass or subclass
     * of the fired event is not run.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);

    /**
     * Unsubscribe a listener previously passed to {@link #listen(Class, Consumer)}.
     *
     * @param eventClass The event class it was subscribed to.
     * @param listener   The listener.
     * @param <T>        The event type.
     * @return Whether the listener was subscribed.
     */
    <T extends S> boolean unlisten(Class<T> eventClass, @NotNull Consumer<T> listener);
}
