package io.github.eutro.exir.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * An {@link EventDispatcher} which fires its events itself, through {@link #dispatch(Class, Object)}.
 * <p>
 * Listeners run in subscription order. A listener may subscribe further listeners while an
 * event is being dispatched; they see the next event, not the current one.
 *
 * @param <S> The supertype of the events fired.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>()).add(listener);
    }

    @Override
    public <T extends S> boolean unlisten(Class<T> eventClass, @NotNull Consumer<T> listener) {
        List<Consumer<?>> forClass = listeners.get(eventClass);
        return forClass != null && forClass.remove(listener);
    }

    /**
     * Fire an event, running every listener of its class until one cancels it.
     *
     * @param eventClass The exact class to fire the event as.
     * @param event      The event.
     * @param <T>        The event type.
     * @return The event, as the listeners left it.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        @SuppressWarnings("unchecked")
        List<Consumer<T>> forClass = (List<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptyList());
        for (Consumer<T> listener : forClass) {
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) break;
            listener.accept(event);
        }
        return event;
    }
}
