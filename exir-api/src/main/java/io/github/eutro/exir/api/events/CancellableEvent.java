package io.github.eutro.exir.api.events;

/**
 * An event which a listener can cancel.
 * <p>
 * {@link EventSupplier#dispatch(Class, Object)} skips the remaining listeners of a cancelled
 * event, and the code firing it decides what cancellation means; a cancelled
 * {@link EmitTreeEvent}, for example, is not emitted to later listeners.
 */
public interface CancellableEvent {
    boolean isCancelled();

    /**
     * Cancel the event. Listeners after the current one will not see it.
     */
    void cancel();
}
