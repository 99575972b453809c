package io.stakemining.core.session;

/** Observer of committed session transitions. */
public interface SessionListener {
    default void onOpened(SessionOpened event) {}

    default void onFinished(SessionFinished event) {}
}
